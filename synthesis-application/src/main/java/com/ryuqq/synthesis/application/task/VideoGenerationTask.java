package com.ryuqq.synthesis.application.task;

import com.ryuqq.synthesis.core.model.AspectRatio;
import com.ryuqq.synthesis.core.model.Resolution;

/**
 * 텍스트 프롬프트 영상 생성.
 *
 * @param prompt 사용자 프롬프트
 * @param style 스타일
 * @param aspectRatio 화면 비율
 * @param resolution 해상도 (모델 선택 기준)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record VideoGenerationTask(
    String prompt,
    VideoStyle style,
    AspectRatio aspectRatio,
    Resolution resolution
) implements SynthesisTask {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 prompt가 빈 문자열인 경우
     */
    public VideoGenerationTask {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        if (style == null || aspectRatio == null || resolution == null) {
            throw new IllegalArgumentException("style, aspectRatio and resolution cannot be null");
        }
    }

    @Override
    public Feature feature() {
        return Feature.VIDEO_GENERATION;
    }
}
