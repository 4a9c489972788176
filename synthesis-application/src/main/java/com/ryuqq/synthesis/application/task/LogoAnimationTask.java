package com.ryuqq.synthesis.application.task;

import com.ryuqq.synthesis.core.model.AspectRatio;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.Resolution;

/**
 * 로고 이미지 애니메이션.
 *
 * @param logo 로고 이미지
 * @param niche 업종/분야 (예: Fitness)
 * @param aspectRatio 화면 비율
 * @param resolution 해상도
 * @param customDirection 추가 연출 지시 (빈 문자열 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LogoAnimationTask(
    MediaBlob logo,
    String niche,
    AspectRatio aspectRatio,
    Resolution resolution,
    String customDirection
) implements SynthesisTask {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 로고가 이미지가 아닌 경우
     */
    public LogoAnimationTask {
        if (logo == null) {
            throw new IllegalArgumentException("logo cannot be null");
        }
        if (!logo.mimeType().startsWith("image/")) {
            throw new IllegalArgumentException("logo must be an image (current: " + logo.mimeType() + ")");
        }
        if (niche == null || niche.isBlank()) {
            throw new IllegalArgumentException("niche cannot be null or blank");
        }
        if (aspectRatio == null || resolution == null) {
            throw new IllegalArgumentException("aspectRatio and resolution cannot be null");
        }
        customDirection = customDirection == null ? "" : customDirection;
    }

    /**
     * 기본 설정(16:9, 720p, 추가 지시 없음)으로 생성.
     *
     * @param logo 로고 이미지
     * @param niche 업종/분야
     * @return LogoAnimationTask 인스턴스
     */
    public static LogoAnimationTask of(MediaBlob logo, String niche) {
        return new LogoAnimationTask(logo, niche, AspectRatio.LANDSCAPE, Resolution.HD, "");
    }

    @Override
    public Feature feature() {
        return Feature.LOGO_ANIMATION;
    }
}
