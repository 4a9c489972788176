package com.ryuqq.synthesis.application.task;

import com.ryuqq.synthesis.core.model.MediaBlob;

/**
 * 이미지/영상 보정.
 *
 * <p>정지 이미지는 동기 편집 호출로, 영상은 Long-running Operation으로 처리됩니다.</p>
 *
 * @param media 보정할 미디어
 * @param mode 보정 모드
 * @param prompt 추가 지시 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ImageRemedyTask(
    MediaBlob media,
    RemedyMode mode,
    String prompt
) implements SynthesisTask {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException media 또는 mode가 null인 경우
     */
    public ImageRemedyTask {
        if (media == null) {
            throw new IllegalArgumentException("media cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        // prompt는 null 허용
    }

    /**
     * 영상 보정 여부.
     *
     * @return 미디어가 영상이면 true
     */
    public boolean isVideo() {
        return media.isVideo();
    }

    @Override
    public Feature feature() {
        return Feature.IMAGE_REMEDY;
    }
}
