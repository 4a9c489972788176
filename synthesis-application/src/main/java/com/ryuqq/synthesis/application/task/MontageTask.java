package com.ryuqq.synthesis.application.task;

import com.ryuqq.synthesis.core.model.MediaBlob;

import java.util.List;

/**
 * 여러 클립의 하이라이트 몽타주.
 *
 * @param clips 입력 영상 클립 (1개 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MontageTask(List<MediaBlob> clips) implements SynthesisTask {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException clips가 null이거나 비어 있는 경우
     */
    public MontageTask {
        if (clips == null || clips.isEmpty()) {
            throw new IllegalArgumentException("clips cannot be null or empty");
        }
        clips = List.copyOf(clips);
    }

    @Override
    public Feature feature() {
        return Feature.MONTAGE;
    }
}
