package com.ryuqq.synthesis.core.outcome;

import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;

import java.util.List;

/**
 * 성공 결과.
 *
 * @param artifact 결과물 바이트
 * @param source 결과물을 내려받은 위치 (동기 이미지 편집처럼 다운로드가 없었던 경우 null)
 * @param segments 몽타주 분석 구간 (몽타주가 아니면 빈 리스트)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Succeeded(
    MediaBlob artifact,
    ArtifactRef source,
    List<MontageSegment> segments
) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException artifact가 null인 경우
     */
    public Succeeded {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    /**
     * 다운로드 결과물로 성공 생성.
     *
     * @param artifact 결과물 바이트
     * @param source 결과물 위치
     * @return Succeeded 인스턴스
     */
    public static Succeeded of(MediaBlob artifact, ArtifactRef source) {
        return new Succeeded(artifact, source, List.of());
    }

    @Override
    public String statusMessage() {
        return "Completed.";
    }
}
