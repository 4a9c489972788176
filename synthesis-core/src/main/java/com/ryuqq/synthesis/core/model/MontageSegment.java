package com.ryuqq.synthesis.core.model;

/**
 * 몽타주 분석이 찾아낸 하이라이트 구간.
 *
 * @param startTimestamp 시작 시각 (예: 00:03)
 * @param endTimestamp 종료 시각 (예: 00:07)
 * @param visualDescription 구간 장면 설명
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MontageSegment(
    String startTimestamp,
    String endTimestamp,
    String visualDescription
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null인 경우
     */
    public MontageSegment {
        if (startTimestamp == null || endTimestamp == null || visualDescription == null) {
            throw new IllegalArgumentException("segment fields cannot be null");
        }
    }
}
