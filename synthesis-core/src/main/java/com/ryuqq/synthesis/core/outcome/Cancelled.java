package com.ryuqq.synthesis.core.outcome;

/**
 * 취소 결과.
 *
 * @param status 중립적인 취소 상태 문구
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Cancelled(String status) implements TaskOutcome {

    private static final String DEFAULT_STATUS = "Operation cancelled.";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 null이거나 빈 문자열인 경우
     */
    public Cancelled {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status cannot be null or blank");
        }
    }

    /**
     * 기본 문구로 생성.
     *
     * @return Cancelled 인스턴스
     */
    public static Cancelled of() {
        return new Cancelled(DEFAULT_STATUS);
    }

    @Override
    public String statusMessage() {
        return status;
    }
}
