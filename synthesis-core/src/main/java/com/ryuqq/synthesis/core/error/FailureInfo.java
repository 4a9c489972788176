package com.ryuqq.synthesis.core.error;

/**
 * 분류된 실패.
 *
 * @param kind 실패 분류
 * @param message 원본 메시지 (사용자에게 그대로 보여줄 수 있음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FailureInfo(
    FailureKind kind,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 message가 null인 경우
     */
    public FailureInfo {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }

    /**
     * FailureInfo 생성.
     *
     * @param kind 실패 분류
     * @param message 원본 메시지
     * @return FailureInfo 인스턴스
     */
    public static FailureInfo of(FailureKind kind, String message) {
        return new FailureInfo(kind, message);
    }
}
