package com.ryuqq.synthesis.core.model;

/**
 * 종료된 Operation이 담고 있는 오류 페이로드.
 *
 * @param code 원격 서비스 오류 코드 (HTTP 상태 코드와 같은 체계, 알 수 없으면 0)
 * @param message 오류 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationError(
    int code,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null인 경우
     */
    public OperationError {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}
