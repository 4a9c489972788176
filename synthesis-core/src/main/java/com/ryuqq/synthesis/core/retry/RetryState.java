package com.ryuqq.synthesis.core.retry;

/**
 * 단일 Retry Executor 호출 범위의 재시도 상태.
 *
 * @param attempt 실패한 시도 번호 (0부터 시작)
 * @param lastFailure 마지막으로 관찰된 실패
 * @param delayMs 다음 시도 전 대기 시간 (밀리초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryState(
    int attempt,
    Throwable lastFailure,
    long delayMs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public RetryState {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        if (lastFailure == null) {
            throw new IllegalArgumentException("lastFailure cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
    }
}
