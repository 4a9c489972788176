package com.ryuqq.synthesis.core.retry;

/**
 * Retry Executor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 7)</li>
 *   <li>baseDelayMs: 백오프 기본 단위 (기본 5000ms)</li>
 *   <li>maxDelayMs: 지수 증가분 상한 (기본 300000ms = 5분)</li>
 *   <li>maxJitterMs: 지수 증가분에 더해지는 최대 jitter (기본 3000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
 * @param maxJitterMs 최대 jitter (밀리초, 0 이상이어야 함)
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    long maxJitterMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=7, baseDelayMs=5000ms, maxDelayMs=300000ms, maxJitterMs=3000ms</p>
     */
    public RetryPolicy() {
        this(7, 5000, 300000, 3000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (maxJitterMs < 0) {
            throw new IllegalArgumentException(
                "maxJitterMs must be non-negative (current: " + maxJitterMs + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, maxJitterMs);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, maxJitterMs);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, maxJitterMs);
    }

    /**
     * maxJitterMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxJitterMs(long maxJitterMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, maxJitterMs);
    }
}
