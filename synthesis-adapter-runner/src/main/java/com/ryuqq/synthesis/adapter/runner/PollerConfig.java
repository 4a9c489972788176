package com.ryuqq.synthesis.adapter.runner;

/**
 * OperationPoller 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: 폴링 간격 (기본 10000ms = 10초, 고정 간격)</li>
 *   <li>maxWaitMs: 최대 대기 시간 (기본 0 = 제한 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollIntervalMs 폴링 간격 (밀리초, 양수여야 함)
 * @param maxWaitMs 최대 대기 시간 (밀리초, 0이면 제한 없음)
 */
public record PollerConfig(
    long pollIntervalMs,
    long maxWaitMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=10000ms, maxWaitMs=0 (제한 없음)</p>
     */
    public PollerConfig() {
        this(10000, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollerConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (maxWaitMs < 0) {
            throw new IllegalArgumentException(
                "maxWaitMs must be non-negative (current: " + maxWaitMs + ")"
            );
        }
    }

    /**
     * 최대 대기 시간 제한 여부.
     *
     * @return maxWaitMs가 설정되어 있으면 true
     */
    public boolean isBounded() {
        return maxWaitMs > 0;
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public PollerConfig withPollIntervalMs(long pollIntervalMs) {
        return new PollerConfig(pollIntervalMs, maxWaitMs);
    }

    /**
     * maxWaitMs만 변경한 새 인스턴스 생성.
     */
    public PollerConfig withMaxWaitMs(long maxWaitMs) {
        return new PollerConfig(pollIntervalMs, maxWaitMs);
    }
}
