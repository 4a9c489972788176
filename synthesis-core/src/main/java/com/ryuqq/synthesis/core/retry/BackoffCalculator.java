package com.ryuqq.synthesis.core.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 원격 서비스에 대한 동기화된 재시도 폭주를 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(maxDelay, baseDelay * 2^attempt) + jitter
 * jitter = random(0, maxJitter)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=5000ms, maxJitter=3000ms):</strong></p>
 * <ul>
 *   <li>attempt=0: 5000ms + jitter(0-3000ms)</li>
 *   <li>attempt=1: 10000ms + jitter(0-3000ms)</li>
 *   <li>attempt=2: 20000ms + jitter(0-3000ms)</li>
 *   <li>attempt=7: 640000ms → maxDelay=300000ms로 제한 + jitter</li>
 * </ul>
 *
 * <p>결과는 항상 {@code maxDelay + maxJitter} 이하입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long maxJitterMs;
    private final DoubleSupplier random;

    /**
     * 기본 RetryPolicy 설정으로 생성.
     */
    public BackoffCalculator() {
        this(new RetryPolicy());
    }

    /**
     * RetryPolicy 설정으로 생성.
     *
     * @param policy 재시도 설정
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy) {
        this(requirePolicy(policy).baseDelayMs(), policy.maxDelayMs(), policy.maxJitterMs(),
            () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param maxJitterMs 최대 jitter (밀리초, 0 이상이어야 함)
     * @param random [0, 1) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, long maxJitterMs, DoubleSupplier random) {
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
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxJitterMs = maxJitterMs;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 번호 (0부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt must be non-negative (current: " + attempt + ")"
            );
        }

        // 1. 지수적 백오프 (shift overflow 방지)
        int shift = Math.min(attempt, MAX_SHIFT);
        long multiplier = 1L << shift;
        long exponential = multiplier > maxDelayMs / baseDelayMs
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        // 2. Jitter 추가 (0 ~ maxJitter)
        double r = Math.max(0.0, Math.min(random.getAsDouble(), 1.0));
        long jitter = (long) (maxJitterMs * r);

        return exponential + jitter;
    }

    /**
     * 지연 시간 상한 조회.
     *
     * @return maxDelay + maxJitter (밀리초)
     */
    public long upperBoundMs() {
        return maxDelayMs + maxJitterMs;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public long getMaxJitterMs() {
        return maxJitterMs;
    }

    private static RetryPolicy requirePolicy(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return policy;
    }
}
