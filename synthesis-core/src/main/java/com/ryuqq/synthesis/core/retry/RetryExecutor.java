package com.ryuqq.synthesis.core.retry;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.cancel.CancelledException;
import com.ryuqq.synthesis.core.error.ErrorClassifier;
import com.ryuqq.synthesis.core.error.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 호출량 제한 전용 재시도 실행기.
 *
 * <p>원격 호출을 성공, 재시도 불가 실패, 또는 시도 예산 소진까지 반복 실행합니다.</p>
 *
 * <p><strong>처리 흐름 (시도마다):</strong></p>
 * <pre>
 * 1. token.throwIfAborted()
 * 2. action.call() → 성공 시 즉시 반환
 * 3. 실패 분류 (ErrorClassifier):
 *    - CANCELLED → CancelledException
 *    - RATE_LIMITED + 남은 시도 있음 → backoff 대기 후 재시도
 *    - 그 외 → 원본 예외 그대로 전파
 * 4. 예산 소진 → 마지막 예외 그대로 전파 (합성된 "소진" 예외 없음)
 * </pre>
 *
 * <p>백오프 대기 중 토큰이 abort되면 남은 대기를 건너뛰고 CancelledException을 던집니다.</p>
 *
 * <p><strong>동시성:</strong> 상태를 갖지 않으므로 여러 오케스트레이션이 공유할 수 있습니다.
 * 재시도 상태는 호출마다 지역 변수로만 존재합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy defaultPolicy;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    /**
     * 기본 정책과 CancellableSleeper로 생성.
     */
    public RetryExecutor() {
        this(new RetryPolicy(), new CancellableSleeper());
    }

    /**
     * 정책과 Sleeper 주입.
     *
     * @param defaultPolicy 기본 재시도 정책
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryExecutor(RetryPolicy defaultPolicy, Sleeper sleeper) {
        this(defaultPolicy, new BackoffCalculator(defaultPolicy), sleeper);
    }

    /**
     * 전체 의존성 주입.
     *
     * @param defaultPolicy 기본 재시도 정책
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryExecutor(RetryPolicy defaultPolicy, BackoffCalculator backoffCalculator, Sleeper sleeper) {
        if (defaultPolicy == null) {
            throw new IllegalArgumentException("defaultPolicy cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.defaultPolicy = defaultPolicy;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
    }

    /**
     * 기본 정책으로 실행.
     *
     * @param action 원격 호출
     * @param token 취소 토큰
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws CancelledException 토큰이 abort된 경우
     * @throws RuntimeException 재시도 불가 실패 또는 예산 소진 시 마지막 실패
     */
    public <T> T execute(RemoteCall<T> action, CancellationToken token) {
        return execute(action, defaultPolicy, token, RetryListener.NONE);
    }

    /**
     * 기본 정책과 리스너로 실행.
     *
     * @param action 원격 호출
     * @param token 취소 토큰
     * @param listener 재시도 알림 리스너
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    public <T> T execute(RemoteCall<T> action, CancellationToken token, RetryListener listener) {
        return execute(action, defaultPolicy, token, listener);
    }

    /**
     * 지정한 정책으로 실행.
     *
     * <p>시도 횟수와 지연 계산 모두 전달된 정책을 따릅니다. 정책이 기본 정책과 같으면
     * 생성 시 주입된 BackoffCalculator를 사용하고, 다르면 해당 정책으로 계산기를 만듭니다.</p>
     *
     * @param action 원격 호출
     * @param policy 재시도 정책
     * @param token 취소 토큰
     * @param listener 재시도 알림 리스너
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public <T> T execute(RemoteCall<T> action, RetryPolicy policy, CancellationToken token, RetryListener listener) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        RetryListener effectiveListener = listener == null ? RetryListener.NONE : listener;
        BackoffCalculator calculator = policy.equals(defaultPolicy) ? backoffCalculator : new BackoffCalculator(policy);

        RuntimeException lastFailure = null;
        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            token.throwIfAborted();
            try {
                return action.call();
            } catch (RuntimeException e) {
                lastFailure = e;
                FailureKind kind = ErrorClassifier.classify(e, token);

                if (kind == FailureKind.CANCELLED) {
                    throw e instanceof CancelledException ce ? ce : new CancelledException("Operation cancelled", e);
                }
                if (!kind.isRetryable() || attempt >= policy.maxAttempts() - 1) {
                    throw e;
                }

                long delay = calculator.calculate(attempt);
                RetryState state = new RetryState(attempt, e, delay);
                log.warn("Rate limited on attempt {}/{}, retrying in {}ms: {}",
                    attempt + 1, policy.maxAttempts(), delay, e.getMessage());
                effectiveListener.onRetry(state);
                sleeper.sleep(delay, token);
            }
        }
        // maxAttempts >= 1이므로 도달하면 lastFailure는 non-null
        throw lastFailure;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
