package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.error.ErrorClassifier;
import com.ryuqq.synthesis.core.error.FailureInfo;
import com.ryuqq.synthesis.core.error.FailureKind;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.retry.RetryExecutor;
import com.ryuqq.synthesis.core.retry.RetryListener;
import com.ryuqq.synthesis.core.retry.RetryPolicy;
import com.ryuqq.synthesis.core.retry.Sleeper;
import com.ryuqq.synthesis.core.spi.SynthesisClient;
import com.ryuqq.synthesis.core.statemachine.PollResult;
import com.ryuqq.synthesis.core.statemachine.PollState;
import com.ryuqq.synthesis.core.statemachine.PollTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Long-running Operation 폴러.
 *
 * <p>원격 Operation이 done이 될 때까지 고정 간격으로 상태를 조회합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>SUBMITTED → POLLING</li>
 *   <li>while (!operation.done):</li>
 *   <li>  - 토큰 abort 시: CANCELLED (네트워크 호출 없음)</li>
 *   <li>  - maxWaitMs 초과 시: FAILED (FATAL)</li>
 *   <li>  - pollIntervalMs 대기 (취소 가능) → 토큰 재확인</li>
 *   <li>  - RetryExecutor를 통해 최신 상태 조회</li>
 *   <li>done + 오류 없음: DONE / done + 오류: FAILED (분류된 FailureInfo)</li>
 * </ol>
 *
 * <p>조회 중 재시도 불가 실패는 FAILED, 대기/조회 중 취소는 CANCELLED로 종료됩니다.
 * 예외를 던지지 않고 항상 {@link PollResult}를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationPoller {

    private static final Logger log = LoggerFactory.getLogger(OperationPoller.class);

    private final SynthesisClient client;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final PollerConfig config;
    private final LongSupplier clockMs;

    /**
     * 생성자.
     *
     * @param client 원격 서비스 클라이언트
     * @param retryExecutor 상태 조회 재시도 실행기
     * @param sleeper 폴링 간격 대기
     * @param config 폴러 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OperationPoller(SynthesisClient client, RetryExecutor retryExecutor, Sleeper sleeper, PollerConfig config) {
        this(client, retryExecutor, defaultPolicyOf(retryExecutor), sleeper, config, System::currentTimeMillis);
    }

    /**
     * 상태 조회 재시도 정책을 지정하는 생성자.
     *
     * @param client 원격 서비스 클라이언트
     * @param retryExecutor 상태 조회 재시도 실행기
     * @param retryPolicy 상태 조회에 적용할 재시도 정책
     * @param sleeper 폴링 간격 대기
     * @param config 폴러 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OperationPoller(SynthesisClient client, RetryExecutor retryExecutor, RetryPolicy retryPolicy,
                           Sleeper sleeper, PollerConfig config) {
        this(client, retryExecutor, retryPolicy, sleeper, config, System::currentTimeMillis);
    }

    OperationPoller(SynthesisClient client, RetryExecutor retryExecutor, Sleeper sleeper,
                    PollerConfig config, LongSupplier clockMs) {
        this(client, retryExecutor, defaultPolicyOf(retryExecutor), sleeper, config, clockMs);
    }

    OperationPoller(SynthesisClient client, RetryExecutor retryExecutor, RetryPolicy retryPolicy,
                    Sleeper sleeper, PollerConfig config, LongSupplier clockMs) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (retryExecutor == null) {
            throw new IllegalArgumentException("retryExecutor cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clockMs == null) {
            throw new IllegalArgumentException("clockMs cannot be null");
        }
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.config = config;
        this.clockMs = clockMs;
    }

    /**
     * Operation 완료 대기 (블로킹).
     *
     * @param operation 제출 직후의 Operation
     * @param token 취소 토큰
     * @return 종료 상태 (DONE, FAILED, CANCELLED)
     */
    public PollResult await(Operation operation, CancellationToken token) {
        return await(operation, token, RetryListener.NONE);
    }

    /**
     * Operation 완료 대기 (재시도 알림 포함).
     *
     * @param operation 제출 직후의 Operation
     * @param token 취소 토큰
     * @param retryListener 상태 조회 재시도 알림
     * @return 종료 상태 (DONE, FAILED, CANCELLED)
     */
    public PollResult await(Operation operation, CancellationToken token, RetryListener retryListener) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }

        PollState state = PollTransition.transition(PollState.SUBMITTED, PollState.POLLING);
        Operation current = operation;
        long startedAt = clockMs.getAsLong();
        int polls = 0;

        try {
            while (!current.done()) {
                if (token.isAborted()) {
                    log.info("Polling cancelled for {} after {} polls", current.id(), polls);
                    return finish(state, PollResult.cancelled(current));
                }
                long elapsed = clockMs.getAsLong() - startedAt;
                if (config.isBounded() && elapsed >= config.maxWaitMs()) {
                    log.error("Polling timed out for {} after {} ms", current.id(), elapsed);
                    return finish(state, PollResult.failed(current, FailureInfo.of(FailureKind.FATAL,
                        "Operation timed out after " + elapsed + " ms")));
                }

                sleeper.sleep(config.pollIntervalMs(), token);
                token.throwIfAborted();

                Operation snapshot = current;
                current = retryExecutor.execute(() -> client.poll(snapshot, token), retryPolicy, token, retryListener);
                polls++;
                log.debug("Poll #{} for {}: done={}", polls, current.id(), current.done());
            }
        } catch (RuntimeException e) {
            FailureInfo failure = ErrorClassifier.describe(e, token);
            if (failure.kind() == FailureKind.CANCELLED) {
                log.info("Polling cancelled for {} after {} polls", current.id(), polls);
                return finish(state, PollResult.cancelled(current));
            }
            log.error("Polling failed for {}: {} ({})", current.id(), failure.message(), failure.kind());
            return finish(state, PollResult.failed(current, failure));
        }

        if (current.hasError()) {
            FailureInfo failure = ErrorClassifier.describe(current.error());
            log.error("Operation {} finished with error: {} ({})", current.id(), failure.message(), failure.kind());
            return finish(state, PollResult.failed(current, failure));
        }
        log.info("Operation {} done after {} polls", current.id(), polls);
        return finish(state, PollResult.done(current));
    }

    public PollerConfig getConfig() {
        return config;
    }

    private static PollResult finish(PollState current, PollResult result) {
        PollTransition.validate(current, result.state());
        return result;
    }

    private static RetryPolicy defaultPolicyOf(RetryExecutor retryExecutor) {
        if (retryExecutor == null) {
            throw new IllegalArgumentException("retryExecutor cannot be null");
        }
        return retryExecutor.getDefaultPolicy();
    }
}
