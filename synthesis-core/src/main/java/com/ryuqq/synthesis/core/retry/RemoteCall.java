package com.ryuqq.synthesis.core.retry;

/**
 * Retry Executor가 감싸는 인자 없는 원격 호출.
 *
 * <p>실패는 unchecked 예외(주로 {@link com.ryuqq.synthesis.core.error.SynthesisException})로 표현되며,
 * 재시도 예산 소진 시 마지막 예외가 그대로 전파됩니다.</p>
 *
 * @param <T> 호출 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCall<T> {

    /**
     * 원격 호출 실행.
     *
     * @return 호출 결과
     */
    T call();
}
