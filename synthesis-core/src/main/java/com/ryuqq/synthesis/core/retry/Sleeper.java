package com.ryuqq.synthesis.core.retry;

import com.ryuqq.synthesis.core.cancel.CancellationToken;

/**
 * 취소 가능한 대기.
 *
 * <p>백오프와 폴링 간격 대기에 사용됩니다. 구현체는 토큰이 abort되면
 * 남은 대기 시간과 관계없이 즉시 깨어나 {@link com.ryuqq.synthesis.core.cancel.CancelledException}을
 * 던져야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @param token 취소 토큰
     * @throws com.ryuqq.synthesis.core.cancel.CancelledException 대기 전 또는 대기 중 abort된 경우
     */
    void sleep(long millis, CancellationToken token);
}
