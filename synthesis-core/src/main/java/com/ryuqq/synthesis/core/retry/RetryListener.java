package com.ryuqq.synthesis.core.retry;

/**
 * 재시도 대기 직전에 호출되는 콜백.
 *
 * <p>오케스트레이터는 이 콜백으로 "할당량 대기 중" 같은 상태를 표시합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * 아무 동작도 하지 않는 리스너.
     */
    RetryListener NONE = state -> { };

    /**
     * 백오프 대기 시작 알림.
     *
     * @param state 재시도 상태
     */
    void onRetry(RetryState state);
}
