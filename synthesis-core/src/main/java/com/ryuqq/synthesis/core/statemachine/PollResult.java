package com.ryuqq.synthesis.core.statemachine;

import com.ryuqq.synthesis.core.error.FailureInfo;
import com.ryuqq.synthesis.core.model.Operation;

/**
 * Operation Poller의 종료 결과.
 *
 * <ul>
 *   <li>DONE: operation = 완료된 Operation, failure = null</li>
 *   <li>FAILED: failure = 분류된 실패, operation = 마지막으로 관찰한 Operation</li>
 *   <li>CANCELLED: failure = null, operation = 마지막으로 관찰한 Operation</li>
 * </ul>
 *
 * @param state 종료 상태
 * @param operation 마지막으로 관찰한 Operation
 * @param failure 실패 정보 (FAILED일 때만 non-null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PollResult(
    PollState state,
    Operation operation,
    FailureInfo failure
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 종료 상태가 아니거나 필드 조합이 맞지 않는 경우
     */
    public PollResult {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal (current: " + state + ")");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if ((state == PollState.FAILED) != (failure != null)) {
            throw new IllegalArgumentException("failure must be present only for FAILED (state: " + state + ")");
        }
    }

    public static PollResult done(Operation operation) {
        return new PollResult(PollState.DONE, operation, null);
    }

    public static PollResult failed(Operation operation, FailureInfo failure) {
        return new PollResult(PollState.FAILED, operation, failure);
    }

    public static PollResult cancelled(Operation operation) {
        return new PollResult(PollState.CANCELLED, operation, null);
    }
}
