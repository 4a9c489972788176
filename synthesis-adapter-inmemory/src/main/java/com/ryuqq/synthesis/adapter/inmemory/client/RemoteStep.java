package com.ryuqq.synthesis.adapter.inmemory.client;

import com.ryuqq.synthesis.core.cancel.CancellationToken;

/**
 * One scripted response of a remote call.
 *
 * <p>A step either returns a value or throws. Steps receive the caller's cancellation
 * token so a script can abort the task in the middle of a call.</p>
 *
 * @param <I> call input type
 * @param <O> call output type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteStep<I, O> {

    /**
     * Produces the response for one call.
     *
     * @param input the call input
     * @param token the caller's cancellation token
     * @return the response
     */
    O apply(I input, CancellationToken token);

    /**
     * Step that always returns the given value.
     *
     * @param value the value to return
     * @param <I> call input type
     * @param <O> call output type
     * @return a returning step
     */
    static <I, O> RemoteStep<I, O> returning(O value) {
        return (input, token) -> value;
    }

    /**
     * Step that always throws the given exception.
     *
     * @param failure the exception to throw
     * @param <I> call input type
     * @param <O> call output type
     * @return a failing step
     */
    static <I, O> RemoteStep<I, O> failing(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return (input, token) -> {
            throw failure;
        };
    }
}
