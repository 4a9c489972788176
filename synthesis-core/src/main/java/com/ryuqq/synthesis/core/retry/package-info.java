/**
 * Retry package.
 *
 * <p>Bounded exponential-backoff retry specialised for rate-limit failures.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.core.retry.RetryExecutor} - Runs a {@link com.ryuqq.synthesis.core.retry.RemoteCall} under a policy</li>
 *   <li>{@link com.ryuqq.synthesis.core.retry.RetryPolicy} - Attempt budget and delay settings</li>
 *   <li>{@link com.ryuqq.synthesis.core.retry.BackoffCalculator} - {@code min(cap, 2^attempt * base) + jitter}</li>
 *   <li>{@link com.ryuqq.synthesis.core.retry.Sleeper} - Cancellable wait, default {@link com.ryuqq.synthesis.core.retry.CancellableSleeper}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.retry;
