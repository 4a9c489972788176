/**
 * Cooperative cancellation package.
 *
 * <p>A {@link com.ryuqq.synthesis.core.cancel.CancellationToken} is created per orchestration and threaded
 * explicitly through submission, polling and artifact fetch. Waits and in-flight calls register abort
 * listeners and remove them when they finish.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.core.cancel.CancellationToken} - Shareable abort flag with listeners</li>
 *   <li>{@link com.ryuqq.synthesis.core.cancel.CancelledException} - Raised at check points after abort</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.cancel;
