/**
 * Failure taxonomy package.
 *
 * <p>All failures crossing the orchestration boundary are labelled by
 * {@link com.ryuqq.synthesis.core.error.ErrorClassifier} into the closed
 * {@link com.ryuqq.synthesis.core.error.FailureKind} enum. Downstream code switches on the kind,
 * never on raw text.</p>
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>CANCELLED - user abort, reported neutrally</li>
 *   <li>RATE_LIMITED - 429 / quota, recovered by the retry executor</li>
 *   <li>AUTH_REQUIRED - credential re-sync needed</li>
 *   <li>QUOTA_EXHAUSTED - daily quota gone, not retried</li>
 *   <li>FATAL - everything else, surfaced verbatim</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.error;
