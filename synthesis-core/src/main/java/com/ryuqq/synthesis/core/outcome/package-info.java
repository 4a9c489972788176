/**
 * Orchestration outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the result of one orchestration.
 * Remote failures never escape the orchestrator as exceptions; they end up here.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.core.outcome.Succeeded} - Artifact fetched</li>
 *   <li>{@link com.ryuqq.synthesis.core.outcome.Failed} - Classified failure, restartable</li>
 *   <li>{@link com.ryuqq.synthesis.core.outcome.Cancelled} - User abort, no alarm</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.outcome;
