/**
 * Orchestration port.
 *
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.application.orchestrator.TaskOrchestrator}: run/submit entry point</li>
 *   <li>{@link com.ryuqq.synthesis.application.orchestrator.TaskHandle}: per-run token, progress and result</li>
 *   <li>{@link com.ryuqq.synthesis.application.orchestrator.FeatureSession}: per-feature current run slot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.application.orchestrator;
