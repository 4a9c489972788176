/**
 * Observation hooks for progress and status.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.listener;
