/**
 * Request construction.
 *
 * <p>Maps feature tasks to {@code GenerationRequest} / {@code ImageEditRequest} values: model selection by
 * resolution and prompt templates.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.application.request;
