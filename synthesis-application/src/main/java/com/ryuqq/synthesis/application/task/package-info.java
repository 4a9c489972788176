/**
 * Feature task inputs.
 *
 * <p>Each record is the validated input of one feature tab. Rendering, widgets and file decoding live
 * outside this SDK; tasks already carry media bytes.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.application.task;
