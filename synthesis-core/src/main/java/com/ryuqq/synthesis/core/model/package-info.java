/**
 * Domain model package.
 *
 * <p>Immutable value types describing remote long-running operations and the media they
 * consume and produce.</p>
 *
 * <h2>Operation</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.core.model.OpId} - Opaque remote operation handle</li>
 *   <li>{@link com.ryuqq.synthesis.core.model.Operation} - Snapshot returned by submission and polling</li>
 *   <li>{@link com.ryuqq.synthesis.core.model.OperationError} - Error payload of a terminal operation</li>
 *   <li>{@link com.ryuqq.synthesis.core.model.ArtifactRef} - Download location of the final media</li>
 * </ul>
 *
 * <h2>Requests and media</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.core.model.GenerationRequest} - Video generation request</li>
 *   <li>{@link com.ryuqq.synthesis.core.model.ImageEditRequest} - Synchronous still image edit</li>
 *   <li>{@link com.ryuqq.synthesis.core.model.MediaBlob} - Bytes plus mime type</li>
 *   <li>{@link com.ryuqq.synthesis.core.model.MontageSegment} - Highlight found by montage analysis</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.model;
