/**
 * Scripted in-memory synthesis client for tests and local runs.
 *
 * <p>{@link com.ryuqq.synthesis.adapter.inmemory.client.ScriptedSynthesisClient} replaces the
 * remote generation service. Each SPI method consumes queued
 * {@link com.ryuqq.synthesis.adapter.inmemory.client.RemoteStep}s, so a test can describe a
 * remote conversation such as "two 429s, then a pending operation, then done":</p>
 *
 * <pre>{@code
 * ScriptedSynthesisClient client = new ScriptedSynthesisClient()
 *     .onSubmit(RemoteStep.failing(new SynthesisException(429, "RESOURCE_EXHAUSTED", "busy")))
 *     .onSubmit(RemoteStep.returning(Operation.pending(OpId.of("operations/1"))))
 *     .pendingPolls(2)
 *     .onPoll(RemoteStep.returning(Operation.succeeded(OpId.of("operations/1"), ref)));
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.synthesis.adapter.inmemory.client;
