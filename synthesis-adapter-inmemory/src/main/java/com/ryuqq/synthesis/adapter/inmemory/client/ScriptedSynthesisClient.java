package com.ryuqq.synthesis.adapter.inmemory.client;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.model.GenerationRequest;
import com.ryuqq.synthesis.core.model.ImageEditRequest;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;
import com.ryuqq.synthesis.core.model.OpId;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.spi.SynthesisClient;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link SynthesisClient} driven by per-method scripts.
 *
 * <p>Each method consumes its queued {@link RemoteStep}s in FIFO order. When a queue is
 * empty the method falls back to a default behaviour:</p>
 * <ul>
 *   <li>{@code submit}: a pending operation named {@code operations/op-N}</li>
 *   <li>{@code poll}: the observed operation, unchanged</li>
 *   <li>{@code editImage}: the input image, unchanged</li>
 *   <li>{@code analyzeMontage}: an empty segment list</li>
 * </ul>
 *
 * <p>Every call is recorded before it runs, and a call made with an aborted token throws
 * {@link com.ryuqq.synthesis.core.cancel.CancelledException} without consuming a step,
 * the way a real transport refuses to start a request that was already cancelled.</p>
 *
 * <p><strong>Thread Safety:</strong> scripts and recordings use concurrent collections and
 * may be configured from the test thread while a worker thread is calling.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedSynthesisClient implements SynthesisClient {

    private final Deque<RemoteStep<GenerationRequest, Operation>> submitSteps = new ConcurrentLinkedDeque<>();
    private final Deque<RemoteStep<Operation, Operation>> pollSteps = new ConcurrentLinkedDeque<>();
    private final Deque<RemoteStep<ImageEditRequest, MediaBlob>> editSteps = new ConcurrentLinkedDeque<>();
    private final Deque<RemoteStep<List<MediaBlob>, List<MontageSegment>>> analyzeSteps = new ConcurrentLinkedDeque<>();

    private final List<GenerationRequest> submitted = new CopyOnWriteArrayList<>();
    private final List<Operation> polled = new CopyOnWriteArrayList<>();
    private final List<ImageEditRequest> edited = new CopyOnWriteArrayList<>();
    private final List<List<MediaBlob>> analyzed = new CopyOnWriteArrayList<>();

    private final AtomicInteger operationSequence = new AtomicInteger();

    // ==================== Scripting ====================

    /**
     * Queues a submit step.
     *
     * @param step the step
     * @return this client
     */
    public ScriptedSynthesisClient onSubmit(RemoteStep<GenerationRequest, Operation> step) {
        submitSteps.add(requireStep(step));
        return this;
    }

    /**
     * Queues a poll step.
     *
     * @param step the step
     * @return this client
     */
    public ScriptedSynthesisClient onPoll(RemoteStep<Operation, Operation> step) {
        pollSteps.add(requireStep(step));
        return this;
    }

    /**
     * Queues an image edit step.
     *
     * @param step the step
     * @return this client
     */
    public ScriptedSynthesisClient onEditImage(RemoteStep<ImageEditRequest, MediaBlob> step) {
        editSteps.add(requireStep(step));
        return this;
    }

    /**
     * Queues a montage analysis step.
     *
     * @param step the step
     * @return this client
     */
    public ScriptedSynthesisClient onAnalyzeMontage(RemoteStep<List<MediaBlob>, List<MontageSegment>> step) {
        analyzeSteps.add(requireStep(step));
        return this;
    }

    /**
     * Queues {@code count} poll steps that return the observed operation still pending.
     *
     * @param count number of pending polls
     * @return this client
     */
    public ScriptedSynthesisClient pendingPolls(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        for (int i = 0; i < count; i++) {
            pollSteps.add((operation, token) -> Operation.pending(operation.id()));
        }
        return this;
    }

    // ==================== SynthesisClient ====================

    @Override
    public Operation submit(GenerationRequest request, CancellationToken token) {
        token.throwIfAborted();
        submitted.add(request);
        RemoteStep<GenerationRequest, Operation> step = submitSteps.poll();
        if (step == null) {
            return Operation.pending(OpId.of("operations/op-" + operationSequence.incrementAndGet()));
        }
        return step.apply(request, token);
    }

    @Override
    public Operation poll(Operation operation, CancellationToken token) {
        token.throwIfAborted();
        polled.add(operation);
        RemoteStep<Operation, Operation> step = pollSteps.poll();
        if (step == null) {
            return operation;
        }
        return step.apply(operation, token);
    }

    @Override
    public MediaBlob editImage(ImageEditRequest request, CancellationToken token) {
        token.throwIfAborted();
        edited.add(request);
        RemoteStep<ImageEditRequest, MediaBlob> step = editSteps.poll();
        if (step == null) {
            return request.image();
        }
        return step.apply(request, token);
    }

    @Override
    public List<MontageSegment> analyzeMontage(List<MediaBlob> clips, CancellationToken token) {
        token.throwIfAborted();
        analyzed.add(List.copyOf(clips));
        RemoteStep<List<MediaBlob>, List<MontageSegment>> step = analyzeSteps.poll();
        if (step == null) {
            return List.of();
        }
        return step.apply(clips, token);
    }

    // ==================== Inspection ====================

    /**
     * Returns submitted requests in call order, retries included.
     *
     * @return snapshot of submitted requests
     */
    public List<GenerationRequest> getSubmittedRequests() {
        return new ArrayList<>(submitted);
    }

    /**
     * Returns the operations passed to {@code poll} in call order.
     *
     * @return snapshot of polled operations
     */
    public List<Operation> getPolledOperations() {
        return new ArrayList<>(polled);
    }

    /**
     * Returns image edit requests in call order.
     *
     * @return snapshot of edit requests
     */
    public List<ImageEditRequest> getEditRequests() {
        return new ArrayList<>(edited);
    }

    /**
     * Returns the clip lists passed to montage analysis.
     *
     * @return snapshot of analysed clip lists
     */
    public List<List<MediaBlob>> getAnalyzedClips() {
        return new ArrayList<>(analyzed);
    }

    public int getSubmitCount() {
        return submitted.size();
    }

    public int getPollCount() {
        return polled.size();
    }

    /**
     * Drops all scripts and recordings.
     */
    public void clear() {
        submitSteps.clear();
        pollSteps.clear();
        editSteps.clear();
        analyzeSteps.clear();
        submitted.clear();
        polled.clear();
        edited.clear();
        analyzed.clear();
        operationSequence.set(0);
    }

    private static <T> T requireStep(T step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        return step;
    }
}
