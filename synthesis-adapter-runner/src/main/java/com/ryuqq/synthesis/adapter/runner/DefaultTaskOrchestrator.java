package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.application.orchestrator.TaskHandle;
import com.ryuqq.synthesis.application.orchestrator.TaskOrchestrator;
import com.ryuqq.synthesis.application.request.RequestFactory;
import com.ryuqq.synthesis.application.task.ImageRemedyTask;
import com.ryuqq.synthesis.application.task.LogoAnimationTask;
import com.ryuqq.synthesis.application.task.MontageTask;
import com.ryuqq.synthesis.application.task.SynthesisTask;
import com.ryuqq.synthesis.application.task.VideoGenerationTask;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.error.ErrorClassifier;
import com.ryuqq.synthesis.core.error.FailureInfo;
import com.ryuqq.synthesis.core.error.FailureKind;
import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.listener.noop.NoOpOrchestrationListener;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.GenerationRequest;
import com.ryuqq.synthesis.core.model.ImageEditRequest;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.outcome.Cancelled;
import com.ryuqq.synthesis.core.outcome.Failed;
import com.ryuqq.synthesis.core.outcome.Succeeded;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;
import com.ryuqq.synthesis.core.retry.CancellableSleeper;
import com.ryuqq.synthesis.core.retry.RetryExecutor;
import com.ryuqq.synthesis.core.retry.RemoteCall;
import com.ryuqq.synthesis.core.retry.RetryListener;
import com.ryuqq.synthesis.core.retry.Sleeper;
import com.ryuqq.synthesis.core.spi.ApiKeyProvider;
import com.ryuqq.synthesis.core.spi.ArtifactFetcher;
import com.ryuqq.synthesis.core.spi.CredentialResync;
import com.ryuqq.synthesis.core.spi.SynthesisClient;
import com.ryuqq.synthesis.core.statemachine.PollResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TaskOrchestrator 기본 구현체.
 *
 * <p>한 번의 합성을 제출부터 결과 다운로드까지 수행하고 결과를 {@link TaskOutcome}으로 보고합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(task, token)
 *   ↓
 * progress.start() → "Preparing..."
 *   ↓
 * submit (RetryExecutor) → "Synthesizing..."
 *   ↓
 * OperationPoller.await()
 *   ├─ CANCELLED → Cancelled
 *   ├─ FAILED    → 분류별 Failed (AUTH_REQUIRED면 자격 증명 재선택)
 *   └─ DONE      → "Finalizing..." → 인증 파라미터 추가 → fetch (RetryExecutor)
 *                    ↓
 *                  progress.complete() → Succeeded
 * </pre>
 *
 * <p>모든 종료 경로에서 진행률 스케줄을 해제합니다. 원격 실패로 예외를 던지지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultTaskOrchestrator implements TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskOrchestrator.class);

    static final String STATUS_PREPARING = "Preparing...";
    static final String STATUS_ANALYZING = "Analyzing highlights...";
    static final String STATUS_ENHANCING = "Enhancing...";
    static final String STATUS_SYNTHESIZING = "Synthesizing...";
    static final String STATUS_FINALIZING = "Finalizing...";
    static final String STATUS_PENDING_QUOTA = "Pending (Quota)...";

    static final String SYNC_COMPLETE_MESSAGE = "Sync complete. Please retry.";
    static final String QUOTA_MESSAGE = "Quota exhausted. Please wait or check settings.";
    static final String NO_ARTIFACT_MESSAGE = "Generation complete, but no video data was found.";
    static final String NO_HIGHLIGHTS_MESSAGE = "No highlights were found in the provided clips.";
    static final String SHUT_DOWN_MESSAGE = "Orchestrator is shut down.";

    private final SynthesisClient client;
    private final ArtifactFetcher fetcher;
    private final CredentialResync credentialResync;
    private final ApiKeyProvider apiKeyProvider;
    private final RequestFactory requestFactory;
    private final OrchestratorConfig config;
    private final RetryExecutor retryExecutor;
    private final OperationPoller poller;
    private final ScheduledExecutorService progressScheduler;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 설정, 기본 모델 구성).
     *
     * @param client 원격 서비스 클라이언트
     * @param fetcher 결과 다운로드
     * @param credentialResync 자격 증명 재선택
     * @param apiKeyProvider 현재 API 키
     */
    public DefaultTaskOrchestrator(SynthesisClient client, ArtifactFetcher fetcher,
                                   CredentialResync credentialResync, ApiKeyProvider apiKeyProvider) {
        this(client, fetcher, credentialResync, apiKeyProvider, new RequestFactory(), new OrchestratorConfig());
    }

    /**
     * 생성자 (설정 커스터마이징).
     *
     * @param client 원격 서비스 클라이언트
     * @param fetcher 결과 다운로드
     * @param credentialResync 자격 증명 재선택
     * @param apiKeyProvider 현재 API 키
     * @param requestFactory 요청 생성기
     * @param config 설정
     */
    public DefaultTaskOrchestrator(SynthesisClient client, ArtifactFetcher fetcher,
                                   CredentialResync credentialResync, ApiKeyProvider apiKeyProvider,
                                   RequestFactory requestFactory, OrchestratorConfig config) {
        this(client, fetcher, credentialResync, apiKeyProvider, requestFactory, config,
            new CancellableSleeper(), null);
    }

    /**
     * 생성자 (대기 전략 주입).
     *
     * <p>재시도 백오프와 폴링 간격 대기 모두 주어진 Sleeper를 사용합니다.</p>
     *
     * @param client 원격 서비스 클라이언트
     * @param fetcher 결과 다운로드
     * @param credentialResync 자격 증명 재선택
     * @param apiKeyProvider 현재 API 키
     * @param requestFactory 요청 생성기
     * @param config 설정
     * @param sleeper 대기 전략
     * @param retryExecutor 재시도 실행기 (null이면 config.retryPolicy와 sleeper로 생성).
     *                      주입된 경우에도 재시도 정책은 config.retryPolicy를 따릅니다.
     */
    public DefaultTaskOrchestrator(SynthesisClient client, ArtifactFetcher fetcher,
                                   CredentialResync credentialResync, ApiKeyProvider apiKeyProvider,
                                   RequestFactory requestFactory, OrchestratorConfig config,
                                   Sleeper sleeper, RetryExecutor retryExecutor) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (credentialResync == null) {
            throw new IllegalArgumentException("credentialResync cannot be null");
        }
        if (apiKeyProvider == null) {
            throw new IllegalArgumentException("apiKeyProvider cannot be null");
        }
        if (requestFactory == null) {
            throw new IllegalArgumentException("requestFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }

        this.client = client;
        this.fetcher = fetcher;
        this.credentialResync = credentialResync;
        this.apiKeyProvider = apiKeyProvider;
        this.requestFactory = requestFactory;
        this.config = config;
        this.retryExecutor = retryExecutor != null ? retryExecutor : new RetryExecutor(config.retryPolicy(), sleeper);
        this.poller = new OperationPoller(client, this.retryExecutor, config.retryPolicy(), sleeper, config.poller());
        this.progressScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("synthesis-progress"));
        this.workerExecutor = Executors.newFixedThreadPool(config.workerThreads(), daemonThreads("synthesis-worker"));
    }

    @Override
    public TaskOutcome run(SynthesisTask task, CancellationToken token) {
        return run(task, token, NoOpOrchestrationListener.INSTANCE);
    }

    @Override
    public TaskOutcome run(SynthesisTask task, CancellationToken token, OrchestrationListener listener) {
        validateInput(task, token, listener);
        OrchestrationListener guarded = GuardedListener.wrap(listener);
        return execute(task, token, guarded, newEstimator(guarded));
    }

    @Override
    public TaskHandle submit(SynthesisTask task) {
        return submit(task, NoOpOrchestrationListener.INSTANCE);
    }

    @Override
    public TaskHandle submit(SynthesisTask task, OrchestrationListener listener) {
        CancellationToken token = new CancellationToken();
        validateInput(task, token, listener);

        OrchestrationListener guarded = GuardedListener.wrap(listener);
        ProgressEstimator progress = newEstimator(guarded);
        CompletableFuture<TaskOutcome> future = new CompletableFuture<>();
        TaskHandle handle = new TaskHandle(TaskHandle.newTaskId(), task.feature(), token, future, progress::current);

        try {
            workerExecutor.execute(() -> future.complete(execute(task, token, guarded, progress)));
        } catch (RejectedExecutionException e) {
            log.warn("Rejected {} orchestration: worker pool is shut down", task.feature());
            Failed rejected = new Failed(FailureInfo.of(FailureKind.FATAL, SHUT_DOWN_MESSAGE), SHUT_DOWN_MESSAGE);
            guarded.onFinished(rejected);
            future.complete(rejected);
        }
        return handle;
    }

    /**
     * Orchestrator 종료 (리소스 정리).
     *
     * <p>워커 풀을 graceful shutdown하여 진행 중인 작업이 완료되도록 대기합니다.
     * 대기 중 인터럽트가 발생해도 진행률 스케줄러는 항상 종료됩니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        try {
            workerExecutor.shutdown();
            if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } finally {
            progressScheduler.shutdownNow();
        }
    }

    boolean isProgressSchedulerShutdown() {
        return progressScheduler.isShutdown();
    }

    private <T> T retry(RemoteCall<T> call, CancellationToken token, RetryListener listener) {
        return retryExecutor.execute(call, config.retryPolicy(), token, listener);
    }

    private void validateInput(SynthesisTask task, CancellationToken token, OrchestrationListener listener) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
    }

    private ProgressEstimator newEstimator(OrchestrationListener listener) {
        return new ProgressEstimator(progressScheduler, config.progress(), listener);
    }

    private TaskOutcome execute(SynthesisTask task, CancellationToken token,
                                OrchestrationListener listener, ProgressEstimator progress) {
        log.info("Orchestration started: feature={}", task.feature());
        TaskOutcome outcome;
        try {
            token.throwIfAborted();
            outcome = dispatch(task, token, listener, progress);
        } catch (RuntimeException e) {
            outcome = outcomeFor(ErrorClassifier.describe(e, token));
        } finally {
            progress.stop();
        }

        log.info("Orchestration finished: feature={}, outcome={}", task.feature(), outcome.getClass().getSimpleName());
        listener.onStatus(outcome.statusMessage());
        listener.onFinished(outcome);
        return outcome;
    }

    private TaskOutcome dispatch(SynthesisTask task, CancellationToken token,
                                 OrchestrationListener listener, ProgressEstimator progress) {
        if (task instanceof VideoGenerationTask video) {
            return renderVideo(requestFactory.videoGeneration(video), List.of(), token, listener, progress);
        }
        if (task instanceof LogoAnimationTask logo) {
            return renderVideo(requestFactory.logoAnimation(logo), List.of(), token, listener, progress);
        }
        if (task instanceof ImageRemedyTask remedy) {
            if (remedy.isVideo()) {
                return renderVideo(requestFactory.videoRemedy(remedy), List.of(), token, listener, progress);
            }
            return editImage(requestFactory.imageEdit(remedy), token, listener, progress);
        }
        if (task instanceof MontageTask montage) {
            return renderMontage(montage, token, listener, progress);
        }
        throw new IllegalArgumentException("Unsupported task: " + task.feature());
    }

    private TaskOutcome renderVideo(GenerationRequest request, List<MontageSegment> segments, CancellationToken token,
                                    OrchestrationListener listener, ProgressEstimator progress) {
        if (!progress.isRunning()) {
            progress.start();
        }
        listener.onStatus(STATUS_PREPARING);
        RetryListener onRetry = quotaNotifier(listener);

        Operation submitted = retry(() -> client.submit(request, token), token, onRetry);
        log.info("Operation {} submitted (model={})", submitted.id(), request.model());

        progress.markSynthesizing();
        listener.onStatus(STATUS_SYNTHESIZING);
        PollResult result = poller.await(submitted, token, onRetry);

        switch (result.state()) {
            case CANCELLED:
                return Cancelled.of();
            case FAILED:
                return outcomeFor(result.failure());
            default:
                break;
        }

        ArtifactRef artifact = result.operation().result();
        if (artifact == null) {
            return outcomeFor(FailureInfo.of(FailureKind.FATAL, NO_ARTIFACT_MESSAGE));
        }

        progress.markFinalizing();
        listener.onStatus(STATUS_FINALIZING);
        URI location = authorize(artifact);
        MediaBlob media = retry(() -> fetcher.fetch(location, token), token, onRetry);
        token.throwIfAborted();

        progress.complete();
        return new Succeeded(media, artifact, segments);
    }

    private TaskOutcome renderMontage(MontageTask task, CancellationToken token,
                                      OrchestrationListener listener, ProgressEstimator progress) {
        progress.start();
        listener.onStatus(STATUS_ANALYZING);
        List<MontageSegment> segments = retry(
            () -> client.analyzeMontage(task.clips(), token), token, quotaNotifier(listener));
        token.throwIfAborted();

        if (segments.isEmpty()) {
            return outcomeFor(FailureInfo.of(FailureKind.FATAL, NO_HIGHLIGHTS_MESSAGE));
        }
        log.info("Montage analysis found {} highlights in {} clips", segments.size(), task.clips().size());
        return renderVideo(requestFactory.montageRender(segments), segments, token, listener, progress);
    }

    private TaskOutcome editImage(ImageEditRequest request, CancellationToken token,
                                  OrchestrationListener listener, ProgressEstimator progress) {
        progress.start();
        listener.onStatus(STATUS_ENHANCING);
        MediaBlob edited = retry(
            () -> client.editImage(request, token), token, quotaNotifier(listener));
        token.throwIfAborted();

        progress.markFinalizing();
        progress.complete();
        return Succeeded.of(edited, null);
    }

    private URI authorize(ArtifactRef artifact) {
        String key = apiKeyProvider.currentKey();
        if (key == null || key.isBlank()) {
            return artifact.uri();
        }
        return artifact.withQueryParameter(config.authParameterName(), key);
    }

    private TaskOutcome outcomeFor(FailureInfo failure) {
        switch (failure.kind()) {
            case CANCELLED:
                log.info("Orchestration cancelled");
                return Cancelled.of();
            case AUTH_REQUIRED:
                return resyncCredentials(failure);
            case QUOTA_EXHAUSTED:
            case RATE_LIMITED:
                log.warn("Orchestration stopped by quota: {} ({})", failure.message(), failure.kind());
                return new Failed(failure, QUOTA_MESSAGE);
            default:
                log.error("Orchestration failed: {}", failure.message());
                String message = failure.message().isBlank() ? "Generation failed" : failure.message();
                return new Failed(failure, message);
        }
    }

    private TaskOutcome resyncCredentials(FailureInfo failure) {
        log.warn("Credentials rejected, opening credential selector: {}", failure.message());
        try {
            credentialResync.openCredentialSelector();
        } catch (RuntimeException e) {
            log.error("Credential selector failed", e);
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new Failed(failure, "Credential sync failed: " + reason);
        }
        return new Failed(failure, SYNC_COMPLETE_MESSAGE);
    }

    private static RetryListener quotaNotifier(OrchestrationListener listener) {
        return state -> listener.onStatus(STATUS_PENDING_QUOTA);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
