package com.ryuqq.synthesis.application.orchestrator;

import com.ryuqq.synthesis.application.task.Feature;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 비동기 합성 실행 핸들.
 *
 * <p>핸들마다 고유한 {@link CancellationToken}을 가지며,
 * 결과 Future는 항상 {@link TaskOutcome}으로 정상 완료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskHandle {

    private final String taskId;
    private final Feature feature;
    private final CancellationToken token;
    private final CompletableFuture<TaskOutcome> outcome;
    private final Supplier<ProgressEstimate> progress;

    /**
     * 생성자.
     *
     * @param taskId 실행 식별자
     * @param feature 기능 구분
     * @param token 이 실행 전용 취소 토큰
     * @param outcome 결과 Future
     * @param progress 현재 진행률 조회 함수
     * @throws IllegalArgumentException 값이 null인 경우
     */
    public TaskHandle(String taskId, Feature feature, CancellationToken token,
                      CompletableFuture<TaskOutcome> outcome, Supplier<ProgressEstimate> progress) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (feature == null || token == null || outcome == null || progress == null) {
            throw new IllegalArgumentException("feature, token, outcome and progress cannot be null");
        }
        this.taskId = taskId;
        this.feature = feature;
        this.token = token;
        this.outcome = outcome;
        this.progress = progress;
    }

    /**
     * 새 실행 식별자 생성.
     *
     * @return UUID 기반 식별자
     */
    public static String newTaskId() {
        return UUID.randomUUID().toString();
    }

    /**
     * 실행 취소.
     *
     * <p>토큰을 abort합니다. 이미 완료된 실행에는 영향이 없습니다.</p>
     */
    public void cancel() {
        token.abort();
    }

    public boolean isCancellationRequested() {
        return token.isAborted();
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /**
     * 결과 대기 (블로킹).
     *
     * @return 최종 결과
     */
    public TaskOutcome await() {
        return outcome.join();
    }

    /**
     * 결과 Stage 조회.
     *
     * @return 읽기 전용 CompletionStage
     */
    public CompletionStage<TaskOutcome> result() {
        return outcome.minimalCompletionStage();
    }

    public ProgressEstimate progress() {
        return progress.get();
    }

    public String getTaskId() {
        return taskId;
    }

    public Feature getFeature() {
        return feature;
    }

    CancellationToken getToken() {
        return token;
    }

    @Override
    public String toString() {
        return "TaskHandle{taskId=" + taskId + ", feature=" + feature
            + ", done=" + outcome.isDone() + ", cancelRequested=" + token.isAborted() + "}";
    }
}
