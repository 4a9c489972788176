package com.ryuqq.synthesis.application.orchestrator;

import com.ryuqq.synthesis.application.task.SynthesisTask;
import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.listener.noop.NoOpOrchestrationListener;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 기능 화면 하나의 현재 실행 슬롯.
 *
 * <p>{@link #start(SynthesisTask)}는 매번 새 토큰을 가진 핸들을 만들고 슬롯에 기록합니다.
 * 완료 시 슬롯은 compare-and-set으로 비워지므로 이전 실행이 늦게 끝나도 새 실행의 슬롯을 지우지 못합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FeatureSession {

    private final TaskOrchestrator orchestrator;
    private final OrchestrationListener listener;
    private final AtomicReference<TaskHandle> current = new AtomicReference<>();

    public FeatureSession(TaskOrchestrator orchestrator) {
        this(orchestrator, NoOpOrchestrationListener.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param orchestrator 오케스트레이터
     * @param listener 이 화면의 진행률/상태 리스너
     * @throws IllegalArgumentException 값이 null인 경우
     */
    public FeatureSession(TaskOrchestrator orchestrator, OrchestrationListener listener) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.orchestrator = orchestrator;
        this.listener = listener;
    }

    /**
     * 새 실행 시작.
     *
     * <p>진행 중인 이전 실행은 취소하지 않으며, 슬롯만 새 핸들로 교체됩니다.</p>
     *
     * @param task 실행할 태스크
     * @return 새 실행 핸들
     */
    public TaskHandle start(SynthesisTask task) {
        TaskHandle handle = orchestrator.submit(task, listener);
        current.set(handle);
        handle.result().whenComplete((outcome, error) -> current.compareAndSet(handle, null));
        return handle;
    }

    /**
     * 현재 실행 취소.
     *
     * @return 취소할 실행이 있었으면 true
     */
    public boolean cancel() {
        TaskHandle handle = current.get();
        if (handle == null) {
            return false;
        }
        handle.cancel();
        return true;
    }

    /**
     * 현재 실행을 취소하고 슬롯 비우기.
     */
    public void reset() {
        TaskHandle handle = current.getAndSet(null);
        if (handle != null) {
            handle.cancel();
        }
    }

    public Optional<TaskHandle> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isRunning() {
        return current.get() != null;
    }
}
