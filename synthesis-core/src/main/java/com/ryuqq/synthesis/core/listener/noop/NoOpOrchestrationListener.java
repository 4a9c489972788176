package com.ryuqq.synthesis.core.listener.noop;

import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;

/**
 * OrchestrationListener NoOp 구현.
 *
 * <p>관찰이 필요 없는 호출자(배치 작업, 테스트)에서 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpOrchestrationListener implements OrchestrationListener {

    public static final NoOpOrchestrationListener INSTANCE = new NoOpOrchestrationListener();

    @Override
    public void onProgress(ProgressEstimate estimate) {
        // NoOp
    }

    @Override
    public void onStatus(String status) {
        // NoOp
    }

    @Override
    public void onFinished(TaskOutcome outcome) {
        // NoOp
    }
}
