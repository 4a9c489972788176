package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 리스너 예외가 오케스트레이션을 중단시키지 않도록 감싸는 데코레이터.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class GuardedListener implements OrchestrationListener {

    private static final Logger log = LoggerFactory.getLogger(GuardedListener.class);

    private final OrchestrationListener delegate;

    GuardedListener(OrchestrationListener delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    static OrchestrationListener wrap(OrchestrationListener listener) {
        return listener instanceof GuardedListener ? listener : new GuardedListener(listener);
    }

    @Override
    public void onProgress(ProgressEstimate estimate) {
        try {
            delegate.onProgress(estimate);
        } catch (RuntimeException e) {
            log.warn("Listener failed on progress {}", estimate, e);
        }
    }

    @Override
    public void onStatus(String status) {
        try {
            delegate.onStatus(status);
        } catch (RuntimeException e) {
            log.warn("Listener failed on status '{}'", status, e);
        }
    }

    @Override
    public void onFinished(TaskOutcome outcome) {
        try {
            delegate.onFinished(outcome);
        } catch (RuntimeException e) {
            log.warn("Listener failed on outcome {}", outcome, e);
        }
    }
}
