package com.ryuqq.synthesis.testkit.contract;

import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link OrchestrationListener} that keeps every notification.
 *
 * <p>Progress arrives from the scheduler thread while status and outcome arrive from the
 * worker, so all lists are concurrent.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingListener implements OrchestrationListener {

    private final List<ProgressEstimate> estimates = new CopyOnWriteArrayList<>();
    private final List<String> statuses = new CopyOnWriteArrayList<>();
    private final List<TaskOutcome> outcomes = new CopyOnWriteArrayList<>();

    @Override
    public void onProgress(ProgressEstimate estimate) {
        estimates.add(estimate);
    }

    @Override
    public void onStatus(String status) {
        statuses.add(status);
    }

    @Override
    public void onFinished(TaskOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<ProgressEstimate> getEstimates() {
        return new ArrayList<>(estimates);
    }

    public List<String> getStatuses() {
        return new ArrayList<>(statuses);
    }

    public List<TaskOutcome> getOutcomes() {
        return new ArrayList<>(outcomes);
    }

    /**
     * Returns the last status published, or {@code null} when none was.
     *
     * @return last status
     */
    public String lastStatus() {
        List<String> snapshot = getStatuses();
        return snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
    }

    /**
     * Returns the last progress estimate, or {@code null} when none was published.
     *
     * @return last estimate
     */
    public ProgressEstimate lastEstimate() {
        List<ProgressEstimate> snapshot = getEstimates();
        return snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
    }
}
