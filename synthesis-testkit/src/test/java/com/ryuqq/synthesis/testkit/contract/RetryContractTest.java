package com.ryuqq.synthesis.testkit.contract;

import com.ryuqq.synthesis.adapter.inmemory.client.RemoteStep;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.error.ErrorClassifier;
import com.ryuqq.synthesis.core.error.FailureKind;
import com.ryuqq.synthesis.core.error.SynthesisException;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.OpId;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.outcome.Failed;
import com.ryuqq.synthesis.core.outcome.Succeeded;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;
import com.ryuqq.synthesis.core.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for rate-limit retries.
 *
 * <p>Validates that transient rate limits are absorbed by exponential backoff within the
 * attempt budget, and that every other failure surfaces on the first attempt.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>429 twice on submit, then success: two backoff waits (5000, 10000 ms)</li>
 *   <li>429 on every attempt: budget exhausted, quota message, waits bounded</li>
 *   <li>Daily quota sentinel: no retry</li>
 *   <li>Non-rate-limit failure: no retry, message passed through</li>
 *   <li>429 while polling: retried inside the poll loop</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractContractTest {

    private static final String QUOTA_MESSAGE = "Quota exhausted. Please wait or check settings.";
    private static final long POLL_INTERVAL_MS = 10_000;

    @Test
    void testSubmit_RateLimitedTwice_SucceedsAfterTwoBackoffWaits() {
        // Given: submit fails with 429 twice, then the render completes on the first poll
        client.onSubmit(RemoteStep.failing(rateLimited()))
            .onSubmit(RemoteStep.failing(rateLimited()));
        scriptSuccessfulRender("operations/retry-1", 0);

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then: succeeded after exactly two backoff waits and one poll wait
        assertTrue(outcome.isSucceeded(), "Expected success but was " + outcome);
        assertEquals(VIDEO, ((Succeeded) outcome).artifact());
        assertEquals(3, client.getSubmitCount());
        assertEquals(List.of(5_000L, 10_000L, POLL_INTERVAL_MS), sleeper.getSleeps());
        assertTrue(listener.getStatuses().contains("Pending (Quota)..."),
            "Retry should be reported as a quota wait: " + listener.getStatuses());
        assertEquals("Completed.", listener.lastStatus());
    }

    @Test
    void testSubmit_RateLimitedBeyondBudget_FailsWithQuotaMessage() {
        // Given: every attempt is rate limited
        int maxAttempts = new RetryPolicy().maxAttempts();
        for (int i = 0; i < maxAttempts + 2; i++) {
            client.onSubmit(RemoteStep.failing(rateLimited()));
        }

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then: one call per attempt, one wait between attempts, no polling
        assertTrue(outcome.isFailed());
        Failed failed = (Failed) outcome;
        assertEquals(FailureKind.RATE_LIMITED, failed.kind());
        assertEquals(QUOTA_MESSAGE, failed.userMessage());
        assertEquals(maxAttempts, client.getSubmitCount());
        assertEquals(0, client.getPollCount());

        List<Long> waits = sleeper.getSleeps();
        assertEquals(maxAttempts - 1, waits.size());
        RetryPolicy policy = new RetryPolicy();
        for (int i = 0; i < waits.size(); i++) {
            long expected = Math.min(policy.baseDelayMs() * (1L << i), policy.maxDelayMs());
            assertEquals(expected, waits.get(i), "Unexpected backoff for retry #" + (i + 1));
            assertTrue(waits.get(i) <= policy.maxDelayMs() + policy.maxJitterMs());
        }
    }

    @Test
    void testSubmit_DailyQuotaSentinel_FailsWithoutRetry() {
        // Given
        client.onSubmit(RemoteStep.failing(new SynthesisException(429, "RESOURCE_EXHAUSTED",
            ErrorClassifier.DAILY_QUOTA_SENTINEL + ": daily generation limit reached")));

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then
        assertTrue(outcome.isFailed());
        assertEquals(FailureKind.QUOTA_EXHAUSTED, ((Failed) outcome).kind());
        assertEquals(QUOTA_MESSAGE, ((Failed) outcome).userMessage());
        assertEquals(1, client.getSubmitCount());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void testSubmit_FatalFailure_SurfacesMessageWithoutRetry() {
        // Given
        client.onSubmit(RemoteStep.failing(new SynthesisException(400, "INVALID_ARGUMENT",
            "Prompt was blocked by the safety filter")));

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then
        assertTrue(outcome.isFailed());
        Failed failed = (Failed) outcome;
        assertEquals(FailureKind.FATAL, failed.kind());
        assertEquals("Prompt was blocked by the safety filter", failed.userMessage());
        assertEquals(1, client.getSubmitCount());
        assertTrue(sleeper.getSleeps().isEmpty());
        assertEquals(0, credentialResync.getInvocationCount());
    }

    @Test
    void testPoll_RateLimited_RetriedInsidePollLoop() {
        // Given: first poll is rate limited, the retried poll reports completion
        OpId id = OpId.of("operations/retry-poll");
        ArtifactRef ref = ArtifactRef.of("https://files.example.com/v1beta/files/retry-poll:download?alt=media");
        client.onSubmit(RemoteStep.returning(Operation.pending(id)))
            .onPoll(RemoteStep.failing(rateLimited()))
            .onPoll(RemoteStep.returning(Operation.succeeded(id, ref)));
        fetcher.register(ref, VIDEO);

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then: poll wait, backoff wait, then success
        assertTrue(outcome.isSucceeded(), "Expected success but was " + outcome);
        assertEquals(ref, ((Succeeded) outcome).source());
        assertEquals(2, client.getPollCount());
        assertEquals(List.of(POLL_INTERVAL_MS, 5_000L), sleeper.getSleeps());
    }
}
