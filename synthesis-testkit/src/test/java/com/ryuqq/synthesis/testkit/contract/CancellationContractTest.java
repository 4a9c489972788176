package com.ryuqq.synthesis.testkit.contract;

import com.ryuqq.synthesis.adapter.inmemory.client.RemoteStep;
import com.ryuqq.synthesis.application.orchestrator.TaskHandle;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.model.OpId;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for cancellation.
 *
 * <p>Validates that an aborted task ends as CANCELLED no matter which stage it was in, and
 * that nothing is called remotely after the abort is observed.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Abort before start: no remote call at all</li>
 *   <li>Abort during a backoff wait: no further submit</li>
 *   <li>Abort mid-poll: no download, progress stopped below 100</li>
 *   <li>Cancel through a {@link TaskHandle} while the worker is waiting</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractContractTest {

    @Test
    void testRun_AbortedBeforeStart_MakesNoRemoteCalls() {
        // Given
        scriptSuccessfulRender("operations/never", 0);
        CancellationToken token = new CancellationToken();
        token.abort();

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), token, listener);

        // Then
        assertTrue(outcome.isCancelled());
        assertEquals(0, client.getSubmitCount());
        assertEquals(0, client.getPollCount());
        assertEquals(0, fetcher.getFetchCount());
        assertEquals("Operation cancelled.", listener.lastStatus());
        assertSame(outcome, assertSingleOutcome());
    }

    @Test
    void testRun_AbortedDuringBackoff_StopsRetrying() {
        // Given: submit is rate limited and the task is aborted while waiting to retry
        client.onSubmit(RemoteStep.failing(rateLimited()));
        scriptSuccessfulRender("operations/backoff", 0);
        sleeper.onSleep(CancellationToken::abort);

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then
        assertTrue(outcome.isCancelled(), "Expected cancellation but was " + outcome);
        assertEquals(1, client.getSubmitCount());
        assertEquals(1, sleeper.getSleeps().size());
        assertEquals(0, client.getPollCount());
    }

    @Test
    void testRun_AbortedMidPoll_SkipsDownloadAndStopsProgress() {
        // Given: the second poll observes the abort request
        OpId id = OpId.of("operations/mid-poll");
        client.onSubmit(RemoteStep.returning(Operation.pending(id)))
            .pendingPolls(1)
            .onPoll((operation, token) -> {
                token.abort();
                return Operation.pending(operation.id());
            });

        // When
        TaskOutcome outcome = orchestrator.run(videoTask(), new CancellationToken(), listener);

        // Then
        assertTrue(outcome.isCancelled(), "Expected cancellation but was " + outcome);
        assertEquals(2, client.getPollCount());
        assertEquals(0, fetcher.getFetchCount());
        assertProgressInvariants(false);
        assertTrue(listener.lastEstimate().percent() < 99);
    }

    @Test
    void testHandle_CancelWhileWaiting_ResolvesCancelled() throws Exception {
        // Given: the worker blocks inside its first poll wait until released
        scriptSuccessfulRender("operations/handle", 3);
        CountDownLatch waiting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        sleeper.onSleep(token -> {
            waiting.countDown();
            awaitQuietly(release);
        });

        // When
        TaskHandle handle = orchestrator.submit(videoTask(), listener);
        assertTrue(waiting.await(5, TimeUnit.SECONDS), "Worker never reached the poll wait");
        handle.cancel();
        release.countDown();
        TaskOutcome outcome = handle.await();

        // Then
        assertTrue(handle.isCancellationRequested());
        assertTrue(outcome.isCancelled(), "Expected cancellation but was " + outcome);
        assertEquals(0, client.getPollCount());
        assertEquals(0, fetcher.getFetchCount());
        assertSame(outcome, assertSingleOutcome());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Latch was not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting", e);
        }
    }
}
