package com.ryuqq.synthesis.core.outcome;

import com.ryuqq.synthesis.core.error.FailureInfo;
import com.ryuqq.synthesis.core.error.FailureKind;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.MediaBlob;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskOutcome 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskOutcomeTest {

    @Test
    void succeeded_IsSucceeded() {
        TaskOutcome outcome = Succeeded.of(new MediaBlob(new byte[]{1}, "video/mp4"), ArtifactRef.of("https://x/y"));

        assertTrue(outcome.isSucceeded());
        assertFalse(outcome.isFailed());
        assertFalse(outcome.isCancelled());
        assertTrue(((Succeeded) outcome).segments().isEmpty());
    }

    @Test
    void failed_ExposesKind() {
        Failed failed = new Failed(FailureInfo.of(FailureKind.FATAL, "boom"), "boom");

        assertTrue(failed.isFailed());
        assertEquals(FailureKind.FATAL, failed.kind());
        assertEquals("boom", failed.statusMessage());
    }

    @Test
    void failed_WithCancelledKind_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Failed(FailureInfo.of(FailureKind.CANCELLED, "cancelled"), "cancelled")
        );
        assertTrue(exception.getMessage().contains("Cancelled"));
    }

    @Test
    void cancelled_DefaultStatusIsNeutral() {
        Cancelled cancelled = Cancelled.of();

        assertTrue(cancelled.isCancelled());
        assertEquals("Operation cancelled.", cancelled.statusMessage());
    }
}
