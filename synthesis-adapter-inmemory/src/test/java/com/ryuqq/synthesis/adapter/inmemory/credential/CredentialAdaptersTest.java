package com.ryuqq.synthesis.adapter.inmemory.credential;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryApiKeyProvider} and {@link RecordingCredentialResync}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CredentialAdaptersTest {

    @Test
    void testApiKeyProvider_DefaultsToEmptyAndReflectsUpdates() {
        InMemoryApiKeyProvider keys = new InMemoryApiKeyProvider();
        assertEquals("", keys.currentKey());

        keys.set("rotated");

        assertEquals("rotated", keys.currentKey());
        assertThrows(IllegalArgumentException.class, () -> keys.set(null));
    }

    @Test
    void testResync_CountsInvocationsAndRunsAction() {
        InMemoryApiKeyProvider keys = new InMemoryApiKeyProvider("stale");
        RecordingCredentialResync resync = new RecordingCredentialResync(() -> keys.set("fresh"));

        resync.openCredentialSelector();
        resync.openCredentialSelector();

        assertEquals(2, resync.getInvocationCount());
        assertEquals("fresh", keys.currentKey());
    }

    @Test
    void testResync_FailingActionPropagatesAfterCounting() {
        RecordingCredentialResync resync = new RecordingCredentialResync(() -> {
            throw new IllegalStateException("selector closed");
        });

        assertThrows(IllegalStateException.class, resync::openCredentialSelector);
        assertEquals(1, resync.getInvocationCount());
    }
}
