package com.ryuqq.synthesis.adapter.inmemory.credential;

import com.ryuqq.synthesis.core.spi.CredentialResync;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CredentialResync} that counts selector invocations.
 *
 * <p>An optional action runs on each invocation. Tests use it to rotate the key held by
 * {@link InMemoryApiKeyProvider} or to simulate a selector that fails.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingCredentialResync implements CredentialResync {

    private final AtomicInteger invocations = new AtomicInteger();
    private final Runnable action;

    public RecordingCredentialResync() {
        this(() -> { });
    }

    /**
     * @param action runs on every selector invocation
     */
    public RecordingCredentialResync(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        this.action = action;
    }

    @Override
    public void openCredentialSelector() {
        invocations.incrementAndGet();
        action.run();
    }

    public int getInvocationCount() {
        return invocations.get();
    }
}
