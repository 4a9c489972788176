package com.ryuqq.synthesis.adapter.inmemory.credential;

import com.ryuqq.synthesis.core.spi.ApiKeyProvider;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable {@link ApiKeyProvider}.
 *
 * <p>The key is read on every call, so a key replaced after a credential resync is picked
 * up by the next task without rebuilding the orchestrator.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryApiKeyProvider implements ApiKeyProvider {

    private final AtomicReference<String> key;

    public InMemoryApiKeyProvider() {
        this("");
    }

    /**
     * @param initialKey initial key, empty for "not configured"
     */
    public InMemoryApiKeyProvider(String initialKey) {
        if (initialKey == null) {
            throw new IllegalArgumentException("initialKey cannot be null");
        }
        this.key = new AtomicReference<>(initialKey);
    }

    @Override
    public String currentKey() {
        return key.get();
    }

    /**
     * Replaces the current key.
     *
     * @param newKey the new key
     */
    public void set(String newKey) {
        if (newKey == null) {
            throw new IllegalArgumentException("newKey cannot be null");
        }
        key.set(newKey);
    }
}
