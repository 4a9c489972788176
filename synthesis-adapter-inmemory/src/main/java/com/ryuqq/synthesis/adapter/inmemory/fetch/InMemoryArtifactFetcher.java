package com.ryuqq.synthesis.adapter.inmemory.fetch;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.error.SynthesisException;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.spi.ArtifactFetcher;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link ArtifactFetcher} serving registered artifacts.
 *
 * <p>Artifacts are registered by their bare location. A fetch URI matches a registration
 * when it starts with the registered location, so the auth query parameter appended by the
 * orchestrator does not affect lookup. Fetched URIs are recorded verbatim, which lets tests
 * assert on the parameter itself.</p>
 *
 * <p>An unknown location fails with HTTP 404, mirroring a missing remote file.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryArtifactFetcher implements ArtifactFetcher {

    private final Map<String, MediaBlob> artifacts = new ConcurrentHashMap<>();
    private final List<URI> fetched = new CopyOnWriteArrayList<>();

    /**
     * Registers the bytes served for an artifact location.
     *
     * @param ref the artifact location
     * @param media the bytes to serve
     * @return this fetcher
     */
    public InMemoryArtifactFetcher register(ArtifactRef ref, MediaBlob media) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (media == null) {
            throw new IllegalArgumentException("media cannot be null");
        }
        artifacts.put(ref.uri().toString(), media);
        return this;
    }

    @Override
    public MediaBlob fetch(URI uri, CancellationToken token) {
        token.throwIfAborted();
        fetched.add(uri);
        String requested = uri.toString();
        return artifacts.entrySet().stream()
            .filter(entry -> requested.startsWith(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElseThrow(() -> new SynthesisException(404, "NOT_FOUND", "Artifact not found: " + requested));
    }

    /**
     * Returns fetched URIs in call order, query parameters included.
     *
     * @return snapshot of fetched URIs
     */
    public List<URI> getFetchedUris() {
        return new ArrayList<>(fetched);
    }

    public int getFetchCount() {
        return fetched.size();
    }

    public void clear() {
        artifacts.clear();
        fetched.clear();
    }
}
