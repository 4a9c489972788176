package com.ryuqq.synthesis.adapter.inmemory.fetch;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.cancel.CancelledException;
import com.ryuqq.synthesis.core.error.SynthesisException;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.MediaBlob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryArtifactFetcher}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryArtifactFetcherTest {

    private static final ArtifactRef REF = ArtifactRef.of("https://files.example.com/v1/files/abc:download?alt=media");
    private static final MediaBlob VIDEO = new MediaBlob(new byte[]{0, 0, 0, 24}, "video/mp4");

    private InMemoryArtifactFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new InMemoryArtifactFetcher().register(REF, VIDEO);
    }

    @Test
    void testFetch_WithAuthParameter_MatchesRegisteredLocation() {
        URI authorized = REF.withQueryParameter("key", "secret");

        MediaBlob blob = fetcher.fetch(authorized, new CancellationToken());

        assertEquals(VIDEO, blob);
        assertEquals(List.of(authorized), fetcher.getFetchedUris());
    }

    @Test
    void testFetch_UnknownLocation_ThrowsNotFound() {
        URI unknown = URI.create("https://files.example.com/v1/files/missing");

        SynthesisException e = assertThrows(SynthesisException.class,
            () -> fetcher.fetch(unknown, new CancellationToken()));

        assertEquals(404, e.getHttpStatus());
        assertEquals("NOT_FOUND", e.getCode());
        assertEquals(1, fetcher.getFetchCount());
    }

    @Test
    void testFetch_AbortedToken_ThrowsCancelledWithoutRecording() {
        CancellationToken token = new CancellationToken();
        token.abort();

        assertThrows(CancelledException.class, () -> fetcher.fetch(REF.uri(), token));
        assertEquals(0, fetcher.getFetchCount());
    }

    @Test
    void testClear_RemovesRegistrations() {
        fetcher.clear();

        assertThrows(SynthesisException.class, () -> fetcher.fetch(REF.uri(), new CancellationToken()));
    }
}
