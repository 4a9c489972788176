package com.ryuqq.synthesis.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.spi.ArtifactFetcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * 생성된 미디어를 HTTP GET으로 내려받는 ArtifactFetcher.
 *
 * <p>인증 파라미터는 호출자가 URI에 이미 추가한 상태여야 합니다.
 * 429 응답은 httpStatus 429인 SynthesisException으로 보고되어 재시도 대상이 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpArtifactFetcher implements ArtifactFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactFetcher.class);
    private static final String DEFAULT_MIME_TYPE = "video/mp4";

    private final CancellableHttp http;

    public HttpArtifactFetcher(GenerativeLanguageConfig config) {
        this(GenerativeLanguageClient.newHttpClient(config));
    }

    /**
     * 생성자 (OkHttpClient 주입).
     *
     * <p>리다이렉트를 따라가도록 설정된 클라이언트여야 합니다 (OkHttp 기본값).</p>
     *
     * @param httpClient OkHttp 클라이언트
     */
    public HttpArtifactFetcher(OkHttpClient httpClient) {
        this.http = new CancellableHttp(httpClient, new ObjectMapper());
    }

    @Override
    public MediaBlob fetch(URI uri, CancellationToken token) {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        Request request = new Request.Builder().url(uri.toString()).get().build();
        CancellableHttp.Payload payload = http.execute(request, token);
        String mimeType = mimeTypeOf(payload.contentType());
        log.info("Fetched artifact ({} bytes, {})", payload.bytes().length, mimeType);
        return new MediaBlob(payload.bytes(), mimeType);
    }

    private static String mimeTypeOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return DEFAULT_MIME_TYPE;
        }
        int semicolon = contentType.indexOf(';');
        String mimeType = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
        return mimeType.isEmpty() || "application/octet-stream".equals(mimeType) ? DEFAULT_MIME_TYPE : mimeType;
    }
}
