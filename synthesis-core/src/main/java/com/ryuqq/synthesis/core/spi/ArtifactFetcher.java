package com.ryuqq.synthesis.core.spi;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.model.MediaBlob;

import java.net.URI;

/**
 * 결과물 다운로드 SPI (HTTP GET).
 *
 * <p>URI에는 이미 인증 파라미터가 붙어 있어야 합니다.
 * 429 응답은 httpStatus=429인 {@link com.ryuqq.synthesis.core.error.SynthesisException}으로,
 * 그 외 2xx가 아닌 응답은 상태 코드와 함께 실패로 보고합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ArtifactFetcher {

    /**
     * 결과물 다운로드.
     *
     * @param uri 인증 파라미터가 포함된 다운로드 URI
     * @param token 취소 토큰
     * @return 결과물 바이트
     */
    MediaBlob fetch(URI uri, CancellationToken token);
}
