package com.ryuqq.synthesis.core.model;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 완료된 Operation이 가리키는 최종 미디어의 위치.
 *
 * <p>원격 서비스의 다운로드 URI는 인증 파라미터 없이 내려오므로,
 * 실제 요청 전에 {@link #withQueryParameter(String, String)}로 인증 값을 덧붙여야 합니다.</p>
 *
 * @param uri 미디어 다운로드 URI
 * @param mimeType 미디어 타입 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ArtifactRef(
    URI uri,
    String mimeType
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException uri가 null이거나 절대 URI가 아닌 경우
     */
    public ArtifactRef {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("uri must be absolute (current: " + uri + ")");
        }
        // mimeType은 null 허용
    }

    /**
     * 문자열 URI로 생성.
     *
     * @param uri 미디어 다운로드 URI
     * @return ArtifactRef 인스턴스
     * @throws IllegalArgumentException uri가 올바른 URI가 아닌 경우
     */
    public static ArtifactRef of(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        return new ArtifactRef(URI.create(uri), null);
    }

    /**
     * 쿼리 파라미터를 덧붙인 URI 생성.
     *
     * <p>기존 쿼리가 있으면 {@code &}, 없으면 {@code ?}로 연결합니다. 값은 URL 인코딩됩니다.</p>
     *
     * @param name 파라미터 이름
     * @param value 파라미터 값
     * @return 파라미터가 추가된 URI
     * @throws IllegalArgumentException name 또는 value가 null이거나 name이 빈 문자열인 경우
     */
    public URI withQueryParameter(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        String base = uri.toString();
        String fragment = "";
        int hash = base.indexOf('#');
        if (hash >= 0) {
            fragment = base.substring(hash);
            base = base.substring(0, hash);
        }
        String separator = uri.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator
            + URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(value, StandardCharsets.UTF_8) + fragment);
    }
}
