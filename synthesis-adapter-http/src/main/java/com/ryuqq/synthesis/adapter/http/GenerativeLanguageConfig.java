package com.ryuqq.synthesis.adapter.http;

import java.util.Map;

/**
 * Generative Language REST 클라이언트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: API 기본 URL (기본 https://generativelanguage.googleapis.com/v1beta/)</li>
 *   <li>analysisModel: 몽타주 분석 모델 (기본 gemini-3-pro-preview)</li>
 *   <li>connectTimeoutMs: 연결 타임아웃 (기본 10000ms)</li>
 *   <li>readTimeoutMs: 읽기/쓰기 타임아웃 (기본 120000ms, 영상 업로드/다운로드 포함)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param baseUrl API 기본 URL ('/'로 끝나도록 정규화)
 * @param analysisModel 몽타주 분석 모델
 * @param connectTimeoutMs 연결 타임아웃 (밀리초, 양수)
 * @param readTimeoutMs 읽기 타임아웃 (밀리초, 양수)
 */
public record GenerativeLanguageConfig(
    String baseUrl,
    String analysisModel,
    long connectTimeoutMs,
    long readTimeoutMs
) {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/";
    public static final String DEFAULT_ANALYSIS_MODEL = "gemini-3-pro-preview";

    static final String ENV_BASE_URL = "SYNTHESIS_BASE_URL";
    static final String ENV_ANALYSIS_MODEL = "SYNTHESIS_ANALYSIS_MODEL";

    /**
     * 기본 설정 생성자.
     */
    public GenerativeLanguageConfig() {
        this(DEFAULT_BASE_URL, DEFAULT_ANALYSIS_MODEL, 10000, 120000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GenerativeLanguageConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new IllegalArgumentException("baseUrl must be an http(s) URL (current: " + baseUrl + ")");
        }
        if (analysisModel == null || analysisModel.isBlank()) {
            throw new IllegalArgumentException("analysisModel cannot be null or blank");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")"
            );
        }
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "readTimeoutMs must be positive (current: " + readTimeoutMs + ")"
            );
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    /**
     * 환경 변수에서 설정 생성.
     *
     * <p>SYNTHESIS_BASE_URL, SYNTHESIS_ANALYSIS_MODEL을 읽고, 없으면 기본값을 사용합니다.</p>
     *
     * @param env 환경 변수 (보통 {@code System.getenv()})
     * @return 설정
     */
    public static GenerativeLanguageConfig fromEnvironment(Map<String, String> env) {
        GenerativeLanguageConfig config = new GenerativeLanguageConfig();
        String baseUrl = env.get(ENV_BASE_URL);
        if (baseUrl != null && !baseUrl.isBlank()) {
            config = config.withBaseUrl(baseUrl.trim());
        }
        String analysisModel = env.get(ENV_ANALYSIS_MODEL);
        if (analysisModel != null && !analysisModel.isBlank()) {
            config = config.withAnalysisModel(analysisModel.trim());
        }
        return config;
    }

    public GenerativeLanguageConfig withBaseUrl(String baseUrl) {
        return new GenerativeLanguageConfig(baseUrl, analysisModel, connectTimeoutMs, readTimeoutMs);
    }

    public GenerativeLanguageConfig withAnalysisModel(String analysisModel) {
        return new GenerativeLanguageConfig(baseUrl, analysisModel, connectTimeoutMs, readTimeoutMs);
    }

    public GenerativeLanguageConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new GenerativeLanguageConfig(baseUrl, analysisModel, connectTimeoutMs, readTimeoutMs);
    }

    public GenerativeLanguageConfig withReadTimeoutMs(long readTimeoutMs) {
        return new GenerativeLanguageConfig(baseUrl, analysisModel, connectTimeoutMs, readTimeoutMs);
    }
}
