/**
 * HTTP Adapter Layer - Generative Language REST 연동.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.adapter.http.GenerativeLanguageClient} - SynthesisClient (OkHttp + Jackson)</li>
 *   <li>{@link com.ryuqq.synthesis.adapter.http.HttpArtifactFetcher} - 결과 미디어 다운로드</li>
 *   <li>{@link com.ryuqq.synthesis.adapter.http.EnvironmentApiKeyProvider} - API_KEY 환경 변수</li>
 * </ul>
 *
 * <p>진행 중인 요청은 취소 토큰이 abort되면 즉시 취소됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.synthesis.adapter.http;
