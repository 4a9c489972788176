package com.ryuqq.synthesis.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.cancel.CancelledException;
import com.ryuqq.synthesis.core.error.ErrorClassifier;
import com.ryuqq.synthesis.core.error.FailureKind;
import com.ryuqq.synthesis.core.error.SynthesisException;
import com.ryuqq.synthesis.core.model.AspectRatio;
import com.ryuqq.synthesis.core.model.GenerationRequest;
import com.ryuqq.synthesis.core.model.ImageEditRequest;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;
import com.ryuqq.synthesis.core.model.OpId;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.model.Resolution;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GenerativeLanguageClient 유닛 테스트 (MockWebServer).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GenerativeLanguageClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private GenerativeLanguageClient client;
    private CancellationToken token;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        GenerativeLanguageConfig config = new GenerativeLanguageConfig().withBaseUrl(server.url("/v1beta/").toString());
        client = new GenerativeLanguageClient(config, () -> "test-key");
        token = new CancellationToken();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    // ============================================================
    // 1. submit / poll
    // ============================================================

    @Test
    void submit은_predictLongRunning으로_요청한다() throws Exception {
        // given
        server.enqueue(json("{\"name\":\"models/veo-3.1-generate-preview/operations/op-1\"}"));
        MediaBlob logo = new MediaBlob(new byte[]{1, 2, 3}, "image/png");
        GenerationRequest request = new GenerationRequest(
            "veo-3.1-generate-preview", "logo reveal", logo, AspectRatio.PORTRAIT, Resolution.FULL_HD);

        // when
        Operation operation = client.submit(request, token);

        // then
        assertThat(operation.id()).isEqualTo(OpId.of("models/veo-3.1-generate-preview/operations/op-1"));
        assertThat(operation.done()).isFalse();

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/veo-3.1-generate-preview:predictLongRunning");
        assertThat(recorded.getHeader("x-goog-api-key")).isEqualTo("test-key");

        JsonNode body = MAPPER.readTree(recorded.getBody().readUtf8());
        JsonNode instance = body.path("instances").path(0);
        assertThat(instance.path("prompt").asText()).isEqualTo("logo reveal");
        assertThat(instance.path("image").path("bytesBase64Encoded").asText())
            .isEqualTo(Base64.getEncoder().encodeToString(new byte[]{1, 2, 3}));
        assertThat(body.path("parameters").path("aspectRatio").asText()).isEqualTo("9:16");
        assertThat(body.path("parameters").path("resolution").asText()).isEqualTo("1080p");
    }

    @Test
    void poll은_완료된_영상_URI를_해석한다() throws Exception {
        // given
        server.enqueue(json("{\"name\":\"models/m/operations/op-2\",\"done\":true,\"response\":"
            + "{\"generateVideoResponse\":{\"generatedSamples\":[{\"video\":"
            + "{\"uri\":\"https://files.example.com/v1beta/files/abc:download?alt=media\"}}]}}}"));

        // when
        Operation operation = client.poll(Operation.pending(OpId.of("models/m/operations/op-2")), token);

        // then
        assertThat(operation.done()).isTrue();
        assertThat(operation.result().uri().toString())
            .isEqualTo("https://files.example.com/v1beta/files/abc:download?alt=media");
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/m/operations/op-2");
    }

    @Test
    void poll은_오류_페이로드를_보존한다() {
        // given
        server.enqueue(json("{\"name\":\"models/m/operations/op-3\",\"done\":true,"
            + "\"error\":{\"code\":3,\"message\":\"Prompt was blocked\"}}"));

        // when
        Operation operation = client.poll(Operation.pending(OpId.of("models/m/operations/op-3")), token);

        // then
        assertThat(operation.hasError()).isTrue();
        assertThat(operation.error().code()).isEqualTo(3);
        assertThat(operation.error().message()).isEqualTo("Prompt was blocked");
    }

    @Test
    void 영상_없이_완료된_응답은_결과_없는_Operation() {
        // given
        server.enqueue(json("{\"name\":\"models/m/operations/op-4\",\"done\":true,\"response\":{}}"));

        // when
        Operation operation = client.poll(Operation.pending(OpId.of("models/m/operations/op-4")), token);

        // then
        assertThat(operation.done()).isTrue();
        assertThat(operation.result()).isNull();
        assertThat(operation.hasError()).isFalse();
    }

    // ============================================================
    // 2. 오류 매핑
    // ============================================================

    @Test
    void _429_응답은_재시도_가능한_예외() {
        // given
        server.enqueue(new MockResponse().setResponseCode(429).setBody(
            "{\"error\":{\"code\":429,\"message\":\"Resource has been exhausted\",\"status\":\"RESOURCE_EXHAUSTED\"}}"));

        // when / then
        assertThatThrownBy(() -> client.poll(Operation.pending(OpId.of("models/m/operations/op-5")), token))
            .isInstanceOfSatisfying(SynthesisException.class, e -> {
                assertThat(e.getHttpStatus()).isEqualTo(429);
                assertThat(e.getCode()).isEqualTo("RESOURCE_EXHAUSTED");
                assertThat(ErrorClassifier.classify(e)).isEqualTo(FailureKind.RATE_LIMITED);
            });
    }

    @Test
    void 엔티티_없음_응답은_재인증_분류() {
        // given
        server.enqueue(new MockResponse().setResponseCode(404).setBody(
            "{\"error\":{\"code\":404,\"message\":\"Requested entity was not found.\",\"status\":\"NOT_FOUND\"}}"));

        // when / then
        assertThatThrownBy(() -> client.poll(Operation.pending(OpId.of("models/m/operations/op-6")), token))
            .isInstanceOfSatisfying(SynthesisException.class,
                e -> assertThat(ErrorClassifier.classify(e)).isEqualTo(FailureKind.AUTH_REQUIRED));
    }

    @Test
    void JSON이_아닌_오류_본문도_상태_코드를_보존한다() {
        // given
        server.enqueue(new MockResponse().setResponseCode(502).setBody("<html>bad gateway</html>"));

        // when / then
        assertThatThrownBy(() -> client.poll(Operation.pending(OpId.of("models/m/operations/op-7")), token))
            .isInstanceOfSatisfying(SynthesisException.class, e -> {
                assertThat(e.getHttpStatus()).isEqualTo(502);
                assertThat(e.getMessage()).startsWith("HTTP 502");
            });
    }

    @Test
    void API_키가_없으면_재인증이_필요하다() {
        // given
        GenerativeLanguageClient keyless = new GenerativeLanguageClient(
            new GenerativeLanguageConfig().withBaseUrl(server.url("/v1beta/").toString()), () -> null);

        // when / then
        assertThatThrownBy(() -> keyless.poll(Operation.pending(OpId.of("models/m/operations/op-8")), token))
            .isInstanceOfSatisfying(SynthesisException.class,
                e -> assertThat(ErrorClassifier.classify(e)).isEqualTo(FailureKind.AUTH_REQUIRED));
        assertThat(server.getRequestCount()).isZero();
    }

    // ============================================================
    // 3. 취소
    // ============================================================

    @Test
    void 이미_abort된_토큰은_요청하지_않는다() {
        // given
        token.abort();

        // when / then
        assertThatThrownBy(() -> client.poll(Operation.pending(OpId.of("models/m/operations/op-9")), token))
            .isInstanceOf(CancelledException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void 진행_중_요청은_abort로_취소된다() throws Exception {
        // given
        server.enqueue(json("{\"name\":\"models/m/operations/op-10\"}").setBodyDelay(10, TimeUnit.SECONDS));
        CompletableFuture<Throwable> failure = CompletableFuture.supplyAsync(() -> {
            try {
                client.poll(Operation.pending(OpId.of("models/m/operations/op-10")), token);
                return null;
            } catch (RuntimeException e) {
                return e;
            }
        });
        server.takeRequest(5, TimeUnit.SECONDS);

        // when
        token.abort();

        // then
        assertThat(failure.get(5, TimeUnit.SECONDS)).isInstanceOf(CancelledException.class);
    }

    @Test
    void 연결_실패는_치명적_오류() throws IOException {
        // given
        MockWebServer dead = new MockWebServer();
        dead.start();
        String deadUrl = dead.url("/v1beta/").toString();
        dead.shutdown();
        GenerativeLanguageClient unreachable = new GenerativeLanguageClient(
            new GenerativeLanguageConfig().withBaseUrl(deadUrl), () -> "test-key");

        // when / then
        assertThatThrownBy(() -> unreachable.poll(Operation.pending(OpId.of("models/m/operations/op-11")), token))
            .isInstanceOfSatisfying(SynthesisException.class, e -> {
                assertThat(e).isNotInstanceOf(CancelledException.class);
                assertThat(ErrorClassifier.classify(e)).isEqualTo(FailureKind.FATAL);
            });
    }

    // ============================================================
    // 4. generateContent
    // ============================================================

    @Test
    void 이미지_편집은_inlineData를_반환한다() throws Exception {
        // given
        String edited = Base64.getEncoder().encodeToString(new byte[]{7, 7});
        server.enqueue(json("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"done\"},"
            + "{\"inlineData\":{\"mimeType\":\"image/png\",\"data\":\"" + edited + "\"}}]}}]}"));
        ImageEditRequest request = new ImageEditRequest(
            "gemini-2.5-flash-image", new MediaBlob(new byte[]{1}, "image/png"), "Task: sharpen");

        // when
        MediaBlob result = client.editImage(request, token);

        // then
        assertThat(result.data()).containsExactly(new byte[]{7, 7});
        assertThat(result.mimeType()).isEqualTo("image/png");
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/gemini-2.5-flash-image:generateContent");
        JsonNode parts = MAPPER.readTree(recorded.getBody().readUtf8()).path("contents").path(0).path("parts");
        assertThat(parts.path(1).path("text").asText()).isEqualTo("Task: sharpen");
    }

    @Test
    void 이미지가_없는_응답은_오류() {
        // given
        server.enqueue(json("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"sorry\"}]}}]}"));
        ImageEditRequest request = new ImageEditRequest(
            "gemini-2.5-flash-image", new MediaBlob(new byte[]{1}, "image/png"), "Task: sharpen");

        // when / then
        assertThatThrownBy(() -> client.editImage(request, token))
            .isInstanceOf(SynthesisException.class)
            .hasMessage("No image data returned from model");
    }

    @Test
    void 몽타주_분석은_JSON_구간을_해석한다() throws Exception {
        // given
        String segments = "[{\\\"start_timestamp\\\":\\\"00:02\\\",\\\"end_timestamp\\\":\\\"00:05\\\","
            + "\\\"visual_description\\\":\\\"drone shot over cliffs\\\"}]";
        server.enqueue(json("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"" + segments + "\"}]}}]}"));

        // when
        List<MontageSegment> result = client.analyzeMontage(
            List.of(new MediaBlob(new byte[]{5}, "video/mp4")), token);

        // then
        assertThat(result).containsExactly(new MontageSegment("00:02", "00:05", "drone shot over cliffs"));
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1beta/models/gemini-3-pro-preview:generateContent");
        JsonNode body = MAPPER.readTree(recorded.getBody().readUtf8());
        assertThat(body.path("generationConfig").path("responseMimeType").asText()).isEqualTo("application/json");
    }

    @Test
    void 몽타주_분석_출력이_JSON이_아니면_빈_목록() {
        assertThat(client.parseSegments("not json at all")).isEmpty();
        assertThat(client.parseSegments("{\"start_timestamp\":\"00:01\"}")).isEmpty();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
