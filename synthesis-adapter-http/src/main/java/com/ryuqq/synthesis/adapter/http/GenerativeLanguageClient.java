package com.ryuqq.synthesis.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.error.ErrorClassifier;
import com.ryuqq.synthesis.core.error.SynthesisException;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.GenerationRequest;
import com.ryuqq.synthesis.core.model.ImageEditRequest;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;
import com.ryuqq.synthesis.core.model.OpId;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.model.OperationError;
import com.ryuqq.synthesis.core.spi.ApiKeyProvider;
import com.ryuqq.synthesis.core.spi.SynthesisClient;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Generative Language REST API 클라이언트.
 *
 * <p><strong>엔드포인트:</strong></p>
 * <ul>
 *   <li>submit: POST models/{model}:predictLongRunning</li>
 *   <li>poll: GET {operation name}</li>
 *   <li>editImage / analyzeMontage: POST models/{model}:generateContent</li>
 * </ul>
 *
 * <p>모든 요청은 x-goog-api-key 헤더로 인증합니다. 키가 없으면 자격 증명 재선택이 필요한
 * 실패로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GenerativeLanguageClient implements SynthesisClient {

    private static final Logger log = LoggerFactory.getLogger(GenerativeLanguageClient.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String API_KEY_HEADER = "x-goog-api-key";

    static final String MONTAGE_ANALYSIS_INSTRUCTION =
        "Analyze these video clips and identify cinematic highlights. "
            + "Return a list of segments with start_timestamp, end_timestamp, "
            + "and visual_description in JSON format.";

    private final GenerativeLanguageConfig config;
    private final ApiKeyProvider apiKeyProvider;
    private final CancellableHttp http;

    /**
     * 생성자 (기본 OkHttpClient, ObjectMapper).
     *
     * @param config 클라이언트 설정
     * @param apiKeyProvider API 키 공급자
     */
    public GenerativeLanguageClient(GenerativeLanguageConfig config, ApiKeyProvider apiKeyProvider) {
        this(config, apiKeyProvider, newHttpClient(config), new ObjectMapper());
    }

    /**
     * 생성자 (OkHttpClient, ObjectMapper 주입).
     *
     * @param config 클라이언트 설정
     * @param apiKeyProvider API 키 공급자
     * @param httpClient OkHttp 클라이언트
     * @param objectMapper Jackson ObjectMapper
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public GenerativeLanguageClient(GenerativeLanguageConfig config, ApiKeyProvider apiKeyProvider,
                                    OkHttpClient httpClient, ObjectMapper objectMapper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (apiKeyProvider == null) {
            throw new IllegalArgumentException("apiKeyProvider cannot be null");
        }
        this.config = config;
        this.apiKeyProvider = apiKeyProvider;
        this.http = new CancellableHttp(httpClient, objectMapper);
    }

    /**
     * 설정의 타임아웃을 적용한 OkHttpClient 생성.
     *
     * @param config 클라이언트 설정
     * @return OkHttpClient
     */
    public static OkHttpClient newHttpClient(GenerativeLanguageConfig config) {
        return new OkHttpClient.Builder()
            .connectTimeout(config.connectTimeoutMs(), TimeUnit.MILLISECONDS)
            .readTimeout(config.readTimeoutMs(), TimeUnit.MILLISECONDS)
            .writeTimeout(config.readTimeoutMs(), TimeUnit.MILLISECONDS)
            .build();
    }

    @Override
    public Operation submit(GenerationRequest request, CancellationToken token) {
        ObjectNode body = mapper().createObjectNode();
        ObjectNode instance = body.putArray("instances").addObject();
        instance.put("prompt", request.prompt());
        if (request.hasImage()) {
            ObjectNode image = instance.putObject("image");
            image.put("bytesBase64Encoded", encode(request.image()));
            image.put("mimeType", request.image().mimeType());
        }
        ObjectNode parameters = body.putObject("parameters");
        parameters.put("aspectRatio", request.aspectRatio().value());
        parameters.put("resolution", request.resolution().value());
        parameters.put("sampleCount", 1);

        JsonNode response = http.executeForJson(post("models/" + request.model() + ":predictLongRunning", body), token);
        Operation operation = parseOperation(response);
        log.debug("Submitted {} to {}", operation.id(), request.model());
        return operation;
    }

    @Override
    public Operation poll(Operation operation, CancellationToken token) {
        Request request = authorized(new Request.Builder()
            .url(config.baseUrl() + operation.id().getValue())
            .get())
            .build();
        return parseOperation(http.executeForJson(request, token));
    }

    @Override
    public MediaBlob editImage(ImageEditRequest request, CancellationToken token) {
        ObjectNode body = mapper().createObjectNode();
        ArrayNode parts = body.putArray("contents").addObject().putArray("parts");
        addInlineData(parts, request.image());
        parts.addObject().put("text", request.instruction());

        JsonNode response = http.executeForJson(post("models/" + request.model() + ":generateContent", body), token);
        JsonNode responseParts = response.path("candidates").path(0).path("content").path("parts");
        if (!responseParts.isArray() || responseParts.isEmpty()) {
            throw new SynthesisException("No response content from studio engine.");
        }
        for (JsonNode part : responseParts) {
            JsonNode inline = part.path("inlineData");
            if (inline.isObject()) {
                byte[] data = Base64.getDecoder().decode(inline.path("data").asText(""));
                return new MediaBlob(data, inline.path("mimeType").asText("image/png"));
            }
        }
        throw new SynthesisException("No image data returned from model");
    }

    /**
     * 몽타주 하이라이트 분석.
     *
     * <p>모델 출력이 JSON 배열이 아니면 빈 목록을 반환합니다.</p>
     */
    @Override
    public List<MontageSegment> analyzeMontage(List<MediaBlob> clips, CancellationToken token) {
        ObjectNode body = mapper().createObjectNode();
        ArrayNode parts = body.putArray("contents").addObject().putArray("parts");
        for (MediaBlob clip : clips) {
            addInlineData(parts, clip);
        }
        parts.addObject().put("text", MONTAGE_ANALYSIS_INSTRUCTION);

        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("responseMimeType", "application/json");
        ObjectNode schema = generationConfig.putObject("responseSchema");
        schema.put("type", "ARRAY");
        ObjectNode items = schema.putObject("items");
        items.put("type", "OBJECT");
        ObjectNode properties = items.putObject("properties");
        properties.putObject("start_timestamp").put("type", "STRING");
        properties.putObject("end_timestamp").put("type", "STRING");
        properties.putObject("visual_description").put("type", "STRING");
        items.putArray("propertyOrdering").add("start_timestamp").add("end_timestamp").add("visual_description");

        JsonNode response = http.executeForJson(
            post("models/" + config.analysisModel() + ":generateContent", body), token);
        String text = response.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText("[]");
        return parseSegments(text);
    }

    List<MontageSegment> parseSegments(String text) {
        try {
            JsonNode array = mapper().readTree(text);
            if (!array.isArray()) {
                log.warn("Montage analysis output is not a JSON array");
                return List.of();
            }
            List<MontageSegment> segments = new ArrayList<>();
            for (JsonNode node : array) {
                segments.add(new MontageSegment(
                    node.path("start_timestamp").asText(""),
                    node.path("end_timestamp").asText(""),
                    node.path("visual_description").asText("")));
            }
            return List.copyOf(segments);
        } catch (IOException e) {
            log.warn("Failed to parse montage analysis output: {}", e.getMessage());
            return List.of();
        }
    }

    private Operation parseOperation(JsonNode node) {
        String name = node.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new SynthesisException("Operation response has no name");
        }
        OpId id = OpId.of(name);
        if (!node.path("done").asBoolean(false)) {
            return Operation.pending(id);
        }

        JsonNode error = node.path("error");
        if (error.isObject()) {
            return Operation.failed(id, new OperationError(error.path("code").asInt(0), error.path("message").asText("")));
        }

        JsonNode response = node.path("response");
        JsonNode video = response.path("generateVideoResponse").path("generatedSamples").path(0).path("video");
        if (video.isMissingNode()) {
            video = response.path("generatedVideos").path(0).path("video");
        }
        String uri = video.path("uri").asText(null);
        if (uri == null || uri.isBlank()) {
            return new Operation(id, true, null, null);
        }
        String mimeType = video.path("mimeType").asText("video/mp4");
        return Operation.succeeded(id, new ArtifactRef(URI.create(uri), mimeType));
    }

    private Request post(String path, ObjectNode body) {
        String json;
        try {
            json = mapper().writeValueAsString(body);
        } catch (IOException e) {
            throw new SynthesisException("Failed to serialize request for " + path, e);
        }
        return authorized(new Request.Builder()
            .url(config.baseUrl() + path)
            .post(RequestBody.create(json, JSON)))
            .build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        String key = apiKeyProvider.currentKey();
        if (key == null || key.isBlank()) {
            throw new SynthesisException(0, ErrorClassifier.REAUTH_SENTINEL, "API key is not configured");
        }
        return builder.header(API_KEY_HEADER, key);
    }

    private void addInlineData(ArrayNode parts, MediaBlob blob) {
        ObjectNode inline = parts.addObject().putObject("inlineData");
        inline.put("mimeType", blob.mimeType());
        inline.put("data", encode(blob));
    }

    private ObjectMapper mapper() {
        return http.objectMapper();
    }

    private static String encode(MediaBlob blob) {
        return Base64.getEncoder().encodeToString(blob.data());
    }
}
