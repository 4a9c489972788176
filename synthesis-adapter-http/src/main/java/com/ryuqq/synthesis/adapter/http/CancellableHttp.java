package com.ryuqq.synthesis.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.cancel.CancelledException;
import com.ryuqq.synthesis.core.error.SynthesisException;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 취소 토큰에 연결된 OkHttp 호출.
 *
 * <p>토큰이 abort되면 진행 중인 {@link Call}을 취소하고 {@link CancelledException}을 던집니다.
 * 2xx가 아닌 응답은 {@code {"error":{"code","message","status"}}} 본문을 해석해
 * {@link SynthesisException}으로 변환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CancellableHttp {

    private static final Logger log = LoggerFactory.getLogger(CancellableHttp.class);
    private static final int MAX_ERROR_BODY_CHARS = 512;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    CancellableHttp(OkHttpClient httpClient, ObjectMapper objectMapper) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * 요청 실행 후 JSON 본문 반환.
     */
    JsonNode executeForJson(Request request, CancellationToken token) {
        byte[] body = execute(request, token).bytes();
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SynthesisException("Malformed response from " + request.url().encodedPath(), e);
        }
    }

    /**
     * 요청 실행 후 본문과 Content-Type 반환.
     */
    Payload execute(Request request, CancellationToken token) {
        token.throwIfAborted();
        Call call = httpClient.newCall(request);
        CancellationToken.Registration registration = token.onAbort(call::cancel);
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body == null ? new byte[0] : body.bytes();
            if (!response.isSuccessful()) {
                throw toException(response.code(), bytes, request);
            }
            String contentType = response.header("Content-Type");
            return new Payload(bytes, contentType);
        } catch (IOException e) {
            if (token.isAborted() || call.isCanceled()) {
                throw new CancelledException("Request cancelled: " + request.method() + " " + request.url().encodedPath(), e);
            }
            log.error("{} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
            throw new SynthesisException("Network failure: " + e.getMessage(), e);
        } finally {
            registration.remove();
        }
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    private SynthesisException toException(int httpStatus, byte[] body, Request request) {
        String text = new String(body, StandardCharsets.UTF_8);
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isObject()) {
                String status = error.path("status").asText(null);
                String message = error.path("message").asText("HTTP " + httpStatus);
                log.warn("{} {} returned {} {}: {}", request.method(), request.url().encodedPath(),
                    httpStatus, status, message);
                return new SynthesisException(httpStatus, status, message);
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON for {} {}", request.method(), request.url().encodedPath());
        }
        String snippet = text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) : text;
        log.warn("{} {} returned {}", request.method(), request.url().encodedPath(), httpStatus);
        return new SynthesisException(httpStatus, null, "HTTP " + httpStatus + (snippet.isBlank() ? "" : ": " + snippet));
    }

    /**
     * 응답 본문.
     *
     * @param bytes 본문
     * @param contentType Content-Type 헤더 (null 가능)
     */
    record Payload(byte[] bytes, String contentType) {
    }
}
