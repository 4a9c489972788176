package com.ryuqq.synthesis.core.error;

/**
 * 원격 합성 서비스 호출 실패.
 *
 * <p>모든 SPI 호출은 실패 시 이 예외(또는 하위 타입)를 던집니다.
 * {@link ErrorClassifier}는 메시지와 함께 {@link #getHttpStatus()}, {@link #getCode()}를
 * 근거로 실패를 분류합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SynthesisException extends RuntimeException {

    private final int httpStatus;
    private final String code;

    /**
     * 상태 정보 없이 생성.
     *
     * @param message 오류 메시지
     */
    public SynthesisException(String message) {
        this(0, null, message, null);
    }

    /**
     * 원인 포함 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public SynthesisException(String message, Throwable cause) {
        this(0, null, message, cause);
    }

    /**
     * 상태 정보 포함 생성.
     *
     * @param httpStatus HTTP 상태 코드 (알 수 없으면 0)
     * @param code 원격 서비스 상태 코드 (예: RESOURCE_EXHAUSTED, null 가능)
     * @param message 오류 메시지
     */
    public SynthesisException(int httpStatus, String code, String message) {
        this(httpStatus, code, message, null);
    }

    /**
     * 전체 필드 생성.
     *
     * @param httpStatus HTTP 상태 코드 (알 수 없으면 0)
     * @param code 원격 서비스 상태 코드 (null 가능)
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     */
    public SynthesisException(int httpStatus, String code, String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.code = code;
    }

    /**
     * HTTP 상태 코드 조회.
     *
     * @return HTTP 상태 코드, 알 수 없으면 0
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * 원격 서비스 상태 코드 조회.
     *
     * @return 상태 코드 또는 null
     */
    public String getCode() {
        return code;
    }
}
