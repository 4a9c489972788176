package com.ryuqq.synthesis.core.error;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.cancel.CancelledException;
import com.ryuqq.synthesis.core.model.OperationError;

import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * 실패 분류기.
 *
 * <p>임의의 실패를 {@link FailureKind}로 매핑하는 순수 함수입니다.
 * 예외 자신과 cause 체인의 메시지, 그리고 {@link SynthesisException}의 상태 코드를
 * 대소문자 구분 없이 검사합니다.</p>
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>CANCELLED: 토큰 abort 또는 취소 예외</li>
 *   <li>QUOTA_EXHAUSTED: {@value #DAILY_QUOTA_SENTINEL} 센티널</li>
 *   <li>AUTH_REQUIRED: "requested entity was not found" 또는 {@value #REAUTH_SENTINEL} 센티널</li>
 *   <li>RATE_LIMITED: 429 상태/코드, "quota" 또는 "resource_exhausted" 포함</li>
 *   <li>FATAL: 그 외</li>
 * </ol>
 *
 * <p>분류기는 토큰을 변경하거나 재시도를 일으키지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    /**
     * 일일 할당량 소진 센티널.
     */
    public static final String DAILY_QUOTA_SENTINEL = "DAILY_QUOTA_EXHAUSTED";

    /**
     * 자격 증명 재선택 센티널.
     */
    public static final String REAUTH_SENTINEL = "RETRY_KEY_SELECTION";

    private static final String ENTITY_NOT_FOUND = "requested entity was not found";
    private static final String RATE_LIMIT_CODE = "429";

    // Utility class - prevent instantiation
    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 실패 분류.
     *
     * @param failure 실패 (null이면 FATAL)
     * @return 실패 분류
     */
    public static FailureKind classify(Throwable failure) {
        return classify(failure, null);
    }

    /**
     * 토큰 상태를 고려한 실패 분류.
     *
     * @param failure 실패 (null이면 토큰 상태에 따라 CANCELLED 또는 FATAL)
     * @param token 현재 오케스트레이션의 토큰 (null 가능)
     * @return 실패 분류
     */
    public static FailureKind classify(Throwable failure, CancellationToken token) {
        if ((token != null && token.isAborted()) || isCancellation(failure)) {
            return FailureKind.CANCELLED;
        }
        if (failure == null) {
            return FailureKind.FATAL;
        }

        String text = collectText(failure);

        if (text.contains(DAILY_QUOTA_SENTINEL.toLowerCase(Locale.ROOT))) {
            return FailureKind.QUOTA_EXHAUSTED;
        }
        if (text.contains(ENTITY_NOT_FOUND) || text.contains(REAUTH_SENTINEL.toLowerCase(Locale.ROOT))) {
            return FailureKind.AUTH_REQUIRED;
        }
        if (hasRateLimitStatus(failure) || text.contains("quota") || text.contains("resource_exhausted")) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.FATAL;
    }

    /**
     * 실패를 분류하여 FailureInfo 생성.
     *
     * @param failure 실패
     * @param token 현재 오케스트레이션의 토큰 (null 가능)
     * @return 분류와 원본 메시지
     */
    public static FailureInfo describe(Throwable failure, CancellationToken token) {
        FailureKind kind = classify(failure, token);
        return FailureInfo.of(kind, messageOf(failure));
    }

    /**
     * Operation 오류 페이로드 분류.
     *
     * @param error 종료된 Operation의 오류
     * @return 분류와 원본 메시지
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static FailureInfo describe(OperationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return describe(toException(error), null);
    }

    /**
     * Operation 오류 페이로드를 예외로 변환.
     *
     * @param error 종료된 Operation의 오류
     * @return 동일한 코드와 메시지를 가진 SynthesisException
     */
    public static SynthesisException toException(OperationError error) {
        String message = error.message().isBlank() ? "Generation failed" : error.message();
        return new SynthesisException(error.code(), error.code() == 0 ? null : String.valueOf(error.code()), message);
    }

    private static boolean isCancellation(Throwable failure) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof CancelledException
                || t instanceof InterruptedException
                || t instanceof CancellationException) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasRateLimitStatus(Throwable failure) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof SynthesisException se) {
                if (se.getHttpStatus() == 429 || RATE_LIMIT_CODE.equals(se.getCode())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String collectText(Throwable failure) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append('\n');
            }
            if (t instanceof SynthesisException se && se.getCode() != null) {
                sb.append(se.getCode()).append('\n');
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static Throwable nextCause(Throwable t) {
        Throwable cause = t.getCause();
        return cause == t ? null : cause;
    }

    private static String messageOf(Throwable failure) {
        if (failure == null) {
            return "Unknown failure";
        }
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
