package com.ryuqq.synthesis.core.error;

/**
 * 실패 분류 체계.
 *
 * <p>호출자는 원본 메시지가 아닌 이 값으로 분기합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 사용자 취소. 오류로 표시하지 않음.
     */
    CANCELLED,

    /**
     * 일시적 호출량 제한 (429). Retry Executor가 백오프 후 재시도.
     */
    RATE_LIMITED,

    /**
     * 자격 증명 재동기화 필요.
     */
    AUTH_REQUIRED,

    /**
     * 일일 할당량 소진. 재시도하지 않음.
     */
    QUOTA_EXHAUSTED,

    /**
     * 그 외 복구 불가능한 실패.
     */
    FATAL;

    /**
     * Retry Executor가 재시도하는 분류인지 확인.
     *
     * @return RATE_LIMITED인 경우 true
     */
    public boolean isRetryable() {
        return this == RATE_LIMITED;
    }
}
