package com.ryuqq.synthesis.core.outcome;

import com.ryuqq.synthesis.core.error.FailureInfo;
import com.ryuqq.synthesis.core.error.FailureKind;

/**
 * 실패 결과.
 *
 * <p>부분 결과물이나 남은 타이머 없이 재시작 가능한 상태로 종료되었음을 나타냅니다.</p>
 *
 * @param failure 분류된 실패
 * @param userMessage 사용자에게 표시할 문구
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(
    FailureInfo failure,
    String userMessage
) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 CANCELLED 분류인 경우
     */
    public Failed {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (failure.kind() == FailureKind.CANCELLED) {
            throw new IllegalArgumentException("cancellation must be reported as Cancelled, not Failed");
        }
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("userMessage cannot be null or blank");
        }
    }

    /**
     * 실패 분류 조회.
     *
     * @return 실패 분류
     */
    public FailureKind kind() {
        return failure.kind();
    }

    @Override
    public String statusMessage() {
        return userMessage;
    }
}
