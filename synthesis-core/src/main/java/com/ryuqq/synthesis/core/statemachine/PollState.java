package com.ryuqq.synthesis.core.statemachine;

/**
 * Operation Poller의 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * SUBMITTED
 *    │
 *    ▼ (폴링 시작)
 * POLLING
 *    │
 *    ├─► DONE (완료, 오류 없음)
 *    ├─► FAILED (오류 페이로드 또는 재시도 불가 실패)
 *    └─► CANCELLED (토큰 abort)
 *
 * 금지된 전이:
 * - 종료 상태(DONE, FAILED, CANCELLED) → * ❌
 * - POLLING → SUBMITTED ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PollState {

    /**
     * 제출 완료, 폴링 시작 전.
     */
    SUBMITTED,

    /**
     * 완료 대기 중.
     */
    POLLING,

    /**
     * 오류 없이 완료.
     */
    DONE,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
