package com.ryuqq.synthesis.core.outcome;

/**
 * 오케스트레이션 1회의 최종 결과.
 *
 * <p>TaskOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 결과물 확보</li>
 *   <li>{@link Failed}: 분류된 실패, 재시작 가능한 깨끗한 종료 상태</li>
 *   <li>{@link Cancelled}: 사용자 취소, 오류 아님</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TaskOutcome permits Succeeded, Failed, Cancelled {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 결과가 취소인지 확인.
     *
     * @return 취소 여부
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }

    /**
     * 사용자에게 표시할 상태 문구.
     *
     * @return 상태 문구
     */
    String statusMessage();
}
