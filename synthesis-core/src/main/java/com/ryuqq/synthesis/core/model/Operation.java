package com.ryuqq.synthesis.core.model;

/**
 * 원격 Long-running Operation의 스냅샷.
 *
 * <p>제출 응답으로 처음 생성되고, 이후에는 폴링 응답으로만 교체됩니다.
 * 클라이언트가 직접 상태를 바꾸는 일은 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>done = false이면 result와 error는 모두 null</li>
 *   <li>result와 error는 동시에 존재할 수 없음</li>
 * </ul>
 *
 * @param id 원격 Operation 핸들
 * @param done 완료 여부
 * @param result 완료 시 결과물 위치 (선택, null 가능)
 * @param error 완료 시 오류 페이로드 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Operation(
    OpId id,
    boolean done,
    ArtifactRef result,
    OperationError error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public Operation {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (!done && (result != null || error != null)) {
            throw new IllegalArgumentException("pending operation cannot carry result or error (id: " + id + ")");
        }
        if (result != null && error != null) {
            throw new IllegalArgumentException("operation cannot carry both result and error (id: " + id + ")");
        }
    }

    /**
     * 진행 중인 Operation 생성.
     *
     * @param id 원격 Operation 핸들
     * @return done = false인 Operation
     */
    public static Operation pending(OpId id) {
        return new Operation(id, false, null, null);
    }

    /**
     * 성공적으로 완료된 Operation 생성.
     *
     * @param id 원격 Operation 핸들
     * @param result 결과물 위치 (원격 서비스가 결과를 비워 보낸 경우 null)
     * @return done = true인 Operation
     */
    public static Operation succeeded(OpId id, ArtifactRef result) {
        return new Operation(id, true, result, null);
    }

    /**
     * 오류로 완료된 Operation 생성.
     *
     * @param id 원격 Operation 핸들
     * @param error 오류 페이로드
     * @return done = true인 Operation
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Operation failed(OpId id, OperationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null for failed operation");
        }
        return new Operation(id, true, null, error);
    }

    /**
     * 오류 페이로드 존재 여부.
     *
     * @return 오류로 완료된 경우 true
     */
    public boolean hasError() {
        return error != null;
    }
}
