package com.ryuqq.synthesis.core.model;

/**
 * 정지 이미지 편집 요청 (동기 호출).
 *
 * @param model 모델 식별자
 * @param image 편집할 이미지
 * @param instruction 편집 지시문
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ImageEditRequest(
    String model,
    MediaBlob image,
    String instruction
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public ImageEditRequest {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (image == null) {
            throw new IllegalArgumentException("image cannot be null");
        }
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("instruction cannot be null or blank");
        }
    }
}
