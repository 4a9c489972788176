package com.ryuqq.synthesis.core.model;

/**
 * 원격 서비스에 제출하는 영상 생성 요청.
 *
 * <p>프롬프트와 설정은 원격 서비스 입장에서 불투명한 파라미터입니다.</p>
 *
 * @param model 모델 식별자 (예: veo-3.1-fast-generate-preview)
 * @param prompt 최종 프롬프트
 * @param image 입력 이미지 (선택, null 가능)
 * @param aspectRatio 화면 비율
 * @param resolution 해상도
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GenerationRequest(
    String model,
    String prompt,
    MediaBlob image,
    AspectRatio aspectRatio,
    Resolution resolution
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 빈 문자열인 경우
     */
    public GenerationRequest {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt cannot be null or blank");
        }
        if (aspectRatio == null) {
            throw new IllegalArgumentException("aspectRatio cannot be null");
        }
        if (resolution == null) {
            throw new IllegalArgumentException("resolution cannot be null");
        }
        // image는 null 허용
    }

    /**
     * 입력 이미지 존재 여부.
     *
     * @return image가 있으면 true
     */
    public boolean hasImage() {
        return image != null;
    }
}
