package com.ryuqq.synthesis.application.task;

/**
 * 오케스트레이터에 전달되는 기능별 입력.
 *
 * <p>Sealed interface로 정의되어 오케스트레이터가 모든 기능을 처리하도록 강제합니다.</p>
 *
 * <ul>
 *   <li>{@link VideoGenerationTask}: 텍스트 프롬프트 영상 생성</li>
 *   <li>{@link LogoAnimationTask}: 로고 이미지 애니메이션</li>
 *   <li>{@link ImageRemedyTask}: 이미지/영상 보정 및 워터마크 제거</li>
 *   <li>{@link MontageTask}: 여러 클립의 하이라이트 몽타주</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface SynthesisTask
    permits VideoGenerationTask, LogoAnimationTask, ImageRemedyTask, MontageTask {

    /**
     * 기능 구분 조회.
     *
     * @return 기능 구분
     */
    Feature feature();
}
