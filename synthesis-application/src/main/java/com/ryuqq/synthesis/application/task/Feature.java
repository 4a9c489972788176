package com.ryuqq.synthesis.application.task;

/**
 * 오케스트레이션 기능 구분.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Feature {
    VIDEO_GENERATION,
    LOGO_ANIMATION,
    IMAGE_REMEDY,
    MONTAGE
}
