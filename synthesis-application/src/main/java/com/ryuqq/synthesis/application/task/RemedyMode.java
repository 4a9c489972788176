package com.ryuqq.synthesis.application.task;

/**
 * 보정 모드.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RemedyMode {

    /**
     * 자동 보정 (선명도, 화질 개선).
     */
    AUTO,

    /**
     * 워터마크/로고/불필요한 객체 제거.
     */
    REMEDY
}
