package com.ryuqq.synthesis.application.task;

/**
 * 영상 생성 스타일.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum VideoStyle {

    REALISTIC("Realistic"),
    CINEMATIC("Cinematic"),
    ANIMATION("Animation"),
    CYBERPUNK("Cyberpunk"),
    VINTAGE("Vintage");

    private final String label;

    VideoStyle(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
