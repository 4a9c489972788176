package com.ryuqq.synthesis.core.model;

/**
 * 생성 영상의 화면 비율.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AspectRatio {

    LANDSCAPE("16:9"),
    PORTRAIT("9:16");

    private final String value;

    AspectRatio(String value) {
        this.value = value;
    }

    /**
     * 원격 서비스에 전달되는 값.
     *
     * @return 비율 문자열 (예: 16:9)
     */
    public String value() {
        return value;
    }
}
