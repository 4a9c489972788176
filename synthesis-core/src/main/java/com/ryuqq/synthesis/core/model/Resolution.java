package com.ryuqq.synthesis.core.model;

/**
 * 생성 영상의 해상도.
 *
 * <p>해상도는 품질 등급을 겸합니다. {@link #isHighQuality()}가 true인 해상도는
 * 고품질 모델로 라우팅됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Resolution {

    HD("720p", false),
    FULL_HD("1080p", true);

    private final String value;
    private final boolean highQuality;

    Resolution(String value, boolean highQuality) {
        this.value = value;
        this.highQuality = highQuality;
    }

    /**
     * 원격 서비스에 전달되는 값.
     *
     * @return 해상도 문자열 (예: 720p)
     */
    public String value() {
        return value;
    }

    /**
     * 고품질 백엔드가 필요한 해상도인지 확인.
     *
     * @return 고품질 모델이 필요하면 true
     */
    public boolean isHighQuality() {
        return highQuality;
    }
}
