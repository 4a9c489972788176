package com.ryuqq.synthesis.core.model;

/**
 * 합성 진행률 추정치.
 *
 * <p>원격 서비스의 실제 진행 상황과 무관한 표시용 값입니다.
 * 완료 여부 판단에 사용해서는 안 됩니다.</p>
 *
 * @param percent 진행률 (0 ~ 100)
 * @param phase 진행 단계
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProgressEstimate(
    double percent,
    Phase phase
) {

    /**
     * 초기 추정치 (0%, SUBMITTED).
     */
    public static final ProgressEstimate INITIAL = new ProgressEstimate(0, Phase.SUBMITTED);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException percent가 범위를 벗어나거나 phase가 null인 경우
     */
    public ProgressEstimate {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be between 0 and 100 (current: " + percent + ")");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
    }

    /**
     * 진행 단계.
     */
    public enum Phase {

        SUBMITTED("submitted"),
        SYNTHESIZING("synthesizing"),
        FINALIZING("finalizing");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
