package com.ryuqq.synthesis.adapter.runner;

/**
 * ProgressEstimator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tickIntervalMs: 갱신 주기 (기본 1000ms)</li>
 *   <li>linearCeiling / linearStep: 이 값 미만에서는 tick마다 최대 linearStep 증가 (기본 90 / 1.5)</li>
 *   <li>plateauCeiling / plateauStep: 이 값 미만에서는 tick마다 최대 plateauStep 증가 (기본 98 / 0.1)</li>
 * </ul>
 *
 * <p>plateauCeiling은 99 미만이어야 합니다. 99 이상은 원격 작업 완료 후에만 표시됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param tickIntervalMs 갱신 주기 (밀리초, 양수)
 * @param linearCeiling 선형 구간 상한
 * @param linearStep 선형 구간 최대 증가폭
 * @param plateauCeiling 정체 구간 상한 (99 미만)
 * @param plateauStep 정체 구간 최대 증가폭
 */
public record ProgressConfig(
    long tickIntervalMs,
    double linearCeiling,
    double linearStep,
    double plateauCeiling,
    double plateauStep
) {

    /**
     * 기본 설정 생성자.
     */
    public ProgressConfig() {
        this(1000, 90, 1.5, 98, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProgressConfig {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "tickIntervalMs must be positive (current: " + tickIntervalMs + ")"
            );
        }
        if (linearCeiling <= 0 || linearCeiling > plateauCeiling) {
            throw new IllegalArgumentException(
                "linearCeiling must be in (0, plateauCeiling] (current: " + linearCeiling + ")"
            );
        }
        if (plateauCeiling >= 99) {
            throw new IllegalArgumentException(
                "plateauCeiling must be below 99 (current: " + plateauCeiling + ")"
            );
        }
        if (linearStep < 0 || plateauStep < 0) {
            throw new IllegalArgumentException(
                "steps must be non-negative (linearStep: " + linearStep + ", plateauStep: " + plateauStep + ")"
            );
        }
    }

    /**
     * tickIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ProgressConfig withTickIntervalMs(long tickIntervalMs) {
        return new ProgressConfig(tickIntervalMs, linearCeiling, linearStep, plateauCeiling, plateauStep);
    }

    /**
     * 선형 구간만 변경한 새 인스턴스 생성.
     */
    public ProgressConfig withLinear(double linearCeiling, double linearStep) {
        return new ProgressConfig(tickIntervalMs, linearCeiling, linearStep, plateauCeiling, plateauStep);
    }

    /**
     * 정체 구간만 변경한 새 인스턴스 생성.
     */
    public ProgressConfig withPlateau(double plateauCeiling, double plateauStep) {
        return new ProgressConfig(tickIntervalMs, linearCeiling, linearStep, plateauCeiling, plateauStep);
    }
}
