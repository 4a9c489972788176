package com.ryuqq.synthesis.core.listener;

import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;

/**
 * 오케스트레이션 관찰 SPI.
 *
 * <p>진행률과 상태 문구를 표시 계층에 전달합니다. 순수하게 관찰용이며,
 * 구현체가 던진 예외는 오케스트레이션 흐름에 영향을 주지 않아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OrchestrationListener {

    /**
     * 진행률 갱신.
     *
     * @param estimate 진행률 추정치
     */
    void onProgress(ProgressEstimate estimate);

    /**
     * 상태 문구 갱신 (예: "Synthesizing...").
     *
     * @param status 상태 문구
     */
    void onStatus(String status);

    /**
     * 종료 알림.
     *
     * @param outcome 최종 결과
     */
    void onFinished(TaskOutcome outcome);
}
