package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.core.retry.RetryPolicy;

/**
 * DefaultTaskOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retryPolicy: 원격 호출 재시도 정책 (기본 7회, 5초 기준 지수 백오프)</li>
 *   <li>poller: 폴링 설정 (기본 10초 간격)</li>
 *   <li>progress: 진행률 추정 설정 (기본 1초 tick)</li>
 *   <li>authParameterName: 결과 다운로드 URI에 붙일 인증 파라미터명 (기본 "key")</li>
 *   <li>workerThreads: 비동기 실행 워커 수 (기본 4)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param retryPolicy 재시도 정책
 * @param poller 폴링 설정
 * @param progress 진행률 설정
 * @param authParameterName 인증 쿼리 파라미터명
 * @param workerThreads 워커 스레드 수 (1 이상)
 */
public record OrchestratorConfig(
    RetryPolicy retryPolicy,
    PollerConfig poller,
    ProgressConfig progress,
    String authParameterName,
    int workerThreads
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(new RetryPolicy(), new PollerConfig(), new ProgressConfig(), "key", 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (authParameterName == null || authParameterName.isBlank()) {
            throw new IllegalArgumentException("authParameterName cannot be null or blank");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
    }

    public OrchestratorConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new OrchestratorConfig(retryPolicy, poller, progress, authParameterName, workerThreads);
    }

    public OrchestratorConfig withPoller(PollerConfig poller) {
        return new OrchestratorConfig(retryPolicy, poller, progress, authParameterName, workerThreads);
    }

    public OrchestratorConfig withProgress(ProgressConfig progress) {
        return new OrchestratorConfig(retryPolicy, poller, progress, authParameterName, workerThreads);
    }

    public OrchestratorConfig withAuthParameterName(String authParameterName) {
        return new OrchestratorConfig(retryPolicy, poller, progress, authParameterName, workerThreads);
    }

    public OrchestratorConfig withWorkerThreads(int workerThreads) {
        return new OrchestratorConfig(retryPolicy, poller, progress, authParameterName, workerThreads);
    }
}
