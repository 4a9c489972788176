/**
 * Runner Adapter Layer - TaskOrchestrator 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.adapter.runner.DefaultTaskOrchestrator} - 제출, 폴링, 다운로드 오케스트레이터</li>
 *   <li>{@link com.ryuqq.synthesis.adapter.runner.OperationPoller} - 고정 간격 Long-running Operation 폴러</li>
 *   <li>{@link com.ryuqq.synthesis.adapter.runner.ProgressEstimator} - 시간 기반 진행률 추정기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultTaskOrchestrator)
 *   ↓ implements
 * application (TaskOrchestrator interface)
 *   ↓ depends on
 * core (CancellationToken, RetryExecutor, ErrorClassifier, TaskOutcome)
 *   ↓ depends on
 * core/spi (SynthesisClient, ArtifactFetcher, CredentialResync, ApiKeyProvider)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.synthesis.adapter.runner;
