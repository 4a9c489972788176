package com.ryuqq.synthesis.application.orchestrator;

import com.ryuqq.synthesis.application.task.SynthesisTask;
import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;

/**
 * 합성 태스크 오케스트레이터.
 *
 * <p>제출, 폴링, 결과 다운로드까지 한 번의 합성을 끝까지 수행합니다.
 * 실패와 취소는 예외가 아니라 {@link TaskOutcome}으로 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskHandle handle = orchestrator.submit(task, listener);
 * // ...
 * handle.cancel();
 * TaskOutcome outcome = handle.await();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskOrchestrator {

    /**
     * 호출 스레드에서 태스크 실행 (블로킹).
     *
     * @param task 실행할 태스크
     * @param token 취소 토큰
     * @param listener 진행률/상태 리스너
     * @return 최종 결과 (non-null)
     */
    TaskOutcome run(SynthesisTask task, CancellationToken token, OrchestrationListener listener);

    /**
     * 리스너 없이 블로킹 실행.
     *
     * @param task 실행할 태스크
     * @param token 취소 토큰
     * @return 최종 결과
     */
    TaskOutcome run(SynthesisTask task, CancellationToken token);

    /**
     * 워커 스레드에서 비동기 실행.
     *
     * @param task 실행할 태스크
     * @param listener 진행률/상태 리스너
     * @return 새 취소 토큰을 가진 실행 핸들
     */
    TaskHandle submit(SynthesisTask task, OrchestrationListener listener);

    /**
     * 리스너 없이 비동기 실행.
     *
     * @param task 실행할 태스크
     * @return 실행 핸들
     */
    TaskHandle submit(SynthesisTask task);
}
