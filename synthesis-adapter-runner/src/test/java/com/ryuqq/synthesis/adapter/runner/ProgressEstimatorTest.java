package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.model.ProgressEstimate.Phase;
import com.ryuqq.synthesis.core.outcome.TaskOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.DoubleSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ProgressEstimator 유닛 테스트.
 *
 * <p>tick 간격을 길게 잡고 {@code tick()}을 직접 호출하여 결정적으로 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProgressEstimatorTest {

    private ScheduledExecutorService scheduler;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void 시작하면_0_SUBMITTED를_알린다() {
        ProgressEstimator estimator = estimator(() -> 1.0);

        estimator.start();

        assertThat(listener.estimates).containsExactly(ProgressEstimate.INITIAL);
        assertThat(estimator.isRunning()).isTrue();
        estimator.stop();
    }

    @Test
    void 선형_구간은_tick마다_최대_step만큼_증가한다() {
        ProgressEstimator estimator = estimator(() -> 1.0);
        estimator.start();

        estimator.tick();
        estimator.tick();

        assertThat(estimator.current().percent()).isEqualTo(3.0);
        estimator.stop();
    }

    @Test
    void 원격_완료_전에는_98을_넘지_않는다() {
        ProgressEstimator estimator = estimator(() -> 1.0);
        estimator.start();

        for (int i = 0; i < 1000; i++) {
            estimator.tick();
        }

        assertThat(estimator.current().percent()).isEqualTo(98.0);
        assertThat(listener.estimates).allSatisfy(e -> assertThat(e.percent()).isLessThan(99));
        estimator.stop();
    }

    @Test
    void 진행률은_감소하지_않는다() {
        double[] randoms = {0.9, 0.0, 0.3, 1.0, 0.5};
        int[] index = {0};
        ProgressEstimator estimator = estimator(() -> randoms[index[0]++ % randoms.length]);
        estimator.start();

        for (int i = 0; i < 200; i++) {
            estimator.tick();
        }

        for (int i = 1; i < listener.estimates.size(); i++) {
            assertThat(listener.estimates.get(i).percent())
                .isGreaterThanOrEqualTo(listener.estimates.get(i - 1).percent());
        }
        estimator.stop();
    }

    @Test
    void 마무리_단계는_99이고_tick이_멈춘다() {
        ProgressEstimator estimator = estimator(() -> 1.0);
        estimator.start();
        estimator.markSynthesizing();

        estimator.markFinalizing();
        estimator.tick();

        assertThat(estimator.current()).isEqualTo(new ProgressEstimate(99, Phase.FINALIZING));
        assertThat(estimator.isRunning()).isFalse();
    }

    @Test
    void 완료는_100을_알리고_스케줄을_해제한다() {
        ProgressEstimator estimator = estimator(() -> 1.0);
        estimator.start();

        estimator.complete();

        assertThat(listener.estimates).last().isEqualTo(new ProgressEstimate(100, Phase.FINALIZING));
        assertThat(estimator.isRunning()).isFalse();
    }

    @Test
    void stop_이후_tick은_무시된다() {
        ProgressEstimator estimator = estimator(() -> 1.0);
        estimator.start();

        estimator.stop();
        estimator.stop();
        estimator.tick();

        assertThat(estimator.current().percent()).isZero();
    }

    @Test
    void 스케줄러가_주기적으로_tick한다() throws InterruptedException {
        ProgressEstimator estimator = new ProgressEstimator(
            scheduler, new ProgressConfig().withTickIntervalMs(5), () -> 1.0, listener);

        estimator.start();
        Thread.sleep(200);
        estimator.stop();

        assertThat(estimator.current().percent()).isGreaterThan(0);
    }

    @Test
    void 리스너_예외는_전파되지_않는다() {
        OrchestrationListener failing = new RecordingListener() {
            @Override
            public void onProgress(ProgressEstimate estimate) {
                throw new IllegalStateException("render failed");
            }
        };
        ProgressEstimator estimator = new ProgressEstimator(
            scheduler, new ProgressConfig().withTickIntervalMs(60000), () -> 1.0, failing);

        estimator.start();
        estimator.tick();

        assertThat(estimator.current().percent()).isEqualTo(1.5);
        estimator.stop();
    }

    private ProgressEstimator estimator(DoubleSupplier random) {
        return new ProgressEstimator(scheduler, new ProgressConfig().withTickIntervalMs(60000), random, listener);
    }

    static class RecordingListener implements OrchestrationListener {

        final List<ProgressEstimate> estimates = new CopyOnWriteArrayList<>();
        final List<String> statuses = new CopyOnWriteArrayList<>();
        final List<TaskOutcome> outcomes = new CopyOnWriteArrayList<>();

        @Override
        public void onProgress(ProgressEstimate estimate) {
            estimates.add(estimate);
        }

        @Override
        public void onStatus(String status) {
            statuses.add(status);
        }

        @Override
        public void onFinished(TaskOutcome outcome) {
            outcomes.add(outcome);
        }
    }
}
