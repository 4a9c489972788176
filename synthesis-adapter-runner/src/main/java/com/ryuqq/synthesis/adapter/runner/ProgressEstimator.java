package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.core.listener.OrchestrationListener;
import com.ryuqq.synthesis.core.model.ProgressEstimate;
import com.ryuqq.synthesis.core.model.ProgressEstimate.Phase;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * 표시용 진행률 추정기.
 *
 * <p>원격 서비스가 진행률을 제공하지 않으므로 시간 기반으로 진행률을 추정합니다.
 * 원격 작업이 끝나기 전에는 99% 이상을 표시하지 않으며, 100%는 {@link #complete()} 호출 시에만 표시합니다.</p>
 *
 * <p><strong>Tick 규칙:</strong></p>
 * <ul>
 *   <li>linearCeiling 미만: random * linearStep 증가</li>
 *   <li>plateauCeiling 미만: random * plateauStep 증가 (plateauCeiling으로 제한)</li>
 *   <li>그 이상: 유지</li>
 * </ul>
 *
 * <p>스케줄은 {@link #complete()} 또는 {@link #stop()}으로 반드시 해제해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressEstimator {

    private static final double FINALIZING_PERCENT = 99;
    private static final double COMPLETE_PERCENT = 100;

    private final ScheduledExecutorService scheduler;
    private final ProgressConfig config;
    private final DoubleSupplier random;
    private final OrchestrationListener listener;

    private double percent;
    private Phase phase = Phase.SUBMITTED;
    private ScheduledFuture<?> schedule;

    public ProgressEstimator(ScheduledExecutorService scheduler, ProgressConfig config, OrchestrationListener listener) {
        this(scheduler, config, () -> ThreadLocalRandom.current().nextDouble(), listener);
    }

    /**
     * 생성자 (난수 공급자 주입).
     *
     * @param scheduler tick 스케줄러
     * @param config 진행률 설정
     * @param random [0, 1) 난수 공급자
     * @param listener 진행률 리스너
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProgressEstimator(ScheduledExecutorService scheduler, ProgressConfig config,
                             DoubleSupplier random, OrchestrationListener listener) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.scheduler = scheduler;
        this.config = config;
        this.random = random;
        this.listener = GuardedListener.wrap(listener);
    }

    /**
     * 0% / SUBMITTED로 초기화하고 tick 시작.
     */
    public synchronized void start() {
        cancelSchedule();
        percent = 0;
        phase = Phase.SUBMITTED;
        publish();
        schedule = scheduler.scheduleAtFixedRate(
            this::tick, config.tickIntervalMs(), config.tickIntervalMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * 원격 합성 단계 진입.
     */
    public synchronized void markSynthesizing() {
        phase = Phase.SYNTHESIZING;
        publish();
    }

    /**
     * 결과 다운로드 단계 진입 (원격 작업 완료 후에만 호출).
     *
     * <p>진행률을 99%로 올리고 tick을 멈춥니다.</p>
     */
    public synchronized void markFinalizing() {
        cancelSchedule();
        percent = Math.max(percent, FINALIZING_PERCENT);
        phase = Phase.FINALIZING;
        publish();
    }

    /**
     * 100%로 완료하고 tick 중지.
     */
    public synchronized void complete() {
        cancelSchedule();
        percent = COMPLETE_PERCENT;
        phase = Phase.FINALIZING;
        publish();
    }

    /**
     * tick 중지 (멱등).
     */
    public synchronized void stop() {
        cancelSchedule();
    }

    public synchronized ProgressEstimate current() {
        return new ProgressEstimate(percent, phase);
    }

    public synchronized boolean isRunning() {
        return schedule != null;
    }

    synchronized void tick() {
        if (schedule == null) {
            return;
        }
        double next = percent;
        if (percent < config.linearCeiling()) {
            next = percent + nextRandom() * config.linearStep();
        } else if (percent < config.plateauCeiling()) {
            next = percent + nextRandom() * config.plateauStep();
        }
        next = Math.min(next, config.plateauCeiling());
        if (next > percent) {
            percent = next;
            publish();
        }
    }

    private double nextRandom() {
        double r = random.getAsDouble();
        return Math.max(0, Math.min(1, r));
    }

    private void publish() {
        listener.onProgress(new ProgressEstimate(percent, phase));
    }

    private void cancelSchedule() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
    }
}
