package com.ryuqq.synthesis.testkit.contract;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.retry.Sleeper;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Sleeper that records requested waits instead of blocking.
 *
 * <p>Covers both retry backoff and poll interval waits, since the orchestrator routes both
 * through the same {@link Sleeper}. An optional hook runs inside each wait, which is where
 * contract tests abort a task "during backoff".</p>
 *
 * <p>This is the shared copy for modules downstream of the runner. synthesis-core and
 * synthesis-adapter-runner keep package-private test copies because this module depends on
 * both of them.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private volatile Consumer<CancellationToken> onSleep = token -> { };

    /**
     * Installs a hook that runs during every wait.
     *
     * @param action hook receiving the waiting task's token
     * @return this sleeper
     */
    public RecordingSleeper onSleep(Consumer<CancellationToken> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        this.onSleep = action;
        return this;
    }

    @Override
    public void sleep(long millis, CancellationToken token) {
        token.throwIfAborted();
        sleeps.add(millis);
        onSleep.accept(token);
        token.throwIfAborted();
    }

    /**
     * Returns the requested waits in call order.
     *
     * @return snapshot of wait durations (ms)
     */
    public List<Long> getSleeps() {
        return new ArrayList<>(sleeps);
    }

    public void clear() {
        sleeps.clear();
    }
}
