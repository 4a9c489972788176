package com.ryuqq.synthesis.core.retry;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.cancel.CancelledException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 토큰 abort 시 즉시 깨어나는 Sleeper 기본 구현.
 *
 * <p>대기마다 latch를 만들고 abort 리스너로 해제합니다.
 * 대기가 끝나면 리스너 등록을 해제하여 토큰에 리스너가 쌓이지 않습니다.</p>
 *
 * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
 * CancelledException으로 래핑하여 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellableSleeper implements Sleeper {

    @Override
    public void sleep(long millis, CancellationToken token) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must be non-negative (current: " + millis + ")");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        token.throwIfAborted();

        CountDownLatch latch = new CountDownLatch(1);
        CancellationToken.Registration registration = token.onAbort(latch::countDown);
        try {
            latch.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Sleep interrupted", e);
        } finally {
            registration.remove();
        }

        token.throwIfAborted();
    }
}
