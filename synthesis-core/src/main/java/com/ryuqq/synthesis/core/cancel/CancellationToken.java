package com.ryuqq.synthesis.core.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 협력적 취소 토큰.
 *
 * <p>오케스트레이션 1회마다 새로 생성되어 제출, 폴링, 다운로드 호출에 명시적으로 전달됩니다.
 * 한 번 abort되면 다시 되돌릴 수 없고, 재사용되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>abort 이후에는 항상 abort 상태 유지</li>
 *   <li>각 리스너는 최대 1회 호출 (등록 순서대로)</li>
 *   <li>이미 abort된 토큰에 등록한 리스너는 즉시 호출 (abort 누락 경쟁 없음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CancellationToken token = new CancellationToken();
 * Registration registration = token.onAbort(call::cancel);
 * try {
 *     call.execute();
 * } finally {
 *     registration.remove();
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean aborted;

    /**
     * abort되지 않은 토큰 생성.
     */
    public CancellationToken() {
    }

    /**
     * 토큰 abort.
     *
     * <p>첫 호출만 상태를 바꾸고 등록된 리스너를 등록 순서대로 1회씩 호출합니다.
     * 이후 호출은 아무 동작도 하지 않습니다.</p>
     *
     * <p>리스너가 예외를 던져도 나머지 리스너는 계속 호출됩니다.</p>
     */
    public void abort() {
        List<Runnable> toNotify;
        synchronized (lock) {
            if (aborted) {
                return;
            }
            aborted = true;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toNotify) {
            invoke(listener);
        }
    }

    /**
     * abort 여부 조회.
     *
     * @return abort된 경우 true
     */
    public boolean isAborted() {
        return aborted;
    }

    /**
     * abort 리스너 등록.
     *
     * <p>이미 abort된 토큰이면 호출 스레드에서 즉시 실행합니다.</p>
     *
     * @param listener abort 시 호출할 콜백
     * @return 등록 해제용 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Registration onAbort(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (lock) {
            if (!aborted) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        invoke(listener);
        return () -> { };
    }

    /**
     * abort된 경우 즉시 중단.
     *
     * @throws CancelledException 토큰이 abort된 경우
     */
    public void throwIfAborted() {
        if (aborted) {
            throw new CancelledException();
        }
    }

    private void invoke(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Abort listener failed, continuing with remaining listeners", e);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{aborted=" + aborted + "}";
    }

    /**
     * 리스너 등록 핸들.
     */
    @FunctionalInterface
    public interface Registration {

        /**
         * 리스너 등록 해제. 이미 호출되었거나 해제된 경우 아무 동작도 하지 않습니다.
         */
        void remove();
    }
}
