package com.ryuqq.synthesis.core.retry;

import com.ryuqq.synthesis.core.cancel.CancellationToken;

import java.util.ArrayList;
import java.util.List;

/**
 * 실제로 대기하지 않고 요청된 대기 시간만 기록하는 테스트용 Sleeper.
 *
 * <p>synthesis-testkit은 core에 의존하므로 core 테스트는 testkit의 RecordingSleeper를 쓸 수 없습니다.
 * core 밖의 테스트는 {@code com.ryuqq.synthesis.testkit.contract.RecordingSleeper}를 사용합니다.</p>
 */
class RecordingSleeper implements Sleeper {

    final List<Long> sleeps = new ArrayList<>();

    @Override
    public void sleep(long millis, CancellationToken token) {
        token.throwIfAborted();
        sleeps.add(millis);
    }
}
