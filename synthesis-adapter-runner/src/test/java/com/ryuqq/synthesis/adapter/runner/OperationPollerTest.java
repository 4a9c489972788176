package com.ryuqq.synthesis.adapter.runner;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.error.FailureKind;
import com.ryuqq.synthesis.core.error.SynthesisException;
import com.ryuqq.synthesis.core.model.ArtifactRef;
import com.ryuqq.synthesis.core.model.OpId;
import com.ryuqq.synthesis.core.model.Operation;
import com.ryuqq.synthesis.core.model.OperationError;
import com.ryuqq.synthesis.core.retry.BackoffCalculator;
import com.ryuqq.synthesis.core.retry.RetryExecutor;
import com.ryuqq.synthesis.core.retry.RetryPolicy;
import com.ryuqq.synthesis.core.spi.SynthesisClient;
import com.ryuqq.synthesis.core.statemachine.PollResult;
import com.ryuqq.synthesis.core.statemachine.PollState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * OperationPoller 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OperationPollerTest {

    private static final OpId OP_ID = OpId.of("models/veo/operations/op-1");
    private static final Operation PENDING = Operation.pending(OP_ID);
    private static final ArtifactRef VIDEO = ArtifactRef.of("https://files.example.com/v1/files/abc:download?alt=media");

    @Mock
    private SynthesisClient client;

    private RecordingSleeper sleeper;
    private OperationPoller poller;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        RetryExecutor retry = new RetryExecutor(new RetryPolicy(),
            new BackoffCalculator(5000, 300000, 3000, () -> 0.0), sleeper);
        poller = new OperationPoller(client, retry, sleeper, new PollerConfig());
        token = new CancellationToken();
    }

    // ============================================================
    // 1. 정상 완료
    // ============================================================

    @Test
    void 세_번째_폴링에서_완료되면_DONE() {
        // given
        when(client.poll(any(), any()))
            .thenReturn(PENDING, PENDING, Operation.succeeded(OP_ID, VIDEO));

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.DONE);
        assertThat(result.operation().result()).isEqualTo(VIDEO);
        assertThat(result.failure()).isNull();
        assertThat(sleeper.sleeps).containsExactly(10000L, 10000L, 10000L);
        verify(client, times(3)).poll(any(), any());
    }

    @Test
    void 이미_완료된_Operation은_폴링하지_않는다() {
        // when
        PollResult result = poller.await(Operation.succeeded(OP_ID, VIDEO), token);

        // then
        assertThat(result.state()).isEqualTo(PollState.DONE);
        assertThat(sleeper.sleeps).isEmpty();
        verifyNoInteractions(client);
    }

    // ============================================================
    // 2. 취소
    // ============================================================

    @Test
    void 시작_전_abort되면_네트워크_호출_없이_CANCELLED() {
        // given
        token.abort();

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.CANCELLED);
        assertThat(sleeper.sleeps).isEmpty();
        verifyNoInteractions(client);
    }

    @Test
    void 대기_중_abort되면_조회하지_않고_CANCELLED() {
        // given
        sleeper.onSleep(CancellationToken::abort);

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.CANCELLED);
        verify(client, never()).poll(any(), any());
    }

    @Test
    void 두_번째_폴링_후_abort되면_CANCELLED() {
        // given
        when(client.poll(any(), any())).thenAnswer(invocation -> {
            if (sleeper.sleeps.size() == 2) {
                token.abort();
            }
            return PENDING;
        });

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.CANCELLED);
        verify(client, times(2)).poll(any(), any());
    }

    // ============================================================
    // 3. 실패
    // ============================================================

    @Test
    void 오류_페이로드로_완료되면_분류된_FAILED() {
        // given
        when(client.poll(any(), any()))
            .thenReturn(Operation.failed(OP_ID, new OperationError(404, "Requested entity was not found.")));

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.FAILED);
        assertThat(result.failure().kind()).isEqualTo(FailureKind.AUTH_REQUIRED);
        assertThat(result.failure().message()).isEqualTo("Requested entity was not found.");
    }

    @Test
    void 조회가_429면_재시도_후_계속_폴링() {
        // given
        when(client.poll(any(), any()))
            .thenThrow(new SynthesisException(429, "RESOURCE_EXHAUSTED", "Too many requests"))
            .thenReturn(Operation.succeeded(OP_ID, VIDEO));

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.DONE);
        assertThat(sleeper.sleeps).containsExactly(10000L, 5000L);
    }

    @Test
    void 조회가_재시도_불가_오류면_FAILED() {
        // given
        when(client.poll(any(), any())).thenThrow(new SynthesisException(500, "INTERNAL", "backend exploded"));

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.FAILED);
        assertThat(result.failure().kind()).isEqualTo(FailureKind.FATAL);
        assertThat(result.failure().message()).isEqualTo("backend exploded");
        verify(client, times(1)).poll(any(), any());
    }

    @Test
    void 최대_대기_시간을_넘기면_FATAL() {
        // given
        AtomicLong now = new AtomicLong();
        sleeper.onSleep(t -> now.addAndGet(10000));
        when(client.poll(any(), any())).thenReturn(PENDING);
        poller = new OperationPoller(client, new RetryExecutor(new RetryPolicy(), sleeper), sleeper,
            new PollerConfig().withMaxWaitMs(25000), now::get);

        // when
        PollResult result = poller.await(PENDING, token);

        // then
        assertThat(result.state()).isEqualTo(PollState.FAILED);
        assertThat(result.failure().kind()).isEqualTo(FailureKind.FATAL);
        assertThat(result.failure().message()).contains("timed out");
        verify(client, times(3)).poll(any(), any());
    }
}
