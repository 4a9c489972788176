package com.ryuqq.synthesis.core.cancel;

import com.ryuqq.synthesis.core.error.SynthesisException;

/**
 * 협력적 취소로 중단된 작업.
 *
 * <p>{@link CancellationToken}이 abort된 뒤 대기나 원격 호출이 중단되면 던져집니다.
 * 사용자에게는 오류가 아닌 중립적인 취소 상태로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CancelledException extends SynthesisException {

    public CancelledException() {
        super("Operation cancelled");
    }

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
