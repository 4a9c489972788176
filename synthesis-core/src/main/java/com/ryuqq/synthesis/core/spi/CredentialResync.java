package com.ryuqq.synthesis.core.spi;

/**
 * 자격 증명 재동기화 협력자.
 *
 * <p>AUTH_REQUIRED로 분류된 실패에서만 호출되며, 오케스트레이터는
 * 반환될 때까지 기다린 뒤 자신의 종료 상태를 보고합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CredentialResync {

    /**
     * 자격 증명 선택 화면을 열고 완료될 때까지 대기.
     */
    void openCredentialSelector();
}
