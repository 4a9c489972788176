package com.ryuqq.synthesis.core.spi;

/**
 * 현재 API 키 공급자.
 *
 * <p>재동기화 후 키가 바뀔 수 있으므로 호출 시점마다 조회합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ApiKeyProvider {

    /**
     * 현재 API 키 조회.
     *
     * @return API 키
     */
    String currentKey();
}
