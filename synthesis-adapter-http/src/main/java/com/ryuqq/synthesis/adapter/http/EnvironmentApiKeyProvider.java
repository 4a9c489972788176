package com.ryuqq.synthesis.adapter.http;

import com.ryuqq.synthesis.core.spi.ApiKeyProvider;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 환경 변수 API_KEY에서 키를 읽는 ApiKeyProvider.
 *
 * <p>호출할 때마다 다시 읽으므로 자격 증명 재선택 후 바뀐 키가 바로 반영됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EnvironmentApiKeyProvider implements ApiKeyProvider {

    static final String ENV_API_KEY = "API_KEY";

    private final Supplier<Map<String, String>> environment;

    public EnvironmentApiKeyProvider() {
        this(System::getenv);
    }

    public EnvironmentApiKeyProvider(Supplier<Map<String, String>> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = environment;
    }

    @Override
    public String currentKey() {
        String key = environment.get().get(ENV_API_KEY);
        return key == null ? null : key.trim();
    }
}
