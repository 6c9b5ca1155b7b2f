package io.github.hide212131.langchain4j.claude.broker.runtime;

import java.time.Duration;
import java.util.Objects;

/** リモート API 経路の接続設定。 */
public record LlmConfiguration(LlmProvider provider, String apiKey, String baseUrl, String model, Duration timeout) {

    private static final int MASK_THRESHOLD = 8;
    private static final int MASK_SUFFIX_LENGTH = 4;

    public LlmConfiguration {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(timeout, "timeout");
    }

    public String maskedApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            return "(none)";
        }
        if (apiKey.length() <= MASK_THRESHOLD) {
            return "****";
        }
        String last = apiKey.substring(apiKey.length() - MASK_SUFFIX_LENGTH);
        return "****" + last;
    }
}
