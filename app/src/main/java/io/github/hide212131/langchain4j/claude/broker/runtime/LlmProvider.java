package io.github.hide212131.langchain4j.claude.broker.runtime;

import java.util.Locale;

/**
 * リモート API 経路で利用する LLM プロバイダの種別。
 */
public enum LlmProvider {
    MOCK,
    ANTHROPIC,
    OPENAI;

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            return ANTHROPIC;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "anthropic" -> ANTHROPIC;
            case "openai" -> OPENAI;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("LLM_PROVIDER の値が不正です: " + value);
        };
    }
}
