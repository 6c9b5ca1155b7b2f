package io.github.hide212131.langchain4j.claude.broker.runtime;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックしてリモート API 設定を解決する。
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String ENV_ANTHROPIC_MODEL = "ANTHROPIC_MODEL";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MODEL = "OPENAI_MODEL";
    static final String ENV_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final Map<String, String> environment;
    private final Map<String, String> dotenv;

    public LlmConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    LlmConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = declaredEntries(Objects.requireNonNull(dotenv, "dotenv"));
    }

    public LlmConfiguration load() {
        return load(null);
    }

    public LlmConfiguration load(LlmProvider overrideProvider) {
        LlmProvider provider = overrideProvider != null ? overrideProvider
                : LlmProvider.from(resolveWithPriority(ENV_LLM_PROVIDER));
        Duration timeout = resolveTimeout();
        return switch (provider) {
            case MOCK -> new LlmConfiguration(provider, null, null, null, timeout);
            case ANTHROPIC -> new LlmConfiguration(provider, requireKey(provider, ENV_ANTHROPIC_API_KEY), null,
                    trimToNull(resolveWithPriority(ENV_ANTHROPIC_MODEL)), timeout);
            case OPENAI -> new LlmConfiguration(provider, requireKey(provider, ENV_OPENAI_API_KEY),
                    trimToNull(resolveWithPriority(ENV_OPENAI_BASE_URL)),
                    trimToNull(resolveWithPriority(ENV_OPENAI_MODEL)), timeout);
        };
    }

    private String requireKey(LlmProvider provider, String key) {
        String value = trimToNull(resolveWithPriority(key));
        if (value == null) {
            throw new IllegalStateException(
                    "LLM_PROVIDER=" + provider.name().toLowerCase(Locale.ROOT) + " の場合、" + key
                            + " が必須です");
        }
        return value;
    }

    private Duration resolveTimeout() {
        String raw = trimToNull(resolveWithPriority(ENV_TIMEOUT_SECONDS));
        if (raw == null) {
            return DEFAULT_TIMEOUT;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_TIMEOUT_SECONDS + " must be a positive integer (seconds)", ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(ENV_TIMEOUT_SECONDS + " must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static Map<String, String> declaredEntries(Dotenv dotenv) {
        Map<String, String> entries = new HashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            entries.put(entry.getKey(), entry.getValue());
        }
        return Map.copyOf(entries);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
