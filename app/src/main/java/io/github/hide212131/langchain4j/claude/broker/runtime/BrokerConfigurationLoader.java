package io.github.hide212131.langchain4j.claude.broker.runtime;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックしてブローカー設定を解決する。
 */
public final class BrokerConfigurationLoader {

    static final String ENV_CLI_COMMAND = "CLAUDE_CLI_COMMAND";
    static final String ENV_MAX_CONCURRENT = "CLAUDE_CLI_MAX_CONCURRENT";
    static final String ENV_TIMEOUT_MS = "CLAUDE_CLI_TIMEOUT";
    static final String ENV_ARTIFACT_DIR = "CLAUDE_CLI_ARTIFACT_DIR";
    static final String ENV_STATUS_TTL_SECONDS = "CLAUDE_CLI_STATUS_TTL_SECONDS";
    static final String ENV_TERMINATION_GRACE_MS = "CLAUDE_CLI_TERMINATION_GRACE_MS";

    private final Map<String, String> environment;
    private final Map<String, String> dotenv;

    public BrokerConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    BrokerConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = declaredEntries(Objects.requireNonNull(dotenv, "dotenv"));
    }

    public BrokerConfiguration load() {
        BrokerConfiguration defaults = BrokerConfiguration.defaults();
        String command = trimToNull(resolveWithPriority(ENV_CLI_COMMAND));
        int capacity = positiveInt(ENV_MAX_CONCURRENT, defaults.capacity());
        Duration timeout = Duration.ofMillis(positiveLong(ENV_TIMEOUT_MS, defaults.defaultTimeout().toMillis()));
        String artifactDir = trimToNull(resolveWithPriority(ENV_ARTIFACT_DIR));
        Duration statusTtl = Duration.ofSeconds(
                nonNegativeLong(ENV_STATUS_TTL_SECONDS, defaults.statusTtl().toSeconds()));
        Duration grace = Duration.ofMillis(
                nonNegativeLong(ENV_TERMINATION_GRACE_MS, defaults.terminationGrace().toMillis()));
        return new BrokerConfiguration(command != null ? command : defaults.cliCommand(), capacity, timeout,
                artifactDir != null ? Path.of(artifactDir) : defaults.artifactDirectory(), statusTtl, grace);
    }

    private int positiveInt(String key, int fallback) {
        long value = positiveLong(key, fallback);
        if (value > Integer.MAX_VALUE) {
            throw new BrokerConfigurationException(key + " は " + Integer.MAX_VALUE + " 以下を指定してください: " + value);
        }
        return (int) value;
    }

    private long positiveLong(String key, long fallback) {
        long value = nonNegativeLong(key, fallback);
        if (value == 0) {
            throw new BrokerConfigurationException(key + " は 1 以上を指定してください");
        }
        return value;
    }

    private long nonNegativeLong(String key, long fallback) {
        String raw = trimToNull(resolveWithPriority(key));
        if (raw == null) {
            return fallback;
        }
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new BrokerConfigurationException(key + " は整数で指定してください: " + raw, ex);
        }
        if (value < 0) {
            throw new BrokerConfigurationException(key + " に負の値は指定できません: " + raw);
        }
        return value;
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
