package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CLI が API キーではなく自身の保存済み認証情報を使うよう、資格情報を上書きしうる環境変数を取り除く。
 *
 * <p>入力は変更せず、常に新しい不変マップを返す。
 */
public final class EnvironmentSanitizer {

    /** 既定で取り除く変数。API キー本体と、それに対応するトークン変数。 */
    public static final Set<String> DEFAULT_SHADOWED_VARIABLES = Set.of("ANTHROPIC_API_KEY", "ANTHROPIC_AUTH_TOKEN");

    private static final EnvironmentSanitizer DEFAULT = new EnvironmentSanitizer(DEFAULT_SHADOWED_VARIABLES);

    private final Set<String> shadowed;

    public EnvironmentSanitizer(Set<String> shadowed) {
        this.shadowed = Set.copyOf(Objects.requireNonNull(shadowed, "shadowed"));
    }

    public static EnvironmentSanitizer defaults() {
        return DEFAULT;
    }

    public Map<String, String> sanitize(Map<String, String> baseEnvironment) {
        Objects.requireNonNull(baseEnvironment, "baseEnvironment");
        Map<String, String> copy = new HashMap<>(baseEnvironment);
        copy.keySet().removeIf(shadowed::contains);
        return Map.copyOf(copy);
    }

    public Set<String> shadowedVariables() {
        return shadowed;
    }
}
