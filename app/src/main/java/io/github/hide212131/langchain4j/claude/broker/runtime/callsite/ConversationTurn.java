package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import java.util.Locale;
import java.util.Objects;

/**
 * 会話履歴の 1 発言。
 *
 * @param role {@code user} または {@code assistant}
 * @param content 発言内容
 */
public record ConversationTurn(String role, String content) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        role = role.trim().toLowerCase(Locale.ROOT);
        if (!"user".equals(role) && !"assistant".equals(role)) {
            throw new IllegalArgumentException("role は user か assistant です: " + role);
        }
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn("user", content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn("assistant", content);
    }

    String label() {
        return "user".equals(role) ? "User" : "Assistant";
    }
}
