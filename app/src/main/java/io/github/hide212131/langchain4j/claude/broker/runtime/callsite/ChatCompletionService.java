package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackOrchestrator;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackResult;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.StreamingCompletionListener;
import java.util.List;
import java.util.Objects;

/**
 * 対話チャット。システムプロンプトと会話履歴を 1 つのプロンプトに展開し、応答をストリーミングで返す。
 */
public final class ChatCompletionService {

    static final int DEFAULT_MAX_TOKENS = 4096;
    static final String DEFAULT_SYSTEM_PROMPT = "You are Claude, a helpful AI assistant.";

    private final FallbackOrchestrator orchestrator;
    private final String systemPrompt;
    private final QueryOptions options;

    public ChatCompletionService(FallbackOrchestrator orchestrator) {
        this(orchestrator, DEFAULT_SYSTEM_PROMPT, QueryOptions.defaults().withMaxTokens(DEFAULT_MAX_TOKENS));
    }

    public ChatCompletionService(FallbackOrchestrator orchestrator, String systemPrompt, QueryOptions options) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.systemPrompt = systemPrompt;
        this.options = Objects.requireNonNull(options, "options");
    }

    public FallbackResult send(String message, List<ConversationTurn> history, StreamingCompletionListener listener) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(listener, "listener");
        return orchestrator.stream(renderPrompt(message, history), options, listener);
    }

    String renderPrompt(String message, List<ConversationTurn> history) {
        StringBuilder prompt = new StringBuilder();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            prompt.append(systemPrompt.trim()).append("\n\n");
        }
        if (history != null) {
            for (ConversationTurn turn : history) {
                prompt.append(turn.label()).append(": ").append(turn.content()).append("\n\n");
            }
        }
        prompt.append("User: ").append(message);
        return prompt.toString();
    }
}
