package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackOrchestrator;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackResult;
import java.util.Objects;

/**
 * バックグラウンドのテキスト抽出。会話の断片を抽出用プロンプトで包み、応答テキストをそのまま返す。
 * 応答の解釈は呼び出し側が行う。
 */
public final class TextExtractionService {

    static final int DEFAULT_MAX_TOKENS = 4000;
    static final String DEFAULT_INSTRUCTIONS = "You are analyzing a conversation between a user and an AI "
            + "assistant to extract memorable moments. Return a valid JSON array only, no other text. "
            + "Return an empty array if nothing is worth remembering.";

    private final FallbackOrchestrator orchestrator;
    private final String instructions;
    private final QueryOptions options;

    public TextExtractionService(FallbackOrchestrator orchestrator) {
        this(orchestrator, DEFAULT_INSTRUCTIONS, QueryOptions.defaults().withMaxTokens(DEFAULT_MAX_TOKENS));
    }

    public TextExtractionService(FallbackOrchestrator orchestrator, String instructions, QueryOptions options) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.instructions = Objects.requireNonNull(instructions, "instructions");
        this.options = Objects.requireNonNull(options, "options");
    }

    public FallbackResult extract(String conversationChunk) {
        Objects.requireNonNull(conversationChunk, "conversationChunk");
        return orchestrator.complete(buildPrompt(conversationChunk), options);
    }

    String buildPrompt(String conversationChunk) {
        return instructions + "\n\nAnalyze this conversation and extract memories:\n\n" + conversationChunk;
    }
}
