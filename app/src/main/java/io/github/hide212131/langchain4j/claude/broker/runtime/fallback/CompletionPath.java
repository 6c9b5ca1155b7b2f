package io.github.hide212131.langchain4j.claude.broker.runtime.fallback;

/** 応答を返した経路。 */
public enum CompletionPath {
    CLI,
    REMOTE_API
}
