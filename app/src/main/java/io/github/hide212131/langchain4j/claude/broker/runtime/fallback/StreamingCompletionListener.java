package io.github.hide212131.langchain4j.claude.broker.runtime.fallback;

/**
 * フォールバック込みのストリーミング購読者。
 */
public interface StreamingCompletionListener {

    void onChunk(String chunk);

    /**
     * CLI 経路が途中で失敗し、リモート API でやり直すときに呼ばれる。それまでに受け取ったチャンクは破棄すること。
     */
    default void onReset() {
    }
}
