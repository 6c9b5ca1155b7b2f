package io.github.hide212131.langchain4j.claude.broker.runtime.stream;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryResult;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 1 リクエストにつき 1 つだけ登録できる出力購読者。
 */
public interface StreamListener {

    /** CLI が出力した順にチャンクを受け取る。 */
    void onChunk(String chunk);

    /** 終端状態に達したときにちょうど 1 回呼ばれる。以降 {@link #onChunk(String)} は呼ばれない。 */
    void onTerminal(QueryResult result);

    static StreamListener of(Consumer<String> onChunk, Consumer<QueryResult> onTerminal) {
        Objects.requireNonNull(onChunk, "onChunk");
        Objects.requireNonNull(onTerminal, "onTerminal");
        return new StreamListener() {
            @Override
            public void onChunk(String chunk) {
                onChunk.accept(chunk);
            }

            @Override
            public void onTerminal(QueryResult result) {
                onTerminal.accept(result);
            }
        };
    }
}
