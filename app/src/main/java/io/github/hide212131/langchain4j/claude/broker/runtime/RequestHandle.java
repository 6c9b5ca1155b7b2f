package io.github.hide212131.langchain4j.claude.broker.runtime;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 投入済みリクエストへの参照。{@link ClaudeCliBroker#cancel(String)} に渡す ID と結果の Future を持つ。
 */
public record RequestHandle(String requestId, CompletableFuture<QueryResult> result) {

    public RequestHandle {
        Objects.requireNonNull(result, "result");
    }

    /** 終端状態に達し、すべての資源が解放されるまで待つ。 */
    public QueryResult await() {
        try {
            return result.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("結果待ちが中断されました: " + requestId, ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("結果の取得に失敗しました: " + requestId, ex.getCause());
        }
    }
}
