package io.github.hide212131.langchain4j.claude.broker.runtime.provider;

import java.util.Objects;

/**
 * リモート API の応答。
 *
 * @param content 応答テキスト
 * @param inputTokens 入力トークン数。不明なら {@code null}
 * @param outputTokens 出力トークン数。不明なら {@code null}
 * @param durationMs 呼び出しに要した時間
 */
public record RemoteCompletion(String content, Integer inputTokens, Integer outputTokens, long durationMs) {

    public RemoteCompletion {
        Objects.requireNonNull(content, "content");
    }
}
