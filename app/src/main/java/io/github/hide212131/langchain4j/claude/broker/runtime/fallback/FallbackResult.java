package io.github.hide212131.langchain4j.claude.broker.runtime.fallback;

import java.util.Objects;

/**
 * フォールバック込みの問い合わせ結果。
 *
 * @param content 応答テキスト
 * @param path 応答を返した経路
 * @param cliError リモート API に切り替えた場合の CLI 側の失敗理由。CLI で完了した場合は {@code null}
 */
public record FallbackResult(String content, CompletionPath path, String cliError) {

    public FallbackResult {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(path, "path");
    }

    public static FallbackResult cli(String content) {
        return new FallbackResult(content, CompletionPath.CLI, null);
    }

    public static FallbackResult remote(String content, String cliError) {
        return new FallbackResult(content, CompletionPath.REMOTE_API, cliError);
    }

    public boolean usedFallback() {
        return path == CompletionPath.REMOTE_API;
    }
}
