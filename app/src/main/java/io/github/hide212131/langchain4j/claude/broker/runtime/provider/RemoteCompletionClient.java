package io.github.hide212131.langchain4j.claude.broker.runtime.provider;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;

/**
 * CLI が使えないときに使うリモート API 経路。失敗は非チェック例外で通知する。
 */
public interface RemoteCompletionClient {

    RemoteCompletion complete(String prompt, QueryOptions options);

    RemoteCompletion completeWithImage(String prompt, byte[] image, String mimeType, QueryOptions options);
}
