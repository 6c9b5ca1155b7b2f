package io.github.hide212131.langchain4j.claude.broker.app;

import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfiguration;
import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfigurationLoader;
import io.github.hide212131.langchain4j.claude.broker.runtime.ClaudeCliBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.claude.broker.runtime.LlmProvider;
import io.github.hide212131.langchain4j.claude.broker.runtime.provider.LangChain4jRemoteClient;
import io.github.hide212131.langchain4j.claude.broker.runtime.provider.RemoteCompletionClient;

/**
 * コマンドが使うブローカーとリモート API クライアントの生成元。
 */
public interface BrokerRuntimeFactory {

    /**
     * @throws io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfigurationException 設定値が不正な場合
     */
    BrokerConfiguration loadConfiguration();

    ClaudeCliBroker createBroker(BrokerConfiguration configuration);

    /**
     * @param overrideProvider 明示指定されたプロバイダ。{@code null} なら環境変数 / .env に従う
     * @throws IllegalStateException API キーなどが不足している場合
     */
    RemoteCompletionClient createRemote(LlmProvider overrideProvider);

    /** 環境変数と .env から設定を読み、実プロセスと実 API を使う。 */
    static BrokerRuntimeFactory defaults() {
        return new BrokerRuntimeFactory() {
            @Override
            public BrokerConfiguration loadConfiguration() {
                return new BrokerConfigurationLoader().load();
            }

            @Override
            public ClaudeCliBroker createBroker(BrokerConfiguration configuration) {
                return new ClaudeCliBroker(configuration);
            }

            @Override
            public RemoteCompletionClient createRemote(LlmProvider overrideProvider) {
                return LangChain4jRemoteClient.from(new LlmConfigurationLoader().load(overrideProvider));
            }
        };
    }
}
