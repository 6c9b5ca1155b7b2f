package io.github.hide212131.langchain4j.claude.broker.runtime;

/**
 * 設定値の読み込みや検証に失敗した場合の例外。
 */
public class BrokerConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BrokerConfigurationException(String message) {
        super(message);
    }

    public BrokerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
