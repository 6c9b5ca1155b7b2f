package io.github.hide212131.langchain4j.claude.broker.runtime.fallback;

/**
 * CLI 経路とリモート API 経路の両方が失敗したことを表す。
 */
public final class CompletionUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String cliError;

    public CompletionUnavailableException(String message, String cliError, Throwable cause) {
        super(message, cause);
        this.cliError = cliError;
    }

    public String cliError() {
        return cliError;
    }
}
