package io.github.hide212131.langchain4j.claude.broker.runtime.process;

/** CLI の出力を期待する構造として解釈できなかった場合の例外。 */
public class MalformedOutputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedOutputException(String message) {
        super(message);
    }

    public MalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
