package io.github.hide212131.langchain4j.claude.broker.runtime.artifact;

/** 一時ファイルの作成に失敗した場合の例外。 */
public class ArtifactIoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ArtifactIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
