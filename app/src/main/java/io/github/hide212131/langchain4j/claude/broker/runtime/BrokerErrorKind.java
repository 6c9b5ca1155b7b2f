package io.github.hide212131.langchain4j.claude.broker.runtime;

/**
 * CLI 経路で発生しうる失敗の分類。フォールバック判定はこの値を見て行う。
 */
public enum BrokerErrorKind {
    /** CLI がインストールされていない。プロセスは起動されない。 */
    NOT_INSTALLED,
    /** CLI が認証されていない。プロセスは起動されない。 */
    NOT_AUTHENTICATED,
    /** プロセスを生成できなかった。 */
    SPAWN_FAILURE,
    /** 非ゼロ終了、または CLI がエラー応答を返した。 */
    RUNTIME_FAILURE,
    /** 出力を期待する構造に解釈できなかった。 */
    MALFORMED_OUTPUT,
    TIMEOUT,
    CANCELLED,
    /** 一時ファイルの書き込みに失敗した。 */
    ARTIFACT_IO_FAILURE
}
