package io.github.hide212131.langchain4j.claude.broker.runtime.request;

/** CLI の出力形式を決めるリクエスト種別。 */
public enum RequestMode {
    /** JSON 出力をまとめて受け取る。 */
    QUERY,
    /** テキスト出力をチャンク単位で購読者へ流す。 */
    STREAM
}
