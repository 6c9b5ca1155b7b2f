package io.github.hide212131.langchain4j.claude.broker.runtime.pool;

/** プールがプロセスを止めた理由。タイムアウトと取り消しは呼び出し側で区別できる必要がある。 */
public enum TerminationCause {
    CANCELLED,
    TIMED_OUT
}
