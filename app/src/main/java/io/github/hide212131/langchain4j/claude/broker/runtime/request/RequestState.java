package io.github.hide212131.langchain4j.claude.broker.runtime.request;

/**
 * リクエストの状態。{@code QUEUED → RUNNING → (STREAMING) → 終端状態} の順にのみ遷移する。
 */
public enum RequestState {
    QUEUED,
    RUNNING,
    STREAMING,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMED_OUT;
    }
}
