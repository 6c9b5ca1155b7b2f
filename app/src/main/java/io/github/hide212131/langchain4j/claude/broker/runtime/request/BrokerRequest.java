package io.github.hide212131.langchain4j.claude.broker.runtime.request;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ブローカーに投入された 1 件のリクエスト。状態遷移は CAS で行い、終端状態からは戻らない。
 */
public final class BrokerRequest {

    private final String id;
    private final String prompt;
    private final byte[] payload;
    private final QueryOptions options;
    private final RequestMode mode;
    private final Instant submittedAt;
    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.QUEUED);
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    public BrokerRequest(String id, String prompt, byte[] payload, QueryOptions options, RequestMode mode,
            Instant submittedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.payload = payload == null ? null : payload.clone();
        this.options = Objects.requireNonNull(options, "options");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
    }

    public String id() {
        return id;
    }

    public String prompt() {
        return prompt;
    }

    public boolean hasPayload() {
        return payload != null;
    }

    byte[] payload() {
        return payload;
    }

    public QueryOptions options() {
        return options;
    }

    public RequestMode mode() {
        return mode;
    }

    public RequestState state() {
        return state.get();
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    boolean markRunning(Instant now) {
        if (state.compareAndSet(RequestState.QUEUED, RequestState.RUNNING)) {
            startedAt = now;
            return true;
        }
        return false;
    }

    boolean markStreaming() {
        return state.compareAndSet(RequestState.RUNNING, RequestState.STREAMING);
    }

    /**
     * 終端状態へ遷移する。
     *
     * @return 遷移した場合は {@code true}。既に終端なら {@code false}
     */
    boolean finish(RequestState terminal, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("終端状態ではありません: " + terminal);
        }
        while (true) {
            RequestState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, terminal)) {
                completedAt = now;
                return true;
            }
        }
    }
}
