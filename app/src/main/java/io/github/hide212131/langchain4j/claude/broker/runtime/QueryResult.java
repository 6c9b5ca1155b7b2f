package io.github.hide212131.langchain4j.claude.broker.runtime;

import io.github.hide212131.langchain4j.claude.broker.runtime.request.RequestState;
import java.time.Duration;
import java.util.Objects;

/**
 * CLI 経路の結果。失敗も例外ではなくこの値で返す。
 *
 * @param requestId リクエスト ID。可用性チェックで弾かれた場合は {@code null}
 * @param success 成功したかどうか
 * @param content 応答テキスト。失敗時は {@code null}
 * @param error 失敗理由。成功時は {@code null}
 * @param errorKind 失敗の分類。成功時は {@code null}
 * @param state 到達した終端状態
 */
public record QueryResult(String requestId, boolean success, String content, String error, BrokerErrorKind errorKind,
        RequestState state) {

    public QueryResult {
        Objects.requireNonNull(state, "state");
        if (success && errorKind != null) {
            throw new IllegalArgumentException("成功結果に errorKind は指定できません");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("失敗結果には errorKind が必要です");
        }
    }

    public static QueryResult completed(String requestId, String content) {
        return new QueryResult(requestId, true, content, null, null, RequestState.COMPLETED);
    }

    public static QueryResult failed(String requestId, BrokerErrorKind kind, String error) {
        return new QueryResult(requestId, false, null, error, kind, RequestState.FAILED);
    }

    public static QueryResult cancelled(String requestId) {
        return new QueryResult(requestId, false, null, "Request cancelled", BrokerErrorKind.CANCELLED,
                RequestState.CANCELLED);
    }

    public static QueryResult timedOut(String requestId, Duration timeout) {
        return new QueryResult(requestId, false, null, "Request timed out after " + timeout.toMillis() + "ms",
                BrokerErrorKind.TIMEOUT, RequestState.TIMED_OUT);
    }

    static QueryResult unavailable(BrokerErrorKind kind, String error) {
        return new QueryResult(null, false, null, error, kind, RequestState.FAILED);
    }
}
