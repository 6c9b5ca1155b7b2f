package io.github.hide212131.langchain4j.claude.broker.runtime;

import java.time.Duration;

/**
 * 1 リクエスト分のオプション。未指定の値は {@code null} で、ブローカーの既定値が使われる。
 *
 * @param maxTokens 最大出力トークン数
 * @param timeout リクエストのタイムアウト
 * @param model モデル名
 */
public record QueryOptions(Integer maxTokens, Duration timeout, String model) {

    private static final QueryOptions DEFAULTS = new QueryOptions(null, null, null);

    public QueryOptions {
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens は正の値である必要があります: " + maxTokens);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout は正の値である必要があります: " + timeout);
        }
        if (model != null && model.isBlank()) {
            model = null;
        }
    }

    public static QueryOptions defaults() {
        return DEFAULTS;
    }

    public QueryOptions withTimeout(Duration value) {
        return new QueryOptions(maxTokens, value, model);
    }

    public QueryOptions withMaxTokens(Integer value) {
        return new QueryOptions(value, timeout, model);
    }

    public QueryOptions withModel(String value) {
        return new QueryOptions(maxTokens, timeout, value);
    }

    public Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }
}
