package io.github.hide212131.langchain4j.claude.broker.runtime.fallback;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerErrorKind;
import io.github.hide212131.langchain4j.claude.broker.runtime.ClaudeCliBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryResult;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.BrokerStatus;
import io.github.hide212131.langchain4j.claude.broker.runtime.provider.RemoteCompletion;
import io.github.hide212131.langchain4j.claude.broker.runtime.provider.RemoteCompletionClient;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamListener;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * CLI 経路を優先し、使えないか失敗した場合にリモート API 経路で応答を得る。
 *
 * <p>手順は (1) 可用性の確認、(2) 利用可能ならブローカー経由で実行、(3) 失敗・タイムアウト・例外ならリモート API、
 * (4) どちらの経路で応答したかを添えて返す。呼び出し側が取り消したリクエストはやり直さない。
 * ストリーミングで CLI が途中まで出力してから失敗した場合は、{@link StreamingCompletionListener#onReset()} を
 * 通知したうえでリモート API で最初からやり直し、出力をつなぎ合わせることはしない。
 */
@SuppressWarnings("PMD.AvoidCatchingGenericException")
public final class FallbackOrchestrator {

    private static final String PHASE = "fallback";
    private static final String CLI_DISABLED = "Claude CLI path is disabled";

    private final ClaudeCliBroker broker;
    private final RemoteCompletionClient remote;
    private final BrokerLog log = BrokerLog.forClass(FallbackOrchestrator.class);

    /**
     * @param broker CLI 経路。{@code null} なら常にリモート API を使う
     * @param remote リモート API 経路。{@code null} ならフォールバックしない
     */
    public FallbackOrchestrator(ClaudeCliBroker broker, RemoteCompletionClient remote) {
        if (broker == null && remote == null) {
            throw new IllegalArgumentException("CLI 経路とリモート API 経路の少なくとも一方が必要です");
        }
        this.broker = broker;
        this.remote = remote;
    }

    public FallbackResult complete(String prompt, QueryOptions options) {
        Objects.requireNonNull(prompt, "prompt");
        return run(() -> broker.query(prompt, options), client -> client.complete(prompt, options), null);
    }

    public FallbackResult completeWithImage(String prompt, byte[] image, String mimeType, QueryOptions options) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(image, "image");
        return run(() -> broker.queryWithImage(prompt, image, options),
                client -> client.completeWithImage(prompt, image, mimeType, options), null);
    }

    /**
     * 出力をチャンク単位で通知しながら実行する。リモート API 経路の応答は 1 チャンクとして通知する。
     */
    public FallbackResult stream(String prompt, QueryOptions options, StreamingCompletionListener listener) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(listener, "listener");
        AtomicBoolean delivered = new AtomicBoolean();
        StreamListener relay = StreamListener.of(chunk -> {
            delivered.set(true);
            listener.onChunk(chunk);
        }, result -> {
        });
        return run(() -> broker.stream(prompt, options, relay), client -> {
            if (delivered.get()) {
                log.info(PHASE, null, "fallback.reset", "CLI の途中出力を破棄してやり直します", "");
                listener.onReset();
            }
            RemoteCompletion completion = client.complete(prompt, options);
            if (!completion.content().isEmpty()) {
                listener.onChunk(completion.content());
            }
            return completion;
        }, delivered);
    }

    public boolean cliEnabled() {
        return broker != null;
    }

    public boolean remoteEnabled() {
        return remote != null;
    }

    private FallbackResult run(Supplier<QueryResult> cliCall,
            Function<RemoteCompletionClient, RemoteCompletion> remoteCall, AtomicBoolean streamed) {
        CliAttempt attempt = attemptCli(cliCall);
        if (attempt.succeeded()) {
            return FallbackResult.cli(attempt.content());
        }
        String cliError = attempt.error();
        if (remote == null) {
            throw new CompletionUnavailableException("Claude CLI failed and remote fallback is disabled: " + cliError,
                    cliError, null);
        }
        log.info(PHASE, null, "fallback.remote", "リモート API 経路に切り替えます",
                "cliError=" + cliError + (streamed != null ? " streamed=" + streamed.get() : ""));
        try {
            RemoteCompletion completion = remoteCall.apply(remote);
            return FallbackResult.remote(completion.content(), cliError);
        } catch (RuntimeException ex) {
            log.error(PHASE, null, "fallback.remote", "リモート API 経路も失敗しました", "cliError=" + cliError, ex);
            throw new CompletionUnavailableException(
                    "Both Claude CLI and remote API failed: " + cliError + " / " + ex.getMessage(), cliError, ex);
        }
    }

    private CliAttempt attemptCli(Supplier<QueryResult> cliCall) {
        if (broker == null) {
            return CliAttempt.failed(CLI_DISABLED);
        }
        BrokerStatus status;
        try {
            status = broker.status();
        } catch (RuntimeException ex) {
            log.warn(PHASE, null, "fallback.status", "可用性を確認できませんでした", "", ex);
            return CliAttempt.failed("Failed to check Claude CLI status: " + ex.getMessage());
        }
        if (!status.available()) {
            String reason = status.lastError() != null ? status.lastError() : "Claude CLI is not available";
            return CliAttempt.failed(reason);
        }
        QueryResult result;
        try {
            result = cliCall.get();
        } catch (RuntimeException ex) {
            log.warn(PHASE, null, "fallback.cli", "CLI 経路で例外が発生しました", "", ex);
            return CliAttempt.failed("Claude CLI request failed: " + ex.getMessage());
        }
        if (result.success()) {
            return new CliAttempt(result.content() != null ? result.content() : "", null);
        }
        if (result.errorKind() == BrokerErrorKind.CANCELLED) {
            throw new CancellationException("Request cancelled: " + result.requestId());
        }
        log.info(PHASE, result.requestId(), "fallback.cli", "CLI 経路が失敗しました",
                "errorKind=" + result.errorKind());
        return CliAttempt.failed(result.error() != null ? result.error() : result.errorKind().name());
    }

    private record CliAttempt(String content, String error) {

        static CliAttempt failed(String error) {
            return new CliAttempt(null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
