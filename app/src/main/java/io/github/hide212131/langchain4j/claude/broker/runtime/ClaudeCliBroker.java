package io.github.hide212131.langchain4j.claude.broker.runtime;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.TemporaryArtifactManager;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.AuthenticationStatus;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.AvailabilityChecker;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.BrokerStatus;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.CliAvailabilityChecker;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.InstallationStatus;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.PoolSnapshot;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.ProcessSlotPool;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ClaudeCommandBuilder;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.EnvironmentSanitizer;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessLauncher;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.NativeProcessLauncher;
import io.github.hide212131.langchain4j.claude.broker.runtime.request.RequestLifecycleController;
import io.github.hide212131.langchain4j.claude.broker.runtime.request.RequestMode;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamListener;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Claude CLI をサブプロセスとして実行するブローカー。
 *
 * <p>同時に起動するプロセス数を {@link BrokerConfiguration#capacity()} に制限し、超過分は FIFO で待たせる。
 * 各リクエストは必ず終端状態に達し、プロセス・一時ファイル・ストリーム購読はすべての経路で解放される。
 * 利用前に {@link #start()}、終了時に {@link #shutdown()} を呼ぶこと。
 */
@SuppressWarnings({ "PMD.ExcessiveImports", "PMD.TooManyMethods" })
public final class ClaudeCliBroker implements AutoCloseable {

    private static final String PHASE = "broker";
    private static final Duration SHUTDOWN_AWAIT = Duration.ofSeconds(5);

    private final BrokerConfiguration configuration;
    private final AvailabilityChecker availability;
    private final ProcessSlotPool pool;
    private final StreamBroker streams;
    private final TemporaryArtifactManager artifacts;
    private final RequestLifecycleController controller;
    private final BrokerLog log = BrokerLog.forClass(ClaudeCliBroker.class);

    private final Object stateLock = new Object();
    private boolean started;
    private boolean stopped;

    /** 実プロセスと現在の環境変数を使うブローカーを作成する。 */
    public ClaudeCliBroker(BrokerConfiguration configuration) {
        this(configuration, new NativeProcessLauncher(), System::getenv, Clock.systemUTC());
    }

    public ClaudeCliBroker(BrokerConfiguration configuration, ExternalProcessLauncher launcher,
            Supplier<Map<String, String>> environment, Clock clock) {
        this(configuration, launcher, environment,
                new CliAvailabilityChecker(launcher, new ClaudeCommandBuilder(configuration.cliCommand()),
                        EnvironmentSanitizer.defaults(), environment, configuration.statusTtl(), clock),
                clock);
    }

    public ClaudeCliBroker(BrokerConfiguration configuration, ExternalProcessLauncher launcher,
            Supplier<Map<String, String>> environment, AvailabilityChecker availability, Clock clock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.availability = Objects.requireNonNull(availability, "availability");
        Objects.requireNonNull(launcher, "launcher");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(clock, "clock");
        this.pool = new ProcessSlotPool(configuration.capacity(), configuration.terminationGrace(), clock);
        this.streams = new StreamBroker();
        this.artifacts = new TemporaryArtifactManager(configuration.artifactDirectory());
        this.controller = new RequestLifecycleController(pool, streams, artifacts, launcher,
                new ClaudeCommandBuilder(configuration.cliCommand()), EnvironmentSanitizer.defaults(), environment,
                configuration.defaultTimeout(), clock);
    }

    public void start() {
        synchronized (stateLock) {
            if (stopped) {
                throw new IllegalStateException("停止済みのブローカーは再開できません");
            }
            if (started) {
                return;
            }
            pool.start();
            started = true;
        }
        log.info(PHASE, null, "broker.start", "ブローカーを開始しました",
                "capacity=" + configuration.capacity() + " timeoutMs=" + configuration.defaultTimeout().toMillis());
    }

    public InstallationStatus checkInstalled() {
        return availability.checkInstalled();
    }

    public AuthenticationStatus checkAuthenticated() {
        return availability.checkAuthenticated();
    }

    /** キャッシュ済みの可用性と現在の枠の使用状況を返す。 */
    public BrokerStatus status() {
        return BrokerStatus.of(availability.cachedInstallation(), availability.cachedAuthentication(),
                pool.snapshot());
    }

    public PoolSnapshot poolSnapshot() {
        return pool.snapshot();
    }

    public QueryResult query(String prompt, QueryOptions options) {
        return submitQuery(prompt, options).await();
    }

    public RequestHandle submitQuery(String prompt, QueryOptions options) {
        return submit(prompt, null, options, RequestMode.QUERY, null);
    }

    /**
     * 画像付きで問い合わせる。画像は一時ファイルに書き出して CLI に渡し、終了時に削除する。
     */
    public QueryResult queryWithImage(String prompt, byte[] image, QueryOptions options) {
        return submitQueryWithImage(prompt, image, options).await();
    }

    public RequestHandle submitQueryWithImage(String prompt, byte[] image, QueryOptions options) {
        Objects.requireNonNull(image, "image");
        return submit(prompt, image, options, RequestMode.QUERY, null);
    }

    /**
     * 出力をチャンク単位で {@code listener} に渡しながら実行し、終端まで待つ。
     *
     * @param listener 購読者。{@code null} の場合は集約結果だけを返す
     * @return 成功時は集約した全文を content に持つ結果
     */
    public QueryResult stream(String prompt, QueryOptions options, StreamListener listener) {
        return submitStream(prompt, options, listener).await();
    }

    public RequestHandle submitStream(String prompt, QueryOptions options, StreamListener listener) {
        return submit(prompt, null, options, RequestMode.STREAM, listener);
    }

    /**
     * リクエストを取り消す。
     *
     * @return 取り消した場合は {@code true}。終了済みまたは不明な ID なら {@code false}
     */
    public boolean cancel(String requestId) {
        boolean cancelled = controller.cancel(requestId);
        log.info(PHASE, requestId, "broker.cancel", "取り消しを受け付けました", "cancelled=" + cancelled);
        return cancelled;
    }

    /** 待機中・実行中のリクエストをすべて取り消し、一時ファイルを削除する。 */
    public void shutdown() {
        synchronized (stateLock) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        log.info(PHASE, null, "broker.shutdown", "ブローカーを停止します", "");
        pool.shutdown(configuration.terminationGrace().plus(SHUTDOWN_AWAIT));
        controller.shutdown();
        artifacts.releaseAll();
    }

    @Override
    public void close() {
        shutdown();
    }

    public BrokerConfiguration configuration() {
        return configuration;
    }

    private RequestHandle submit(String prompt, byte[] payload, QueryOptions options, RequestMode mode,
            StreamListener listener) {
        Objects.requireNonNull(prompt, "prompt");
        QueryOptions resolved = options != null ? options : QueryOptions.defaults();
        ensureRunning();
        QueryResult unavailable = checkAvailability();
        if (unavailable != null) {
            log.info(PHASE, null, "broker.submit", "CLI が利用できないため実行しません",
                    "errorKind=" + unavailable.errorKind());
            if (listener != null) {
                listener.onTerminal(unavailable);
            }
            return new RequestHandle(null, CompletableFuture.completedFuture(unavailable));
        }
        return controller.submit(prompt, payload, resolved, mode, listener);
    }

    private QueryResult checkAvailability() {
        InstallationStatus installation = availability.cachedInstallation();
        if (!installation.installed()) {
            return QueryResult.unavailable(BrokerErrorKind.NOT_INSTALLED,
                    installation.error() != null ? installation.error() : "Claude CLI is not installed");
        }
        AuthenticationStatus authentication = availability.cachedAuthentication();
        if (!authentication.authenticated()) {
            return QueryResult.unavailable(BrokerErrorKind.NOT_AUTHENTICATED,
                    authentication.error() != null ? authentication.error() : "Claude CLI is not authenticated");
        }
        return null;
    }

    private void ensureRunning() {
        synchronized (stateLock) {
            if (!started || stopped) {
                throw new IllegalStateException("ブローカーが稼働していません");
            }
        }
    }
}
