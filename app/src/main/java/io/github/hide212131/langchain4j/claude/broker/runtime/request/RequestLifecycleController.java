package io.github.hide212131.langchain4j.claude.broker.runtime.request;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerErrorKind;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryResult;
import io.github.hide212131.langchain4j.claude.broker.runtime.RequestHandle;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.ArtifactIoException;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.TemporaryArtifactManager;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.ProcessSlotPool;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.SlotLease;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.SlotTask;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.TerminationCause;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ClaudeCommandBuilder;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ClaudeOutputParser;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.EnvironmentSanitizer;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessHandle;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessLauncher;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.MalformedOutputException;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ProcessSpec;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamListener;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * リクエストの状態遷移を管理し、プール・ストリーム中継・一時ファイルの間を取り持つ。
 *
 * <p>どの終端状態に至っても、一時ファイルの削除、ストリームの終端通知、枠の返却を行ってから呼び出し側の
 * Future を完了させる。CLI 経路の失敗はすべて {@link QueryResult} に変換し、例外として外へ出さない。
 */
@SuppressWarnings({ "PMD.AvoidCatchingGenericException", "PMD.ExcessiveImports", "PMD.CouplingBetweenObjects" })
public final class RequestLifecycleController {

    private static final String PHASE = "process";
    private static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(2);
    private static final int READ_BUFFER_SIZE = 4096;

    private final ProcessSlotPool pool;
    private final StreamBroker streams;
    private final TemporaryArtifactManager artifacts;
    private final ExternalProcessLauncher launcher;
    private final ClaudeCommandBuilder commands;
    private final ClaudeOutputParser parser;
    private final EnvironmentSanitizer sanitizer;
    private final Supplier<Map<String, String>> environment;
    private final Duration defaultTimeout;
    private final Clock clock;
    private final BrokerLog log = BrokerLog.forClass(RequestLifecycleController.class);
    private final Map<String, BrokerRequest> requests = new ConcurrentHashMap<>();
    private final ExecutorService io;

    @SuppressWarnings("checkstyle:ParameterNumber")
    public RequestLifecycleController(ProcessSlotPool pool, StreamBroker streams, TemporaryArtifactManager artifacts,
            ExternalProcessLauncher launcher, ClaudeCommandBuilder commands, EnvironmentSanitizer sanitizer,
            Supplier<Map<String, String>> environment, Duration defaultTimeout, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.streams = Objects.requireNonNull(streams, "streams");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.parser = new ClaudeOutputParser();
        AtomicInteger counter = new AtomicInteger();
        this.io = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "claude-cli-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * リクエストを作成してプールへ投入する。
     *
     * @param listener ストリーム購読者。不要なら {@code null}
     */
    public RequestHandle submit(String prompt, byte[] payload, QueryOptions options, RequestMode mode,
            StreamListener listener) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(mode, "mode");
        BrokerRequest request = new BrokerRequest(UUID.randomUUID().toString(), prompt, payload, options, mode,
                clock.instant());
        CompletableFuture<QueryResult> future = new CompletableFuture<>();
        streams.open(request.id());
        if (listener != null) {
            streams.subscribe(request.id(), listener);
        }
        requests.put(request.id(), request);
        try {
            boolean admitted = pool.submit(new Execution(request, future));
            log.debug(PHASE, request.id(), "request.submit", "リクエストを受け付けました",
                    "mode=" + mode + " admitted=" + admitted + " payload=" + request.hasPayload());
        } catch (IllegalStateException ex) {
            requests.remove(request.id());
            QueryResult rejected = QueryResult.cancelled(request.id());
            request.finish(RequestState.CANCELLED, clock.instant());
            streams.terminate(request.id(), rejected);
            throw ex;
        }
        return new RequestHandle(request.id(), future);
    }

    public boolean cancel(String requestId) {
        if (requestId == null) {
            return false;
        }
        return pool.cancel(requestId);
    }

    public Optional<BrokerRequest> find(String requestId) {
        return Optional.ofNullable(requestId).map(requests::get);
    }

    public int liveRequests() {
        return requests.size();
    }

    public void shutdown() {
        io.shutdownNow();
    }

    Duration timeoutOf(BrokerRequest request) {
        return request.options().timeoutOr(defaultTimeout);
    }

    private final class Execution implements SlotTask {

        private final BrokerRequest request;
        private final CompletableFuture<QueryResult> future;
        private volatile QueryResult result;

        Execution(BrokerRequest request, CompletableFuture<QueryResult> future) {
            this.request = request;
            this.future = future;
        }

        @Override
        public String requestId() {
            return request.id();
        }

        @Override
        public Duration timeout() {
            return timeoutOf(request);
        }

        @Override
        public void run(SlotLease lease) {
            request.markRunning(clock.instant());
            Path artifact = null;
            QueryResult outcome;
            try {
                if (request.hasPayload()) {
                    artifact = artifacts.acquire(request.id(), request.payload());
                }
                outcome = execute(lease, artifact);
            } catch (ArtifactIoException ex) {
                log.warn(PHASE, request.id(), "artifact.acquire", "一時ファイルを作成できませんでした", "", ex);
                outcome = QueryResult.failed(request.id(), BrokerErrorKind.ARTIFACT_IO_FAILURE, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error(PHASE, request.id(), "process.run", "CLI 実行中に予期しない例外が発生しました", "", ex);
                outcome = QueryResult.failed(request.id(), BrokerErrorKind.RUNTIME_FAILURE, ex.getMessage());
            } finally {
                artifacts.release(artifact);
            }
            TerminationCause cause = lease.seal();
            if (cause != null && outcome.state() == RequestState.FAILED) {
                outcome = resultFor(cause);
            }
            result = finish(outcome);
        }

        @Override
        public void released() {
            QueryResult finalResult = result;
            if (finalResult == null) {
                finalResult = finish(QueryResult.cancelled(request.id()));
            }
            requests.remove(request.id());
            future.complete(finalResult);
        }

        @Override
        public void abandoned(TerminationCause cause) {
            QueryResult finalResult = finish(resultFor(cause));
            requests.remove(request.id());
            future.complete(finalResult);
        }

        private QueryResult execute(SlotLease lease, Path artifact) {
            TerminationCause early = lease.terminationCause();
            if (early != null) {
                lease.seal();
                return resultFor(early);
            }
            ProcessSpec spec = new ProcessSpec(commands.prompt(request.mode(), request.options(), artifact),
                    sanitizer.sanitize(environment.get()));
            ExternalProcessHandle process;
            try {
                process = launcher.spawn(spec);
            } catch (IOException ex) {
                log.warn(PHASE, request.id(), "process.spawn", "CLI プロセスを起動できませんでした",
                        "command=" + spec.executable(), ex);
                return QueryResult.failed(request.id(), BrokerErrorKind.SPAWN_FAILURE,
                        "Failed to start Claude CLI: " + ex.getMessage());
            }
            if (!lease.attach(process)) {
                process.kill();
            }
            log.info(PHASE, request.id(), "process.spawn", "CLI プロセスを起動しました",
                    "pid=" + process.pid() + " mode=" + request.mode());
            return supervise(lease, process);
        }

        private QueryResult supervise(SlotLease lease, ExternalProcessHandle process) {
            StringBuilder collected = new StringBuilder();
            Consumer<String> sink = request.mode() == RequestMode.STREAM ? this::publish : collected::append;
            Future<?> stdoutPump = io.submit(() -> {
                pump(process.stdout(), sink);
                return null;
            });
            Future<String> stderrPump = io.submit(() -> {
                StringBuilder stderr = new StringBuilder();
                pump(process.stderr(), stderr::append);
                return stderr.toString();
            });
            try {
                process.writeInput(request.prompt());
            } catch (IOException ex) {
                log.debug(PHASE, request.id(), "process.stdin", "標準入力への書き込みに失敗しました", ex.getMessage());
            }
            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                process.kill();
                lease.seal();
                return QueryResult.cancelled(request.id());
            }
            boolean drained = drain(stdoutPump);
            String stderr = drainText(stderrPump);
            TerminationCause cause = lease.seal();
            if (cause != null) {
                return resultFor(cause);
            }
            if (exitCode != 0) {
                String detail = stderr.isBlank() ? "Unknown error" : stderr.trim();
                log.warn(PHASE, request.id(), "process.exit", "CLI が異常終了しました", "exitCode=" + exitCode, null);
                return QueryResult.failed(request.id(), BrokerErrorKind.RUNTIME_FAILURE,
                        "Claude CLI exited with code " + exitCode + ": " + detail);
            }
            if (!drained) {
                return QueryResult.failed(request.id(), BrokerErrorKind.RUNTIME_FAILURE,
                        "Claude CLI output was not closed after exit");
            }
            if (request.mode() == RequestMode.STREAM) {
                String aggregate = streams.aggregate(request.id());
                return QueryResult.completed(request.id(), aggregate == null ? "" : aggregate);
            }
            return parse(collected.toString());
        }

        private QueryResult parse(String stdout) {
            try {
                ClaudeOutputParser.ParsedOutput parsed = parser.parse(stdout);
                if (parsed.error()) {
                    return QueryResult.failed(request.id(), BrokerErrorKind.RUNTIME_FAILURE,
                            "Claude CLI reported an error: " + parsed.text());
                }
                return QueryResult.completed(request.id(), parsed.text());
            } catch (MalformedOutputException ex) {
                log.warn(PHASE, request.id(), "process.parse", "CLI の出力を解釈できませんでした", "", ex);
                return QueryResult.failed(request.id(), BrokerErrorKind.MALFORMED_OUTPUT, ex.getMessage());
            }
        }

        private void publish(String chunk) {
            request.markStreaming();
            streams.publish(request.id(), chunk);
        }

        private QueryResult finish(QueryResult outcome) {
            request.finish(outcome.state(), clock.instant());
            streams.terminate(request.id(), outcome);
            log.info(PHASE, request.id(), "request.finish", "リクエストが終端状態に達しました",
                    "state=" + outcome.state() + (outcome.errorKind() != null ? " errorKind=" + outcome.errorKind()
                            : ""));
            return outcome;
        }

        private QueryResult resultFor(TerminationCause cause) {
            return cause == TerminationCause.TIMED_OUT ? QueryResult.timedOut(request.id(), timeout())
                    : QueryResult.cancelled(request.id());
        }

        private boolean drain(Future<?> pump) {
            try {
                pump.get(OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                pump.cancel(true);
                return false;
            } catch (ExecutionException ex) {
                log.warn(PHASE, request.id(), "process.stdout", "標準出力の読み取りに失敗しました", "", ex.getCause());
                return false;
            } catch (TimeoutException ex) {
                pump.cancel(true);
                return false;
            }
        }

        private String drainText(Future<String> pump) {
            try {
                return pump.get(OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                pump.cancel(true);
                return "";
            } catch (ExecutionException | TimeoutException ex) {
                pump.cancel(true);
                return "";
            }
        }
    }

    private static void pump(InputStream stream, Consumer<String> sink) throws IOException {
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            char[] buffer = new char[READ_BUFFER_SIZE];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                if (read > 0) {
                    sink.accept(new String(buffer, 0, read));
                }
            }
        }
    }
}
