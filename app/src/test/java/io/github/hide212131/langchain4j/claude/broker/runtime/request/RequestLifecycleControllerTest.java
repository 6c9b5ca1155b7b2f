package io.github.hide212131.langchain4j.claude.broker.runtime.request;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerErrorKind;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryResult;
import io.github.hide212131.langchain4j.claude.broker.runtime.RequestHandle;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.TemporaryArtifactManager;
import io.github.hide212131.langchain4j.claude.broker.runtime.pool.ProcessSlotPool;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ClaudeCommandBuilder;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.EnvironmentSanitizer;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ProcessSpec;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ScriptedProcessLauncher;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ScriptedProcessLauncher.Script;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.stream.StreamListener;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("PMD.JUnitTestContainsTooManyAsserts")
class RequestLifecycleControllerTest {

    private static final Map<String, String> PARENT_ENVIRONMENT = Map.of("PATH", "/usr/bin", "ANTHROPIC_API_KEY",
            "sk-ant-secret", "ANTHROPIC_AUTH_TOKEN", "token-secret");
    private static final byte[] IMAGE = "png-bytes".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private ProcessSlotPool pool;
    private StreamBroker streams;
    private RequestLifecycleController controller;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(2));
        }
        if (controller != null) {
            controller.shutdown();
        }
    }

    @Test
    @DisplayName("問い合わせは JSON 出力から応答を取り出し、プロンプトは標準入力で渡す")
    void queryParsesJsonAndWritesPromptToStdin() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.emits("{\"result\":\"hello\"}"));
        controller = controller(launcher);

        QueryResult result = controller.submit("秘密のプロンプト", null, QueryOptions.defaults(), RequestMode.QUERY, null)
                .await();

        assertThat(result.success()).isTrue();
        assertThat(result.content()).isEqualTo("hello");
        assertThat(result.state()).isEqualTo(RequestState.COMPLETED);
        ProcessSpec spec = launcher.spawned().get(0);
        assertThat(spec.command()).containsSequence("-p", "--output-format", "json");
        assertThat(spec.command()).doesNotContain("秘密のプロンプト");
        assertThat(launcher.handles().get(0).inputs()).containsExactly("秘密のプロンプト");
        assertThat(controller.liveRequests()).isZero();
        assertThat(streams.openChannels()).isZero();
    }

    @Test
    @DisplayName("子プロセスの環境から API キー系の変数が取り除かれる")
    void shadowsCredentialVariables() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.emits("{\"result\":\"ok\"}"));
        controller = controller(launcher);

        controller.submit("hi", null, QueryOptions.defaults(), RequestMode.QUERY, null).await();

        Map<String, String> environment = launcher.spawned().get(0).environment();
        assertThat(environment).containsEntry("PATH", "/usr/bin");
        assertThat(environment).doesNotContainKeys("ANTHROPIC_API_KEY", "ANTHROPIC_AUTH_TOKEN");
    }

    @Test
    @DisplayName("ストリームは出力順にチャンクを渡し、終端通知はちょうど 1 回")
    void streamDeliversChunksInOrderThenOneTerminal() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.emits("Hel", "lo ", "world"));
        controller = controller(launcher);
        List<String> chunks = new CopyOnWriteArrayList<>();
        List<QueryResult> terminals = new CopyOnWriteArrayList<>();

        QueryResult result = controller.submit("greet", null, QueryOptions.defaults(), RequestMode.STREAM,
                StreamListener.of(chunks::add, terminals::add)).await();

        assertThat(String.join("", chunks)).isEqualTo("Hello world");
        assertThat(terminals).hasSize(1);
        assertThat(terminals.get(0)).isEqualTo(result);
        assertThat(result.content()).isEqualTo("Hello world");
        assertThat(launcher.spawned().get(0).command()).containsSequence("--output-format", "text");
    }

    @Test
    @DisplayName("非ゼロ終了は標準エラーの内容を含む失敗になる")
    void nonZeroExitBecomesRuntimeFailure() {
        controller = controller(new ScriptedProcessLauncher(Script.fails(2, "rate limited\n")));

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.QUERY, null).await();

        assertThat(result.errorKind()).isEqualTo(BrokerErrorKind.RUNTIME_FAILURE);
        assertThat(result.error()).isEqualTo("Claude CLI exited with code 2: rate limited");
        assertThat(result.state()).isEqualTo(RequestState.FAILED);
    }

    @Test
    @DisplayName("標準エラーが空の異常終了は Unknown error と報告する")
    void nonZeroExitWithoutStderr() {
        controller = controller(new ScriptedProcessLauncher(Script.fails(1, "")));

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.QUERY, null).await();

        assertThat(result.error()).isEqualTo("Claude CLI exited with code 1: Unknown error");
    }

    @Test
    @DisplayName("JSON として読めない出力は MALFORMED_OUTPUT になる")
    void malformedOutput() {
        controller = controller(new ScriptedProcessLauncher(Script.emits("this is not json")));

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.QUERY, null).await();

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(BrokerErrorKind.MALFORMED_OUTPUT);
    }

    @Test
    @DisplayName("CLI が is_error を報告した場合は失敗として扱う")
    void reportedErrorIsFailure() {
        controller = controller(new ScriptedProcessLauncher(
                Script.emits("{\"is_error\":true,\"result\":\"Credit balance is too low\"}")));

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.QUERY, null).await();

        assertThat(result.errorKind()).isEqualTo(BrokerErrorKind.RUNTIME_FAILURE);
        assertThat(result.error()).contains("Credit balance is too low");
    }

    @Test
    @DisplayName("起動に失敗した場合は SPAWN_FAILURE になり、枠は返却される")
    void spawnFailure() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.emits("{}"));
        launcher.failSpawnWith(new IOException("No such file or directory"));
        controller = controller(launcher);

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.QUERY, null).await();

        assertThat(result.errorKind()).isEqualTo(BrokerErrorKind.SPAWN_FAILURE);
        assertThat(result.error()).isEqualTo("Failed to start Claude CLI: No such file or directory");
        assertThat(pool.snapshot().activeSlots()).isZero();
    }

    @Test
    @DisplayName("起動失敗で終端に達したリクエストの取り消しは false を返す")
    void cancelAfterSpawnFailureReturnsFalse() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.emits("{}"));
        launcher.failSpawnWith(new IOException("No such file or directory"));
        controller = controller(launcher);
        List<Boolean> cancelledFromTerminal = new CopyOnWriteArrayList<>();

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.STREAM,
                StreamListener.of(chunk -> {
                }, terminal -> cancelledFromTerminal.add(controller.cancel(terminal.requestId())))).await();

        assertThat(result.state()).isEqualTo(RequestState.FAILED);
        assertThat(result.errorKind()).isEqualTo(BrokerErrorKind.SPAWN_FAILURE);
        assertThat(cancelledFromTerminal).containsExactly(false);
        assertThat(controller.cancel(result.requestId())).isFalse();
    }

    @Test
    @DisplayName("期限を過ぎたリクエストは TIMED_OUT になる")
    void timesOut() {
        controller = controller(new ScriptedProcessLauncher(Script.hangsAfter("partial")));

        QueryResult result = controller.submit("hi", null, QueryOptions.defaults().withTimeout(Duration.ofMillis(150)),
                RequestMode.STREAM, null).await();

        assertThat(result.state()).isEqualTo(RequestState.TIMED_OUT);
        assertThat(result.errorKind()).isEqualTo(BrokerErrorKind.TIMEOUT);
        assertThat(result.error()).isEqualTo("Request timed out after 150ms");
    }

    @Test
    @DisplayName("実行中の取り消しは CANCELLED で終わり、終端通知も届く")
    void cancelWhileRunning() throws Exception {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.hangsAfter("partial"));
        controller = controller(launcher);
        List<QueryResult> terminals = new CopyOnWriteArrayList<>();

        RequestHandle handle = controller.submit("hi", null, QueryOptions.defaults(), RequestMode.STREAM,
                StreamListener.of(chunk -> {
                }, terminals::add));
        awaitSpawned(launcher, 1);

        assertThat(controller.cancel(handle.requestId())).isTrue();
        QueryResult result = handle.result().get(2, TimeUnit.SECONDS);

        assertThat(result.state()).isEqualTo(RequestState.CANCELLED);
        assertThat(terminals).containsExactly(result);
        assertThat(controller.cancel(handle.requestId())).isFalse();
        assertThat(controller.find(handle.requestId())).isEmpty();
    }

    @Test
    @DisplayName("画像の一時ファイルは実行中だけ存在し、成功時に削除される")
    void artifactRemovedAfterSuccess() throws IOException {
        List<Boolean> existedAtSpawn = new CopyOnWriteArrayList<>();
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(
                recordingArtifact(existedAtSpawn, spec -> Script.emits("{\"result\":\"a cat\"}")));
        controller = controller(launcher);

        QueryResult result = controller.submit("describe", IMAGE, QueryOptions.defaults(), RequestMode.QUERY, null)
                .await();

        assertThat(result.content()).isEqualTo("a cat");
        assertThat(existedAtSpawn).containsExactly(true);
        assertThat(filesIn(tempDir)).isEmpty();
    }

    @Test
    @DisplayName("失敗・期限切れ・取り消しのどの経路でも一時ファイルは残らない")
    void artifactRemovedOnEveryTerminalPath() throws Exception {
        List<Boolean> existedAtSpawn = new CopyOnWriteArrayList<>();
        ScriptedProcessLauncher failing = new ScriptedProcessLauncher(
                recordingArtifact(existedAtSpawn, spec -> Script.fails(1, "bad image")));
        controller = controller(failing);
        controller.submit("describe", IMAGE, QueryOptions.defaults(), RequestMode.QUERY, null).await();
        assertThat(filesIn(tempDir)).isEmpty();
        tearDown();

        ScriptedProcessLauncher hanging = new ScriptedProcessLauncher(
                recordingArtifact(existedAtSpawn, spec -> Script.hangsAfter()));
        controller = controller(hanging);
        QueryResult timedOut = controller.submit("describe", IMAGE,
                QueryOptions.defaults().withTimeout(Duration.ofMillis(100)), RequestMode.QUERY, null).await();
        assertThat(timedOut.state()).isEqualTo(RequestState.TIMED_OUT);
        assertThat(filesIn(tempDir)).isEmpty();

        RequestHandle handle = controller.submit("describe", IMAGE, QueryOptions.defaults(), RequestMode.QUERY, null);
        awaitSpawned(hanging, 2);
        controller.cancel(handle.requestId());
        assertThat(handle.result().get(2, TimeUnit.SECONDS).state()).isEqualTo(RequestState.CANCELLED);
        assertThat(filesIn(tempDir)).isEmpty();
        assertThat(existedAtSpawn).containsOnly(true);
    }

    private RequestLifecycleController controller(ScriptedProcessLauncher launcher) {
        pool = new ProcessSlotPool(2, Duration.ofMillis(100), Clock.systemUTC());
        pool.start();
        streams = new StreamBroker();
        return new RequestLifecycleController(pool, streams, new TemporaryArtifactManager(tempDir), launcher,
                new ClaudeCommandBuilder("claude"), EnvironmentSanitizer.defaults(), () -> PARENT_ENVIRONMENT,
                Duration.ofSeconds(30), Clock.systemUTC());
    }

    private static Function<ProcessSpec, Script> recordingArtifact(List<Boolean> existed,
            Function<ProcessSpec, Script> script) {
        return spec -> {
            int index = spec.command().indexOf("--image");
            existed.add(index >= 0 && Files.exists(Path.of(spec.command().get(index + 1))));
            return script.apply(spec);
        };
    }

    private static List<Path> filesIn(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.toList();
        }
    }

    private static void awaitSpawned(ScriptedProcessLauncher launcher, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (launcher.spawnCount() < count && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(launcher.spawnCount()).isGreaterThanOrEqualTo(count);
    }
}
