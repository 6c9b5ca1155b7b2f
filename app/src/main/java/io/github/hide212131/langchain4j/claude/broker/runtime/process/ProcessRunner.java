package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 完了まで待つ短いコマンド (--version, auth status) を実行する。プールの枠は使わない。
 */
@SuppressWarnings("PMD.CloseResource")
public final class ProcessRunner {

    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private ProcessRunner() {
        throw new AssertionError("インスタンス化できません");
    }

    /**
     * コマンドを起動し、終了まで最大 {@code timeout} 待つ。
     *
     * @throws IOException 起動に失敗した場合
     * @throws TimeoutException 期限内に終了しなかった場合。プロセスは強制終了される
     */
    public static ExecutionResult run(ExternalProcessLauncher launcher, ProcessSpec spec, Duration timeout)
            throws IOException, TimeoutException {
        Objects.requireNonNull(launcher, "launcher");
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(timeout, "timeout");
        long startedAt = System.nanoTime();
        ExternalProcessHandle process = launcher.spawn(spec);
        ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "claude-cli-probe-io");
            thread.setDaemon(true);
            return thread;
        });
        try {
            process.writeInput(null);
            Future<String> stdoutFuture = executor.submit(() -> readStream(process.stdout()));
            Future<String> stderrFuture = executor.submit(() -> readStream(process.stderr()));
            if (!process.waitFor(timeout)) {
                throw new TimeoutException(
                        "コマンドが " + timeout.toMillis() + "ms 以内に終了しませんでした: " + spec.displayCommand());
            }
            int exitCode = process.waitFor();
            String stdout = getFuture(stdoutFuture, spec);
            String stderr = getFuture(stderrFuture, spec);
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
            return new ExecutionResult(spec.displayCommand(), exitCode, stdout, stderr, elapsedMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("コマンドの実行が中断されました: " + spec.displayCommand(), ex);
        } finally {
            if (process.isAlive()) {
                process.kill();
            }
            shutdownExecutor(executor);
        }
    }

    private static String readStream(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String getFuture(Future<String> future, ProcessSpec spec) throws IOException {
        try {
            return future.get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("コマンドの出力取得が中断されました: " + spec.displayCommand(), ex);
        } catch (ExecutionException ex) {
            throw new IOException("コマンドの出力取得に失敗しました: " + spec.displayCommand(), ex.getCause());
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new IOException("コマンドの出力が閉じられませんでした: " + spec.displayCommand(), ex);
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(3, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
