package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessBuilder} によるプロセス起動。親プロセスの環境は引き継がず、{@link ProcessSpec} の環境だけを渡す。
 */
@SuppressWarnings("PMD.CloseResource")
public final class NativeProcessLauncher implements ExternalProcessLauncher {

    @Override
    public ExternalProcessHandle spawn(ProcessSpec spec) throws IOException {
        Objects.requireNonNull(spec, "spec");
        ProcessBuilder builder = new ProcessBuilder(spec.command());
        Map<String, String> environment = builder.environment();
        environment.clear();
        environment.putAll(spec.environment());
        return new NativeProcessHandle(builder.start());
    }

    static final class NativeProcessHandle implements ExternalProcessHandle {

        private final Process process;

        NativeProcessHandle(Process process) {
            this.process = Objects.requireNonNull(process, "process");
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public void writeInput(String input) throws IOException {
            try (OutputStream stdin = process.getOutputStream()) {
                if (input != null) {
                    stdin.write(input.getBytes(StandardCharsets.UTF_8));
                }
            }
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }
    }
}
