package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class NativeProcessLauncherTest {

    private final NativeProcessLauncher launcher = new NativeProcessLauncher();

    @Test
    @DisplayName("親の環境を引き継がず、指定した環境と標準入力だけを渡す")
    void passesOnlyGivenEnvironmentAndStdin() throws Exception {
        ProcessSpec spec = new ProcessSpec(
                List.of("/bin/sh", "-c", "printf '%s|%s|' \"$GREETING\" \"${HOME:-none}\"; /bin/cat"),
                Map.of("GREETING", "hi"));

        ExecutionResult result = ProcessRunner.run(launcher, spec, Duration.ofSeconds(5));

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("hi|none|");
    }

    @Test
    @DisplayName("終了シグナルで停止したプロセスは生存していない")
    void terminateStopsProcess() throws Exception {
        ExternalProcessHandle handle = launcher.spawn(new ProcessSpec(List.of("/bin/sleep", "30"), Map.of()));

        handle.terminate();

        assertThat(handle.waitFor(Duration.ofSeconds(5))).isTrue();
        assertThat(handle.isAlive()).isFalse();
    }
}
