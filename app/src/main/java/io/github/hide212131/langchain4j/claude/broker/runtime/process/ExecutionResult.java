package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import java.util.Objects;

/** 完了まで待つ短命なプロセス (可用性プローブ) の実行結果。 */
public record ExecutionResult(String command, int exitCode, String stdout, String stderr, long elapsedMs) {

    public ExecutionResult {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(stdout, "stdout");
        Objects.requireNonNull(stderr, "stderr");
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
