package io.github.hide212131.langchain4j.claude.broker.runtime.process;

import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.request.RequestMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Claude CLI の引数を組み立てる。プロンプト本文は引数ではなく標準入力で渡す。
 */
public final class ClaudeCommandBuilder {

    private final String executable;

    public ClaudeCommandBuilder(String executable) {
        this.executable = Objects.requireNonNull(executable, "executable");
    }

    public List<String> version() {
        return List.of(executable, "--version");
    }

    public List<String> authStatus() {
        return List.of(executable, "auth", "status");
    }

    public List<String> prompt(RequestMode mode, QueryOptions options, Path imagePath) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(options, "options");
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-p");
        command.add("--output-format");
        command.add(mode == RequestMode.STREAM ? "text" : "json");
        if (options.model() != null) {
            command.add("--model");
            command.add(options.model());
        }
        if (options.maxTokens() != null) {
            command.add("--max-tokens");
            command.add(options.maxTokens().toString());
        }
        if (imagePath != null) {
            command.add("--image");
            command.add(imagePath.toString());
        }
        return List.copyOf(command);
    }
}
