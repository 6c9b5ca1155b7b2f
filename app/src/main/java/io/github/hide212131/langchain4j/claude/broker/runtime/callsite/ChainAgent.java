package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import java.util.Objects;

/**
 * チェーン実行の 1 エージェント。
 *
 * @param name 表示名
 * @param taskSpec 入力の前に置く指示
 * @param model 使うモデル。{@code null} なら既定
 */
public record ChainAgent(String name, String taskSpec, String model) {

    public ChainAgent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(taskSpec, "taskSpec");
    }
}
