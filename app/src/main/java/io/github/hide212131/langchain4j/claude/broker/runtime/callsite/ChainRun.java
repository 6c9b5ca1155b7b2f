package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import java.util.List;
import java.util.Objects;

/**
 * 1 つの入力をチェーン全体に通した結果。
 *
 * @param prompt 最初のエージェントへの入力
 * @param steps 実行したステップ。中断した場合は途中まで
 * @param aborted 途中で中断されたかどうか
 */
public record ChainRun(String prompt, List<ChainStepResult> steps, boolean aborted) {

    public ChainRun {
        Objects.requireNonNull(prompt, "prompt");
        steps = List.copyOf(steps);
    }

    /** 最後のステップの出力。ステップが無ければ入力そのもの。 */
    public String finalOutput() {
        return steps.isEmpty() ? prompt : steps.get(steps.size() - 1).output();
    }
}
