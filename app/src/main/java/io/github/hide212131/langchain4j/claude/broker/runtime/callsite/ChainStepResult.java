package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.CompletionPath;

/** チェーン 1 ステップ分の出力と、応答した経路。 */
public record ChainStepResult(String agentName, String output, CompletionPath path) {
}
