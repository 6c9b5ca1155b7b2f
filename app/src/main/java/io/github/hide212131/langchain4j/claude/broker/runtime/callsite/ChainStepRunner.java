package io.github.hide212131.langchain4j.claude.broker.runtime.callsite;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackOrchestrator;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 複数エージェントのチェーン実行。各エージェントの出力を次のエージェントの入力にする。
 *
 * <p>中断フラグは {@link #run} / {@link #runBatch} の呼び出しごとに持つ。{@link #abort()} はその時点で実行中のチェーン
 * すべてに効き、後から始まったチェーンには影響しない。
 */
public final class ChainStepRunner {

    static final int STEP_MAX_TOKENS = 4096;

    private static final String PHASE = "chain";

    private final FallbackOrchestrator orchestrator;
    private final Set<AtomicBoolean> running = ConcurrentHashMap.newKeySet();
    private final BrokerLog log = BrokerLog.forClass(ChainStepRunner.class);

    public ChainStepRunner(FallbackOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    /**
     * 入力をすべてのエージェントに順に通す。
     *
     * @throws io.github.hide212131.langchain4j.claude.broker.runtime.fallback.CompletionUnavailableException
     *         いずれかのステップで両経路が失敗した場合
     */
    public ChainRun run(String prompt, List<ChainAgent> agents) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(agents, "agents");
        AtomicBoolean aborted = register();
        try {
            return runOnce(prompt, agents, aborted);
        } finally {
            running.remove(aborted);
        }
    }

    /** 空でない入力それぞれについてチェーンを実行する。中断されたらそこで止める。 */
    public List<ChainRun> runBatch(List<String> prompts, List<ChainAgent> agents) {
        Objects.requireNonNull(prompts, "prompts");
        Objects.requireNonNull(agents, "agents");
        AtomicBoolean aborted = register();
        try {
            List<ChainRun> runs = new ArrayList<>();
            for (String prompt : prompts) {
                if (prompt == null || prompt.isBlank()) {
                    continue;
                }
                ChainRun run = runOnce(prompt.trim(), agents, aborted);
                runs.add(run);
                if (run.aborted()) {
                    break;
                }
            }
            return runs;
        } finally {
            running.remove(aborted);
        }
    }

    /** 実行中のチェーンを次のステップの前で止める。 */
    public void abort() {
        running.forEach(flag -> flag.set(true));
    }

    static String stepPrompt(ChainAgent agent, String input) {
        return agent.taskSpec() + "\n\n" + input;
    }

    private AtomicBoolean register() {
        AtomicBoolean flag = new AtomicBoolean();
        running.add(flag);
        return flag;
    }

    private ChainRun runOnce(String prompt, List<ChainAgent> agents, AtomicBoolean aborted) {
        List<ChainStepResult> steps = new ArrayList<>();
        String input = prompt;
        for (ChainAgent agent : agents) {
            if (aborted.get()) {
                log.info(PHASE, null, "chain.abort", "チェーンを中断しました", "completedSteps=" + steps.size());
                return new ChainRun(prompt, steps, true);
            }
            QueryOptions options = QueryOptions.defaults().withMaxTokens(STEP_MAX_TOKENS).withModel(agent.model());
            FallbackResult result = orchestrator.complete(stepPrompt(agent, input), options);
            steps.add(new ChainStepResult(agent.name(), result.content(), result.path()));
            log.debug(PHASE, null, "chain.step", "ステップが完了しました",
                    "agent=" + agent.name() + " path=" + result.path());
            input = result.content();
        }
        return new ChainRun(prompt, steps, false);
    }
}
