package io.github.hide212131.langchain4j.claude.broker.app;

import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfiguration;
import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfigurationException;
import io.github.hide212131.langchain4j.claude.broker.runtime.ClaudeCliBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.LlmProvider;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryOptions;
import io.github.hide212131.langchain4j.claude.broker.runtime.artifact.ImagePayloads;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.CompletionUnavailableException;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackOrchestrator;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.FallbackResult;
import io.github.hide212131.langchain4j.claude.broker.runtime.fallback.StreamingCompletionListener;
import io.github.hide212131.langchain4j.claude.broker.runtime.provider.RemoteCompletionClient;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI 経路を優先し、失敗時はリモート API で問い合わせるコマンド (query)。
 */
@Command(name = "query", description = "プロンプトを送信し、応答と応答した経路を表示します。", mixinStandardHelpOptions = true)
@SuppressWarnings({ "PMD.ExcessiveImports", "checkstyle:LineLength" })
public final class QueryCommand implements Callable<Integer> {

    static final int EXIT_COMPLETION_UNAVAILABLE = 3;
    static final int EXIT_CONFIGURATION_ERROR = 4;

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private BrokerCliApp parent;

    // CHECKSTYLE:OFF: LineLength
    @Option(names = "--prompt", required = true, paramLabel = "TEXT", description = "送信するプロンプト")
    private String prompt;

    @Option(names = "--image", paramLabel = "FILE", description = "添付する画像ファイル（任意）")
    private Path image;

    @Option(names = "--stream", description = "応答をチャンク単位で表示します（--image とは併用できません）")
    private boolean stream;

    @Option(names = "--model", paramLabel = "MODEL", description = "使用するモデル（任意）")
    private String model;

    @Option(names = "--max-tokens", paramLabel = "N", description = "最大出力トークン数（任意）")
    private Integer maxTokens;

    @Option(names = "--timeout-ms", paramLabel = "MS", description = "CLI 経路のタイムアウト（未指定時は CLAUDE_CLI_TIMEOUT）")
    private Long timeoutMs;

    @Option(names = "--no-fallback", description = "リモート API へのフォールバックを行いません")
    private boolean noFallback;

    @Option(names = "--llm-provider", paramLabel = "PROVIDER",
            description = "フォールバック先 (mock|anthropic|openai)。未指定時は環境変数/ .env を参照します。",
            converter = LlmProviderConverter.class)
    private LlmProvider llmProvider;
    // CHECKSTYLE:ON

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public QueryCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (stream && image != null) {
            err.println("--image と --stream は同時に指定できません");
            err.flush();
            return CommandLine.ExitCode.USAGE;
        }
        QueryOptions options;
        BrokerConfiguration configuration;
        RemoteCompletionClient remote;
        byte[] imageBytes;
        try {
            options = buildOptions();
            configuration = parent.runtimeFactory().loadConfiguration();
            remote = noFallback ? null : parent.runtimeFactory().createRemote(llmProvider);
            imageBytes = image != null ? Files.readAllBytes(image) : null;
        } catch (BrokerConfigurationException | IllegalArgumentException | IllegalStateException ex) {
            err.println(ex.getMessage());
            err.flush();
            return EXIT_CONFIGURATION_ERROR;
        } catch (IOException ex) {
            err.println("画像ファイルを読み込めませんでした: " + image);
            err.flush();
            return EXIT_CONFIGURATION_ERROR;
        }
        try (ClaudeCliBroker broker = parent.runtimeFactory().createBroker(configuration)) {
            broker.start();
            FallbackOrchestrator orchestrator = new FallbackOrchestrator(broker, remote);
            FallbackResult result;
            if (imageBytes != null) {
                result = orchestrator.completeWithImage(prompt, imageBytes, mimeTypeOf(image), options);
                out.println(result.content());
            } else if (stream) {
                result = orchestrator.stream(prompt, options, new PrintingListener(out, err));
                out.println();
            } else {
                result = orchestrator.complete(prompt, options);
                out.println(result.content());
            }
            out.flush();
            String cliError = result.cliError() != null ? " cliError=" + result.cliError() : "";
            err.println("[path=" + result.path() + cliError + "]");
            err.flush();
            return CommandLine.ExitCode.OK;
        } catch (CompletionUnavailableException | CancellationException ex) {
            err.println(ex.getMessage());
            err.flush();
            return EXIT_COMPLETION_UNAVAILABLE;
        }
    }

    private QueryOptions buildOptions() {
        QueryOptions options = QueryOptions.defaults().withModel(model).withMaxTokens(maxTokens);
        if (timeoutMs != null) {
            options = options.withTimeout(Duration.ofMillis(timeoutMs));
        }
        return options;
    }

    private static String mimeTypeOf(Path path) {
        try {
            String probed = Files.probeContentType(path);
            return probed != null ? probed : ImagePayloads.DEFAULT_MIME_TYPE;
        } catch (IOException ex) {
            return ImagePayloads.DEFAULT_MIME_TYPE;
        }
    }

    private static final class PrintingListener implements StreamingCompletionListener {

        private final PrintWriter out;
        private final PrintWriter err;

        PrintingListener(PrintWriter out, PrintWriter err) {
            this.out = out;
            this.err = err;
        }

        @Override
        public void onChunk(String chunk) {
            out.print(chunk);
            out.flush();
        }

        @Override
        public void onReset() {
            out.println();
            out.flush();
            err.println("[reset] CLI の出力を破棄し、リモート API でやり直します");
            err.flush();
        }
    }

    private static final class LlmProviderConverter implements ITypeConverter<LlmProvider> {

        @Override
        public LlmProvider convert(String value) {
            return LlmProvider.from(value);
        }
    }
}
