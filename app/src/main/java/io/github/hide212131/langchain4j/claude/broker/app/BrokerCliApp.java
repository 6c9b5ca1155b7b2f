package io.github.hide212131.langchain4j.claude.broker.app;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** claude-broker のルートコマンド。 */
@Command(name = "claude-broker", description = "Claude CLI ブローカー CLI。", mixinStandardHelpOptions = true,
        subcommands = { StatusCommand.class, QueryCommand.class })
public final class BrokerCliApp {

    private final BrokerRuntimeFactory runtimeFactory;

    public BrokerCliApp() {
        this(BrokerRuntimeFactory.defaults());
    }

    BrokerCliApp(BrokerRuntimeFactory runtimeFactory) {
        this.runtimeFactory = Objects.requireNonNull(runtimeFactory, "runtimeFactory");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BrokerCliApp()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(BrokerRuntimeFactory factory, String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd = new CommandLine(new BrokerCliApp(factory));
        cmd.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return cmd.execute(args);
    }

    BrokerRuntimeFactory runtimeFactory() {
        return runtimeFactory;
    }
}
