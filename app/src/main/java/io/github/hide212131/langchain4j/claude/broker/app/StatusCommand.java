package io.github.hide212131.langchain4j.claude.broker.app;

import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfiguration;
import io.github.hide212131.langchain4j.claude.broker.runtime.BrokerConfigurationException;
import io.github.hide212131.langchain4j.claude.broker.runtime.ClaudeCliBroker;
import io.github.hide212131.langchain4j.claude.broker.runtime.availability.BrokerStatus;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI のインストール状態・ログイン状態・実行枠を表示するコマンド (status)。
 */
@Command(name = "status", description = "Claude CLI の可用性と実行枠の状態を表示します。", mixinStandardHelpOptions = true)
public final class StatusCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private BrokerCliApp parent;

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public StatusCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        BrokerConfiguration configuration;
        try {
            configuration = parent.runtimeFactory().loadConfiguration();
        } catch (BrokerConfigurationException ex) {
            spec.commandLine().getErr().println(ex.getMessage());
            spec.commandLine().getErr().flush();
            return QueryCommand.EXIT_CONFIGURATION_ERROR;
        }
        try (ClaudeCliBroker broker = parent.runtimeFactory().createBroker(configuration)) {
            broker.start();
            BrokerStatus status = broker.status();
            PrintWriter out = spec.commandLine().getOut();
            out.println("Installed: " + status.installed());
            out.println("Version: " + (status.version() != null ? status.version() : "N/A"));
            out.println("Authenticated: " + status.authenticated());
            if (status.account() != null) {
                out.println("Account: " + status.account());
            }
            out.println("Slots: " + status.activeSlots() + "/" + status.capacity() + " (queued " + status.queued()
                    + ")");
            if (status.lastError() != null) {
                out.println("Error: " + status.lastError());
            }
            out.flush();
        }
        return CommandLine.ExitCode.OK;
    }
}
