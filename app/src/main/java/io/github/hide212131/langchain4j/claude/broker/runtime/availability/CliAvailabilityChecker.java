package io.github.hide212131.langchain4j.claude.broker.runtime.availability;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ClaudeCommandBuilder;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.EnvironmentSanitizer;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExecutionResult;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessLauncher;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ProcessRunner;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ProcessSpec;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <cli> --version} と {@code <cli> auth status} を実行して可用性を判定する。
 *
 * <p>結果は {@code ttl} の間キャッシュする。プローブも通常のリクエストと同じく認証情報を除いた環境で起動する。
 */
@SuppressWarnings("PMD.AvoidCatchingGenericException")
public final class CliAvailabilityChecker implements AvailabilityChecker {

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);
    static final String CLI_NOT_AVAILABLE = "CLI not available";

    private static final String PHASE = "availability";
    private static final Pattern AUTHENTICATED_AS = Pattern.compile("Authenticated as:\\s*(.+)",
            Pattern.CASE_INSENSITIVE);

    private final ExternalProcessLauncher launcher;
    private final ClaudeCommandBuilder commands;
    private final EnvironmentSanitizer sanitizer;
    private final Supplier<Map<String, String>> environment;
    private final Duration ttl;
    private final Clock clock;
    private final BrokerLog log = BrokerLog.forClass(CliAvailabilityChecker.class);

    private InstallationStatus installation;
    private AuthenticationStatus authentication;

    public CliAvailabilityChecker(ExternalProcessLauncher launcher, ClaudeCommandBuilder commands,
            EnvironmentSanitizer sanitizer, Supplier<Map<String, String>> environment, Duration ttl, Clock clock) {
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized InstallationStatus checkInstalled() {
        Instant now = clock.instant();
        InstallationStatus status;
        try {
            ExecutionResult result = probe(commands.version());
            if (result.succeeded()) {
                status = InstallationStatus.installed(result.stdout().trim(), now);
            } else {
                status = InstallationStatus.missing("Claude CLI exited with code " + result.exitCode() + ": "
                        + firstNonBlank(result.stderr(), result.stdout(), "Unknown error"), now);
            }
        } catch (IOException ex) {
            status = InstallationStatus.missing("Claude CLI not found: " + ex.getMessage(), now);
        } catch (TimeoutException ex) {
            status = InstallationStatus.missing("Claude CLI did not respond within "
                    + PROBE_TIMEOUT.toMillis() + "ms", now);
        } catch (RuntimeException ex) {
            status = InstallationStatus.missing("Claude CLI check failed: " + ex.getMessage(), now);
        }
        installation = status;
        log.info(PHASE, null, "check.installed", "インストール状態を確認しました",
                "installed=" + status.installed() + " version=" + status.version());
        return status;
    }

    @Override
    public synchronized AuthenticationStatus checkAuthenticated() {
        InstallationStatus installed = cachedInstallation();
        Instant now = clock.instant();
        AuthenticationStatus status;
        if (!installed.installed()) {
            status = AuthenticationStatus.unauthenticated(CLI_NOT_AVAILABLE, now);
        } else {
            try {
                ExecutionResult result = probe(commands.authStatus());
                status = parseAuthentication(result.stdout() + "\n" + result.stderr(), now);
            } catch (IOException | TimeoutException ex) {
                status = AuthenticationStatus.unauthenticated("Failed to check authentication: " + ex.getMessage(),
                        now);
            } catch (RuntimeException ex) {
                status = AuthenticationStatus.unauthenticated("Failed to check authentication: " + ex.getMessage(),
                        now);
            }
        }
        authentication = status;
        log.info(PHASE, null, "check.authenticated", "ログイン状態を確認しました",
                "authenticated=" + status.authenticated());
        return status;
    }

    @Override
    public synchronized InstallationStatus cachedInstallation() {
        if (installation == null || isStale(installation.checkedAt())) {
            return checkInstalled();
        }
        return installation;
    }

    @Override
    public synchronized AuthenticationStatus cachedAuthentication() {
        if (authentication == null || isStale(authentication.checkedAt())) {
            return checkAuthenticated();
        }
        return authentication;
    }

    @Override
    public synchronized void invalidate() {
        installation = null;
        authentication = null;
    }

    static AuthenticationStatus parseAuthentication(String output, Instant checkedAt) {
        Matcher matcher = AUTHENTICATED_AS.matcher(output);
        if (matcher.find()) {
            return AuthenticationStatus.authenticated(matcher.group(1).trim(), checkedAt);
        }
        return AuthenticationStatus.unauthenticated("Not authenticated. Run: claude auth login", checkedAt);
    }

    private ExecutionResult probe(List<String> command) throws IOException, TimeoutException {
        ProcessSpec spec = new ProcessSpec(command, sanitizer.sanitize(environment.get()));
        return ProcessRunner.run(launcher, spec, PROBE_TIMEOUT);
    }

    private boolean isStale(Instant checkedAt) {
        return Duration.between(checkedAt, clock.instant()).compareTo(ttl) >= 0;
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return fallback;
    }
}
