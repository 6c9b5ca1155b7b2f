package io.github.hide212131.langchain4j.claude.broker.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * ブローカー 1 インスタンス分の設定値。
 *
 * @param cliCommand 起動する CLI の実行ファイル名またはパス
 * @param capacity 同時に実行できるプロセス数
 * @param defaultTimeout リクエストでタイムアウト未指定時の既定値
 * @param artifactDirectory 画像などの一時ファイルを置くディレクトリ
 * @param statusTtl 可用性チェック結果を再利用する期間
 * @param terminationGrace 終了シグナル送信後、強制終了に移るまでの猶予
 */
public record BrokerConfiguration(String cliCommand, int capacity, Duration defaultTimeout, Path artifactDirectory,
        Duration statusTtl, Duration terminationGrace) {

    public static final String DEFAULT_CLI_COMMAND = "claude";
    public static final int DEFAULT_CAPACITY = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(120_000);
    public static final Duration DEFAULT_STATUS_TTL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TERMINATION_GRACE = Duration.ofSeconds(1);

    public BrokerConfiguration {
        Objects.requireNonNull(cliCommand, "cliCommand");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(artifactDirectory, "artifactDirectory");
        Objects.requireNonNull(statusTtl, "statusTtl");
        Objects.requireNonNull(terminationGrace, "terminationGrace");
        if (cliCommand.isBlank()) {
            throw new IllegalArgumentException("cliCommand は空にできません");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity は 1 以上である必要があります: " + capacity);
        }
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout は正の値である必要があります");
        }
        if (statusTtl.isNegative()) {
            throw new IllegalArgumentException("statusTtl は負にできません");
        }
        if (terminationGrace.isNegative()) {
            throw new IllegalArgumentException("terminationGrace は負にできません");
        }
    }

    /** すべて既定値の設定。一時ファイルは {@code java.io.tmpdir} に置く。 */
    public static BrokerConfiguration defaults() {
        return new BrokerConfiguration(DEFAULT_CLI_COMMAND, DEFAULT_CAPACITY, DEFAULT_TIMEOUT,
                Path.of(System.getProperty("java.io.tmpdir")), DEFAULT_STATUS_TTL, DEFAULT_TERMINATION_GRACE);
    }

    public BrokerConfiguration withCapacity(int value) {
        return new BrokerConfiguration(cliCommand, value, defaultTimeout, artifactDirectory, statusTtl,
                terminationGrace);
    }

    public BrokerConfiguration withDefaultTimeout(Duration value) {
        return new BrokerConfiguration(cliCommand, capacity, value, artifactDirectory, statusTtl, terminationGrace);
    }

    public BrokerConfiguration withArtifactDirectory(Path value) {
        return new BrokerConfiguration(cliCommand, capacity, defaultTimeout, value, statusTtl, terminationGrace);
    }

    public BrokerConfiguration withTerminationGrace(Duration value) {
        return new BrokerConfiguration(cliCommand, capacity, defaultTimeout, artifactDirectory, statusTtl, value);
    }
}
