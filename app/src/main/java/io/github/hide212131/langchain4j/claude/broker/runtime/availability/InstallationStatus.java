package io.github.hide212131.langchain4j.claude.broker.runtime.availability;

import java.time.Instant;
import java.util.Objects;

/**
 * CLI がインストールされているかの確認結果。
 *
 * @param installed {@code --version} が正常終了したかどうか
 * @param version 出力されたバージョン文字列。未インストール時は {@code null}
 * @param error 失敗時の診断メッセージ
 * @param checkedAt 確認した時刻
 */
public record InstallationStatus(boolean installed, String version, String error, Instant checkedAt) {

    public InstallationStatus {
        Objects.requireNonNull(checkedAt, "checkedAt");
    }

    public static InstallationStatus installed(String version, Instant checkedAt) {
        return new InstallationStatus(true, version, null, checkedAt);
    }

    public static InstallationStatus missing(String error, Instant checkedAt) {
        return new InstallationStatus(false, null, error, checkedAt);
    }
}
