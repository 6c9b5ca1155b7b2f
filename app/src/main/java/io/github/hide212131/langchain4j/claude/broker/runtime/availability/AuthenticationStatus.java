package io.github.hide212131.langchain4j.claude.broker.runtime.availability;

import java.time.Instant;
import java.util.Objects;

/**
 * CLI がログイン済みかの確認結果。
 *
 * @param authenticated ログイン済みかどうか
 * @param account ログイン中のアカウント。不明なら {@code null}
 * @param error 未ログイン時の診断メッセージ
 * @param checkedAt 確認した時刻
 */
public record AuthenticationStatus(boolean authenticated, String account, String error, Instant checkedAt) {

    public AuthenticationStatus {
        Objects.requireNonNull(checkedAt, "checkedAt");
    }

    public static AuthenticationStatus authenticated(String account, Instant checkedAt) {
        return new AuthenticationStatus(true, account, null, checkedAt);
    }

    public static AuthenticationStatus unauthenticated(String error, Instant checkedAt) {
        return new AuthenticationStatus(false, null, error, checkedAt);
    }
}
