package io.github.hide212131.langchain4j.claude.broker.runtime.availability;

/**
 * CLI のインストール状態とログイン状態を確認する。実装は例外を送出せず、失敗も結果の値で返す。
 */
public interface AvailabilityChecker {

    /** キャッシュを使わずにインストール状態を確認する。 */
    InstallationStatus checkInstalled();

    /** キャッシュを使わずにログイン状態を確認する。未インストールならプロセスを起動しない。 */
    AuthenticationStatus checkAuthenticated();

    /** 有効期限内ならキャッシュした結果を返し、期限切れなら再確認する。 */
    InstallationStatus cachedInstallation();

    AuthenticationStatus cachedAuthentication();

    void invalidate();
}
