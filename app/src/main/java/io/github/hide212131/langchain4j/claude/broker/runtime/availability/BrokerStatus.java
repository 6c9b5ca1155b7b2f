package io.github.hide212131.langchain4j.claude.broker.runtime.availability;

import io.github.hide212131.langchain4j.claude.broker.runtime.pool.PoolSnapshot;
import java.time.Instant;
import java.util.Objects;

/**
 * インストール状態、ログイン状態、実行枠の使用状況をまとめたもの。判定は参考値で、次のリクエストの成功を保証しない。
 */
public record BrokerStatus(boolean installed, String version, boolean authenticated, String account,
        int activeSlots, int capacity, int queued, String lastError, Instant checkedAt) {

    public BrokerStatus {
        Objects.requireNonNull(checkedAt, "checkedAt");
    }

    public static BrokerStatus of(InstallationStatus installation, AuthenticationStatus authentication,
            PoolSnapshot pool) {
        Objects.requireNonNull(installation, "installation");
        Objects.requireNonNull(authentication, "authentication");
        Objects.requireNonNull(pool, "pool");
        String lastError = installation.error() != null ? installation.error() : authentication.error();
        Instant checkedAt = installation.checkedAt().isAfter(authentication.checkedAt()) ? installation.checkedAt()
                : authentication.checkedAt();
        return new BrokerStatus(installation.installed(), installation.version(), authentication.authenticated(),
                authentication.account(), pool.activeSlots(), pool.capacity(), pool.queued(), lastError, checkedAt);
    }

    /** CLI 経路を試す価値があるかどうか。 */
    public boolean available() {
        return installed && authenticated;
    }
}
