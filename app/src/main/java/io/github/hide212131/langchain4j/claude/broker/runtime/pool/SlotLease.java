package io.github.hide212131.langchain4j.claude.broker.runtime.pool;

import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessHandle;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * 1 リクエストに貸し出された実行枠。プロセスと停止理由をひも付ける。
 */
public final class SlotLease {

    private final String requestId;
    private final Instant leasedAt;

    private ExternalProcessHandle process;
    private TerminationCause terminationCause;
    private boolean sealed;
    private Future<?> deadline;
    private Future<?> forcedKill;

    SlotLease(String requestId, Instant leasedAt) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.leasedAt = Objects.requireNonNull(leasedAt, "leasedAt");
    }

    public String requestId() {
        return requestId;
    }

    public Instant leasedAt() {
        return leasedAt;
    }

    /**
     * 起動したプロセスをこの枠にひも付ける。
     *
     * @return 既に停止要求が出ている場合は {@code false}。呼び出し側はプロセスを強制終了すること
     */
    public synchronized boolean attach(ExternalProcessHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (terminationCause != null) {
            return false;
        }
        this.process = handle;
        return true;
    }

    /** 停止要求の理由。要求が無ければ {@code null}。 */
    public synchronized TerminationCause terminationCause() {
        return terminationCause;
    }

    /**
     * 結果を確定させる。以降の停止要求は受け付けない。
     *
     * @return 確定時点での停止理由。要求が無ければ {@code null}
     */
    public synchronized TerminationCause seal() {
        sealed = true;
        return terminationCause;
    }

    synchronized ExternalProcessHandle process() {
        return process;
    }

    /** 最初の停止要求だけを記録する。 */
    synchronized boolean requestTermination(TerminationCause cause) {
        if (sealed || terminationCause != null) {
            return false;
        }
        terminationCause = cause;
        return true;
    }

    synchronized void armDeadline(Future<?> timer) {
        this.deadline = timer;
    }

    synchronized void armForcedKill(Future<?> timer) {
        this.forcedKill = timer;
    }

    synchronized void disarm() {
        if (deadline != null) {
            deadline.cancel(false);
            deadline = null;
        }
        if (forcedKill != null) {
            forcedKill.cancel(false);
            forcedKill = null;
        }
    }
}
