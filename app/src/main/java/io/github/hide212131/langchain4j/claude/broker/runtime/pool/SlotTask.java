package io.github.hide212131.langchain4j.claude.broker.runtime.pool;

import java.time.Duration;

/**
 * プールに投入する 1 リクエスト分の処理。
 */
public interface SlotTask {

    String requestId();

    /** 枠を得てから強制停止されるまでの期限。 */
    Duration timeout();

    /**
     * 枠を保持したままワーカースレッドで実行される。プロセスが終了してから戻ること。
     */
    void run(SlotLease lease);

    /** {@link #run(SlotLease)} の終了後、枠が返却されてから呼ばれる。 */
    void released();

    /** 枠を得る前に待ち行列から外された場合に呼ばれる。{@link #run(SlotLease)} は呼ばれない。 */
    void abandoned(TerminationCause cause);
}
