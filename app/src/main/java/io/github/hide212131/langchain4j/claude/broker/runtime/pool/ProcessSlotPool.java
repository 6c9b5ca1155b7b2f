package io.github.hide212131.langchain4j.claude.broker.runtime.pool;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessHandle;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 同時実行数を {@code capacity} に制限する実行枠プール。
 *
 * <p>枠の貸し出しと待ち行列の操作はすべて 1 つのロックの下で行う。枠が返却されるたびに、待ち行列の先頭を
 * 1 件だけ昇格させる。貸し出した枠にはタイムアウト用のタイマーを設定し、期限切れは取り消しと同じ停止手順
 * (終了シグナル → 猶予後に強制終了) をたどる。
 */
@SuppressWarnings({ "PMD.AvoidCatchingGenericException", "PMD.GodClass" })
public final class ProcessSlotPool {

    private static final String PHASE = "pool";

    private final int capacity;
    private final Duration terminationGrace;
    private final Clock clock;
    private final BrokerLog log;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<SlotTask> queue = new ArrayDeque<>();
    private final Map<String, SlotLease> leases = new LinkedHashMap<>();
    private int peakActiveSlots;
    private boolean started;
    private boolean closed;

    private ExecutorService workers;
    private ScheduledExecutorService timers;

    public ProcessSlotPool(int capacity, Duration terminationGrace, Clock clock) {
        this(capacity, terminationGrace, clock, BrokerLog.forClass(ProcessSlotPool.class));
    }

    ProcessSlotPool(int capacity, Duration terminationGrace, Clock clock, BrokerLog log) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity は 1 以上である必要があります: " + capacity);
        }
        this.capacity = capacity;
        this.terminationGrace = Objects.requireNonNull(terminationGrace, "terminationGrace");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.log = Objects.requireNonNull(log, "log");
    }

    public void start() {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("停止済みのプールは再開できません");
            }
            if (started) {
                return;
            }
            workers = Executors.newCachedThreadPool(namedThreads("claude-cli-slot-"));
            timers = Executors.newSingleThreadScheduledExecutor(namedThreads("claude-cli-timer-"));
            started = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * タスクを投入する。空き枠があれば即座に貸し出し、無ければ待ち行列の末尾に加える。
     *
     * @return 即座に枠を得た場合は {@code true}
     * @throws IllegalStateException 開始前、停止後、または同じ ID が投入済みの場合
     */
    public boolean submit(SlotTask task) {
        Objects.requireNonNull(task, "task");
        SlotLease lease = null;
        lock.lock();
        try {
            if (!started || closed) {
                throw new IllegalStateException("プールが稼働していません");
            }
            if (leases.containsKey(task.requestId()) || isQueuedLocked(task.requestId())) {
                throw new IllegalStateException("同じリクエストが既に投入されています: " + task.requestId());
            }
            if (leases.size() < capacity) {
                lease = leaseLocked(task);
            } else {
                queue.addLast(task);
                log.debug(PHASE, task.requestId(), "slot.queue", "空き枠が無いため待ち行列に入れました",
                        "queued=" + queue.size());
            }
        } finally {
            lock.unlock();
        }
        if (lease != null) {
            dispatch(task, lease);
            return true;
        }
        return false;
    }

    /**
     * リクエストを取り消す。待機中なら待ち行列から外し、実行中ならプロセスを停止する。
     *
     * @return 取り消しが行われた場合は {@code true}。既に終了済み、停止要求済み、または不明な ID なら {@code false}
     */
    public boolean cancel(String requestId) {
        Objects.requireNonNull(requestId, "requestId");
        SlotTask removed = null;
        SlotLease lease;
        lock.lock();
        try {
            removed = removeQueuedLocked(requestId);
            lease = removed == null ? leases.get(requestId) : null;
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.info(PHASE, requestId, "slot.cancel", "待機中のリクエストを取り消しました", "");
            abandon(removed, TerminationCause.CANCELLED);
            return true;
        }
        if (lease != null) {
            return terminate(lease, TerminationCause.CANCELLED);
        }
        return false;
    }

    public PoolSnapshot snapshot() {
        lock.lock();
        try {
            return new PoolSnapshot(leases.size(), capacity, queue.size());
        } finally {
            lock.unlock();
        }
    }

    /** 起動以来、同時に貸し出された枠数の最大値。 */
    public int peakActiveSlots() {
        lock.lock();
        try {
            return peakActiveSlots;
        } finally {
            lock.unlock();
        }
    }

    public boolean isQueued(String requestId) {
        lock.lock();
        try {
            return isQueuedLocked(requestId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isLeased(String requestId) {
        lock.lock();
        try {
            return leases.containsKey(requestId);
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * 待機中のタスクをすべて取り消し、実行中のプロセスを停止して、最大 {@code await} まで終了を待つ。
     */
    public void shutdown(Duration await) {
        Objects.requireNonNull(await, "await");
        List<SlotTask> pending;
        List<SlotLease> running;
        lock.lock();
        try {
            if (closed || !started) {
                closed = true;
                return;
            }
            closed = true;
            pending = new ArrayList<>(queue);
            queue.clear();
            running = new ArrayList<>(leases.values());
        } finally {
            lock.unlock();
        }
        log.info(PHASE, null, "pool.shutdown", "プールを停止します",
                "queued=" + pending.size() + " active=" + running.size());
        for (SlotTask task : pending) {
            abandon(task, TerminationCause.CANCELLED);
        }
        for (SlotLease lease : running) {
            terminate(lease, TerminationCause.CANCELLED);
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                forceKillRemaining();
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            forceKillRemaining();
            workers.shutdownNow();
        } finally {
            timers.shutdownNow();
        }
    }

    private SlotLease leaseLocked(SlotTask task) {
        SlotLease lease = new SlotLease(task.requestId(), clock.instant());
        leases.put(task.requestId(), lease);
        peakActiveSlots = Math.max(peakActiveSlots, leases.size());
        return lease;
    }

    private void dispatch(SlotTask task, SlotLease lease) {
        log.info(PHASE, task.requestId(), "slot.lease", "実行枠を割り当てました",
                "timeoutMs=" + task.timeout().toMillis());
        try {
            lease.armDeadline(timers.schedule(() -> expire(lease), task.timeout().toMillis(), TimeUnit.MILLISECONDS));
            workers.execute(() -> runLeased(task, lease));
        } catch (RejectedExecutionException ex) {
            log.warn(PHASE, task.requestId(), "slot.lease", "停止中のためタスクを実行できません", "", ex);
            lease.requestTermination(TerminationCause.CANCELLED);
            release(task, lease);
        }
    }

    private void runLeased(SlotTask task, SlotLease lease) {
        try {
            task.run(lease);
        } catch (RuntimeException ex) {
            log.error(PHASE, task.requestId(), "slot.run", "タスクが例外で終了しました", "", ex);
        } finally {
            release(task, lease);
        }
    }

    private void release(SlotTask task, SlotLease lease) {
        lease.disarm();
        SlotTask next = null;
        SlotLease nextLease = null;
        lock.lock();
        try {
            if (leases.remove(lease.requestId(), lease) && !closed) {
                next = queue.pollFirst();
                if (next != null) {
                    nextLease = leaseLocked(next);
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug(PHASE, lease.requestId(), "slot.release", "実行枠を返却しました", "");
        notifyReleased(task);
        if (next != null) {
            dispatch(next, nextLease);
        }
    }

    private void expire(SlotLease lease) {
        if (terminate(lease, TerminationCause.TIMED_OUT)) {
            log.warn(PHASE, lease.requestId(), "slot.timeout", "期限を過ぎたためプロセスを停止します", "", null);
        }
    }

    private boolean terminate(SlotLease lease, TerminationCause cause) {
        if (!lease.requestTermination(cause)) {
            return false;
        }
        ExternalProcessHandle process = lease.process();
        log.info(PHASE, lease.requestId(), "slot.terminate", "プロセスの停止を要求しました", "cause=" + cause);
        if (process == null) {
            return true;
        }
        if (terminationGrace.isZero()) {
            process.kill();
            return true;
        }
        process.terminate();
        try {
            lease.armForcedKill(timers.schedule(() -> forceKill(lease, process), terminationGrace.toMillis(),
                    TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException ex) {
            process.kill();
        }
        return true;
    }

    private void forceKill(SlotLease lease, ExternalProcessHandle process) {
        if (process.isAlive()) {
            log.warn(PHASE, lease.requestId(), "slot.kill", "猶予内に終了しなかったため強制終了します", "", null);
            process.kill();
        }
    }

    private void forceKillRemaining() {
        List<SlotLease> remaining;
        lock.lock();
        try {
            remaining = new ArrayList<>(leases.values());
        } finally {
            lock.unlock();
        }
        for (SlotLease lease : remaining) {
            ExternalProcessHandle process = lease.process();
            if (process != null && process.isAlive()) {
                process.kill();
            }
        }
    }

    private void abandon(SlotTask task, TerminationCause cause) {
        try {
            task.abandoned(cause);
        } catch (RuntimeException ex) {
            log.error(PHASE, task.requestId(), "slot.abandon", "待機タスクの後始末で例外が発生しました", "", ex);
        }
    }

    private void notifyReleased(SlotTask task) {
        try {
            task.released();
        } catch (RuntimeException ex) {
            log.error(PHASE, task.requestId(), "slot.release", "返却通知で例外が発生しました", "", ex);
        }
    }

    private boolean isQueuedLocked(String requestId) {
        for (SlotTask task : queue) {
            if (task.requestId().equals(requestId)) {
                return true;
            }
        }
        return false;
    }

    private SlotTask removeQueuedLocked(String requestId) {
        Iterator<SlotTask> iterator = queue.iterator();
        while (iterator.hasNext()) {
            SlotTask task = iterator.next();
            if (task.requestId().equals(requestId)) {
                iterator.remove();
                return task;
            }
        }
        return null;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
