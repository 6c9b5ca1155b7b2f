package io.github.hide212131.langchain4j.claude.broker.runtime.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.claude.broker.runtime.process.ExternalProcessHandle;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ProcessSpec;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ScriptedProcessLauncher;
import io.github.hide212131.langchain4j.claude.broker.runtime.process.ScriptedProcessLauncher.Script;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@SuppressWarnings("PMD.JUnitTestContainsTooManyAsserts")
class ProcessSlotPoolTest {

    private static final Duration LONG_TIMEOUT = Duration.ofSeconds(30);

    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(
            spec -> Script.emitsWhen(gates.computeIfAbsent(spec.command().get(1), id -> new CountDownLatch(1)),
                    "done"));
    private ProcessSlotPool pool;

    @AfterEach
    void tearDown() {
        gates.values().forEach(CountDownLatch::countDown);
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(2));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = { 1L, 7L, 42L })
    @DisplayName("投入と取り消しをどう混ぜても、貸し出し中の枠は容量を超えない")
    void neverExceedsCapacityUnderRandomInterleavings(long seed) throws Exception {
        pool = startedPool(3, Duration.ZERO);
        Random random = new Random(seed);
        List<RecordingTask> tasks = new ArrayList<>();
        for (int step = 0; step < 120; step++) {
            int action = random.nextInt(3);
            if (action == 0 || tasks.isEmpty()) {
                RecordingTask task = new RecordingTask("req-" + seed + "-" + tasks.size(), LONG_TIMEOUT, launcher);
                tasks.add(task);
                pool.submit(task);
            } else if (action == 1) {
                pool.cancel(tasks.get(random.nextInt(tasks.size())).requestId());
            } else {
                gate(tasks.get(random.nextInt(tasks.size())).requestId()).countDown();
            }
            assertThat(pool.snapshot().activeSlots()).isLessThanOrEqualTo(3);
            assertThat(launcher.aliveCount()).isLessThanOrEqualTo(3);
        }
        for (RecordingTask task : tasks) {
            gate(task.requestId()).countDown();
        }
        for (RecordingTask task : tasks) {
            task.finished().get(5, TimeUnit.SECONDS);
        }

        assertThat(pool.peakActiveSlots()).isLessThanOrEqualTo(3);
        assertThat(pool.snapshot().activeSlots()).isZero();
        assertThat(pool.snapshot().queued()).isZero();
    }

    @Test
    @DisplayName("待ち行列は投入順に実行される")
    void drainsQueueInSubmissionOrder() throws Exception {
        pool = startedPool(1, Duration.ZERO);
        List<String> started = new CopyOnWriteArrayList<>();
        List<RecordingTask> tasks = new ArrayList<>();
        for (String id : List.of("a", "b", "c", "d")) {
            RecordingTask task = new RecordingTask(id, LONG_TIMEOUT, launcher, started);
            tasks.add(task);
            pool.submit(task);
        }

        assertThat(pool.snapshot().queued()).isEqualTo(3);
        for (String id : List.of("a", "b", "c", "d")) {
            gate(id).countDown();
        }
        for (RecordingTask task : tasks) {
            task.finished().get(5, TimeUnit.SECONDS);
        }

        assertThat(started).containsExactly("a", "b", "c", "d");
    }

    @Test
    @DisplayName("待機中に取り消したリクエストはプロセスを一度も起動しない")
    void cancelWhileQueuedNeverSpawns() throws Exception {
        pool = startedPool(1, Duration.ZERO);
        RecordingTask running = new RecordingTask("running", LONG_TIMEOUT, launcher);
        RecordingTask queued = new RecordingTask("queued", LONG_TIMEOUT, launcher);
        pool.submit(running);
        pool.submit(queued);

        assertThat(pool.isQueued("queued")).isTrue();
        assertThat(pool.cancel("queued")).isTrue();
        assertThat(queued.finished().get(1, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CANCELLED);
        assertThat(pool.cancel("queued")).isFalse();

        gate("running").countDown();
        running.finished().get(5, TimeUnit.SECONDS);

        assertThat(launcher.spawned()).extracting(spec -> spec.command().get(1)).containsExactly("running");
        assertThat(queued.ran()).isFalse();
    }

    @Test
    @DisplayName("実行中に取り消すと終了シグナルで止まり、すぐに枠が返る")
    void cancelWhileRunningReleasesSlot() throws Exception {
        pool = startedPool(1, Duration.ofSeconds(1));
        RecordingTask task = new RecordingTask("running", LONG_TIMEOUT, launcher);
        pool.submit(task);
        task.awaitAttached();

        long startedAt = System.nanoTime();
        assertThat(pool.cancel("running")).isTrue();
        TerminationCause cause = task.finished().get(2, TimeUnit.SECONDS);

        assertThat(cause).isEqualTo(TerminationCause.CANCELLED);
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(2));
        assertThat(pool.snapshot().activeSlots()).isZero();
        assertThat(launcher.handles().get(0).terminateCalls()).isEqualTo(1);
        assertThat(pool.cancel("running")).isFalse();
    }

    @Test
    @DisplayName("終了シグナルを無視するプロセスは猶予後に強制終了される")
    void forcedKillAfterGrace() throws Exception {
        ScriptedProcessLauncher stubborn = new ScriptedProcessLauncher(Script.ignoresTerminate());
        pool = startedPool(1, Duration.ofMillis(200));
        RecordingTask task = new RecordingTask("stubborn", LONG_TIMEOUT, stubborn);
        pool.submit(task);
        task.awaitAttached();

        pool.cancel("stubborn");

        assertThat(task.finished().get(2, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CANCELLED);
        ScriptedProcessLauncher.ScriptedHandle handle = stubborn.handles().get(0);
        assertThat(handle.terminateCalls()).isEqualTo(1);
        assertThat(handle.killCalls()).isEqualTo(1);
        assertThat(handle.isAlive()).isFalse();
    }

    @Test
    @DisplayName("期限切れは取り消しとは別の理由で停止する")
    void timeoutIsDistinctFromCancel() throws Exception {
        ScriptedProcessLauncher hanging = new ScriptedProcessLauncher(Script.hangsAfter());
        pool = startedPool(1, Duration.ofMillis(100));
        RecordingTask task = new RecordingTask("slow", Duration.ofMillis(100), hanging);
        long startedAt = System.nanoTime();
        pool.submit(task);

        assertThat(task.finished().get(2, TimeUnit.SECONDS)).isEqualTo(TerminationCause.TIMED_OUT);
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(2));
        assertThat(pool.cancel("slow")).isFalse();
    }

    @Test
    @DisplayName("枠が返るたびに待ち行列の先頭が 1 件だけ昇格する")
    void promotesOneTaskPerRelease() throws Exception {
        pool = startedPool(2, Duration.ZERO);
        List<RecordingTask> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            RecordingTask task = new RecordingTask("t" + i, LONG_TIMEOUT, launcher);
            tasks.add(task);
            assertThat(pool.submit(task)).isEqualTo(i < 2);
        }
        assertThat(pool.snapshot()).isEqualTo(new PoolSnapshot(2, 2, 3));

        gate("t0").countDown();
        tasks.get(0).finished().get(5, TimeUnit.SECONDS);
        tasks.get(2).awaitAttached();

        assertThat(pool.isLeased("t2")).isTrue();
        assertThat(pool.isQueued("t3")).isTrue();
        assertThat(pool.snapshot().queued()).isEqualTo(2);
    }

    @Test
    @DisplayName("開始前や重複 ID の投入は拒否される")
    void rejectsInvalidSubmissions() {
        ProcessSlotPool notStarted = new ProcessSlotPool(1, Duration.ZERO, Clock.systemUTC());
        assertThatThrownBy(() -> notStarted.submit(new RecordingTask("x", LONG_TIMEOUT, launcher)))
                .isInstanceOf(IllegalStateException.class);

        pool = startedPool(1, Duration.ZERO);
        pool.submit(new RecordingTask("dup", LONG_TIMEOUT, launcher));
        assertThatThrownBy(() -> pool.submit(new RecordingTask("dup", LONG_TIMEOUT, launcher)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dup");
        assertThat(pool.cancel("unknown")).isFalse();
        assertThatThrownBy(() -> new ProcessSlotPool(0, Duration.ZERO, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("停止すると待機中も実行中もすべて取り消される")
    void shutdownCancelsEverything() throws Exception {
        pool = startedPool(1, Duration.ZERO);
        RecordingTask running = new RecordingTask("running", LONG_TIMEOUT, launcher);
        RecordingTask queued = new RecordingTask("queued", LONG_TIMEOUT, launcher);
        pool.submit(running);
        pool.submit(queued);
        running.awaitAttached();

        pool.shutdown(Duration.ofSeconds(2));

        assertThat(running.finished().get(2, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CANCELLED);
        assertThat(queued.finished().get(2, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CANCELLED);
        assertThat(launcher.aliveCount()).isZero();
        assertThatThrownBy(() -> pool.submit(new RecordingTask("late", LONG_TIMEOUT, launcher)))
                .isInstanceOf(IllegalStateException.class);
    }

    private CountDownLatch gate(String requestId) {
        return gates.computeIfAbsent(requestId, id -> new CountDownLatch(1));
    }

    private static ProcessSlotPool startedPool(int capacity, Duration grace) {
        ProcessSlotPool created = new ProcessSlotPool(capacity, grace, Clock.systemUTC());
        created.start();
        return created;
    }

    /** 偽プロセスを 1 つ起動して終了を待つ。停止理由 (正常終了なら null) を Future で返す。 */
    private static final class RecordingTask implements SlotTask {

        private final String requestId;
        private final Duration timeout;
        private final ScriptedProcessLauncher launcher;
        private final List<String> startOrder;
        private final CountDownLatch attached = new CountDownLatch(1);
        private final CompletableFuture<TerminationCause> finished = new CompletableFuture<>();
        private volatile TerminationCause outcome;
        private volatile boolean ran;

        RecordingTask(String requestId, Duration timeout, ScriptedProcessLauncher launcher) {
            this(requestId, timeout, launcher, new CopyOnWriteArrayList<>());
        }

        RecordingTask(String requestId, Duration timeout, ScriptedProcessLauncher launcher, List<String> startOrder) {
            this.requestId = requestId;
            this.timeout = timeout;
            this.launcher = launcher;
            this.startOrder = startOrder;
        }

        @Override
        public String requestId() {
            return requestId;
        }

        @Override
        public Duration timeout() {
            return timeout;
        }

        @Override
        public void run(SlotLease lease) {
            ran = true;
            startOrder.add(requestId);
            try {
                ExternalProcessHandle handle = launcher.spawn(
                        new ProcessSpec(List.of("fake-cli", requestId), Map.of()));
                if (!lease.attach(handle)) {
                    handle.kill();
                }
                attached.countDown();
                handle.waitFor();
            } catch (IOException ex) {
                throw new IllegalStateException(ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                attached.countDown();
                outcome = lease.seal();
            }
        }

        @Override
        public void released() {
            finished.complete(outcome);
        }

        @Override
        public void abandoned(TerminationCause cause) {
            finished.complete(cause);
        }

        CompletableFuture<TerminationCause> finished() {
            return finished;
        }

        boolean ran() {
            return ran;
        }

        void awaitAttached() throws InterruptedException {
            assertThat(attached.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }
}
