package io.github.hide212131.langchain4j.claude.broker.runtime.stream;

import io.github.hide212131.langchain4j.claude.broker.infra.logging.BrokerLog;
import io.github.hide212131.langchain4j.claude.broker.runtime.QueryResult;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 実行中プロセスの出力をリクエストごとの購読者へ中継する。
 *
 * <p>チャンネルはリクエスト作成時に開き、終端通知とともに閉じる。購読者がいなくても出力は集約され、
 * {@link #terminate(String, QueryResult)} の戻り値として取り出せる。
 */
@SuppressWarnings("PMD.AvoidCatchingGenericException")
public final class StreamBroker {

    private static final String PHASE = "stream";

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final BrokerLog log;

    public StreamBroker() {
        this(BrokerLog.forClass(StreamBroker.class));
    }

    StreamBroker(BrokerLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public void open(String requestId) {
        Objects.requireNonNull(requestId, "requestId");
        if (channels.putIfAbsent(requestId, new Channel()) != null) {
            throw new IllegalStateException("チャンネルは既に開かれています: " + requestId);
        }
    }

    /**
     * 購読者を登録する。
     *
     * @throws IllegalStateException チャンネルが無い、または既に購読者がいる場合
     */
    public void subscribe(String requestId, StreamListener listener) {
        Objects.requireNonNull(listener, "listener");
        Channel channel = channels.get(requestId);
        if (channel == null) {
            throw new IllegalStateException("チャンネルが存在しません: " + requestId);
        }
        synchronized (channel) {
            if (channel.listener != null) {
                throw new IllegalStateException("購読者は 1 リクエストにつき 1 つまでです: " + requestId);
            }
            channel.listener = listener;
        }
    }

    /**
     * チャンクを集約し、購読者へ渡す。終端後やチャンネルが無い場合は何もしない。
     *
     * @return 受け付けた場合は {@code true}
     */
    public boolean publish(String requestId, String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return false;
        }
        Channel channel = channels.get(requestId);
        if (channel == null) {
            return false;
        }
        synchronized (channel) {
            if (channel.closed) {
                return false;
            }
            channel.aggregate.append(chunk);
            channel.chunkCount++;
            if (channel.listener != null) {
                try {
                    channel.listener.onChunk(chunk);
                } catch (RuntimeException ex) {
                    log.warn(PHASE, requestId, "stream.chunk", "購読者がチャンク処理で例外を送出しました", "", ex);
                }
            }
            return true;
        }
    }

    /** 現時点までに集約した出力。チャンネルが無い場合は {@code null}。 */
    public String aggregate(String requestId) {
        Channel channel = channels.get(requestId);
        if (channel == null) {
            return null;
        }
        synchronized (channel) {
            return channel.aggregate.toString();
        }
    }

    public int chunkCount(String requestId) {
        Channel channel = channels.get(requestId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.chunkCount;
        }
    }

    /**
     * 終端結果を 1 回だけ通知し、チャンネルを閉じる。
     *
     * @return 集約済みの出力。既に閉じている場合は {@code null}
     */
    public String terminate(String requestId, QueryResult result) {
        Objects.requireNonNull(result, "result");
        Channel channel = channels.remove(requestId);
        if (channel == null) {
            return null;
        }
        synchronized (channel) {
            channel.closed = true;
            if (channel.listener != null) {
                try {
                    channel.listener.onTerminal(result);
                } catch (RuntimeException ex) {
                    log.warn(PHASE, requestId, "stream.terminal", "購読者が終端通知で例外を送出しました", "", ex);
                }
                channel.listener = null;
            }
            return channel.aggregate.toString();
        }
    }

    public boolean isOpen(String requestId) {
        return channels.containsKey(requestId);
    }

    public int openChannels() {
        return channels.size();
    }

    private static final class Channel {
        private final StringBuilder aggregate = new StringBuilder();
        private StreamListener listener;
        private int chunkCount;
        private boolean closed;
    }
}
