package io.github.hide212131.langchain4j.claude.broker.runtime.pool;

/**
 * プール占有状況のある時点の値。
 *
 * @param activeSlots 貸し出し中の枠数
 * @param capacity 枠の総数
 * @param queued 待ち行列の長さ
 */
public record PoolSnapshot(int activeSlots, int capacity, int queued) {
}
