package com.work.proof.app.event;

import com.work.proof.core.event.ProofMarketEvent;
import com.work.proof.core.model.ProvingNetwork;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 有界、带序号的内存事件日志，供证明网络以 poll-only 方式增量拉取（afterSeq + limit）。
 * <p>
 * 超出容量时丢弃最旧的记录；序号从 1 开始单调递增，不会因丢弃而复用。
 */
public class EventJournal {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long lastSeq;

    public EventJournal(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须大于0");
        }
        this.capacity = capacity;
    }

    public synchronized long append(ProofMarketEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event 不能为null");
        }
        lastSeq++;
        entries.addLast(new Entry(lastSeq, event));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        return lastSeq;
    }

    /**
     * @param afterSeq 只返回序号大于该值的记录，null 表示从头开始
     * @param limit    条数上限，null 或非正数取默认值，超过 {@link #MAX_LIMIT} 截断
     * @param network  为 null 时不过滤
     */
    public synchronized List<Entry> list(Long afterSeq, Integer limit, ProvingNetwork network) {
        long after = afterSeq == null ? 0L : afterSeq;
        int max = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        List<Entry> out = new ArrayList<>(Math.min(max, entries.size()));
        for (Entry e : entries) {
            if (out.size() >= max) {
                break;
            }
            if (e.getSeq() <= after) {
                continue;
            }
            if (network != null && e.getEvent().getNetwork() != network) {
                continue;
            }
            out.add(e);
        }
        return out;
    }

    public synchronized long lastSeq() {
        return lastSeq;
    }

    public synchronized int size() {
        return entries.size();
    }

    public static final class Entry {

        private final long seq;
        private final ProofMarketEvent event;

        Entry(long seq, ProofMarketEvent event) {
            this.seq = seq;
            this.event = event;
        }

        public long getSeq() {
            return seq;
        }

        public ProofMarketEvent getEvent() {
            return event;
        }
    }
}
