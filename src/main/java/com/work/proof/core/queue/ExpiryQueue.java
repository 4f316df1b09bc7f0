package com.work.proof.core.queue;

import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.model.ProofRequestId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按过期时间排序的索引最小堆。
 * <p>
 * 数组二叉堆 + (id -> 数组下标) 索引，两者在每次 swap/insert/remove 时同步维护，
 * 因此按业务 id 删除或改 key 都是 O(log n)。相同 expiry 的先后顺序不做保证。
 * <p>
 * 非线程安全：由 ProofManager 的全局锁串行访问。
 */
public class ExpiryQueue {

    public static final int NOT_PRESENT = -1;

    private static final int INITIAL_CAPACITY = 16;

    private long[] expiries = new long[INITIAL_CAPACITY];
    private ProofRequestId[] ids = new ProofRequestId[INITIAL_CAPACITY];
    private final Map<ProofRequestId, Integer> index = new HashMap<>();
    private int size;
    private long modCount;

    public void insert(long expiry, ProofRequestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id 不能为null");
        }
        if (index.containsKey(id)) {
            throw new ProofManagerException(ErrorCode.INVARIANT_VIOLATED, "expiry entry already present: " + id);
        }
        ensureCapacity(size + 1);
        expiries[size] = expiry;
        ids[size] = id;
        index.put(id, size);
        size++;
        modCount++;
        siftUp(size - 1);
    }

    public ExpiryEntry peekMin() {
        if (size == 0) {
            throw new ProofManagerException(ErrorCode.EMPTY_QUEUE, "expiry queue is empty");
        }
        return new ExpiryEntry(expiries[0], ids[0]);
    }

    public ExpiryEntry extractMin() {
        ExpiryEntry min = peekMin();
        removeAt(0);
        return min;
    }

    public ExpiryEntry removeByKey(ProofRequestId id) {
        int i = indexOf(id);
        if (i == NOT_PRESENT) {
            throw new ProofManagerException(ErrorCode.KEY_NOT_FOUND, "expiry entry not found: " + id);
        }
        ExpiryEntry removed = new ExpiryEntry(expiries[i], ids[i]);
        removeAt(i);
        return removed;
    }

    public void rekey(ProofRequestId id, long newExpiry) {
        int i = indexOf(id);
        if (i == NOT_PRESENT) {
            throw new ProofManagerException(ErrorCode.KEY_NOT_FOUND, "expiry entry not found: " + id);
        }
        long old = expiries[i];
        expiries[i] = newExpiry;
        modCount++;
        if (newExpiry < old) {
            siftUp(i);
        } else if (newExpiry > old) {
            siftDown(i);
        }
    }

    public boolean contains(ProofRequestId id) {
        return index.containsKey(id);
    }

    public int indexOf(ProofRequestId id) {
        Integer i = index.get(id);
        return i == null ? NOT_PRESENT : i;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 结构修改计数，调用方据此判断一次失败的操作是否动过队列。
     */
    public long modCount() {
        return modCount;
    }

    public void clear() {
        Arrays.fill(ids, 0, size, null);
        index.clear();
        size = 0;
        modCount++;
    }

    /**
     * 按数组顺序返回快照（非排序），用于排查与恢复校验。
     */
    public List<ExpiryEntry> snapshot() {
        List<ExpiryEntry> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(new ExpiryEntry(expiries[i], ids[i]));
        }
        return out;
    }

    private void removeAt(int i) {
        int last = size - 1;
        ProofRequestId removed = ids[i];
        if (i != last) {
            swap(i, last);
        }
        ids[last] = null;
        index.remove(removed);
        size--;
        modCount++;
        if (i < size) {
            // 被换上来的元素可能需要上浮也可能需要下沉
            siftDown(i);
            siftUp(i);
        }
    }

    private void siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) >>> 1;
            if (expiries[i] >= expiries[parent]) {
                return;
            }
            swap(i, parent);
            i = parent;
        }
    }

    private void siftDown(int i) {
        while (true) {
            int left = 2 * i + 1;
            if (left >= size) {
                return;
            }
            int right = left + 1;
            int smallest = right < size && expiries[right] < expiries[left] ? right : left;
            if (expiries[i] <= expiries[smallest]) {
                return;
            }
            swap(i, smallest);
            i = smallest;
        }
    }

    private void swap(int a, int b) {
        long e = expiries[a];
        expiries[a] = expiries[b];
        expiries[b] = e;
        ProofRequestId id = ids[a];
        ids[a] = ids[b];
        ids[b] = id;
        index.put(ids[a], a);
        index.put(ids[b], b);
    }

    private void ensureCapacity(int required) {
        if (required <= expiries.length) {
            return;
        }
        int newCapacity = Math.max(required, expiries.length * 2);
        expiries = Arrays.copyOf(expiries, newCapacity);
        ids = Arrays.copyOf(ids, newCapacity);
    }
}
