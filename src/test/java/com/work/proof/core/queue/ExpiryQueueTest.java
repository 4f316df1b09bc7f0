package com.work.proof.core.queue;

import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.model.ProofRequestId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExpiryQueueTest {

    private static ProofRequestId id(long block) {
        return ProofRequestId.of(1, block);
    }

    @Test
    public void extracts_in_expiry_order() {
        ExpiryQueue q = new ExpiryQueue();
        q.insert(50, id(1));
        q.insert(10, id(2));
        q.insert(30, id(3));
        q.insert(20, id(4));

        assertEquals(10, q.peekMin().getExpiry());
        assertEquals(id(2), q.extractMin().getId());
        assertEquals(id(4), q.extractMin().getId());
        assertEquals(id(3), q.extractMin().getId());
        assertEquals(id(1), q.extractMin().getId());
        assertTrue(q.isEmpty());
    }

    @Test
    public void empty_queue_reports_empty_queue() {
        ExpiryQueue q = new ExpiryQueue();
        ProofManagerException e = assertThrows(ProofManagerException.class, q::peekMin);
        assertEquals(ErrorCode.EMPTY_QUEUE, e.getCode());
        e = assertThrows(ProofManagerException.class, q::extractMin);
        assertEquals(ErrorCode.EMPTY_QUEUE, e.getCode());
    }

    @Test
    public void remove_and_rekey_by_id() {
        ExpiryQueue q = new ExpiryQueue();
        for (int i = 0; i < 8; i++) {
            q.insert(100 + i, id(i));
        }
        ExpiryEntry removed = q.removeByKey(id(3));
        assertEquals(103, removed.getExpiry());
        assertFalse(q.contains(id(3)));
        assertEquals(ExpiryQueue.NOT_PRESENT, q.indexOf(id(3)));
        assertEquals(7, q.size());

        q.rekey(id(7), 1);
        assertEquals(id(7), q.peekMin().getId());
        q.rekey(id(7), 1000);
        assertEquals(id(0), q.peekMin().getId());
    }

    @Test
    public void missing_key_reports_key_not_found() {
        ExpiryQueue q = new ExpiryQueue();
        q.insert(5, id(1));
        ProofManagerException e = assertThrows(ProofManagerException.class, () -> q.removeByKey(id(2)));
        assertEquals(ErrorCode.KEY_NOT_FOUND, e.getCode());
        e = assertThrows(ProofManagerException.class, () -> q.rekey(id(2), 10));
        assertEquals(ErrorCode.KEY_NOT_FOUND, e.getCode());
        assertEquals(1, q.size());
    }

    @Test
    public void duplicate_insert_is_rejected() {
        ExpiryQueue q = new ExpiryQueue();
        q.insert(5, id(1));
        ProofManagerException e = assertThrows(ProofManagerException.class, () -> q.insert(6, id(1)));
        assertEquals(ErrorCode.INVARIANT_VIOLATED, e.getCode());
    }

    @Test
    public void index_stays_consistent_under_random_operations() {
        ExpiryQueue q = new ExpiryQueue();
        Random random = new Random(42);
        List<ProofRequestId> live = new ArrayList<>();
        long next = 0;
        for (int step = 0; step < 2000; step++) {
            int op = random.nextInt(4);
            if (op <= 1 || live.isEmpty()) {
                ProofRequestId id = id(next++);
                q.insert(random.nextInt(500), id);
                live.add(id);
            } else if (op == 2) {
                ProofRequestId id = live.remove(random.nextInt(live.size()));
                q.removeByKey(id);
            } else {
                ProofRequestId id = live.get(random.nextInt(live.size()));
                q.rekey(id, random.nextInt(500));
            }
            assertEquals(live.size(), q.size());
            List<ExpiryEntry> snapshot = q.snapshot();
            for (ProofRequestId id : live) {
                int i = q.indexOf(id);
                assertTrue(i >= 0 && i < q.size());
                assertEquals(id, snapshot.get(i).getId());
            }
        }

        long last = Long.MIN_VALUE;
        while (!q.isEmpty()) {
            long expiry = q.extractMin().getExpiry();
            assertTrue(expiry >= last);
            last = expiry;
        }
    }

    @Test
    public void mod_count_moves_on_every_structural_change() {
        ExpiryQueue q = new ExpiryQueue();
        long v0 = q.modCount();
        q.insert(1, id(1));
        long v1 = q.modCount();
        assertTrue(v1 > v0);
        q.rekey(id(1), 2);
        assertTrue(q.modCount() > v1);
        long v2 = q.modCount();
        q.contains(id(1));
        q.peekMin();
        assertEquals(v2, q.modCount());
    }
}
