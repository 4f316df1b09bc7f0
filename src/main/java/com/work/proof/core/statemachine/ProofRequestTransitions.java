package com.work.proof.core.statemachine;

import com.work.proof.core.exception.IllegalTransitionException;
import com.work.proof.core.model.ProofRequestStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.work.proof.core.model.ProofRequestStatus.COMMITTED;
import static com.work.proof.core.model.ProofRequestStatus.PAID;
import static com.work.proof.core.model.ProofRequestStatus.PENDING_ACKNOWLEDGEMENT;
import static com.work.proof.core.model.ProofRequestStatus.PROVEN;
import static com.work.proof.core.model.ProofRequestStatus.REFUSED;
import static com.work.proof.core.model.ProofRequestStatus.TIMED_OUT;
import static com.work.proof.core.model.ProofRequestStatus.UNACKNOWLEDGED;
import static com.work.proof.core.model.ProofRequestStatus.VALIDATED;
import static com.work.proof.core.model.ProofRequestStatus.VALIDATION_FAILED;

/**
 * 状态迁移表（静态数据，便于审计与穷举测试）。
 *
 * <pre>
 * PENDING_ACKNOWLEDGEMENT -> COMMITTED | REFUSED | UNACKNOWLEDGED
 * COMMITTED               -> PROVEN | TIMED_OUT
 * PROVEN                  -> VALIDATED | VALIDATION_FAILED
 * VALIDATED               -> PAID
 * </pre>
 * 其余状态为终态。
 */
public final class ProofRequestTransitions {

    private static final Map<ProofRequestStatus, Set<ProofRequestStatus>> ALLOWED;

    /**
     * submitter 可直接驱动的迁移子集（只有验证结果）。
     */
    private static final Map<ProofRequestStatus, Set<ProofRequestStatus>> SUBMITTER_ALLOWED;

    static {
        Map<ProofRequestStatus, Set<ProofRequestStatus>> all = new EnumMap<>(ProofRequestStatus.class);
        for (ProofRequestStatus s : ProofRequestStatus.values()) {
            all.put(s, Collections.unmodifiableSet(EnumSet.noneOf(ProofRequestStatus.class)));
        }
        all.put(PENDING_ACKNOWLEDGEMENT, Collections.unmodifiableSet(EnumSet.of(COMMITTED, REFUSED, UNACKNOWLEDGED)));
        all.put(COMMITTED, Collections.unmodifiableSet(EnumSet.of(PROVEN, TIMED_OUT)));
        all.put(PROVEN, Collections.unmodifiableSet(EnumSet.of(VALIDATED, VALIDATION_FAILED)));
        all.put(VALIDATED, Collections.unmodifiableSet(EnumSet.of(PAID)));
        ALLOWED = Collections.unmodifiableMap(all);

        Map<ProofRequestStatus, Set<ProofRequestStatus>> submitter = new EnumMap<>(ProofRequestStatus.class);
        for (ProofRequestStatus s : ProofRequestStatus.values()) {
            submitter.put(s, Collections.unmodifiableSet(EnumSet.noneOf(ProofRequestStatus.class)));
        }
        submitter.put(PROVEN, Collections.unmodifiableSet(EnumSet.of(VALIDATED, VALIDATION_FAILED)));
        SUBMITTER_ALLOWED = Collections.unmodifiableMap(submitter);
    }

    private ProofRequestTransitions() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static boolean isAllowed(ProofRequestStatus from, ProofRequestStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    public static boolean isAllowedForSubmitter(ProofRequestStatus from, ProofRequestStatus to) {
        return from != null && to != null && SUBMITTER_ALLOWED.get(from).contains(to);
    }

    public static Set<ProofRequestStatus> allowedFrom(ProofRequestStatus from) {
        return ALLOWED.get(from);
    }

    public static boolean isTerminal(ProofRequestStatus status) {
        return ALLOWED.get(status).isEmpty();
    }

    public static void requireAllowed(ProofRequestStatus from, ProofRequestStatus to) {
        if (!isAllowed(from, to)) {
            throw new IllegalTransitionException(from, to);
        }
    }

    public static void requireAllowedForSubmitter(ProofRequestStatus from, ProofRequestStatus to) {
        if (!isAllowedForSubmitter(from, to)) {
            throw new IllegalTransitionException(from, to);
        }
    }
}
