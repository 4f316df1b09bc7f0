package com.work.proof.core;

import com.work.proof.core.access.StaticAccessControl;
import com.work.proof.core.config.ProofManagerConfig;
import com.work.proof.core.escrow.EscrowLedger;
import com.work.proof.core.escrow.InMemoryEscrowLedger;
import com.work.proof.core.escrow.PreparedTransfer;
import com.work.proof.core.escrow.TransferStatus;
import com.work.proof.core.event.ProofMarketEvent;
import com.work.proof.core.event.ProofRequestExpiredEvent;
import com.work.proof.core.event.ProofRequestSubmittedEvent;
import com.work.proof.core.event.RewardPaidEvent;
import com.work.proof.core.exception.DeadlinePassedException;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.FundsUnavailableException;
import com.work.proof.core.exception.IllegalTransitionException;
import com.work.proof.core.exception.InvalidRequestException;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.exception.RequestNotFoundException;
import com.work.proof.core.exception.TransferFailedException;
import com.work.proof.core.exception.UnauthorizedException;
import com.work.proof.core.model.MarketState;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestParams;
import com.work.proof.core.model.ProofRequestStatus;
import com.work.proof.core.model.ProtocolVersion;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkStatus;
import com.work.proof.core.support.InMemoryProofMarketStore;
import com.work.proof.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ProofManagerTest {

    private static final String ESCROW = "0x3000000000000000000000000000000000000003";
    private static final String FERMAH = "0x1000000000000000000000000000000000000001";
    private static final String LAGRANGE = "0x2000000000000000000000000000000000000002";
    private static final String ADMIN = "0x4000000000000000000000000000000000000004";
    private static final String SUBMITTER = "0x5000000000000000000000000000000000000005";
    private static final String STRANGER = "0x6000000000000000000000000000000000000006";

    private static final long T0 = 1_700_000_000L;
    private static final BigInteger USDC = BigInteger.valueOf(1_000_000L);
    private static final BigInteger CEILING = BigInteger.valueOf(25_000_000L);

    private MutableClock clock;
    private InMemoryProofMarketStore store;
    private InMemoryEscrowLedger ledger;
    private List<ProofMarketEvent> published;
    private ProofManager manager;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryProofMarketStore();
        ledger = new InMemoryEscrowLedger(ESCROW, USDC.multiply(BigInteger.valueOf(1_000)));
        published = new ArrayList<>();
        manager = newManager(ledger, ProofManagerConfig.defaultConfig(ESCROW));
    }

    private ProofManager newManager(EscrowLedger escrow, ProofManagerConfig config) {
        return new ProofManager(config, store, escrow,
                new StaticAccessControl(Collections.singletonList(ADMIN), Collections.singletonList(SUBMITTER)),
                clock, published::add, FERMAH, LAGRANGE);
    }

    private static ProofRequestParams params(long timeoutAfter, BigInteger maxReward) {
        return new ProofRequestParams("https://inputs.example/1", new ProtocolVersion(0, 27, 1), timeoutAfter, maxReward);
    }

    private ProofRequest submit(long block) {
        return manager.submit(SUBMITTER, ProofRequestId.of(1, block), params(3600, USDC.multiply(BigInteger.valueOf(4))));
    }

    private static ProofRequestId id(long block) {
        return ProofRequestId.of(1, block);
    }

    // ------------------------------------------------------------------ lifecycle

    @Test
    public void full_lifecycle_pays_the_assigned_network() {
        ProofRequest created = manager.submit(SUBMITTER, id(1), params(3600, USDC.multiply(BigInteger.valueOf(4))));
        assertEquals(0L, created.getRequestId());
        assertEquals(ProvingNetwork.FERMAH, created.getAssignedTo());
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, created.getStatus());
        assertEquals(T0, created.getSubmittedAt());
        assertEquals(1, manager.inFlightCount());

        clock.advance(60);
        assertEquals(ProofRequestStatus.COMMITTED, manager.acknowledge(FERMAH, id(1), true).getStatus());

        clock.advance(600);
        byte[] proof = {1, 2, 3};
        ProofRequest proven = manager.submitProof(FERMAH, id(1), proof, USDC.multiply(BigInteger.valueOf(3)));
        assertEquals(ProofRequestStatus.PROVEN, proven.getStatus());
        assertEquals(0, manager.inFlightCount());
        assertEquals(USDC.multiply(BigInteger.valueOf(3)), manager.getObligations().getPotentialFutureReward());

        manager.submitValidationResult(SUBMITTER, id(1), true);
        assertEquals(ProofRequestStatus.VALIDATED, manager.getRequestStatus(id(1)));
        assertEquals(USDC.multiply(BigInteger.valueOf(3)), manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(BigInteger.ZERO, manager.getObligations().getPotentialFutureReward());

        BigInteger paid = manager.claimReward(FERMAH);
        assertEquals(USDC.multiply(BigInteger.valueOf(3)), paid);
        assertEquals(ProofRequestStatus.PAID, manager.getRequestStatus(id(1)));
        assertEquals(BigInteger.ZERO, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(USDC.multiply(BigInteger.valueOf(3)), ledger.balanceOf(FERMAH));
        assertArrayEquals(proof, manager.getRequest(id(1)).get().getProof());

        ProofMarketEvent last = published.get(published.size() - 1);
        assertInstanceOf(RewardPaidEvent.class, last);
        assertEquals(ProvingNetwork.FERMAH, last.getNetwork());

        FundsUnavailableException again = assertThrows(FundsUnavailableException.class, () -> manager.claimReward(FERMAH));
        assertEquals(ErrorCode.NO_PAYMENT_DUE, again.getCode());
    }

    @Test
    public void failed_validation_releases_reward_without_paying() {
        submit(1);
        manager.acknowledge(FERMAH, id(1), true);
        manager.submitProof(FERMAH, id(1), new byte[]{9}, USDC);
        manager.submitValidationResult(SUBMITTER, id(1), false);

        assertEquals(ProofRequestStatus.VALIDATION_FAILED, manager.getRequestStatus(id(1)));
        assertEquals(BigInteger.ZERO, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(BigInteger.ZERO, manager.getObligations().getPotentialFutureReward());

        IllegalTransitionException e = assertThrows(IllegalTransitionException.class,
                () -> manager.submitValidationResult(SUBMITTER, id(1), true));
        assertEquals(ProofRequestStatus.VALIDATION_FAILED, e.getFrom());
    }

    @Test
    public void claim_pays_every_validated_request_at_once() {
        manager.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);
        for (long b = 1; b <= 3; b++) {
            submit(b);
        }
        // 0 -> FERMAH, 1 -> LAGRANGE, 2 -> 偏好网络 FERMAH
        for (long b : new long[]{1, 3}) {
            manager.acknowledge(FERMAH, id(b), true);
            manager.submitProof(FERMAH, id(b), new byte[]{1}, USDC);
            manager.submitValidationResult(SUBMITTER, id(b), true);
        }
        assertEquals(BigInteger.valueOf(2).multiply(USDC), manager.claimReward(FERMAH));
        assertEquals(ProofRequestStatus.PAID, manager.getRequestStatus(id(1)));
        assertEquals(ProofRequestStatus.PAID, manager.getRequestStatus(id(3)));
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, manager.getRequestStatus(id(2)));
    }

    @Test
    public void rejected_acknowledgement_leaves_queue() {
        submit(1);
        ProofRequest refused = manager.acknowledge(FERMAH, id(1), false);
        assertEquals(ProofRequestStatus.REFUSED, refused.getStatus());
        assertEquals(0, manager.inFlightCount());
        assertThrows(IllegalTransitionException.class, () -> manager.acknowledge(FERMAH, id(1), true));
    }

    // ------------------------------------------------------------------ submit validation

    @Test
    public void submit_validates_duplicate_timeout_and_reward() {
        submit(1);
        InvalidRequestException dup = assertThrows(InvalidRequestException.class, () -> submit(1));
        assertEquals(ErrorCode.DUPLICATE_REQUEST, dup.getCode());

        InvalidRequestException tooShort = assertThrows(InvalidRequestException.class,
                () -> manager.submit(SUBMITTER, id(2), params(120, USDC)));
        assertEquals(ErrorCode.INVALID_TIMEOUT, tooShort.getCode());
        InvalidRequestException tooLong = assertThrows(InvalidRequestException.class,
                () -> manager.submit(SUBMITTER, id(2), params(2 * 24 * 3600 + 1, USDC)));
        assertEquals(ErrorCode.INVALID_TIMEOUT, tooLong.getCode());
        manager.submit(SUBMITTER, id(3), params(2 * 24 * 3600, USDC));
        manager.submit(SUBMITTER, id(4), params(121, USDC));

        InvalidRequestException zero = assertThrows(InvalidRequestException.class,
                () -> manager.submit(SUBMITTER, id(5), params(3600, BigInteger.ZERO)));
        assertEquals(ErrorCode.REWARD_OUT_OF_BOUNDS, zero.getCode());
        InvalidRequestException over = assertThrows(InvalidRequestException.class,
                () -> manager.submit(SUBMITTER, id(5), params(3600, CEILING.add(BigInteger.ONE))));
        assertEquals(ErrorCode.REWARD_OUT_OF_BOUNDS, over.getCode());
        manager.submit(SUBMITTER, id(5), params(3600, CEILING));
    }

    @Test
    public void assignment_rotates_and_refuses_without_preferred() {
        assertEquals(ProvingNetwork.FERMAH, submit(1).getAssignedTo());
        assertEquals(ProvingNetwork.LAGRANGE, submit(2).getAssignedTo());

        ProofRequest third = submit(3);
        assertEquals(ProvingNetwork.NONE, third.getAssignedTo());
        assertEquals(ProofRequestStatus.REFUSED, third.getStatus());
        assertEquals(2L, third.getRequestId());

        manager.setPreferredNetwork(ADMIN, ProvingNetwork.LAGRANGE);
        ProofRequest fourth = submit(4);
        assertEquals(ProvingNetwork.LAGRANGE, fourth.getAssignedTo());
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, fourth.getStatus());
        assertEquals(ProvingNetwork.FERMAH, submit(5).getAssignedTo());
        assertEquals(4, manager.inFlightCount());
    }

    @Test
    public void inactive_assignee_creates_refused_request() {
        manager.setNetworkStatus(ADMIN, ProvingNetwork.FERMAH, ProvingNetworkStatus.INACTIVE);
        ProofRequest r = submit(1);
        assertEquals(ProvingNetwork.FERMAH, r.getAssignedTo());
        assertEquals(ProofRequestStatus.REFUSED, r.getStatus());
        assertEquals(0, manager.inFlightCount());
        assertEquals(1L, manager.submit(SUBMITTER, id(2), params(3600, USDC)).getRequestId());
        ProofRequestSubmittedEvent first = (ProofRequestSubmittedEvent) published.stream()
                .filter(e -> e instanceof ProofRequestSubmittedEvent).findFirst().get();
        assertEquals(ProofRequestStatus.REFUSED, first.getStatus());
    }

    // ------------------------------------------------------------------ deadlines

    @Test
    public void acknowledgement_window_is_inclusive() {
        submit(1);
        submit(2);
        clock.advance(120);
        manager.acknowledge(FERMAH, id(1), true);

        clock.advance(1);
        DeadlinePassedException e = assertThrows(DeadlinePassedException.class,
                () -> manager.acknowledge(LAGRANGE, id(2), true));
        assertEquals(ErrorCode.ACK_DEADLINE_PASSED, e.getCode());
        assertEquals(ProofRequestStatus.UNACKNOWLEDGED, manager.getRequestStatus(id(2)));
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, store.findRequest(id(2)).get().getStatus());
    }

    @Test
    public void proving_window_is_inclusive() {
        submit(1);
        submit(2);
        manager.acknowledge(FERMAH, id(1), true);
        manager.acknowledge(LAGRANGE, id(2), true);
        clock.advance(3600);
        manager.submitProof(FERMAH, id(1), new byte[]{1}, USDC);

        clock.advance(1);
        DeadlinePassedException e = assertThrows(DeadlinePassedException.class,
                () -> manager.submitProof(LAGRANGE, id(2), new byte[]{1}, USDC));
        assertEquals(ErrorCode.PROVING_DEADLINE_PASSED, e.getCode());
        assertEquals(ProofRequestStatus.TIMED_OUT, manager.getRequestStatus(id(2)));
    }

    @Test
    public void proof_must_be_non_empty_and_reward_is_clamped() {
        submit(1);
        manager.acknowledge(FERMAH, id(1), true);
        InvalidRequestException empty = assertThrows(InvalidRequestException.class,
                () -> manager.submitProof(FERMAH, id(1), new byte[0], USDC));
        assertEquals(ErrorCode.EMPTY_PROOF, empty.getCode());

        ProofRequest proven = manager.submitProof(FERMAH, id(1), new byte[]{7}, CEILING);
        assertEquals(USDC.multiply(BigInteger.valueOf(4)), proven.getRequestedReward());
        assertEquals(USDC.multiply(BigInteger.valueOf(4)), manager.getObligations().getPotentialFutureReward());
    }

    @Test
    public void proof_before_acknowledgement_is_an_invalid_transition() {
        submit(1);
        IllegalTransitionException e = assertThrows(IllegalTransitionException.class,
                () -> manager.submitProof(FERMAH, id(1), new byte[]{1}, USDC));
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, e.getFrom());
        assertEquals(ProofRequestStatus.PROVEN, e.getTo());
    }

    // ------------------------------------------------------------------ authorization

    @Test
    public void callers_are_checked_against_roles_and_assignee() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> manager.submit(STRANGER, id(1), params(3600, USDC)));
        assertEquals(ErrorCode.UNAUTHORIZED, e.getCode());

        submit(1);
        e = assertThrows(UnauthorizedException.class, () -> manager.acknowledge(LAGRANGE, id(1), true));
        assertEquals(ErrorCode.ONLY_ASSIGNEE, e.getCode());
        e = assertThrows(UnauthorizedException.class, () -> manager.acknowledge(SUBMITTER, id(1), true));
        assertEquals(ErrorCode.ONLY_ASSIGNEE, e.getCode());

        manager.acknowledge(FERMAH, id(1), true);
        manager.submitProof(FERMAH, id(1), new byte[]{1}, USDC);
        assertThrows(UnauthorizedException.class, () -> manager.submitValidationResult(FERMAH, id(1), true));

        assertThrows(UnauthorizedException.class,
                () -> manager.setNetworkStatus(SUBMITTER, ProvingNetwork.FERMAH, ProvingNetworkStatus.INACTIVE));
        assertThrows(UnauthorizedException.class, () -> manager.setPreferredNetwork(FERMAH, ProvingNetwork.FERMAH));
        assertThrows(UnauthorizedException.class,
                () -> manager.setNetworkAddress(STRANGER, ProvingNetwork.FERMAH, STRANGER));
        assertThrows(UnauthorizedException.class, () -> manager.claimReward(STRANGER));
    }

    @Test
    public void network_address_change_moves_caller_identity() {
        submit(1);
        String moved = "0x1000000000000000000000000000000000000011";
        manager.setNetworkAddress(ADMIN, ProvingNetwork.FERMAH, moved);
        assertThrows(UnauthorizedException.class, () -> manager.acknowledge(FERMAH, id(1), true));
        assertEquals(ProofRequestStatus.COMMITTED, manager.acknowledge(moved, id(1), true).getStatus());
    }

    @Test
    public void unknown_request_is_not_found() {
        assertFalse(manager.getRequest(id(99)).isPresent());
        RequestNotFoundException e = assertThrows(RequestNotFoundException.class, () -> manager.getRequestStatus(id(99)));
        assertEquals(ErrorCode.REQUEST_NOT_FOUND, e.getCode());
        assertThrows(RequestNotFoundException.class, () -> manager.acknowledge(FERMAH, id(99), true));
    }

    // ------------------------------------------------------------------ payouts

    @Test
    public void rejected_transfer_changes_nothing() {
        EscrowLedger escrow = mockEscrow(USDC.multiply(BigInteger.valueOf(1_000)));
        PreparedTransfer transfer = new PreparedTransfer("0xa1", FERMAH, USDC, "0xf1");
        when(escrow.prepareTransfer(anyString(), any(BigInteger.class))).thenReturn(transfer);
        when(escrow.broadcast(transfer)).thenReturn(false);
        manager = newManager(escrow, ProofManagerConfig.defaultConfig(ESCROW));

        validated(1);
        int eventsBefore = published.size();
        TransferFailedException e = assertThrows(TransferFailedException.class, () -> manager.claimReward(FERMAH));
        assertTrue(e.isRetryable());
        assertEquals(USDC, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertNull(manager.getNetwork(ProvingNetwork.FERMAH).getPendingPayout());
        assertEquals(ProofRequestStatus.VALIDATED, manager.getRequestStatus(id(1)));
        assertNull(store.findRequest(id(1)).get().getPayoutReference());
        assertEquals(eventsBefore, published.size());
        verify(escrow, never()).awaitTransfer(anyString());

        when(escrow.prepareTransfer(anyString(), any(BigInteger.class))).thenThrow(new IllegalStateException("rpc down"));
        e = assertThrows(TransferFailedException.class, () -> manager.claimReward(FERMAH));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(USDC, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertNull(manager.getNetwork(ProvingNetwork.FERMAH).getPendingPayout());
    }

    @Test
    public void reverted_transfer_is_abandoned_and_can_be_claimed_again() {
        EscrowLedger escrow = mockEscrow(USDC.multiply(BigInteger.valueOf(1_000)));
        PreparedTransfer first = new PreparedTransfer("0xa1", FERMAH, USDC, "0xf1");
        PreparedTransfer second = new PreparedTransfer("0xa2", FERMAH, USDC, "0xf2");
        when(escrow.prepareTransfer(anyString(), any(BigInteger.class))).thenReturn(first, second);
        when(escrow.broadcast(any(PreparedTransfer.class))).thenReturn(true);
        when(escrow.awaitTransfer("0xa1")).thenReturn(TransferStatus.FAILED);
        when(escrow.awaitTransfer("0xa2")).thenReturn(TransferStatus.CONFIRMED);
        manager = newManager(escrow, ProofManagerConfig.defaultConfig(ESCROW));

        validated(1);
        assertThrows(TransferFailedException.class, () -> manager.claimReward(FERMAH));
        assertNull(manager.getNetwork(ProvingNetwork.FERMAH).getPendingPayout());
        assertEquals(ProofRequestStatus.VALIDATED, manager.getRequestStatus(id(1)));

        assertEquals(USDC, manager.claimReward(FERMAH));
        assertEquals(ProofRequestStatus.PAID, manager.getRequestStatus(id(1)));
        assertEquals(BigInteger.ZERO, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
    }

    @Test
    public void receipt_timeout_keeps_payout_pending_and_retry_never_signs_a_second_transfer() {
        EscrowLedger escrow = mockEscrow(USDC.multiply(BigInteger.valueOf(1_000)));
        PreparedTransfer transfer = new PreparedTransfer("0xa1", FERMAH, USDC.multiply(BigInteger.valueOf(3)), "0xf1");
        when(escrow.prepareTransfer(anyString(), any(BigInteger.class))).thenReturn(transfer);
        when(escrow.broadcast(transfer)).thenReturn(true);
        when(escrow.awaitTransfer("0xa1")).thenReturn(TransferStatus.PENDING);
        when(escrow.checkTransfer("0xa1")).thenReturn(TransferStatus.PENDING, TransferStatus.CONFIRMED);
        manager = newManager(escrow, ProofManagerConfig.defaultConfig(ESCROW));

        submit(1);
        manager.acknowledge(FERMAH, id(1), true);
        manager.submitProof(FERMAH, id(1), new byte[]{1}, USDC.multiply(BigInteger.valueOf(3)));
        manager.submitValidationResult(SUBMITTER, id(1), true);
        int eventsBefore = published.size();

        ProofManagerException pending = assertThrows(ProofManagerException.class, () -> manager.claimReward(FERMAH));
        assertEquals(ErrorCode.PAYOUT_PENDING, pending.getCode());
        assertTrue(pending.isRetryable());
        assertEquals(USDC.multiply(BigInteger.valueOf(3)), manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(transfer, manager.getNetwork(ProvingNetwork.FERMAH).getPendingPayout());
        assertEquals("0xa1", store.findRequest(id(1)).get().getPayoutReference());
        assertEquals(ProofRequestStatus.VALIDATED, manager.getRequestStatus(id(1)));

        // 仍未确认：原样重发同一笔交易
        assertThrows(ProofManagerException.class, () -> manager.claimReward(FERMAH));
        verify(escrow, times(2)).broadcast(transfer);
        assertEquals(eventsBefore, published.size());

        // 期间验证通过的新请求不属于这笔转账
        manager.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);
        submit(50);
        validated(2);
        assertEquals(USDC.multiply(BigInteger.valueOf(4)), manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());

        assertEquals(USDC.multiply(BigInteger.valueOf(3)), manager.claimReward(FERMAH));
        verify(escrow, times(1)).prepareTransfer(anyString(), any(BigInteger.class));
        verify(escrow, times(2)).broadcast(any(PreparedTransfer.class));
        assertEquals(ProofRequestStatus.PAID, manager.getRequestStatus(id(1)));
        assertEquals(ProofRequestStatus.VALIDATED, manager.getRequestStatus(id(2)));
        assertEquals(USDC, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertNull(manager.getNetwork(ProvingNetwork.FERMAH).getPendingPayout());
        assertInstanceOf(RewardPaidEvent.class, published.get(published.size() - 1));
    }

    @Test
    public void broadcast_error_is_treated_as_possibly_sent() {
        EscrowLedger escrow = mockEscrow(USDC.multiply(BigInteger.valueOf(1_000)));
        PreparedTransfer transfer = new PreparedTransfer("0xa1", FERMAH, USDC, "0xf1");
        when(escrow.prepareTransfer(anyString(), any(BigInteger.class))).thenReturn(transfer);
        when(escrow.broadcast(transfer)).thenThrow(new IllegalStateException("socket closed"));
        when(escrow.awaitTransfer("0xa1")).thenThrow(new IllegalStateException("socket closed"));
        manager = newManager(escrow, ProofManagerConfig.defaultConfig(ESCROW));

        validated(1);
        ProofManagerException e = assertThrows(ProofManagerException.class, () -> manager.claimReward(FERMAH));
        assertEquals(ErrorCode.PAYOUT_PENDING, e.getCode());
        assertEquals(transfer, manager.getNetwork(ProvingNetwork.FERMAH).getPendingPayout());
        assertEquals(USDC, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
    }

    @Test
    public void claim_needs_enough_escrow_balance() {
        AtomicReference<BigInteger> balance = new AtomicReference<>(USDC.multiply(BigInteger.valueOf(1_000)));
        EscrowLedger escrow = mock(EscrowLedger.class);
        when(escrow.balanceOf(anyString())).thenAnswer(inv -> balance.get());
        manager = newManager(escrow, ProofManagerConfig.defaultConfig(ESCROW));

        validated(1);
        balance.set(USDC.subtract(BigInteger.ONE));
        FundsUnavailableException e = assertThrows(FundsUnavailableException.class, () -> manager.claimReward(FERMAH));
        assertEquals(ErrorCode.INSUFFICIENT_FUNDS, e.getCode());
        verify(escrow, never()).prepareTransfer(anyString(), any(BigInteger.class));
        verify(escrow, never()).broadcast(any(PreparedTransfer.class));
    }

    @Test
    public void failed_validation_bookkeeping_leaves_no_partial_write() {
        manager.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);
        validated(1);
        submit(50);
        submit(2);
        manager.acknowledge(FERMAH, id(2), true);
        manager.submitProof(FERMAH, id(2), new byte[]{1}, USDC);
        MarketState broken = store.loadState();
        broken.setPotentialFutureReward(BigInteger.ZERO);
        store.saveState(broken);
        int eventsBefore = published.size();

        ProofManagerException e = assertThrows(ProofManagerException.class,
                () -> manager.submitValidationResult(SUBMITTER, id(2), true));
        assertEquals(ErrorCode.INVARIANT_VIOLATED, e.getCode());
        assertEquals(ProofRequestStatus.PROVEN, store.findRequest(id(2)).get().getStatus());
        assertEquals(USDC, manager.getNetwork(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(eventsBefore, published.size());
    }

    private EscrowLedger mockEscrow(BigInteger balance) {
        EscrowLedger escrow = mock(EscrowLedger.class);
        when(escrow.balanceOf(anyString())).thenReturn(balance);
        return escrow;
    }

    private void validated(long block) {
        submit(block);
        manager.acknowledge(FERMAH, id(block), true);
        manager.submitProof(FERMAH, id(block), new byte[]{1}, USDC);
        manager.submitValidationResult(SUBMITTER, id(block), true);
    }

    // ------------------------------------------------------------------ admission and purge

    @Test
    public void admission_rejects_when_escrow_cannot_cover_another_request() {
        ledger = new InMemoryEscrowLedger(ESCROW, CEILING.multiply(BigInteger.valueOf(2)));
        store = new InMemoryProofMarketStore();
        manager = newManager(ledger, ProofManagerConfig.defaultConfig(ESCROW));
        manager.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);

        submit(1);
        submit(2);
        FundsUnavailableException e = assertThrows(FundsUnavailableException.class, () -> submit(3));
        assertEquals(ErrorCode.NO_FUNDS_AVAILABLE, e.getCode());
        assertFalse(manager.getRequest(id(3)).isPresent());

        ledger.deposit(CEILING);
        assertEquals(2L, submit(3).getRequestId());
    }

    @Test
    public void submit_purges_at_most_purge_limit_expired_entries() {
        manager.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);
        for (long b = 1; b <= 12; b++) {
            submit(b);
        }
        assertEquals(12, manager.inFlightCount());

        clock.advance(121);
        published.clear();
        submit(100);
        assertEquals(3, manager.inFlightCount());
        long expired = published.stream().filter(e -> e instanceof ProofRequestExpiredEvent).count();
        assertEquals(10, expired);

        int unacknowledged = 0;
        for (long b = 1; b <= 12; b++) {
            if (store.findRequest(id(b)).get().getStatus() == ProofRequestStatus.UNACKNOWLEDGED) {
                unacknowledged++;
            }
        }
        assertEquals(10, unacknowledged);

        submit(101);
        assertEquals(2, manager.inFlightCount());
    }

    @Test
    public void failed_admission_rolls_back_purge() {
        AtomicReference<BigInteger> balance = new AtomicReference<>(CEILING.multiply(BigInteger.valueOf(2)));
        EscrowLedger escrow = mock(EscrowLedger.class);
        when(escrow.balanceOf(anyString())).thenAnswer(inv -> balance.get());
        manager = newManager(escrow, ProofManagerConfig.defaultConfig(ESCROW));
        manager.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);

        submit(1);
        clock.advance(100);
        submit(2);
        clock.advance(21);
        balance.set(CEILING);
        published.clear();

        FundsUnavailableException e = assertThrows(FundsUnavailableException.class, () -> submit(3));
        assertEquals(ErrorCode.NO_FUNDS_AVAILABLE, e.getCode());
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, store.findRequest(id(1)).get().getStatus());
        assertEquals(ProofRequestStatus.UNACKNOWLEDGED, manager.getRequestStatus(id(1)));
        assertEquals(2, manager.inFlightCount());
        assertTrue(published.isEmpty());
        assertEquals(2L, store.loadState().getRequestCounter());
    }

    @Test
    public void expiry_queue_is_rebuilt_from_store_on_restart() {
        submit(1);
        submit(2);
        manager.acknowledge(FERMAH, id(1), true);
        ProofManager restarted = newManager(ledger, ProofManagerConfig.defaultConfig(ESCROW));
        assertEquals(2, restarted.inFlightCount());

        clock.advance(121);
        restarted.setPreferredNetwork(ADMIN, ProvingNetwork.FERMAH);
        restarted.submit(SUBMITTER, id(3), params(3600, USDC));
        // 确认窗口过期的 (1,2) 被清理，已 COMMITTED 的 (1,1) 仍在途
        assertEquals(ProofRequestStatus.UNACKNOWLEDGED, store.findRequest(id(2)).get().getStatus());
        assertEquals(2, restarted.inFlightCount());
    }

    @Test
    public void publisher_failure_does_not_fail_the_operation() {
        manager = new ProofManager(ProofManagerConfig.defaultConfig(ESCROW), store, ledger,
                new StaticAccessControl(Collections.singletonList(ADMIN), Collections.singletonList(SUBMITTER)),
                clock, event -> {
                    throw new IllegalStateException("broker down");
                }, FERMAH, LAGRANGE);
        assertEquals(ProofRequestStatus.PENDING_ACKNOWLEDGEMENT, submit(1).getStatus());
        assertTrue(store.existsRequest(id(1)));
    }

    @Test
    public void invalid_network_operations_are_rejected() {
        ProofManagerException e = assertThrows(ProofManagerException.class, () -> manager.getNetwork(ProvingNetwork.NONE));
        assertEquals(ErrorCode.INVALID_NETWORK, e.getCode());
        e = assertThrows(ProofManagerException.class,
                () -> manager.setNetworkAddress(ADMIN, ProvingNetwork.LAGRANGE, FERMAH));
        assertEquals(ErrorCode.INVALID_ADDRESS, e.getCode());
    }
}
