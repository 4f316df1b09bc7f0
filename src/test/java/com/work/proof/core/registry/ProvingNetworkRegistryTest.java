package com.work.proof.core.registry;

import com.work.proof.core.escrow.PreparedTransfer;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.InvalidRequestException;
import com.work.proof.core.exception.ProofManagerException;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;
import com.work.proof.core.model.ProvingNetworkStatus;
import com.work.proof.core.support.InMemoryProofMarketStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProvingNetworkRegistryTest {

    private static final String FERMAH = "0x1000000000000000000000000000000000000001";
    private static final String LAGRANGE = "0x2000000000000000000000000000000000000002";

    private InMemoryProofMarketStore store;
    private ProvingNetworkRegistry registry;

    @BeforeEach
    public void setUp() {
        store = new InMemoryProofMarketStore();
        registry = new ProvingNetworkRegistry(store);
        registry.initialize(FERMAH, LAGRANGE);
    }

    @Test
    public void initialize_registers_both_networks_active() {
        ProvingNetworkInfo fermah = registry.get(ProvingNetwork.FERMAH);
        assertEquals(FERMAH, fermah.getAddress());
        assertTrue(fermah.isActive());
        assertEquals(BigInteger.ZERO, fermah.getOwedReward());
        assertTrue(registry.isActive(ProvingNetwork.LAGRANGE));
        assertFalse(registry.isActive(ProvingNetwork.NONE));
        assertEquals(ProvingNetwork.NONE, registry.getPreferred());
    }

    @Test
    public void initialize_keeps_stored_networks() {
        registry.setStatus(ProvingNetwork.FERMAH, ProvingNetworkStatus.INACTIVE);
        registry.initialize("0x1000000000000000000000000000000000000009", LAGRANGE);
        assertEquals(FERMAH, registry.get(ProvingNetwork.FERMAH).getAddress());
        assertFalse(registry.isActive(ProvingNetwork.FERMAH));
    }

    @Test
    public void initialize_rejects_shared_or_zero_address() {
        ProvingNetworkRegistry fresh = new ProvingNetworkRegistry(new InMemoryProofMarketStore());
        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> fresh.initialize(FERMAH, FERMAH));
        assertEquals(ErrorCode.INVALID_ADDRESS, e.getCode());
        e = assertThrows(InvalidRequestException.class,
                () -> fresh.initialize("0x0000000000000000000000000000000000000000", LAGRANGE));
        assertEquals(ErrorCode.INVALID_ADDRESS, e.getCode());
    }

    @Test
    public void find_by_address_is_case_insensitive() {
        assertEquals(Optional.of(ProvingNetwork.LAGRANGE), registry.findByAddress(LAGRANGE.toUpperCase().replace("0X", "0x")));
        assertEquals(Optional.empty(), registry.findByAddress("0x9000000000000000000000000000000000000009"));
        assertEquals(Optional.empty(), registry.findByAddress(null));
    }

    @Test
    public void set_address_rejects_other_networks_address() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> registry.setAddress(ProvingNetwork.FERMAH, LAGRANGE));
        assertEquals(ErrorCode.INVALID_ADDRESS, e.getCode());
        e = assertThrows(InvalidRequestException.class, () -> registry.setAddress(ProvingNetwork.FERMAH, "not-an-address"));
        assertEquals(ErrorCode.INVALID_ADDRESS, e.getCode());

        String moved = "0x1000000000000000000000000000000000000011";
        registry.setAddress(ProvingNetwork.FERMAH, moved);
        assertEquals(Optional.of(ProvingNetwork.FERMAH), registry.findByAddress(moved));
        assertEquals(Optional.empty(), registry.findByAddress(FERMAH));
    }

    @Test
    public void none_is_not_a_registrable_network() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> registry.get(ProvingNetwork.NONE));
        assertEquals(ErrorCode.INVALID_NETWORK, e.getCode());
        assertThrows(InvalidRequestException.class,
                () -> registry.setStatus(ProvingNetwork.NONE, ProvingNetworkStatus.ACTIVE));
    }

    @Test
    public void owed_reward_is_reduced_only_when_payout_completes() {
        registry.accrueReward(ProvingNetwork.FERMAH, BigInteger.valueOf(3));
        registry.accrueReward(ProvingNetwork.LAGRANGE, BigInteger.valueOf(4));
        registry.accrueReward(ProvingNetwork.FERMAH, BigInteger.valueOf(5));
        assertEquals(BigInteger.valueOf(8), registry.get(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(BigInteger.valueOf(12), registry.totalOwedReward());

        PreparedTransfer first = new PreparedTransfer("0xaa", FERMAH, BigInteger.valueOf(8), "0x01");
        registry.beginPayout(ProvingNetwork.FERMAH, first);
        assertEquals(first, registry.get(ProvingNetwork.FERMAH).getPendingPayout());
        assertEquals(BigInteger.valueOf(12), registry.totalOwedReward());
        ProofManagerException busy = assertThrows(ProofManagerException.class, () -> registry.beginPayout(
                ProvingNetwork.FERMAH, new PreparedTransfer("0xbb", FERMAH, BigInteger.ONE, "0x02")));
        assertEquals(ErrorCode.INVARIANT_VIOLATED, busy.getCode());

        registry.abandonPayout(ProvingNetwork.FERMAH, first);
        assertNull(registry.get(ProvingNetwork.FERMAH).getPendingPayout());
        assertEquals(BigInteger.valueOf(8), registry.get(ProvingNetwork.FERMAH).getOwedReward());

        PreparedTransfer second = new PreparedTransfer("0xcc", FERMAH, BigInteger.valueOf(8), "0x03");
        registry.beginPayout(ProvingNetwork.FERMAH, second);
        registry.accrueReward(ProvingNetwork.FERMAH, BigInteger.valueOf(2));
        registry.completePayout(ProvingNetwork.FERMAH, second);
        assertEquals(BigInteger.valueOf(2), registry.get(ProvingNetwork.FERMAH).getOwedReward());
        assertEquals(BigInteger.valueOf(6), registry.totalOwedReward());
        assertThrows(ProofManagerException.class, () -> registry.completePayout(ProvingNetwork.FERMAH, second));
    }

    @Test
    public void preferred_network_may_be_none() {
        registry.setPreferred(ProvingNetwork.LAGRANGE);
        assertEquals(ProvingNetwork.LAGRANGE, registry.getPreferred());
        registry.setPreferred(ProvingNetwork.NONE);
        assertEquals(ProvingNetwork.NONE, registry.getPreferred());
    }
}
