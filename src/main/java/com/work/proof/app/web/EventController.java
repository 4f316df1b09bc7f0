package com.work.proof.app.web;

import com.work.proof.app.event.EventJournal;
import com.work.proof.app.web.dto.EventView;
import com.work.proof.core.event.NetworkAddressChangedEvent;
import com.work.proof.core.event.NetworkStatusChangedEvent;
import com.work.proof.core.event.ProofMarketEvent;
import com.work.proof.core.event.ProofRequestAcknowledgedEvent;
import com.work.proof.core.event.ProofRequestExpiredEvent;
import com.work.proof.core.event.ProofRequestProvenEvent;
import com.work.proof.core.event.ProofRequestSubmittedEvent;
import com.work.proof.core.event.RewardPaidEvent;
import com.work.proof.core.event.ValidationResultEvent;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProvingNetwork;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * poll-only 的事件 feed：证明网络按 afterSeq 增量拉取与自己相关的事件。
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventJournal journal;

    public EventController(EventJournal journal) {
        this.journal = journal;
    }

    @GetMapping
    public ResponseEntity<List<EventView>> list(@RequestParam(value = "afterSeq", required = false) Long afterSeq,
                                                @RequestParam(value = "limit", required = false) Integer limit,
                                                @RequestParam(value = "network", required = false) ProvingNetwork network) {
        List<EventJournal.Entry> rows = journal.list(afterSeq, limit, network);
        List<EventView> out = new ArrayList<>(rows.size());
        for (EventJournal.Entry row : rows) {
            ProofMarketEvent e = row.getEvent();
            EventView v = new EventView();
            v.setSeq(row.getSeq());
            v.setType(e.getType());
            v.setTimestamp(e.getTimestamp());
            v.setNetwork(e.getNetwork().name());
            v.setDetails(details(e));
            out.add(v);
        }
        return ResponseEntity.ok(out);
    }

    private Map<String, Object> details(ProofMarketEvent e) {
        Map<String, Object> d = new LinkedHashMap<>();
        if (e instanceof ProofRequestSubmittedEvent) {
            ProofRequestSubmittedEvent s = (ProofRequestSubmittedEvent) e;
            putId(d, s.getId());
            d.put("requestId", s.getRequestId());
            d.put("proofInputsUrl", s.getProofInputsUrl());
            d.put("protocolVersion", s.getProtocolVersion().toString());
            d.put("timeoutAfter", s.getTimeoutAfter());
            d.put("maxReward", s.getMaxReward().toString());
            d.put("status", s.getStatus().name());
        } else if (e instanceof ProofRequestAcknowledgedEvent) {
            ProofRequestAcknowledgedEvent a = (ProofRequestAcknowledgedEvent) e;
            putId(d, a.getId());
            d.put("accepted", a.isAccepted());
        } else if (e instanceof ProofRequestProvenEvent) {
            ProofRequestProvenEvent p = (ProofRequestProvenEvent) e;
            putId(d, p.getId());
            d.put("proof", Numeric.toHexString(p.getProof()));
            d.put("requestedReward", p.getRequestedReward().toString());
        } else if (e instanceof ValidationResultEvent) {
            ValidationResultEvent r = (ValidationResultEvent) e;
            putId(d, r.getId());
            d.put("valid", r.isValid());
        } else if (e instanceof ProofRequestExpiredEvent) {
            ProofRequestExpiredEvent x = (ProofRequestExpiredEvent) e;
            putId(d, x.getId());
            d.put("status", x.getStatus().name());
        } else if (e instanceof RewardPaidEvent) {
            RewardPaidEvent r = (RewardPaidEvent) e;
            d.put("address", r.getAddress());
            d.put("amount", r.getAmount().toString());
        } else if (e instanceof NetworkAddressChangedEvent) {
            d.put("address", ((NetworkAddressChangedEvent) e).getAddress());
        } else if (e instanceof NetworkStatusChangedEvent) {
            d.put("status", ((NetworkStatusChangedEvent) e).getStatus().name());
        }
        return d;
    }

    private static void putId(Map<String, Object> d, ProofRequestId id) {
        d.put("chainId", id.getChainId());
        d.put("blockNumber", id.getBlockNumber());
    }
}
