package com.work.proof.app.web;

import com.work.proof.app.web.dto.ObligationsView;
import com.work.proof.core.ProofManager;
import com.work.proof.core.admission.EscrowObligations;
import com.work.proof.core.model.ProvingNetwork;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/escrow")
public class EscrowController {

    private final ProofManager proofManager;

    public EscrowController(ProofManager proofManager) {
        this.proofManager = proofManager;
    }

    @GetMapping("/obligations")
    public ResponseEntity<ObligationsView> obligations() {
        EscrowObligations o = proofManager.getObligations();
        Map<String, String> owed = new LinkedHashMap<>();
        for (ProvingNetwork network : ProvingNetwork.values()) {
            if (network.isReal()) {
                owed.put(network.name(), proofManager.getNetwork(network).getOwedReward().toString());
            }
        }
        ObligationsView v = new ObligationsView();
        v.setEscrowBalance(o.getEscrowBalance().toString());
        v.setOwedByNetwork(owed);
        v.setOwedReward(o.getOwedReward().toString());
        v.setPotentialFutureReward(o.getPotentialFutureReward().toString());
        v.setTotalObligations(o.getTotalObligations().toString());
        v.setInFlight(o.getInFlight());
        v.setRequestSlots(o.getRequestSlots().toString());
        v.setAcceptingRequests(o.canAcceptNewRequest());
        return ResponseEntity.ok(v);
    }
}
