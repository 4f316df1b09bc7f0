package com.work.proof.app.web;

import com.work.proof.app.web.dto.ClaimRewardResponse;
import com.work.proof.app.web.dto.PreferredNetworkRequest;
import com.work.proof.app.web.dto.ProvingNetworkView;
import com.work.proof.app.web.dto.UpdateAddressRequest;
import com.work.proof.app.web.dto.UpdateStatusRequest;
import com.work.proof.core.ProofManager;
import com.work.proof.core.model.ProvingNetwork;
import com.work.proof.core.model.ProvingNetworkInfo;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

import static com.work.proof.app.web.ProofRequestController.CALLER_HEADER;

/**
 * 证明网络登记、领取奖励与管理员操作。
 */
@RestController
@RequestMapping("/api/v1/proving-networks")
public class ProvingNetworkController {

    private final ProofManager proofManager;

    public ProvingNetworkController(ProofManager proofManager) {
        this.proofManager = proofManager;
    }

    /**
     * 以调用方地址识别网络，一次性领取全部应付奖励
     */
    @PostMapping("/claim")
    public ResponseEntity<ClaimRewardResponse> claim(@RequestHeader(CALLER_HEADER) String caller) {
        BigInteger amount = proofManager.claimReward(caller);
        ProvingNetwork network = proofManager.findNetworkByAddress(caller).orElse(ProvingNetwork.NONE);
        ClaimRewardResponse resp = new ClaimRewardResponse();
        resp.setNetwork(network.name());
        resp.setAddress(caller);
        resp.setAmount(amount.toString());
        return ResponseEntity.ok(resp);
    }

    @GetMapping("/preferred")
    public ResponseEntity<PreferredNetworkRequest> getPreferred() {
        PreferredNetworkRequest body = new PreferredNetworkRequest();
        body.setNetwork(proofManager.getPreferredNetwork());
        return ResponseEntity.ok(body);
    }

    @PutMapping("/preferred")
    public ResponseEntity<PreferredNetworkRequest> setPreferred(@RequestHeader(CALLER_HEADER) String caller,
                                                                @Validated @RequestBody PreferredNetworkRequest req) {
        PreferredNetworkRequest body = new PreferredNetworkRequest();
        body.setNetwork(proofManager.setPreferredNetwork(caller, req.getNetwork()));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{network}")
    public ResponseEntity<ProvingNetworkView> get(@PathVariable ProvingNetwork network) {
        return ResponseEntity.ok(toView(proofManager.getNetwork(network)));
    }

    @PutMapping("/{network}/address")
    public ResponseEntity<ProvingNetworkView> setAddress(@RequestHeader(CALLER_HEADER) String caller,
                                                         @PathVariable ProvingNetwork network,
                                                         @Validated @RequestBody UpdateAddressRequest req) {
        return ResponseEntity.ok(toView(proofManager.setNetworkAddress(caller, network, req.getAddress())));
    }

    @PutMapping("/{network}/status")
    public ResponseEntity<ProvingNetworkView> setStatus(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable ProvingNetwork network,
                                                        @Validated @RequestBody UpdateStatusRequest req) {
        return ResponseEntity.ok(toView(proofManager.setNetworkStatus(caller, network, req.getStatus())));
    }

    private ProvingNetworkView toView(ProvingNetworkInfo info) {
        ProvingNetworkView v = new ProvingNetworkView();
        v.setNetwork(info.getNetwork().name());
        v.setAddress(info.getAddress());
        v.setStatus(info.getStatus().name());
        v.setOwedReward(info.getOwedReward().toString());
        return v;
    }
}
