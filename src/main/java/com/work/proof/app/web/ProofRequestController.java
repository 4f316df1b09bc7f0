package com.work.proof.app.web;

import com.work.proof.app.web.dto.AcknowledgeRequest;
import com.work.proof.app.web.dto.CreateProofRequestRequest;
import com.work.proof.app.web.dto.ProofRequestView;
import com.work.proof.app.web.dto.SubmitProofRequest;
import com.work.proof.app.web.dto.ValidationResultRequest;
import com.work.proof.core.ProofManager;
import com.work.proof.core.exception.RequestNotFoundException;
import com.work.proof.core.model.ProofRequest;
import com.work.proof.core.model.ProofRequestId;
import com.work.proof.core.model.ProofRequestParams;
import com.work.proof.core.model.ProtocolVersion;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * 证明请求生命周期接口。调用方身份通过 X-Caller-Address 头传入。
 */
@RestController
@RequestMapping("/api/v1/proof-requests")
public class ProofRequestController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final ProofManager proofManager;

    public ProofRequestController(ProofManager proofManager) {
        this.proofManager = proofManager;
    }

    @PostMapping
    public ResponseEntity<ProofRequestView> submit(@RequestHeader(CALLER_HEADER) String caller,
                                                   @Validated @RequestBody CreateProofRequestRequest req) {
        ProofRequestParams params = new ProofRequestParams(
                req.getProofInputsUrl(),
                new ProtocolVersion(req.getProtocolMajor(), req.getProtocolMinor(), req.getProtocolPatch()),
                req.getTimeoutAfter(),
                new BigInteger(req.getMaxReward()));
        ProofRequest created = proofManager.submit(caller, ProofRequestId.of(req.getChainId(), req.getBlockNumber()), params);
        return ResponseEntity.status(HttpStatus.CREATED).body(toView(created));
    }

    @GetMapping("/{chainId}/{blockNumber}")
    public ResponseEntity<ProofRequestView> get(@PathVariable long chainId, @PathVariable long blockNumber) {
        ProofRequestId id = ProofRequestId.of(chainId, blockNumber);
        ProofRequest request = proofManager.getRequest(id).orElseThrow(() -> new RequestNotFoundException(id));
        return ResponseEntity.ok(toView(request));
    }

    @PostMapping("/{chainId}/{blockNumber}/acknowledgement")
    public ResponseEntity<ProofRequestView> acknowledge(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable long chainId,
                                                        @PathVariable long blockNumber,
                                                        @Validated @RequestBody AcknowledgeRequest req) {
        ProofRequest updated = proofManager.acknowledge(caller, ProofRequestId.of(chainId, blockNumber), req.getAccept());
        return ResponseEntity.ok(toView(updated));
    }

    @PostMapping("/{chainId}/{blockNumber}/proof")
    public ResponseEntity<ProofRequestView> submitProof(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable long chainId,
                                                        @PathVariable long blockNumber,
                                                        @Validated @RequestBody SubmitProofRequest req) {
        ProofRequest updated = proofManager.submitProof(caller, ProofRequestId.of(chainId, blockNumber),
                Numeric.hexStringToByteArray(req.getProof()), new BigInteger(req.getRequestedReward()));
        return ResponseEntity.ok(toView(updated));
    }

    @PostMapping("/{chainId}/{blockNumber}/validation")
    public ResponseEntity<ProofRequestView> submitValidationResult(@RequestHeader(CALLER_HEADER) String caller,
                                                                   @PathVariable long chainId,
                                                                   @PathVariable long blockNumber,
                                                                   @Validated @RequestBody ValidationResultRequest req) {
        ProofRequest updated = proofManager.submitValidationResult(caller, ProofRequestId.of(chainId, blockNumber),
                req.getValid());
        return ResponseEntity.ok(toView(updated));
    }

    private ProofRequestView toView(ProofRequest r) {
        ProofRequestView v = new ProofRequestView();
        v.setChainId(r.getId().getChainId());
        v.setBlockNumber(r.getId().getBlockNumber());
        v.setRequestId(r.getRequestId());
        v.setProofInputsUrl(r.getProofInputsUrl());
        ProtocolVersion version = r.getProtocolVersion();
        if (version != null) {
            v.setProtocolVersion(version.toString());
        }
        v.setSubmittedAt(r.getSubmittedAt());
        v.setTimeoutAfter(r.getTimeoutAfter());
        v.setMaxReward(r.getMaxReward().toString());
        v.setAssignedTo(r.getAssignedTo().name());
        v.setStatus(r.getStatus().name());
        v.setRequestedReward(r.getRequestedReward().toString());
        v.setProof(Numeric.toHexString(r.getProof()));
        return v;
    }
}
