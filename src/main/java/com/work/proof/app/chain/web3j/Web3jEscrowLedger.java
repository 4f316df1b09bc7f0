package com.work.proof.app.chain.web3j;

import com.work.proof.core.escrow.EscrowLedger;
import com.work.proof.core.escrow.PreparedTransfer;
import com.work.proof.core.escrow.TransferStatus;
import com.work.proof.core.exception.ErrorCode;
import com.work.proof.core.exception.ProofManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.gas.ContractGasProvider;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.work.proof.core.support.ValidationUtils.requireAddress;
import static com.work.proof.core.support.ValidationUtils.requireNonNegative;
import static com.work.proof.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 Web3j 的 ERC-20（USDC）托管账本：
 * - balanceOf 走 eth_call
 * - transfer 在本地签名，广播前即可由已签名交易算出交易哈希（灰区补齐），广播走 eth_sendRawTransaction
 * - 结果以回执 status 判定，等待超时或 RPC 异常一律报告为 PENDING
 *
 * 同一笔已签名交易（相同 nonce）重复广播最多上链一次。
 */
public class Web3jEscrowLedger implements EscrowLedger {

    private static final Logger log = LoggerFactory.getLogger(Web3jEscrowLedger.class);

    private final Web3j web3j;
    private final Credentials credentials;
    private final long chainId;
    private final TransactionReceiptProcessor receiptProcessor;
    private final ContractGasProvider gasProvider;
    private final String tokenAddress;

    public Web3jEscrowLedger(Web3j web3j,
                             Credentials credentials,
                             long chainId,
                             TransactionReceiptProcessor receiptProcessor,
                             ContractGasProvider gasProvider,
                             String tokenAddress) {
        this.web3j = requireNonNull(web3j, "web3j");
        this.credentials = requireNonNull(credentials, "credentials");
        this.chainId = chainId;
        this.receiptProcessor = requireNonNull(receiptProcessor, "receiptProcessor");
        this.gasProvider = requireNonNull(gasProvider, "gasProvider");
        this.tokenAddress = requireAddress(tokenAddress, "tokenAddress");
    }

    @Override
    public BigInteger balanceOf(String owner) {
        Function function = new Function("balanceOf",
                Collections.<Type>singletonList(new Address(owner)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {
                }));
        String data = FunctionEncoder.encode(function);
        try {
            EthCall resp = web3j.ethCall(Transaction.createEthCallTransaction(owner, tokenAddress, data),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new ProofManagerException(ErrorCode.ESCROW_UNAVAILABLE,
                        "balanceOf rejected by node: " + resp.getError().getMessage());
            }
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters());
            if (decoded.isEmpty()) {
                throw new ProofManagerException(ErrorCode.ESCROW_UNAVAILABLE,
                        "balanceOf returned no data, token=" + tokenAddress);
            }
            return (BigInteger) decoded.get(0).getValue();
        } catch (IOException e) {
            log.warn("Web3j balanceOf failed. owner={} err={}", owner, e.getMessage());
            throw new ProofManagerException(ErrorCode.ESCROW_UNAVAILABLE, "balanceOf failed: " + e.getMessage(), e);
        }
    }

    /**
     * nonce 取托管地址的 pending nonce；签名不产生链上副作用。
     */
    @Override
    public PreparedTransfer prepareTransfer(String to, BigInteger amount) {
        requireNonNegative(amount, "amount");
        Function function = new Function("transfer",
                Arrays.<Type>asList(new Address(to), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {
                }));
        String data = FunctionEncoder.encode(function);
        try {
            EthGetTransactionCount count = web3j.ethGetTransactionCount(credentials.getAddress(),
                    DefaultBlockParameterName.PENDING).send();
            if (count.hasError()) {
                throw new ProofManagerException(ErrorCode.ESCROW_UNAVAILABLE,
                        "nonce lookup rejected by node: " + count.getError().getMessage());
            }
            RawTransaction raw = RawTransaction.createTransaction(count.getTransactionCount(),
                    gasProvider.getGasPrice(function.getName()),
                    gasProvider.getGasLimit(function.getName()),
                    tokenAddress, BigInteger.ZERO, data);
            String signed = Numeric.toHexString(TransactionEncoder.signMessage(raw, chainId, credentials));
            String txHash = Hash.sha3(signed);
            log.info("Web3j transfer signed. to={} amount={} nonce={} txHash={}", to, amount, raw.getNonce(), txHash);
            return new PreparedTransfer(txHash, to, amount, signed);
        } catch (IOException e) {
            log.warn("Web3j nonce lookup failed. from={} err={}", credentials.getAddress(), e.getMessage());
            throw new ProofManagerException(ErrorCode.ESCROW_UNAVAILABLE, "nonce lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean broadcast(PreparedTransfer transfer) {
        requireNonNull(transfer, "transfer");
        try {
            EthSendTransaction sent = web3j.ethSendRawTransaction(transfer.getPayload()).send();
            if (sent.hasError()) {
                log.warn("Web3j transfer rejected. txHash={} err={}", transfer.getReference(), sent.getError().getMessage());
                return false;
            }
            if (sent.getTransactionHash() != null && !transfer.getReference().equalsIgnoreCase(sent.getTransactionHash())) {
                log.warn("Web3j transfer hash mismatch. expected={} node={}", transfer.getReference(), sent.getTransactionHash());
            }
            return true;
        } catch (IOException e) {
            // 请求可能已到达节点，按已广播处理
            log.warn("Web3j transfer broadcast outcome unknown. txHash={} err={}", transfer.getReference(), e.getMessage());
            return true;
        }
    }

    @Override
    public TransferStatus awaitTransfer(String txHash) {
        try {
            TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(txHash);
            TransferStatus status = statusOf(receipt);
            log.info("Web3j transfer mined. txHash={} status={}", txHash, status);
            return status;
        } catch (IOException | TransactionException e) {
            log.warn("Web3j transfer receipt not available. txHash={} err={}", txHash, e.getMessage());
            return TransferStatus.PENDING;
        }
    }

    @Override
    public TransferStatus checkTransfer(String txHash) {
        try {
            EthGetTransactionReceipt resp = web3j.ethGetTransactionReceipt(txHash).send();
            if (resp.hasError()) {
                log.warn("Web3j getTransactionReceipt rejected. txHash={} err={}", txHash, resp.getError().getMessage());
                return TransferStatus.PENDING;
            }
            Optional<TransactionReceipt> receipt = resp.getTransactionReceipt();
            return receipt.isPresent() ? statusOf(receipt.get()) : TransferStatus.PENDING;
        } catch (IOException e) {
            log.warn("Web3j getTransactionReceipt failed. txHash={} err={}", txHash, e.getMessage());
            return TransferStatus.PENDING;
        }
    }

    private static TransferStatus statusOf(TransactionReceipt receipt) {
        // EVM receipt status: 0x1 success, 0x0 failure
        return receipt.isStatusOK() ? TransferStatus.CONFIRMED : TransferStatus.FAILED;
    }
}
