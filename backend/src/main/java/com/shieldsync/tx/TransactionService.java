package com.shieldsync.tx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shieldsync.common.InternalStateException;
import com.shieldsync.common.TxInvalidArgumentException;
import com.shieldsync.config.PoolProperties;
import com.shieldsync.crypto.CryptoCapability;
import com.shieldsync.crypto.Proof;
import com.shieldsync.crypto.TxData;
import com.shieldsync.crypto.TxDataFactory;
import com.shieldsync.domain.AccountSnapshot;
import com.shieldsync.domain.TransferOutput;
import com.shieldsync.domain.TxOutput;
import com.shieldsync.domain.TxPart;
import com.shieldsync.domain.TxType;
import com.shieldsync.ingestion.relayer.RelayerGateway;
import com.shieldsync.ingestion.relayer.RelayerTxRequest;
import com.shieldsync.ingestion.sync.ReadinessPoller;
import com.shieldsync.planner.FeeEstimator;
import com.shieldsync.state.PoolAccount;
import com.shieldsync.state.PoolAccountRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Deposits, transfers and withdrawals. Each tx is built from synced state, proven, verified locally, sent to
 * the relayer and tracked until its job completes. Transfers and withdrawals larger than one tx can carry are
 * sent part by part, re-planning on fresh state after each part is mined.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionService {

    private final PoolAccountRegistry registry;
    private final PoolProperties poolProperties;
    private final ReadinessPoller readinessPoller;
    private final FeeEstimator feeEstimator;
    private final TxDataFactory txDataFactory;
    private final CryptoCapability cryptoCapability;
    private final RelayerGateway relayerGateway;
    private final JobTracker jobTracker;
    private final ObjectMapper objectMapper;

    /**
     * @param amountWei   amount in wei; converted to pool units by the asset's denominator
     * @param fromAddress optional sender address prepended to the signature; null to send the signature alone
     * @param fee         fee per tx in pool units, or null for the asset's fee
     */
    public TxSubmission deposit(String asset, BigInteger amountWei, String fromAddress, DepositSigner signer, Long fee) {
        PoolAccount account = registry.get(asset);
        long amount = account.toPoolUnits(amountWei);
        checkMinAmount(amount);
        if (account.getDepositLimit() != null && amount > account.getDepositLimit()) {
            throw new TxLimitException(amount, account.getDepositLimit());
        }
        long feePerTx = feeEstimator.resolveFee(asset, fee);
        awaitReady(asset);

        AccountSnapshot snapshot = account.getState().snapshot();
        TxData data = txDataFactory.createDeposit(snapshot, amount, feePerTx);
        Proof proof = proveAndVerify(TxType.DEPOSIT, data);
        String signature = DepositSignatures.assemble(fromAddress, signer.sign(data.nullifier()), account.isCompactSignature());
        String jobId = send(asset, new RelayerTxRequest(TxType.DEPOSIT.getWireCode(), data.memo(), proofJson(proof), signature));
        log.info("Deposit of {} to {} sent as job {}", amount, asset, jobId);
        return new TxSubmission(List.of(jobId), jobTracker.waitForJob(asset, jobId));
    }

    /**
     * Sends to every output; outputs are paid in order, an output may be split between two parts.
     *
     * @param outputs shielded recipients with amounts in wei
     * @throws TxInvalidArgumentException when a recipient is not a shielded address or the outputs cannot be carried
     */
    public TxSubmission transfer(String asset, List<TransferOutput> outputs, Long fee) {
        PoolAccount account = registry.get(asset);
        if (outputs == null || outputs.isEmpty()) {
            throw new TxInvalidArgumentException("Transfer needs at least one output");
        }
        if (outputs.size() > poolProperties.getOutputsPerTx()) {
            throw new TxInvalidArgumentException("Transfer has " + outputs.size() + " outputs, at most "
                    + poolProperties.getOutputsPerTx() + " fit in one tx");
        }
        Deque<TxOutput> unpaid = new ArrayDeque<>();
        long amount = 0L;
        for (TransferOutput output : outputs) {
            if (!cryptoCapability.isValidAddress(output.to())) {
                throw new TxInvalidArgumentException("Invalid address. Expected a shielded address: " + output.to());
            }
            long units = account.toPoolUnits(output.amountWei());
            if (units <= 0) {
                throw new TxInvalidArgumentException("Output to " + output.to() + " is below one pool unit");
            }
            if (amount > Long.MAX_VALUE - units) {
                throw new TxInvalidArgumentException("Transfer total is out of range for " + asset);
            }
            amount += units;
            unpaid.addLast(new TxOutput(output.to(), units));
        }
        return sendInParts(asset, TxType.TRANSFER, amount, fee,
                (snapshot, part) -> txDataFactory.createTransfer(snapshot, takeOutputs(unpaid, part.amount()), part.fee()));
    }

    public TxSubmission withdraw(String asset, String to, BigInteger amountWei, Long fee) {
        long amount = registry.get(asset).toPoolUnits(amountWei);
        return sendInParts(asset, TxType.WITHDRAWAL, amount, fee,
                (snapshot, part) -> txDataFactory.createWithdraw(snapshot, to, part.amount(), part.fee()));
    }

    private TxSubmission sendInParts(String asset, TxType txType, long amount, Long fee,
                                     BiFunction<AccountSnapshot, TxPart, TxData> buildPart) {
        PoolAccount account = registry.get(asset);
        checkMinAmount(amount);
        long feePerTx = feeEstimator.resolveFee(asset, fee);
        awaitReady(asset);

        List<TxPart> plan = feeEstimator.planParts(asset, amount, feePerTx);
        log.info("{} of {} on {} planned as {} part(s)", txType, amount, asset, plan.size());

        List<String> jobIds = new ArrayList<>();
        List<String> txHashes = new ArrayList<>();
        long remaining = amount;
        TxPart part = plan.get(0);
        while (true) {
            TxData data = buildPart.apply(account.getState().snapshot(), part);
            Proof proof = proveAndVerify(txType, data);
            String jobId = send(asset, new RelayerTxRequest(txType.getWireCode(), data.memo(), proofJson(proof), null));
            log.info("{} part {} of {} on {} sent as job {}", txType, jobIds.size() + 1, part.amount(), asset, jobId);
            jobIds.add(jobId);
            txHashes.addAll(jobTracker.waitForJob(asset, jobId));

            remaining -= part.amount();
            if (remaining <= 0) {
                break;
            }
            awaitReady(asset);
            part = feeEstimator.planParts(asset, remaining, feePerTx).get(0);
        }
        return new TxSubmission(jobIds, txHashes);
    }

    /**
     * Removes {@code amount} worth of outputs from the head of {@code unpaid}, splitting the last one if needed.
     */
    static List<TxOutput> takeOutputs(Deque<TxOutput> unpaid, long amount) {
        List<TxOutput> taken = new ArrayList<>();
        long left = amount;
        while (left > 0 && !unpaid.isEmpty()) {
            TxOutput next = unpaid.removeFirst();
            if (next.amount() <= left) {
                taken.add(next);
                left -= next.amount();
            } else {
                taken.add(new TxOutput(next.to(), left));
                unpaid.addFirst(new TxOutput(next.to(), next.amount() - left));
                left = 0;
            }
        }
        if (left > 0) {
            throw new InternalStateException("Planned part exceeds the unpaid transfer outputs by " + left);
        }
        return taken;
    }

    private void checkMinAmount(long amount) {
        if (amount < poolProperties.getMinTxAmount()) {
            throw new TxSmallAmountException(amount, poolProperties.getMinTxAmount());
        }
    }

    private void awaitReady(String asset) {
        if (!readinessPoller.waitReadyToTransact(asset)) {
            throw new InternalStateException("Account for " + asset + " is not ready to transact: own transaction still pending");
        }
    }

    private Proof proveAndVerify(TxType txType, TxData data) {
        Proof proof = cryptoCapability.prove(data.publicInputs(), data.secretInputs());
        if (!cryptoCapability.verify(cryptoCapability.transferVerifyingKey(), proof.inputs(), proof.proof())) {
            throw new TxProofException("Generated " + txType + " proof failed local verification");
        }
        return proof;
    }

    private String send(String asset, RelayerTxRequest request) {
        return relayerGateway.sendTransactions(asset, List.of(request));
    }

    private ObjectNode proofJson(Proof proof) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set("inputs", proof.inputs());
        node.set("proof", proof.proof());
        return node;
    }
}
