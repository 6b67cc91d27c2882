package com.shieldsync.api.controller;

import com.shieldsync.api.dto.BalancesResponse;
import com.shieldsync.api.dto.FeeEstimateResponse;
import com.shieldsync.api.dto.HistoryItemResponse;
import com.shieldsync.api.dto.HistoryResponse;
import com.shieldsync.api.dto.MaxTransferResponse;
import com.shieldsync.api.dto.SyncResponse;
import com.shieldsync.api.dto.TransferRequest;
import com.shieldsync.api.dto.TxSubmissionResponse;
import com.shieldsync.api.dto.WithdrawalRequest;
import com.shieldsync.domain.Balances;
import com.shieldsync.domain.FeeEstimate;
import com.shieldsync.domain.TransferOutput;
import com.shieldsync.domain.TxType;
import com.shieldsync.ingestion.sync.SyncCoordinator;
import com.shieldsync.planner.FeeEstimator;
import com.shieldsync.query.PoolQueryService;
import com.shieldsync.tx.TransactionService;
import com.shieldsync.tx.TxSubmission;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Pool account API. Every operation talks to the relayer through blocking calls, so handlers run on the
 * bounded-elastic scheduler rather than the event loop.
 */
@RestController
@RequestMapping("/api/v1/pools")
@RequiredArgsConstructor
public class PoolController {

    private final SyncCoordinator syncCoordinator;
    private final PoolQueryService poolQueryService;
    private final FeeEstimator feeEstimator;
    private final TransactionService transactionService;

    @PostMapping("/{asset}/sync")
    public Mono<ResponseEntity<SyncResponse>> sync(@PathVariable String asset) {
        return blocking(() -> new SyncResponse(asset, syncCoordinator.updateState(asset)));
    }

    @GetMapping("/{asset}/balances")
    public Mono<ResponseEntity<BalancesResponse>> balances(@PathVariable String asset) {
        return blocking(() -> {
            Balances b = poolQueryService.getBalances(asset);
            return new BalancesResponse(asset, b.total(), b.account(), b.notes(), b.optimistic());
        });
    }

    @GetMapping("/{asset}/history")
    public Mono<ResponseEntity<HistoryResponse>> history(@PathVariable String asset) {
        return blocking(() -> new HistoryResponse(asset, poolQueryService.getHistory(asset).stream()
                .map(r -> new HistoryItemResponse(r.index(), r.type(), r.amount(), r.fee(), r.pending(), r.txHash()))
                .toList()));
    }

    /**
     * Fee for sending {@code amount} pool units as the given tx type.
     */
    @GetMapping("/{asset}/fee")
    public Mono<ResponseEntity<FeeEstimateResponse>> fee(
            @PathVariable String asset,
            @RequestParam long amount,
            @RequestParam(defaultValue = "TRANSFER") TxType txType,
            @RequestParam(required = false) Long fee
    ) {
        return blocking(() -> {
            FeeEstimate estimate = feeEstimator.feeEstimate(asset, amount, txType, fee);
            return new FeeEstimateResponse(estimate.total(), estimate.perTx(), estimate.partCount());
        });
    }

    @GetMapping("/{asset}/max-transfer")
    public Mono<ResponseEntity<MaxTransferResponse>> maxTransfer(
            @PathVariable String asset,
            @RequestParam(required = false) Long fee
    ) {
        return blocking(() -> new MaxTransferResponse(asset, feeEstimator.calcMaxAvailableTransfer(asset, fee)));
    }

    @PostMapping("/{asset}/transfers")
    public Mono<ResponseEntity<TxSubmissionResponse>> transfer(
            @PathVariable String asset,
            @RequestBody @Valid TransferRequest request
    ) {
        List<TransferOutput> outputs = request.outputs().stream()
                .map(o -> new TransferOutput(o.to().trim(), o.amount()))
                .toList();
        return blocking(() -> toResponse(transactionService.transfer(asset, outputs, request.fee())));
    }

    @PostMapping("/{asset}/withdrawals")
    public Mono<ResponseEntity<TxSubmissionResponse>> withdraw(
            @PathVariable String asset,
            @RequestBody @Valid WithdrawalRequest request
    ) {
        return blocking(() -> toResponse(transactionService.withdraw(asset, request.to().trim(), request.amount(), request.fee())));
    }

    private static TxSubmissionResponse toResponse(TxSubmission submission) {
        return new TxSubmissionResponse(submission.jobIds(), submission.txHashes());
    }

    private static <T> Mono<ResponseEntity<T>> blocking(Callable<T> call) {
        return Mono.fromCallable(call)
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }
}
