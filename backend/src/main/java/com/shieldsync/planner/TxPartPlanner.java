package com.shieldsync.planner;

import com.shieldsync.config.PoolProperties;
import com.shieldsync.domain.Note;
import com.shieldsync.domain.TxPart;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a transfer or withdrawal into elementary transactions, each spending the account (first part only)
 * plus at most maxInputs notes in spend order. Pure; an empty result means the target is infeasible.
 */
@Component
@RequiredArgsConstructor
public class TxPartPlanner {

    private final PoolProperties poolProperties;

    /**
     * @param usableNotes notes in spend order (ascending index)
     * @return parts whose amounts sum to {@code targetAmount} exactly, or an empty list
     */
    public List<TxPart> plan(long targetAmount, long feePerTx, List<Note> usableNotes, long accountBalance) {
        if (targetAmount < 0 || feePerTx < 0) {
            throw new IllegalArgumentException("Amount and fee must be non-negative, got " + targetAmount + " / " + feePerTx);
        }
        if (feePerTx <= accountBalance && targetAmount <= accountBalance - feePerTx) {
            return List.of(new TxPart(targetAmount, feePerTx, accountBalance));
        }

        int maxInputs = Math.max(1, poolProperties.getMaxInputs());
        long minTxAmount = poolProperties.getMinTxAmount();
        List<TxPart> parts = new ArrayList<>();
        long remaining = targetAmount;

        for (int start = 0; start < usableNotes.size() && remaining > 0; start += maxInputs) {
            long pool = start == 0 ? accountBalance : 0L;
            for (Note note : usableNotes.subList(start, Math.min(start + maxInputs, usableNotes.size()))) {
                pool = saturatedAdd(pool, note.value());
            }
            long accountLimit = pool;
            if (pool - feePerTx > remaining) {
                pool = remaining + feePerTx;
            }
            if (pool < feePerTx || pool < minTxAmount) {
                break;
            }
            long amount = pool - feePerTx;
            parts.add(new TxPart(amount, feePerTx, accountLimit));
            remaining -= amount;
        }

        return remaining > 0 ? List.of() : List.copyOf(parts);
    }

    /**
     * {@code a + b}, clamped to {@link Long#MAX_VALUE} for non-negative operands.
     */
    static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < a ? Long.MAX_VALUE : sum;
    }

    /**
     * Part count the planner produces for {@code noteCount} notes when every note has to be spent.
     */
    public int estimatedPartCount(int noteCount) {
        int maxInputs = Math.max(1, poolProperties.getMaxInputs());
        int overflow = Math.max(0, noteCount - maxInputs);
        return 1 + (overflow + maxInputs - 1) / maxInputs;
    }
}
