package com.shieldsync.api.dto;

import com.shieldsync.api.validation.EvmAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * POST /pools/{asset}/withdrawals. {@code to} is the EVM address receiving the funds.
 */
public record WithdrawalRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @EvmAddress
        String to,

        @NotNull(message = "INVALID_AMOUNT")
        @Positive(message = "INVALID_AMOUNT")
        BigInteger amount,

        @PositiveOrZero(message = "INVALID_FEE")
        Long fee
) {
}
