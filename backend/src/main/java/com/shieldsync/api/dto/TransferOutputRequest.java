package com.shieldsync.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * One transfer recipient: shielded pool address and amount in wei.
 */
public record TransferOutputRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        String to,

        @NotNull(message = "INVALID_AMOUNT")
        @Positive(message = "INVALID_AMOUNT")
        BigInteger amount
) {
}
