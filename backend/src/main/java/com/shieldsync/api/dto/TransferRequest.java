package com.shieldsync.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * POST /pools/{asset}/transfers. Outputs are paid in order; fee is per tx in pool units.
 */
public record TransferRequest(
        @NotEmpty(message = "INVALID_OUTPUTS")
        @Valid
        List<TransferOutputRequest> outputs,

        @PositiveOrZero(message = "INVALID_FEE")
        Long fee
) {
}
