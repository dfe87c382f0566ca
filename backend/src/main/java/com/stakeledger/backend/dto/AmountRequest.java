package com.stakeledger.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Amount of value accompanying or requested by a participant call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {

    @NotNull
    @PositiveOrZero
    private Long amount;
}
