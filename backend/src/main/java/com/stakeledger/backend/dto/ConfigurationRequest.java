package com.stakeledger.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationRequest {

    @NotNull
    @PositiveOrZero
    private Long depositFloor;

    @NotNull
    @PositiveOrZero
    private Long cooldownPeriodSeconds;
}
