package com.stakeledger.backend.dto;

public record ConfigurationResponse(long depositFloor, long cooldownPeriodSeconds) {
}
