package com.stakeledger.backend.dto;

public record SweepResponse(String recipient, long amount, long confiscatedTotal, String transferReference) {
}
