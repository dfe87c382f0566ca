package com.stakeledger.backend.dto;

public record UnregisterResponse(String identity, long releasedAmount) {
}
