package com.stakeledger.backend.dto;

public record SlashResponse(String target, long slashedAmount, long remainingStake, long confiscatedTotal) {
}
