package com.stakeledger.backend.dto;

/**
 * View of a participant record. Absent participants read as {@code registeredAt == 0} and
 * {@code stakedAmount == 0}.
 */
public record ParticipantResponse(
        String identity,
        boolean registered,
        long registeredAt,
        long stakedAmount,
        long cooldownEndsAt,
        long cooldownRemainingSeconds
) {
    public static ParticipantResponse absent(String identity) {
        return new ParticipantResponse(identity, false, 0L, 0L, 0L, 0L);
    }
}
