package com.stakeledger.backend.service;

import com.stakeledger.backend.dto.ConfigurationResponse;
import com.stakeledger.backend.dto.LedgerSummaryResponse;
import com.stakeledger.backend.dto.ParticipantResponse;
import com.stakeledger.backend.dto.SlashResponse;
import com.stakeledger.backend.dto.SweepResponse;
import com.stakeledger.backend.entity.LedgerState;
import com.stakeledger.backend.event.AdminCapabilityGrantedEvent;
import com.stakeledger.backend.event.AdminCapabilityRevokedEvent;
import com.stakeledger.backend.event.ConfigurationUpdatedEvent;
import com.stakeledger.backend.event.LedgerInitializedEvent;
import com.stakeledger.backend.event.RegisteredEvent;
import com.stakeledger.backend.event.SlashedEvent;
import com.stakeledger.backend.event.StakedEvent;
import com.stakeledger.backend.event.UnregisteredEvent;
import com.stakeledger.backend.event.UnstakedEvent;
import com.stakeledger.backend.event.WithdrawnEvent;
import com.stakeledger.backend.exception.LedgerErrorCode;
import com.stakeledger.backend.exception.LedgerException;
import com.stakeledger.backend.exception.LedgerPreconditionException;
import com.stakeledger.backend.exception.NotAuthorizedException;
import com.stakeledger.backend.exception.TransferFailedException;
import com.stakeledger.backend.model.ParticipantStake;
import com.stakeledger.backend.repository.ParticipantStakeRepository;
import com.stakeledger.backend.service.access.AdminCapabilityService;
import com.stakeledger.backend.service.access.AuthorityCheck;
import com.stakeledger.backend.service.transfer.TransferResult;
import com.stakeledger.backend.service.transfer.ValueTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Participant balances, the registration lifecycle, cooldown-gated withdrawal and the
 * administrative slash/sweep path.
 * <p>
 * Every mutating operation runs through {@link LedgerExecutionGuard} and is all-or-nothing.
 * Ledger state is written and flushed before any value leaves through {@link ValueTransfer};
 * when the transfer does not succeed the write is reversed and {@link TransferFailedException}
 * is raised.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StakeLedgerService {

    static final int MAX_IDENTITY_LENGTH = 128;

    private final ParticipantStakeRepository participantStakeRepository;
    private final LedgerStateService ledgerStateService;
    private final AuthorityCheck authorityCheck;
    private final AdminCapabilityService adminCapabilityService;
    private final ValueTransfer valueTransfer;
    private final LedgerExecutionGuard executionGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void initialize(String admin, long depositFloor, Duration cooldownPeriod) {
        String adminIdentity = requireIdentity(admin, "admin");
        requireNonNegative(depositFloor, "depositFloor");
        long cooldownSeconds = requireNonNegative(cooldownPeriod.getSeconds(), "cooldownPeriod");
        executionGuard.run("initialize", () -> {
            ledgerStateService.create(depositFloor, cooldownSeconds);
            adminCapabilityService.grant(adminIdentity, adminIdentity);
            log.info("Ledger initialized admin={} depositFloor={} cooldownPeriodSeconds={}",
                    adminIdentity, depositFloor, cooldownSeconds);
            eventPublisher.publishEvent(new LedgerInitializedEvent(adminIdentity, depositFloor, cooldownSeconds, now()));
        });
    }

    public ConfigurationResponse setConfiguration(String caller, long depositFloor, long cooldownPeriodSeconds) {
        String identity = requireIdentity(caller, "caller");
        requireNonNegative(depositFloor, "depositFloor");
        requireNonNegative(cooldownPeriodSeconds, "cooldownPeriodSeconds");
        return executionGuard.execute("setConfiguration", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            requireAdmin(identity, "setConfiguration");
            state.setDepositFloor(depositFloor);
            state.setCooldownPeriodSeconds(cooldownPeriodSeconds);
            ledgerStateService.save(state);
            eventPublisher.publishEvent(new ConfigurationUpdatedEvent(depositFloor, cooldownPeriodSeconds, identity, now()));
            return new ConfigurationResponse(depositFloor, cooldownPeriodSeconds);
        });
    }

    /**
     * Registers the caller with {@code depositAmount} of accompanying value. The whole deposit is
     * kept as stake, including anything above the floor.
     */
    public ParticipantResponse register(String caller, long depositAmount) {
        String identity = requireIdentity(caller, "caller");
        requireNonNegative(depositAmount, "depositAmount");
        return executionGuard.execute("register", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            if (participantStakeRepository.existsById(identity)) {
                throw new LedgerPreconditionException(LedgerErrorCode.ALREADY_REGISTERED,
                        identity + " is already registered");
            }
            if (depositAmount < state.getDepositFloor()) {
                throw new LedgerPreconditionException(LedgerErrorCode.INSUFFICIENT_DEPOSIT,
                        "Deposit " + depositAmount + " is below the floor of " + state.getDepositFloor());
            }
            Instant registeredAt = now();
            ParticipantStake record = participantStakeRepository.saveAndFlush(ParticipantStake.builder()
                    .identity(identity)
                    .registeredAt(registeredAt)
                    .stakedAmount(depositAmount)
                    .build());
            state.setHeldBalance(Math.addExact(state.getHeldBalance(), depositAmount));
            ledgerStateService.save(state);
            eventPublisher.publishEvent(new RegisteredEvent(identity, depositAmount, registeredAt));
            return toResponse(record, state);
        });
    }

    /**
     * Removes the caller's record and pays out the full stake.
     *
     * @return the amount released to the caller
     */
    public long unregister(String caller) {
        String identity = requireIdentity(caller, "caller");
        return executionGuard.execute("unregister", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            ParticipantStake record = requireRegistered(identity);
            requireCooldownElapsed(record, state);
            long amount = record.getStakedAmount();
            ParticipantStake snapshot = copyOf(record);
            participantStakeRepository.delete(record);
            participantStakeRepository.flush();
            if (amount > 0) {
                release(state, identity, amount, () -> participantStakeRepository.saveAndFlush(snapshot));
            }
            eventPublisher.publishEvent(new UnregisteredEvent(identity, amount, now()));
            return amount;
        });
    }

    public ParticipantResponse stake(String caller, long amount) {
        String identity = requireIdentity(caller, "caller");
        requireNonNegative(amount, "amount");
        return executionGuard.execute("stake", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            if (amount == 0) {
                throw new LedgerPreconditionException(LedgerErrorCode.ZERO_AMOUNT, "Stake amount must be greater than zero");
            }
            ParticipantStake record = requireRegistered(identity);
            record.setStakedAmount(Math.addExact(record.getStakedAmount(), amount));
            participantStakeRepository.saveAndFlush(record);
            state.setHeldBalance(Math.addExact(state.getHeldBalance(), amount));
            ledgerStateService.save(state);
            eventPublisher.publishEvent(new StakedEvent(identity, amount, now()));
            return toResponse(record, state);
        });
    }

    /**
     * Withdraws part of the caller's stake. The registration stays in place even when the stake
     * drops to zero.
     */
    public ParticipantResponse unstake(String caller, long amount) {
        String identity = requireIdentity(caller, "caller");
        requireNonNegative(amount, "amount");
        return executionGuard.execute("unstake", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            ParticipantStake record = requireRegistered(identity);
            long before = record.getStakedAmount();
            if (amount > before) {
                throw new LedgerPreconditionException(LedgerErrorCode.INSUFFICIENT_STAKE,
                        "Unstake " + amount + " exceeds staked amount " + before);
            }
            requireCooldownElapsed(record, state);
            record.setStakedAmount(before - amount);
            participantStakeRepository.saveAndFlush(record);
            if (amount > 0) {
                release(state, identity, amount, () -> {
                    record.setStakedAmount(before);
                    participantStakeRepository.saveAndFlush(record);
                });
            }
            eventPublisher.publishEvent(new UnstakedEvent(identity, amount, now()));
            return toResponse(record, state);
        });
    }

    /**
     * Moves {@code amount} of the target's stake into the confiscated pool. The target's cooldown
     * and the caller's own registration play no part.
     */
    public SlashResponse slash(String caller, String target, long amount) {
        String identity = requireIdentity(caller, "caller");
        String targetIdentity = requireIdentity(target, "target");
        requireNonNegative(amount, "amount");
        return executionGuard.execute("slash", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            requireAdmin(identity, "slash");
            Optional<ParticipantStake> record = participantStakeRepository.findById(targetIdentity);
            long staked = record.map(ParticipantStake::getStakedAmount).orElse(0L);
            if (amount > staked) {
                throw new LedgerPreconditionException(LedgerErrorCode.INSUFFICIENT_STAKE,
                        "Slash " + amount + " exceeds " + targetIdentity + " stake of " + staked);
            }
            long remaining = staked - amount;
            record.ifPresent(stake -> {
                stake.setStakedAmount(remaining);
                participantStakeRepository.saveAndFlush(stake);
            });
            state.setConfiscatedTotal(Math.addExact(state.getConfiscatedTotal(), amount));
            ledgerStateService.save(state);
            log.info("Slashed target={} amount={} by={} confiscatedTotal={}",
                    targetIdentity, amount, identity, state.getConfiscatedTotal());
            eventPublisher.publishEvent(new SlashedEvent(targetIdentity, amount, identity, now()));
            return new SlashResponse(targetIdentity, amount, remaining, state.getConfiscatedTotal());
        });
    }

    /**
     * Pays {@code amount} of confiscated funds out to the calling admin.
     */
    public SweepResponse sweep(String caller, long amount) {
        String identity = requireIdentity(caller, "caller");
        requireNonNegative(amount, "amount");
        return executionGuard.execute("sweep", () -> {
            LedgerState state = ledgerStateService.requireInitialized();
            requireAdmin(identity, "sweep");
            long before = state.getConfiscatedTotal();
            if (amount > before) {
                throw new LedgerPreconditionException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                        "Sweep " + amount + " exceeds confiscated total " + before);
            }
            state.setConfiscatedTotal(before - amount);
            ledgerStateService.save(state);
            String reference = null;
            if (amount > 0) {
                reference = release(state, identity, amount, () -> {
                    state.setConfiscatedTotal(before);
                    ledgerStateService.save(state);
                }).reference();
            }
            eventPublisher.publishEvent(new WithdrawnEvent(identity, amount, now()));
            return new SweepResponse(identity, amount, state.getConfiscatedTotal(), reference);
        });
    }

    public boolean grantAdmin(String caller, String identity) {
        String callerIdentity = requireIdentity(caller, "caller");
        String grantee = requireIdentity(identity, "identity");
        return executionGuard.execute("grantAdmin", () -> {
            ledgerStateService.requireInitialized();
            requireAdmin(callerIdentity, "grantAdmin");
            boolean granted = adminCapabilityService.grant(grantee, callerIdentity);
            if (granted) {
                eventPublisher.publishEvent(new AdminCapabilityGrantedEvent(grantee, callerIdentity, now()));
            }
            return granted;
        });
    }

    public boolean revokeAdmin(String caller, String identity) {
        String callerIdentity = requireIdentity(caller, "caller");
        String revokee = requireIdentity(identity, "identity");
        return executionGuard.execute("revokeAdmin", () -> {
            ledgerStateService.requireInitialized();
            requireAdmin(callerIdentity, "revokeAdmin");
            boolean revoked = adminCapabilityService.revoke(revokee);
            if (revoked) {
                eventPublisher.publishEvent(new AdminCapabilityRevokedEvent(revokee, callerIdentity, now()));
            }
            return revoked;
        });
    }

    @Transactional(readOnly = true)
    public ParticipantResponse getParticipant(String identity) {
        String participant = requireIdentity(identity, "identity");
        LedgerState state = ledgerStateService.requireInitialized();
        return participantStakeRepository.findById(participant)
                .map(record -> toResponse(record, state))
                .orElseGet(() -> ParticipantResponse.absent(participant));
    }

    @Transactional(readOnly = true)
    public ConfigurationResponse getConfiguration() {
        LedgerState state = ledgerStateService.requireInitialized();
        return new ConfigurationResponse(state.getDepositFloor(), state.getCooldownPeriodSeconds());
    }

    @Transactional(readOnly = true)
    public LedgerSummaryResponse getSummary() {
        LedgerState state = ledgerStateService.requireInitialized();
        return new LedgerSummaryResponse(
                state.getDepositFloor(),
                state.getCooldownPeriodSeconds(),
                state.getConfiscatedTotal(),
                state.getHeldBalance(),
                participantStakeRepository.sumStakedAmount(),
                participantStakeRepository.count()
        );
    }

    public boolean isInitialized() {
        return ledgerStateService.isInitialized();
    }

    private TransferResult release(LedgerState state, String recipient, long amount, Runnable revert) {
        TransferResult result;
        try {
            result = valueTransfer.send(recipient, amount);
        } catch (LedgerException ex) {
            revert.run();
            throw ex;
        } catch (RuntimeException ex) {
            revert.run();
            throw new TransferFailedException(recipient, amount, ex);
        }
        if (result == null || !result.success()) {
            revert.run();
            String reason = result == null ? "no result" : result.failureReason();
            log.warn("Transfer failed recipient={} amount={} reason={}", recipient, amount, reason);
            throw new TransferFailedException(recipient, amount, reason);
        }
        state.setHeldBalance(Math.subtractExact(state.getHeldBalance(), amount));
        ledgerStateService.save(state);
        return result;
    }

    private ParticipantStake requireRegistered(String identity) {
        return participantStakeRepository.findById(identity)
                .orElseThrow(() -> new LedgerPreconditionException(LedgerErrorCode.NOT_REGISTERED,
                        identity + " is not registered"));
    }

    private void requireAdmin(String identity, String operation) {
        if (!authorityCheck.hasAdminCapability(identity)) {
            throw new NotAuthorizedException(identity + " lacks the admin capability required for " + operation);
        }
    }

    private void requireCooldownElapsed(ParticipantStake record, LedgerState state) {
        long elapsed = now().getEpochSecond() - record.getRegisteredAt().getEpochSecond();
        if (elapsed < state.getCooldownPeriodSeconds()) {
            throw new LedgerPreconditionException(LedgerErrorCode.COOLDOWN_NOT_ELAPSED,
                    "Cooldown for " + record.getIdentity() + " ends at epoch second " + cooldownEndsAt(record, state));
        }
    }

    /**
     * Epoch second at which the cooldown ends, saturating at {@link Long#MAX_VALUE} for periods
     * beyond the representable range.
     */
    private long cooldownEndsAt(ParticipantStake record, LedgerState state) {
        long registeredAt = record.getRegisteredAt().getEpochSecond();
        long cooldown = state.getCooldownPeriodSeconds();
        return cooldown > Long.MAX_VALUE - registeredAt ? Long.MAX_VALUE : registeredAt + cooldown;
    }

    private ParticipantResponse toResponse(ParticipantStake record, LedgerState state) {
        long endsAt = cooldownEndsAt(record, state);
        long remaining = Math.max(0L, endsAt - now().getEpochSecond());
        return new ParticipantResponse(
                record.getIdentity(),
                true,
                record.getRegisteredAt().getEpochSecond(),
                record.getStakedAmount(),
                endsAt,
                remaining
        );
    }

    private ParticipantStake copyOf(ParticipantStake record) {
        return ParticipantStake.builder()
                .identity(record.getIdentity())
                .registeredAt(record.getRegisteredAt())
                .stakedAmount(record.getStakedAmount())
                .createdAt(record.getCreatedAt())
                .build();
    }

    /**
     * Ledger time has one-second resolution.
     */
    private Instant now() {
        return Instant.ofEpochSecond(clock.instant().getEpochSecond());
    }

    private String requireIdentity(String identity, String name) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException(name + " identity is required");
        }
        String trimmed = identity.trim();
        if (trimmed.length() > MAX_IDENTITY_LENGTH) {
            throw new IllegalArgumentException(name + " identity exceeds " + MAX_IDENTITY_LENGTH + " characters");
        }
        return trimmed;
    }

    private long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }
}
