package com.prozchain.slashing;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.validator.UnknownValidatorException;
import com.prozchain.storage.DBConstants;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.storage.KVRepository;
import com.prozchain.storage.StateUtil;
import com.prozchain.treasury.StakeTreasury;
import com.prozchain.types.Hash256;
import com.prozchain.validator.Validator;
import com.prozchain.validator.ValidatorRegistry;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;

/**
 * Verifies slashing evidence and applies the penalty exactly once per evidence hash. Processed evidence is
 * kept in the slashing log as an audit record.
 */
@Log
@Component
public class SlashingManager {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final ConsensusConfig config;
    private final ValidatorRegistry registry;
    private final StakeTreasury treasury;
    private final FinalizedBlockStore blockStore;
    private final KVRepository<String, Object> repository;

    private final Set<Hash256> processed = new HashSet<>();

    public SlashingManager(ConsensusConfig config,
                           ValidatorRegistry registry,
                           StakeTreasury treasury,
                           FinalizedBlockStore blockStore,
                           KVRepository<String, Object> repository) {
        this.config = config;
        this.registry = registry;
        this.treasury = treasury;
        this.blockStore = blockStore;
        this.repository = repository;
    }

    public synchronized SlashingOutcome processEvidence(SlashingEvidence evidence) {
        Hash256 evidenceHash = evidence.getHash();
        if (isProcessed(evidenceHash)) {
            log.fine("Evidence already processed " + evidenceHash);
            return SlashingOutcome.ALREADY_PROCESSED;
        }

        if (!isValid(evidence)) {
            log.log(Level.WARNING, "Rejected invalid slashing evidence " + evidence);
            return SlashingOutcome.INVALID;
        }

        long currentHeight = Math.max(0, blockStore.getLatestHeight());
        if (currentHeight - evidence.getHeight() > config.getEvidenceExpiryWindow()) {
            log.fine("Evidence expired " + evidence);
            return SlashingOutcome.EXPIRED;
        }

        Optional<Validator> validator = registry.getValidator(evidence.getOffender());
        if (validator.isEmpty()) {
            log.log(Level.WARNING, "Slashing evidence names unknown validator " + evidence.getOffender());
            return SlashingOutcome.INVALID;
        }

        BigInteger penalty = computePenalty(evidence, validator.get().getStake());
        try {
            BigInteger remaining = registry.applySlash(evidence.getOffender(), penalty);
            treasury.applyPenalty(evidence.getOffender(), penalty);
            log.log(Level.WARNING, String.format("Slashed %s by %s for %s, remaining stake %s",
                    evidence.getOffender(), penalty, evidence.getOffense(), remaining));
        } catch (UnknownValidatorException e) {
            log.log(Level.WARNING, e.getMessage());
            return SlashingOutcome.INVALID;
        }

        processed.add(evidenceHash);
        repository.save(StateUtil.generateHashKey(DBConstants.SLASHING_EVIDENCE, evidenceHash),
                evidence.withPenalty(penalty));
        return SlashingOutcome.SLASHED;
    }

    /**
     * Double voting and long range equivocation cost a fixed share of stake; unavailability grows with the
     * number of consecutive misses up to a cap.
     */
    public BigInteger computePenalty(SlashingEvidence evidence, BigInteger stake) {
        long percent = switch (evidence.getOffense()) {
            case DOUBLE_VOTING, LONG_RANGE_EQUIVOCATION -> config.getDoubleSignPenaltyPercent();
            case UNAVAILABILITY -> Math.min(
                    (long) config.getUnavailabilityPenaltyPercent() * evidence.getConsecutiveMisses(),
                    config.getUnavailabilityPenaltyCapPercent());
        };
        return stake.multiply(BigInteger.valueOf(percent)).divide(HUNDRED);
    }

    public Optional<SlashingEvidence> getEvidence(Hash256 evidenceHash) {
        return repository.find(StateUtil.generateHashKey(DBConstants.SLASHING_EVIDENCE, evidenceHash))
                .map(SlashingEvidence.class::cast);
    }

    private boolean isProcessed(Hash256 evidenceHash) {
        return processed.contains(evidenceHash) || getEvidence(evidenceHash).isPresent();
    }

    private boolean isValid(SlashingEvidence evidence) {
        if (evidence.getOffense() == OffenseType.UNAVAILABILITY) {
            return evidence.getConsecutiveMisses() >= config.getUnavailabilityThreshold();
        }
        return evidence.getFirst() != null
                && evidence.getSecond() != null
                && evidence.getFirst().getValidator().equals(evidence.getOffender())
                && evidence.getFirst().conflictsWith(evidence.getSecond())
                && evidence.getFirst().isSignatureValid()
                && evidence.getSecond().isSignatureValid();
    }
}
