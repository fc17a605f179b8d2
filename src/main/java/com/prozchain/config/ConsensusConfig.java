package com.prozchain.config;

import com.prozchain.exception.global.ConfigurationException;
import com.prozchain.finality.FinalityMode;
import com.prozchain.forkchoice.ForkChoiceStrategy;
import com.prozchain.leader.LeaderSelectionPolicy;
import lombok.Builder;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Consensus parameters fixed at genesis. Every honest node must run with identical values.
 */
@Getter
@Builder(toBuilder = true)
public class ConsensusConfig {

    // Epochs and slots
    @Builder.Default
    private final long epochLength = 100;
    @Builder.Default
    private final Duration slotDuration = Duration.ofMillis(6000);
    @Builder.Default
    private final long genesisSlot = 0;

    // Validator registry
    @Builder.Default
    private final int maxValidators = 100;
    @Builder.Default
    private final BigInteger minStake = BigInteger.valueOf(1000);
    @Builder.Default
    private final BigInteger powerUnit = BigInteger.ONE;

    // Leader scheduling
    @Builder.Default
    private final LeaderSelectionPolicy leaderPolicy = LeaderSelectionPolicy.STAKE_WEIGHTED;
    @Builder.Default
    private final int backupLeaders = 3;
    @Builder.Default
    private final Duration leaderTimeout = Duration.ofMillis(3000);

    // Fork choice
    @Builder.Default
    private final ForkChoiceStrategy forkChoiceStrategy = ForkChoiceStrategy.GHOST;
    @Builder.Default
    private final int orphanBufferSize = 256;
    @Builder.Default
    private final Duration orphanTimeout = Duration.ofSeconds(60);

    // Finality
    @Builder.Default
    private final FinalityMode finalityMode = FinalityMode.BFT;
    @Builder.Default
    private final long quorumNumerator = 2;
    @Builder.Default
    private final long quorumDenominator = 3;
    @Builder.Default
    private final long safetyWindow = 64;
    @Builder.Default
    private final long confirmationDepth = 6;
    @Builder.Default
    private final int voteBufferSize = 1024;
    @Builder.Default
    private final long voteBufferHeightWindow = 256;

    // Checkpoints
    @Builder.Default
    private final long checkpointInterval = 100;

    // Slashing
    @Builder.Default
    private final int recentVoteBufferSize = 64;
    @Builder.Default
    private final long evidenceExpiryWindow = 1000;
    @Builder.Default
    private final int doubleSignPenaltyPercent = 50;
    @Builder.Default
    private final int unavailabilityPenaltyPercent = 1;
    @Builder.Default
    private final int unavailabilityPenaltyCapPercent = 10;
    @Builder.Default
    private final long unavailabilityThreshold = 10;

    // Rewards
    @Builder.Default
    private final BigInteger blockRewardBudget = BigInteger.valueOf(100);
    @Builder.Default
    private final int proposerRewardPercent = 20;
    @Builder.Default
    private final int proposerBoostPercent = 10;
    @Builder.Default
    private final int lowParticipationPercent = 50;

    public static ConsensusConfig defaults() {
        return ConsensusConfig.builder().build();
    }

    /**
     * Rejects parameter combinations that break the fault tolerance bound or the protocol arithmetic.
     *
     * @return this config, for chaining
     */
    public ConsensusConfig validate() {
        if (quorumDenominator <= 0 || quorumNumerator <= 0 || quorumNumerator > quorumDenominator) {
            throw new ConfigurationException(String.format("Invalid quorum fraction %d/%d",
                    quorumNumerator, quorumDenominator));
        }
        // n/d >= 2/3 <=> 3n >= 2d
        if (3 * quorumNumerator < 2 * quorumDenominator) {
            throw new ConfigurationException(String.format(
                    "Quorum fraction %d/%d is below 2/3, Byzantine fault tolerance no longer holds",
                    quorumNumerator, quorumDenominator));
        }
        if (epochLength <= 0 || slotDuration.isNegative() || slotDuration.isZero()) {
            throw new ConfigurationException("Epoch length and slot duration must be positive");
        }
        if (maxValidators <= 0) {
            throw new ConfigurationException("maxValidators must be positive");
        }
        if (powerUnit.signum() <= 0) {
            throw new ConfigurationException("powerUnit must be positive");
        }
        if (checkpointInterval <= 0) {
            throw new ConfigurationException("checkpointInterval must be positive");
        }
        if (proposerRewardPercent < 0 || proposerRewardPercent + proposerBoostPercent > 100) {
            throw new ConfigurationException("Proposer reward share must stay within 0..100 percent");
        }
        if (doubleSignPenaltyPercent < 0 || doubleSignPenaltyPercent > 100
                || unavailabilityPenaltyCapPercent < 0 || unavailabilityPenaltyCapPercent > 100) {
            throw new ConfigurationException("Penalty percentages must stay within 0..100");
        }
        return this;
    }
}
