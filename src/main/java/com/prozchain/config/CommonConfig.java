package com.prozchain.config;

import com.prozchain.exception.global.ConfigurationException;
import com.prozchain.finality.FinalityMode;
import com.prozchain.forkchoice.ForkChoiceStrategy;
import com.prozchain.leader.LeaderSelectionPolicy;
import com.prozchain.network.LocalPeerMessageCoordinator;
import com.prozchain.network.PeerMessageCoordinator;
import com.prozchain.storage.InMemoryRepository;
import com.prozchain.storage.KVRepository;
import com.prozchain.treasury.InMemoryStakeTreasury;
import com.prozchain.treasury.StakeTreasury;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.env.Environment;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration class used to instantiate beans.
 */
@Configuration
@ComponentScan("com.prozchain")
@PropertySource("classpath:consensus.properties")
public class CommonConfig {

    private static final String PREFIX = "consensus.";

    @Bean
    public ConsensusConfig consensusConfig(Environment environment) {
        return fromEnvironment(environment);
    }

    @Bean
    public KVRepository<String, Object> repository() {
        return new InMemoryRepository();
    }

    @Bean
    public StakeTreasury stakeTreasury() {
        return new InMemoryStakeTreasury();
    }

    @Bean
    public PeerMessageCoordinator peerMessageCoordinator() {
        return new LocalPeerMessageCoordinator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Reads {@code consensus.*} properties over the built in defaults and validates the result.
     */
    public static ConsensusConfig fromEnvironment(Environment env) {
        ConsensusConfig defaults = ConsensusConfig.defaults();
        try {
            return ConsensusConfig.builder()
                    .epochLength(env.getProperty(PREFIX + "epoch-length", Long.class, defaults.getEpochLength()))
                    .slotDuration(Duration.ofMillis(env.getProperty(PREFIX + "slot-duration-ms", Long.class,
                            defaults.getSlotDuration().toMillis())))
                    .genesisSlot(env.getProperty(PREFIX + "genesis-slot", Long.class, defaults.getGenesisSlot()))
                    .maxValidators(env.getProperty(PREFIX + "max-validators", Integer.class,
                            defaults.getMaxValidators()))
                    .minStake(new BigInteger(env.getProperty(PREFIX + "min-stake", defaults.getMinStake().toString())))
                    .powerUnit(new BigInteger(env.getProperty(PREFIX + "power-unit", defaults.getPowerUnit().toString())))
                    .leaderPolicy(LeaderSelectionPolicy.valueOf(env.getProperty(PREFIX + "leader-policy",
                            defaults.getLeaderPolicy().name())))
                    .backupLeaders(env.getProperty(PREFIX + "backup-leaders", Integer.class,
                            defaults.getBackupLeaders()))
                    .leaderTimeout(Duration.ofMillis(env.getProperty(PREFIX + "leader-timeout-ms", Long.class,
                            defaults.getLeaderTimeout().toMillis())))
                    .forkChoiceStrategy(ForkChoiceStrategy.valueOf(env.getProperty(PREFIX + "fork-choice",
                            defaults.getForkChoiceStrategy().name())))
                    .orphanBufferSize(env.getProperty(PREFIX + "orphan-buffer-size", Integer.class,
                            defaults.getOrphanBufferSize()))
                    .orphanTimeout(Duration.ofMillis(env.getProperty(PREFIX + "orphan-timeout-ms", Long.class,
                            defaults.getOrphanTimeout().toMillis())))
                    .finalityMode(FinalityMode.valueOf(env.getProperty(PREFIX + "finality-mode",
                            defaults.getFinalityMode().name())))
                    .quorumNumerator(env.getProperty(PREFIX + "quorum-numerator", Long.class,
                            defaults.getQuorumNumerator()))
                    .quorumDenominator(env.getProperty(PREFIX + "quorum-denominator", Long.class,
                            defaults.getQuorumDenominator()))
                    .safetyWindow(env.getProperty(PREFIX + "safety-window", Long.class, defaults.getSafetyWindow()))
                    .confirmationDepth(env.getProperty(PREFIX + "confirmation-depth", Long.class,
                            defaults.getConfirmationDepth()))
                    .voteBufferSize(env.getProperty(PREFIX + "vote-buffer-size", Integer.class,
                            defaults.getVoteBufferSize()))
                    .voteBufferHeightWindow(env.getProperty(PREFIX + "vote-buffer-height-window", Long.class,
                            defaults.getVoteBufferHeightWindow()))
                    .checkpointInterval(env.getProperty(PREFIX + "checkpoint-interval", Long.class,
                            defaults.getCheckpointInterval()))
                    .recentVoteBufferSize(env.getProperty(PREFIX + "recent-vote-buffer-size", Integer.class,
                            defaults.getRecentVoteBufferSize()))
                    .evidenceExpiryWindow(env.getProperty(PREFIX + "evidence-expiry-window", Long.class,
                            defaults.getEvidenceExpiryWindow()))
                    .doubleSignPenaltyPercent(env.getProperty(PREFIX + "double-sign-penalty-percent", Integer.class,
                            defaults.getDoubleSignPenaltyPercent()))
                    .unavailabilityPenaltyPercent(env.getProperty(PREFIX + "unavailability-penalty-percent",
                            Integer.class, defaults.getUnavailabilityPenaltyPercent()))
                    .unavailabilityPenaltyCapPercent(env.getProperty(PREFIX + "unavailability-penalty-cap-percent",
                            Integer.class, defaults.getUnavailabilityPenaltyCapPercent()))
                    .unavailabilityThreshold(env.getProperty(PREFIX + "unavailability-threshold", Long.class,
                            defaults.getUnavailabilityThreshold()))
                    .blockRewardBudget(new BigInteger(env.getProperty(PREFIX + "block-reward-budget",
                            defaults.getBlockRewardBudget().toString())))
                    .proposerRewardPercent(env.getProperty(PREFIX + "proposer-reward-percent", Integer.class,
                            defaults.getProposerRewardPercent()))
                    .proposerBoostPercent(env.getProperty(PREFIX + "proposer-boost-percent", Integer.class,
                            defaults.getProposerBoostPercent()))
                    .lowParticipationPercent(env.getProperty(PREFIX + "low-participation-percent", Integer.class,
                            defaults.getLowParticipationPercent()))
                    .build()
                    .validate();
        } catch (IllegalArgumentException | ConversionException e) {
            throw new ConfigurationException("Invalid consensus property: " + e.getMessage(), e);
        }
    }
}
