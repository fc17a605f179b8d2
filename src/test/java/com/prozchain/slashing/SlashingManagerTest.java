package com.prozchain.slashing;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.finality.Vote;
import com.prozchain.finality.VoteStage;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.storage.InMemoryRepository;
import com.prozchain.treasury.InMemoryStakeTreasury;
import com.prozchain.utils.TestUtils;
import com.prozchain.validator.ValidatorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlashingManagerTest {

    @Mock
    private FinalizedBlockStore blockStore;

    private final List<TestUtils.Signer> signers = TestUtils.signers(4);
    private final TestUtils.Signer offender = signers.get(0);
    private final Block genesis = TestUtils.genesis(offender.getId());
    private final Block x = TestUtils.child(genesis, offender.getId(), "x");
    private final Block y = TestUtils.child(genesis, offender.getId(), "y");

    private ConsensusConfig config;
    private InMemoryStakeTreasury treasury;
    private InMemoryRepository repository;
    private ValidatorRegistry registry;
    private SlashingManager slashingManager;

    @BeforeEach
    void setup() {
        config = ConsensusConfig.defaults();
        treasury = new InMemoryStakeTreasury();
        repository = new InMemoryRepository();
        registry = TestUtils.registry(config, treasury, signers, 2000);
        slashingManager = new SlashingManager(config, registry, treasury, blockStore, repository);
    }

    private SlashingEvidence doubleVote() {
        return SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING,
                offender.vote(x, VoteStage.PREPARE), offender.vote(y, VoteStage.PREPARE));
    }

    @Test
    void doubleVotingCostsHalfTheStake() {
        when(blockStore.getLatestHeight()).thenReturn(1L);
        SlashingEvidence evidence = doubleVote();

        assertEquals(SlashingOutcome.SLASHED, slashingManager.processEvidence(evidence));

        assertEquals(BigInteger.valueOf(1000), treasury.currentStake(offender.getId()));
        assertEquals(BigInteger.valueOf(1000), registry.getValidator(offender.getId()).orElseThrow().getStake());
        assertFalse(registry.isEjected(offender.getId()));
        assertEquals(BigInteger.valueOf(1000), slashingManager.getEvidence(evidence.getHash()).orElseThrow()
                .getPenalty());
    }

    @Test
    void evidenceIsAppliedOnlyOnce() {
        when(blockStore.getLatestHeight()).thenReturn(1L);
        Vote first = offender.vote(x, VoteStage.PREPARE);
        Vote second = offender.vote(y, VoteStage.PREPARE);

        slashingManager.processEvidence(SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING, first, second));

        assertEquals(SlashingOutcome.ALREADY_PROCESSED, slashingManager.processEvidence(
                SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING, second, first)));
        assertEquals(BigInteger.valueOf(1000), treasury.currentStake(offender.getId()));

        // the slashing log survives a restart
        SlashingManager restarted = new SlashingManager(config, registry, treasury, blockStore, repository);
        assertEquals(SlashingOutcome.ALREADY_PROCESSED, restarted.processEvidence(doubleVote()));
    }

    @Test
    void repeatedSlashingEjects() {
        when(blockStore.getLatestHeight()).thenReturn(1L);
        slashingManager.processEvidence(doubleVote());

        SlashingEvidence commitEvidence = SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING,
                offender.vote(x, VoteStage.COMMIT), offender.vote(y, VoteStage.COMMIT));
        assertEquals(SlashingOutcome.SLASHED, slashingManager.processEvidence(commitEvidence));

        assertTrue(registry.isEjected(offender.getId()));
        assertEquals(BigInteger.valueOf(500), treasury.currentStake(offender.getId()));
    }

    @Test
    void forgedEvidenceIsInvalid() {
        Vote genuine = offender.vote(x, VoteStage.PREPARE);
        Vote forged = new Vote(offender.getId(), y.getHash(), 1, 0, VoteStage.PREPARE, genuine.getSignature());

        assertEquals(SlashingOutcome.INVALID, slashingManager.processEvidence(
                SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING, genuine, forged)));
        assertEquals(BigInteger.valueOf(2000), treasury.currentStake(offender.getId()));
    }

    @Test
    void nonConflictingVotesAreInvalid() {
        Vote prepare = offender.vote(x, VoteStage.PREPARE);
        Vote commit = offender.vote(y, VoteStage.COMMIT);

        assertEquals(SlashingOutcome.INVALID, slashingManager.processEvidence(
                SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING, prepare, commit)));
    }

    @Test
    void oldEvidenceExpires() {
        when(blockStore.getLatestHeight()).thenReturn(1002L);

        assertEquals(SlashingOutcome.EXPIRED, slashingManager.processEvidence(doubleVote()));
        assertEquals(BigInteger.valueOf(2000), treasury.currentStake(offender.getId()));
    }

    @Test
    void unavailabilityPenaltyGrowsWithMissesUpToCap() {
        BigInteger stake = BigInteger.valueOf(2000);

        assertEquals(BigInteger.valueOf(200), slashingManager.computePenalty(
                SlashingEvidence.unavailability(offender.getId(), 5, 10), stake));
        assertEquals(BigInteger.valueOf(200), slashingManager.computePenalty(
                SlashingEvidence.unavailability(offender.getId(), 5, 50), stake));
        assertEquals(BigInteger.valueOf(1000), slashingManager.computePenalty(doubleVote(), stake));
    }

    @Test
    void unavailabilityBelowThresholdIsInvalid() {
        assertEquals(SlashingOutcome.INVALID, slashingManager.processEvidence(
                SlashingEvidence.unavailability(offender.getId(), 5, 3)));
    }

    @Test
    void unavailabilityIsSlashed() {
        when(blockStore.getLatestHeight()).thenReturn(20L);

        assertEquals(SlashingOutcome.SLASHED, slashingManager.processEvidence(
                SlashingEvidence.unavailability(offender.getId(), 20, 12)));
        assertEquals(BigInteger.valueOf(1800), treasury.currentStake(offender.getId()));
    }
}
