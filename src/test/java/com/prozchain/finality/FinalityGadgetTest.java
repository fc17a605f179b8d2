package com.prozchain.finality;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.finality.SafetyViolationException;
import com.prozchain.forkchoice.ForkChoiceService;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.storage.InMemoryRepository;
import com.prozchain.treasury.InMemoryStakeTreasury;
import com.prozchain.types.Hash256;
import com.prozchain.utils.TestUtils;
import com.prozchain.validator.ValidatorRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinalityGadgetTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_000_000);

    private final List<TestUtils.Signer> signers = TestUtils.signers(4);
    private final TestUtils.Signer a = signers.get(0);
    private final TestUtils.Signer b = signers.get(1);
    private final TestUtils.Signer c = signers.get(2);
    private final TestUtils.Signer d = signers.get(3);
    private final Block genesis = TestUtils.genesis(a.getId());

    private ValidatorRegistry registry;
    private ForkChoiceService forkChoice;
    private FinalizedBlockStore blockStore;
    private FinalityGadget gadget;

    private void setup(ConsensusConfig config) {
        registry = TestUtils.registry(config, new InMemoryStakeTreasury(), signers, 2000);
        forkChoice = new ForkChoiceService(config, registry);
        forkChoice.initialize(genesis);
        blockStore = new FinalizedBlockStore(new InMemoryRepository());
        gadget = new FinalityGadget(config, registry, forkChoice, blockStore);
        gadget.initialize(genesis);
    }

    private void setup() {
        setup(ConsensusConfig.defaults());
    }

    private Hash256 propose(Block block) {
        Hash256 head = forkChoice.onBlock(block, NOW);
        forkChoice.takeImportedBlocks().forEach(gadget::onBlockProposed);
        return head;
    }

    private List<Block> proposeChain(Block parent, int length, String tag) {
        List<Block> chain = TestUtils.chain(parent, length, a.getId(), tag);
        chain.forEach(this::propose);
        return chain;
    }

    private void voteAll(Block block, VoteStage stage, TestUtils.Signer... voters) {
        for (TestUtils.Signer voter : voters) {
            assertEquals(VoteOutcome.ACCEPTED, gadget.onVote(voter.vote(block, stage)));
        }
    }

    @Test
    void supermajorityFinalizesBlockAndAncestors() {
        setup();
        List<Block> chain = proposeChain(genesis, 10, "");
        Block target = chain.get(9);

        voteAll(target, VoteStage.PREPARE, a, b, c);
        assertEquals(Optional.of(CandidateState.PREPARED), gadget.getState(target.getHash()));
        voteAll(target, VoteStage.COMMIT, a, b, c);

        assertEquals(Optional.of(CandidateState.FINALIZED), gadget.getState(target.getHash()));
        assertEquals(target, gadget.getLastFinalized());
        assertEquals(10, blockStore.getLatestHeight());
        for (int height = 1; height <= 10; height++) {
            assertEquals(chain.get(height - 1), blockStore.getByHeight(height).orElseThrow());
        }

        FinalityRecord record = blockStore.getRecord(10).orElseThrow();
        assertEquals(FinalityJustification.QUORUM_CERTIFICATE, record.getJustification());
        assertEquals(3, record.getCertificate().getVotes().size());
        assertEquals(BigInteger.valueOf(6000), record.getCertificate().getVotedPower());
        assertEquals(BigInteger.valueOf(8000), record.getCertificate().getTotalPower());

        FinalityRecord ancestor = blockStore.getRecord(4).orElseThrow();
        assertEquals(FinalityJustification.ANCESTOR_OF_FINALIZED, ancestor.getJustification());
        assertEquals(target.getHash(), ancestor.getJustifiedBy());
        assertNull(ancestor.getCertificate());
        assertEquals(target.getHash(), forkChoice.getFinalizedRoot());
    }

    @Test
    void voteForConflictingBlockAfterFinalityIsRejected() {
        setup();
        List<Block> chain = proposeChain(genesis, 10, "");
        Block target = chain.get(9);
        voteAll(target, VoteStage.PREPARE, a, b, c);
        voteAll(target, VoteStage.COMMIT, a, b, c);

        Block conflicting = TestUtils.child(chain.get(8), a.getId(), "conflict");

        assertEquals(VoteOutcome.REJECTED, gadget.onVote(a.vote(conflicting, VoteStage.COMMIT)));
        assertEquals(VoteOutcome.DUPLICATE, gadget.onVote(d.vote(target, VoteStage.COMMIT)));
        assertEquals(target.getHash(), blockStore.getByHeight(10).orElseThrow().getHash());
    }

    @Test
    void belowQuorumStaysProposed() {
        setup();
        Block block = proposeChain(genesis, 1, "").get(0);

        voteAll(block, VoteStage.PREPARE, a, b);
        voteAll(block, VoteStage.COMMIT, a, b);

        assertEquals(Optional.of(CandidateState.PROPOSED), gadget.getState(block.getHash()));
        assertTrue(blockStore.getByHeight(1).isEmpty());
    }

    @Test
    void commitsBeforePrepareQuorumCountOnceItForms() {
        setup();
        Block block = proposeChain(genesis, 1, "").get(0);

        voteAll(block, VoteStage.COMMIT, a, b, c);
        assertEquals(Optional.of(CandidateState.PROPOSED), gadget.getState(block.getHash()));

        voteAll(block, VoteStage.PREPARE, b, c, d);

        assertEquals(Optional.of(CandidateState.FINALIZED), gadget.getState(block.getHash()));
    }

    @Test
    void outcomeDoesNotDependOnVoteOrder() {
        Random random = new Random(42);
        List<Hash256> finalizedHashes = new ArrayList<>();

        for (int run = 0; run < 5; run++) {
            setup();
            Block x = TestUtils.child(genesis, a.getId(), "x");
            Block y = TestUtils.child(genesis, a.getId(), "y");
            propose(x);
            propose(y);

            List<Vote> votes = new ArrayList<>();
            for (TestUtils.Signer signer : List.of(a, b, c)) {
                votes.add(signer.vote(x, VoteStage.PREPARE));
                votes.add(signer.vote(x, VoteStage.COMMIT));
            }
            votes.add(d.vote(y, VoteStage.PREPARE));
            votes.add(d.vote(y, VoteStage.COMMIT));
            Collections.shuffle(votes, random);

            votes.forEach(gadget::onVote);
            finalizedHashes.add(gadget.getLastFinalized().getHash());
        }

        assertTrue(finalizedHashes.stream().allMatch(hash -> hash.equals(finalizedHashes.get(0))));
    }

    @Test
    void duplicateAndEquivocatingVotesAreReported() {
        setup();
        Block x = TestUtils.child(genesis, a.getId(), "x");
        Block y = TestUtils.child(genesis, a.getId(), "y");
        propose(x);
        propose(y);

        Vote vote = a.vote(x, VoteStage.PREPARE);
        assertEquals(VoteOutcome.ACCEPTED, gadget.onVote(vote));
        assertEquals(VoteOutcome.DUPLICATE, gadget.onVote(vote));
        assertEquals(VoteOutcome.EQUIVOCATION, gadget.onVote(a.vote(y, VoteStage.PREPARE)));
        assertEquals(1, gadget.getCandidate(x.getHash()).orElseThrow().getPrepares().size());
        assertTrue(gadget.getCandidate(y.getHash()).orElseThrow().getPrepares().isEmpty());
    }

    @Test
    void votesForUnknownBlockAreBufferedAndReplayed() {
        setup();
        Block block = TestUtils.child(genesis, a.getId());

        for (TestUtils.Signer signer : List.of(a, b, c)) {
            assertEquals(VoteOutcome.BUFFERED, gadget.onVote(signer.vote(block, VoteStage.PREPARE)));
            assertEquals(VoteOutcome.BUFFERED, gadget.onVote(signer.vote(block, VoteStage.COMMIT)));
        }
        assertEquals(6, gadget.getPendingVoteCount());

        propose(block);

        assertEquals(0, gadget.getPendingVoteCount());
        assertEquals(block, gadget.getLastFinalized());
    }

    @Test
    void votesTooFarAboveFinalizedHeightAreRejected() {
        setup(ConsensusConfig.builder().voteBufferHeightWindow(5).build());
        Hash256 unknown = TestUtils.child(genesis, a.getId()).getHash();

        assertEquals(VoteOutcome.BUFFERED, gadget.onVote(a.vote(unknown, 5, 0, VoteStage.PREPARE)));
        assertEquals(VoteOutcome.REJECTED, gadget.onVote(a.vote(unknown, 6, 0, VoteStage.PREPARE)));
    }

    @Test
    void ejectedValidatorStopsCountingImmediately() {
        setup();
        Block block = proposeChain(genesis, 1, "").get(0);

        voteAll(block, VoteStage.PREPARE, a);
        registry.applySlash(a.getId(), BigInteger.valueOf(1500));

        assertEquals(VoteOutcome.REJECTED, gadget.onVote(a.vote(block, VoteStage.COMMIT)));
        voteAll(block, VoteStage.PREPARE, b, c);
        // a's earlier prepare no longer counts: 4000 of a frozen 8000 total
        assertEquals(Optional.of(CandidateState.PROPOSED), gadget.getState(block.getHash()));

        voteAll(block, VoteStage.PREPARE, d);
        assertEquals(Optional.of(CandidateState.PREPARED), gadget.getState(block.getHash()));
    }

    @Test
    void conflictingCheckpointHaltsFinalization() {
        setup();
        Block block = proposeChain(genesis, 1, "").get(0);
        voteAll(block, VoteStage.PREPARE, a, b, c);
        voteAll(block, VoteStage.COMMIT, a, b, c);

        Hash256 other = TestUtils.child(genesis, b.getId(), "other").getHash();
        assertThrows(SafetyViolationException.class, () -> gadget.finalizeCheckpoint(1, other));

        assertTrue(gadget.isHalted());
        Block next = proposeChain(block, 1, "").get(0);
        assertEquals(VoteOutcome.REJECTED, gadget.onVote(a.vote(next, VoteStage.PREPARE)));
    }

    @Test
    void checkpointFinalizesWithoutVotes() {
        setup();
        List<Block> chain = proposeChain(genesis, 3, "");

        gadget.finalizeCheckpoint(2, chain.get(1).getHash());

        assertEquals(chain.get(1), gadget.getLastFinalized());
        assertEquals(FinalityJustification.CHECKPOINT, blockStore.getRecord(2).orElseThrow().getJustification());
    }

    @Test
    void confirmationDepthFinalizesBuriedBlocks() {
        setup(ConsensusConfig.builder()
                .finalityMode(FinalityMode.CONFIRMATION_DEPTH)
                .confirmationDepth(2)
                .build());
        List<Block> chain = proposeChain(genesis, 5, "");
        voteAll(chain.get(4), VoteStage.PREPARE, a, b, c);
        voteAll(chain.get(4), VoteStage.COMMIT, a, b, c);
        // votes alone never finalize in this mode
        assertEquals(genesis, gadget.getLastFinalized());

        gadget.onHeadChanged(forkChoice.getHead());

        assertEquals(chain.get(2), gadget.getLastFinalized());
        assertEquals(FinalityJustification.CONFIRMATION_DEPTH,
                blockStore.getRecord(3).orElseThrow().getJustification());
    }

    @Test
    void candidatesLeftBehindByTheHeadAreAbandoned() {
        setup(ConsensusConfig.builder().safetyWindow(2).build());
        Block fork = TestUtils.child(genesis, b.getId(), "fork");
        propose(fork);
        List<Block> main = proposeChain(genesis, 4, "main");

        gadget.onHeadChanged(main.get(3).getHash());

        assertEquals(Optional.of(CandidateState.ABANDONED), gadget.getState(fork.getHash()));
        assertEquals(Optional.of(CandidateState.PROPOSED), gadget.getState(main.get(0).getHash()));
    }

    @Test
    void listenersSeeFinalizedBlocksInHeightOrder() {
        setup();
        List<FinalityEvent> events = new ArrayList<>();
        gadget.addListener(events::add);
        List<Block> chain = proposeChain(genesis, 3, "");

        voteAll(chain.get(2), VoteStage.PREPARE, a, b, c);
        voteAll(chain.get(2), VoteStage.COMMIT, a, b, c);

        assertEquals(3, events.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(chain.get(i), events.get(i).getBlock());
        }
        assertNotNull(events.get(2).getRecord().getCertificate());
        assertEquals(3, events.get(2).getParticipants().size());
    }
}
