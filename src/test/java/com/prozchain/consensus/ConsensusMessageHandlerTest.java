package com.prozchain.consensus;

import com.prozchain.block.Block;
import com.prozchain.block.BlockHeader;
import com.prozchain.checkpoint.CheckpointSignature;
import com.prozchain.finality.Vote;
import com.prozchain.finality.VoteOutcome;
import com.prozchain.finality.VoteStage;
import com.prozchain.leader.EpochData;
import com.prozchain.leader.EpochState;
import com.prozchain.leader.LeaderScheduler;
import com.prozchain.types.Hash256;
import com.prozchain.utils.TestUtils;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorRegistry;
import com.prozchain.validator.ValidatorSetSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsensusMessageHandlerTest {

    @Mock
    private ConsensusCore consensusCore;
    @Mock
    private ValidatorRegistry registry;
    @Mock
    private LeaderScheduler leaderScheduler;
    @Mock
    private EpochState epochState;

    @InjectMocks
    private ConsensusMessageHandler handler;

    private final TestUtils.Signer signer = new TestUtils.Signer();
    private final Block genesis = TestUtils.genesis(signer.getId());
    private final Block block = TestUtils.child(genesis, signer.getId());

    @AfterEach
    void tearDown() {
        handler.shutdown();
    }

    private ValidatorSetSnapshot snapshotWith(ValidatorId id) {
        return new ValidatorSetSnapshot(0, Map.of(id, BigInteger.TEN));
    }

    private EpochData epochZero() {
        return new EpochData(0, snapshotWith(signer.getId()), Hash256.empty());
    }

    @Test
    void blockWithMismatchedPayloadIsDropped() {
        BlockHeader header = block.getHeader();
        Block tampered = new Block(header, List.of("extra".getBytes(StandardCharsets.UTF_8)));

        assertFalse(handler.isBlockWellFormed(tampered));
    }

    @Test
    void secondGenesisIsDropped() {
        assertFalse(handler.isBlockWellFormed(genesis));
    }

    @Test
    void blockFromUnscheduledProposerIsDropped() {
        when(epochState.getEpochIndex(1)).thenReturn(0L);
        when(epochState.getEpochData(0)).thenReturn(Optional.of(epochZero()));
        when(leaderScheduler.isScheduled(signer.getId(), 1)).thenReturn(false);

        assertFalse(handler.isBlockWellFormed(block));
    }

    @Test
    void blockOfScheduledProposerPasses() {
        when(epochState.getEpochIndex(1)).thenReturn(0L);
        when(epochState.getEpochData(0)).thenReturn(Optional.of(epochZero()));
        when(leaderScheduler.isScheduled(signer.getId(), 1)).thenReturn(true);

        assertTrue(handler.isBlockWellFormed(block));
    }

    @Test
    void blockOfAnEpochNotYetFixedSkipsLeaderCheck() {
        when(epochState.getEpochIndex(1)).thenReturn(1L);
        when(epochState.getEpochData(1)).thenReturn(Optional.empty());

        assertTrue(handler.isBlockWellFormed(block));
        verify(leaderScheduler, never()).isScheduled(any(), anyLong());
    }

    @Test
    void voteFromOutsideActiveSetIsRejectedWithoutReachingCore() {
        when(registry.getCurrentSnapshot()).thenReturn(snapshotWith(new TestUtils.Signer().getId()));

        VoteOutcome outcome = handler.deliverVote(signer.vote(block, VoteStage.PREPARE)).join();

        assertEquals(VoteOutcome.REJECTED, outcome);
        verify(consensusCore, never()).submitVote(any());
    }

    @Test
    void validVoteIsSubmittedToCore() {
        Vote vote = signer.vote(block, VoteStage.PREPARE);
        when(registry.getCurrentSnapshot()).thenReturn(snapshotWith(signer.getId()));
        when(consensusCore.submitVote(vote)).thenReturn(CompletableFuture.completedFuture(VoteOutcome.ACCEPTED));

        assertEquals(VoteOutcome.ACCEPTED, handler.deliverVote(vote).join());
    }

    @Test
    void voteWithUnknownStageIsRejected() {
        Vote vote = new Vote(signer.getId(), block.getHash(), 1, 0, VoteStage.UNKNOWN, null);

        assertFalse(handler.isVoteWellFormed(vote));
    }

    @Test
    void badlySignedCheckpointSignatureIsDropped() {
        when(registry.getCurrentSnapshot()).thenReturn(snapshotWith(signer.getId()));
        CheckpointSignature genuine = signer.checkpoint(block);
        CheckpointSignature forged = new CheckpointSignature(signer.getId(), 2, block.getHash(),
                genuine.getSignature());

        handler.deliverCheckpointSignature(forged).join();

        verify(consensusCore, never()).submitCheckpointSignature(any());
    }
}
