package com.prozchain.consensus;

import com.prozchain.block.Block;
import com.prozchain.checkpoint.CheckpointSignature;
import com.prozchain.finality.Vote;
import com.prozchain.finality.VoteOutcome;
import com.prozchain.finality.VoteStage;
import com.prozchain.leader.EpochState;
import com.prozchain.leader.LeaderScheduler;
import com.prozchain.types.Hash256;
import com.prozchain.utils.async.AsyncExecutor;
import com.prozchain.validator.ValidatorRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;

/**
 * Inbound boundary from the gossip layer. Messages may arrive in any order and more than once. Stateless
 * checks and signature verification run on a worker pool; messages that pass are handed to the
 * {@link ConsensusCore} event loop, the rest are logged and dropped.
 */
@Log
@Component
public class ConsensusMessageHandler {

    private final ConsensusCore consensusCore;
    private final ValidatorRegistry registry;
    private final LeaderScheduler leaderScheduler;
    private final EpochState epochState;

    private final AsyncExecutor verificationExecutor = AsyncExecutor.withPoolSize(4);

    public ConsensusMessageHandler(ConsensusCore consensusCore,
                                   ValidatorRegistry registry,
                                   LeaderScheduler leaderScheduler,
                                   EpochState epochState) {
        this.consensusCore = consensusCore;
        this.registry = registry;
        this.leaderScheduler = leaderScheduler;
        this.epochState = epochState;
    }

    /**
     * @return the head after the block was applied, or the current head if the block was dropped
     */
    public CompletableFuture<Hash256> deliverBlock(Block block) {
        return verificationExecutor.executeAsync(() -> isBlockWellFormed(block))
                .thenCompose(valid -> valid
                        ? consensusCore.submitBlock(block)
                        : CompletableFuture.completedFuture(consensusCore.getHead()));
    }

    public CompletableFuture<VoteOutcome> deliverVote(Vote vote) {
        return verificationExecutor.executeAsync(() -> isVoteWellFormed(vote))
                .thenCompose(valid -> valid
                        ? consensusCore.submitVote(vote)
                        : CompletableFuture.completedFuture(VoteOutcome.REJECTED));
    }

    public CompletableFuture<Void> deliverCheckpointSignature(CheckpointSignature signature) {
        return verificationExecutor.executeAsync(() -> isCheckpointSignatureWellFormed(signature))
                .thenCompose(valid -> valid
                        ? consensusCore.submitCheckpointSignature(signature)
                        : CompletableFuture.<Void>completedFuture(null));
    }

    @PreDestroy
    public void shutdown() {
        verificationExecutor.shutdown(1000);
    }

    boolean isBlockWellFormed(Block block) {
        if (!block.isPayloadConsistent()) {
            return drop("block", block, "payload does not match its root");
        }
        if (block.getHeight() <= 0) {
            return drop("block", block, "only the genesis block has height 0");
        }

        long slot = block.getHeader().getSlot();
        // Leadership is only checkable for epochs whose set and randomness this node has fixed.
        if (epochState.getEpochData(epochState.getEpochIndex(slot)).isPresent()
                && !leaderScheduler.isScheduled(block.getProposer(), slot)) {
            return drop("block", block, "proposer " + block.getProposer() + " is not scheduled for slot " + slot);
        }
        return true;
    }

    boolean isVoteWellFormed(Vote vote) {
        if (vote.getStage() == null || vote.getStage() == VoteStage.UNKNOWN) {
            return drop("vote", vote, "unknown stage");
        }
        if (!registry.getCurrentSnapshot().contains(vote.getValidator())) {
            return drop("vote", vote, "validator is not in the active set");
        }
        if (!vote.isSignatureValid()) {
            return drop("vote", vote, "bad signature");
        }
        return true;
    }

    boolean isCheckpointSignatureWellFormed(CheckpointSignature signature) {
        if (!registry.getCurrentSnapshot().contains(signature.getValidator())) {
            return drop("checkpoint signature", signature, "signer is not in the active set");
        }
        if (!signature.isSignatureValid()) {
            return drop("checkpoint signature", signature, "bad signature");
        }
        return true;
    }

    private boolean drop(String kind, Object message, String reason) {
        log.log(Level.WARNING, String.format("Dropped %s %s: %s", kind, message, reason));
        return false;
    }
}
