package com.prozchain.finality;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.finality.SafetyViolationException;
import com.prozchain.forkchoice.ForkChoiceService;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorRegistry;
import com.prozchain.validator.ValidatorSetChangeEvent;
import com.prozchain.validator.ValidatorSetChangeListener;
import lombok.extern.java.Log;
import org.apache.commons.collections4.map.LRUMap;
import org.javatuples.Quartet;
import org.jetbrains.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

/**
 * Two phase BFT voting state machine. Each candidate block moves
 * {@code PROPOSED -> PREPARED -> COMMITTED -> FINALIZED} once prepare and then commit votes from a stake
 * weighted supermajority are collected. Finalizing a block finalizes its non-final ancestors as well.
 * <p>
 * A block conflicting with finalized history is never finalized: if that would happen, the gadget raises a
 * {@link SafetyViolationException} and refuses to finalize anything afterwards.
 * <p>
 * In {@link FinalityMode#CONFIRMATION_DEPTH} votes are still collected but blocks are finalized once they are
 * buried {@code confirmationDepth} blocks deep on the canonical chain.
 * <p>
 * Not thread safe on its own, all calls are serialized by the consensus event loop.
 */
@Log
@Component
public class FinalityGadget implements ValidatorSetChangeListener {

    private static final int SETTLED_CACHE_SIZE = 4096;

    private final ConsensusConfig config;
    private final ValidatorRegistry registry;
    private final ForkChoiceService forkChoice;
    private final FinalizedBlockStore blockStore;
    private final QuorumCalculator quorum;

    private final Map<Hash256, BlockVotes> candidates = new HashMap<>();
    private final Map<Quartet<ValidatorId, Long, Long, VoteStage>, Hash256> castVotes = new HashMap<>();
    private final LRUMap<Hash256, CandidateState> settled = new LRUMap<>(SETTLED_CACHE_SIZE);
    private final PendingVoteBuffer pendingVotes;
    private final List<FinalityListener> listeners = new CopyOnWriteArrayList<>();

    private Block lastFinalized;
    private boolean halted;

    public FinalityGadget(ConsensusConfig config,
                          ValidatorRegistry registry,
                          ForkChoiceService forkChoice,
                          FinalizedBlockStore blockStore) {
        this.config = config;
        this.registry = registry;
        this.forkChoice = forkChoice;
        this.blockStore = blockStore;
        this.quorum = QuorumCalculator.fromConfig(config);
        this.pendingVotes = new PendingVoteBuffer(config.getVoteBufferSize());
    }

    /**
     * Starts from the given finalized block, which is also written to the finalized store if it is empty.
     */
    public void initialize(Block finalizedRoot) {
        if (blockStore.isEmpty()) {
            blockStore.append(finalizedRoot, FinalityRecord.builder()
                    .height(finalizedRoot.getHeight())
                    .blockHash(finalizedRoot.getHash())
                    .stateRoot(finalizedRoot.getHeader().getStateRoot())
                    .justification(FinalityJustification.CHECKPOINT)
                    .justifiedBy(finalizedRoot.getHash())
                    .build());
        }
        lastFinalized = finalizedRoot;
        candidates.clear();
        castVotes.clear();
        halted = false;
        log.fine("Finality gadget starting from " + finalizedRoot);
    }

    public void addListener(FinalityListener listener) {
        listeners.add(listener);
    }

    @Override
    public void validatorSetChanged(ValidatorSetChangeEvent event) {
        log.fine(String.format("Validator set of epoch %d active, re-evaluating %d candidates",
                event.getSnapshot().getEpoch(), candidates.size()));
        if (config.getFinalityMode() == FinalityMode.BFT) {
            sortedCandidates().forEach(this::tryAdvance);
        }
    }

    /**
     * Opens voting on a block and counts any votes that arrived before it.
     */
    public void onBlockProposed(Block block) {
        if (halted || block.getHeight() <= lastFinalized.getHeight() || candidates.containsKey(block.getHash())) {
            return;
        }

        BlockVotes candidate = new BlockVotes(block);
        candidates.put(block.getHash(), candidate);
        log.fine("Candidate proposed " + block);

        for (Vote vote : pendingVotes.takeFor(block.getHash())) {
            if (vote.getHeight() == block.getHeight()) {
                candidate.addVote(vote);
            }
        }
        tryAdvance(candidate);
    }

    /**
     * Records a vote whose signature the caller has already verified.
     */
    public VoteOutcome onVote(Vote vote) {
        if (halted) {
            log.fine("Finalization halted, ignoring " + vote);
            return VoteOutcome.REJECTED;
        }
        if (vote.getStage() == null || vote.getStage() == VoteStage.UNKNOWN) {
            return VoteOutcome.REJECTED;
        }
        if (!registry.isCountable(vote.getValidator())) {
            log.fine("Vote from non-counting validator " + vote.getValidator());
            return VoteOutcome.REJECTED;
        }

        BlockVotes candidate = candidates.get(vote.getBlockHash());
        if (candidate == null && vote.getHeight() <= lastFinalized.getHeight()) {
            boolean finalizedBlock = blockStore.getByHeight(vote.getHeight())
                    .map(block -> block.getHash().equals(vote.getBlockHash()))
                    .orElse(false);
            return finalizedBlock ? VoteOutcome.DUPLICATE : VoteOutcome.REJECTED;
        }
        if (candidate != null && candidate.getHeight() != vote.getHeight()) {
            log.fine("Vote height does not match its block " + vote);
            return VoteOutcome.REJECTED;
        }
        if (candidate == null && vote.getHeight() > lastFinalized.getHeight() + config.getVoteBufferHeightWindow()) {
            log.fine("Vote too far above finalized height " + vote);
            return VoteOutcome.REJECTED;
        }

        var key = Quartet.with(vote.getValidator(), vote.getHeight(), vote.getRound(), vote.getStage());
        Hash256 previous = castVotes.get(key);
        if (previous != null) {
            if (previous.equals(vote.getBlockHash())) {
                return VoteOutcome.DUPLICATE;
            }
            log.log(Level.WARNING, String.format("Validator %s voted for both %s and %s at height %d",
                    vote.getValidator(), previous, vote.getBlockHash(), vote.getHeight()));
            return VoteOutcome.EQUIVOCATION;
        }
        castVotes.put(key, vote.getBlockHash());

        if (candidate == null) {
            pendingVotes.add(vote);
            return VoteOutcome.BUFFERED;
        }

        if (!candidate.addVote(vote)) {
            // Same stage, different round: the validator's power already counts for this block.
            return VoteOutcome.DUPLICATE;
        }
        if (!candidate.getState().isTerminal()) {
            tryAdvance(candidate);
        }
        return VoteOutcome.ACCEPTED;
    }

    /**
     * Reacts to a new fork choice head: abandons candidates the head has left behind on another branch and,
     * in confirmation depth mode, finalizes deeply buried blocks.
     */
    public void onHeadChanged(Hash256 headHash) {
        if (halted) {
            return;
        }
        Optional<Block> head = forkChoice.getBlock(headHash);
        if (head.isEmpty()) {
            return;
        }
        long headHeight = head.get().getHeight();

        for (BlockVotes candidate : sortedCandidates()) {
            if (candidate.getState().isTerminal()) {
                continue;
            }
            boolean onHeadChain = forkChoice.isDescendantOf(headHash, candidate.getBlockHash());
            if (!onHeadChain && headHeight - candidate.getHeight() > config.getSafetyWindow()) {
                candidate.setState(CandidateState.ABANDONED);
                log.fine("Candidate abandoned " + candidate.getBlock());
            }
        }

        if (config.getFinalityMode() == FinalityMode.CONFIRMATION_DEPTH) {
            long targetHeight = headHeight - config.getConfirmationDepth();
            if (targetHeight > lastFinalized.getHeight()) {
                forkChoice.getPathFromRoot(headHash).stream()
                        .filter(block -> block.getHeight() == targetHeight)
                        .findFirst()
                        .ifPresent(block -> finalize(block, FinalityJustification.CONFIRMATION_DEPTH, null));
            }
        }
    }

    /**
     * Finalizes the block of a sealed checkpoint unless it already is.
     *
     * @throws SafetyViolationException if the checkpoint contradicts finalized history
     */
    public void finalizeCheckpoint(long height, Hash256 blockHash) {
        if (halted) {
            return;
        }
        if (height <= lastFinalized.getHeight()) {
            boolean consistent = blockStore.getByHeight(height)
                    .map(block -> block.getHash().equals(blockHash))
                    .orElse(false);
            if (!consistent) {
                raiseSafetyViolation(String.format("Checkpoint #%d %s contradicts finalized history", height, blockHash));
            }
            return;
        }

        Optional<Block> block = forkChoice.getBlock(blockHash);
        if (block.isEmpty()) {
            log.fine("Checkpoint block " + blockHash + " not known yet, finalization deferred");
            return;
        }
        finalize(block.get(), FinalityJustification.CHECKPOINT, null);
    }

    public Optional<CandidateState> getState(Hash256 blockHash) {
        BlockVotes candidate = candidates.get(blockHash);
        if (candidate != null) {
            return Optional.of(candidate.getState());
        }
        return Optional.ofNullable(settled.get(blockHash));
    }

    public Optional<BlockVotes> getCandidate(Hash256 blockHash) {
        return Optional.ofNullable(candidates.get(blockHash));
    }

    public Block getLastFinalized() {
        return lastFinalized;
    }

    public boolean isHalted() {
        return halted;
    }

    public int getPendingVoteCount() {
        return pendingVotes.size();
    }

    private void tryAdvance(BlockVotes candidate) {
        if (config.getFinalityMode() != FinalityMode.BFT || candidate.getState().isTerminal()) {
            return;
        }

        if (candidate.getState() == CandidateState.PROPOSED && hasQuorum(candidate.getPrepares())) {
            candidate.setState(CandidateState.PREPARED);
            log.fine("Candidate prepared " + candidate.getBlock());
        }

        // Commits that arrived while the block was still PROPOSED count from here on.
        if (candidate.getState() == CandidateState.PREPARED && hasQuorum(candidate.getCommits())) {
            candidate.setState(CandidateState.COMMITTED);
            log.fine("Candidate committed " + candidate.getBlock());
            finalize(candidate.getBlock(), FinalityJustification.QUORUM_CERTIFICATE, certificateFor(candidate));
        }
    }

    private boolean hasQuorum(Map<ValidatorId, Vote> votes) {
        return quorum.hasQuorum(countableVoters(votes), registry::getVotingPower, registry.getTotalActivePower());
    }

    private List<ValidatorId> countableVoters(Map<ValidatorId, Vote> votes) {
        return votes.keySet().stream()
                .filter(registry::isCountable)
                .toList();
    }

    private QuorumCertificate certificateFor(BlockVotes candidate) {
        List<ValidatorId> voters = countableVoters(candidate.getCommits());
        List<Vote> votes = voters.stream().map(candidate.getCommits()::get).toList();
        return new QuorumCertificate(candidate.getBlockHash(), candidate.getHeight(), VoteStage.COMMIT, votes,
                quorum.votedPower(voters, registry::getVotingPower), registry.getTotalActivePower());
    }

    private void finalize(Block block, FinalityJustification justification, @Nullable QuorumCertificate certificate) {
        if (block.getHeight() <= lastFinalized.getHeight()) {
            boolean alreadyFinal = blockStore.getByHeight(block.getHeight())
                    .map(existing -> existing.getHash().equals(block.getHash()))
                    .orElse(false);
            if (!alreadyFinal) {
                raiseSafetyViolation(String.format("Block %s conflicts with finalized block at height %d",
                        block, block.getHeight()));
            }
            return;
        }
        if (!forkChoice.contains(block.getHash())
                || !forkChoice.isDescendantOf(block.getHash(), lastFinalized.getHash())) {
            raiseSafetyViolation(String.format("Block %s does not descend from last finalized %s",
                    block, lastFinalized));
        }

        long round = certificate != null ? certificate.getRound() : 0;
        for (Block ancestor : forkChoice.getPathFromRoot(block.getHash())) {
            boolean target = ancestor.getHash().equals(block.getHash());
            FinalityRecord record = FinalityRecord.builder()
                    .height(ancestor.getHeight())
                    .blockHash(ancestor.getHash())
                    .stateRoot(ancestor.getHeader().getStateRoot())
                    .round(round)
                    .justification(target ? justification : FinalityJustification.ANCESTOR_OF_FINALIZED)
                    .justifiedBy(block.getHash())
                    .certificate(target ? certificate : null)
                    .build();

            try {
                blockStore.append(ancestor, record);
            } catch (SafetyViolationException e) {
                raiseSafetyViolation(e.getMessage());
            }

            BlockVotes votes = candidates.remove(ancestor.getHash());
            List<Vote> participants = List.of();
            if (votes != null) {
                votes.setState(CandidateState.FINALIZED);
                participants = votes.getParticipants();
            }
            settled.put(ancestor.getHash(), CandidateState.FINALIZED);
            lastFinalized = ancestor;

            log.log(Level.INFO, String.format("Finalized block #%d %s (%s)",
                    ancestor.getHeight(), ancestor.getHash(), record.getJustification()));
            FinalityEvent event = new FinalityEvent(this, ancestor, record, participants);
            listeners.forEach(listener -> listener.blockFinalized(event));
        }

        forkChoice.onFinalized(block.getHash());
        pruneBelow(block.getHeight());
    }

    private void pruneBelow(long finalizedHeight) {
        List<Hash256> stale = candidates.values().stream()
                .filter(candidate -> candidate.getHeight() <= finalizedHeight
                        || !forkChoice.contains(candidate.getBlockHash()))
                .map(BlockVotes::getBlockHash)
                .toList();
        stale.forEach(hash -> {
            candidates.remove(hash);
            settled.put(hash, CandidateState.ABANDONED);
        });

        castVotes.keySet().removeIf(key -> key.getValue1() <= finalizedHeight);
        int expired = pendingVotes.expireAtOrBelow(finalizedHeight);
        if (expired > 0) {
            log.fine("Expired " + expired + " pending votes at or below height " + finalizedHeight);
        }
    }

    private void raiseSafetyViolation(String message) {
        halted = true;
        log.log(Level.SEVERE, "SAFETY VIOLATION, finalization halted: " + message);
        throw new SafetyViolationException(message);
    }

    private List<BlockVotes> sortedCandidates() {
        List<BlockVotes> sorted = new ArrayList<>(candidates.values());
        sorted.sort(Comparator.comparingLong(BlockVotes::getHeight));
        return sorted;
    }
}
