package com.prozchain.consensus;

import com.prozchain.block.Block;
import com.prozchain.checkpoint.CheckpointSignature;
import com.prozchain.checkpoint.CheckpointSystem;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.ConsensusGenericException;
import com.prozchain.exception.finality.SafetyViolationException;
import com.prozchain.exception.forkchoice.InvalidAncestryException;
import com.prozchain.finality.CandidateState;
import com.prozchain.finality.FinalityEvent;
import com.prozchain.finality.FinalityGadget;
import com.prozchain.finality.FinalityJustification;
import com.prozchain.finality.FinalityListener;
import com.prozchain.finality.Vote;
import com.prozchain.finality.VoteOutcome;
import com.prozchain.finality.VoteStage;
import com.prozchain.forkchoice.ForkChoiceService;
import com.prozchain.leader.EpochState;
import com.prozchain.leader.LeaderScheduler;
import com.prozchain.leader.coordinator.SlotChangeEvent;
import com.prozchain.leader.coordinator.SlotChangeListener;
import com.prozchain.network.PeerMessageCoordinator;
import com.prozchain.reward.RewardCalculator;
import com.prozchain.slashing.EquivocationDetector;
import com.prozchain.slashing.SlashingEvidence;
import com.prozchain.slashing.SlashingManager;
import com.prozchain.slashing.SlashingOutcome;
import com.prozchain.state.StateManager;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.storage.crypto.ValidatorKeyStore;
import com.prozchain.treasury.StakeTreasury;
import com.prozchain.types.Hash256;
import com.prozchain.utils.async.AsyncExecutor;
import com.prozchain.validator.Validator;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorRegistry;
import com.prozchain.validator.ValidatorSetSnapshot;
import jakarta.annotation.PreDestroy;
import lombok.extern.java.Log;
import org.javatuples.Pair;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Single writer event loop of the consensus state. Blocks, votes, checkpoint signatures and slot ticks may be
 * submitted from any thread; they are applied one at a time in submission order on a dedicated thread, so
 * the registry, fork choice, gadget and checkpoint records only ever change from that thread.
 * <p>
 * When the node holds an active validator key it also takes part: it produces blocks in its slots, votes on
 * the blocks it sees on the canonical chain and never signs two different blocks at the same height.
 */
@Log
@Component
public class ConsensusCore implements SlotChangeListener, FinalityListener {

    private static final long VOTE_ROUND = 0;

    private final ConsensusConfig config;
    private final StateManager stateManager;
    private final ValidatorRegistry registry;
    private final EpochState epochState;
    private final LeaderScheduler leaderScheduler;
    private final ForkChoiceService forkChoice;
    private final FinalityGadget finalityGadget;
    private final CheckpointSystem checkpointSystem;
    private final EquivocationDetector equivocationDetector;
    private final SlashingManager slashingManager;
    private final RewardCalculator rewardCalculator;
    private final StakeTreasury treasury;
    private final FinalizedBlockStore blockStore;
    private final ValidatorKeyStore keyStore;
    private final PeerMessageCoordinator messageCoordinator;
    private final Clock clock;

    private final AsyncExecutor eventLoop = AsyncExecutor.withSingleThread();

    // height -> block this node voted for, per stage
    private final Map<Pair<Long, VoteStage>, Hash256> ownVotes = new HashMap<>();
    private final Set<Long> producedSlots = new HashSet<>();

    private boolean started;

    public ConsensusCore(ConsensusConfig config,
                         StateManager stateManager,
                         EpochState epochState,
                         LeaderScheduler leaderScheduler,
                         ForkChoiceService forkChoice,
                         FinalityGadget finalityGadget,
                         EquivocationDetector equivocationDetector,
                         SlashingManager slashingManager,
                         RewardCalculator rewardCalculator,
                         StakeTreasury treasury,
                         ValidatorKeyStore keyStore,
                         PeerMessageCoordinator messageCoordinator,
                         Clock clock) {
        this.config = config;
        this.stateManager = stateManager;
        this.registry = stateManager.getValidatorRegistry();
        this.blockStore = stateManager.getFinalizedBlockStore();
        this.checkpointSystem = stateManager.getCheckpointSystem();
        this.epochState = epochState;
        this.leaderScheduler = leaderScheduler;
        this.forkChoice = forkChoice;
        this.finalityGadget = finalityGadget;
        this.equivocationDetector = equivocationDetector;
        this.slashingManager = slashingManager;
        this.rewardCalculator = rewardCalculator;
        this.treasury = treasury;
        this.keyStore = keyStore;
        this.messageCoordinator = messageCoordinator;
        this.clock = clock;

        registry.addListener(leaderScheduler);
        registry.addListener(finalityGadget);
        finalityGadget.addListener(equivocationDetector);
        finalityGadget.addListener(this);
    }

    /**
     * Restores persisted state, fixes the validator set of the first epoch if none exists yet and anchors fork
     * choice and finality at the latest finalized block, or at {@code genesis} on a fresh node.
     */
    public synchronized void start(Block genesis) {
        if (started) {
            return;
        }
        stateManager.initializeFromDatabase();

        long epoch = epochState.getEpochIndex(epochState.getSlotNumber(clock.instant()));
        if (registry.getCurrentSnapshot().isEmpty()) {
            registry.rotate(epoch);
        } else {
            ValidatorSetSnapshot snapshot = registry.getCurrentSnapshot();
            epochState.switchEpoch(snapshot.getEpoch(), snapshot);
        }

        Block root = blockStore.latest().orElse(genesis);
        forkChoice.initialize(root);
        finalityGadget.initialize(root);
        started = true;
        log.log(Level.INFO, String.format("Consensus started at #%d %s with %d validators",
                root.getHeight(), root.getHash(), registry.getCurrentSnapshot().size()));
    }

    @PreDestroy
    public void stop() {
        stateManager.persistState();
        eventLoop.shutdown(1000);
    }

    public CompletableFuture<Hash256> submitBlock(Block block) {
        return eventLoop.executeAsync(() -> processBlock(block));
    }

    public CompletableFuture<VoteOutcome> submitVote(Vote vote) {
        return eventLoop.executeAsync(() -> processVote(vote));
    }

    public CompletableFuture<Void> submitCheckpointSignature(CheckpointSignature signature) {
        return eventLoop.executeAsync(() -> processCheckpointSignature(signature));
    }

    @Override
    public void slotChanged(SlotChangeEvent event) {
        eventLoop.executeAndForget(() -> onSlot(event.getSlotNumber(), event.isLastSlotFromCurrentEpoch()));
    }

    /**
     * Runs the duties of a new slot: epoch rotation on the last slot of an epoch, expiring orphan blocks and
     * block production when this node leads the slot. Backups get a delayed check once the primary's window
     * has passed.
     */
    public CompletableFuture<Void> submitSlot(long slot, boolean lastSlotOfEpoch) {
        return eventLoop.executeAsync(() -> onSlot(slot, lastSlotOfEpoch));
    }

    private void onSlot(long slot, boolean lastSlotOfEpoch) {
        if (!started) {
            return;
        }
        if (lastSlotOfEpoch) {
            registry.rotate(epochState.getEpochIndex(slot) + 1);
        }

        int expired = forkChoice.expirePendingBlocks(clock.instant());
        if (expired > 0) {
            log.fine("Expired " + expired + " orphan blocks");
        }

        Optional<ValidatorId> local = localValidator();
        if (local.isEmpty() || registry.getCurrentSnapshot().isEmpty()) {
            return;
        }

        int position = leaderScheduler.positionInSlot(local.get(), slot);
        if (position == 0) {
            produceBlock(local.get(), slot);
        } else if (position > 0) {
            long delay = config.getLeaderTimeout().toMillis() * position;
            CompletableFuture.runAsync(() -> eventLoop.executeAndForget(() -> produceAsBackup(local.get(), slot)),
                    CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS));
        }
    }

    private void produceAsBackup(ValidatorId local, long slot) {
        boolean slotFilled = forkChoice.getBlocks().stream().anyMatch(block -> block.getHeader().getSlot() == slot);
        Duration elapsed = Duration.between(epochState.getSlotStartTime(slot), clock.instant());
        if (!slotFilled && leaderScheduler.isEntitled(local, slot, elapsed)) {
            produceBlock(local, slot);
        }
    }

    private void produceBlock(ValidatorId proposer, long slot) {
        if (!producedSlots.add(slot) || finalityGadget.isHalted()) {
            return;
        }
        Block parent = forkChoice.getHeadBlock();
        if (parent.getHeader().getSlot() >= slot) {
            log.fine("Head already at slot " + parent.getHeader().getSlot() + ", skipping production for " + slot);
            return;
        }

        Block block = Block.create(parent.getHash(), parent.getHeight() + 1, parent.getHeader().getStateRoot(),
                proposer, slot, clock.millis(), List.of());
        log.log(Level.INFO, String.format("Produced block #%d %s in slot %d", block.getHeight(), block.getHash(), slot));
        processBlock(block);
        messageCoordinator.broadcastBlock(block);
    }

    Hash256 processBlock(Block block) {
        try {
            forkChoice.onBlock(block, clock.instant());
            for (Block imported : forkChoice.takeImportedBlocks()) {
                finalityGadget.onBlockProposed(imported);
                checkpointSystem.onBlock(imported);
            }
            afterStateChange();
            return forkChoice.getHead();
        } catch (InvalidAncestryException e) {
            log.log(Level.WARNING, "Rejected block " + block + ": " + e.getMessage());
            return forkChoice.getHead();
        } catch (SafetyViolationException e) {
            return forkChoice.getHead();
        }
    }

    VoteOutcome processVote(Vote vote) {
        equivocationDetector.observe(vote).ifPresent(this::processEvidence);

        VoteOutcome outcome;
        try {
            outcome = finalityGadget.onVote(vote);
        } catch (SafetyViolationException e) {
            return VoteOutcome.REJECTED;
        }
        if (outcome == VoteOutcome.ACCEPTED || outcome == VoteOutcome.BUFFERED) {
            forkChoice.onVote(vote.getValidator(), vote.getBlockHash(), vote.getHeight());
        }
        afterStateChange();
        return outcome;
    }

    Void processCheckpointSignature(CheckpointSignature signature) {
        try {
            checkpointSystem.onSignature(signature);
        } catch (SafetyViolationException e) {
            log.log(Level.SEVERE, "Checkpoint conflicts with finalized history: " + e.getMessage());
        } catch (ConsensusGenericException e) {
            log.log(Level.WARNING, "Dropped checkpoint signature " + signature + ": " + e.getMessage());
        }
        return null;
    }

    SlashingOutcome processEvidence(SlashingEvidence evidence) {
        return slashingManager.processEvidence(evidence);
    }

    private void afterStateChange() {
        if (finalityGadget.isHalted()) {
            return;
        }
        try {
            finalityGadget.onHeadChanged(forkChoice.getHead());
            castOwnVotes();
        } catch (SafetyViolationException e) {
            log.log(Level.SEVERE, "Finalization halted: " + e.getMessage());
        }
    }

    // Prepare the canonical chain above the finalized block, commit whatever got prepared.
    private void castOwnVotes() {
        Optional<ValidatorId> local = localValidator();
        if (local.isEmpty()) {
            return;
        }

        for (Block block : forkChoice.getPathFromRoot(forkChoice.getHead())) {
            castOwnVote(local.get(), block, VoteStage.PREPARE);
            boolean prepared = finalityGadget.getState(block.getHash())
                    .map(state -> state == CandidateState.PREPARED)
                    .orElse(false);
            if (prepared) {
                castOwnVote(local.get(), block, VoteStage.COMMIT);
            }
        }
    }

    private void castOwnVote(ValidatorId local, Block block, VoteStage stage) {
        var key = Pair.with(block.getHeight(), stage);
        if (ownVotes.containsKey(key) || block.getHeight() <= finalityGadget.getLastFinalized().getHeight()) {
            return;
        }
        Optional<Vote> vote = keyStore.getKeyPair(local).map(keyPair -> Vote.sign(keyPair.getValue0(), local,
                block.getHash(), block.getHeight(), VOTE_ROUND, stage));
        if (vote.isEmpty()) {
            return;
        }

        ownVotes.put(key, block.getHash());
        messageCoordinator.broadcastVote(vote.get());
        processVote(vote.get());
    }

    @Override
    public void blockFinalized(FinalityEvent event) {
        Block block = event.getBlock();
        ownVotes.keySet().removeIf(key -> key.getValue0() <= block.getHeight());

        if (event.getRecord().getJustification() != FinalityJustification.QUORUM_CERTIFICATE) {
            return;
        }

        ValidatorSetSnapshot snapshot = registry.getCurrentSnapshot();
        Map<ValidatorId, BigInteger> rewards = rewardCalculator.calculate(block, event.getParticipants(), snapshot);
        treasury.applyReward(rewards);

        Set<ValidatorId> voters = new HashSet<>();
        event.getParticipants().forEach(vote -> voters.add(vote.getValidator()));
        for (ValidatorId validator : snapshot.getValidators()) {
            boolean voted = voters.contains(validator);
            registry.recordParticipation(validator, voted);
            if (!voted) {
                reportIfUnavailable(validator, block.getHeight());
            }
        }
    }

    // Penalize every full run of missed votes once, not every miss after the threshold.
    private void reportIfUnavailable(ValidatorId validator, long height) {
        long misses = registry.getValidator(validator).map(Validator::getConsecutiveMisses).orElse(0L);
        long threshold = config.getUnavailabilityThreshold();
        if (threshold <= 0 || misses == 0 || misses % threshold != 0) {
            return;
        }
        equivocationDetector.reportUnavailability(validator, misses, height).ifPresent(this::processEvidence);
    }

    private Optional<ValidatorId> localValidator() {
        return keyStore.getLocalValidator().filter(registry::isCountable);
    }

    public Hash256 getHead() {
        return forkChoice.getHead();
    }

    public boolean isStarted() {
        return started;
    }

    public Instant now() {
        return clock.instant();
    }
}
