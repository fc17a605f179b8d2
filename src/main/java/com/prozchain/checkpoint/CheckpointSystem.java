package com.prozchain.checkpoint;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.checkpoint.CheckpointMonotonicityException;
import com.prozchain.exception.crypto.InvalidSignatureException;
import com.prozchain.exception.validator.UnknownValidatorException;
import com.prozchain.finality.FinalityGadget;
import com.prozchain.finality.QuorumCalculator;
import com.prozchain.forkchoice.ForkChoiceService;
import com.prozchain.network.PeerMessageCoordinator;
import com.prozchain.state.AbstractState;
import com.prozchain.storage.DBConstants;
import com.prozchain.storage.KVRepository;
import com.prozchain.storage.StateUtil;
import com.prozchain.storage.crypto.ValidatorKeyStore;
import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorRegistry;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;

/**
 * Collects validator signatures over blocks at every {@code checkpointInterval} height and seals a
 * {@link Checkpoint} once they reach the same quorum as the finality gadget. A sealed checkpoint is a
 * permanent lower bound for fork choice and finalizes its block if the gadget has not done so yet.
 */
@Log
@Component
public class CheckpointSystem extends AbstractState {

    private final ConsensusConfig config;
    private final ValidatorRegistry registry;
    private final FinalityGadget finalityGadget;
    private final ForkChoiceService forkChoice;
    private final KVRepository<String, Object> repository;
    private final PeerMessageCoordinator messageCoordinator;
    private final ValidatorKeyStore keyStore;
    private final QuorumCalculator quorum;

    private final NavigableMap<Long, Checkpoint> sealed = new TreeMap<>();
    // height -> block hash -> signer -> signature
    private final NavigableMap<Long, Map<Hash256, Map<ValidatorId, CheckpointSignature>>> collected = new TreeMap<>();
    private final Map<Hash256, Hash256> observedStateRoots = new HashMap<>();
    private final Set<Long> signedHeights = new HashSet<>();

    public CheckpointSystem(ConsensusConfig config,
                            ValidatorRegistry registry,
                            FinalityGadget finalityGadget,
                            ForkChoiceService forkChoice,
                            KVRepository<String, Object> repository,
                            PeerMessageCoordinator messageCoordinator,
                            ValidatorKeyStore keyStore) {
        this.config = config;
        this.registry = registry;
        this.finalityGadget = finalityGadget;
        this.forkChoice = forkChoice;
        this.repository = repository;
        this.messageCoordinator = messageCoordinator;
        this.keyStore = keyStore;
        this.quorum = QuorumCalculator.fromConfig(config);
    }

    @Override
    public void initializeFromDatabase() {
        Long latestHeight = repository.find(DBConstants.LATEST_CHECKPOINT_HEIGHT, null);
        if (latestHeight != null) {
            Checkpoint checkpoint = repository.find(
                    StateUtil.generateHeightKey(DBConstants.CHECKPOINT, latestHeight), null);
            if (checkpoint != null) {
                sealed.put(latestHeight, checkpoint);
                log.info("Loaded latest checkpoint " + checkpoint);
            }
        }
        initialized = true;
    }

    @Override
    public void persistState() {
        Map.Entry<Long, Checkpoint> latest = sealed.lastEntry();
        if (latest != null) {
            repository.save(StateUtil.generateHeightKey(DBConstants.CHECKPOINT, latest.getKey()), latest.getValue());
            repository.save(DBConstants.LATEST_CHECKPOINT_HEIGHT, latest.getKey());
        }
    }

    public boolean isCheckpointHeight(long height) {
        return height > 0 && height % config.getCheckpointInterval() == 0;
    }

    /**
     * Observes a block. At checkpoint heights the local validator signs and broadcasts the checkpoint
     * message, at most once per height.
     *
     * @return the checkpoint of this height if it is (or just got) sealed
     */
    public Optional<Checkpoint> onBlock(Block block) {
        long height = block.getHeight();
        if (!isCheckpointHeight(height)) {
            return Optional.empty();
        }
        if (sealed.containsKey(height) || isBelowLatest(height)) {
            return Optional.ofNullable(sealed.get(height));
        }

        observedStateRoots.put(block.getHash(), block.getHeader().getStateRoot());
        signLocally(height, block.getHash());
        return trySeal(height, block.getHash());
    }

    /**
     * Adds a signature from the network.
     *
     * @throws UnknownValidatorException if the signer is not a counting member of the active set
     * @throws InvalidSignatureException if the signature does not verify
     */
    public Optional<Checkpoint> onSignature(CheckpointSignature signature) {
        long height = signature.getHeight();
        if (!isCheckpointHeight(height)) {
            log.fine("Ignoring checkpoint signature for non checkpoint height " + height);
            return Optional.empty();
        }
        if (sealed.containsKey(height)) {
            return Optional.of(sealed.get(height));
        }
        if (isBelowLatest(height)) {
            return Optional.empty();
        }
        if (!registry.isCountable(signature.getValidator())) {
            throw new UnknownValidatorException("Checkpoint signer " + signature.getValidator() + " is not active");
        }
        if (!signature.isSignatureValid()) {
            throw new InvalidSignatureException("Invalid checkpoint signature " + signature);
        }

        collected.computeIfAbsent(height, h -> new HashMap<>())
                .computeIfAbsent(signature.getBlockHash(), h -> new LinkedHashMap<>())
                .putIfAbsent(signature.getValidator(), signature);
        return trySeal(height, signature.getBlockHash());
    }

    /**
     * Records a sealed checkpoint. Re-sealing the same checkpoint is a no-op.
     *
     * @throws CheckpointMonotonicityException if the height is below the latest sealed checkpoint or a
     *                                         different block was sealed at the same height
     */
    public Checkpoint seal(Checkpoint checkpoint) {
        long height = checkpoint.getHeight();
        Checkpoint existing = sealed.get(height);
        if (existing != null) {
            if (existing.getBlockHash().equals(checkpoint.getBlockHash())) {
                return existing;
            }
            throw new CheckpointMonotonicityException(String.format(
                    "Checkpoint at height %d already sealed for %s", height, existing.getBlockHash()));
        }
        if (isBelowLatest(height)) {
            throw new CheckpointMonotonicityException(String.format(
                    "Cannot seal checkpoint at height %d below latest sealed height %d", height, sealed.lastKey()));
        }

        sealed.put(height, checkpoint);
        collected.headMap(height, true).clear();
        persistState();
        log.log(Level.INFO, "Sealed " + checkpoint);

        forkChoice.onCheckpoint(height, checkpoint.getBlockHash());
        finalityGadget.finalizeCheckpoint(height, checkpoint.getBlockHash());
        return checkpoint;
    }

    public Optional<Checkpoint> getLatest() {
        return Optional.ofNullable(sealed.lastEntry()).map(Map.Entry::getValue);
    }

    public Optional<Checkpoint> get(long height) {
        Checkpoint checkpoint = sealed.get(height);
        if (checkpoint != null) {
            return Optional.of(checkpoint);
        }
        return repository.find(StateUtil.generateHeightKey(DBConstants.CHECKPOINT, height))
                .map(Checkpoint.class::cast);
    }

    public List<Long> getSealedHeights() {
        return new ArrayList<>(sealed.keySet());
    }

    private boolean isBelowLatest(long height) {
        return !sealed.isEmpty() && height < sealed.lastKey();
    }

    private void signLocally(long height, Hash256 blockHash) {
        if (signedHeights.contains(height)) {
            return;
        }
        Optional<ValidatorId> local = keyStore.getLocalValidator().filter(registry::isCountable);
        if (local.isEmpty()) {
            return;
        }

        keyStore.getKeyPair(local.get()).ifPresent(keyPair -> {
            CheckpointSignature signature = CheckpointSignature.sign(keyPair.getValue0(), local.get(), height, blockHash);
            signedHeights.add(height);
            collected.computeIfAbsent(height, h -> new HashMap<>())
                    .computeIfAbsent(blockHash, h -> new LinkedHashMap<>())
                    .putIfAbsent(signature.getValidator(), signature);
            messageCoordinator.broadcastCheckpointSignature(signature);
            log.fine("Signed checkpoint at height " + height);
        });
    }

    private Optional<Checkpoint> trySeal(long height, Hash256 blockHash) {
        Map<ValidatorId, CheckpointSignature> signatures = collected
                .getOrDefault(height, Map.of())
                .getOrDefault(blockHash, Map.of());
        Hash256 stateRoot = observedStateRoots.get(blockHash);
        if (stateRoot == null) {
            return Optional.empty();
        }

        List<ValidatorId> signers = signatures.keySet().stream()
                .filter(registry::isCountable)
                .toList();
        if (!quorum.hasQuorum(signers, registry::getVotingPower, registry.getTotalActivePower())) {
            return Optional.empty();
        }

        Checkpoint checkpoint = new Checkpoint(height, blockHash, stateRoot,
                signers.stream().map(signatures::get).toList(),
                quorum.votedPower(signers, registry::getVotingPower),
                registry.getTotalActivePower());
        Checkpoint result = seal(checkpoint);
        observedStateRoots.remove(blockHash);
        return Optional.of(result);
    }
}
