package com.prozchain.leader;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.state.AbstractState;
import com.prozchain.storage.DBConstants;
import com.prozchain.storage.FinalizedBlockStore;
import com.prozchain.storage.KVRepository;
import com.prozchain.storage.StateUtil;
import com.prozchain.types.Hash256;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.HashUtils;
import com.prozchain.validator.ValidatorSetSnapshot;
import lombok.Getter;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Slot and epoch arithmetic plus the per-epoch randomness used for leader selection.
 * <p>
 * The randomness of epoch {@code e} is {@code blake2b(randomness_(e-1) || digest_(e-2))}, where the digest folds
 * in the hashes of the finalized blocks whose slot lies in epoch {@code e - 2}. Sampling the epoch before the one
 * that just ended gives finality a whole epoch to settle that range, so every node holding the finalized history
 * derives the same value, while nobody can predict it before those blocks are final.
 */
@Log
@Component
public class EpochState extends AbstractState {

    public static final Hash256 GENESIS_RANDOMNESS =
            HashUtils.blake2bHash("prozchain-genesis-randomness".getBytes(StandardCharsets.UTF_8));

    @Getter
    private final long slotDurationMillis;
    @Getter
    private final long epochLength;
    @Getter
    private final long genesisSlotNumber;

    private final FinalizedBlockStore blockStore;
    private final KVRepository<String, Object> repository;

    private final Map<Long, Hash256> randomnessByEpoch = new HashMap<>();
    private final Map<Long, EpochData> epochDataByEpoch = new HashMap<>();

    private EpochData currentEpochData;

    public EpochState(ConsensusConfig config,
                      FinalizedBlockStore blockStore,
                      KVRepository<String, Object> repository) {
        this.slotDurationMillis = config.getSlotDuration().toMillis();
        this.epochLength = config.getEpochLength();
        this.genesisSlotNumber = config.getGenesisSlot();
        this.blockStore = blockStore;
        this.repository = repository;
        this.randomnessByEpoch.put(0L, GENESIS_RANDOMNESS);
        this.currentEpochData = new EpochData(0, ValidatorSetSnapshot.empty(0), GENESIS_RANDOMNESS);
    }

    @Override
    public synchronized void initializeFromDatabase() {
        Long latestEpoch = repository.find(DBConstants.LATEST_EPOCH, null);
        if (latestEpoch != null) {
            Hash256 stored = repository.find(StateUtil.generateEpochKey(DBConstants.EPOCH_RANDOMNESS, latestEpoch), null);
            if (stored != null) {
                randomnessByEpoch.put(latestEpoch, stored);
                log.fine(String.format("Loaded randomness %s of epoch %d", stored, latestEpoch));
            }
        }
        initialized = true;
    }

    @Override
    public synchronized void persistState() {
        randomnessByEpoch.forEach(this::persistRandomness);
    }

    public long getCurrentSlotNumber() {
        return getSlotNumber(Instant.now());
    }

    public long getSlotNumber(Instant instant) {
        return instant.toEpochMilli() / slotDurationMillis;
    }

    public Instant getSlotStartTime(long slotNumber) {
        return Instant.ofEpochMilli(slotNumber * slotDurationMillis);
    }

    // (slotNumber - genesisSlotNumber) / epochLength = epochIndex, rounded down
    public long getEpochIndex(long slotNumber) {
        if (slotNumber < genesisSlotNumber) {
            return 0;
        }
        return (slotNumber - genesisSlotNumber) / epochLength;
    }

    // epochIndex * epochLength + genesisSlot = epochStartSlotNumber
    public long getEpochStartSlotNumber(long epochIndex) {
        return epochIndex * epochLength + genesisSlotNumber;
    }

    // Range of an epoch is [start, start + epochLength)
    public long getEpochEndSlotNumber(long epochIndex) {
        return getEpochStartSlotNumber(epochIndex) + epochLength - 1;
    }

    public boolean isLastSlotOfEpoch(long slotNumber) {
        return slotNumber == getEpochEndSlotNumber(getEpochIndex(slotNumber));
    }

    /**
     * @return the randomness of the epoch, deriving it from finalized history if this node has not fixed it yet
     */
    public synchronized Hash256 getRandomness(long epochIndex) {
        Hash256 known = knownRandomness(epochIndex);
        if (known != null) {
            return known;
        }

        long from = epochIndex - 1;
        while (knownRandomness(from) == null) {
            from--;
        }
        Hash256 randomness = knownRandomness(from);
        for (long epoch = from + 1; epoch <= epochIndex; epoch++) {
            randomness = deriveNextRandomness(randomness, finalizedDigest(epoch - 2));
            randomnessByEpoch.put(epoch, randomness);
            persistRandomness(epoch, randomness);
        }
        return randomness;
    }

    /**
     * Fixes the validator set of an epoch and makes it current. The randomness comes from
     * {@link #getRandomness(long)}, so switching to the same epoch again, here or after a restart, yields the same
     * value.
     */
    public synchronized EpochData switchEpoch(long epochIndex, ValidatorSetSnapshot snapshot) {
        Hash256 randomness = getRandomness(epochIndex);
        currentEpochData = new EpochData(epochIndex, snapshot, randomness);
        epochDataByEpoch.put(epochIndex, currentEpochData);
        log.fine(String.format("Switched to epoch %d with randomness %s", epochIndex, randomness));
        return currentEpochData;
    }

    public synchronized EpochData getCurrentEpochData() {
        return currentEpochData;
    }

    public synchronized Optional<EpochData> getEpochData(long epochIndex) {
        return Optional.ofNullable(epochDataByEpoch.get(epochIndex));
    }

    /**
     * @return the data of the epoch the slot belongs to, or the current epoch's if this node never switched to it
     */
    public synchronized EpochData getEpochDataForSlot(long slotNumber) {
        return epochDataByEpoch.getOrDefault(getEpochIndex(slotNumber), currentEpochData);
    }

    public static Hash256 deriveNextRandomness(Hash256 previous, Hash256 digest) {
        return HashUtils.blake2bHash(new CanonicalWriter()
                .writeHash(previous)
                .writeHash(digest)
                .toByteArray());
    }

    /**
     * Folds the hashes of the finalized blocks of an epoch, in height order, into one digest.
     */
    public Hash256 finalizedDigest(long epochIndex) {
        if (epochIndex < 0) {
            return Hash256.empty();
        }

        long endSlot = getEpochEndSlotNumber(epochIndex);
        if (!blockStore.isFinalizedPast(endSlot)) {
            log.log(Level.WARNING, String.format(
                    "Finality has not passed the end of epoch %d, randomness derived from it may differ from peers",
                    epochIndex));
        }

        // Slots before the genesis slot count towards epoch 0.
        long startSlot = epochIndex == 0 ? 0 : getEpochStartSlotNumber(epochIndex);
        Hash256 digest = Hash256.empty();
        for (Block block : blockStore.streamBySlot(startSlot, endSlot).toList()) {
            digest = HashUtils.blake2bHash(new CanonicalWriter()
                    .writeHash(digest)
                    .writeHash(block.getHash())
                    .toByteArray());
        }
        return digest;
    }

    private Hash256 knownRandomness(long epochIndex) {
        if (epochIndex <= 0) {
            return GENESIS_RANDOMNESS;
        }
        Hash256 randomness = randomnessByEpoch.get(epochIndex);
        if (randomness == null) {
            randomness = repository.find(StateUtil.generateEpochKey(DBConstants.EPOCH_RANDOMNESS, epochIndex), null);
            if (randomness != null) {
                randomnessByEpoch.put(epochIndex, randomness);
            }
        }
        return randomness;
    }

    private void persistRandomness(long epochIndex, Hash256 randomness) {
        repository.save(StateUtil.generateEpochKey(DBConstants.EPOCH_RANDOMNESS, epochIndex), randomness);
    }
}
