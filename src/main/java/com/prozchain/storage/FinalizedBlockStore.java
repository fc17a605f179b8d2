package com.prozchain.storage;

import com.prozchain.block.Block;
import com.prozchain.exception.finality.SafetyViolationException;
import com.prozchain.finality.FinalityRecord;
import com.prozchain.state.AbstractState;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Append only table of finalized blocks keyed by height, the canonical history handed to the execution layer.
 */
@Log
@Component
public class FinalizedBlockStore extends AbstractState {

    private final KVRepository<String, Object> repository;
    private volatile long latestHeight = -1;

    public FinalizedBlockStore(KVRepository<String, Object> repository) {
        this.repository = repository;
    }

    @Override
    public void initializeFromDatabase() {
        Long stored = repository.find(DBConstants.LAST_FINALIZED_HEIGHT, null);
        latestHeight = stored != null ? stored : -1;
        initialized = true;
        log.fine("Finalized block store resumed at height " + latestHeight);
    }

    @Override
    public void persistState() {
        repository.save(DBConstants.LAST_FINALIZED_HEIGHT, latestHeight);
    }

    /**
     * Appends the next finalized block. Heights must be contiguous; re-appending the same block is a no-op.
     *
     * @throws SafetyViolationException if a different block is already stored at that height
     * @throws IllegalArgumentException if the height would leave a gap
     */
    public synchronized void append(Block block, FinalityRecord record) {
        long height = block.getHeight();
        Optional<Block> existing = getByHeight(height);
        if (existing.isPresent()) {
            if (existing.get().getHash().equals(block.getHash())) {
                return;
            }
            throw new SafetyViolationException(String.format("Height %d is already finalized as %s, refusing %s",
                    height, existing.get().getHash(), block.getHash()));
        }
        if (latestHeight >= 0 && height != latestHeight + 1) {
            throw new IllegalArgumentException(String.format(
                    "Finalized heights must be contiguous, expected %d but got %d", latestHeight + 1, height));
        }

        repository.save(StateUtil.generateHeightKey(DBConstants.FINALIZED_BLOCK, height), block);
        repository.save(StateUtil.generateHeightKey(DBConstants.FINALIZED_RECORD, height), record);
        latestHeight = height;
        persistState();
    }

    public Optional<Block> getByHeight(long height) {
        return repository.find(StateUtil.generateHeightKey(DBConstants.FINALIZED_BLOCK, height))
                .map(Block.class::cast);
    }

    public Optional<FinalityRecord> getRecord(long height) {
        return repository.find(StateUtil.generateHeightKey(DBConstants.FINALIZED_RECORD, height))
                .map(FinalityRecord.class::cast);
    }

    public Optional<Block> latest() {
        return latestHeight < 0 ? Optional.empty() : getByHeight(latestHeight);
    }

    public long getLatestHeight() {
        return latestHeight;
    }

    public boolean isEmpty() {
        return latestHeight < 0;
    }

    /**
     * Lazily reads finalized blocks starting at {@code fromHeight}. The stream ends at the first height that is
     * not finalized yet, so a consumer resumes by opening a new stream at the next height it has not seen.
     */
    public Stream<Block> stream(long fromHeight) {
        return LongStream.iterate(Math.max(0, fromHeight), height -> height + 1)
                .mapToObj(this::getByHeight)
                .takeWhile(Optional::isPresent)
                .map(Optional::get);
    }

    /**
     * Streams the finalized blocks whose slot lies in {@code [fromSlot, toSlot]}. Slots strictly increase with
     * height along a chain, so the first height is found by binary search.
     */
    public Stream<Block> streamBySlot(long fromSlot, long toSlot) {
        long low = 0;
        long high = latestHeight + 1;
        while (low < high) {
            long mid = (low + high) >>> 1;
            long slot = getByHeight(mid).map(block -> block.getHeader().getSlot()).orElse(Long.MAX_VALUE);
            if (slot < fromSlot) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return stream(low).takeWhile(block -> block.getHeader().getSlot() <= toSlot);
    }

    /**
     * @return whether finality has moved past {@code slot}, after which no block of a slot up to it can be
     * finalized any more
     */
    public boolean isFinalizedPast(long slot) {
        return latest().map(block -> block.getHeader().getSlot() > slot).orElse(false);
    }
}
