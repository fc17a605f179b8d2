package com.prozchain.forkchoice;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.forkchoice.BlockNotFoundException;
import com.prozchain.exception.forkchoice.InvalidAncestryException;
import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorRegistry;
import lombok.extern.java.Log;
import org.apache.commons.collections4.map.LRUMap;
import org.javatuples.Pair;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;

/**
 * Keeps the tree of non-finalized blocks and the latest vote of every validator, and selects the canonical
 * head with the configured {@link ForkChoiceStrategy}.
 * <p>
 * Blocks whose parent is not known yet are held in a bounded pending queue until the parent arrives or
 * the orphan timeout passes.
 */
@Log
@Component
public class ForkChoiceService {

    private final ConsensusConfig config;
    private final ValidatorRegistry registry;

    private final ArrayDeque<Pair<Instant, Block>> pendingBlocksQueue = new ArrayDeque<>();
    private final Map<ValidatorId, Pair<Hash256, Long>> latestVotes = new HashMap<>();
    private final LRUMap<Hash256, Long> prunedBlocks;
    private final List<Block> importedBlocks = new ArrayList<>();

    private BlockTree blockTree;
    private Hash256 head;
    private Pair<Hash256, Long> checkpoint;

    public ForkChoiceService(ConsensusConfig config, ValidatorRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.prunedBlocks = new LRUMap<>(Math.max(16, config.getOrphanBufferSize() * 4));
    }

    public synchronized void initialize(Block root) {
        blockTree = new BlockTree(root);
        head = root.getHash();
        checkpoint = Pair.with(root.getHash(), root.getHeight());
        pendingBlocksQueue.clear();
        latestVotes.clear();
        importedBlocks.clear();
        log.fine("Fork choice initialized at " + root);
    }

    /**
     * Integrates a block into the tree.
     *
     * @return the head after the block was processed
     * @throws InvalidAncestryException if the block conflicts with the finalized chain or the latest checkpoint
     */
    public synchronized Hash256 onBlock(Block block, Instant arrivalTime) {
        ensureInitialized();

        if (blockTree.contains(block.getHash()) || isPending(block.getHash())) {
            log.fine("Skipping known block " + block);
            return head;
        }

        Block root = blockTree.getRoot();
        if (block.getHeight() <= root.getHeight()) {
            throw new InvalidAncestryException(String.format(
                    "Block %s is at or below finalized height %d", block, root.getHeight()));
        }
        if (prunedBlocks.containsKey(block.getParentHash())) {
            throw new InvalidAncestryException(String.format(
                    "Block %s builds on %s, which conflicts with the finalized chain", block, block.getParentHash()));
        }

        if (!blockTree.contains(block.getParentHash())) {
            addBlockToQueue(block, arrivalTime);
            return head;
        }

        addBlockToTree(block);
        processPendingChildren(block.getHash());

        return updateHead();
    }

    /**
     * Records the vote as the validator's latest message if it is higher than the previous one.
     */
    public synchronized void onVote(ValidatorId validator, Hash256 blockHash, long height) {
        Pair<Hash256, Long> previous = latestVotes.get(validator);
        if (previous != null && previous.getValue1() >= height) {
            return;
        }
        latestVotes.put(validator, Pair.with(blockHash, height));
        if (blockTree != null && blockTree.contains(blockHash)) {
            updateHead();
        }
    }

    /**
     * Moves the root of the tree to the newly finalized block and drops every branch that conflicts with it.
     */
    public synchronized void onFinalized(Hash256 finalizedHash) {
        ensureInitialized();
        if (finalizedHash.equals(blockTree.getRootHash())) {
            return;
        }
        if (!blockTree.contains(finalizedHash)) {
            throw new BlockNotFoundException("Finalized block " + finalizedHash + " is not in the fork choice tree");
        }

        long finalizedHeight = blockTree.getOrThrow(finalizedHash).getHeight();
        Set<Hash256> removed = blockTree.prune(finalizedHash);
        removed.forEach(hash -> prunedBlocks.put(hash, finalizedHeight));
        pendingBlocksQueue.removeIf(pair -> pair.getValue1().getHeight() <= finalizedHeight);

        if (checkpoint.getValue1() < finalizedHeight) {
            checkpoint = Pair.with(finalizedHash, finalizedHeight);
        }

        log.fine(String.format("Fork choice root moved to #%d %s, pruned %d blocks",
                finalizedHeight, finalizedHash, removed.size()));
        updateHead();
    }

    /**
     * Raises the lower bound for future blocks to a sealed checkpoint.
     */
    public synchronized void onCheckpoint(long height, Hash256 blockHash) {
        ensureInitialized();
        if (height <= checkpoint.getValue1()) {
            return;
        }
        if (blockTree.contains(blockHash) && !blockTree.isDescendantOf(blockHash, blockTree.getRootHash())) {
            throw new InvalidAncestryException("Checkpoint " + blockHash + " does not descend from the finalized root");
        }
        checkpoint = Pair.with(blockHash, height);
        updateHead();
    }

    /**
     * Drops pending blocks whose parent did not arrive within the orphan timeout.
     *
     * @return the number of discarded blocks
     */
    public synchronized int expirePendingBlocks(Instant now) {
        Instant cutoff = now.minus(config.getOrphanTimeout());
        int expired = 0;
        Iterator<Pair<Instant, Block>> iterator = pendingBlocksQueue.iterator();
        while (iterator.hasNext()) {
            Pair<Instant, Block> pending = iterator.next();
            if (pending.getValue0().isBefore(cutoff)) {
                iterator.remove();
                expired++;
                log.fine("Discarded orphan block " + pending.getValue1() + " after timeout");
            }
        }
        return expired;
    }

    public synchronized Hash256 getHead() {
        ensureInitialized();
        return head;
    }

    public synchronized Block getHeadBlock() {
        ensureInitialized();
        return blockTree.getOrThrow(head);
    }

    public synchronized Optional<Block> getBlock(Hash256 hash) {
        ensureInitialized();
        return blockTree.get(hash);
    }

    public synchronized boolean contains(Hash256 hash) {
        return blockTree != null && blockTree.contains(hash);
    }

    public synchronized Hash256 getFinalizedRoot() {
        ensureInitialized();
        return blockTree.getRootHash();
    }

    public synchronized Pair<Hash256, Long> getCheckpoint() {
        return checkpoint;
    }

    public synchronized boolean isDescendantOf(Hash256 descendant, Hash256 ancestor) {
        ensureInitialized();
        return blockTree.isDescendantOf(descendant, ancestor);
    }

    public synchronized Hash256 lowestCommonAncestor(Hash256 first, Hash256 second) {
        ensureInitialized();
        return blockTree.lowestCommonAncestor(first, second);
    }

    /**
     * @return blocks above the finalized root up to and including {@code hash}, ascending by height
     */
    public synchronized List<Block> getPathFromRoot(Hash256 hash) {
        ensureInitialized();
        return blockTree.getPathFromRoot(hash);
    }

    public synchronized List<Block> getBlocks() {
        ensureInitialized();
        return blockTree.getBlocks();
    }

    /**
     * Returns and forgets the blocks attached to the tree since the last call, including pending blocks that
     * were re-integrated when their parent arrived. Ascending by height within each import.
     */
    public synchronized List<Block> takeImportedBlocks() {
        List<Block> imported = new ArrayList<>(importedBlocks);
        importedBlocks.clear();
        return imported;
    }

    public synchronized int getPendingCount() {
        return pendingBlocksQueue.size();
    }

    private void addBlockToTree(Block block) {
        checkCheckpointAncestry(block);
        blockTree.add(block);
        importedBlocks.add(block);
        log.fine(String.format("Added block No: %d with hash: %s to block tree.", block.getHeight(), block.getHash()));
    }

    private void checkCheckpointAncestry(Block block) {
        Hash256 checkpointHash = checkpoint.getValue0();
        long checkpointHeight = checkpoint.getValue1();
        if (!blockTree.contains(checkpointHash)) {
            return;
        }

        boolean consistent = block.getHeight() > checkpointHeight
                ? blockTree.isDescendantOf(block.getParentHash(), checkpointHash)
                : blockTree.getAncestorAtHeight(checkpointHash, block.getHeight() - 1)
                .map(ancestor -> ancestor.getHash().equals(block.getParentHash()))
                .orElse(false);

        if (!consistent) {
            throw new InvalidAncestryException(String.format(
                    "Block %s does not descend from checkpoint #%d %s", block, checkpointHeight, checkpointHash));
        }
    }

    private void addBlockToQueue(Block block, Instant arrivalTime) {
        if (pendingBlocksQueue.size() >= config.getOrphanBufferSize()) {
            Pair<Instant, Block> dropped = pendingBlocksQueue.poll();
            log.fine("Orphan buffer full, dropped " + dropped.getValue1());
        }
        pendingBlocksQueue.add(Pair.with(arrivalTime, block));
        log.fine("Added block to queue " + block.getHeight() + " " + block.getHash());
    }

    // Children may themselves unlock further pending blocks, so keep going until nothing attaches.
    private void processPendingChildren(Hash256 parentHash) {
        ArrayDeque<Hash256> parents = new ArrayDeque<>();
        parents.add(parentHash);

        while (!parents.isEmpty()) {
            Hash256 parent = parents.poll();
            List<Block> children = new ArrayList<>();
            pendingBlocksQueue.removeIf(pair -> {
                if (pair.getValue1().getParentHash().equals(parent)) {
                    children.add(pair.getValue1());
                    return true;
                }
                return false;
            });

            for (Block child : children) {
                try {
                    addBlockToTree(child);
                    parents.add(child.getHash());
                } catch (InvalidAncestryException ex) {
                    log.log(Level.WARNING, String.format("[%s] %s", child.getHash(), ex.getMessage()));
                }
            }
        }
    }

    private boolean isPending(Hash256 hash) {
        return pendingBlocksQueue.stream().anyMatch(pair -> pair.getValue1().getHash().equals(hash));
    }

    private Hash256 updateHead() {
        Hash256 newHead = config.getForkChoiceStrategy().selectHead(blockTree, latestVotes, registry::getVotingPower);

        // The head may never fall behind the checkpoint once the checkpoint block is in the tree.
        Hash256 checkpointHash = checkpoint.getValue0();
        if (blockTree.contains(checkpointHash) && !blockTree.isDescendantOf(newHead, checkpointHash)) {
            newHead = checkpointHash;
        }

        if (!newHead.equals(head)) {
            log.fine("New head " + newHead);
            head = newHead;
        }
        return head;
    }

    private void ensureInitialized() {
        if (blockTree == null) {
            throw new IllegalStateException("Fork choice has not been initialized with a root block");
        }
    }
}
