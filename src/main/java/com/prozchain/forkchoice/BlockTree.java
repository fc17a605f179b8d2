package com.prozchain.forkchoice;

import com.prozchain.block.Block;
import com.prozchain.exception.forkchoice.BlockNotFoundException;
import com.prozchain.exception.forkchoice.InvalidAncestryException;
import com.prozchain.types.Hash256;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arena of non-finalized blocks rooted at the latest finalized block. Parent links are lookups by hash.
 * Not thread safe, callers serialize access.
 */
public class BlockTree {

    private final Map<Hash256, Block> blocks = new HashMap<>();
    private final Map<Hash256, List<Hash256>> children = new HashMap<>();
    private Hash256 rootHash;

    public BlockTree(Block root) {
        this.rootHash = root.getHash();
        blocks.put(rootHash, root);
        children.put(rootHash, new ArrayList<>());
    }

    public Block getRoot() {
        return blocks.get(rootHash);
    }

    public Hash256 getRootHash() {
        return rootHash;
    }

    public boolean contains(Hash256 hash) {
        return blocks.containsKey(hash);
    }

    public Optional<Block> get(Hash256 hash) {
        return Optional.ofNullable(blocks.get(hash));
    }

    public Block getOrThrow(Hash256 hash) {
        Block block = blocks.get(hash);
        if (block == null) {
            throw new BlockNotFoundException("Block " + hash + " is not in the tree");
        }
        return block;
    }

    public int size() {
        return blocks.size();
    }

    public void add(Block block) {
        Hash256 parentHash = block.getParentHash();
        Block parent = blocks.get(parentHash);
        if (parent == null) {
            throw new BlockNotFoundException("Parent " + parentHash + " of " + block + " is not in the tree");
        }
        if (block.getHeight() != parent.getHeight() + 1) {
            throw new InvalidAncestryException(String.format("Block %s has height %d but its parent has height %d",
                    block.getHash(), block.getHeight(), parent.getHeight()));
        }
        if (block.getHeader().getSlot() <= parent.getHeader().getSlot()) {
            throw new InvalidAncestryException(String.format("Block %s is in slot %d, not after its parent's slot %d",
                    block.getHash(), block.getHeader().getSlot(), parent.getHeader().getSlot()));
        }

        blocks.put(block.getHash(), block);
        children.put(block.getHash(), new ArrayList<>());
        children.get(parentHash).add(block.getHash());
    }

    public List<Hash256> getChildren(Hash256 hash) {
        return Collections.unmodifiableList(children.getOrDefault(hash, List.of()));
    }

    /**
     * @return true if {@code descendant} equals {@code ancestor} or lies in its subtree
     */
    public boolean isDescendantOf(Hash256 descendant, Hash256 ancestor) {
        Block ancestorBlock = blocks.get(ancestor);
        Block current = blocks.get(descendant);
        if (ancestorBlock == null || current == null) {
            return false;
        }

        while (current != null && current.getHeight() > ancestorBlock.getHeight()) {
            current = blocks.get(current.getParentHash());
        }
        return current != null && current.getHash().equals(ancestor);
    }

    public Hash256 lowestCommonAncestor(Hash256 first, Hash256 second) {
        Block a = getOrThrow(first);
        Block b = getOrThrow(second);

        while (a.getHeight() > b.getHeight()) a = blocks.get(a.getParentHash());
        while (b.getHeight() > a.getHeight()) b = blocks.get(b.getParentHash());

        while (!a.getHash().equals(b.getHash())) {
            a = blocks.get(a.getParentHash());
            b = blocks.get(b.getParentHash());
        }
        return a.getHash();
    }

    /**
     * @return blocks from the child of the root down to {@code hash}, ascending by height
     */
    public List<Block> getPathFromRoot(Hash256 hash) {
        Deque<Block> path = new ArrayDeque<>();
        Block current = getOrThrow(hash);
        while (!current.getHash().equals(rootHash)) {
            path.addFirst(current);
            current = blocks.get(current.getParentHash());
        }
        return new ArrayList<>(path);
    }

    public Optional<Block> getAncestorAtHeight(Hash256 hash, long height) {
        Block current = blocks.get(hash);
        while (current != null && current.getHeight() > height) {
            current = blocks.get(current.getParentHash());
        }
        return Optional.ofNullable(current).filter(block -> block.getHeight() == height);
    }

    public List<Hash256> getLeaves() {
        return children.entrySet().stream()
                .filter(entry -> entry.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
    }

    public List<Block> getBlocks() {
        return new ArrayList<>(blocks.values());
    }

    /**
     * Moves the root to {@code newRoot} and drops every block that does not descend from it.
     *
     * @return hashes of the removed blocks
     */
    public Set<Hash256> prune(Hash256 newRoot) {
        if (!contains(newRoot)) {
            throw new BlockNotFoundException("Cannot prune to unknown block " + newRoot);
        }

        Set<Hash256> keep = new HashSet<>();
        Deque<Hash256> stack = new ArrayDeque<>();
        stack.push(newRoot);
        while (!stack.isEmpty()) {
            Hash256 hash = stack.pop();
            keep.add(hash);
            children.getOrDefault(hash, List.of()).forEach(stack::push);
        }

        Set<Hash256> removed = new HashSet<>(blocks.keySet());
        removed.removeAll(keep);
        removed.forEach(hash -> {
            blocks.remove(hash);
            children.remove(hash);
        });

        rootHash = newRoot;
        return removed;
    }
}
