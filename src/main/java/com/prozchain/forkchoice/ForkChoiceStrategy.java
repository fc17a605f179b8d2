package com.prozchain.forkchoice;

import com.prozchain.block.Block;
import com.prozchain.types.Hash256;
import com.prozchain.validator.ValidatorId;
import org.javatuples.Pair;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Head selection rules. The active rule is chosen once from configuration; each variant is a pure function over
 * the block tree and the latest vote of every validator.
 */
public enum ForkChoiceStrategy {

    /**
     * Greedy heaviest observed subtree: starting at the finalized root, repeatedly step into the child whose
     * subtree carries the most voting power. Equal weights prefer the deeper subtree, then the smaller hash.
     */
    GHOST {
        @Override
        public Hash256 selectHead(BlockTree tree,
                                  Map<ValidatorId, Pair<Hash256, Long>> latestVotes,
                                  Function<ValidatorId, BigInteger> votingPower) {
            Map<Hash256, BigInteger> weights = subtreeWeights(tree, latestVotes, votingPower);
            Map<Hash256, Long> depths = subtreeMaxHeights(tree);

            Comparator<Hash256> preference = Comparator
                    .comparing((Hash256 hash) -> weights.getOrDefault(hash, BigInteger.ZERO))
                    .thenComparing(depths::get)
                    .thenComparing(Comparator.<Hash256>reverseOrder());

            return descend(tree, preference);
        }
    },

    /**
     * Longest chain: the leaf with the greatest height; between equally long branches the one containing the
     * smaller hash at the point where they diverge wins.
     */
    LONGEST_CHAIN {
        @Override
        public Hash256 selectHead(BlockTree tree,
                                  Map<ValidatorId, Pair<Hash256, Long>> latestVotes,
                                  Function<ValidatorId, BigInteger> votingPower) {
            Map<Hash256, Long> depths = subtreeMaxHeights(tree);

            Comparator<Hash256> preference = Comparator
                    .comparing((Hash256 hash) -> depths.get(hash))
                    .thenComparing(Comparator.<Hash256>reverseOrder());

            return descend(tree, preference);
        }
    };

    public abstract Hash256 selectHead(BlockTree tree,
                                       Map<ValidatorId, Pair<Hash256, Long>> latestVotes,
                                       Function<ValidatorId, BigInteger> votingPower);

    // Walks from the root, always into the child ranked highest by the preference.
    private static Hash256 descend(BlockTree tree, Comparator<Hash256> preference) {
        Hash256 current = tree.getRootHash();
        List<Hash256> children = tree.getChildren(current);
        while (!children.isEmpty()) {
            current = children.stream().max(preference).orElseThrow();
            children = tree.getChildren(current);
        }
        return current;
    }

    static Map<Hash256, BigInteger> subtreeWeights(BlockTree tree,
                                                   Map<ValidatorId, Pair<Hash256, Long>> latestVotes,
                                                   Function<ValidatorId, BigInteger> votingPower) {
        Map<Hash256, BigInteger> weights = new HashMap<>();
        Hash256 rootHash = tree.getRootHash();

        for (Map.Entry<ValidatorId, Pair<Hash256, Long>> entry : latestVotes.entrySet()) {
            BigInteger power = votingPower.apply(entry.getKey());
            if (power.signum() == 0) {
                continue;
            }

            Block current = tree.get(entry.getValue().getValue0()).orElse(null);
            while (current != null) {
                weights.merge(current.getHash(), power, BigInteger::add);
                if (current.getHash().equals(rootHash)) {
                    break;
                }
                current = tree.get(current.getParentHash()).orElse(null);
            }
        }
        return weights;
    }

    static Map<Hash256, Long> subtreeMaxHeights(BlockTree tree) {
        Map<Hash256, Long> depths = new HashMap<>();
        for (Hash256 leaf : tree.getLeaves()) {
            Block current = tree.get(leaf).orElse(null);
            long leafHeight = current != null ? current.getHeight() : 0;
            while (current != null) {
                Long known = depths.get(current.getHash());
                if (known != null && known >= leafHeight) {
                    break;
                }
                depths.put(current.getHash(), leafHeight);
                if (current.getHash().equals(tree.getRootHash())) {
                    break;
                }
                current = tree.get(current.getParentHash()).orElse(null);
            }
        }
        return depths;
    }
}
