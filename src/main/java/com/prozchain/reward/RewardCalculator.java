package com.prozchain.reward;

import com.prozchain.block.Block;
import com.prozchain.config.ConsensusConfig;
import com.prozchain.finality.Vote;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorSetSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the per block reward budget between the proposer and the validators that voted on the block.
 * Pure: the returned mapping is applied by the treasury.
 */
@Component
@RequiredArgsConstructor
public class RewardCalculator {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final ConsensusConfig config;

    /**
     * The proposer receives a fixed share of the budget, raised by the boost when less than the low
     * participation threshold of voting power took part. The rest is shared equally among distinct voters from
     * the snapshot; whatever does not divide evenly goes to the proposer. Non voters receive nothing.
     */
    public Map<ValidatorId, BigInteger> calculate(Block block, Collection<Vote> votes, ValidatorSetSnapshot snapshot) {
        BigInteger budget = config.getBlockRewardBudget();
        ValidatorId proposer = block.getProposer();

        List<ValidatorId> voters = votes.stream()
                .map(Vote::getValidator)
                .distinct()
                .filter(snapshot::contains)
                .sorted()
                .toList();

        BigInteger votedPower = voters.stream()
                .map(snapshot::getVotingPower)
                .reduce(BigInteger.ZERO, BigInteger::add);
        boolean lowParticipation = isLowParticipation(votedPower, snapshot.getTotalVotingPower());

        int proposerPercent = config.getProposerRewardPercent() + (lowParticipation ? config.getProposerBoostPercent() : 0);
        BigInteger proposerShare = budget.multiply(BigInteger.valueOf(proposerPercent)).divide(HUNDRED);
        BigInteger participationPool = budget.subtract(proposerShare);

        Map<ValidatorId, BigInteger> rewards = new LinkedHashMap<>();
        if (voters.isEmpty()) {
            rewards.put(proposer, budget);
            return rewards;
        }

        BigInteger[] split = participationPool.divideAndRemainder(BigInteger.valueOf(voters.size()));
        rewards.put(proposer, proposerShare.add(split[1]));
        voters.forEach(voter -> rewards.merge(voter, split[0], BigInteger::add));
        return rewards;
    }

    public boolean isLowParticipation(BigInteger votedPower, BigInteger totalPower) {
        return votedPower.multiply(HUNDRED)
                .compareTo(totalPower.multiply(BigInteger.valueOf(config.getLowParticipationPercent()))) < 0;
    }
}
