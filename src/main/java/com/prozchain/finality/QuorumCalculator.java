package com.prozchain.finality;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.validator.ValidatorId;

import java.math.BigInteger;
import java.util.Collection;
import java.util.HashSet;
import java.util.function.Function;

/**
 * Stake weighted supermajority arithmetic. All comparisons are exact integer cross multiplications, so the
 * result depends only on the set of voters and never on the order votes were seen in.
 */
public class QuorumCalculator {

    private final BigInteger numerator;
    private final BigInteger denominator;

    public QuorumCalculator(long numerator, long denominator) {
        this.numerator = BigInteger.valueOf(numerator);
        this.denominator = BigInteger.valueOf(denominator);
    }

    public static QuorumCalculator fromConfig(ConsensusConfig config) {
        return new QuorumCalculator(config.getQuorumNumerator(), config.getQuorumDenominator());
    }

    /**
     * @return true if {@code votedPower / totalPower >= numerator / denominator}; an empty set never has quorum
     */
    public boolean hasQuorum(BigInteger votedPower, BigInteger totalPower) {
        if (totalPower.signum() <= 0) {
            return false;
        }
        return votedPower.multiply(denominator).compareTo(totalPower.multiply(numerator)) >= 0;
    }

    public boolean hasQuorum(Collection<ValidatorId> voters,
                             Function<ValidatorId, BigInteger> votingPower,
                             BigInteger totalPower) {
        return hasQuorum(votedPower(voters, votingPower), totalPower);
    }

    /**
     * Sums the power of distinct voters; a validator listed twice counts once.
     */
    public BigInteger votedPower(Collection<ValidatorId> voters, Function<ValidatorId, BigInteger> votingPower) {
        return new HashSet<>(voters).stream()
                .map(votingPower)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * @return the smallest voting power that reaches quorum out of {@code totalPower}
     */
    public BigInteger threshold(BigInteger totalPower) {
        BigInteger[] division = totalPower.multiply(numerator).divideAndRemainder(denominator);
        return division[1].signum() == 0 ? division[0] : division[0].add(BigInteger.ONE);
    }
}
