package com.prozchain.treasury;

import com.prozchain.validator.ValidatorId;
import lombok.extern.java.Log;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;

/**
 * Stake ledger kept in memory. Used when the node runs without an external treasury.
 */
@Log
public class InMemoryStakeTreasury implements StakeTreasury {

    private final Map<ValidatorId, BigInteger> stakes = new ConcurrentHashMap<>();
    private final Map<ValidatorId, BigInteger> rewards = new ConcurrentHashMap<>();

    public void deposit(ValidatorId validator, BigInteger amount) {
        stakes.merge(validator, amount, BigInteger::add);
    }

    @Override
    public BigInteger currentStake(ValidatorId validator) {
        return stakes.getOrDefault(validator, BigInteger.ZERO);
    }

    public BigInteger rewardBalance(ValidatorId validator) {
        return rewards.getOrDefault(validator, BigInteger.ZERO);
    }

    @Override
    public void applyReward(Map<ValidatorId, BigInteger> payouts) {
        payouts.forEach((validator, amount) -> rewards.merge(validator, amount, BigInteger::add));
    }

    @Override
    public void applyPenalty(ValidatorId validator, BigInteger amount) {
        stakes.computeIfPresent(validator, (id, stake) -> stake.subtract(amount).max(BigInteger.ZERO));
        log.log(Level.FINE, String.format("Penalty of %s applied to %s", amount, validator));
    }
}
