package com.prozchain.treasury;

import com.prozchain.validator.ValidatorId;

import java.math.BigInteger;
import java.util.Map;

/**
 * Boundary to the balance/stake ledger. These are the only state mutations performed outside
 * the consensus core's own bookkeeping.
 */
public interface StakeTreasury {

    BigInteger currentStake(ValidatorId validator);

    void applyReward(Map<ValidatorId, BigInteger> rewards);

    void applyPenalty(ValidatorId validator, BigInteger amount);
}
