package com.prozchain.validator;

import lombok.Getter;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The validator set and voting powers frozen for one epoch, in the order produced by rotation
 * (descending stake, ties by ascending id).
 */
@Getter
public class ValidatorSetSnapshot implements Serializable {

    private final long epoch;
    private final List<ValidatorId> validators;
    private final Map<ValidatorId, BigInteger> votingPowers;
    private final BigInteger totalVotingPower;

    public ValidatorSetSnapshot(long epoch, Map<ValidatorId, BigInteger> orderedVotingPowers) {
        this.epoch = epoch;
        this.votingPowers = Collections.unmodifiableMap(new LinkedHashMap<>(orderedVotingPowers));
        this.validators = List.copyOf(orderedVotingPowers.keySet());
        this.totalVotingPower = orderedVotingPowers.values().stream()
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public static ValidatorSetSnapshot empty(long epoch) {
        return new ValidatorSetSnapshot(epoch, Map.of());
    }

    public BigInteger getVotingPower(ValidatorId id) {
        return votingPowers.getOrDefault(id, BigInteger.ZERO);
    }

    public boolean contains(ValidatorId id) {
        return votingPowers.containsKey(id);
    }

    public int indexOf(ValidatorId id) {
        return validators.indexOf(id);
    }

    public int size() {
        return validators.size();
    }

    public boolean isEmpty() {
        return validators.isEmpty();
    }
}
