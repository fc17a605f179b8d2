package com.prozchain.validator;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;

/**
 * A staked participant. Instances are owned by {@link ValidatorRegistry} and only mutated through it.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class Validator {

    private final ValidatorId id;
    private BigInteger stake;
    private ValidatorStatus status;

    private long votesCast;
    private long votesMissed;
    private long consecutiveMisses;

    public Validator(ValidatorId id, BigInteger stake) {
        this.id = id;
        this.stake = stake;
        this.status = ValidatorStatus.QUEUED;
    }

    Validator copy() {
        Validator copy = new Validator(id, stake);
        copy.status = status;
        copy.votesCast = votesCast;
        copy.votesMissed = votesMissed;
        copy.consecutiveMisses = consecutiveMisses;
        return copy;
    }

    void recordVote() {
        votesCast++;
        consecutiveMisses = 0;
    }

    void recordMiss() {
        votesMissed++;
        consecutiveMisses++;
    }

    @Override
    public String toString() {
        return "Validator{" +
                "id=" + id +
                ", stake=" + stake +
                ", status=" + status +
                ", votesCast=" + votesCast +
                ", votesMissed=" + votesMissed +
                '}';
    }
}
