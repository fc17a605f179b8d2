package com.prozchain.slashing;

import com.prozchain.finality.Vote;
import com.prozchain.types.Hash256;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.HashUtils;
import com.prozchain.validator.ValidatorId;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Proof of a validator offense. For equivocation it carries both conflicting signed votes, which makes it
 * verifiable by any node without further context.
 */
@Getter
public class SlashingEvidence implements Serializable {

    private final OffenseType offense;
    private final ValidatorId offender;
    private final long height;
    @Nullable
    private final Vote first;
    @Nullable
    private final Vote second;
    private final long consecutiveMisses;
    private final BigInteger penalty;
    private final Hash256 hash;

    private SlashingEvidence(OffenseType offense, ValidatorId offender, long height, Vote first, Vote second,
                             long consecutiveMisses, BigInteger penalty) {
        this.offense = offense;
        this.offender = offender;
        this.height = height;
        this.first = first;
        this.second = second;
        this.consecutiveMisses = consecutiveMisses;
        this.penalty = penalty;
        this.hash = computeHash();
    }

    public static SlashingEvidence equivocation(OffenseType offense, Vote first, Vote second) {
        if (!offense.isEquivocation()) {
            throw new IllegalArgumentException(offense + " is not an equivocation offense");
        }
        return new SlashingEvidence(offense, first.getValidator(), first.getHeight(), first, second, 0,
                BigInteger.ZERO);
    }

    public static SlashingEvidence unavailability(ValidatorId offender, long height, long consecutiveMisses) {
        return new SlashingEvidence(OffenseType.UNAVAILABILITY, offender, height, null, null, consecutiveMisses,
                BigInteger.ZERO);
    }

    /**
     * @return a copy carrying the penalty that was applied; the evidence hash does not change
     */
    public SlashingEvidence withPenalty(BigInteger appliedPenalty) {
        return new SlashingEvidence(offense, offender, height, first, second, consecutiveMisses, appliedPenalty);
    }

    // The two votes are hashed in byte order so that (a, b) and (b, a) identify the same evidence.
    private Hash256 computeHash() {
        CanonicalWriter writer = new CanonicalWriter()
                .writeByte(offense.getCode())
                .writeHash(offender.getPublicKey())
                .writeLong(height)
                .writeLong(consecutiveMisses);

        if (first != null && second != null) {
            byte[] a = encode(first);
            byte[] b = encode(second);
            if (Arrays.compare(a, b) > 0) {
                byte[] swap = a;
                a = b;
                b = swap;
            }
            writer.writeBytes(a).writeBytes(b);
        }
        return HashUtils.blake2bHash(writer.toByteArray());
    }

    private static byte[] encode(Vote vote) {
        return new CanonicalWriter()
                .writeHash(vote.getValidator().getPublicKey())
                .writeBytes(vote.signingPayload())
                .writeBytes(vote.getSignature() != null ? vote.getSignature().getBytes() : new byte[0])
                .toByteArray();
    }

    @Override
    public String toString() {
        return String.format("SlashingEvidence{%s %s #%d %s}", offense, offender, height, hash);
    }
}
