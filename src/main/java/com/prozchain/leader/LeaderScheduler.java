package com.prozchain.leader;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.ConsensusGenericException;
import com.prozchain.types.Hash256;
import com.prozchain.utils.CanonicalWriter;
import com.prozchain.utils.HashUtils;
import com.prozchain.utils.LittleEndianUtils;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorSetChangeEvent;
import com.prozchain.validator.ValidatorSetChangeListener;
import com.prozchain.validator.ValidatorSetSnapshot;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns block production duty per slot from the validator set frozen for the current epoch.
 */
@Log
@Component
public class LeaderScheduler implements ValidatorSetChangeListener {

    private final LeaderSelectionPolicy policy;
    private final int backupCount;
    private final Duration leaderTimeout;
    private final EpochState epochState;

    public LeaderScheduler(ConsensusConfig config, EpochState epochState) {
        this.policy = config.getLeaderPolicy();
        this.backupCount = config.getBackupLeaders();
        this.leaderTimeout = config.getLeaderTimeout();
        this.epochState = epochState;
    }

    @Override
    public void validatorSetChanged(ValidatorSetChangeEvent event) {
        ValidatorSetSnapshot snapshot = event.getSnapshot();
        epochState.switchEpoch(snapshot.getEpoch(), snapshot);
    }

    public ValidatorId leaderFor(long slot) {
        EpochData epochData = epochState.getEpochDataForSlot(slot);
        return select(epochData, slot, 0);
    }

    /**
     * Returns the next {@code count} distinct candidates after the primary leader, computed with the same
     * selection function. They take over in order when the primary misses its window.
     */
    public List<ValidatorId> backupsFor(long slot, int count) {
        EpochData epochData = epochState.getEpochDataForSlot(slot);
        ValidatorSetSnapshot snapshot = epochData.getSnapshot();
        ValidatorId primary = select(epochData, slot, 0);

        int wanted = Math.min(count, snapshot.size() - 1);
        Set<ValidatorId> chosen = new LinkedHashSet<>();
        chosen.add(primary);

        if (policy == LeaderSelectionPolicy.ROUND_ROBIN) {
            int start = snapshot.indexOf(primary);
            for (int i = 1; chosen.size() <= wanted; i++) {
                chosen.add(snapshot.getValidators().get((start + i) % snapshot.size()));
            }
        } else {
            int maxAttempts = 64 * snapshot.size();
            for (int attempt = 1; attempt <= maxAttempts && chosen.size() <= wanted; attempt++) {
                chosen.add(select(epochData, slot, attempt));
            }
            // Draws can keep hitting heavy validators; fill the rest deterministically.
            for (ValidatorId id : snapshot.getValidators()) {
                if (chosen.size() > wanted) break;
                chosen.add(id);
            }
        }

        List<ValidatorId> backups = new ArrayList<>(chosen);
        return backups.subList(1, backups.size());
    }

    public List<ValidatorId> backupsFor(long slot) {
        return backupsFor(slot, backupCount);
    }

    /**
     * Resolves who is entitled to produce in the slot after {@code elapsed} time: the primary during the first
     * timeout window, then each backup for one further window.
     *
     * @return the entitled validator, or empty once every backup window has passed
     */
    public Optional<ValidatorId> leaderAt(long slot, Duration elapsed) {
        long window = elapsed.toMillis() / Math.max(1, leaderTimeout.toMillis());
        if (window == 0) {
            return Optional.of(leaderFor(slot));
        }

        List<ValidatorId> backups = backupsFor(slot);
        if (window - 1 < backups.size()) {
            ValidatorId backup = backups.get((int) (window - 1));
            log.fine(String.format("Leader of slot %d timed out, backup #%d %s takes over", slot, window, backup));
            return Optional.of(backup);
        }
        return Optional.empty();
    }

    public boolean isEntitled(ValidatorId validator, long slot, Duration elapsed) {
        return leaderAt(slot, elapsed).map(validator::equals).orElse(false);
    }

    /**
     * @return true if the validator is the primary or one of the backups of the slot
     */
    public boolean isScheduled(ValidatorId validator, long slot) {
        return leaderFor(slot).equals(validator) || backupsFor(slot).contains(validator);
    }

    /**
     * @return the position of the validator in the slot's production order: 0 for the primary, {@code k} for
     * backup {@code k}, or -1 if it may not produce in this slot
     */
    public int positionInSlot(ValidatorId validator, long slot) {
        if (leaderFor(slot).equals(validator)) {
            return 0;
        }
        int index = backupsFor(slot).indexOf(validator);
        return index < 0 ? -1 : index + 1;
    }

    private ValidatorId select(EpochData epochData, long slot, int attempt) {
        ValidatorSetSnapshot snapshot = epochData.getSnapshot();
        if (snapshot.isEmpty()) {
            throw new ConsensusGenericException("No active validators in epoch " + epochData.getEpochIndex());
        }

        return switch (policy) {
            case ROUND_ROBIN -> snapshot.getValidators().get((int) Math.floorMod(slot + attempt, (long) snapshot.size()));
            case STAKE_WEIGHTED -> {
                BigInteger draw = drawValue(epochData.getRandomness(), slot, attempt);
                yield selectByWeight(snapshot, draw.mod(snapshot.getTotalVotingPower()));
            }
        };
    }

    static BigInteger drawValue(Hash256 randomness, long slot, int attempt) {
        byte[] hash = HashUtils.hashWithBlake2b(new CanonicalWriter()
                .writeHash(randomness)
                .writeLong(slot)
                .writeLong(attempt)
                .toByteArray());
        return LittleEndianUtils.fromLittleEndianByteArray(hash);
    }

    /**
     * Maps a value in {@code [0, totalPower)} onto the validator owning that point of the cumulative weight line.
     * Validator {@code i} owns the half open range {@code [c(i-1), c(i))}, so a value landing exactly on a
     * boundary belongs to the validator owning the upper sub-range.
     */
    public static ValidatorId selectByWeight(ValidatorSetSnapshot snapshot, BigInteger value) {
        List<ValidatorId> validators = snapshot.getValidators();
        BigInteger[] cumulative = new BigInteger[validators.size()];
        BigInteger sum = BigInteger.ZERO;
        for (int i = 0; i < validators.size(); i++) {
            sum = sum.add(snapshot.getVotingPower(validators.get(i)));
            cumulative[i] = sum;
        }

        if (value.signum() < 0 || value.compareTo(sum) >= 0) {
            throw new IllegalArgumentException("Selection value " + value + " outside [0, " + sum + ")");
        }

        // smallest i with cumulative[i] > value
        int low = 0;
        int high = cumulative.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative[mid].compareTo(value) > 0) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return validators.get(low);
    }
}
