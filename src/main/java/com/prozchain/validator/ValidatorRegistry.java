package com.prozchain.validator;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.exception.validator.UnknownValidatorException;
import com.prozchain.state.AbstractState;
import com.prozchain.storage.DBConstants;
import com.prozchain.storage.KVRepository;
import com.prozchain.storage.StateUtil;
import com.prozchain.treasury.StakeTreasury;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

/**
 * Authoritative mapping from validator identity to stake, voting power and status.
 * <p>
 * The active set is recomputed only at epoch boundaries by {@link #rotate(long)} and frozen into a
 * {@link ValidatorSetSnapshot} for the whole epoch, so every quorum calculation within an epoch sees the
 * same weights. Slashing changes stake right away but voting power only at the next rotation; an ejected
 * validator is however excluded from vote counting immediately.
 */
@Log
@Component
public class ValidatorRegistry extends AbstractState {

    private final ConsensusConfig config;
    private final StakeTreasury treasury;
    private final KVRepository<String, Object> repository;

    private final Map<ValidatorId, Validator> validators = new HashMap<>();
    private final NavigableMap<Long, ValidatorSetSnapshot> snapshots = new TreeMap<>();
    private final List<ValidatorSetChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ValidatorSetSnapshot currentSnapshot = ValidatorSetSnapshot.empty(0);

    public ValidatorRegistry(ConsensusConfig config,
                             StakeTreasury treasury,
                             KVRepository<String, Object> repository) {
        this.config = config;
        this.treasury = treasury;
        this.repository = repository;
    }

    @Override
    public void initializeFromDatabase() {
        synchronized (this) {
            for (String key : repository.findKeysByPrefix(DBConstants.VALIDATOR, Integer.MAX_VALUE)) {
                Validator stored = repository.find(key, null);
                if (stored != null) {
                    validators.put(stored.getId(), stored.copy());
                }
            }
        }

        Long latestEpoch = repository.find(DBConstants.LATEST_EPOCH, null);
        if (latestEpoch == null) {
            initialized = true;
            return;
        }

        ValidatorSetSnapshot snapshot = repository.find(
                StateUtil.generateEpochKey(DBConstants.VALIDATOR_SET, latestEpoch), null);
        if (snapshot != null) {
            synchronized (this) {
                snapshots.put(latestEpoch, snapshot);
                currentSnapshot = snapshot;
                // Members without a stored record predate it; ejections are always stored.
                snapshot.getValidators().forEach(id -> validators.computeIfAbsent(id, key -> {
                    Validator validator = new Validator(key, treasury.currentStake(key));
                    validator.setStatus(ValidatorStatus.ACTIVE);
                    return validator;
                }));
            }
            log.info("Loaded validator set of epoch " + latestEpoch + " with " + snapshot.size() + " validators");
        }
        initialized = true;
    }

    @Override
    public void persistState() {
        ValidatorSetSnapshot snapshot = currentSnapshot;
        repository.save(StateUtil.generateEpochKey(DBConstants.VALIDATOR_SET, snapshot.getEpoch()), snapshot);
        repository.save(DBConstants.LATEST_EPOCH, snapshot.getEpoch());
        synchronized (this) {
            validators.values().forEach(this::persistValidator);
        }
    }

    public void addListener(ValidatorSetChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Adds a candidate. It stays {@link ValidatorStatus#QUEUED} until a rotation admits it.
     */
    public synchronized Validator register(ValidatorId id) {
        return validators.computeIfAbsent(id, key -> {
            log.fine("Registered validator candidate " + key);
            return new Validator(key, treasury.currentStake(key));
        });
    }

    /**
     * Recomputes the active set for the given epoch from the stake source: candidates below the minimum
     * stake and ejected validators are skipped, the rest ordered by descending stake (ties broken by
     * ascending public key) and truncated to the configured maximum.
     *
     * @param epoch the epoch about to start
     * @return the validators added, removed and retained relative to the previous set
     */
    public SetDelta rotate(long epoch) {
        SetDelta delta;
        ValidatorSetSnapshot snapshot;

        synchronized (this) {
            if (!snapshots.isEmpty() && epoch < snapshots.lastKey()) {
                throw new IllegalArgumentException(String.format(
                        "Cannot rotate to epoch %d, epoch %d is already fixed", epoch, snapshots.lastKey()));
            }
            ValidatorSetSnapshot existing = snapshots.get(epoch);
            if (existing != null) {
                log.fine("Validator set for epoch " + epoch + " already computed");
                return new SetDelta(epoch, List.of(), List.of(), existing.getValidators());
            }

            List<Validator> eligible = new ArrayList<>();
            for (Validator validator : validators.values()) {
                validator.setStake(treasury.currentStake(validator.getId()));
                if (validator.getStatus() == ValidatorStatus.EJECTED) {
                    continue;
                }
                if (validator.getStake().compareTo(config.getMinStake()) < 0
                        || toVotingPower(validator.getStake()).signum() == 0) {
                    validator.setStatus(ValidatorStatus.QUEUED);
                    continue;
                }
                eligible.add(validator);
            }

            eligible.sort(Comparator.comparing(Validator::getStake).reversed()
                    .thenComparing(Validator::getId));

            Map<ValidatorId, BigInteger> ordered = new LinkedHashMap<>();
            for (int i = 0; i < eligible.size(); i++) {
                Validator validator = eligible.get(i);
                if (i < config.getMaxValidators()) {
                    validator.setStatus(ValidatorStatus.ACTIVE);
                    ordered.put(validator.getId(), toVotingPower(validator.getStake()));
                } else {
                    validator.setStatus(ValidatorStatus.QUEUED);
                }
            }

            ValidatorSetSnapshot previous = currentSnapshot;
            snapshot = new ValidatorSetSnapshot(epoch, ordered);
            delta = computeDelta(epoch, previous, snapshot);

            snapshots.put(epoch, snapshot);
            currentSnapshot = snapshot;
        }

        persistState();
        log.log(Level.INFO, String.format("Rotated to epoch %d: %d active validators, +%d -%d, total power %s",
                epoch, snapshot.size(), delta.getAdded().size(), delta.getRemoved().size(),
                snapshot.getTotalVotingPower()));

        ValidatorSetChangeEvent event = new ValidatorSetChangeEvent(this, delta, snapshot);
        listeners.forEach(listener -> listener.validatorSetChanged(event));
        return delta;
    }

    /**
     * Deducts stake from a validator. Stake is clamped at zero; falling below the minimum stake ejects the
     * validator, which stops its votes from being counted for the rest of the epoch.
     *
     * @return the remaining stake
     * @throws UnknownValidatorException if the validator was never registered
     */
    public synchronized BigInteger applySlash(ValidatorId id, BigInteger amount) {
        Validator validator = validators.get(id);
        if (validator == null) {
            throw new UnknownValidatorException("Cannot slash unknown validator " + id);
        }

        BigInteger newStake = validator.getStake().subtract(amount.max(BigInteger.ZERO)).max(BigInteger.ZERO);
        validator.setStake(newStake);

        if (newStake.signum() == 0 || newStake.compareTo(config.getMinStake()) < 0) {
            if (validator.getStatus() != ValidatorStatus.EJECTED) {
                log.log(Level.WARNING, String.format("Validator %s ejected, stake dropped to %s", id, newStake));
            }
            validator.setStatus(ValidatorStatus.EJECTED);
        }
        persistValidator(validator);
        return newStake;
    }

    public synchronized void recordParticipation(ValidatorId id, boolean voted) {
        Validator validator = validators.get(id);
        if (validator == null) {
            return;
        }
        if (voted) {
            validator.recordVote();
        } else {
            validator.recordMiss();
        }
    }

    public ValidatorSetSnapshot getCurrentSnapshot() {
        return currentSnapshot;
    }

    public synchronized Optional<ValidatorSetSnapshot> getSnapshot(long epoch) {
        return Optional.ofNullable(snapshots.get(epoch));
    }

    public synchronized Optional<Validator> getValidator(ValidatorId id) {
        return Optional.ofNullable(validators.get(id));
    }

    public synchronized List<Validator> getValidators() {
        return new ArrayList<>(validators.values());
    }

    public synchronized boolean isEjected(ValidatorId id) {
        Validator validator = validators.get(id);
        return validator != null && validator.getStatus() == ValidatorStatus.EJECTED;
    }

    /**
     * @return the frozen voting power of the current epoch, or zero for non-members and ejected validators
     */
    public BigInteger getVotingPower(ValidatorId id) {
        if (isEjected(id)) {
            return BigInteger.ZERO;
        }
        return currentSnapshot.getVotingPower(id);
    }

    public BigInteger getTotalActivePower() {
        return currentSnapshot.getTotalVotingPower();
    }

    public boolean isCountable(ValidatorId id) {
        return currentSnapshot.contains(id) && !isEjected(id);
    }

    private void persistValidator(Validator validator) {
        repository.save(StateUtil.generateHashKey(DBConstants.VALIDATOR, validator.getId().getPublicKey()),
                validator.copy());
    }

    private BigInteger toVotingPower(BigInteger stake) {
        return stake.divide(config.getPowerUnit());
    }

    private SetDelta computeDelta(long epoch, ValidatorSetSnapshot previous, ValidatorSetSnapshot next) {
        List<ValidatorId> added = new ArrayList<>();
        List<ValidatorId> retained = new ArrayList<>();
        for (ValidatorId id : next.getValidators()) {
            if (previous.contains(id)) {
                retained.add(id);
            } else {
                added.add(id);
            }
        }
        List<ValidatorId> removed = previous.getValidators().stream()
                .filter(id -> !next.contains(id))
                .toList();
        return new SetDelta(epoch, added, removed, retained);
    }
}
