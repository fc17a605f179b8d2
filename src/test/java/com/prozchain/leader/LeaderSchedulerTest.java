package com.prozchain.leader;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.utils.TestUtils;
import com.prozchain.validator.ValidatorId;
import com.prozchain.validator.ValidatorSetSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeaderSchedulerTest {

    private ValidatorId a;
    private ValidatorId b;
    private ValidatorId c;
    private ValidatorSetSnapshot snapshot;

    @BeforeEach
    void setup() {
        a = new TestUtils.Signer().getId();
        b = new TestUtils.Signer().getId();
        c = new TestUtils.Signer().getId();

        Map<ValidatorId, BigInteger> powers = new LinkedHashMap<>();
        powers.put(a, BigInteger.valueOf(10));
        powers.put(b, BigInteger.valueOf(20));
        powers.put(c, BigInteger.valueOf(30));
        snapshot = new ValidatorSetSnapshot(0, powers);
    }

    private LeaderScheduler scheduler(LeaderSelectionPolicy policy) {
        ConsensusConfig config = ConsensusConfig.builder()
                .leaderPolicy(policy)
                .backupLeaders(2)
                .leaderTimeout(Duration.ofMillis(1000))
                .build();
        EpochState epochState = TestUtils.epochState(config);
        epochState.switchEpoch(0, snapshot);
        return new LeaderScheduler(config, epochState);
    }

    @Test
    void selectByWeightFollowsCumulativeRanges() {
        assertEquals(a, LeaderScheduler.selectByWeight(snapshot, BigInteger.ZERO));
        assertEquals(a, LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(9)));
        assertEquals(b, LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(10)));
        assertEquals(b, LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(29)));
        assertEquals(c, LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(30)));
        assertEquals(c, LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(59)));
    }

    @Test
    void selectByWeightRejectsValuesOutsideTheLine() {
        assertThrows(IllegalArgumentException.class,
                () -> LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(60)));
        assertThrows(IllegalArgumentException.class,
                () -> LeaderScheduler.selectByWeight(snapshot, BigInteger.valueOf(-1)));
    }

    @Test
    void roundRobinCyclesThroughSnapshotOrder() {
        LeaderScheduler scheduler = scheduler(LeaderSelectionPolicy.ROUND_ROBIN);

        assertEquals(a, scheduler.leaderFor(0));
        assertEquals(b, scheduler.leaderFor(1));
        assertEquals(c, scheduler.leaderFor(2));
        assertEquals(a, scheduler.leaderFor(3));
        assertEquals(List.of(c, a), scheduler.backupsFor(1));
    }

    @Test
    void stakeWeightedSelectionIsDeterministicAcrossNodes() {
        LeaderScheduler first = scheduler(LeaderSelectionPolicy.STAKE_WEIGHTED);
        LeaderScheduler second = scheduler(LeaderSelectionPolicy.STAKE_WEIGHTED);

        for (long slot = 0; slot < 50; slot++) {
            assertEquals(first.leaderFor(slot), second.leaderFor(slot));
            assertEquals(first.backupsFor(slot), second.backupsFor(slot));
        }
    }

    @Test
    void stakeWeightedSelectionFavoursHeavierValidators() {
        LeaderScheduler scheduler = scheduler(LeaderSelectionPolicy.STAKE_WEIGHTED);
        Map<ValidatorId, Integer> counts = new HashMap<>();
        for (long slot = 0; slot < 3000; slot++) {
            counts.merge(scheduler.leaderFor(slot), 1, Integer::sum);
        }

        assertTrue(counts.getOrDefault(c, 0) > counts.getOrDefault(a, 0));
        assertEquals(new HashSet<>(List.of(a, b, c)), counts.keySet());
    }

    @Test
    void backupsAreDistinctAndExcludePrimary() {
        LeaderScheduler scheduler = scheduler(LeaderSelectionPolicy.STAKE_WEIGHTED);
        for (long slot = 0; slot < 20; slot++) {
            ValidatorId primary = scheduler.leaderFor(slot);
            List<ValidatorId> backups = scheduler.backupsFor(slot);

            assertEquals(2, backups.size());
            assertFalse(backups.contains(primary));
            assertEquals(2, new HashSet<>(backups).size());
        }
    }

    @Test
    void leaderAtHandsOverToBackupsPerTimeoutWindow() {
        LeaderScheduler scheduler = scheduler(LeaderSelectionPolicy.ROUND_ROBIN);

        assertEquals(Optional.of(a), scheduler.leaderAt(0, Duration.ofMillis(999)));
        assertEquals(Optional.of(b), scheduler.leaderAt(0, Duration.ofMillis(1000)));
        assertEquals(Optional.of(c), scheduler.leaderAt(0, Duration.ofMillis(2500)));
        assertEquals(Optional.empty(), scheduler.leaderAt(0, Duration.ofMillis(3000)));
        assertTrue(scheduler.isEntitled(b, 0, Duration.ofMillis(1500)));
    }

    @Test
    void positionInSlotReflectsProductionOrder() {
        LeaderScheduler scheduler = scheduler(LeaderSelectionPolicy.ROUND_ROBIN);

        assertEquals(0, scheduler.positionInSlot(a, 0));
        assertEquals(1, scheduler.positionInSlot(b, 0));
        assertEquals(2, scheduler.positionInSlot(c, 0));
        assertTrue(scheduler.isScheduled(c, 0));
        assertEquals(-1, scheduler.positionInSlot(new TestUtils.Signer().getId(), 0));
    }
}
