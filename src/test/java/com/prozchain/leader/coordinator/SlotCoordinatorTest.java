package com.prozchain.leader.coordinator;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.leader.EpochState;
import com.prozchain.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotCoordinatorTest {

    private final EpochState epochState = TestUtils.epochState(ConsensusConfig.builder()
            .slotDuration(Duration.ofMillis(1000))
            .epochLength(3)
            .build());

    @Test
    void firesOncePerNewSlot() {
        SlotCoordinator coordinator = new SlotCoordinator(epochState);
        List<SlotChangeEvent> events = new ArrayList<>();
        coordinator.addListener(events::add);

        coordinator.tick(Instant.ofEpochMilli(100));
        coordinator.tick(Instant.ofEpochMilli(900));
        coordinator.tick(Instant.ofEpochMilli(1000));
        coordinator.tick(Instant.ofEpochMilli(2500));

        assertEquals(3, events.size());
        assertEquals(0, events.get(0).getSlotNumber());
        assertEquals(1, events.get(1).getSlotNumber());
        assertEquals(2, events.get(2).getSlotNumber());
        assertFalse(events.get(1).isLastSlotFromCurrentEpoch());
        assertTrue(events.get(2).isLastSlotFromCurrentEpoch());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        SlotCoordinator coordinator = new SlotCoordinator(epochState);
        List<SlotChangeEvent> events = new ArrayList<>();
        coordinator.addListener(event -> {
            throw new IllegalStateException("boom");
        });
        coordinator.addListener(events::add);

        coordinator.tick(Instant.ofEpochMilli(3000));

        assertEquals(1, events.size());
        assertEquals(1, events.get(0).getEpochIndex());
    }
}
