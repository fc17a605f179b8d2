package com.prozchain.leader.coordinator;

import com.prozchain.leader.EpochState;
import jakarta.annotation.PreDestroy;
import lombok.extern.java.Log;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Periodic slot timer. Emits one {@link SlotChangeEvent} per slot boundary observed.
 */
@Log
@Component
public class SlotCoordinator {

    private final List<SlotChangeListener> slotChangeListenerList = new CopyOnWriteArrayList<>();
    private final EpochState epochState;

    private ScheduledExecutorService scheduler;
    private long lastSlotNumber = -1;

    public SlotCoordinator(EpochState epochState) {
        this.epochState = epochState;
    }

    public void addListener(SlotChangeListener listener) {
        slotChangeListenerList.add(listener);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        lastSlotNumber = epochState.getCurrentSlotNumber();

        scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleAtFixedRate(() -> tick(Instant.now()), 0, 10, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Checks the clock and fires an event if a new slot has started since the last check.
     */
    public synchronized void tick(Instant now) {
        long currentSlotNumber = epochState.getSlotNumber(now);
        if (currentSlotNumber > lastSlotNumber) {
            lastSlotNumber = currentSlotNumber;
            triggerEvent(currentSlotNumber);
        }
    }

    private void triggerEvent(long currentSlotNumber) {
        long currentEpochIndex = epochState.getEpochIndex(currentSlotNumber);
        boolean isLastSlot = epochState.isLastSlotOfEpoch(currentSlotNumber);

        log.log(Level.FINE, String.format("Slot Number: %d | Epoch Index: %d | Is Last Slot: %s",
                currentSlotNumber, currentEpochIndex, isLastSlot));

        var event = new SlotChangeEvent(this, currentSlotNumber, currentEpochIndex, isLastSlot);
        for (SlotChangeListener slotChangeListener : slotChangeListenerList) {
            try {
                slotChangeListener.slotChanged(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Slot listener failed for slot " + currentSlotNumber, e);
            }
        }
    }
}
