package com.prozchain.leader.coordinator;

import lombok.Getter;

import java.util.EventObject;

@Getter
public class SlotChangeEvent extends EventObject {

    private final long slotNumber;
    private final long epochIndex;
    private final boolean isLastSlotFromCurrentEpoch;

    /**
     * Constructs a prototypical Event.
     *
     * @param source                     the object on which the Event initially occurred
     * @param slotNumber                 the new slot that triggered the event
     * @param epochIndex                 the epoch the slot belongs to
     * @param isLastSlotFromCurrentEpoch whether the slot is the last slot of its epoch
     * @throws IllegalArgumentException if source is null
     */
    public SlotChangeEvent(Object source, long slotNumber, long epochIndex, boolean isLastSlotFromCurrentEpoch) {
        super(source);
        this.slotNumber = slotNumber;
        this.epochIndex = epochIndex;
        this.isLastSlotFromCurrentEpoch = isLastSlotFromCurrentEpoch;
    }
}
