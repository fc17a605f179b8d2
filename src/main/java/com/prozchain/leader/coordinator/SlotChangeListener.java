package com.prozchain.leader.coordinator;

public interface SlotChangeListener {

    void slotChanged(SlotChangeEvent event);
}
