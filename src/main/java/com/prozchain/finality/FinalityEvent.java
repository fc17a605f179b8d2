package com.prozchain.finality;

import com.prozchain.block.Block;
import lombok.Getter;

import java.util.EventObject;
import java.util.List;

@Getter
public class FinalityEvent extends EventObject {

    private final transient Block block;
    private final transient FinalityRecord record;
    private final transient List<Vote> participants;

    public FinalityEvent(Object source, Block block, FinalityRecord record, List<Vote> participants) {
        super(source);
        this.block = block;
        this.record = record;
        this.participants = List.copyOf(participants);
    }
}
