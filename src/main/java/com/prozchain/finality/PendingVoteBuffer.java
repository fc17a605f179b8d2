package com.prozchain.finality;

import com.prozchain.types.Hash256;
import lombok.extern.java.Log;
import org.apache.commons.collections4.queue.CircularFifoQueue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Votes for blocks that have not arrived yet. Bounded: when full, the oldest vote is dropped, which can only
 * delay finality.
 */
@Log
public class PendingVoteBuffer {

    private final CircularFifoQueue<Vote> votes;
    private long droppedCount;

    public PendingVoteBuffer(int capacity) {
        this.votes = new CircularFifoQueue<>(capacity);
    }

    public void add(Vote vote) {
        if (votes.contains(vote)) {
            return;
        }
        if (votes.isAtFullCapacity()) {
            droppedCount++;
            log.fine("VoteDropped: pending vote buffer full, evicting " + votes.peek());
        }
        votes.add(vote);
    }

    /**
     * Removes and returns the buffered votes for a block, oldest first.
     */
    public List<Vote> takeFor(Hash256 blockHash) {
        List<Vote> taken = new ArrayList<>();
        Iterator<Vote> iterator = votes.iterator();
        while (iterator.hasNext()) {
            Vote vote = iterator.next();
            if (vote.getBlockHash().equals(blockHash)) {
                taken.add(vote);
                iterator.remove();
            }
        }
        return taken;
    }

    /**
     * Drops votes for heights at or below {@code height}.
     *
     * @return the number of expired votes
     */
    public int expireAtOrBelow(long height) {
        int before = votes.size();
        Iterator<Vote> iterator = votes.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getHeight() <= height) {
                iterator.remove();
            }
        }
        return before - votes.size();
    }

    public int size() {
        return votes.size();
    }

    public long getDroppedCount() {
        return droppedCount;
    }
}
