package com.prozchain.network;

import com.prozchain.block.Block;
import com.prozchain.checkpoint.CheckpointSignature;
import com.prozchain.finality.Vote;

/**
 * Outbound boundary to the gossip layer. Delivery is at least once and in no particular order.
 */
public interface PeerMessageCoordinator {

    void broadcastBlock(Block block);

    void broadcastVote(Vote vote);

    void broadcastCheckpointSignature(CheckpointSignature signature);
}
