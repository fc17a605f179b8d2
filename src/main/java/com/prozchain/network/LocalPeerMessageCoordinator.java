package com.prozchain.network;

import com.prozchain.block.Block;
import com.prozchain.checkpoint.CheckpointSignature;
import com.prozchain.consensus.ConsensusMessageHandler;
import com.prozchain.finality.Vote;
import com.prozchain.utils.async.AsyncExecutor;
import jakarta.annotation.PreDestroy;
import lombok.extern.java.Log;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process gossip: fans every message out to the connected handlers on a worker pool. Used for single
 * process networks and simulations.
 */
@Log
public class LocalPeerMessageCoordinator implements PeerMessageCoordinator {

    private final AsyncExecutor asyncExecutor;
    private final List<ConsensusMessageHandler> peers = new CopyOnWriteArrayList<>();

    public LocalPeerMessageCoordinator() {
        this(AsyncExecutor.withPoolSize(4));
    }

    public LocalPeerMessageCoordinator(AsyncExecutor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    public void connect(ConsensusMessageHandler peer) {
        peers.add(peer);
    }

    public void disconnect(ConsensusMessageHandler peer) {
        peers.remove(peer);
    }

    @Override
    public void broadcastBlock(Block block) {
        sendMessageToActivePeers(peer -> peer.deliverBlock(block));
    }

    @Override
    public void broadcastVote(Vote vote) {
        sendMessageToActivePeers(peer -> peer.deliverVote(vote));
    }

    @Override
    public void broadcastCheckpointSignature(CheckpointSignature signature) {
        sendMessageToActivePeers(peer -> peer.deliverCheckpointSignature(signature));
    }

    @PreDestroy
    public void shutdown() {
        asyncExecutor.shutdown(1000);
    }

    private void sendMessageToActivePeers(Consumer<ConsensusMessageHandler> sender) {
        peers.forEach(peer -> asyncExecutor.executeAndForget(() -> sender.accept(peer)));
    }
}
