package com.prozchain.slashing;

import com.prozchain.config.ConsensusConfig;
import com.prozchain.finality.FinalityEvent;
import com.prozchain.finality.FinalityListener;
import com.prozchain.finality.QuorumCertificate;
import com.prozchain.finality.Vote;
import com.prozchain.finality.VoteStage;
import com.prozchain.validator.ValidatorId;
import lombok.extern.java.Log;
import org.apache.commons.collections4.map.LRUMap;
import org.javatuples.Quartet;
import org.javatuples.Triplet;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Cross checks every vote against the recent votes of the same validator. Two signed votes for the same
 * height, round and stage referencing different blocks are self authenticating proof of double voting.
 * Votes that conflict with a finalized certificate after the recent buffer forgot them are reported as
 * long range equivocation.
 */
@Log
@Component
public class EquivocationDetector implements FinalityListener {

    private final ConsensusConfig config;
    private final Map<ValidatorId, LRUMap<Triplet<Long, Long, VoteStage>, Vote>> recentVotes = new HashMap<>();
    private final LRUMap<Quartet<ValidatorId, Long, Long, VoteStage>, Vote> finalizedVotes;

    public EquivocationDetector(ConsensusConfig config) {
        this.config = config;
        this.finalizedVotes = new LRUMap<>((int) Math.min(Integer.MAX_VALUE,
                Math.max(1024, config.getEvidenceExpiryWindow() * 4)));
    }

    /**
     * @return evidence if the vote conflicts with an earlier vote of the same validator
     */
    public synchronized Optional<SlashingEvidence> observe(Vote vote) {
        if (!vote.isSignatureValid()) {
            log.fine("Not checking unsigned or badly signed " + vote);
            return Optional.empty();
        }

        var key = Triplet.with(vote.getHeight(), vote.getRound(), vote.getStage());
        LRUMap<Triplet<Long, Long, VoteStage>, Vote> buffer = recentVotes.computeIfAbsent(vote.getValidator(),
                id -> new LRUMap<>(config.getRecentVoteBufferSize()));

        Vote previous = buffer.get(key);
        if (previous != null) {
            if (!previous.conflictsWith(vote)) {
                return Optional.empty();
            }
            return report(SlashingEvidence.equivocation(OffenseType.DOUBLE_VOTING, previous, vote));
        }
        buffer.put(key, vote);

        Vote finalized = finalizedVotes.get(
                Quartet.with(vote.getValidator(), vote.getHeight(), vote.getRound(), vote.getStage()));
        if (finalized != null && finalized.conflictsWith(vote)) {
            return report(SlashingEvidence.equivocation(OffenseType.LONG_RANGE_EQUIVOCATION, finalized, vote));
        }
        return Optional.empty();
    }

    /**
     * @return unavailability evidence once the validator missed at least the configured number of votes in a row
     */
    public Optional<SlashingEvidence> reportUnavailability(ValidatorId validator, long consecutiveMisses, long height) {
        if (consecutiveMisses < config.getUnavailabilityThreshold()) {
            return Optional.empty();
        }
        log.log(Level.INFO, String.format("Validator %s missed %d consecutive votes", validator, consecutiveMisses));
        return Optional.of(SlashingEvidence.unavailability(validator, height, consecutiveMisses));
    }

    @Override
    public synchronized void blockFinalized(FinalityEvent event) {
        QuorumCertificate certificate = event.getRecord().getCertificate();
        if (certificate == null) {
            return;
        }
        for (Vote vote : certificate.getVotes()) {
            finalizedVotes.put(Quartet.with(vote.getValidator(), vote.getHeight(), vote.getRound(), vote.getStage()),
                    vote);
        }
    }

    private Optional<SlashingEvidence> report(SlashingEvidence evidence) {
        log.log(Level.WARNING, String.format("Detected %s by %s at height %d",
                evidence.getOffense(), evidence.getOffender(), evidence.getHeight()));
        return Optional.of(evidence);
    }
}
