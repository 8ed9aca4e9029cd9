package com.ivamare.auction.history;

import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory {@link HistoryTracker}.
 *
 * <p>Every append is journaled so that {@link #rollbackTo(Checkpoint)} can remove
 * the tail appended by a failed call. Not thread-safe.
 */
public class InMemoryHistoryTracker implements HistoryTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHistoryTracker.class);

    private final List<Bid> allBids = new ArrayList<>();
    private final Map<ParticipantId, List<Bid>> bidsByParticipant = new HashMap<>();
    private final Map<ParticipantId, List<BigDecimal>> refundsByParticipant = new HashMap<>();
    private final Map<ParticipantId, List<BigDecimal>> commissionsByParticipant = new HashMap<>();
    private final List<JournalEntry> journal = new ArrayList<>();

    @Override
    public void recordBid(Bid bid) {
        Objects.requireNonNull(bid, "bid must not be null");
        allBids.add(bid);
        bidsByParticipant.computeIfAbsent(bid.bidder(), k -> new ArrayList<>()).add(bid);
        journal.add(new JournalEntry(EntryKind.BID, bid.bidder()));
    }

    @Override
    public void recordRefund(ParticipantId participant, BigDecimal amount) {
        refundsByParticipant.computeIfAbsent(participant, k -> new ArrayList<>()).add(amount);
        journal.add(new JournalEntry(EntryKind.REFUND, participant));
    }

    @Override
    public void recordCommission(ParticipantId participant, BigDecimal amount) {
        commissionsByParticipant.computeIfAbsent(participant, k -> new ArrayList<>()).add(amount);
        journal.add(new JournalEntry(EntryKind.COMMISSION, participant));
    }

    @Override
    public List<Bid> allBids() {
        return List.copyOf(allBids);
    }

    @Override
    public List<Bid> bidsOf(ParticipantId participant) {
        return List.copyOf(bidsByParticipant.getOrDefault(participant, List.of()));
    }

    @Override
    public List<BigDecimal> refundsOf(ParticipantId participant) {
        return List.copyOf(refundsByParticipant.getOrDefault(participant, List.of()));
    }

    @Override
    public List<BigDecimal> commissionsOf(ParticipantId participant) {
        return List.copyOf(commissionsByParticipant.getOrDefault(participant, List.of()));
    }

    @Override
    public BigDecimal totalCommissions() {
        return sum(commissionsByParticipant);
    }

    @Override
    public BigDecimal totalRefunds() {
        return sum(refundsByParticipant);
    }

    @Override
    public Checkpoint checkpoint() {
        return new Checkpoint(journal.size());
    }

    @Override
    public void rollbackTo(Checkpoint checkpoint) {
        if (checkpoint.position() > journal.size()) {
            throw new IllegalStateException("Checkpoint " + checkpoint.position()
                + " is ahead of history (" + journal.size() + " entries)");
        }

        int discarded = journal.size() - checkpoint.position();
        while (journal.size() > checkpoint.position()) {
            JournalEntry entry = journal.remove(journal.size() - 1);
            switch (entry.kind()) {
                case BID -> {
                    allBids.remove(allBids.size() - 1);
                    removeLast(bidsByParticipant, entry.participant());
                }
                case REFUND -> removeLast(refundsByParticipant, entry.participant());
                case COMMISSION -> removeLast(commissionsByParticipant, entry.participant());
            }
        }

        if (discarded > 0) {
            log.debug("Discarded {} history entries back to position {}", discarded, checkpoint.position());
        }
    }

    private static <T> void removeLast(Map<ParticipantId, List<T>> byParticipant, ParticipantId participant) {
        List<T> entries = byParticipant.get(participant);
        entries.remove(entries.size() - 1);
        if (entries.isEmpty()) {
            byParticipant.remove(participant);
        }
    }

    private static BigDecimal sum(Map<ParticipantId, List<BigDecimal>> byParticipant) {
        return byParticipant.values().stream()
            .flatMap(List::stream)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private enum EntryKind { BID, REFUND, COMMISSION }

    private record JournalEntry(EntryKind kind, ParticipantId participant) {}
}
