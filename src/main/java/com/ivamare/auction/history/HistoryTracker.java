package com.ivamare.auction.history;

import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;

import java.math.BigDecimal;
import java.util.List;

/**
 * Append-only record of bids, refunds and commissions, globally and per participant.
 *
 * <p>Queries return snapshots in insertion order, and an empty list for a
 * participant that never appeared.
 */
public interface HistoryTracker {

    /**
     * Append an accepted bid to the global and per-bidder history.
     *
     * @param bid The accepted bid
     */
    void recordBid(Bid bid);

    /**
     * Append a refund paid to a participant.
     *
     * @param participant Refunded participant
     * @param amount Amount refunded (net of commission)
     */
    void recordRefund(ParticipantId participant, BigDecimal amount);

    /**
     * Append a commission charged to a participant.
     *
     * @param participant Overbid leader or winner
     * @param amount Commission charged
     */
    void recordCommission(ParticipantId participant, BigDecimal amount);

    /**
     * Every accepted bid, oldest first.
     */
    List<Bid> allBids();

    List<Bid> bidsOf(ParticipantId participant);

    List<BigDecimal> refundsOf(ParticipantId participant);

    List<BigDecimal> commissionsOf(ParticipantId participant);

    /**
     * Sum of every commission ever recorded, across all participants.
     */
    BigDecimal totalCommissions();

    /**
     * Sum of every refund ever recorded, across all participants.
     */
    BigDecimal totalRefunds();

    /**
     * Mark the current end of history so appends made after it can be discarded.
     *
     * @return Opaque checkpoint
     */
    Checkpoint checkpoint();

    /**
     * Discard every append made after the checkpoint. Only used to undo a call that failed.
     *
     * @param checkpoint Checkpoint taken earlier by this tracker
     */
    void rollbackTo(Checkpoint checkpoint);

    /**
     * Position in the append journal.
     *
     * @param position Number of appends made when the checkpoint was taken
     */
    record Checkpoint(int position) {}
}
