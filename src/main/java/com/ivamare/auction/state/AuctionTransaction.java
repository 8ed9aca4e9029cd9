package com.ivamare.auction.state;

import com.ivamare.auction.history.HistoryTracker;
import com.ivamare.auction.model.AuctionEvent;
import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Unit of work around one external call.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>BEGIN: snapshot the auction state and checkpoint the history</li>
 *   <li>Mutate state and history through this transaction, then perform the external transfer</li>
 *   <li>COMMIT: hand back the events collected on the way, for publishing</li>
 *   <li>ROLLBACK: on any failure, restore the snapshot and discard history appended since BEGIN</li>
 * </ol>
 *
 * <p>A transaction begun while another one on the same auction is still active (a call
 * made from inside a ledger transfer) is nested. Its commit hands its events to the
 * enclosing transaction and returns nothing to publish; they are published when the
 * outermost transaction commits, and dropped if it rolls back.
 *
 * <p>All state changes go through this class; the auction aggregate exposes no public mutators.
 */
public class AuctionTransaction {

    private static final Logger log = LoggerFactory.getLogger(AuctionTransaction.class);

    private final String operation;
    private final AuctionState state;
    private final HistoryTracker history;
    private final AuctionState.Snapshot snapshot;
    private final HistoryTracker.Checkpoint checkpoint;
    private final AuctionTransaction enclosing;
    private final List<AuctionEvent> events = new ArrayList<>();
    private Status status = Status.ACTIVE;

    private AuctionTransaction(String operation, AuctionState state, HistoryTracker history) {
        this.operation = operation;
        this.state = state;
        this.history = history;
        this.snapshot = state.snapshot();
        this.checkpoint = history.checkpoint();
        this.enclosing = state.getActiveTransaction();
        state.setActiveTransaction(this);
    }

    /**
     * Begin a transaction for one call.
     *
     * @param operation Name of the call, for logging
     * @param state Auction aggregate
     * @param history History of the same auction
     * @return Active transaction
     */
    public static AuctionTransaction begin(String operation, AuctionState state, HistoryTracker history) {
        AuctionTransaction txn = new AuctionTransaction(operation, state, history);
        log.debug("[TXN-START] {} at history position {}, nested={}",
            operation, txn.checkpoint.position(), txn.isNested());
        return txn;
    }

    // --- State mutations ---

    public void setLeader(ParticipantId bidder, BigDecimal amount) {
        requireActive();
        state.setLeader(bidder, amount);
    }

    public boolean extendTo(Instant newEndTime) {
        requireActive();
        return state.extendTo(newEndTime);
    }

    public void addCommission(BigDecimal commission) {
        requireActive();
        state.addCommission(commission);
    }

    public BigDecimal takeCommission() {
        requireActive();
        return state.takeCommission();
    }

    public void finalizeWith(BigDecimal proceeds) {
        requireActive();
        state.finalizeWith(proceeds);
    }

    public BigDecimal takeProceeds() {
        requireActive();
        return state.takeProceeds();
    }

    // --- History appends ---

    public void recordBid(Bid bid) {
        requireActive();
        history.recordBid(bid);
    }

    public void recordRefund(ParticipantId participant, BigDecimal amount) {
        requireActive();
        history.recordRefund(participant, amount);
    }

    public void recordCommission(ParticipantId participant, BigDecimal amount) {
        requireActive();
        history.recordCommission(participant, amount);
    }

    // --- Events ---

    /**
     * Queue an event to be published once the transaction commits.
     */
    public void emit(AuctionEvent event) {
        requireActive();
        events.add(event);
    }

    // --- Completion ---

    /**
     * Commit and return the queued events in emission order. A nested transaction
     * passes its events to the enclosing one and returns an empty list.
     */
    public List<AuctionEvent> commit() {
        requireActive();
        status = Status.COMMITTED;
        state.setActiveTransaction(enclosing);
        if (isNested()) {
            enclosing.events.addAll(events);
            log.debug("[TXN-COMMIT] {} deferred {} events to {}", operation, events.size(), enclosing.operation);
            return List.of();
        }
        log.debug("[TXN-COMMIT] {} with {} events", operation, events.size());
        return List.copyOf(events);
    }

    /**
     * Restore the state captured at BEGIN and drop queued events.
     */
    public void rollback() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Cannot roll back " + operation + ": transaction " + status);
        }
        state.restore(snapshot);
        history.rollbackTo(checkpoint);
        events.clear();
        status = Status.ROLLED_BACK;
        state.setActiveTransaction(enclosing);
        log.debug("[TXN-ROLLBACK] {} restored to history position {}", operation, checkpoint.position());
    }

    public Status getStatus() {
        return status;
    }

    /**
     * True if this transaction began while another one was active.
     */
    public boolean isNested() {
        return enclosing != null;
    }

    private void requireActive() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction for " + operation + " is " + status);
        }
    }

    public enum Status {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }
}
