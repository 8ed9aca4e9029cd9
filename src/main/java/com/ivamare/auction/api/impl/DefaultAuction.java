package com.ivamare.auction.api.impl;

import com.ivamare.auction.api.Auction;
import com.ivamare.auction.engine.BiddingEngine;
import com.ivamare.auction.engine.ClaimsManager;
import com.ivamare.auction.history.HistoryTracker;
import com.ivamare.auction.ledger.ValueLedger;
import com.ivamare.auction.model.AuctionStatus;
import com.ivamare.auction.model.AuctionSummary;
import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;
import com.ivamare.auction.state.AuctionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Default implementation of Auction.
 *
 * <p>Every method holds the instance monitor, so calls never interleave. The monitor
 * is reentrant: a ledger transfer that calls back into the auction on the same thread
 * proceeds and sees the state already updated by the outer call.
 */
public class DefaultAuction implements Auction {

    private static final Logger log = LoggerFactory.getLogger(DefaultAuction.class);

    private final AuctionState state;
    private final HistoryTracker history;
    private final BiddingEngine biddingEngine;
    private final ClaimsManager claimsManager;
    private final ValueLedger ledger;

    /**
     * Creates a new DefaultAuction.
     *
     * @param state Auction aggregate
     * @param history History of the same auction
     * @param biddingEngine Engine applying bids to {@code state}
     * @param claimsManager Manager settling {@code state}
     * @param ledger Ledger supplying time
     */
    public DefaultAuction(
            AuctionState state,
            HistoryTracker history,
            BiddingEngine biddingEngine,
            ClaimsManager claimsManager,
            ValueLedger ledger) {
        this.state = state;
        this.history = history;
        this.biddingEngine = biddingEngine;
        this.claimsManager = claimsManager;
        this.ledger = ledger;
    }

    // --- Bidding ---

    @Override
    public synchronized void placeBid(ParticipantId sender, BigDecimal amount) {
        biddingEngine.placeBid(sender, amount, ledger.now());
    }

    // --- Settlement ---

    @Override
    public synchronized BigDecimal claimCommission(ParticipantId caller) {
        return claimsManager.claimCommission(caller, ledger.now());
    }

    @Override
    public synchronized BigDecimal claimProceeds(ParticipantId caller) {
        return claimsManager.claimProceeds(caller, ledger.now());
    }

    @Override
    public synchronized boolean finalizeAuction() {
        return claimsManager.finalizeAuction(ledger.now());
    }

    // --- Queries ---

    @Override
    public synchronized boolean isEnded() {
        return state.isEnded(ledger.now());
    }

    @Override
    public synchronized Duration timeLeft() {
        return state.timeLeft(ledger.now());
    }

    @Override
    public synchronized AuctionStatus state() {
        return state.status(ledger.now());
    }

    @Override
    public synchronized AuctionSummary summary() {
        AuctionSummary summary = state.summary(ledger.now());
        log.debug("Auction summary: phase={}, highestBid={}", summary.phase(), summary.highestBid());
        return summary;
    }

    @Override
    public synchronized Optional<ParticipantId> highestBidder() {
        return Optional.ofNullable(state.getHighestBidder());
    }

    @Override
    public synchronized BigDecimal highestBid() {
        return state.getHighestBid();
    }

    @Override
    public synchronized BigDecimal minimumNextBid() {
        return biddingEngine.minimumNextBid();
    }

    @Override
    public synchronized List<Bid> allBids() {
        return history.allBids();
    }

    @Override
    public synchronized List<Bid> bidHistory(ParticipantId participant) {
        return history.bidsOf(participant);
    }

    @Override
    public synchronized List<BigDecimal> refundHistory(ParticipantId participant) {
        return history.refundsOf(participant);
    }

    @Override
    public synchronized List<BigDecimal> commissionHistory(ParticipantId participant) {
        return history.commissionsOf(participant);
    }
}
