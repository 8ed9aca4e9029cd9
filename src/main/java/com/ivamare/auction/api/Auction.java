package com.ivamare.auction.api;

import com.ivamare.auction.model.AuctionStatus;
import com.ivamare.auction.model.AuctionSummary;
import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Public entry point of one auction.
 *
 * <p>Calls run one at a time and are all-or-nothing: a call that throws leaves the
 * auction exactly as it found it. Time is read from the ledger on every call.
 */
public interface Auction {

    // --- Bidding ---

    /**
     * Place a bid while the auction is open.
     *
     * @param sender Bidder
     * @param amount Value sent with the bid; at least 5% above the current leader
     * @throws com.ivamare.auction.exception.AuctionClosedException if the deadline has passed
     * @throws com.ivamare.auction.exception.InsufficientIncrementException if the amount is too low
     * @throws com.ivamare.auction.exception.TransferFailedException if the previous leader could not be refunded
     */
    void placeBid(ParticipantId sender, BigDecimal amount);

    // --- Settlement ---

    /**
     * Pay the accumulated commission to the commission recipient. Owner only, after the deadline.
     *
     * @param caller Caller identity
     * @return Amount paid
     */
    BigDecimal claimCommission(ParticipantId caller);

    /**
     * Pay the winning proceeds to the proceeds recipient. Owner only, after the deadline.
     *
     * @param caller Caller identity
     * @return Amount paid
     */
    BigDecimal claimProceeds(ParticipantId caller);

    /**
     * Fix the final settlement once the deadline has passed. Callable by anyone, idempotent.
     *
     * @return true if this call finalized the auction
     */
    boolean finalizeAuction();

    // --- Queries ---

    boolean isEnded();

    Duration timeLeft();

    AuctionStatus state();

    AuctionSummary summary();

    Optional<ParticipantId> highestBidder();

    BigDecimal highestBid();

    /**
     * Smallest amount the next bid may carry, inclusive. Zero before the first bid,
     * where any strictly positive amount is accepted.
     */
    BigDecimal minimumNextBid();

    List<Bid> allBids();

    List<Bid> bidHistory(ParticipantId participant);

    List<BigDecimal> refundHistory(ParticipantId participant);

    List<BigDecimal> commissionHistory(ParticipantId participant);
}
