package com.ivamare.auction.engine;

import com.ivamare.auction.event.AuctionEventPublisher;
import com.ivamare.auction.exception.AuctionClosedException;
import com.ivamare.auction.exception.InsufficientIncrementException;
import com.ivamare.auction.history.HistoryTracker;
import com.ivamare.auction.ledger.ValueLedger;
import com.ivamare.auction.model.AuctionEvent;
import com.ivamare.auction.model.AuctionEventType;
import com.ivamare.auction.model.Bid;
import com.ivamare.auction.model.ParticipantId;
import com.ivamare.auction.policy.AuctionRules;
import com.ivamare.auction.state.AuctionState;
import com.ivamare.auction.state.AuctionTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Validates and applies bids while the auction is open.
 *
 * <p>A bid is applied in this order:
 * <ol>
 *   <li>record the bid and make the sender the leader</li>
 *   <li>charge commission on the previous leader's amount and record the refund</li>
 *   <li>extend the deadline if the bid landed inside the sniping window</li>
 *   <li>transfer the refund to the previous leader through the ledger</li>
 * </ol>
 *
 * <p>The ledger transfer comes last, so a transfer that calls back into the auction
 * sees the new leader. If the transfer fails, every change made by the call is undone.
 */
public class BiddingEngine {

    private static final Logger log = LoggerFactory.getLogger(BiddingEngine.class);

    private final AuctionState state;
    private final HistoryTracker history;
    private final ValueLedger ledger;
    private final AuctionRules rules;
    private final AuctionEventPublisher eventPublisher;

    public BiddingEngine(
            AuctionState state,
            HistoryTracker history,
            ValueLedger ledger,
            AuctionEventPublisher eventPublisher) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.rules = state.getConfig().rules();
    }

    /**
     * Place a bid.
     *
     * @param sender Bidder
     * @param amount Value sent with the bid
     * @param now Ledger time of the call
     * @throws AuctionClosedException if {@code now} is at or past the deadline
     * @throws InsufficientIncrementException if the amount is not positive or below the minimum increment
     * @throws com.ivamare.auction.exception.TransferFailedException if the refund could not be paid
     */
    public void placeBid(ParticipantId sender, BigDecimal amount, Instant now) {
        Objects.requireNonNull(sender, "sender must not be null");
        Objects.requireNonNull(amount, "amount must not be null");

        if (state.isEnded(now)) {
            log.warn("Rejected bid of {} from {}: auction closed at {}",
                amount.toPlainString(), sender, state.getAuctionEndTime());
            throw new AuctionClosedException(state.getAuctionEndTime(), now);
        }

        BigDecimal highestBid = state.getHighestBid();
        if (!rules.isAcceptable(amount, highestBid)) {
            BigDecimal minimum = rules.minimumNextBid(highestBid);
            log.warn("Rejected bid of {} from {}: minimum is {}",
                amount.toPlainString(), sender, minimum.toPlainString());
            throw new InsufficientIncrementException(amount, minimum);
        }

        ParticipantId previousBidder = state.getHighestBidder();
        BigDecimal previousAmount = highestBid;

        AuctionTransaction txn = AuctionTransaction.begin("placeBid", state, history);
        List<AuctionEvent> events;
        try {
            txn.recordBid(new Bid(sender, amount));
            txn.setLeader(sender, amount);
            txn.emit(AuctionEvent.of(AuctionEventType.NEW_BID, sender, amount, now));

            BigDecimal refund = null;
            if (previousBidder != null) {
                BigDecimal commission = rules.commissionOn(previousAmount);
                refund = previousAmount.subtract(commission);
                txn.addCommission(commission);
                txn.recordCommission(previousBidder, commission);
                txn.recordRefund(previousBidder, refund);
                txn.emit(AuctionEvent.of(AuctionEventType.REFUNDED, previousBidder, refund, now));
            }

            Instant previousEndTime = state.getAuctionEndTime();
            if (rules.isWithinSnipingWindow(previousEndTime, now)
                    && txn.extendTo(now.plus(state.getExtension()))) {
                txn.emit(AuctionEvent.extended(sender, amount, now, state.getAuctionEndTime()));
            }

            if (refund != null) {
                ledger.transfer(previousBidder, refund);
            }

            events = txn.commit();
        } catch (RuntimeException e) {
            txn.rollback();
            log.warn("Bid of {} from {} rolled back: {}", amount.toPlainString(), sender, e.getMessage());
            throw e;
        }

        log.info("Accepted bid of {} from {} (previous leader={}, endTime={})",
            amount.toPlainString(), sender, previousBidder, state.getAuctionEndTime());

        eventPublisher.publishAll(events);
    }

    /**
     * Smallest amount the next bid may carry, inclusive. Zero before the first bid,
     * where any strictly positive amount is accepted.
     */
    public BigDecimal minimumNextBid() {
        return rules.minimumNextBid(state.getHighestBid());
    }
}
