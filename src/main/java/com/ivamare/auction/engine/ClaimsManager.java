package com.ivamare.auction.engine;

import com.ivamare.auction.event.AuctionEventPublisher;
import com.ivamare.auction.exception.AuctionStillOpenException;
import com.ivamare.auction.exception.NothingToClaimException;
import com.ivamare.auction.exception.UnauthorizedException;
import com.ivamare.auction.history.HistoryTracker;
import com.ivamare.auction.ledger.ValueLedger;
import com.ivamare.auction.model.AuctionEvent;
import com.ivamare.auction.model.AuctionEventType;
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
import java.util.function.Function;

/**
 * Settles the auction once the deadline has passed.
 *
 * <p>Finalization charges commission on the winning bid and fixes the proceeds.
 * It runs at most once and is triggered by the first claim, or explicitly.
 * Each balance is zeroed before the ledger transfer that pays it out, so a transfer
 * calling back into the auction finds nothing left to claim.
 */
public class ClaimsManager {

    private static final Logger log = LoggerFactory.getLogger(ClaimsManager.class);

    static final String COMMISSION_BALANCE = "commission";
    static final String PROCEEDS_BALANCE = "proceeds";

    private final AuctionState state;
    private final HistoryTracker history;
    private final ValueLedger ledger;
    private final AuctionRules rules;
    private final AuctionEventPublisher eventPublisher;

    public ClaimsManager(
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
     * Finalize the auction. Idempotent: later calls do nothing.
     *
     * @param now Ledger time of the call
     * @return true if this call finalized the auction
     * @throws AuctionStillOpenException if the deadline has not been reached
     */
    public boolean finalizeAuction(Instant now) {
        requireEnded("finalizeAuction", now);
        if (state.isFinalized()) {
            return false;
        }

        AuctionTransaction txn = AuctionTransaction.begin("finalizeAuction", state, history);
        List<AuctionEvent> events;
        try {
            applyFinalization(txn, now);
            events = txn.commit();
        } catch (RuntimeException e) {
            txn.rollback();
            throw e;
        }
        eventPublisher.publishAll(events);
        return true;
    }

    /**
     * Pay the accumulated commission to the commission recipient.
     *
     * @param caller Must be the owner
     * @param now Ledger time of the call
     * @return Amount paid
     * @throws UnauthorizedException if the caller is not the owner
     * @throws AuctionStillOpenException if the deadline has not been reached
     * @throws NothingToClaimException if the commission balance is zero
     * @throws com.ivamare.auction.exception.TransferFailedException if the ledger refused the payout
     */
    public BigDecimal claimCommission(ParticipantId caller, Instant now) {
        return claim("claimCommission", caller, now, COMMISSION_BALANCE,
            AuctionTransaction::takeCommission,
            state.getCommissionRecipient(),
            AuctionEventType.COMMISSION_CLAIMED);
    }

    /**
     * Pay the winning proceeds, net of commission, to the proceeds recipient.
     *
     * @param caller Must be the owner
     * @param now Ledger time of the call
     * @return Amount paid
     * @throws UnauthorizedException if the caller is not the owner
     * @throws AuctionStillOpenException if the deadline has not been reached
     * @throws NothingToClaimException if the proceeds were already paid or there was no bid
     * @throws com.ivamare.auction.exception.TransferFailedException if the ledger refused the payout
     */
    public BigDecimal claimProceeds(ParticipantId caller, Instant now) {
        return claim("claimProceeds", caller, now, PROCEEDS_BALANCE,
            AuctionTransaction::takeProceeds,
            state.getProceedsRecipient(),
            AuctionEventType.PROCEEDS_TRANSFERRED);
    }

    private BigDecimal claim(
            String operation,
            ParticipantId caller,
            Instant now,
            String balance,
            Function<AuctionTransaction, BigDecimal> take,
            ParticipantId recipient,
            AuctionEventType eventType) {

        Objects.requireNonNull(caller, "caller must not be null");
        if (!state.isOwner(caller)) {
            log.warn("Rejected {} from {}: not the owner", operation, caller);
            throw new UnauthorizedException(operation, caller);
        }
        requireEnded(operation, now);

        AuctionTransaction txn = AuctionTransaction.begin(operation, state, history);
        BigDecimal amount;
        List<AuctionEvent> events;
        try {
            if (!state.isFinalized()) {
                applyFinalization(txn, now);
            }

            amount = take.apply(txn);
            if (amount.signum() == 0) {
                throw new NothingToClaimException(balance);
            }
            txn.emit(AuctionEvent.of(eventType, recipient, amount, now));

            ledger.transfer(recipient, amount);

            events = txn.commit();
        } catch (RuntimeException e) {
            txn.rollback();
            log.warn("{} rolled back: {}", operation, e.getMessage());
            throw e;
        }

        log.info("Paid {} of {} to {}", balance, amount.toPlainString(), recipient);

        eventPublisher.publishAll(events);
        return amount;
    }

    private void applyFinalization(AuctionTransaction txn, Instant now) {
        ParticipantId winner = state.getHighestBidder();
        BigDecimal winningBid = state.getHighestBid();
        BigDecimal proceeds = BigDecimal.ZERO;

        if (winner != null) {
            BigDecimal commission = rules.commissionOn(winningBid);
            proceeds = winningBid.subtract(commission);
            txn.addCommission(commission);
            txn.recordCommission(winner, commission);
        }

        txn.finalizeWith(proceeds);
        txn.emit(AuctionEvent.of(AuctionEventType.AUCTION_ENDED, winner, winningBid, now));

        log.info("Finalizing auction: winner={}, winningBid={}, proceeds={}",
            winner, winningBid.toPlainString(), proceeds.toPlainString());
    }

    private void requireEnded(String operation, Instant now) {
        if (!state.isEnded(now)) {
            log.warn("Rejected {}: auction open until {}", operation, state.getAuctionEndTime());
            throw new AuctionStillOpenException(operation, state.getAuctionEndTime());
        }
    }
}
