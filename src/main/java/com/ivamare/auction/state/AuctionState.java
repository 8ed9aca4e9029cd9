package com.ivamare.auction.state;

import com.ivamare.auction.model.AuctionPhase;
import com.ivamare.auction.model.AuctionStatus;
import com.ivamare.auction.model.AuctionSummary;
import com.ivamare.auction.model.ParticipantId;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The single mutable aggregate of one auction.
 *
 * <p>Identities, the initial deadline and the extension are fixed at creation.
 * The leader and the balances are changed only by the bidding engine and the
 * claims manager, always inside an {@link AuctionTransaction}.
 *
 * <p>Not thread-safe. Callers serialize access (see {@code DefaultAuction}).
 */
public class AuctionState {

    private final AuctionConfig config;
    private final Instant initialEndTime;

    private ParticipantId highestBidder;
    private BigDecimal highestBid = BigDecimal.ZERO;
    private Instant auctionEndTime;
    private BigDecimal commissionTotal = BigDecimal.ZERO;
    private BigDecimal proceedsPending = BigDecimal.ZERO;
    private boolean finalized;

    // Innermost transaction in progress; not part of the snapshot
    private AuctionTransaction activeTransaction;

    public AuctionState(AuctionConfig config, Instant createdAt) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.initialEndTime = createdAt.plus(config.duration());
        this.auctionEndTime = initialEndTime;
    }

    // --- Queries ---

    public boolean isEnded(Instant now) {
        return !now.isBefore(auctionEndTime);
    }

    /**
     * Remaining time until the deadline, zero once ended.
     */
    public Duration timeLeft(Instant now) {
        return isEnded(now) ? Duration.ZERO : Duration.between(now, auctionEndTime);
    }

    public AuctionStatus status(Instant now) {
        return new AuctionStatus(isEnded(now), timeLeft(now));
    }

    public AuctionPhase phase(Instant now) {
        if (finalized) {
            return AuctionPhase.FINALIZED;
        }
        return isEnded(now) ? AuctionPhase.ENDED : AuctionPhase.OPEN;
    }

    public AuctionSummary summary(Instant now) {
        return new AuctionSummary(
            config.owner(),
            config.commissionRecipient(),
            config.proceedsRecipient(),
            highestBidder,
            highestBid,
            initialEndTime,
            auctionEndTime,
            config.extension(),
            commissionTotal,
            proceedsPending,
            phase(now)
        );
    }

    public boolean hasBids() {
        return highestBidder != null;
    }

    public boolean isOwner(ParticipantId participant) {
        return config.owner().equals(participant);
    }

    public AuctionConfig getConfig() {
        return config;
    }

    public ParticipantId getOwner() {
        return config.owner();
    }

    public ParticipantId getCommissionRecipient() {
        return config.commissionRecipient();
    }

    public ParticipantId getProceedsRecipient() {
        return config.proceedsRecipient();
    }

    public Duration getExtension() {
        return config.extension();
    }

    public Instant getInitialEndTime() {
        return initialEndTime;
    }

    public Instant getAuctionEndTime() {
        return auctionEndTime;
    }

    public ParticipantId getHighestBidder() {
        return highestBidder;
    }

    public BigDecimal getHighestBid() {
        return highestBid;
    }

    public BigDecimal getCommissionTotal() {
        return commissionTotal;
    }

    public BigDecimal getProceedsPending() {
        return proceedsPending;
    }

    public boolean isFinalized() {
        return finalized;
    }

    // --- Mutations ---

    void setLeader(ParticipantId bidder, BigDecimal amount) {
        this.highestBidder = bidder;
        this.highestBid = amount;
    }

    /**
     * Move the deadline forward. Returns false, leaving the deadline untouched,
     * if {@code newEndTime} is not later than the current one.
     */
    boolean extendTo(Instant newEndTime) {
        if (!newEndTime.isAfter(auctionEndTime)) {
            return false;
        }
        this.auctionEndTime = newEndTime;
        return true;
    }

    void addCommission(BigDecimal commission) {
        this.commissionTotal = commissionTotal.add(commission);
    }

    BigDecimal takeCommission() {
        BigDecimal taken = commissionTotal;
        this.commissionTotal = BigDecimal.ZERO;
        return taken;
    }

    void finalizeWith(BigDecimal proceeds) {
        this.proceedsPending = proceeds;
        this.finalized = true;
    }

    BigDecimal takeProceeds() {
        BigDecimal taken = proceedsPending;
        this.proceedsPending = BigDecimal.ZERO;
        return taken;
    }

    // --- Transaction tracking ---

    AuctionTransaction getActiveTransaction() {
        return activeTransaction;
    }

    void setActiveTransaction(AuctionTransaction transaction) {
        this.activeTransaction = transaction;
    }

    // --- Snapshot support for AuctionTransaction ---

    Snapshot snapshot() {
        return new Snapshot(highestBidder, highestBid, auctionEndTime,
            commissionTotal, proceedsPending, finalized);
    }

    void restore(Snapshot snapshot) {
        this.highestBidder = snapshot.highestBidder();
        this.highestBid = snapshot.highestBid();
        this.auctionEndTime = snapshot.auctionEndTime();
        this.commissionTotal = snapshot.commissionTotal();
        this.proceedsPending = snapshot.proceedsPending();
        this.finalized = snapshot.finalized();
    }

    /**
     * Copy of every mutable field, taken when a transaction begins.
     */
    record Snapshot(
        ParticipantId highestBidder,
        BigDecimal highestBid,
        Instant auctionEndTime,
        BigDecimal commissionTotal,
        BigDecimal proceedsPending,
        boolean finalized
    ) {}
}
