package com.ivamare.auction.policy;

import com.ivamare.auction.exception.InvalidConfigurationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Pricing and timing rules applied to every bid and payout.
 *
 * <p>All arithmetic is exact; no rounding is applied to commissions or increments.
 *
 * @param minIncrementRate Fraction a new bid must exceed the leader by (0.05 = 5%)
 * @param commissionRate Fraction skimmed from every refund and from the winning bid
 * @param snipingWindow A bid arriving with less than this left before the deadline extends it
 */
public record AuctionRules(
    BigDecimal minIncrementRate,
    BigDecimal commissionRate,
    Duration snipingWindow
) {
    public static final BigDecimal DEFAULT_MIN_INCREMENT_RATE = new BigDecimal("0.05");
    public static final BigDecimal DEFAULT_COMMISSION_RATE = new BigDecimal("0.02");
    public static final Duration DEFAULT_SNIPING_WINDOW = Duration.ofSeconds(60);

    public AuctionRules {
        if (minIncrementRate == null || minIncrementRate.signum() < 0) {
            throw new InvalidConfigurationException("minIncrementRate must be zero or positive");
        }
        if (commissionRate == null || commissionRate.signum() < 0 || commissionRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidConfigurationException("commissionRate must be in [0, 1)");
        }
        if (snipingWindow == null || snipingWindow.isNegative()) {
            throw new InvalidConfigurationException("snipingWindow must be zero or positive");
        }
    }

    /**
     * Default rules: 5% increment, 2% commission, 60 second sniping window.
     *
     * @return Default rules
     */
    public static AuctionRules defaultRules() {
        return new AuctionRules(DEFAULT_MIN_INCREMENT_RATE, DEFAULT_COMMISSION_RATE, DEFAULT_SNIPING_WINDOW);
    }

    /**
     * Smallest amount the next bid may carry. Zero when there is no leader yet,
     * in which case the bid must still be strictly positive.
     *
     * @param highestBid Current leading amount (zero before the first bid)
     * @return Minimum acceptable amount, inclusive
     */
    public BigDecimal minimumNextBid(BigDecimal highestBid) {
        return highestBid.multiply(BigDecimal.ONE.add(minIncrementRate));
    }

    /**
     * Check whether an amount satisfies the increment rule against the current leader.
     */
    public boolean isAcceptable(BigDecimal amount, BigDecimal highestBid) {
        return amount.signum() > 0 && amount.compareTo(minimumNextBid(highestBid)) >= 0;
    }

    /**
     * Commission owed on an amount leaving the auction.
     */
    public BigDecimal commissionOn(BigDecimal amount) {
        return amount.multiply(commissionRate);
    }

    /**
     * Check whether a bid at {@code now} falls inside the window before {@code auctionEndTime}.
     */
    public boolean isWithinSnipingWindow(Instant auctionEndTime, Instant now) {
        return Duration.between(now, auctionEndTime).compareTo(snipingWindow) < 0;
    }
}
