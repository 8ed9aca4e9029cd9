package com.ivamare.auction.health;

import com.ivamare.auction.api.Auction;
import com.ivamare.auction.model.AuctionSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Duration;

/**
 * Health indicator for the auction.
 *
 * <p>Reports:
 * <ul>
 *   <li>Lifecycle phase and time left</li>
 *   <li>Current leader and number of accepted bids</li>
 *   <li>Commission and proceeds waiting to be claimed</li>
 * </ul>
 */
public class AuctionHealthIndicator implements HealthIndicator {

    private final Auction auction;

    public AuctionHealthIndicator(Auction auction) {
        this.auction = auction;
    }

    @Override
    public Health health() {
        try {
            AuctionSummary summary = auction.summary();
            Duration timeLeft = auction.timeLeft();

            return Health.up()
                .withDetail("phase", summary.phase().getValue())
                .withDetail("timeLeftSeconds", timeLeft.toSeconds())
                .withDetail("highestBidder", summary.highestBidder() != null ? summary.highestBidder().value() : "none")
                .withDetail("highestBid", summary.highestBid().toPlainString())
                .withDetail("bidCount", auction.allBids().size())
                .withDetail("commissionPending", summary.commissionTotal().toPlainString())
                .withDetail("proceedsPending", summary.proceedsPending().toPlainString())
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
