package com.ivamare.auction.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Thrown when a bid arrives at or after the deadline.
 */
public class AuctionClosedException extends AuctionException {

    private final Instant auctionEndTime;

    public AuctionClosedException(Instant auctionEndTime, Instant now) {
        super(AuctionErrorCode.AUCTION_CLOSED,
            "Auction closed at " + auctionEndTime,
            Map.of("auctionEndTime", auctionEndTime.toString(), "now", now.toString()));
        this.auctionEndTime = auctionEndTime;
    }

    public Instant getAuctionEndTime() {
        return auctionEndTime;
    }
}
