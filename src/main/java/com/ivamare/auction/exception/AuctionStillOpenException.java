package com.ivamare.auction.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Thrown when a settlement operation is attempted before the deadline.
 */
public class AuctionStillOpenException extends AuctionException {

    private final Instant auctionEndTime;

    public AuctionStillOpenException(String operation, Instant auctionEndTime) {
        super(AuctionErrorCode.AUCTION_STILL_OPEN,
            operation + " not allowed before " + auctionEndTime,
            Map.of("operation", operation, "auctionEndTime", auctionEndTime.toString()));
        this.auctionEndTime = auctionEndTime;
    }

    public Instant getAuctionEndTime() {
        return auctionEndTime;
    }
}
