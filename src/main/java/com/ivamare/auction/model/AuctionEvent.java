package com.ivamare.auction.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A notification about something that happened to the auction.
 *
 * @param type Event type
 * @param participant Participant the event concerns (nullable for an auction that ended without bids)
 * @param amount Value involved in the event
 * @param timestamp Ledger time of the call that produced the event
 * @param endTime New deadline, set only on {@link AuctionEventType#AUCTION_EXTENDED}
 */
public record AuctionEvent(
    AuctionEventType type,
    ParticipantId participant,
    BigDecimal amount,
    Instant timestamp,
    Instant endTime
) {
    public static AuctionEvent of(AuctionEventType type, ParticipantId participant,
                                  BigDecimal amount, Instant timestamp) {
        return new AuctionEvent(type, participant, amount, timestamp, null);
    }

    /**
     * A late bid by {@code bidder} moved the deadline to {@code endTime}.
     */
    public static AuctionEvent extended(ParticipantId bidder, BigDecimal amount,
                                        Instant timestamp, Instant endTime) {
        return new AuctionEvent(AuctionEventType.AUCTION_EXTENDED, bidder, amount, timestamp, endTime);
    }
}
