package com.ivamare.auction.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An accepted bid. Immutable once recorded.
 *
 * @param bidder Who placed the bid
 * @param amount Value sent with the bid
 */
public record Bid(ParticipantId bidder, BigDecimal amount) {

    public Bid {
        Objects.requireNonNull(bidder, "bidder must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
    }
}
