package com.ivamare.auction.model;

/**
 * Notifications emitted by the auction.
 */
public enum AuctionEventType {
    /** A bid was accepted; participant is the new leader */
    NEW_BID("NEW_BID"),

    /** An overbid leader was refunded (amount net of commission) */
    REFUNDED("REFUNDED"),

    /** A late bid pushed the deadline; endTime carries the new deadline */
    AUCTION_EXTENDED("AUCTION_EXTENDED"),

    /** Auction was finalized after the deadline; participant is the winner (nullable) */
    AUCTION_ENDED("AUCTION_ENDED"),

    /** Accumulated commission was paid to the commission recipient */
    COMMISSION_CLAIMED("COMMISSION_CLAIMED"),

    /** Winning proceeds were paid to the proceeds recipient */
    PROCEEDS_TRANSFERRED("PROCEEDS_TRANSFERRED");

    private final String value;

    AuctionEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AuctionEventType fromValue(String value) {
        for (AuctionEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown AuctionEventType: " + value);
    }
}
