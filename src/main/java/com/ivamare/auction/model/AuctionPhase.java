package com.ivamare.auction.model;

/**
 * Lifecycle phase of the auction.
 */
public enum AuctionPhase {
    /** Deadline not reached, bids accepted */
    OPEN("OPEN"),

    /** Deadline passed, settlement not yet finalized */
    ENDED("ENDED"),

    /** Deadline passed and final proceeds computed */
    FINALIZED("FINALIZED");

    private final String value;

    AuctionPhase(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AuctionPhase fromValue(String value) {
        for (AuctionPhase phase : values()) {
            if (phase.value.equals(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown AuctionPhase: " + value);
    }
}
