package com.ivamare.auction.exception;

/**
 * Error kinds reported to callers of the auction.
 */
public enum AuctionErrorCode {
    INVALID_CONFIGURATION("INVALID_CONFIGURATION"),
    AUCTION_CLOSED("AUCTION_CLOSED"),
    AUCTION_STILL_OPEN("AUCTION_STILL_OPEN"),
    INSUFFICIENT_INCREMENT("INSUFFICIENT_INCREMENT"),
    UNAUTHORIZED("UNAUTHORIZED"),
    TRANSFER_FAILED("TRANSFER_FAILED"),
    NOTHING_TO_CLAIM("NOTHING_TO_CLAIM");

    private final String value;

    AuctionErrorCode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AuctionErrorCode fromValue(String value) {
        for (AuctionErrorCode code : values()) {
            if (code.value.equals(value)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown AuctionErrorCode: " + value);
    }
}
