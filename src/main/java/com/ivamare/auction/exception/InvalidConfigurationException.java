package com.ivamare.auction.exception;

/**
 * Thrown at creation time when auction parameters are out of bounds. No auction is created.
 */
public class InvalidConfigurationException extends AuctionException {

    public InvalidConfigurationException(String message) {
        super(AuctionErrorCode.INVALID_CONFIGURATION, message);
    }
}
