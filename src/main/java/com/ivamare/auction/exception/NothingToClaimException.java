package com.ivamare.auction.exception;

import java.util.Map;

/**
 * Thrown when a claim finds its balance already at zero.
 */
public class NothingToClaimException extends AuctionException {

    public NothingToClaimException(String balance) {
        super(AuctionErrorCode.NOTHING_TO_CLAIM,
            "No " + balance + " left to claim",
            Map.of("balance", balance));
    }
}
