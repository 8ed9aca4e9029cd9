package com.ivamare.auction.exception;

import java.util.Map;

/**
 * Base exception for all auction errors.
 *
 * <p>A call that throws leaves the auction exactly as it was before the call.
 */
public class AuctionException extends RuntimeException {

    private final AuctionErrorCode code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public AuctionException(AuctionErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public AuctionException(AuctionErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public AuctionException(AuctionErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super("[" + code.getValue() + "] " + message, cause);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public AuctionErrorCode getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
