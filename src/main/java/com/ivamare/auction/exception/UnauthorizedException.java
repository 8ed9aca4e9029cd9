package com.ivamare.auction.exception;

import com.ivamare.auction.model.ParticipantId;

import java.util.Map;

/**
 * Thrown when someone other than the owner calls an owner-only operation.
 */
public class UnauthorizedException extends AuctionException {

    private final ParticipantId caller;

    public UnauthorizedException(String operation, ParticipantId caller) {
        super(AuctionErrorCode.UNAUTHORIZED,
            caller + " is not allowed to " + operation,
            Map.of("operation", operation, "caller", caller.value()));
        this.caller = caller;
    }

    public ParticipantId getCaller() {
        return caller;
    }
}
