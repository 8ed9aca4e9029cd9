package com.ivamare.auction.model;

import java.util.Objects;

/**
 * Opaque identity of an auction participant (bidder, owner or payout recipient).
 *
 * <p>Carries no structure beyond equality; the ledger decides what the value means.
 *
 * @param value Identifier as understood by the ledger
 */
public record ParticipantId(String value) {

    public ParticipantId {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Participant id must not be blank");
        }
    }

    public static ParticipantId of(String value) {
        return new ParticipantId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
