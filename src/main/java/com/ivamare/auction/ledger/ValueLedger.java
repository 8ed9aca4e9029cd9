package com.ivamare.auction.ledger;

import com.ivamare.auction.exception.TransferFailedException;
import com.ivamare.auction.model.ParticipantId;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * External ledger holding the auction's value and supplying time.
 *
 * <p>The host application provides the implementation. A transfer either completes
 * fully or throws without partial effect. A transfer may call back into the auction
 * before it returns; the auction has already updated its own state by then.
 */
public interface ValueLedger {

    /**
     * Move value held by the auction to a participant.
     *
     * @param to Recipient
     * @param amount Positive amount to transfer
     * @throws TransferFailedException if the ledger refuses or cannot complete the transfer
     */
    void transfer(ParticipantId to, BigDecimal amount);

    /**
     * Current ledger time. Never decreases between calls.
     *
     * @return Current time
     */
    Instant now();
}
