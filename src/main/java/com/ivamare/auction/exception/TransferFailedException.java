package com.ivamare.auction.exception;

import com.ivamare.auction.model.ParticipantId;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown by a ledger that refused or could not complete a transfer.
 */
public class TransferFailedException extends AuctionException {

    private final ParticipantId recipient;
    private final BigDecimal amount;

    public TransferFailedException(ParticipantId recipient, BigDecimal amount, String reason) {
        this(recipient, amount, reason, null);
    }

    public TransferFailedException(ParticipantId recipient, BigDecimal amount, String reason, Throwable cause) {
        super(AuctionErrorCode.TRANSFER_FAILED,
            "Transfer of " + amount.toPlainString() + " to " + recipient + " failed: " + reason,
            Map.of("recipient", recipient.value(), "amount", amount),
            cause);
        this.recipient = recipient;
        this.amount = amount;
    }

    public ParticipantId getRecipient() {
        return recipient;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
