package com.ivamare.auction.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown when a bid is not positive or is below the minimum increment over the current leader.
 */
public class InsufficientIncrementException extends AuctionException {

    private final BigDecimal amount;
    private final BigDecimal minimumAmount;

    public InsufficientIncrementException(BigDecimal amount, BigDecimal minimumAmount) {
        super(AuctionErrorCode.INSUFFICIENT_INCREMENT,
            "Bid " + amount.toPlainString() + " below minimum " + minimumAmount.toPlainString(),
            Map.of("amount", amount, "minimumAmount", minimumAmount));
        this.amount = amount;
        this.minimumAmount = minimumAmount;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getMinimumAmount() {
        return minimumAmount;
    }
}
