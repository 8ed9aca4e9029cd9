package com.ivamare.auction.model;

import java.time.Duration;

/**
 * Answer to "is the auction over, and if not, for how long does it run".
 *
 * @param ended true once the deadline has been reached
 * @param timeLeft Remaining time, {@link Duration#ZERO} once ended
 */
public record AuctionStatus(boolean ended, Duration timeLeft) {}
