package com.ivamare.auction.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the auction aggregate.
 *
 * @param owner Party allowed to trigger claims
 * @param commissionRecipient Receiver of accumulated commission
 * @param proceedsRecipient Receiver of the winning proceeds
 * @param highestBidder Current leader (nullable before the first bid)
 * @param highestBid Current leading amount (zero before the first bid)
 * @param initialEndTime Deadline fixed at creation
 * @param auctionEndTime Current deadline, including extensions
 * @param extension Time added by a late bid
 * @param commissionTotal Commission accumulated and not yet claimed
 * @param proceedsPending Proceeds computed and not yet claimed
 * @param phase Lifecycle phase at the time of the query
 */
public record AuctionSummary(
    ParticipantId owner,
    ParticipantId commissionRecipient,
    ParticipantId proceedsRecipient,
    ParticipantId highestBidder,
    BigDecimal highestBid,
    Instant initialEndTime,
    Instant auctionEndTime,
    Duration extension,
    BigDecimal commissionTotal,
    BigDecimal proceedsPending,
    AuctionPhase phase
) {}
