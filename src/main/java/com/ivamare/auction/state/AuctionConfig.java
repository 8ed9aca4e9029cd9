package com.ivamare.auction.state;

import com.ivamare.auction.exception.InvalidConfigurationException;
import com.ivamare.auction.model.ParticipantId;
import com.ivamare.auction.policy.AuctionRules;

import java.time.Duration;

/**
 * Parameters fixed at auction creation. Validated eagerly.
 *
 * @param owner Party allowed to trigger claims
 * @param commissionRecipient Receiver of accumulated commission
 * @param proceedsRecipient Receiver of the winning proceeds
 * @param duration Time from creation to the initial deadline (at least 120 seconds)
 * @param extension Time granted by a late bid (at least 30 seconds)
 * @param rules Increment, commission and sniping rules
 */
public record AuctionConfig(
    ParticipantId owner,
    ParticipantId commissionRecipient,
    ParticipantId proceedsRecipient,
    Duration duration,
    Duration extension,
    AuctionRules rules
) {
    public static final Duration MIN_DURATION = Duration.ofSeconds(120);
    public static final Duration MIN_EXTENSION = Duration.ofSeconds(30);

    public AuctionConfig {
        if (owner == null) {
            throw new InvalidConfigurationException("owner is required");
        }
        if (commissionRecipient == null) {
            throw new InvalidConfigurationException("commissionRecipient is required");
        }
        if (proceedsRecipient == null) {
            throw new InvalidConfigurationException("proceedsRecipient is required");
        }
        if (duration == null || duration.compareTo(MIN_DURATION) < 0) {
            throw new InvalidConfigurationException("duration must be at least " + MIN_DURATION.toSeconds() + "s");
        }
        if (extension == null || extension.compareTo(MIN_EXTENSION) < 0) {
            throw new InvalidConfigurationException("extension must be at least " + MIN_EXTENSION.toSeconds() + "s");
        }
        if (rules == null) {
            rules = AuctionRules.defaultRules();
        }
    }

    /**
     * Config with default rules.
     */
    public static AuctionConfig of(
            ParticipantId owner,
            ParticipantId commissionRecipient,
            ParticipantId proceedsRecipient,
            Duration duration,
            Duration extension) {
        return new AuctionConfig(owner, commissionRecipient, proceedsRecipient,
            duration, extension, AuctionRules.defaultRules());
    }
}
