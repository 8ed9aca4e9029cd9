package com.ivamare.auction;

import com.ivamare.auction.policy.AuctionRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the auction.
 *
 * <p>Example configuration:
 * <pre>
 * auction:
 *   enabled: true
 *   owner: alice
 *   commission-recipient: house
 *   proceeds-recipient: seller
 *   duration: 600
 *   extension: 30
 *   rules:
 *     min-increment-rate: 0.05
 *     commission-rate: 0.02
 *     sniping-window: 60
 * </pre>
 *
 * <p>Plain numbers for durations are read as seconds.
 */
@ConfigurationProperties(prefix = "auction")
public class AuctionProperties {

    /**
     * Enable/disable auction auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Identity allowed to trigger claims.
     */
    private String owner;

    /**
     * Identity receiving accumulated commission.
     */
    private String commissionRecipient;

    /**
     * Identity receiving the winning proceeds.
     */
    private String proceedsRecipient;

    /**
     * Time from creation to the initial deadline. At least 120 seconds.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration duration = Duration.ofSeconds(120);

    /**
     * Time granted by a bid inside the sniping window. At least 30 seconds.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration extension = Duration.ofSeconds(30);

    /**
     * Pricing and timing rules.
     */
    private RulesProperties rules = new RulesProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getCommissionRecipient() {
        return commissionRecipient;
    }

    public void setCommissionRecipient(String commissionRecipient) {
        this.commissionRecipient = commissionRecipient;
    }

    public String getProceedsRecipient() {
        return proceedsRecipient;
    }

    public void setProceedsRecipient(String proceedsRecipient) {
        this.proceedsRecipient = proceedsRecipient;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    public Duration getExtension() {
        return extension;
    }

    public void setExtension(Duration extension) {
        this.extension = extension;
    }

    public RulesProperties getRules() {
        return rules;
    }

    public void setRules(RulesProperties rules) {
        this.rules = rules;
    }

    /**
     * Rules configuration properties.
     */
    public static class RulesProperties {

        /**
         * Fraction a new bid must exceed the current leader by.
         */
        private BigDecimal minIncrementRate = AuctionRules.DEFAULT_MIN_INCREMENT_RATE;

        /**
         * Fraction skimmed from every refund and from the winning bid.
         */
        private BigDecimal commissionRate = AuctionRules.DEFAULT_COMMISSION_RATE;

        /**
         * Remaining time below which a bid extends the deadline.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration snipingWindow = AuctionRules.DEFAULT_SNIPING_WINDOW;

        public BigDecimal getMinIncrementRate() {
            return minIncrementRate;
        }

        public void setMinIncrementRate(BigDecimal minIncrementRate) {
            this.minIncrementRate = minIncrementRate;
        }

        public BigDecimal getCommissionRate() {
            return commissionRate;
        }

        public void setCommissionRate(BigDecimal commissionRate) {
            this.commissionRate = commissionRate;
        }

        public Duration getSnipingWindow() {
            return snipingWindow;
        }

        public void setSnipingWindow(Duration snipingWindow) {
            this.snipingWindow = snipingWindow;
        }
    }
}
