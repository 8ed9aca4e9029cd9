package com.ivamare.auction.health;

import com.ivamare.auction.AuctionAutoConfiguration;
import com.ivamare.auction.api.Auction;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for auction health indicators.
 */
@AutoConfiguration(after = AuctionAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "auction", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(AuctionHealthIndicator.class)
    @ConditionalOnBean(Auction.class)
    public AuctionHealthIndicator auctionHealthIndicator(Auction auction) {
        return new AuctionHealthIndicator(auction);
    }
}
