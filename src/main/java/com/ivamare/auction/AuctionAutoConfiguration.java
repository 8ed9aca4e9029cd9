package com.ivamare.auction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.auction.api.Auction;
import com.ivamare.auction.api.impl.DefaultAuction;
import com.ivamare.auction.engine.BiddingEngine;
import com.ivamare.auction.engine.ClaimsManager;
import com.ivamare.auction.event.AuctionEventLog;
import com.ivamare.auction.event.JsonAuctionEventLogger;
import com.ivamare.auction.event.SpringAuctionEventForwarder;
import com.ivamare.auction.history.HistoryTracker;
import com.ivamare.auction.history.InMemoryHistoryTracker;
import com.ivamare.auction.ledger.ValueLedger;
import com.ivamare.auction.model.ParticipantId;
import com.ivamare.auction.policy.AuctionRules;
import com.ivamare.auction.state.AuctionConfig;
import com.ivamare.auction.state.AuctionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the auction.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Auction rules and config from {@link AuctionProperties}</li>
 *   <li>History tracker and event log</li>
 *   <li>Auction state, bidding engine, claims manager and the {@link Auction} facade</li>
 * </ul>
 *
 * <p>The host application must provide a {@link ValueLedger} bean; without one
 * no auction is created.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * auction.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "auction", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AuctionProperties.class)
public class AuctionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuctionAutoConfiguration.class);

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper auctionObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // --- Rules and config ---

    @Bean
    @ConditionalOnMissingBean
    public AuctionRules auctionRules(AuctionProperties properties) {
        AuctionProperties.RulesProperties rules = properties.getRules();
        return new AuctionRules(
            rules.getMinIncrementRate(),
            rules.getCommissionRate(),
            rules.getSnipingWindow()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ValueLedger.class)
    public AuctionConfig auctionConfig(AuctionProperties properties, AuctionRules rules) {
        return new AuctionConfig(
            participant(properties.getOwner()),
            participant(properties.getCommissionRecipient()),
            participant(properties.getProceedsRecipient()),
            properties.getDuration(),
            properties.getExtension(),
            rules
        );
    }

    // --- History and events ---

    @Bean
    @ConditionalOnMissingBean
    public HistoryTracker historyTracker() {
        return new InMemoryHistoryTracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonAuctionEventLogger jsonAuctionEventLogger(ObjectMapper objectMapper) {
        return new JsonAuctionEventLogger(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuctionEventLog auctionEventLog(
            ApplicationEventPublisher applicationEventPublisher,
            JsonAuctionEventLogger jsonAuctionEventLogger) {
        return new AuctionEventLog(List.of(
            jsonAuctionEventLogger,
            new SpringAuctionEventForwarder(applicationEventPublisher)
        ));
    }

    // --- Auction ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ValueLedger.class)
    public AuctionState auctionState(AuctionConfig config, ValueLedger ledger) {
        AuctionState state = new AuctionState(config, ledger.now());
        log.info("Created auction (owner={}, endTime={}, extension={}s)",
            config.owner(), state.getAuctionEndTime(), config.extension().toSeconds());
        return state;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ValueLedger.class)
    public BiddingEngine biddingEngine(
            AuctionState state,
            HistoryTracker historyTracker,
            ValueLedger ledger,
            AuctionEventLog eventLog) {
        return new BiddingEngine(state, historyTracker, ledger, eventLog);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ValueLedger.class)
    public ClaimsManager claimsManager(
            AuctionState state,
            HistoryTracker historyTracker,
            ValueLedger ledger,
            AuctionEventLog eventLog) {
        return new ClaimsManager(state, historyTracker, ledger, eventLog);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ValueLedger.class)
    public Auction auction(
            AuctionState state,
            HistoryTracker historyTracker,
            BiddingEngine biddingEngine,
            ClaimsManager claimsManager,
            ValueLedger ledger) {
        return new DefaultAuction(state, historyTracker, biddingEngine, claimsManager, ledger);
    }

    private static ParticipantId participant(String value) {
        return value == null || value.isBlank() ? null : ParticipantId.of(value);
    }
}
