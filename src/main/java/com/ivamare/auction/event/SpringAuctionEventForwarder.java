package com.ivamare.auction.event;

import com.ivamare.auction.model.AuctionEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Re-publishes auction events on the Spring application context,
 * so host beans can consume them with {@code @EventListener}.
 */
public class SpringAuctionEventForwarder implements AuctionEventListener {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringAuctionEventForwarder(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void onEvent(AuctionEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
