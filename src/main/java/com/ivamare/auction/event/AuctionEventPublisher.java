package com.ivamare.auction.event;

import com.ivamare.auction.model.AuctionEvent;

import java.util.List;

/**
 * Outlet for auction notifications. Only committed calls publish.
 */
public interface AuctionEventPublisher {

    void publish(AuctionEvent event);

    default void publishAll(List<AuctionEvent> events) {
        events.forEach(this::publish);
    }
}
