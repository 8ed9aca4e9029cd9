package com.ivamare.auction.event;

import com.ivamare.auction.model.AuctionEvent;

/**
 * Subscriber to auction notifications.
 */
@FunctionalInterface
public interface AuctionEventListener {

    void onEvent(AuctionEvent event);
}
