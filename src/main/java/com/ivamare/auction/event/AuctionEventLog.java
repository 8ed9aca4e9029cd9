package com.ivamare.auction.event;

import com.ivamare.auction.model.AuctionEvent;
import com.ivamare.auction.model.AuctionEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of published events with subscriber fan-out.
 *
 * <p>A listener that throws does not affect the auction or other listeners;
 * the call that produced the event has already committed.
 */
public class AuctionEventLog implements AuctionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AuctionEventLog.class);

    private final List<AuctionEvent> events = new CopyOnWriteArrayList<>();
    private final List<AuctionEventListener> listeners = new CopyOnWriteArrayList<>();

    public AuctionEventLog() {
    }

    public AuctionEventLog(List<AuctionEventListener> listeners) {
        this.listeners.addAll(listeners);
    }

    @Override
    public void publish(AuctionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        events.add(event);

        for (AuctionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {} event", listener, event.type(), e);
            }
        }
    }

    public void subscribe(AuctionEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public boolean unsubscribe(AuctionEventListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Every event published so far, oldest first.
     */
    public List<AuctionEvent> events() {
        return List.copyOf(events);
    }

    public List<AuctionEvent> eventsOfType(AuctionEventType type) {
        List<AuctionEvent> matching = new ArrayList<>();
        for (AuctionEvent event : events) {
            if (event.type() == type) {
                matching.add(event);
            }
        }
        return matching;
    }
}
