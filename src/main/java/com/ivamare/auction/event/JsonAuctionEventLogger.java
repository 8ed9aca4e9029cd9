package com.ivamare.auction.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.auction.model.AuctionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes every event as a single JSON line to the {@code auction.events} logger.
 */
public class JsonAuctionEventLogger implements AuctionEventListener {

    static final String LOGGER_NAME = "auction.events";

    private static final Logger log = LoggerFactory.getLogger(JsonAuctionEventLogger.class);

    private final ObjectMapper objectMapper;
    private final Logger eventLog;

    public JsonAuctionEventLogger(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(LOGGER_NAME));
    }

    JsonAuctionEventLogger(ObjectMapper objectMapper, Logger eventLog) {
        this.objectMapper = objectMapper;
        this.eventLog = eventLog;
    }

    @Override
    public void onEvent(AuctionEvent event) {
        try {
            eventLog.info(toJson(event));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} event: {}", event.type(), e.getMessage());
        }
    }

    String toJson(AuctionEvent event) throws JsonProcessingException {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("type", event.type().getValue());
        line.put("participant", event.participant() != null ? event.participant().value() : null);
        line.put("amount", event.amount() != null ? event.amount().toPlainString() : null);
        line.put("timestamp", event.timestamp());
        if (event.endTime() != null) {
            line.put("endTime", event.endTime());
        }
        return objectMapper.writeValueAsString(line);
    }
}
