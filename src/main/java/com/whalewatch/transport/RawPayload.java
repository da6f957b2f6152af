package com.whalewatch.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider message as received, tagged with the channel it came from and the entity whose
 * subscription it was routed to.
 */
public record RawPayload(String channel, String subscribedEntityId, JsonNode data, long receivedAt) {}
