package com.purchasingpower.hsn.conversation;

import com.purchasingpower.hsn.core.QueryResponse;

import java.time.Instant;

/**
 * One (query, response) exchange.
 */
public record Turn(String query, QueryResponse response, Instant timestamp) {
}
