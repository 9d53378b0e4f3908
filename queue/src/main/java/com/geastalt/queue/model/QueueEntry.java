/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One admitted or waiting request in a queue.
 * The enqueue time is informational; queues are ordered by insertion.
 */
public record QueueEntry(
        String key,
        Map<String, Object> payload,
        Instant enqueuedAt
) {
    public QueueEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt must not be null");
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Creates an entry for an arrival at the given instant.
     */
    public static QueueEntry from(ArrivalRequest arrival, Instant enqueuedAt) {
        return new QueueEntry(arrival.key(), arrival.payload(), enqueuedAt);
    }

    /**
     * Returns a mutable copy of the payload for emission downstream.
     */
    public Map<String, Object> payloadCopy() {
        return new LinkedHashMap<>(payload);
    }
}
