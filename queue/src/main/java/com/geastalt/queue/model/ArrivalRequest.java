/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.util.Map;

/**
 * A request for exclusive access to the lock named by {@code key}.
 * A missing key is treated as the empty key; arrivals are never rejected.
 */
public record ArrivalRequest(
        String key,
        Map<String, Object> payload
) {
    public ArrivalRequest {
        key = key == null ? "" : key;
        payload = payload == null ? Map.of() : payload;
    }
}
