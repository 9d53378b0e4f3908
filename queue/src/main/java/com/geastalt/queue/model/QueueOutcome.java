/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one controller invocation: the updated state and the payloads admitted, in decision order.
 */
public record QueueOutcome(
        QueueState state,
        List<Map<String, Object>> admissions
) {
    public QueueOutcome {
        Objects.requireNonNull(state, "state must not be null");
        admissions = admissions == null ? List.of() : List.copyOf(admissions);
    }
}
