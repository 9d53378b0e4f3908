/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.util.Objects;

/**
 * Represents an error that occurred during a queue operation.
 */
public record QueueError(
        QueueStatus status,
        String message
) {
    public QueueError {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static QueueError invalidRequest(String message) {
        return new QueueError(QueueStatus.INVALID_REQUEST, message);
    }

    /**
     * Creates an error for a persisted partition whose lock flag has no holder.
     */
    public static QueueError invalidState(String stateId, String partition) {
        return new QueueError(
                QueueStatus.INVALID_STATE,
                String.format("State %s is locked with no holder in partition '%s'", stateId, partition)
        );
    }

    public static QueueError storeFailure(String stateId, String cause) {
        return new QueueError(
                QueueStatus.STORE_ERROR,
                "State store failure for " + stateId + ": " + cause
        );
    }

    public static QueueError timeout(String stateId, long waitedMs) {
        return new QueueError(
                QueueStatus.TIMEOUT,
                String.format("Timed out after %d ms waiting for state %s", waitedMs, stateId)
        );
    }

    public static QueueError error(String message) {
        return new QueueError(QueueStatus.ERROR, message);
    }
}
