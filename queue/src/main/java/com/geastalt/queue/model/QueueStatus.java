/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

/**
 * Represents the status of a queue operation.
 */
public enum QueueStatus {
    OK,

    /**
     * Request could not be interpreted (bad state id, mode or payload).
     */
    INVALID_REQUEST,

    /**
     * Persisted state violates the holder invariant.
     */
    INVALID_STATE,

    /**
     * State could not be read from or written to the store.
     */
    STORE_ERROR,

    /**
     * Exclusive access to the state was not obtained in time.
     */
    TIMEOUT,

    ERROR;

    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Checks if the failed operation left the state untouched and may be retried as is.
     */
    public boolean isRetryable() {
        return this == STORE_ERROR || this == TIMEOUT;
    }
}
