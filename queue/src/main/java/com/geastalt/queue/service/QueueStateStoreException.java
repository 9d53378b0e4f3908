/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.service;

/**
 * Raised when queue state cannot be read or written.
 */
public class QueueStateStoreException extends RuntimeException {

    public QueueStateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
