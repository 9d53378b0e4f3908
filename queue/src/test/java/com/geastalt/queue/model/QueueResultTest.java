/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueueResult.
 */
class QueueResultTest {

    @Test
    @DisplayName("Should create success result")
    void shouldCreateSuccessResult() {
        var result = QueueResult.success("value");

        assertTrue(result.isSuccess());
        assertEquals("value", result.getValue());
        assertThrows(IllegalStateException.class, result::getError);
    }

    @Test
    @DisplayName("Should create failure result")
    void shouldCreateFailureResult() {
        var error = QueueError.timeout("global", 50);
        var result = QueueResult.<String>failure(error);

        assertFalse(result.isSuccess());
        assertEquals(QueueStatus.TIMEOUT, result.getError().status());
        assertThrows(IllegalStateException.class, result::getValue);
    }

    @Test
    @DisplayName("Should map success and pass failure through")
    void shouldMapOnlySuccess() {
        assertEquals(10, QueueResult.success(5).map(v -> v * 2).getValue());

        var error = QueueError.error("boom");
        var mapped = QueueResult.<Integer>failure(error).map(v -> v * 2);
        assertEquals(error, mapped.getError());
    }

    @Test
    @DisplayName("Should run failure callback only on failure")
    void shouldRunFailureCallback() {
        var seen = new AtomicReference<QueueError>();

        QueueResult.success(1).onFailure(seen::set);
        assertNull(seen.get());

        var error = QueueError.invalidRequest("bad");
        QueueResult.failure(error).onFailure(seen::set);
        assertEquals(error, seen.get());
    }

    @Test
    @DisplayName("Should mark only transient statuses retryable")
    void shouldClassifyRetryableStatuses() {
        assertTrue(QueueStatus.STORE_ERROR.isRetryable());
        assertTrue(QueueStatus.TIMEOUT.isRetryable());
        assertFalse(QueueStatus.INVALID_STATE.isRetryable());
        assertFalse(QueueStatus.INVALID_REQUEST.isRetryable());
        assertTrue(QueueStatus.OK.isSuccess());
    }
}
