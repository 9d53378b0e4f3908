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

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyQueueState.
 */
class KeyQueueStateTest {

    private static QueueEntry entry(String key) {
        return new QueueEntry(key, Map.of(), Instant.EPOCH);
    }

    @Test
    @DisplayName("Should promote the head of an unlocked queue once")
    void shouldPromoteOnce() {
        var state = new KeyQueueState();
        state.append(entry("a"));
        state.append(entry("b"));

        var promoted = state.promote();

        assertTrue(promoted.isPresent());
        assertEquals("a", promoted.get().key());
        assertTrue(state.isLocked());
        assertTrue(state.promote().isEmpty());
    }

    @Test
    @DisplayName("Should not promote an empty queue")
    void shouldNotPromoteEmptyQueue() {
        var state = new KeyQueueState();

        assertTrue(state.promote().isEmpty());
        assertFalse(state.isLocked());
    }

    @Test
    @DisplayName("Should remove head and unlock on release")
    void shouldReleaseHead() {
        var state = new KeyQueueState(List.of(entry("a"), entry("b")), true);

        var released = state.release();

        assertEquals("a", released.key());
        assertFalse(state.isLocked());
        assertEquals("b", state.head().orElseThrow().key());
    }

    @Test
    @DisplayName("Should detect a lock without a holder")
    void shouldDetectInconsistency() {
        assertFalse(new KeyQueueState(List.of(), true).isConsistent());
        assertTrue(new KeyQueueState(List.of(), false).isConsistent());
        assertTrue(new KeyQueueState(List.of(entry("a")), true).isConsistent());
    }

    @Test
    @DisplayName("Should copy independently of the original")
    void shouldCopyIndependently() {
        var original = new KeyQueueState(List.of(entry("a")), false);

        var copy = original.copy();
        copy.append(entry("b"));
        copy.promote();

        assertEquals(1, original.depth());
        assertFalse(original.isLocked());
        assertEquals(2, copy.depth());
    }
}
