/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Lock state for one partition: the FIFO of waiters and whether the head holds the lock.
 * When locked, the queue is non-empty and its head is the holder.
 */
public class KeyQueueState {

    private final Deque<QueueEntry> queue;
    private boolean locked;

    public KeyQueueState() {
        this(List.of(), false);
    }

    @JsonCreator
    public KeyQueueState(@JsonProperty("queue") List<QueueEntry> queue,
                         @JsonProperty("locked") boolean locked) {
        this.queue = new ArrayDeque<>(queue == null ? List.of() : queue);
        this.locked = locked;
    }

    public void append(QueueEntry entry) {
        queue.addLast(entry);
    }

    /**
     * Grants the lock to the head waiter if the queue is unlocked and has waiters.
     *
     * @return the newly admitted head, or empty if nothing was promoted
     */
    public Optional<QueueEntry> promote() {
        if (locked || queue.isEmpty()) {
            return Optional.empty();
        }
        locked = true;
        return Optional.of(queue.peekFirst());
    }

    /**
     * Removes the current head and clears the lock.
     */
    public QueueEntry release() {
        var removed = queue.pollFirst();
        locked = false;
        return removed;
    }

    public Optional<QueueEntry> head() {
        return Optional.ofNullable(queue.peekFirst());
    }

    @JsonProperty("queue")
    public List<QueueEntry> entries() {
        return List.copyOf(queue);
    }

    @JsonProperty("locked")
    public boolean isLocked() {
        return locked;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int depth() {
        return queue.size();
    }

    /**
     * Checks the holder invariant, which can only break through a corrupted persisted state.
     */
    @JsonIgnore
    public boolean isConsistent() {
        return !locked || !queue.isEmpty();
    }

    public KeyQueueState copy() {
        return new KeyQueueState(entries(), locked);
    }
}
