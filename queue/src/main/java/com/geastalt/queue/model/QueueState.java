/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted queue state: partitions keyed by the value the active mode resolves keys to.
 * Partitions keep insertion order so promotion order is stable across invocations.
 */
public class QueueState {

    private final Map<String, KeyQueueState> queues;

    public QueueState() {
        this(Map.of());
    }

    @JsonCreator
    public QueueState(@JsonProperty("queues") Map<String, KeyQueueState> queues) {
        this.queues = new LinkedHashMap<>(queues == null ? Map.of() : queues);
    }

    @JsonProperty("queues")
    public Map<String, KeyQueueState> queues() {
        return Collections.unmodifiableMap(queues);
    }

    public KeyQueueState getOrCreate(String partition) {
        return queues.computeIfAbsent(partition, k -> new KeyQueueState());
    }

    public Optional<KeyQueueState> find(String partition) {
        return Optional.ofNullable(queues.get(partition));
    }

    public void remove(String partition) {
        queues.remove(partition);
    }

    /**
     * Returns the first partition whose holder invariant is broken, if any.
     */
    public Optional<String> findInconsistentPartition() {
        return queues.entrySet().stream()
                .filter(e -> e.getValue() == null || !e.getValue().isConsistent())
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * Deep copy; entries are immutable and shared.
     */
    public QueueState copy() {
        var copied = new LinkedHashMap<String, KeyQueueState>();
        queues.forEach((partition, state) -> copied.put(partition, state.copy()));
        return new QueueState(copied);
    }
}
