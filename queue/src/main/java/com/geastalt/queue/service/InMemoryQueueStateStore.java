/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.service;

import com.geastalt.queue.model.QueueState;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory queue state store. State lives as long as the process.
 */
@Slf4j
public class InMemoryQueueStateStore implements QueueStateStore {

    private final Map<String, QueueState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<QueueState> load(String stateId) {
        return Optional.ofNullable(states.get(stateId)).map(QueueState::copy);
    }

    @Override
    public void save(String stateId, QueueState state) {
        states.put(stateId, state.copy());
        log.debug("Saved state {} with {} partitions", stateId, state.queues().size());
    }
}
