/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.service;

import com.geastalt.queue.model.QueueState;

import java.util.Optional;

/**
 * Durable home of queue state, keyed by state id.
 * Implementations hand out and keep copies; callers serialize read-modify-write per state id.
 *
 * @throws QueueStateStoreException from any method when the backing storage fails
 */
public interface QueueStateStore {

    Optional<QueueState> load(String stateId);

    void save(String stateId, QueueState state);
}
