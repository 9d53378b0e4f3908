/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.service;

import com.geastalt.queue.model.ArrivalRequest;
import com.geastalt.queue.model.QueueEntry;
import com.geastalt.queue.model.QueueMode;
import com.geastalt.queue.model.QueueOutcome;
import com.geastalt.queue.model.QueueState;
import com.geastalt.queue.model.ReleaseSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FIFO mutex state machine. Each invocation enqueues arrivals, promotes unlocked
 * queues, then applies release signals in order.
 *
 * <p>The controller never mutates the state it is given: it works on a copy and
 * returns the updated state with the admitted payloads. Callers must serialize
 * invocations against the same state.
 */
@Slf4j
@Component
public class QueueController {

    private final Clock clock;

    public QueueController() {
        this(Clock.systemUTC());
    }

    public QueueController(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs one activation of the queue.
     *
     * @param current  The persisted state, left unmodified
     * @param mode     Key-resolution mode for this invocation
     * @param arrivals Lock requests, in arrival order
     * @param signals  Release signals, in arrival order
     * @return the new state and the admissions, arrival promotions first
     */
    public QueueOutcome process(QueueState current, QueueMode mode,
                                List<ArrivalRequest> arrivals, List<ReleaseSignal> signals) {
        Objects.requireNonNull(current, "state must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        var state = current.copy();
        mode.initialize(state);
        List<Map<String, Object>> admissions = new ArrayList<>();

        for (var arrival : nullToEmpty(arrivals)) {
            if (arrival == null) {
                continue;
            }
            var entry = QueueEntry.from(arrival, clock.instant());
            state.getOrCreate(mode.partitionFor(entry.key())).append(entry);
        }

        state.queues().forEach((partition, queue) -> queue.promote().ifPresent(head -> {
            log.debug("Admitted {} on partition {}", head.key(), partition);
            admissions.add(head.payloadCopy());
        }));

        for (var signal : nullToEmpty(signals)) {
            if (signal == null || !signal.hasKey()) {
                continue;
            }
            var partition = mode.partitionForSignal(signal).orElse(null);
            if (partition == null) {
                log.debug("Ignoring release for {}: key selects no queue", signal.key());
                continue;
            }
            var queue = state.find(partition).orElse(null);
            if (queue == null || queue.isEmpty()) {
                log.debug("Ignoring release for {}: nothing queued", signal.key());
                continue;
            }
            if (!mode.releases(queue.head().orElseThrow(), signal)) {
                log.debug("Ignoring release for {}: head is held by {}",
                        signal.key(), queue.head().map(QueueEntry::key).orElse(null));
                continue;
            }

            var released = queue.release();
            log.debug("Released {} on partition {}", released.key(), partition);

            var promoted = queue.promote();
            if (promoted.isPresent()) {
                log.debug("Admitted {} on partition {}", promoted.get().key(), partition);
                admissions.add(promoted.get().payloadCopy());
            } else if (!mode.retainsIdlePartitions()) {
                state.remove(partition);
            }
        }

        return new QueueOutcome(state, admissions);
    }

    private static <T> List<T> nullToEmpty(List<T> items) {
        return items == null ? List.of() : items;
    }
}
