/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.service;

import com.geastalt.queue.config.QueueConfig;
import com.geastalt.queue.model.ArrivalRequest;
import com.geastalt.queue.model.QueueError;
import com.geastalt.queue.model.QueueMode;
import com.geastalt.queue.model.QueueOutcome;
import com.geastalt.queue.model.QueueResult;
import com.geastalt.queue.model.QueueState;
import com.geastalt.queue.model.ReleaseSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Hosts the queue controller over a {@link QueueStateStore}.
 * Every load-process-save cycle for a state id runs inside an exclusive section
 * so concurrent callers observe a serialized history of invocations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueService {

    private static final Pattern STATE_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final QueueController controller;
    private final QueueStateStore stateStore;
    private final QueueConfig queueConfig;
    private final Map<String, StateLock> stateLocks = new ConcurrentHashMap<>();

    /**
     * Applies a batch of arrivals and release signals to the named state.
     *
     * @param stateId  State identifier; blank selects the configured default
     * @param mode     Queue mode; null selects the configured default
     * @param arrivals Lock requests, in order
     * @param signals  Release signals, in order
     * @return the outcome with admitted payloads, or an error if the state was not touched
     */
    public QueueResult<QueueOutcome> invoke(String stateId, QueueMode mode,
                                            List<ArrivalRequest> arrivals, List<ReleaseSignal> signals) {
        var id = queueConfig.resolveStateId(stateId);
        var effectiveMode = queueConfig.resolveMode(mode);
        log.debug("Invoke request: stateId={}, mode={}, arrivals={}, signals={}",
                id, effectiveMode, arrivals == null ? 0 : arrivals.size(), signals == null ? 0 : signals.size());

        if (!isValidStateId(id)) {
            log.warn("Rejected invocation with invalid state id '{}'", id);
            return QueueResult.failure(QueueError.invalidRequest("Invalid state id: " + id));
        }

        return withStateLock(id, () -> {
            var state = stateStore.load(id).orElseGet(QueueState::new);
            var broken = state.findInconsistentPartition();
            if (broken.isPresent()) {
                log.warn("State {} is inconsistent at partition {}", id, broken.get());
                return QueueResult.failure(QueueError.invalidState(id, broken.get()));
            }

            var outcome = controller.process(state, effectiveMode, arrivals, signals);
            stateStore.save(id, outcome.state());
            log.debug("State {} admitted {} payloads", id, outcome.admissions().size());
            return QueueResult.success(outcome);
        });
    }

    /**
     * Returns a read-only view of each partition of the named state.
     */
    public QueueResult<QueueSnapshot> inspect(String stateId) {
        var id = queueConfig.resolveStateId(stateId);
        if (!isValidStateId(id)) {
            return QueueResult.failure(QueueError.invalidRequest("Invalid state id: " + id));
        }

        return withStateLock(id, () -> {
            var state = stateStore.load(id).orElseGet(QueueState::new);
            var broken = state.findInconsistentPartition();
            if (broken.isPresent()) {
                log.warn("State {} is inconsistent at partition {}", id, broken.get());
                return QueueResult.failure(QueueError.invalidState(id, broken.get()));
            }
            var partitions = state.queues().entrySet().stream()
                    .map(e -> new PartitionInfo(
                            e.getKey(),
                            e.getValue().isLocked(),
                            e.getValue().depth(),
                            e.getValue().head().map(head -> head.key()).orElse(null)))
                    .toList();
            return QueueResult.success(new QueueSnapshot(id, partitions));
        });
    }

    public static boolean isValidStateId(String stateId) {
        return stateId != null && STATE_ID_PATTERN.matcher(stateId).matches();
    }

    /**
     * Number of state ids that currently have a caller inside or waiting for their exclusive section.
     */
    int activeStateLocks() {
        return stateLocks.size();
    }

    private <T> QueueResult<T> withStateLock(String stateId, Supplier<QueueResult<T>> action) {
        var stateLock = stateLocks.compute(stateId, (k, existing) -> {
            var entry = existing != null ? existing : new StateLock();
            entry.users++;
            return entry;
        });
        try {
            return runLocked(stateId, stateLock.lock, action);
        } finally {
            // drop the entry once no caller holds or waits for it
            stateLocks.computeIfPresent(stateId, (k, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    private <T> QueueResult<T> runLocked(String stateId, ReentrantLock lock, Supplier<QueueResult<T>> action) {
        long timeoutMs = queueConfig.getLockTimeoutMs();
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting {} ms for state {}", timeoutMs, stateId);
                return QueueResult.failure(QueueError.timeout(stateId, timeoutMs));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return QueueResult.failure(QueueError.error("Interrupted while waiting for state " + stateId));
        }

        try {
            return action.get();
        } catch (QueueStateStoreException e) {
            log.error("Queue state store failed for {}: {}", stateId, e.getMessage(), e);
            return QueueResult.failure(QueueError.storeFailure(stateId, e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Exclusive section for one state id with the count of callers using it.
     * The count is only read and written inside map compute calls.
     */
    private static final class StateLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Point-in-time view of a queue state.
     */
    public record QueueSnapshot(
            String stateId,
            List<PartitionInfo> partitions
    ) {}

    /**
     * Information about one partition. {@code headKey} is null for an empty partition.
     */
    public record PartitionInfo(
            String partition,
            boolean locked,
            int depth,
            String headKey
    ) {}
}
