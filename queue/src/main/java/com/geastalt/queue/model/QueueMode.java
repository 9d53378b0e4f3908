/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Key-resolution strategy shared by the queue controller.
 * Single mode is multi mode with one implicit, always-present partition.
 */
public enum QueueMode {

    /**
     * One global FIFO for every key. Entry keys only gate release: a signal
     * releases the head solely when its key is the same string as the head's key.
     */
    SINGLE {
        @Override
        public String partitionFor(String key) {
            return SINGLE_PARTITION;
        }

        @Override
        public Optional<String> partitionForSignal(ReleaseSignal signal) {
            return Optional.of(SINGLE_PARTITION);
        }

        @Override
        public boolean releases(QueueEntry head, ReleaseSignal signal) {
            return signal.matches(head.key());
        }

        @Override
        public boolean retainsIdlePartitions() {
            return true;
        }

        @Override
        public void initialize(QueueState state) {
            state.getOrCreate(SINGLE_PARTITION);
        }
    },

    /**
     * An independent FIFO per key. The signal key selects the queue, so no head check is made.
     * Numeric and boolean signal keys select the queue named by their text form.
     */
    MULTI {
        @Override
        public String partitionFor(String key) {
            return key;
        }

        @Override
        public Optional<String> partitionForSignal(ReleaseSignal signal) {
            return signal.keyText();
        }

        @Override
        public boolean releases(QueueEntry head, ReleaseSignal signal) {
            return true;
        }

        @Override
        public boolean retainsIdlePartitions() {
            return false;
        }

        @Override
        public void initialize(QueueState state) {
            // partitions are created on demand
        }
    };

    /**
     * Partition used by single mode for all entries.
     */
    public static final String SINGLE_PARTITION = "__single__";

    /**
     * Resolves the partition an arrival key belongs to.
     */
    public abstract String partitionFor(String key);

    /**
     * Resolves the partition a release signal addresses, or empty if its key selects none.
     */
    public abstract Optional<String> partitionForSignal(ReleaseSignal signal);

    /**
     * Checks if the signal may release the given head entry.
     */
    public abstract boolean releases(QueueEntry head, ReleaseSignal signal);

    /**
     * Whether a partition stays in the state after a release empties it.
     */
    public abstract boolean retainsIdlePartitions();

    /**
     * Brings the state into the shape this mode requires without dropping existing entries.
     */
    public abstract void initialize(QueueState state);

    /**
     * Parses a mode name. Accepts {@code single}/{@code multi} and the
     * {@code modeSingle}/{@code modeMulti} spellings, case-insensitively.
     */
    public static QueueMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Queue mode must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "single", "modesingle" -> SINGLE;
            case "multi", "modemulti" -> MULTI;
            default -> throw new IllegalArgumentException("Unknown queue mode: " + value);
        };
    }
}
