/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geastalt.queue.model.QueueState;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Queue state store keeping one JSON document per state id in a directory.
 * Writes go through a temporary file and an atomic move so a crash never leaves a partial document.
 */
@Slf4j
public class FileQueueStateStore implements QueueStateStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileQueueStateStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public Optional<QueueState> load(String stateId) {
        var file = fileFor(stateId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), QueueState.class));
        } catch (IOException e) {
            throw new QueueStateStoreException("Failed to read queue state " + stateId + " from " + file, e);
        }
    }

    @Override
    public void save(String stateId, QueueState state) {
        var file = fileFor(stateId);
        try {
            Files.createDirectories(directory);
            var temp = Files.createTempFile(directory, stateId + "-", ".tmp");
            try {
                mapper.writeValue(temp.toFile(), state);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Wrote state {} to {}", stateId, file);
        } catch (IOException e) {
            throw new QueueStateStoreException("Failed to write queue state " + stateId + " to " + file, e);
        }
    }

    Path fileFor(String stateId) {
        return directory.resolve(stateId + SUFFIX);
    }
}
