/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.config;

import com.geastalt.queue.service.FileQueueStateStore;
import com.geastalt.queue.service.InMemoryQueueStateStore;
import com.geastalt.queue.service.QueueStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Selects the state store implementation from {@link QueueConfig}.
 */
@Slf4j
@Configuration
public class StateStoreConfig {

    @Bean
    public QueueStateStore queueStateStore(QueueConfig queueConfig) {
        return switch (queueConfig.getStore()) {
            case MEMORY -> {
                log.info("Using in-memory queue state store");
                yield new InMemoryQueueStateStore();
            }
            case FILE -> {
                var directory = Path.of(queueConfig.getStateDirectory());
                log.info("Using file queue state store in {}", directory.toAbsolutePath());
                yield new FileQueueStateStore(directory);
            }
        };
    }
}
