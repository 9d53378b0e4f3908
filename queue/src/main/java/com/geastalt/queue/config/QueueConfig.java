/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.config;

import com.geastalt.queue.model.QueueMode;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for queue behavior and state storage.
 */
@Configuration
@ConfigurationProperties(prefix = "queuemgr.queue")
@Getter
@Setter
public class QueueConfig {

    /**
     * Mode name, parsed with {@link QueueMode#fromValue}: single, multi, modeSingle or modeMulti.
     */
    private String defaultMode = "single";
    private String defaultStateId = "global";
    private long lockTimeoutMs = 5000;
    private StoreType store = StoreType.MEMORY;
    private String stateDirectory = "./queue-state";

    /**
     * Fails startup on an unknown default mode instead of on the first request.
     */
    @PostConstruct
    public void validate() {
        QueueMode.fromValue(defaultMode);
    }

    /**
     * Returns the requested mode, or the configured default when none was given.
     */
    public QueueMode resolveMode(QueueMode requested) {
        return requested != null ? requested : QueueMode.fromValue(defaultMode);
    }

    /**
     * Returns the requested state id, or the default when blank.
     */
    public String resolveStateId(String requested) {
        return requested == null || requested.isBlank() ? defaultStateId : requested.trim();
    }

    public enum StoreType {
        MEMORY,
        FILE
    }
}
