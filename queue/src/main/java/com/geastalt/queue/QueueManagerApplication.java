/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the Queue Manager.
 *
 * <p>Serializes access to named resources through persistent FIFO mutex queues.
 * Each invocation enqueues lock requests, admits the head of every unlocked
 * queue, and advances queues on release signals. Two modes are supported:
 * <ul>
 *   <li>Single - one global queue; a release must name the current holder's key</li>
 *   <li>Multi - an independent queue per key, dropped once it drains</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class QueueManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueueManagerApplication.class, args);
    }
}
