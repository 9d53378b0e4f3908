/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a host-level queue operation: a value or a {@link QueueError}.
 */
public sealed interface QueueResult<T> {

    boolean isSuccess();

    /**
     * Gets the value if successful, throws if not.
     */
    T getValue();

    /**
     * Gets the error if failed, throws if successful.
     */
    QueueError getError();

    <U> QueueResult<U> map(Function<T, U> mapper);

    /**
     * Executes the given consumer if this is a failure.
     */
    QueueResult<T> onFailure(Consumer<QueueError> consumer);

    static <T> QueueResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> QueueResult<T> failure(QueueError error) {
        return new Failure<>(error);
    }

    record Success<T>(T value) implements QueueResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public QueueError getError() {
            throw new IllegalStateException("Cannot get error from success result");
        }

        @Override
        public <U> QueueResult<U> map(Function<T, U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public QueueResult<T> onFailure(Consumer<QueueError> consumer) {
            return this;
        }
    }

    record Failure<T>(QueueError error) implements QueueResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Cannot get value from failure result: " + error);
        }

        @Override
        public QueueError getError() {
            return error;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> QueueResult<U> map(Function<T, U> mapper) {
            return (QueueResult<U>) this;
        }

        @Override
        public QueueResult<T> onFailure(Consumer<QueueError> consumer) {
            consumer.accept(error);
            return this;
        }
    }
}
