package com.questrail.mcumgr.api;

import com.questrail.mcumgr.error.McuMgrException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one SMP exchange: exactly one of a value or an error.
 *
 * <p>Illegal states (both, or neither) are unrepresentable.</p>
 */
public sealed interface McuMgrResult<T> permits McuMgrResult.Success, McuMgrResult.Failure {

    static <T> McuMgrResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> McuMgrResult<T> failure(McuMgrException error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    Optional<T> value();

    Optional<McuMgrException> error();

    /**
     * Returns the value, or throws the carried error.
     */
    T getOrThrow() throws McuMgrException;

    record Success<T>(T result) implements McuMgrResult<T> {
        public Success {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.of(result);
        }

        @Override
        public Optional<McuMgrException> error() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return result;
        }
    }

    record Failure<T>(McuMgrException cause) implements McuMgrResult<T> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        @Override
        public Optional<McuMgrException> error() {
            return Optional.of(cause);
        }

        @Override
        public T getOrThrow() throws McuMgrException {
            throw cause;
        }
    }
}
