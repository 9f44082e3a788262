package io.palletchain.core.runtime;

import io.palletchain.core.support.DispatchError;

/** Failures raised by the runtime itself rather than by a pallet. */
public enum RuntimeError implements DispatchError {
    BLOCK_NUMBER_MISMATCH("block number does not match what is expected");

    private final String message;

    RuntimeError(String message) {
        this.message = message;
    }

    @Override
    public String module() {
        return "Runtime";
    }

    @Override
    public String message() {
        return message;
    }
}
