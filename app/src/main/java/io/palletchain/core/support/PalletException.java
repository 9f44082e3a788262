package io.palletchain.core.support;

/**
 * Expected failure of a pallet operation. Subclasses pin the error type
 * so callers can match on the module's own enum.
 */
public class PalletException extends Exception {
    private final DispatchError error;

    public PalletException(DispatchError error) {
        super(error.message());
        this.error = error;
    }

    public DispatchError error() {
        return error;
    }

    public DispatchResult toResult() {
        return DispatchResult.error(error);
    }
}
