package io.palletchain.core.balances;

import io.palletchain.core.support.DispatchError;

public enum BalancesError implements DispatchError {
    INSUFFICIENT_BALANCE("Insufficient balance"),
    INSUFFICIENT_FUNDS("Insufficient funds to pay fees"),
    OVERFLOW_IN_CALCULATION("Overflow in calculating transfer costs"),
    OVERFLOW_IN_TRANSFER("Overflow in transfer calculation"),
    INVALID_AMOUNT("Invalid amount specified");

    private final String message;

    BalancesError(String message) {
        this.message = message;
    }

    @Override
    public String module() {
        return "Balances";
    }

    @Override
    public String message() {
        return message;
    }
}
