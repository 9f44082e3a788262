package io.palletchain.core.balances;

/** Calls a signed origin can make into the Balances pallet. */
public interface BalancesCall<A, Bal> {

    /** Move {@code amount} from the caller to {@code to}, paying the flat fee on top. */
    record Transfer<A, Bal>(A to, Bal amount) implements BalancesCall<A, Bal> {
        public Transfer {
            if (to == null) throw new IllegalArgumentException("to required");
            if (amount == null) throw new IllegalArgumentException("amount required");
        }
    }
}
