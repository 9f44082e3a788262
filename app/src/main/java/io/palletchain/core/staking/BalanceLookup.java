package io.palletchain.core.staking;

/**
 * Read-only view of spendable balances handed to {@link StakingPallet#stake}.
 * Staking never keeps a reference to the ledger that backs it.
 */
@FunctionalInterface
public interface BalanceLookup<A, Bal> {

    Bal balanceOf(A who);
}
