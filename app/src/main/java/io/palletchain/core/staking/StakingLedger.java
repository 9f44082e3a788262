package io.palletchain.core.staking;

import io.palletchain.core.support.PalletException;

/**
 * Balance-side effects of staking calls, supplied by the caller for the duration
 * of one dispatch. Staking records that funds are locked; the ledger moves them.
 */
public interface StakingLedger<A, Bal> extends BalanceLookup<A, Bal> {

    /** Take {@code amount} out of the spendable balance of {@code who}. */
    void lock(A who, Bal amount) throws PalletException;

    /** Return previously locked funds. */
    void unlock(A who, Bal amount) throws PalletException;

    /** Credit a claimed reward. */
    void payout(A who, Bal amount) throws PalletException;
}
