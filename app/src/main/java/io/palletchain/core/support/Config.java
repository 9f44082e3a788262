package io.palletchain.core.support;

/**
 * Full configuration shared by every pallet of one runtime.
 * Extends the System types with a Balance type so Balances and Staking
 * agree with System on account and block types.
 *
 * @param <Bal> fungible balance
 */
public interface Config<A extends Comparable<A>, B, N, Bal> extends SystemConfig<A, B, N> {

    Arithmetic<Bal> balances();

    /** Express a block count as a balance (reward accrual multiplies by it). */
    Bal toBalance(B blocks);
}
