package io.palletchain.core.support;

/**
 * Associated types of the System pallet.
 *
 * @param <A> account identity (ordered)
 * @param <B> block number
 * @param <N> per-account nonce
 */
public interface SystemConfig<A extends Comparable<A>, B, N> {

    Arithmetic<B> blockNumbers();

    Arithmetic<N> nonces();
}
