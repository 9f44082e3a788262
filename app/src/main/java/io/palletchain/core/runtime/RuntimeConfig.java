package io.palletchain.core.runtime;

import io.palletchain.core.support.Arithmetic;
import io.palletchain.core.support.Config;

import java.math.BigInteger;

/**
 * Concrete types of the composed runtime, implemented once for all pallets:
 * AccountId = String, BlockNumber = u32, Nonce = u32, Balance = u128.
 */
public final class RuntimeConfig implements Config<String, Integer, Integer, BigInteger> {

    public static final RuntimeConfig INSTANCE = new RuntimeConfig();

    private RuntimeConfig() {}

    @Override
    public Arithmetic<Integer> blockNumbers() {
        return Arithmetic.UINT32;
    }

    @Override
    public Arithmetic<Integer> nonces() {
        return Arithmetic.UINT32;
    }

    @Override
    public Arithmetic<BigInteger> balances() {
        return Arithmetic.UINT128;
    }

    @Override
    public BigInteger toBalance(Integer blocks) {
        return Arithmetic.UINT32.toBigInteger(blocks);
    }
}
