package io.palletchain.core.balances;

import io.palletchain.core.support.PalletException;

public final class BalancesException extends PalletException {

    public BalancesException(BalancesError error) {
        super(error);
    }

    @Override
    public BalancesError error() {
        return (BalancesError) super.error();
    }
}
