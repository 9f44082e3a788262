package io.palletchain.core.staking;

import io.palletchain.core.support.PalletException;

public final class StakingException extends PalletException {

    public StakingException(StakingError error) {
        super(error);
    }

    @Override
    public StakingError error() {
        return (StakingError) super.error();
    }
}
