package io.palletchain.core.staking;

import io.palletchain.core.support.DispatchError;

public enum StakingError implements DispatchError {
    INSUFFICIENT_BALANCE("Insufficient balance to stake"),
    NOT_STAKED("Account is not staking"),
    ALREADY_STAKED("Account is already staking"),
    MINIMUM_STAKE_NOT_MET("Minimum stake amount not met"),
    INVALID_VALIDATOR("Invalid validator"),
    TOO_MANY_VALIDATORS("Too many validators"),
    NOT_VALIDATOR("Account is not a validator"),
    ALREADY_VALIDATOR("Account is already a validator"),
    REWARD_CALCULATION_ERROR("Error calculating rewards"),
    UNSTAKING_PERIOD_NOT_MET("Unstaking period not met");

    private final String message;

    StakingError(String message) {
        this.message = message;
    }

    @Override
    public String module() {
        return "Staking";
    }

    @Override
    public String message() {
        return message;
    }
}
