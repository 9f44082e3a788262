package io.palletchain.core.staking;

public record StakingStats<Bal>(Bal totalStaked, int totalValidators, int activeValidators, int totalStakers, Bal averageStake) {
}
