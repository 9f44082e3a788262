package io.palletchain.core.staking;

/**
 * Active stake of one account.
 *
 * @param stakedAmount    locked amount
 * @param validator       chosen validator id
 * @param stakeBlock      block at which the stake was placed (lock-up starts here)
 * @param lastRewardBlock block of the last reward claim
 * @param totalRewards    cumulative rewards paid
 */
public record StakeInfo<A, B, Bal>(Bal stakedAmount, A validator, B stakeBlock, B lastRewardBlock, Bal totalRewards) {

    StakeInfo<A, B, Bal> withClaim(B block, Bal newTotalRewards) {
        return new StakeInfo<>(stakedAmount, validator, stakeBlock, block, newTotalRewards);
    }

    StakeInfo<A, B, Bal> withStakedAmount(Bal amount) {
        return new StakeInfo<>(amount, validator, stakeBlock, lastRewardBlock, totalRewards);
    }
}
