package io.palletchain.core.staking;

/**
 * @param totalStake      sum of stakes delegated to this validator
 * @param commissionRate  percent (0-100) of each nominator reward kept by the validator
 * @param active          inactive validators accept no new stake
 * @param nominatorCount  number of stakers referencing this validator
 */
public record ValidatorInfo<Bal>(Bal totalStake, int commissionRate, boolean active, int nominatorCount) {

    ValidatorInfo<Bal> withStake(Bal newTotal, int newCount) {
        return new ValidatorInfo<>(newTotal, commissionRate, active, newCount);
    }

    ValidatorInfo<Bal> withActive(boolean flag) {
        return new ValidatorInfo<>(totalStake, commissionRate, flag, nominatorCount);
    }
}
