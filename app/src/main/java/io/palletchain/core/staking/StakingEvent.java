package io.palletchain.core.staking;

/** State transitions recorded by the staking pallet for outside observers. */
public interface StakingEvent {

    record Staked<A, Bal>(A who, Bal amount, A validator) implements StakingEvent {}

    record Unstaked<A, Bal>(A who, Bal amount) implements StakingEvent {}

    record ValidatorAdded<A>(A validator) implements StakingEvent {}

    record ValidatorRemoved<A>(A validator) implements StakingEvent {}

    record RewardsPaid<A, Bal>(A who, Bal amount) implements StakingEvent {}

    record SlashApplied<A, Bal>(A who, Bal amount) implements StakingEvent {}
}
