package io.palletchain.core.staking;

/** Calls a signed origin can make into the Staking pallet. The caller is always the subject. */
public interface StakingCall<A, Bal> {

    record Stake<A, Bal>(Bal amount, A validator) implements StakingCall<A, Bal> {
        public Stake {
            if (amount == null) throw new IllegalArgumentException("amount required");
            if (validator == null) throw new IllegalArgumentException("validator required");
        }
    }

    record Unstake<A, Bal>() implements StakingCall<A, Bal> {}

    record ClaimRewards<A, Bal>() implements StakingCall<A, Bal> {}

    /** Register the caller as a validator. */
    record AddValidator<A, Bal>(int commission) implements StakingCall<A, Bal> {}

    /** Deregister the caller. */
    record RemoveValidator<A, Bal>() implements StakingCall<A, Bal> {}
}
