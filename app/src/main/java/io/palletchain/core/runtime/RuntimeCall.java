package io.palletchain.core.runtime;

import io.palletchain.core.balances.BalancesCall;
import io.palletchain.core.staking.StakingCall;

import java.math.BigInteger;

/** Union of every pallet's calls; the runtime routes on the variant. */
public interface RuntimeCall {

    record Balances(BalancesCall<String, BigInteger> call) implements RuntimeCall {
        public Balances {
            if (call == null) throw new IllegalArgumentException("call required");
        }
    }

    record Staking(StakingCall<String, BigInteger> call) implements RuntimeCall {
        public Staking {
            if (call == null) throw new IllegalArgumentException("call required");
        }
    }

    static RuntimeCall transfer(String to, long amount) {
        return new Balances(new BalancesCall.Transfer<>(to, BigInteger.valueOf(amount)));
    }

    static RuntimeCall stake(long amount, String validator) {
        return new Staking(new StakingCall.Stake<>(BigInteger.valueOf(amount), validator));
    }

    static RuntimeCall unstake() {
        return new Staking(new StakingCall.Unstake<>());
    }

    static RuntimeCall claimRewards() {
        return new Staking(new StakingCall.ClaimRewards<>());
    }

    static RuntimeCall addValidator(int commission) {
        return new Staking(new StakingCall.AddValidator<>(commission));
    }

    static RuntimeCall removeValidator() {
        return new Staking(new StakingCall.RemoveValidator<>());
    }
}
