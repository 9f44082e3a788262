package io.palletchain.core.runtime;

import io.palletchain.core.balances.BalancesCall;
import io.palletchain.core.staking.StakingCall;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Transaction surface offered to drivers. Signed variants carry the account that
 * pays the nonce; root variants (SetBalance, AddValidator) have no signer.
 */
public interface Transaction {

    Optional<String> signer();

    /** A transaction that maps onto a {@link RuntimeCall} dispatched from its signer. */
    interface Signed extends Transaction {
        String origin();

        RuntimeCall call();

        @Override
        default Optional<String> signer() {
            return Optional.of(origin());
        }
    }

    record Transfer(String from, String to, BigInteger amount) implements Signed {
        public Transfer {
            requireAccount(from);
            requireAccount(to);
            requireAmount(amount);
        }

        @Override public String origin() { return from; }

        @Override public RuntimeCall call() {
            return new RuntimeCall.Balances(new BalancesCall.Transfer<>(to, amount));
        }
    }

    record Stake(String who, BigInteger amount, String validator) implements Signed {
        public Stake {
            requireAccount(who);
            requireAccount(validator);
            requireAmount(amount);
        }

        @Override public String origin() { return who; }

        @Override public RuntimeCall call() {
            return new RuntimeCall.Staking(new StakingCall.Stake<>(amount, validator));
        }
    }

    record Unstake(String who) implements Signed {
        public Unstake {
            requireAccount(who);
        }

        @Override public String origin() { return who; }

        @Override public RuntimeCall call() { return RuntimeCall.unstake(); }
    }

    record ClaimRewards(String who) implements Signed {
        public ClaimRewards {
            requireAccount(who);
        }

        @Override public String origin() { return who; }

        @Override public RuntimeCall call() { return RuntimeCall.claimRewards(); }
    }

    record SetBalance(String who, BigInteger amount) implements Transaction {
        public SetBalance {
            requireAccount(who);
            requireAmount(amount);
        }

        @Override public Optional<String> signer() { return Optional.empty(); }
    }

    record AddValidator(String validator, int commission) implements Transaction {
        public AddValidator {
            requireAccount(validator);
        }

        @Override public Optional<String> signer() { return Optional.empty(); }
    }

    static Transfer transfer(String from, String to, long amount) {
        return new Transfer(from, to, BigInteger.valueOf(amount));
    }

    static SetBalance setBalance(String who, long amount) {
        return new SetBalance(who, BigInteger.valueOf(amount));
    }

    static Stake stake(String who, long amount, String validator) {
        return new Stake(who, BigInteger.valueOf(amount), validator);
    }

    private static void requireAccount(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("account id required");
    }

    private static void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() < 0) throw new IllegalArgumentException("amount must be >= 0");
    }
}
