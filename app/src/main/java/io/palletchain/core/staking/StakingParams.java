package io.palletchain.core.staking;

/** Tunables of the staking pallet. */
public final class StakingParams {
    public final long minimumStake;
    public final long rewardRate;       // per mille of the stake, per block
    public final long unstakingPeriod;  // blocks
    public final int maxValidators;

    public StakingParams(long minimumStake, long rewardRate, long unstakingPeriod, int maxValidators) {
        if (minimumStake < 0) throw new IllegalArgumentException("minimumStake must be >= 0");
        if (rewardRate < 0) throw new IllegalArgumentException("rewardRate must be >= 0");
        if (unstakingPeriod < 0) throw new IllegalArgumentException("unstakingPeriod must be >= 0");
        if (maxValidators < 0) throw new IllegalArgumentException("maxValidators must be >= 0");
        this.minimumStake = minimumStake;
        this.rewardRate = rewardRate;
        this.unstakingPeriod = unstakingPeriod;
        this.maxValidators = maxValidators;
    }

    public static StakingParams defaults() {
        return new StakingParams(
                100L,   // minimum stake
                5L,     // 0.5% per block
                10L,    // lock-up blocks
                10      // validator slots
        );
    }

    @Override public String toString() {
        return "StakingParams{min=" + minimumStake + ", rate=" + rewardRate
                + ", unstakingPeriod=" + unstakingPeriod + ", maxValidators=" + maxValidators + "}";
    }
}
