package io.palletchain.core.staking;

import io.palletchain.core.protocol.ProtocolLimits;
import io.palletchain.core.support.Arithmetic;
import io.palletchain.core.support.Config;
import io.palletchain.core.support.Dispatch;
import io.palletchain.core.support.DispatchResult;
import io.palletchain.core.support.PalletException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validator registry and per-account stakes with block-based rewards.
 *
 * Invariants kept by every operation:
 * - a StakeInfo exists iff the account has an active stake
 * - totalStaked == sum of all stakedAmount
 * - validator.totalStake == sum of stakedAmount of the stakes referencing it
 *
 * Checks run before writes; a failing call leaves state untouched.
 */
public final class StakingPallet<A extends Comparable<A>, B, Bal> {
    private static final Logger LOG = Logger.getLogger(StakingPallet.class.getName());

    private final Config<A, B, ?, Bal> config;
    private final Arithmetic<B> blocks;
    private final Arithmetic<Bal> math;

    private final Bal minimumStake;
    private final Bal rewardRate;
    private final B unstakingPeriod;
    private final int maxValidators;

    private final Map<A, StakeInfo<A, B, Bal>> stakes = new TreeMap<>();
    private final Map<A, ValidatorInfo<Bal>> validators = new TreeMap<>();
    private final List<StakingEvent> events = new ArrayList<>();
    private Bal totalStaked;
    private B currentBlock;

    public StakingPallet(Config<A, B, ?, Bal> config) {
        this(config, StakingParams.defaults());
    }

    public StakingPallet(Config<A, B, ?, Bal> config, StakingParams params) {
        this.config = config;
        this.blocks = config.blockNumbers();
        this.math = config.balances();
        this.minimumStake = math.fromLong(params.minimumStake);
        this.rewardRate = math.fromLong(params.rewardRate);
        this.unstakingPeriod = blocks.fromLong(params.unstakingPeriod);
        this.maxValidators = params.maxValidators;
        this.totalStaked = math.zero();
        this.currentBlock = blocks.zero();
    }

    // -------------------- block hook --------------------

    /**
     * Called once per finalized block. Moves the staking clock and claims rewards for
     * every staker; a staker whose claim fails (e.g. validator removed) is skipped.
     * Crediting the returned rewards is up to the caller.
     *
     * @return reward claimed per staker this block (zero rewards omitted)
     */
    public Map<A, Bal> onBlock(B blockNumber) {
        return settleBlock(blockNumber, (who, amount) -> { });
    }

    /**
     * Same as {@link #onBlock(Object)} but each reward is credited through {@code ledger}
     * before the claim is recorded. A payout the ledger rejects stays unclaimed and
     * accrues into the next block.
     */
    public Map<A, Bal> onBlock(B blockNumber, StakingLedger<A, Bal> ledger) {
        return settleBlock(blockNumber, ledger::payout);
    }

    private Map<A, Bal> settleBlock(B blockNumber, Payout<A, Bal> payout) {
        this.currentBlock = blockNumber;
        Map<A, Bal> payouts = new LinkedHashMap<>();
        for (A staker : new ArrayList<>(stakes.keySet())) {
            try {
                Bal reward = claimRewards(staker, payout);
                if (!math.isZero(reward)) {
                    payouts.put(staker, reward);
                }
            } catch (StakingException e) {
                LOG.log(Level.FINE, "Skipping reward for " + staker + ": " + e.getMessage());
            } catch (PalletException e) {
                LOG.warning("Reward payout to " + staker + " rejected, left unclaimed: " + e.getMessage());
            }
        }
        return payouts;
    }

    @FunctionalInterface
    private interface Payout<A, Bal> {
        void pay(A who, Bal amount) throws PalletException;
    }

    public B currentBlock() {
        return currentBlock;
    }

    // -------------------- validators --------------------

    public void addValidator(A validator, int commissionRate) throws StakingException {
        if (validator == null) throw new IllegalArgumentException("validator required");
        if (validators.containsKey(validator)) {
            throw new StakingException(StakingError.ALREADY_VALIDATOR);
        }
        if (validators.size() >= maxValidators) {
            throw new StakingException(StakingError.TOO_MANY_VALIDATORS);
        }
        if (commissionRate < 0 || commissionRate > ProtocolLimits.MAX_COMMISSION_PERCENT) {
            throw new StakingException(StakingError.INVALID_VALIDATOR);
        }

        // stakes frozen by an earlier removal of this id rejoin it
        List<A> rejoining = new ArrayList<>();
        Bal rejoinedStake = math.zero();
        for (Map.Entry<A, StakeInfo<A, B, Bal>> e : stakes.entrySet()) {
            if (validator.equals(e.getValue().validator())) {
                rejoinedStake = math.checkedAdd(rejoinedStake, e.getValue().stakedAmount())
                        .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
                rejoining.add(e.getKey());
            }
        }

        for (A staker : rejoining) {
            StakeInfo<A, B, Bal> info = stakes.get(staker);
            // nothing accrues for the blocks spent frozen
            stakes.put(staker, info.withClaim(currentBlock, info.totalRewards()));
        }
        validators.put(validator, new ValidatorInfo<>(rejoinedStake, commissionRate, true, rejoining.size()));
        events.add(new StakingEvent.ValidatorAdded<>(validator));
    }

    /**
     * Deregister a validator. Stakes pointing at it are frozen, not migrated:
     * they earn nothing and can still be unstaked once the lock-up has passed.
     */
    public void removeValidator(A validator) throws StakingException {
        if (!validators.containsKey(validator)) {
            throw new StakingException(StakingError.NOT_VALIDATOR);
        }
        validators.remove(validator);
        events.add(new StakingEvent.ValidatorRemoved<>(validator));
    }

    public void setValidatorActive(A validator, boolean active) throws StakingException {
        ValidatorInfo<Bal> info = validators.get(validator);
        if (info == null) {
            throw new StakingException(StakingError.NOT_VALIDATOR);
        }
        validators.put(validator, info.withActive(active));
    }

    // -------------------- staking --------------------

    /**
     * Record a stake of {@code amount} with {@code validator}. Only tracks the lock;
     * taking the funds out of the spendable balance is up to the caller.
     */
    public void stake(A who, Bal amount, A validator, BalanceLookup<A, Bal> balanceCheck) throws StakingException {
        if (who == null) throw new IllegalArgumentException("account required");
        if (stakes.containsKey(who)) {
            throw new StakingException(StakingError.ALREADY_STAKED);
        }
        if (math.lessThan(amount, minimumStake)) {
            throw new StakingException(StakingError.MINIMUM_STAKE_NOT_MET);
        }
        ValidatorInfo<Bal> info = validator == null ? null : validators.get(validator);
        if (info == null || !info.active()) {
            throw new StakingException(StakingError.INVALID_VALIDATOR);
        }
        if (math.lessThan(balanceCheck.balanceOf(who), amount)) {
            throw new StakingException(StakingError.INSUFFICIENT_BALANCE);
        }

        Bal validatorTotal = math.checkedAdd(info.totalStake(), amount)
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
        if (info.nominatorCount() == Integer.MAX_VALUE) {
            throw new StakingException(StakingError.REWARD_CALCULATION_ERROR);
        }
        Bal newTotalStaked = math.checkedAdd(totalStaked, amount)
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));

        validators.put(validator, info.withStake(validatorTotal, info.nominatorCount() + 1));
        stakes.put(who, new StakeInfo<>(amount, validator, currentBlock, currentBlock, math.zero()));
        totalStaked = newTotalStaked;
        events.add(new StakingEvent.Staked<>(who, amount, validator));
    }

    /** @return the freed amount; crediting it back is up to the caller */
    public Bal unstake(A who) throws StakingException {
        StakeInfo<A, B, Bal> info = stakes.get(who);
        if (info == null) {
            throw new StakingException(StakingError.NOT_STAKED);
        }
        Optional<B> unlockAt = blocks.checkedAdd(info.stakeBlock(), unstakingPeriod);
        if (unlockAt.isEmpty() || blocks.lessThan(currentBlock, unlockAt.get())) {
            throw new StakingException(StakingError.UNSTAKING_PERIOD_NOT_MET);
        }

        Bal amount = info.stakedAmount();
        Bal newTotalStaked = math.checkedSub(totalStaked, amount)
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
        ValidatorInfo<Bal> validator = validators.get(info.validator());
        ValidatorInfo<Bal> updated = null;
        if (validator != null) {
            Bal validatorTotal = math.checkedSub(validator.totalStake(), amount)
                    .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
            updated = validator.withStake(validatorTotal, Math.max(0, validator.nominatorCount() - 1));
        }

        if (updated != null) {
            validators.put(info.validator(), updated);
        }
        stakes.remove(who);
        totalStaked = newTotalStaked;
        events.add(new StakingEvent.Unstaked<>(who, amount));
        return amount;
    }

    /**
     * Net reward accrued since the last claim:
     * base = staked * rate * blocks / 1000, net = base - base * commission / 100.
     */
    public Bal calculateRewards(A who) throws StakingException {
        StakeInfo<A, B, Bal> info = stakes.get(who);
        if (info == null) {
            throw new StakingException(StakingError.NOT_STAKED);
        }
        B elapsed = blocks.checkedSub(currentBlock, info.lastRewardBlock())
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));

        Bal base = math.checkedMul(info.stakedAmount(), rewardRate)
                .flatMap(v -> math.checkedMul(v, config.toBalance(elapsed)))
                .map(v -> math.divide(v, math.fromLong(ProtocolLimits.REWARD_SCALE)))
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));

        ValidatorInfo<Bal> validator = validators.get(info.validator());
        if (validator == null) {
            throw new StakingException(StakingError.INVALID_VALIDATOR);
        }
        Bal commission = math.checkedMul(base, math.fromLong(validator.commissionRate()))
                .map(v -> math.divide(v, math.fromLong(100)))
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
        return math.checkedSub(base, commission)
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
    }

    public Bal claimRewards(A who) throws StakingException {
        Bal reward = calculateRewards(who);
        recordClaim(who, reward, rewardTotal(who, reward));
        return reward;
    }

    /** Pay first, record second: a rejected payout leaves the claim untouched. */
    private Bal claimRewards(A who, Payout<A, Bal> payout) throws PalletException {
        Bal reward = calculateRewards(who);
        Bal total = rewardTotal(who, reward);
        if (!math.isZero(reward)) {
            payout.pay(who, reward);
        }
        recordClaim(who, reward, total);
        return reward;
    }

    private Bal rewardTotal(A who, Bal reward) throws StakingException {
        return math.checkedAdd(stakes.get(who).totalRewards(), reward)
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
    }

    private void recordClaim(A who, Bal reward, Bal total) {
        stakes.put(who, stakes.get(who).withClaim(currentBlock, total));
        events.add(new StakingEvent.RewardsPaid<>(who, reward));
    }

    /**
     * Cut up to {@code amount} from a stake. A stake slashed to zero is removed.
     *
     * @return the amount actually slashed
     */
    public Bal slash(A who, Bal amount) throws StakingException {
        StakeInfo<A, B, Bal> info = stakes.get(who);
        if (info == null) {
            throw new StakingException(StakingError.NOT_STAKED);
        }
        Bal cut = math.lessThan(amount, info.stakedAmount()) ? amount : info.stakedAmount();
        Bal remaining = math.checkedSub(info.stakedAmount(), cut).orElseThrow();
        Bal newTotalStaked = math.checkedSub(totalStaked, cut)
                .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));

        ValidatorInfo<Bal> validator = validators.get(info.validator());
        if (validator != null) {
            Bal validatorTotal = math.checkedSub(validator.totalStake(), cut)
                    .orElseThrow(() -> new StakingException(StakingError.REWARD_CALCULATION_ERROR));
            int count = math.isZero(remaining) ? Math.max(0, validator.nominatorCount() - 1) : validator.nominatorCount();
            validators.put(info.validator(), validator.withStake(validatorTotal, count));
        }
        if (math.isZero(remaining)) {
            stakes.remove(who);
        } else {
            stakes.put(who, info.withStakedAmount(remaining));
        }
        totalStaked = newTotalStaked;
        events.add(new StakingEvent.SlashApplied<>(who, cut));
        return cut;
    }

    // -------------------- dispatch --------------------

    /**
     * Dispatch view bound to {@code ledger} for one call. The ledger is not retained
     * by the pallet; drop the returned view after use.
     */
    public Dispatch<A, StakingCall<A, Bal>> withLedger(StakingLedger<A, Bal> ledger) {
        return (caller, call) -> dispatch(caller, call, ledger);
    }

    /**
     * Run a staking call and apply its balance effect through {@code ledger}.
     * When the ledger rejects the effect the staking change is rolled back.
     */
    public DispatchResult dispatch(A caller, StakingCall<A, Bal> call, StakingLedger<A, Bal> ledger) {
        Snapshot snapshot = new Snapshot(caller, call);
        boolean applied = false;
        try {
            if (call instanceof StakingCall.Stake<A, Bal> stake) {
                stake(caller, stake.amount(), stake.validator(), ledger);
                applied = true;
                ledger.lock(caller, stake.amount());
            } else if (call instanceof StakingCall.Unstake) {
                Bal freed = unstake(caller);
                applied = true;
                ledger.unlock(caller, freed);
            } else if (call instanceof StakingCall.ClaimRewards) {
                Bal reward = claimRewards(caller);
                applied = true;
                if (!math.isZero(reward)) {
                    ledger.payout(caller, reward);
                }
            } else if (call instanceof StakingCall.AddValidator<A, Bal> add) {
                addValidator(caller, add.commission());
            } else if (call instanceof StakingCall.RemoveValidator) {
                removeValidator(caller);
            } else {
                throw new IllegalArgumentException("Unsupported staking call: " + call);
            }
            return DispatchResult.ok();
        } catch (PalletException e) {
            if (applied) {
                snapshot.restore();
            }
            return e.toResult();
        }
    }

    /** Pre-call copy of everything a single call can touch. */
    private final class Snapshot {
        private final A caller;
        private final StakeInfo<A, B, Bal> stake;
        private final A validatorId;
        private final ValidatorInfo<Bal> validator;
        private final Bal total;
        private final int eventCount;

        Snapshot(A caller, StakingCall<A, Bal> call) {
            this.caller = caller;
            this.stake = stakes.get(caller);
            if (call instanceof StakingCall.Stake<A, Bal> stakeCall) {
                this.validatorId = stakeCall.validator();
            } else {
                this.validatorId = stake == null ? null : stake.validator();
            }
            this.validator = validatorId == null ? null : validators.get(validatorId);
            this.total = totalStaked;
            this.eventCount = events.size();
        }

        void restore() {
            if (stake == null) stakes.remove(caller); else stakes.put(caller, stake);
            if (validatorId != null) {
                if (validator == null) validators.remove(validatorId); else validators.put(validatorId, validator);
            }
            totalStaked = total;
            while (events.size() > eventCount) {
                events.remove(events.size() - 1);
            }
            LOG.warning("Rolled back staking call of " + caller + " after ledger rejection");
        }
    }

    // -------------------- queries --------------------

    public Optional<StakeInfo<A, B, Bal>> getStakeInfo(A who) {
        return Optional.ofNullable(stakes.get(who));
    }

    public Optional<ValidatorInfo<Bal>> getValidatorInfo(A validator) {
        return Optional.ofNullable(validators.get(validator));
    }

    public Map<A, ValidatorInfo<Bal>> getActiveValidators() {
        Map<A, ValidatorInfo<Bal>> out = new TreeMap<>();
        for (Map.Entry<A, ValidatorInfo<Bal>> e : validators.entrySet()) {
            if (e.getValue().active()) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    public Map<A, StakeInfo<A, B, Bal>> getStakes() {
        return Collections.unmodifiableMap(stakes);
    }

    public Bal getTotalStaked() {
        return totalStaked;
    }

    public boolean isStaking(A who) {
        return stakes.containsKey(who);
    }

    public boolean isValidator(A who) {
        return validators.containsKey(who);
    }

    public List<StakingEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /** Hand the queued events to the caller and empty the queue. */
    public List<StakingEvent> drainEvents() {
        List<StakingEvent> out = new ArrayList<>(events);
        events.clear();
        return out;
    }

    public void clearEvents() {
        events.clear();
    }

    /** Aggregates recomputed from the stake and validator tables on every call. */
    public StakingStats<Bal> getStakingStats() {
        Bal total = math.zero();
        for (StakeInfo<A, B, Bal> info : stakes.values()) {
            total = math.checkedAdd(total, info.stakedAmount())
                    .orElseThrow(() -> new IllegalStateException("stake total exceeds balance range"));
        }
        int active = 0;
        for (ValidatorInfo<Bal> v : validators.values()) {
            if (v.active()) active++;
        }
        int stakers = stakes.size();
        Bal average = stakers > 0 ? math.divide(total, math.fromLong(stakers)) : math.zero();
        return new StakingStats<>(total, validators.size(), active, stakers, average);
    }
}
