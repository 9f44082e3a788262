package io.palletchain.core.staking;

import io.palletchain.core.balances.BalancesError;
import io.palletchain.core.support.DispatchResult;
import io.palletchain.core.support.PalletException;
import io.palletchain.core.support.TestConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StakingPalletTest {

    private static final BalanceLookup<String, Long> RICH = who -> 1_000_000L;

    private static StakingPallet<String, Integer, Long> newStaking() {
        return new StakingPallet<>(TestConfig.INSTANCE);
    }

    @Test
    void stakeAndUnstakeAfterLockUp() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);

        staking.stake("u1", 200L, "v1", who -> 1000L);
        assertEquals(200L, staking.getTotalStaked());
        assertTrue(staking.isStaking("u1"));

        StakingException early = assertThrows(StakingException.class, () -> staking.unstake("u1"));
        assertEquals(StakingError.UNSTAKING_PERIOD_NOT_MET, early.error());

        staking.onBlock(staking.currentBlock() + 10);
        assertEquals(200L, staking.unstake("u1"));
        assertEquals(0L, staking.getTotalStaked());
        assertFalse(staking.isStaking("u1"));
        assertEquals(0L, staking.getValidatorInfo("v1").orElseThrow().totalStake());
        assertEquals(0, staking.getValidatorInfo("v1").orElseThrow().nominatorCount());
    }

    @Test
    void validatorRegistrationRules() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);

        StakingException dup = assertThrows(StakingException.class, () -> staking.addValidator("v1", 5));
        assertEquals(StakingError.ALREADY_VALIDATOR, dup.error());

        StakingException badCommission = assertThrows(StakingException.class, () -> staking.addValidator("v2", 150));
        assertEquals(StakingError.INVALID_VALIDATOR, badCommission.error());
        assertFalse(staking.isValidator("v2"));

        StakingException missing = assertThrows(StakingException.class, () -> staking.removeValidator("nobody"));
        assertEquals(StakingError.NOT_VALIDATOR, missing.error());
    }

    @Test
    void validatorSlotsAreLimited() throws Exception {
        StakingPallet<String, Integer, Long> staking =
                new StakingPallet<>(TestConfig.INSTANCE, new StakingParams(100, 5, 10, 2));
        staking.addValidator("v1", 0);
        staking.addValidator("v2", 100);

        StakingException ex = assertThrows(StakingException.class, () -> staking.addValidator("v3", 1));
        assertEquals(StakingError.TOO_MANY_VALIDATORS, ex.error());

        staking.removeValidator("v1");
        staking.addValidator("v3", 1);
        assertEquals(2, staking.getActiveValidators().size());
    }

    @Test
    void stakeChecks() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);

        assertEquals(StakingError.MINIMUM_STAKE_NOT_MET,
                assertThrows(StakingException.class, () -> staking.stake("u1", 99L, "v1", RICH)).error());
        assertEquals(StakingError.INVALID_VALIDATOR,
                assertThrows(StakingException.class, () -> staking.stake("u1", 100L, "ghost", RICH)).error());
        assertEquals(StakingError.INSUFFICIENT_BALANCE,
                assertThrows(StakingException.class, () -> staking.stake("u1", 500L, "v1", who -> 499L)).error());

        staking.stake("u1", 100L, "v1", RICH);
        assertEquals(StakingError.ALREADY_STAKED,
                assertThrows(StakingException.class, () -> staking.stake("u1", 100L, "v1", RICH)).error());
        assertEquals(100L, staking.getTotalStaked());
    }

    @Test
    void inactiveValidatorRejectsNewStakes() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);
        staking.setValidatorActive("v1", false);

        assertTrue(staking.getActiveValidators().isEmpty());
        assertEquals(StakingError.INVALID_VALIDATOR,
                assertThrows(StakingException.class, () -> staking.stake("u1", 100L, "v1", RICH)).error());

        staking.setValidatorActive("v1", true);
        staking.stake("u1", 100L, "v1", RICH);
        assertEquals(StakingError.NOT_VALIDATOR,
                assertThrows(StakingException.class, () -> staking.setValidatorActive("v9", true)).error());
    }

    @Test
    void unstakeWithoutStakeFails() {
        StakingPallet<String, Integer, Long> staking = newStaking();
        assertEquals(StakingError.NOT_STAKED,
                assertThrows(StakingException.class, () -> staking.unstake("u1")).error());
        assertEquals(StakingError.NOT_STAKED,
                assertThrows(StakingException.class, () -> staking.calculateRewards("u1")).error());
    }

    @Test
    void rewardsAccrueAndCommissionIsDeducted() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);
        staking.addValidator("v2", 10);
        staking.stake("u1", 200L, "v1", RICH);
        staking.stake("u2", 1000L, "v2", RICH);

        Map<String, Long> payouts = staking.onBlock(10);

        // 200 * 5 * 10 / 1000 = 10, 5% of 10 rounds to 0
        assertEquals(10L, payouts.get("u1"));
        // 1000 * 5 * 10 / 1000 = 50, minus 10% commission
        assertEquals(45L, payouts.get("u2"));
        assertEquals(45L, staking.getStakeInfo("u2").orElseThrow().totalRewards());
        assertEquals(10, staking.getStakeInfo("u2").orElseThrow().lastRewardBlock());

        assertEquals(0L, staking.calculateRewards("u2"));
        assertTrue(staking.onBlock(10).isEmpty());
    }

    @Test
    void removedValidatorFreezesItsStakes() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);
        staking.stake("u1", 200L, "v1", RICH);
        staking.removeValidator("v1");

        assertEquals(StakingError.INVALID_VALIDATOR,
                assertThrows(StakingException.class, () -> staking.calculateRewards("u1")).error());
        assertTrue(staking.onBlock(20).isEmpty());

        assertEquals(200L, staking.unstake("u1"));
        assertEquals(0L, staking.getTotalStaked());
    }

    @Test
    void reAddedValidatorTakesBackFrozenStakes() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 0);
        staking.stake("u1", 1000L, "v1", RICH);
        staking.removeValidator("v1");
        staking.onBlock(50);

        staking.addValidator("v1", 0);

        ValidatorInfo<Long> info = staking.getValidatorInfo("v1").orElseThrow();
        assertEquals(1000L, info.totalStake());
        assertEquals(1, info.nominatorCount());
        assertTotalsConsistent(staking);
        // the frozen blocks earn nothing
        assertEquals(0L, staking.calculateRewards("u1"));
        assertEquals(50, staking.getStakeInfo("u1").orElseThrow().lastRewardBlock());

        // 1000 * 5 * 10 / 1000
        assertEquals(50L, staking.onBlock(60).get("u1"));
        assertEquals(1000L, staking.unstake("u1"));
        assertEquals(0L, staking.getValidatorInfo("v1").orElseThrow().totalStake());
        assertEquals(0L, staking.getTotalStaked());
    }

    @Test
    void reAddDoesNotAdoptOtherValidatorsStakes() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 0);
        staking.addValidator("v2", 0);
        staking.stake("u1", 300L, "v1", RICH);
        staking.stake("u2", 400L, "v2", RICH);
        staking.removeValidator("v1");

        staking.addValidator("v1", 10);

        assertEquals(300L, staking.getValidatorInfo("v1").orElseThrow().totalStake());
        assertEquals(400L, staking.getValidatorInfo("v2").orElseThrow().totalStake());
        assertTotalsConsistent(staking);
    }

    @Test
    void totalsMatchStakeTables() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);
        staking.addValidator("v2", 10);
        staking.stake("a", 300L, "v1", RICH);
        staking.stake("b", 150L, "v1", RICH);
        staking.stake("c", 700L, "v2", RICH);
        staking.onBlock(12);
        staking.unstake("b");
        staking.slash("c", 200L);

        assertTotalsConsistent(staking);
        assertEquals(800L, staking.getTotalStaked());
        assertEquals(1, staking.getValidatorInfo("v1").orElseThrow().nominatorCount());
    }

    private static void assertTotalsConsistent(StakingPallet<String, Integer, Long> staking) {
        long sum = 0;
        Map<String, Long> perValidator = new HashMap<>();
        for (StakeInfo<String, Integer, Long> info : staking.getStakes().values()) {
            sum += info.stakedAmount();
            perValidator.merge(info.validator(), info.stakedAmount(), Long::sum);
        }
        assertEquals(sum, staking.getTotalStaked());
        for (Map.Entry<String, Long> e : perValidator.entrySet()) {
            assertEquals(e.getValue(), staking.getValidatorInfo(e.getKey()).orElseThrow().totalStake());
        }
    }

    @Test
    void slashIsCappedAndRemovesEmptyStake() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);
        staking.stake("u1", 200L, "v1", RICH);

        assertEquals(50L, staking.slash("u1", 50L));
        assertEquals(150L, staking.getStakeInfo("u1").orElseThrow().stakedAmount());

        assertEquals(150L, staking.slash("u1", 1_000L));
        assertFalse(staking.isStaking("u1"));
        assertEquals(0L, staking.getTotalStaked());
        assertEquals(0, staking.getValidatorInfo("v1").orElseThrow().nominatorCount());
    }

    @Test
    void statsAreRecomputed() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("validator1", 5);
        staking.addValidator("validator2", 10);
        staking.stake("cheryl", 1000L, "validator1", RICH);
        staking.stake("femi", 100L, "validator2", RICH);

        StakingStats<Long> stats = staking.getStakingStats();
        assertEquals(1100L, stats.totalStaked());
        assertEquals(2, stats.totalValidators());
        assertEquals(2, stats.activeValidators());
        assertEquals(2, stats.totalStakers());
        assertEquals(550L, stats.averageStake());

        staking.setValidatorActive("validator2", false);
        assertEquals(1, staking.getStakingStats().activeValidators());
    }

    @Test
    void emptyStatsHaveZeroAverage() {
        StakingStats<Long> stats = newStaking().getStakingStats();
        assertEquals(0L, stats.totalStaked());
        assertEquals(0L, stats.averageStake());
        assertEquals(0, stats.totalStakers());
    }

    @Test
    void eventsAreQueuedUntilDrained() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        staking.addValidator("v1", 5);
        staking.stake("u1", 200L, "v1", RICH);

        List<StakingEvent> drained = staking.drainEvents();
        assertEquals(List.of(
                new StakingEvent.ValidatorAdded<>("v1"),
                new StakingEvent.Staked<>("u1", 200L, "v1")), drained);
        assertTrue(staking.getEvents().isEmpty());

        staking.onBlock(3);
        assertEquals(List.of(new StakingEvent.RewardsPaid<>("u1", 3L)), staking.getEvents());
        staking.clearEvents();
        assertTrue(staking.getEvents().isEmpty());
    }

    @Test
    void dispatchMovesFundsThroughLedger() {
        StakingPallet<String, Integer, Long> staking = newStaking();
        MapLedger ledger = new MapLedger();
        ledger.free.put("u1", 500L);

        assertTrue(staking.withLedger(ledger).dispatch("v1", new StakingCall.AddValidator<>(5)).ok);
        assertTrue(staking.withLedger(ledger).dispatch("u1", new StakingCall.Stake<>(200L, "v1")).ok);
        assertEquals(300L, ledger.free.get("u1"));

        DispatchResult early = staking.withLedger(ledger).dispatch("u1", new StakingCall.Unstake<>());
        assertEquals(StakingError.UNSTAKING_PERIOD_NOT_MET, early.error);

        staking.onBlock(10);
        assertTrue(staking.withLedger(ledger).dispatch("u1", new StakingCall.Unstake<>()).ok);
        assertEquals(500L, ledger.free.get("u1"));

        assertTrue(staking.withLedger(ledger).dispatch("v1", new StakingCall.RemoveValidator<>()).ok);
        assertFalse(staking.isValidator("v1"));
    }

    @Test
    void ledgerRejectionRollsBackStake() {
        StakingPallet<String, Integer, Long> staking = newStaking();
        MapLedger ledger = new MapLedger();
        ledger.free.put("u1", 500L);
        ledger.rejectLocks = true;
        staking.withLedger(ledger).dispatch("v1", new StakingCall.AddValidator<>(5));
        staking.clearEvents();

        DispatchResult result = staking.withLedger(ledger).dispatch("u1", new StakingCall.Stake<>(200L, "v1"));

        assertFalse(result.ok);
        assertFalse(staking.isStaking("u1"));
        assertEquals(0L, staking.getTotalStaked());
        assertEquals(0L, staking.getValidatorInfo("v1").orElseThrow().totalStake());
        assertEquals(0, staking.getValidatorInfo("v1").orElseThrow().nominatorCount());
        assertTrue(staking.getEvents().isEmpty());
        assertEquals(500L, ledger.free.get("u1"));
    }

    @Test
    void blockRewardsArePaidThroughLedger() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        MapLedger ledger = new MapLedger();
        staking.addValidator("v1", 5);
        staking.stake("u1", 200L, "v1", RICH);

        Map<String, Long> payouts = staking.onBlock(10, ledger);

        assertEquals(10L, payouts.get("u1"));
        assertEquals(10L, ledger.free.get("u1"));
        assertEquals(10L, staking.getStakeInfo("u1").orElseThrow().totalRewards());
    }

    @Test
    void rejectedPayoutStaysUnclaimed() throws Exception {
        StakingPallet<String, Integer, Long> staking = newStaking();
        MapLedger ledger = new MapLedger();
        staking.addValidator("v1", 5);
        staking.stake("u1", 200L, "v1", RICH);
        staking.clearEvents();
        ledger.rejectPayouts = true;

        assertTrue(staking.onBlock(10, ledger).isEmpty());

        StakeInfo<String, Integer, Long> info = staking.getStakeInfo("u1").orElseThrow();
        assertEquals(0, info.lastRewardBlock());
        assertEquals(0L, info.totalRewards());
        assertTrue(staking.getEvents().isEmpty());
        assertNull(ledger.free.get("u1"));

        ledger.rejectPayouts = false;
        // 200 * 5 * 12 / 1000 = 12, commission rounds to 0
        assertEquals(12L, staking.onBlock(12, ledger).get("u1"));
        assertEquals(12L, ledger.free.get("u1"));
        assertEquals(12L, staking.getStakeInfo("u1").orElseThrow().totalRewards());
    }

    /** Plain map of spendable balances. */
    private static final class MapLedger implements StakingLedger<String, Long> {
        final Map<String, Long> free = new HashMap<>();
        boolean rejectLocks;
        boolean rejectPayouts;

        @Override
        public Long balanceOf(String who) {
            return free.getOrDefault(who, 0L);
        }

        @Override
        public void lock(String who, Long amount) throws PalletException {
            if (rejectLocks) {
                throw new StakingException(StakingError.INSUFFICIENT_BALANCE);
            }
            free.put(who, balanceOf(who) - amount);
        }

        @Override
        public void unlock(String who, Long amount) {
            free.merge(who, amount, Long::sum);
        }

        @Override
        public void payout(String who, Long amount) throws PalletException {
            if (rejectPayouts) {
                throw new PalletException(BalancesError.OVERFLOW_IN_TRANSFER);
            }
            free.merge(who, amount, Long::sum);
        }
    }
}
