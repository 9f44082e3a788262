package io.palletchain.core.runtime;

import io.palletchain.core.balances.BalancesPallet;
import io.palletchain.core.metrics.BlockMetrics;
import io.palletchain.core.protocol.Block;
import io.palletchain.core.protocol.Extrinsic;
import io.palletchain.core.protocol.Hash;
import io.palletchain.core.staking.StakingEvent;
import io.palletchain.core.staking.StakingException;
import io.palletchain.core.staking.StakingLedger;
import io.palletchain.core.staking.StakingPallet;
import io.palletchain.core.staking.StakingParams;
import io.palletchain.core.support.Dispatch;
import io.palletchain.core.support.DispatchResult;
import io.palletchain.core.support.PalletException;
import io.palletchain.core.system.SystemPallet;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Owns one instance of every pallet and executes blocks against them.
 *
 * Per block: advance the block number, then for each entry in order bump the
 * signer's nonce and dispatch. A failed entry is logged and skipped; its nonce
 * bump stays and the rest of the block still runs. Finally the block hash is
 * filed, staking pays rewards for the new block and its event queue is drained.
 */
public final class PalletRuntime implements Dispatch<String, RuntimeCall> {
    private static final Logger LOG = Logger.getLogger(PalletRuntime.class.getName());

    private final SystemPallet<String, Integer, Integer> system;
    private final BalancesPallet<String, BigInteger> balances;
    private final StakingPallet<String, Integer, BigInteger> staking;

    public PalletRuntime() {
        this(StakingParams.defaults());
    }

    public PalletRuntime(StakingParams stakingParams) {
        RuntimeConfig config = RuntimeConfig.INSTANCE;
        this.system = new SystemPallet<>(config);
        this.balances = new BalancesPallet<>(config);
        this.staking = new StakingPallet<>(config, stakingParams);
    }

    public SystemPallet<String, Integer, Integer> system() { return system; }
    public BalancesPallet<String, BigInteger> balances() { return balances; }
    public StakingPallet<String, Integer, BigInteger> staking() { return staking; }

    // -------------------- dispatch --------------------

    @Override
    public DispatchResult dispatch(String caller, RuntimeCall call) {
        if (call instanceof RuntimeCall.Balances balancesCall) {
            return balances.dispatch(caller, balancesCall.call());
        }
        if (call instanceof RuntimeCall.Staking stakingCall) {
            return staking.withLedger(ledgerView()).dispatch(caller, stakingCall.call());
        }
        throw new IllegalArgumentException("Unsupported runtime call: " + call);
    }

    /** Fresh capability over the balances ledger for a single staking call. */
    private StakingLedger<String, BigInteger> ledgerView() {
        return new StakingLedger<>() {
            @Override
            public BigInteger balanceOf(String who) {
                return balances.balance(who);
            }

            @Override
            public void lock(String who, BigInteger amount) throws PalletException {
                balances.withdraw(who, amount);
            }

            @Override
            public void unlock(String who, BigInteger amount) throws PalletException {
                balances.deposit(who, amount);
            }

            @Override
            public void payout(String who, BigInteger amount) throws PalletException {
                balances.deposit(who, amount);
            }
        };
    }

    // -------------------- block execution --------------------

    /**
     * Execute a block of extrinsics. The header must carry the next block number;
     * otherwise nothing runs and {@link RuntimeError#BLOCK_NUMBER_MISMATCH} is raised.
     */
    public BlockResult<Extrinsic<String, RuntimeCall>> executeBlock(Block<Integer, Extrinsic<String, RuntimeCall>> block)
            throws PalletException {
        Optional<Integer> expected = RuntimeConfig.INSTANCE.blockNumbers()
                .checkedAdd(system.blockNumber(), 1);
        if (expected.isEmpty() || !expected.get().equals(block.header().blockNumber())) {
            throw new PalletException(RuntimeError.BLOCK_NUMBER_MISMATCH);
        }
        return BlockMetrics.recordExecution(() -> runBlock(block.extrinsics(), extrinsic -> {
            system.incNonce(extrinsic.caller());
            return dispatch(extrinsic.caller(), extrinsic.call());
        }));
    }

    /** Open the next block, run the transactions in order and finalize it. */
    public BlockResult<Transaction> createBlock(List<Transaction> transactions) {
        List<Transaction> txs = transactions == null ? List.of() : transactions;
        return BlockMetrics.recordExecution(() -> runBlock(txs, this::executeTransaction));
    }

    private <T> BlockResult<T> runBlock(List<T> entries, Function<T, DispatchResult> executor) {
        system.incBlockNumber();
        int blockNumber = system.blockNumber();
        LOG.fine("Executing block #" + Integer.toUnsignedString(blockNumber) + " with " + entries.size() + " entries");

        List<T> successful = new ArrayList<>();
        List<BlockResult.Failure<T>> failed = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            T entry = entries.get(i);
            DispatchResult result = executor.apply(entry);
            BlockMetrics.recordExtrinsic(result.ok);
            if (result.ok) {
                successful.add(entry);
            } else {
                failed.add(new BlockResult.Failure<>(entry, result.error));
                LOG.info("Block #" + Integer.toUnsignedString(blockNumber) + " entry " + i + " failed: " + result);
            }
        }

        Sealed sealed = seal();
        BlockMetrics.incrementBlocks();
        LOG.fine("Block #" + Integer.toUnsignedString(blockNumber) + " finalized " + sealed.hash().shortHex()
                + " with " + sealed.events().size() + " staking events");
        return new BlockResult<>(blockNumber, sealed.hash(), successful, failed, sealed.events());
    }

    /** Map one transaction onto its pallet operation. Signed ones pay a nonce first. */
    public DispatchResult executeTransaction(Transaction tx) {
        if (tx instanceof Transaction.Signed signed) {
            system.incNonce(signed.origin());
            return dispatch(signed.origin(), signed.call());
        }
        if (tx instanceof Transaction.SetBalance set) {
            balances.setBalance(set.who(), set.amount());
            return DispatchResult.ok();
        }
        if (tx instanceof Transaction.AddValidator add) {
            try {
                staking.addValidator(add.validator(), add.commission());
                return DispatchResult.ok();
            } catch (StakingException e) {
                return e.toResult();
            }
        }
        throw new IllegalArgumentException("Unsupported transaction: " + tx);
    }

    /**
     * Seal the current block: file its hash, then let staking pay the rewards for it
     * into spendable balances. Staking events queued since the last seal are discarded;
     * blocks built through this runtime hand them out in {@link BlockResult#events()}.
     */
    public Hash finalizeBlock() {
        return seal().hash();
    }

    private Sealed seal() {
        Hash hash = system.finalizeBlock();
        staking.onBlock(system.blockNumber(), ledgerView());
        return new Sealed(hash, staking.drainEvents());
    }

    private record Sealed(Hash hash, List<StakingEvent> events) {}

    // -------------------- inspection --------------------

    /**
     * Every block from 1 to the current one has a hash, and each hash carries the
     * prefix of its parent's hash.
     */
    public boolean verifyChainIntegrity() {
        long current = Integer.toUnsignedLong(system.blockNumber());
        for (long n = 1; n <= current; n++) {
            Optional<Hash> hash = system.getBlockHash((int) n);
            if (hash.isEmpty()) {
                LOG.warning("Block #" + n + " hash missing");
                return false;
            }
            Optional<Hash> parent = system.getBlockHash((int) (n - 1));
            if (parent.isPresent()) {
                byte[] link = Arrays.copyOfRange(hash.get().bytes(), 8, 16);
                if (!Arrays.equals(link, parent.get().prefix(8))) {
                    LOG.warning("Block #" + n + " does not link to its parent");
                    return false;
                }
            }
        }
        return true;
    }

    @Override public String toString() {
        return "PalletRuntime{block=" + Integer.toUnsignedString(system.blockNumber())
                + ", accounts=" + balances.accounts().size()
                + ", stakers=" + staking.getStakes().size() + "}";
    }
}
