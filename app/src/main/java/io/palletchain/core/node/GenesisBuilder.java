package io.palletchain.core.node;

import io.palletchain.core.protocol.Hash;
import io.palletchain.core.runtime.PalletRuntime;
import io.palletchain.core.staking.StakingException;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Seeds a fresh runtime from a {@link GenesisConfig} and seals block 0.
 * - balances and fee settings are written directly (no transfers, no fees)
 * - validators are registered with their commission
 */
public final class GenesisBuilder {
    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /** Build a runtime with the staking parameters of the config, then seed it. */
    public static PalletRuntime build(GenesisConfig config) {
        PalletRuntime runtime = new PalletRuntime(config.staking);
        initIfNeeded(runtime, config);
        return runtime;
    }

    /** Credit initial balances (allocations map) into the ledger. */
    public static void seedBalances(PalletRuntime runtime, Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) return;
        for (Map.Entry<String, Long> e : allocations.entrySet()) {
            runtime.balances().setBalance(e.getKey(), BigInteger.valueOf(e.getValue() == null ? 0L : e.getValue()));
        }
    }

    public static void seedValidators(PalletRuntime runtime, Map<String, Integer> validators) {
        if (validators == null || validators.isEmpty()) return;
        for (Map.Entry<String, Integer> e : validators.entrySet()) {
            int commission = e.getValue() == null ? 0 : e.getValue();
            try {
                runtime.staking().addValidator(e.getKey(), commission);
            } catch (StakingException ex) {
                throw new IllegalArgumentException("Invalid genesis validator " + e.getKey() + ": " + ex.getMessage(), ex);
            }
        }
    }

    /**
     * If block 0 has not been sealed yet, seed state and finalize it.
     * Idempotent: does nothing once a genesis hash exists.
     */
    public static Hash initIfNeeded(PalletRuntime runtime, GenesisConfig config) {
        Optional<Hash> existing = runtime.system().genesisHash();
        if (existing.isPresent()) return existing.get();

        seedBalances(runtime, config.allocations);
        runtime.balances().setTransactionFee(BigInteger.valueOf(config.baseFee));
        runtime.balances().setFeeRecipient(Optional.ofNullable(config.feeRecipient));
        seedValidators(runtime, config.validators);

        Hash genesis = runtime.finalizeBlock();
        LOG.info("Genesis sealed " + genesis.shortHex() + " (" + config + ")");
        return genesis;
    }
}
