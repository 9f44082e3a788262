package io.palletchain.core;

import io.palletchain.core.metrics.BlockMetrics;
import io.palletchain.core.node.GenesisBuilder;
import io.palletchain.core.node.GenesisConfig;
import io.palletchain.core.protocol.Hash;
import io.palletchain.core.runtime.BlockResult;
import io.palletchain.core.runtime.PalletRuntime;
import io.palletchain.core.runtime.Transaction;
import io.palletchain.core.staking.StakingStats;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        GenesisConfig genesis;
        try {
            genesis = GenesisConfig.loadOrBundled(options.genesisFile() == null
                    ? null
                    : options.genesisFile().toAbsolutePath().normalize());
        } catch (IllegalStateException e) {
            LOG.severe(e.getMessage());
            System.exit(1);
            return;
        }
        PalletRuntime runtime = GenesisBuilder.build(genesis);

        if (options.demo()) {
            runDemoFlow(runtime);
        } else {
            LOG.info("Demo flow disabled (--no-demo)");
        }

        for (int i = 0; i < options.emptyBlocks(); i++) {
            runtime.createBlock(List.of());
        }

        logState(runtime);
        LOG.info("Chain integrity " + (runtime.verifyChainIntegrity() ? "verified" : "BROKEN"));
        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
    }

    private static void runDemoFlow(PalletRuntime runtime) {
        String femi = "Femi";
        String temi = "temi";
        String cheryl = "cheryl";
        String nathaniel = "nathaniel";
        String faith = "faith";

        report(runtime.createBlock(List.of(
                Transaction.transfer(cheryl, faith, 50),
                Transaction.transfer(cheryl, nathaniel, 70),
                Transaction.transfer(femi, temi, 100))));

        report(runtime.createBlock(List.of(
                Transaction.transfer(cheryl, femi, 100),
                Transaction.transfer(faith, temi, 20),
                Transaction.transfer(nathaniel, femi, 30))));

        // first entry overdraws on purpose
        report(runtime.createBlock(List.of(
                Transaction.transfer(cheryl, nathaniel, 9_200),
                Transaction.transfer(temi, faith, 50),
                Transaction.transfer(femi, cheryl, 200))));

        String validator = runtime.staking().getActiveValidators().keySet().stream().findFirst().orElse(null);
        if (validator == null) {
            LOG.info("No validators in genesis; skipping staking demo");
            return;
        }
        report(runtime.createBlock(List.of(
                Transaction.stake(cheryl, 1_000, validator),
                Transaction.stake(femi, 50, validator))));
    }

    private static void report(BlockResult<Transaction> result) {
        LOG.info("Block #" + result.blockNumber() + " completed with " + result.transactionCount()
                + "/" + result.submittedCount() + " successful transactions, hash " + result.blockHash().shortHex());
        for (BlockResult.Failure<Transaction> failure : result.failed()) {
            LOG.info("  failed " + failure.entry() + ": " + failure.reason());
        }
    }

    private static void logState(PalletRuntime runtime) {
        StringBuilder sb = new StringBuilder("=== Runtime state ===\n");
        sb.append("Current block: #").append(Integer.toUnsignedString(runtime.system().blockNumber())).append('\n');
        for (Map.Entry<Integer, Hash> e : runtime.system().allBlockHashes().descendingMap().entrySet()) {
            sb.append("  block #").append(Integer.toUnsignedString(e.getKey())).append(": ").append(e.getValue().shortHex()).append('\n');
        }
        sb.append("Balances:\n");
        for (Map.Entry<String, BigInteger> e : runtime.balances().accounts().entrySet()) {
            sb.append("  ").append(e.getKey()).append(": ").append(e.getValue())
              .append(" (nonce ").append(Integer.toUnsignedString(runtime.system().nonce(e.getKey()))).append(")\n");
        }
        StakingStats<BigInteger> stats = runtime.staking().getStakingStats();
        sb.append("Staking: total=").append(stats.totalStaked())
          .append(", validators=").append(stats.activeValidators()).append('/').append(stats.totalValidators())
          .append(", stakers=").append(stats.totalStakers())
          .append(", average=").append(stats.averageStake());
        LOG.info(sb.toString());
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path genesisFile,
            boolean demo,
            int emptyBlocks
    ) {
        static CliOptions parse(String[] args) {
            Path genesisFile = envPath("PALLET_RUNTIME_GENESIS", null);
            boolean demo = true;
            int emptyBlocks = 0;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--genesis=")) {
                        genesisFile = Path.of(arg.substring("--genesis=".length()));
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--blocks=")) {
                        try {
                            emptyBlocks = parseCount(arg.substring("--blocks=".length()), "--blocks");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(showHelp, error, genesisFile, demo, emptyBlocks);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: pallet-runtime [options]

Options:
  --help, -h                 Show this help message and exit
  --genesis=<path>           Genesis JSON (default: bundled genesis.json)
  --demo / --no-demo         Enable (default) or disable the demo block sequence
  --blocks=<n>               Produce n additional empty blocks (default 0)

Environment overrides:
  PALLET_RUNTIME_GENESIS     Override --genesis
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parseCount(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
