package io.palletchain.core.runtime;

import io.palletchain.core.protocol.Hash;
import io.palletchain.core.staking.StakingEvent;
import io.palletchain.core.support.DispatchError;

import java.util.List;

/**
 * Outcome of one executed block: its hash and which entries succeeded or failed.
 * Failed entries keep the typed error; {@link Failure#reason()} is the text form.
 */
public final class BlockResult<T> {
    private final int blockNumber;
    private final Hash blockHash;
    private final List<T> successful;
    private final List<Failure<T>> failed;
    private final List<StakingEvent> events;

    public BlockResult(int blockNumber, Hash blockHash, List<T> successful, List<Failure<T>> failed,
                       List<StakingEvent> events) {
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.successful = List.copyOf(successful);
        this.failed = List.copyOf(failed);
        this.events = List.copyOf(events);
    }

    public int blockNumber() { return blockNumber; }
    public Hash blockHash() { return blockHash; }
    public List<T> successful() { return successful; }
    public List<Failure<T>> failed() { return failed; }

    /** Staking events emitted while this block ran and was sealed. */
    public List<StakingEvent> events() { return events; }

    /** Number of entries that went through. */
    public int transactionCount() { return successful.size(); }

    public int submittedCount() { return successful.size() + failed.size(); }

    public record Failure<T>(T entry, DispatchError error) {
        public String reason() {
            return error.message();
        }
    }

    @Override public String toString() {
        return "BlockResult{n=" + Integer.toUnsignedString(blockNumber) + ", ok=" + successful.size()
                + ", failed=" + failed.size() + ", hash=" + blockHash.shortHex() + "}";
    }
}
