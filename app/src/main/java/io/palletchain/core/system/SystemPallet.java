package io.palletchain.core.system;

import io.palletchain.core.protocol.Hash;
import io.palletchain.core.support.Arithmetic;
import io.palletchain.core.support.SystemConfig;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Block progression, per-account nonces and the chain of finalized block hashes.
 * - block number starts at zero and only moves forward by one
 * - nonces default to zero and never decrease
 * - one hash per finalized block number; re-finalizing overwrites it
 */
public final class SystemPallet<A extends Comparable<A>, B, N> {
    private static final Logger LOG = Logger.getLogger(SystemPallet.class.getName());

    private final Arithmetic<B> blocks;
    private final Arithmetic<N> nonces;

    private B blockNumber;
    private final Map<A, N> nonceByAccount = new TreeMap<>();
    private final NavigableMap<B, Hash> blockHashes;

    public SystemPallet(SystemConfig<A, B, N> config) {
        this.blocks = config.blockNumbers();
        this.nonces = config.nonces();
        this.blockNumber = blocks.zero();
        this.blockHashes = new TreeMap<>(blocks);
    }

    public B blockNumber() {
        return blockNumber;
    }

    /** Advance by one. Saturates at the type maximum rather than wrapping. */
    public void incBlockNumber() {
        Optional<B> next = blocks.checkedAdd(blockNumber, blocks.one());
        if (next.isEmpty()) {
            LOG.warning("Block number saturated at " + blockNumber);
            return;
        }
        blockNumber = next.get();
    }

    public N nonce(A who) {
        N n = nonceByAccount.get(who);
        return n == null ? nonces.zero() : n;
    }

    public void incNonce(A who) {
        if (who == null) throw new IllegalArgumentException("account required");
        N current = nonce(who);
        Optional<N> next = nonces.checkedAdd(current, nonces.one());
        if (next.isEmpty()) {
            LOG.warning("Nonce saturated for " + who);
            return;
        }
        nonceByAccount.put(who, next.get());
    }

    /** Read-only view of all tracked nonces. */
    public Map<A, N> nonces() {
        return Collections.unmodifiableMap(nonceByAccount);
    }

    /** Seal the current block: compute its hash and file it under the current number. */
    public Hash finalizeBlock() {
        Hash hash = generateBlockHash();
        blockHashes.put(blockNumber, hash);
        return hash;
    }

    /**
     * Placeholder, non-cryptographic hash:
     * [0..4) block number, [4..8) nonce sum, [8..16) parent prefix, [16..32) filler.
     * Parent is looked up at blockNumber - 1 saturating at zero.
     */
    private Hash generateBlockHash() {
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH);
        long n = blocks.toBigInteger(blockNumber).longValue();
        buf.putInt((int) n);

        BigInteger nonceSum = BigInteger.ZERO;
        for (N value : nonceByAccount.values()) {
            nonceSum = nonceSum.add(nonces.toBigInteger(value));
        }
        buf.putInt(nonceSum.intValue());

        B parentNumber = blocks.checkedSub(blockNumber, blocks.one()).orElse(blocks.zero());
        Hash parent = blockHashes.get(parentNumber);
        buf.put(parent != null ? parent.prefix(8) : new byte[8]);

        for (int i = 16; i < Hash.LENGTH; i++) {
            buf.put((byte) ((i + n) % 256));
        }
        return new Hash(buf.array());
    }

    public Optional<Hash> getBlockHash(B number) {
        if (number == null) return Optional.empty();
        return Optional.ofNullable(blockHashes.get(number));
    }

    public Optional<Hash> currentBlockHash() {
        return getBlockHash(blockNumber);
    }

    /** Empty at block zero. */
    public Optional<Hash> parentBlockHash() {
        if (blocks.isZero(blockNumber)) return Optional.empty();
        return getBlockHash(blocks.checkedSub(blockNumber, blocks.one()).orElseThrow());
    }

    public Optional<Hash> genesisHash() {
        return getBlockHash(blocks.zero());
    }

    /** Sorted, read-only view of every finalized hash. */
    public NavigableMap<B, Hash> allBlockHashes() {
        return Collections.unmodifiableNavigableMap(blockHashes);
    }
}
