package io.palletchain.core.protocol;

/**
 * Block metadata. Only the block number for now; parent hash and state root
 * are derived by the System pallet at finalization instead of being carried here.
 */
public final class Header<B> {
    private final B blockNumber;

    public Header(B blockNumber) {
        if (blockNumber == null) throw new IllegalArgumentException("blockNumber required");
        this.blockNumber = blockNumber;
    }

    public B blockNumber() { return blockNumber; }

    @Override public String toString() {
        return "Header{n=" + blockNumber + "}";
    }
}
