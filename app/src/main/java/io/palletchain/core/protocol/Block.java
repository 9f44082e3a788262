package io.palletchain.core.protocol;

import java.util.List;

/**
 * Block = header + ordered extrinsics. Extrinsics run strictly in list order.
 */
public final class Block<B, X> {
    private final Header<B> header;
    private final List<X> extrinsics;

    public Block(Header<B> header, List<X> extrinsics) {
        this.header = header;
        this.extrinsics = extrinsics != null ? List.copyOf(extrinsics) : List.of();
        basicValidate();
    }

    public Header<B> header() { return header; }
    public List<X> extrinsics() { return extrinsics; }

    public void basicValidate() {
        if (header == null) throw new IllegalArgumentException("missing header");
        if (extrinsics.size() > ProtocolLimits.MAX_EXTRINSICS_PER_BLOCK) throw new IllegalArgumentException("too many extrinsics");
    }

    @Override public String toString() {
        return "Block{n=" + header.blockNumber() + ", extrinsics=" + extrinsics.size() + "}";
    }
}
