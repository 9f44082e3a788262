package io.palletchain.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_EXTRINSICS_PER_BLOCK = 1_000_000;
    public static final int MAX_COMMISSION_PERCENT = 100;
    public static final long REWARD_SCALE = 1_000L;         // reward rate is per mille per block
}
