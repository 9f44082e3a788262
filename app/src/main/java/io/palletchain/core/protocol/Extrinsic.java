package io.palletchain.core.protocol;

/** One submitted call: who is calling and what they want to run. */
public record Extrinsic<A, C>(A caller, C call) {
    public Extrinsic {
        if (caller == null) throw new IllegalArgumentException("caller required");
        if (call == null) throw new IllegalArgumentException("call required");
    }
}
