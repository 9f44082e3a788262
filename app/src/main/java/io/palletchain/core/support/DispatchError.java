package io.palletchain.core.support;

/** Typed failure reason carried through the dispatch boundary. */
public interface DispatchError {

    /** Owning module, e.g. "Balances". */
    String module();

    /** Human-readable reason (the textual fallback). */
    String message();
}
