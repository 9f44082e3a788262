package io.palletchain.core.support;

public final class DispatchResult {
    private static final DispatchResult OK = new DispatchResult(true, null);

    public final boolean ok;
    public final DispatchError error;

    private DispatchResult(boolean ok, DispatchError error) {
        this.ok = ok;
        this.error = error;
    }

    public static DispatchResult ok() { return OK; }

    public static DispatchResult error(DispatchError e) {
        if (e == null) throw new IllegalArgumentException("error required");
        return new DispatchResult(false, e);
    }

    /** Textual reason, or null on success. */
    public String message() {
        return ok ? null : error.message();
    }

    @Override public String toString() {
        return ok ? "OK" : ("ERR[" + error.module() + "." + error + "]: " + error.message());
    }
}
