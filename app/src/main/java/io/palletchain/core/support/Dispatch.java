package io.palletchain.core.support;

/**
 * Uniform entry point a pallet (or the runtime) exposes for incoming calls.
 * Implementations mutate their own state and report expected failures in the
 * returned result; they do not throw for them.
 *
 * @param <A> caller identity
 * @param <C> call type owned by the implementer
 */
public interface Dispatch<A, C> {

    DispatchResult dispatch(A caller, C call);
}
