package net.quantuminvestor.fetch.boundary;

/**
 * Work handed to a {@link Boundary}: typically one provider call that may throw
 * {@link ProviderException}.
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
