package org.javai.result.boundary;

/**
 * Work handed to a {@link Boundary}: produces a value or throws a checked exception.
 *
 * @param <T> the type of value produced
 * @param <X> the type of exception thrown
 */
@FunctionalInterface
public interface CheckedSupplier<T, X extends Exception> {

    T get() throws X;
}
