package org.javai.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Static helpers for composing {@link Result} values.
 */
public final class Results {

    private Results() {
    }

    /**
     * Removes one level of nesting.
     *
     * <p>{@code Success(Success(v))} becomes {@code Success(v)}, {@code Success(Failure(e))}
     * becomes {@code Failure(e)} and {@code Failure(e)} stays {@code Failure(e)}.
     */
    public static <T, E> Result<T, E> flatten(Result<Result<T, E>, E> nested) {
        Objects.requireNonNull(nested, "nested must not be null");
        return nested.andThen(Function.identity());
    }

    /**
     * Turns a sequence of results into a result of a list. The first failure met in
     * iteration order is returned and the remaining elements are not visited.
     *
     * @return an unmodifiable list of all success values, in order, or the first failure
     */
    public static <T, E> Result<List<T>, E> collect(Iterable<? extends Result<? extends T, ? extends E>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<T> values = new ArrayList<>();
        for (Result<? extends T, ? extends E> result : results) {
            if (result.isFailure()) {
                return Result.failure(result.unwrapError());
            }
            values.add(result.unwrap());
        }
        return Result.success(Collections.unmodifiableList(values));
    }

    /**
     * Returns a success holding the optional's value, or a failure holding the supplied error
     * when the optional is empty. The supplier is only invoked for an empty optional.
     */
    public static <T, E> Result<T, E> fromOptional(Optional<? extends T> optional, Supplier<? extends E> error) {
        Objects.requireNonNull(optional, "optional must not be null");
        Objects.requireNonNull(error, "error must not be null");
        return optional.isPresent()
                ? Result.success(optional.get())
                : Result.failure(error.get());
    }

    /**
     * Returns the success values of {@code results}, in order, skipping failures.
     */
    public static <T, E> List<T> successes(Iterable<? extends Result<? extends T, ? extends E>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<T> values = new ArrayList<>();
        for (Result<? extends T, ? extends E> result : results) {
            result.toSequence().forEach(values::add);
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Returns the errors of {@code results}, in order, skipping successes.
     */
    public static <T, E> List<E> failures(Iterable<? extends Result<? extends T, ? extends E>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<E> errors = new ArrayList<>();
        for (Result<? extends T, ? extends E> result : results) {
            if (result.isFailure()) {
                errors.add(result.unwrapError());
            }
        }
        return Collections.unmodifiableList(errors);
    }
}
