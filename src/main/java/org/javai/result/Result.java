package org.javai.result;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * The result of an operation that either succeeded with a value or failed with an error.
 * Either {@link Success} containing a value of type {@code T}, or {@link Failure} containing
 * an error of type {@code E}.
 *
 * <p>A {@code Result} is immutable. Every combinator returns a result (or a plain value) and
 * leaves the receiver untouched, so results can be shared freely between threads as long as
 * their payloads can.
 *
 * <p>Combinators that take an already built {@code Result} ({@link #and}, {@link #or}) or a
 * plain default ({@link #mapOr}, {@link #unwrapOr}) evaluate their argument eagerly, at the
 * call site. Their {@code ...Then}/{@code ...Else} counterparts take a function and only
 * invoke it when the corresponding variant is present.
 *
 * <pre>{@code
 * Result<Version, String> version = parseVersion(3);
 *
 * String description = version.mapOrElse(
 *         error -> "error parsing header: " + error,
 *         v -> "working with version: " + v);
 *
 * Version effective = version.unwrapOr(Version.VERSION_1);
 * }</pre>
 *
 * @param <T> the type of the success value
 * @param <E> the type of the failure value
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    String UNWRAP_MESSAGE = "called `Result#unwrap` on a `Failure` value";
    String UNWRAP_ERROR_MESSAGE = "called `Result#unwrapError` on a `Success` value";

    /**
     * A successful result. The value may be {@code null}, which is how {@code Result<Void, E>}
     * signals completion without a value.
     *
     * @param value the success value
     */
    record Success<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public boolean isSuccessAnd(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            return predicate.test(value);
        }

        @Override
        public boolean isFailureAnd(Predicate<? super E> predicate) {
            Objects.requireNonNull(predicate);
            return false;
        }

        @Override
        public Optional<T> successOrNone() {
            return Optional.ofNullable(value);
        }

        @Override
        public Optional<E> failureOrNone() {
            return Optional.empty();
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(value);
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <U> U mapOrElse(Function<? super E, ? extends U> onError, Function<? super T, ? extends U> onSuccess) {
            Objects.requireNonNull(onError);
            Objects.requireNonNull(onSuccess);
            return onSuccess.apply(value);
        }

        @Override
        public Result<T, E> inspect(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            action.accept(value);
            return this;
        }

        @Override
        public Result<T, E> inspectError(Consumer<? super E> action) {
            Objects.requireNonNull(action);
            return this;
        }

        @Override
        public Iterable<T> toSequence() {
            return () -> Collections.singletonList(value).iterator();
        }

        @Override
        public Stream<T> stream() {
            return Stream.of(value);
        }

        @Override
        public <U> Result<U, E> and(Result<U, E> other) {
            return Objects.requireNonNull(other, "other must not be null");
        }

        @Override
        public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> mapper) {
            Objects.requireNonNull(mapper);
            return Objects.requireNonNull(mapper.apply(value), "andThen function returned null");
        }

        @Override
        public <F> Result<T, F> or(Result<T, F> other) {
            Objects.requireNonNull(other, "other must not be null");
            return new Success<>(value);
        }

        @Override
        public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> recovery) {
            Objects.requireNonNull(recovery);
            return new Success<>(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public E unwrapError() {
            throw new UnwrapOnSuccessException(UNWRAP_ERROR_MESSAGE, value);
        }

        @Override
        public T expect(String message) {
            return value;
        }

        @Override
        public E expectFailure(String message) {
            throw new UnwrapOnSuccessException(message, value);
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return value;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            Objects.requireNonNull(fallback);
            return value;
        }

        @Override
        public T unwrapOrDefault(DefaultValue<? extends T> defaultValue) {
            Objects.requireNonNull(defaultValue);
            return value;
        }

        @Override
        public T unwrapOrDefault(Class<T> type) {
            Objects.requireNonNull(type);
            return value;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Success.class.getSimpleName(), value);
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    /**
     * A failed result.
     *
     * @param error the failure value
     */
    record Failure<T, E>(E error) implements Result<T, E> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public boolean isSuccessAnd(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            return false;
        }

        @Override
        public boolean isFailureAnd(Predicate<? super E> predicate) {
            Objects.requireNonNull(predicate);
            return predicate.test(error);
        }

        @Override
        public Optional<T> successOrNone() {
            return Optional.empty();
        }

        @Override
        public Optional<E> failureOrNone() {
            return Optional.ofNullable(error);
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Failure<>(error);
        }

        @Override
        public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper);
            return new Failure<>(mapper.apply(error));
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return defaultValue;
        }

        @Override
        public <U> U mapOrElse(Function<? super E, ? extends U> onError, Function<? super T, ? extends U> onSuccess) {
            Objects.requireNonNull(onError);
            Objects.requireNonNull(onSuccess);
            return onError.apply(error);
        }

        @Override
        public Result<T, E> inspect(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            return this;
        }

        @Override
        public Result<T, E> inspectError(Consumer<? super E> action) {
            Objects.requireNonNull(action);
            action.accept(error);
            return this;
        }

        @Override
        public Iterable<T> toSequence() {
            return Collections::emptyIterator;
        }

        @Override
        public Stream<T> stream() {
            return Stream.empty();
        }

        @Override
        public <U> Result<U, E> and(Result<U, E> other) {
            Objects.requireNonNull(other, "other must not be null");
            return new Failure<>(error);
        }

        @Override
        public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> mapper) {
            Objects.requireNonNull(mapper);
            return new Failure<>(error);
        }

        @Override
        public <F> Result<T, F> or(Result<T, F> other) {
            return Objects.requireNonNull(other, "other must not be null");
        }

        @Override
        public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> recovery) {
            Objects.requireNonNull(recovery);
            return Objects.requireNonNull(recovery.apply(error), "orElse function returned null");
        }

        @Override
        public T unwrap() {
            throw new UnwrapOnFailureException(UNWRAP_MESSAGE, error);
        }

        @Override
        public E unwrapError() {
            return error;
        }

        @Override
        public T expect(String message) {
            throw new UnwrapOnFailureException(message, error);
        }

        @Override
        public E expectFailure(String message) {
            return error;
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            Objects.requireNonNull(fallback);
            return fallback.apply(error);
        }

        @Override
        public T unwrapOrDefault(DefaultValue<? extends T> defaultValue) {
            Objects.requireNonNull(defaultValue);
            return defaultValue.get();
        }

        @Override
        public T unwrapOrDefault(Class<T> type) {
            return DefaultValue.forType(type).get();
        }

        @Override
        public int hashCode() {
            return Objects.hash(Failure.class.getSimpleName(), error);
        }

        @Override
        public String toString() {
            return "Failure(" + error + ")";
        }
    }

    // Query methods
    boolean isSuccess();
    boolean isFailure();

    /**
     * Returns {@code true} if this is a {@link Success} whose value matches the predicate.
     * The predicate is not invoked on a {@link Failure}.
     */
    boolean isSuccessAnd(Predicate<? super T> predicate);

    /**
     * Returns {@code true} if this is a {@link Failure} whose error matches the predicate.
     * The predicate is not invoked on a {@link Success}.
     */
    boolean isFailureAnd(Predicate<? super E> predicate);

    // Optional conversion
    /**
     * Returns the success value, discarding any error. A {@code null} success value
     * is reported as empty.
     */
    Optional<T> successOrNone();

    /**
     * Returns the error, discarding any success value. A {@code null} error is reported
     * as empty.
     */
    Optional<E> failureOrNone();

    // Transformations
    <U> Result<U, E> map(Function<? super T, ? extends U> mapper);
    <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper);

    /**
     * Applies {@code mapper} to the success value, or returns {@code defaultValue} on failure.
     * The default is an argument and is therefore always evaluated; prefer
     * {@link #mapOrElse} when computing it is expensive.
     */
    <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper);

    /**
     * Folds both variants into a single value. Exactly one of the functions is invoked.
     *
     * @param onError applied to the error of a {@link Failure}
     * @param onSuccess applied to the value of a {@link Success}
     */
    <U> U mapOrElse(Function<? super E, ? extends U> onError, Function<? super T, ? extends U> onSuccess);

    /**
     * Calls {@code action} with the success value, if any, and returns this result unchanged.
     */
    Result<T, E> inspect(Consumer<? super T> action);

    /**
     * Calls {@code action} with the error, if any, and returns this result unchanged.
     */
    Result<T, E> inspectError(Consumer<? super E> action);

    /**
     * Returns an iterable yielding the success value once, or nothing for a failure.
     * Each call to {@link Iterable#iterator()} starts over.
     */
    Iterable<T> toSequence();

    /**
     * Returns a stream of the success value, or an empty stream for a failure.
     */
    Stream<T> stream();

    // Chaining
    /**
     * Returns {@code other} if this is a success, otherwise this failure's error.
     */
    <U> Result<U, E> and(Result<U, E> other);

    /**
     * Applies {@code mapper} to the success value and returns its result. A failure is
     * propagated without invoking {@code mapper}.
     */
    <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> mapper);

    /**
     * Returns this success value if present, otherwise {@code other}.
     */
    <F> Result<T, F> or(Result<T, F> other);

    /**
     * Applies {@code recovery} to the error and returns its result. A success is
     * returned without invoking {@code recovery}.
     */
    <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> recovery);

    // Value extraction
    /**
     * Returns the success value.
     *
     * @throws UnwrapOnFailureException if this is a failure; the error is attached as payload
     */
    T unwrap();

    /**
     * Returns the error.
     *
     * @throws UnwrapOnSuccessException if this is a success; the value is attached as payload
     */
    E unwrapError();

    /**
     * Returns the success value.
     *
     * @param message the diagnostic used if this is a failure
     * @throws UnwrapOnFailureException if this is a failure
     */
    T expect(String message);

    /**
     * Returns the error.
     *
     * @param message the diagnostic used if this is a success
     * @throws UnwrapOnSuccessException if this is a success
     */
    E expectFailure(String message);

    T unwrapOr(T defaultValue);
    T unwrapOrElse(Function<? super E, ? extends T> fallback);

    /**
     * Returns the success value, or the canonical default held by {@code defaultValue}.
     */
    T unwrapOrDefault(DefaultValue<? extends T> defaultValue);

    /**
     * Returns the success value, or the canonical default for {@code type}.
     *
     * <p>Only the types enumerated by {@link DefaultValue} are recognised. Generic
     * container types cannot be named by a class literal without losing their type
     * arguments; use {@link #unwrapOrDefault(DefaultValue)} with {@link DefaultValue#list()},
     * {@link DefaultValue#map()} or {@link DefaultValue#set()} for those.
     *
     * @throws UnsupportedDefaultTypeException if this is a failure and {@code type} has no default
     */
    T unwrapOrDefault(Class<T> type);

    // Static factories
    static <E> Result<Void, E> success() {
        return new Success<>(null);
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
