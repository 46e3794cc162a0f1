package org.javai.result;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The canonical zero or empty value of a well-known type, used by
 * {@link Result#unwrapOrDefault(DefaultValue)} and {@link Result#unwrapOrDefault(Class)}.
 *
 * <p>The set of defaults is closed: only the constants and factory methods of this class
 * create instances, and {@link #forType(Class)} resolves a class by exact match against them.
 * A type outside the set is rejected with {@link UnsupportedDefaultTypeException} rather than
 * given a guessed value.
 *
 * <p>All default values are immutable. The collection defaults are the unmodifiable
 * empty {@link List}, {@link Map} and {@link Set}.
 *
 * @param <T> the type of the default value
 */
public final class DefaultValue<T> {

    public static final DefaultValue<Integer> INTEGER = new DefaultValue<>("Integer", 0, Integer.class, int.class);
    public static final DefaultValue<Long> LONG = new DefaultValue<>("Long", 0L, Long.class, long.class);
    public static final DefaultValue<Short> SHORT = new DefaultValue<>("Short", (short) 0, Short.class, short.class);
    public static final DefaultValue<Byte> BYTE = new DefaultValue<>("Byte", (byte) 0, Byte.class, byte.class);
    public static final DefaultValue<Double> DOUBLE = new DefaultValue<>("Double", 0.0d, Double.class, double.class);
    public static final DefaultValue<Float> FLOAT = new DefaultValue<>("Float", 0.0f, Float.class, float.class);
    public static final DefaultValue<String> STRING = new DefaultValue<>("String", "", String.class);
    public static final DefaultValue<Boolean> BOOLEAN = new DefaultValue<>("Boolean", false, Boolean.class, boolean.class);
    public static final DefaultValue<BigInteger> BIG_INTEGER = new DefaultValue<>("BigInteger", BigInteger.ZERO, BigInteger.class);
    public static final DefaultValue<BigDecimal> BIG_DECIMAL = new DefaultValue<>("BigDecimal", BigDecimal.ZERO, BigDecimal.class);
    public static final DefaultValue<Duration> DURATION = new DefaultValue<>("Duration", Duration.ZERO, Duration.class);
    public static final DefaultValue<Instant> INSTANT = new DefaultValue<>("Instant", Instant.EPOCH, Instant.class);
    public static final DefaultValue<Pattern> PATTERN = new DefaultValue<>("Pattern", Pattern.compile(""), Pattern.class);
    public static final DefaultValue<URI> URI = new DefaultValue<>("URI", java.net.URI.create(""), java.net.URI.class);

    private static final DefaultValue<List<?>> LIST = new DefaultValue<>("List", List.of(), List.class);
    private static final DefaultValue<Map<?, ?>> MAP = new DefaultValue<>("Map", Map.of(), Map.class);
    private static final DefaultValue<Set<?>> SET = new DefaultValue<>("Set", Set.of(), Set.class);

    private static final Map<Class<?>, DefaultValue<?>> BY_TYPE = index(
            INTEGER, LONG, SHORT, BYTE, DOUBLE, FLOAT, STRING, BOOLEAN,
            BIG_INTEGER, BIG_DECIMAL, DURATION, INSTANT, PATTERN, URI,
            LIST, MAP, SET);

    private final String name;
    private final T value;
    private final Class<?>[] types;

    private DefaultValue(String name, T value, Class<?>... types) {
        this.name = name;
        this.value = value;
        this.types = types;
    }

    /**
     * Returns the default for an empty list of any element type.
     */
    public static <V> DefaultValue<List<V>> list() {
        return new DefaultValue<>("List", List.of(), List.class);
    }

    /**
     * Returns the default for an empty map of any key and value type.
     */
    public static <K, V> DefaultValue<Map<K, V>> map() {
        return new DefaultValue<>("Map", Map.of(), Map.class);
    }

    /**
     * Returns the default for an empty set of any element type.
     */
    public static <V> DefaultValue<Set<V>> set() {
        return new DefaultValue<>("Set", Set.of(), Set.class);
    }

    /**
     * Resolves the default for {@code type}. Primitive classes resolve to the default of
     * their wrapper. Subtypes of a supported type are not supported themselves.
     *
     * @throws UnsupportedDefaultTypeException if {@code type} has no default
     */
    @SuppressWarnings("unchecked")
    public static <T> DefaultValue<T> forType(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        DefaultValue<?> found = BY_TYPE.get(type);
        if (found == null) {
            throw new UnsupportedDefaultTypeException(type);
        }
        // keyed by exact class, so the entry's value is a T
        return (DefaultValue<T>) found;
    }

    public static boolean isSupported(Class<?> type) {
        return type != null && BY_TYPE.containsKey(type);
    }

    public T get() {
        return value;
    }

    @Override
    public String toString() {
        return "DefaultValue[" + name + "]";
    }

    private static Map<Class<?>, DefaultValue<?>> index(DefaultValue<?>... defaults) {
        Map<Class<?>, DefaultValue<?>> byType = new HashMap<>();
        for (DefaultValue<?> defaultValue : defaults) {
            for (Class<?> type : defaultValue.types) {
                byType.put(type, defaultValue);
            }
        }
        return Map.copyOf(byType);
    }
}
