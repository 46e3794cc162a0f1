package org.javai.result;

/**
 * Thrown when a default value is requested for a type that {@link DefaultValue} does not know.
 */
public class UnsupportedDefaultTypeException extends RuntimeException {

    private final Class<?> type;

    public UnsupportedDefaultTypeException(Class<?> type) {
        super("Type " + type.getName() + " has no default value, use unwrapOr or unwrapOrElse instead");
        this.type = type;
    }

    public Class<?> type() {
        return type;
    }
}
