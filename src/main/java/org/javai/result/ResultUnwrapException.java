package org.javai.result;

/**
 * Thrown when a value is extracted from the wrong variant of a {@link Result}.
 * This is an unchecked exception because it indicates misuse of the API: the caller
 * should have checked the variant first or used one of the {@code unwrapOr...} methods.
 *
 * <p>The exception carries the payload of the variant that was actually present, and
 * renders it after the diagnostic in {@link #getMessage()}. A {@link Throwable} payload
 * also becomes the cause.
 */
public abstract class ResultUnwrapException extends RuntimeException {

    private final String diagnostic;
    private final transient Object payload;

    protected ResultUnwrapException(String diagnostic, Object payload) {
        super(render(diagnostic, payload));
        this.diagnostic = diagnostic;
        this.payload = payload;
        if (payload instanceof Throwable throwable) {
            initCause(throwable);
        }
    }

    /**
     * Returns the message supplied at the call site, without the rendered payload.
     */
    public String diagnostic() {
        return diagnostic;
    }

    /**
     * Returns the payload of the variant that was present when extraction failed.
     */
    public Object payload() {
        return payload;
    }

    private static String render(String diagnostic, Object payload) {
        return payload != null ? diagnostic + ": " + payload : diagnostic;
    }
}
