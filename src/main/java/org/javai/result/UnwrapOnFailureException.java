package org.javai.result;

/**
 * Thrown by {@link Result#unwrap()} and {@link Result#expect(String)} on a
 * {@link Result.Failure}. The payload is the failure's error.
 */
public class UnwrapOnFailureException extends ResultUnwrapException {

    public UnwrapOnFailureException(String diagnostic, Object error) {
        super(diagnostic, error);
    }
}
