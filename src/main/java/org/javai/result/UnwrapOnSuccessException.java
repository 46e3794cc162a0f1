package org.javai.result;

/**
 * Thrown by {@link Result#unwrapError()} and {@link Result#expectFailure(String)} on a
 * {@link Result.Success}. The payload is the success value.
 */
public class UnwrapOnSuccessException extends ResultUnwrapException {

    public UnwrapOnSuccessException(String diagnostic, Object value) {
        super(diagnostic, value);
    }
}
