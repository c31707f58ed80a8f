package io.github.cyfko.targetql.core.exception;

/**
 * Exception thrown when a target to remove is not among the direct elements of a criterion.
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public class TargetNotFoundException extends TargetingException {

    public TargetNotFoundException(String message) {
        super(message);
    }
}
