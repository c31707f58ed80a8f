package io.github.cyfko.targetql.core.exception;

/**
 * Exception thrown when an operation receives arguments it cannot work with.
 * <p>
 * Typical causes are an unknown operator name, an element list that is not a list,
 * an element that is neither a target nor a criterion, or mutually exclusive
 * flattening options.
 * </p>
 *
 * <p><strong>Usage Examples:</strong></p>
 * <pre>{@code
 * Criteria.of("XOR", List.of(target));
 * // → "Invalid operator 'XOR'. Supported operators: [OR, AND, NOT]"
 *
 * tree.flatten(1, true);
 * // → "Depth selection and leaf selection are mutually exclusive"
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public class TargetingArgumentException extends TargetingException {

    /**
     * Creates a new TargetingArgumentException with detailed message.
     *
     * @param message explanation of the invalid argument
     */
    public TargetingArgumentException(String message) {
        super(message);
    }

    /**
     * Creates a new TargetingArgumentException with detailed message and cause.
     *
     * @param message explanation of the invalid argument
     * @param cause underlying exception causing this failure
     */
    public TargetingArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
