package io.github.cyfko.targetql.core.exception;

/**
 * Base type of every failure raised by the targeting core.
 * <p>
 * All failures are local and synchronous: the core never performs I/O, so there is
 * no transient failure class and nothing is worth retrying. Callers surface these
 * exceptions directly to their own users.
 * </p>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link TargetingArgumentException} - invalid operator, element list or argument combination</li>
 *   <li>{@link DocumentFormatException} - malformed document or JSON input</li>
 *   <li>{@link CriterionStructureException} - criterion does not have the expected shape</li>
 *   <li>{@link TargetNotFoundException} - removal target absent from a criterion</li>
 * </ul>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public abstract class TargetingException extends RuntimeException {

    /**
     * @param message explanation of the failure
     */
    protected TargetingException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure
     */
    protected TargetingException(String message, Throwable cause) {
        super(message, cause);
    }
}
