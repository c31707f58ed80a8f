package io.github.cyfko.targetql.core.exception;

/**
 * Exception thrown when a document (or its JSON text) cannot be converted back into
 * targets, criteria or trees.
 * <p>
 * Raised for missing or unknown {@code _metadata} kinds, documents without exactly one
 * operator key, child lists that are not lists, and JSON that does not parse.
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 * @see io.github.cyfko.targetql.core.codec.CriterionCodec
 * @see io.github.cyfko.targetql.core.codec.DocumentMapper
 */
public class DocumentFormatException extends TargetingArgumentException {

    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
