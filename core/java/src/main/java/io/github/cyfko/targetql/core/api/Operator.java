package io.github.cyfko.targetql.core.api;

/**
 * Boolean operators of a {@link Criterion}.
 * <p>
 * The enum constant names are also the operator keys of the document form
 * ({@code {"OR": [...]}}, {@code {"AND": [...]}}, {@code {"NOT": [...]}}).
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public enum Operator {

    /** At least one element must be satisfied. */
    OR,

    /** Every element must be satisfied. */
    AND,

    /** The wrapped elements must not be satisfied. */
    NOT;

    /**
     * Parses an operator name, case-insensitively and ignoring surrounding blanks.
     *
     * @param value the operator name
     * @return the operator, or {@code null} if {@code value} is null or unknown
     */
    public static Operator fromString(String value) {
        if (value == null) return null;
        String normalized = value.trim().toUpperCase();
        for (Operator operator : values()) {
            if (operator.name().equals(normalized)) {
                return operator;
            }
        }
        return null;
    }
}
