package io.github.cyfko.targetql.core.exception;

/**
 * Exception thrown when an operation expecting the canonical AND-of-ORs shape receives a
 * criterion with a different structure.
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * orCriterion.removeTarget(single);
 * // → "Criterion has wrong structure. Top-level operator is OR, expected AND"
 *
 * andCriterion.removeTarget(twoTargetOr);
 * // → "Target must be an OR criterion holding a single target"
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public class CriterionStructureException extends TargetingException {

    public CriterionStructureException(String message) {
        super(message);
    }
}
