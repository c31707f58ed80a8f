package io.github.cyfko.targetql.core;

import io.github.cyfko.targetql.core.api.Criterion;
import io.github.cyfko.targetql.core.api.Operator;
import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetingElement;
import io.github.cyfko.targetql.core.exception.TargetingArgumentException;
import io.github.cyfko.targetql.core.impl.Combination;
import io.github.cyfko.targetql.core.impl.Negation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for building {@link Criterion} instances.
 * <p>
 * Criteria built here are taken literally: no splicing or other simplification happens at
 * construction. Simplification only occurs when criteria are combined through
 * {@link Criterion#and(Criterion)} and {@link Criterion#or(Criterion)}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Criterion sports = Criteria.of(Operator.OR, List.of(hockey, baseball));
 * Criterion home = Criteria.of(homeAdUnit);                 // OR:[home]
 *
 * Criterion criterion = home.and(sports.not());
 * TargetPartition partition = criterion.getIncludesAndExcludes();
 * // includes: [home], excludes: [hockey, baseball]
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class Criteria {

    private Criteria() {
        // Utility class - prevent instantiation
    }

    /**
     * Wraps a single target as {@code OR:[target]}.
     *
     * @param target the target
     * @return a single-element OR criterion
     * @throws NullPointerException if {@code target} is null
     */
    public static Criterion of(Target target) {
        Objects.requireNonNull(target, "Target cannot be null");
        return new Combination(Operator.OR, List.of(target));
    }

    /**
     * Builds a criterion with an explicit operator.
     *
     * @param operator OR, AND or NOT
     * @param elements ordered elements; targets and criteria may be mixed
     * @return the criterion
     * @throws NullPointerException if an argument or an element is null
     */
    public static Criterion of(Operator operator, List<? extends TargetingElement> elements) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(elements, "Elements cannot be null");
        return operator == Operator.NOT ? new Negation(elements) : new Combination(operator, elements);
    }

    /**
     * Builds a criterion with an explicit operator.
     *
     * @param operator OR, AND or NOT
     * @param elements ordered elements
     * @return the criterion
     */
    public static Criterion of(Operator operator, TargetingElement... elements) {
        return of(operator, Arrays.asList(elements));
    }

    /**
     * Untyped construction used when the operator name and elements come from outside,
     * e.g. from a document.
     *
     * @param operatorName operator name, case-insensitive
     * @param elements expected to be a {@link List} of targets and/or criteria
     * @return the criterion
     * @throws TargetingArgumentException if the operator is unknown, {@code elements} is not a
     *         list, or an element is neither a target nor a criterion
     */
    public static Criterion of(String operatorName, Object elements) {
        Operator operator = Operator.fromString(operatorName);
        if (operator == null) {
            throw new TargetingArgumentException(String.format(
                    "Invalid operator '%s'. Supported operators: %s",
                    operatorName, Arrays.toString(Operator.values())
            ));
        }
        if (!(elements instanceof List<?> list)) {
            throw new TargetingArgumentException(String.format(
                    "Invalid target list: expected a list of targets or criteria, got %s",
                    elements == null ? "null" : elements.getClass().getSimpleName()
            ));
        }

        List<TargetingElement> typed = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof TargetingElement targetingElement)) {
                throw new TargetingArgumentException(String.format(
                        "Invalid target list element %s: expected a Target or a Criterion", element
                ));
            }
            typed.add(targetingElement);
        }
        return of(operator, typed);
    }
}
