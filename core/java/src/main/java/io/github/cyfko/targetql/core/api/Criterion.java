package io.github.cyfko.targetql.core.api;

import io.github.cyfko.targetql.core.exception.CriterionStructureException;
import io.github.cyfko.targetql.core.exception.TargetNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Boolean expression node over {@link Target}s and nested criteria.
 * <p>
 * A criterion is either a combination ({@link Operator#OR} / {@link Operator#AND}) of an
 * ordered list of elements, or a negation ({@link Operator#NOT}). Leaf targets are always
 * wrapped: a single target becomes {@code OR:[target]}.
 * </p>
 *
 * <h2>Combination</h2>
 * <p>
 * {@link #and(Criterion)} and {@link #or(Criterion)} splice associative chains instead of
 * nesting them when both operands agree with the requested operator (or hold at most one
 * element) and their first elements have the same concrete kind. A negated operand is never
 * spliced:
 * </p>
 * <pre>{@code
 * home.or(page)                  // OR:[home, page]
 * home.or(page).or(hockey)       // OR:[home, page, hockey]
 * home.and(hockey.not())         // AND:[OR:[home], NOT:[OR:[hockey]]]
 * }</pre>
 *
 * <h2>Equality</h2>
 * <p>
 * {@code equals} compares the operator and the elements pairwise <em>in order</em>,
 * recursively. {@code OR:[a, b]} and {@code OR:[b, a]} are therefore different criteria.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations are immutable; every operation returns a new instance.
 * </p>
 *
 * @see io.github.cyfko.targetql.core.Criteria
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public interface Criterion extends TargetingElement {

    /**
     * @return the top-level operator of this criterion
     */
    Operator operator();

    /**
     * @return the direct elements of this criterion, in order (read-only)
     */
    List<TargetingElement> elements();

    /**
     * Combines this criterion with another one under AND.
     *
     * @param other the other criterion
     * @return a new criterion representing (this AND other)
     * @throws NullPointerException if {@code other} is null
     */
    Criterion and(Criterion other);

    /**
     * Combines this criterion with another one under OR.
     *
     * @param other the other criterion
     * @return a new criterion representing (this OR other)
     * @throws NullPointerException if {@code other} is null
     */
    Criterion or(Criterion other);

    /**
     * Negates this criterion. Double negations are kept as is.
     *
     * @return {@code NOT:[this]}
     */
    Criterion not();

    /**
     * Lists every target mentioned anywhere in this criterion, in document order,
     * including targets below a NOT. Duplicates are kept.
     *
     * @return all targets of this criterion
     */
    List<Target> flatten();

    /**
     * Splits the targets of this criterion into includes and excludes.
     * <p>
     * Includes are the targets reachable through OR/AND elements without entering a NOT;
     * excludes are all remaining targets of {@link #flatten()}.
     * </p>
     * <p>
     * <strong>Warning:</strong> this is a heuristic, not a boolean solver. It is only exact
     * for criteria shaped like {@code (OR:[t1, t2]) AND (NOT: OR:[t3, t4])}; with deeper
     * nesting targets may be misclassified.
     * </p>
     *
     * @return the include/exclude partition
     */
    TargetPartition getIncludesAndExcludes();

    /**
     * Removes a single target from a top-level AND.
     * <p>
     * The target is given as a single-target OR criterion; it is looked up among the direct
     * elements of this criterion, either as that criterion or as its bare target. The rest
     * is re-wrapped: nothing left gives an empty result, a single remaining criterion is
     * returned unwrapped, a single remaining target is wrapped as {@code OR}, anything else
     * stays an {@code AND}.
     * </p>
     *
     * @param target {@code OR:[t]} criterion naming the target to remove
     * @return the remaining criterion, or empty when nothing remains
     * @throws CriterionStructureException if this criterion is not an AND, or {@code target}
     *         is not an OR holding exactly one target
     * @throws TargetNotFoundException if the target is not a direct element of this criterion
     */
    Optional<Criterion> removeTarget(Criterion target);
}
