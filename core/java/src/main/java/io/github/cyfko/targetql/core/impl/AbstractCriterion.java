package io.github.cyfko.targetql.core.impl;

import io.github.cyfko.targetql.core.api.Criterion;
import io.github.cyfko.targetql.core.api.Operator;
import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetPartition;
import io.github.cyfko.targetql.core.api.TargetingElement;
import io.github.cyfko.targetql.core.exception.CriterionStructureException;
import io.github.cyfko.targetql.core.exception.TargetNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Shared implementation of {@link Criterion}: holds the operator and the ordered elements,
 * and implements combination, flattening, decomposition and removal on top of them.
 * <p>
 * Subclasses only decide how a node contributes to the included targets
 * (see {@link #collectIncludes(List)}).
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public abstract class AbstractCriterion implements Criterion {

    private static final Logger log = Logger.getLogger(AbstractCriterion.class.getName());

    private final Operator operator;
    private final List<TargetingElement> elements;

    protected AbstractCriterion(Operator operator, List<? extends TargetingElement> elements) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(elements, "Elements cannot be null");
        List<TargetingElement> copy = new ArrayList<>(elements.size());
        for (TargetingElement element : elements) {
            copy.add(Objects.requireNonNull(element, "Criterion elements cannot be null"));
        }
        this.elements = Collections.unmodifiableList(copy);
    }

    @Override
    public Operator operator() {
        return operator;
    }

    @Override
    public List<TargetingElement> elements() {
        return elements;
    }

    @Override
    public Criterion and(Criterion other) {
        return combine(this, other, Operator.AND);
    }

    @Override
    public Criterion or(Criterion other) {
        return combine(this, other, Operator.OR);
    }

    @Override
    public Criterion not() {
        return new Negation(List.of(this));
    }

    /**
     * Combines two criteria under {@code operator}, splicing their elements into a single
     * node when both sides are extendable and start with elements of the same kind.
     *
     * @param first left operand
     * @param second right operand
     * @param operator {@link Operator#AND} or {@link Operator#OR}
     * @return the combined criterion
     */
    static Criterion combine(Criterion first, Criterion second, Operator operator) {
        Objects.requireNonNull(first, "Criterion cannot be null");
        Objects.requireNonNull(second, "Other criterion cannot be null");

        // Negations are never simplified
        if (first.operator() == Operator.NOT || second.operator() == Operator.NOT) {
            return new Combination(operator, List.of(first, second));
        }

        List<TargetingElement> elements1 = first.elements();
        List<TargetingElement> elements2 = second.elements();

        boolean firstExtendable = first.operator() == operator || elements1.size() <= 1;
        boolean secondExtendable = second.operator() == operator || elements2.size() <= 1;

        if (firstExtendable && secondExtendable && sameKind(elements1, elements2)) {
            List<TargetingElement> spliced = new ArrayList<>(elements1.size() + elements2.size());
            spliced.addAll(elements1);
            spliced.addAll(elements2);
            return new Combination(operator, spliced);
        }
        return new Combination(operator, List.of(first, second));
    }

    /**
     * Compares the first element of each list: both criteria, or both targets of the same
     * {@link io.github.cyfko.targetql.core.api.TargetKind}. An empty list has no kind.
     */
    private static boolean sameKind(List<TargetingElement> elements1, List<TargetingElement> elements2) {
        if (elements1.isEmpty() || elements2.isEmpty()) {
            return false;
        }
        TargetingElement head1 = elements1.get(0);
        TargetingElement head2 = elements2.get(0);
        if (head1 instanceof Criterion && head2 instanceof Criterion) {
            return true;
        }
        return head1 instanceof Target t1 && head2 instanceof Target t2 && t1.getKind() == t2.getKind();
    }

    @Override
    public List<Target> flatten() {
        List<Target> targets = new ArrayList<>();
        collectAll(targets);
        return targets;
    }

    private void collectAll(List<Target> sink) {
        for (TargetingElement element : elements) {
            if (element instanceof Target target) {
                sink.add(target);
            } else if (element instanceof AbstractCriterion criterion) {
                criterion.collectAll(sink);
            } else if (element instanceof Criterion criterion) {
                sink.addAll(criterion.flatten());
            }
        }
    }

    /**
     * Adds the targets of this node that do not live under a NOT.
     *
     * @param sink list receiving the included targets
     */
    protected abstract void collectIncludes(List<Target> sink);

    /**
     * Collects includes of every element: targets directly, nested criteria recursively.
     */
    protected final void collectElementIncludes(List<Target> sink) {
        for (TargetingElement element : elements) {
            if (element instanceof Target target) {
                sink.add(target);
            } else if (element instanceof AbstractCriterion criterion) {
                criterion.collectIncludes(sink);
            } else if (element instanceof Criterion criterion) {
                sink.addAll(criterion.getIncludesAndExcludes().includes());
            }
        }
    }

    @Override
    public TargetPartition getIncludesAndExcludes() {
        Set<Target> all = new LinkedHashSet<>(flatten());

        List<Target> includedTargets = new ArrayList<>();
        collectIncludes(includedTargets);
        Set<Target> includes = new LinkedHashSet<>(includedTargets);

        Set<Target> excludes = new LinkedHashSet<>(all);
        excludes.removeAll(includes);

        log.fine(() -> String.format("Decomposed %s criterion: %d include(s), %d exclude(s)",
                operator, includes.size(), excludes.size()));

        return new TargetPartition(new ArrayList<>(includes), new ArrayList<>(excludes));
    }

    @Override
    public Optional<Criterion> removeTarget(Criterion target) {
        Objects.requireNonNull(target, "Target criterion cannot be null");

        if (this.equals(target)) {
            return Optional.empty();
        }

        if (operator != Operator.AND) {
            throw new CriterionStructureException(
                    "Criterion has wrong structure. Top-level operator is " + operator + ", expected AND");
        }

        List<TargetingElement> targetElements = target.elements();
        if (target.operator() != Operator.OR
                || targetElements.size() != 1
                || !(targetElements.get(0) instanceof Target targetModel)) {
            throw new CriterionStructureException(
                    "Target must be an OR criterion holding a single target, got " + target);
        }

        int index = elements.indexOf(target);
        if (index < 0) {
            index = elements.indexOf(targetModel);
        }
        if (index < 0) {
            throw new TargetNotFoundException("Target " + targetModel + " not found in top-level structure");
        }

        List<TargetingElement> remaining = new ArrayList<>(elements);
        remaining.remove(index);

        if (remaining.isEmpty()) {
            return Optional.empty();
        }
        if (remaining.size() == 1) {
            TargetingElement last = remaining.get(0);
            if (last instanceof Criterion criterion) {
                return Optional.of(criterion);
            }
            return Optional.of(new Combination(Operator.OR, remaining));
        }
        return Optional.of(new Combination(Operator.AND, remaining));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Criterion other)) return false;
        return operator == other.operator() && elements.equals(other.elements());
    }

    @Override
    public int hashCode() {
        return 31 * operator.hashCode() + elements.hashCode();
    }

    @Override
    public String toString() {
        return "Criterion{" + operator + ":" + elements + "}";
    }
}
