package io.github.cyfko.targetql.core.impl;

import io.github.cyfko.targetql.core.api.Operator;
import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetingElement;

import java.util.List;

/**
 * NOT node of a criterion.
 * <p>
 * {@link io.github.cyfko.targetql.core.api.Criterion#not()} always produces a negation of
 * exactly one criterion. Negations read from documents keep whatever elements the document
 * lists; every one of them counts as excluded.
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class Negation extends AbstractCriterion {

    public Negation(List<? extends TargetingElement> elements) {
        super(Operator.NOT, elements);
    }

    /**
     * Nothing below a NOT is included.
     */
    @Override
    protected void collectIncludes(List<Target> sink) {
        // no-op
    }
}
