package io.github.cyfko.targetql.core.impl;

import io.github.cyfko.targetql.core.api.Operator;
import io.github.cyfko.targetql.core.api.Target;
import io.github.cyfko.targetql.core.api.TargetingElement;
import io.github.cyfko.targetql.core.exception.TargetingArgumentException;

import java.util.List;

/**
 * OR / AND node of a criterion.
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class Combination extends AbstractCriterion {

    /**
     * @param operator {@link Operator#OR} or {@link Operator#AND}
     * @param elements ordered elements, targets or criteria
     * @throws TargetingArgumentException if {@code operator} is {@link Operator#NOT}
     */
    public Combination(Operator operator, List<? extends TargetingElement> elements) {
        super(operator, elements);
        if (operator == Operator.NOT) {
            throw new TargetingArgumentException("NOT criteria must be built as a Negation");
        }
    }

    @Override
    protected void collectIncludes(List<Target> sink) {
        collectElementIncludes(sink);
    }
}
