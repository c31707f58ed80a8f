package io.github.cyfko.targetql.core.api;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Criterion#getIncludesAndExcludes()}: the distinct targets that are
 * included (reachable without crossing a NOT) and those that are excluded (every other
 * target mentioned in the criterion), each in first-seen order.
 *
 * @param includes targets to include
 * @param excludes targets to exclude
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public record TargetPartition(List<Target> includes, List<Target> excludes) {

    public TargetPartition {
        includes = List.copyOf(Objects.requireNonNull(includes, "includes cannot be null"));
        excludes = List.copyOf(Objects.requireNonNull(excludes, "excludes cannot be null"));
    }
}
