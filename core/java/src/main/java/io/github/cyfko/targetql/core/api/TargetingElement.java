package io.github.cyfko.targetql.core.api;

/**
 * Anything that may appear as an element of a {@link Criterion}: either an atomic
 * {@link Target} or a nested {@link Criterion}.
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public interface TargetingElement {
}
