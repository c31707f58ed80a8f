package io.github.cyfko.targetql.core.api;

import java.util.List;

/**
 * Source of flat, parent-linked target lists.
 * <p>
 * Implemented by provider adapters (outside of this library) that fetch inventory,
 * geographies or custom key/values from an ad server. Every returned target exposes
 * its {@code id} and, when it has one, its {@code parentId}.
 * </p>
 *
 * <pre>{@code
 * TreeBuilder builder = new TreeBuilder(provider);
 * NodeTree inventory = builder.constructTree(TargetType.ADUNIT);
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public interface TargetProvider {

    /**
     * @return every ad unit known to the provider
     */
    List<Target> getAdUnitTargets();

    /**
     * @return every geography known to the provider
     */
    List<Target> getGeographyTargets();

    /**
     * Custom key/value targets. Demographics and ad positions are modelled as custom
     * targets as well.
     *
     * @return every custom target known to the provider
     */
    List<Target> getCustomTargets();

    /**
     * Lists the targets of the given type.
     *
     * @param type requested target family
     * @return the flat target list
     */
    default List<Target> getTargets(TargetType type) {
        return switch (type) {
            case ADUNIT -> getAdUnitTargets();
            case GEOGRAPHY -> getGeographyTargets();
            case DEMOGRAPHICS, AD_POSITION, CUSTOM -> getCustomTargets();
        };
    }
}
