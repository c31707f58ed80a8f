package io.github.cyfko.targetql.core.api;

/**
 * Families of hierarchical targets an ad provider can list, each mapped to the
 * {@link TargetKind} of the targets it yields.
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 * @see TargetProvider
 */
public enum TargetType {

    ADUNIT(TargetKind.AD_UNIT),
    GEOGRAPHY(TargetKind.GEOGRAPHY),
    DEMOGRAPHICS(TargetKind.CUSTOM),
    AD_POSITION(TargetKind.CUSTOM),
    CUSTOM(TargetKind.CUSTOM);

    private final TargetKind kind;

    TargetType(TargetKind kind) {
        this.kind = kind;
    }

    /**
     * @return the kind of the targets listed for this type
     */
    public TargetKind kind() {
        return kind;
    }
}
