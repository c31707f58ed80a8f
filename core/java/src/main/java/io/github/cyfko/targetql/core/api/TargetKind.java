package io.github.cyfko.targetql.core.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminator of the atomic target kinds.
 * <p>
 * Each kind carries the name written under {@code _metadata.kind} in the document form.
 * </p>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public enum TargetKind {

    /** Space (or group of spaces) where ads can be delivered. */
    AD_UNIT("AdUnit"),

    /** Grouping of ad units targeted all at once. */
    PLACEMENT("Placement"),

    /** Country, region, city or metro. */
    GEOGRAPHY("Geography"),

    /** Browser, device, operating system, carrier... */
    TECHNOLOGY("Technology"),

    /** Day of week and time range. */
    DAY_PART("DayPart"),

    /** Domain of the user. */
    USER_DOMAIN("UserDomain"),

    /** Custom key/value targeting. */
    CUSTOM("Custom"),

    /** Video content bundle. */
    VIDEO_CONTENT("VideoContent"),

    /** Position within a video pod. */
    VIDEO_POSITION("VideoPosition");

    private final String documentName;

    TargetKind(String documentName) {
        this.documentName = documentName;
    }

    /**
     * @return the name of this kind in the document form, e.g. {@code "AdUnit"}
     */
    public String documentName() {
        return documentName;
    }

    /**
     * Resolves a kind from its document name.
     *
     * @param documentName name read from {@code _metadata.kind}
     * @return the matching kind, or empty when the name is unknown
     */
    public static Optional<TargetKind> fromDocumentName(String documentName) {
        return Arrays.stream(values())
                .filter(kind -> kind.documentName.equals(documentName))
                .findFirst();
    }
}
