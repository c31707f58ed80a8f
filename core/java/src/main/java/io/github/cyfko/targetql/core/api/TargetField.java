package io.github.cyfko.targetql.core.api;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Standard fields shared by every {@link Target}, with their document keys.
 * <p>
 * Tree search and filtering address target fields by key; these constants spare
 * callers from repeating the raw strings.
 * </p>
 *
 * <pre>{@code
 * tree.getSubtree(TargetField.ID, "2");
 * tree.filterTreeByKey(TargetField.EXTERNAL_NAME.key(), Set.of("sports"));
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public enum TargetField {

    ID("id", Target::getId),
    PARENT_ID("parent_id", Target::getParentId),
    NAME("name", Target::getName),
    EXTERNAL_ID("external_id", Target::getExternalId),
    EXTERNAL_NAME("external_name", Target::getExternalName),
    DESCRIPTIVE_NAME("descriptive_name", Target::getDescriptiveName);

    private final String key;
    private final Function<Target, String> accessor;

    TargetField(String key, Function<Target, String> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    /**
     * @return the document key of this field
     */
    public String key() {
        return key;
    }

    /**
     * Reads this field from a target.
     *
     * @param target target to read
     * @return the field value, possibly {@code null}
     */
    public String valueOf(Target target) {
        return accessor.apply(target);
    }

    /**
     * Resolves a standard field from its document key.
     *
     * @param key document key such as {@code "parent_id"}
     * @return the field, or empty when the key names an attribute
     */
    public static Optional<TargetField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key.equals(key))
                .findFirst();
    }
}
