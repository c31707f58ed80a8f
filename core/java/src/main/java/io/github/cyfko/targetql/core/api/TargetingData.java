package io.github.cyfko.targetql.core.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Targeting bundle of a line item: one optional {@link Criterion} per targeting slot.
 *
 * <pre>{@code
 * TargetingData data = TargetingData.builder()
 *     .criterion(TargetingData.Slot.INVENTORY, Criteria.of(home).and(Criteria.of(sports).not()))
 *     .criterion(TargetingData.Slot.GEOGRAPHY, Criteria.of(unitedStates))
 *     .build();
 * }</pre>
 *
 * @author TargetQL Contributors
 * @since 1.0.0
 */
public final class TargetingData {

    /**
     * Targeting slots, with their document keys.
     */
    public enum Slot {
        INVENTORY("inventory"),
        GEOGRAPHY("geography"),
        DAY_PART("day_part"),
        USER_DOMAIN("user_domain"),
        TECHNOLOGY("technology"),
        VIDEO_CONTENT("video_content"),
        VIDEO_POSITION("video_position"),
        CUSTOM("custom");

        private final String key;

        Slot(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    private final Map<Slot, Criterion> criteria;

    private TargetingData(Builder builder) {
        this.criteria = Collections.unmodifiableMap(new LinkedHashMap<>(builder.criteria));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param slot targeting slot
     * @return the criterion of that slot, if any
     */
    public Optional<Criterion> get(Slot slot) {
        return Optional.ofNullable(criteria.get(slot));
    }

    /**
     * @return the criteria of the filled slots (read-only)
     */
    public Map<Slot, Criterion> asMap() {
        return criteria;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetingData other)) return false;
        return criteria.equals(other.criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "TargetingData" + criteria;
    }

    public static final class Builder {
        private final Map<Slot, Criterion> criteria = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Sets (or clears, when {@code criterion} is null) a slot.
         */
        public Builder criterion(Slot slot, Criterion criterion) {
            Objects.requireNonNull(slot, "slot");
            if (criterion == null) {
                criteria.remove(slot);
            } else {
                criteria.put(slot, criterion);
            }
            return this;
        }

        public TargetingData build() {
            return new TargetingData(this);
        }
    }
}
