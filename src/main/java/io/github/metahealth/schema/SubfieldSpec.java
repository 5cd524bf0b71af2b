package io.github.metahealth.schema;

import com.google.common.collect.ImmutableSet;

import java.util.Objects;
import java.util.Set;

/**
 * Static description of one tracked subfield: its name, the permitted categorical values
 * (empty for presence-only subfields) and the extractor that finds it in an occurrence.
 */
public final class SubfieldSpec {

    public static final String OTHER = "Other";

    private final String name;
    private final ImmutableSet<String> permittedValues;
    private final boolean enumerated;
    private final SubfieldExtractor extractor;

    private SubfieldSpec(String name, Set<String> permittedValues, boolean enumerated,
                         SubfieldExtractor extractor) {
        this.name = Objects.requireNonNull(name, "name");
        this.permittedValues = ImmutableSet.copyOf(permittedValues);
        this.enumerated = enumerated;
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public static SubfieldSpec presence(String name, SubfieldExtractor extractor) {
        return new SubfieldSpec(name, ImmutableSet.of(), false, extractor);
    }

    public static SubfieldSpec enumerated(String name, Set<String> permittedValues,
                                          SubfieldExtractor extractor) {
        if (permittedValues.isEmpty()) {
            throw new IllegalArgumentException("Enumerated subfield '" + name + "' needs permitted values");
        }
        return new SubfieldSpec(name, permittedValues, true, extractor);
    }

    public String getName() {
        return name;
    }

    public boolean isEnumerated() {
        return enumerated;
    }

    public ImmutableSet<String> getPermittedValues() {
        return permittedValues;
    }

    public SubfieldExtractor getExtractor() {
        return extractor;
    }

    /**
     * Maps an observed value onto the enumeration.
     *
     * @return the value itself when permitted, {@value #OTHER} when the enumeration defines
     *         that sentinel, otherwise null (the observation is not counted under any value)
     */
    public String classify(String value) {
        if (!enumerated || value == null) {
            return null;
        }
        if (permittedValues.contains(value)) {
            return value;
        }
        return permittedValues.contains(OTHER) ? OTHER : null;
    }

    @Override
    public String toString() {
        return enumerated
                ? "SubfieldSpec[" + name + ", " + permittedValues.size() + " values]"
                : "SubfieldSpec[" + name + ", presence]";
    }
}
