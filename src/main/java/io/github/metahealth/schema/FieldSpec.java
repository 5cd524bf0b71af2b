package io.github.metahealth.schema;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Objects;

/**
 * Static description of a tracked field.
 *
 * <p>The {@link Shape} decides how a value is turned into occurrences: a {@code SIMPLE} field is
 * only checked for presence, a {@code SINGULAR_COMPOSITE} contributes at most one occurrence
 * per record, and every element of a {@code REPEATABLE_COMPOSITE} is an occurrence of its own.</p>
 */
public final class FieldSpec {

    public enum Shape {
        SIMPLE,
        SINGULAR_COMPOSITE,
        REPEATABLE_COMPOSITE
    }

    private final String name;
    private final FieldStatus status;
    private final Shape shape;
    private final ImmutableList<SubfieldSpec> subfields;

    private FieldSpec(String name, FieldStatus status, Shape shape, ImmutableList<SubfieldSpec> subfields) {
        this.name = Objects.requireNonNull(name, "name");
        this.status = Objects.requireNonNull(status, "status");
        this.shape = shape;
        this.subfields = subfields;
    }

    public static FieldSpec simple(String name, FieldStatus status) {
        return new FieldSpec(name, status, Shape.SIMPLE, ImmutableList.of());
    }

    public static FieldSpec singular(String name, FieldStatus status, SubfieldSpec... subfields) {
        return new FieldSpec(name, status, Shape.SINGULAR_COMPOSITE, ImmutableList.copyOf(Arrays.asList(subfields)));
    }

    public static FieldSpec repeatable(String name, FieldStatus status, SubfieldSpec... subfields) {
        return new FieldSpec(name, status, Shape.REPEATABLE_COMPOSITE, ImmutableList.copyOf(Arrays.asList(subfields)));
    }

    public String getName() {
        return name;
    }

    public FieldStatus getStatus() {
        return status;
    }

    public Shape getShape() {
        return shape;
    }

    public ImmutableList<SubfieldSpec> getSubfields() {
        return subfields;
    }

    public boolean hasSubfields() {
        return !subfields.isEmpty();
    }

    @Override
    public String toString() {
        return "FieldSpec[" + name + ", " + status.getLabel() + ", " + shape + ", subfields=" + subfields.size() + "]";
    }
}
