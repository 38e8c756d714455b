package com.graphgate.config.schema;

import java.util.Objects;

/**
 * Argument of a {@link Field}: its GraphQL type name and list/required modifiers.
 */
public final class Arg {

    private final String typeOf;
    private final boolean list;
    private final boolean required;

    public Arg(String typeOf, boolean list, boolean required) {
        this.typeOf = Objects.requireNonNull(typeOf, "typeOf");
        this.list = list;
        this.required = required;
    }

    public static Arg ofType(String typeOf) {
        return new Arg(typeOf, false, false);
    }

    public static Arg string() {
        return ofType("String");
    }

    public static Arg integer() {
        return ofType("Int");
    }

    public static Arg bool() {
        return ofType("Boolean");
    }

    /** GraphQL scalar or type name. */
    public String getTypeOf() {
        return typeOf;
    }

    public boolean isList() {
        return list;
    }

    public boolean isRequired() {
        return required;
    }

    public Arg asList() {
        return new Arg(typeOf, true, required);
    }

    public Arg asRequired() {
        return new Arg(typeOf, list, true);
    }

    /**
     * Arguments have no redundant state: an unset modifier and {@code false} are the same value,
     * so the compressed form is this argument.
     */
    public Arg compress() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arg that = (Arg) o;
        return list == that.list && required == that.required && Objects.equals(typeOf, that.typeOf);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeOf, list, required);
    }

    @Override
    public String toString() {
        return "Arg{typeOf=" + typeOf + ", list=" + list + ", required=" + required + "}";
    }
}
