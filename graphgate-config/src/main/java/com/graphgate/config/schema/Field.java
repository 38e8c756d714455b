package com.graphgate.config.schema;

import com.graphgate.config.step.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field of a GraphQL type: type name, list/required modifiers, the ordered resolution
 * pipeline ({@link Step}s) and its arguments.
 * <p>
 * Steps and args distinguish "absent" (null) from empty; {@link #compress()} collapses empty to absent.
 */
public final class Field {

    private final String typeOf;
    private final boolean list;
    private final boolean required;
    private final List<Step> steps;
    private final Map<String, Arg> args;

    public Field(String typeOf, boolean list, boolean required, List<Step> steps, Map<String, Arg> args) {
        this.typeOf = Objects.requireNonNull(typeOf, "typeOf");
        this.list = list;
        this.required = required;
        this.steps = steps != null ? List.copyOf(steps) : null;
        this.args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : null;
    }

    /**
     * Field of the given type resolved by the given steps. With no steps the pipeline is absent.
     */
    public static Field ofType(String typeOf, Step... steps) {
        return new Field(typeOf, false, false, steps.length == 0 ? null : List.of(steps), null);
    }

    public static Field string() {
        return ofType("String");
    }

    public static Field integer() {
        return ofType("Int");
    }

    public static Field bool() {
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

    /** Resolution pipeline in execution order; null = not declared. */
    public List<Step> getSteps() {
        return steps;
    }

    /** Arguments by name; null = not declared. */
    public Map<String, Arg> getArgs() {
        return args;
    }

    public Field asList() {
        return new Field(typeOf, true, required, steps, args);
    }

    public Field asRequired() {
        return new Field(typeOf, list, true, steps, args);
    }

    public Field withSteps(Step... steps) {
        return withSteps(List.of(steps));
    }

    public Field withSteps(List<Step> steps) {
        return new Field(typeOf, list, required, steps, args);
    }

    public Field withArgs(Map<String, Arg> args) {
        return new Field(typeOf, list, required, steps, args);
    }

    /** Adds or replaces one argument. */
    public Field withArg(String name, Arg arg) {
        Map<String, Arg> updated = args != null ? new LinkedHashMap<>(args) : new LinkedHashMap<>();
        updated.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(arg, "arg"));
        return new Field(typeOf, list, required, steps, updated);
    }

    /**
     * Smallest equivalent field: empty steps and args become absent, each step and arg is compressed.
     */
    public Field compress() {
        List<Step> compressedSteps = null;
        if (steps != null && !steps.isEmpty()) {
            compressedSteps = new ArrayList<>(steps.size());
            for (Step step : steps) {
                compressedSteps.add(step.compress());
            }
        }
        Map<String, Arg> compressedArgs = null;
        if (args != null && !args.isEmpty()) {
            compressedArgs = new LinkedHashMap<>();
            for (Map.Entry<String, Arg> e : args.entrySet()) {
                compressedArgs.put(e.getKey(), e.getValue().compress());
            }
        }
        return new Field(typeOf, list, required, compressedSteps, compressedArgs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Field that = (Field) o;
        return list == that.list && required == that.required
                && Objects.equals(typeOf, that.typeOf)
                && Objects.equals(steps, that.steps)
                && Objects.equals(args, that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeOf, list, required, steps, args);
    }

    @Override
    public String toString() {
        return "Field{typeOf=" + typeOf + ", list=" + list + ", required=" + required
                + ", steps=" + steps + ", args=" + args + "}";
    }
}
