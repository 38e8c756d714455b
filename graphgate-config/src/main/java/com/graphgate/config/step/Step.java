package com.graphgate.config.step;

/**
 * One stage of a field's resolution pipeline. The variant set is closed: an upstream HTTP call
 * ({@link HttpStep}), a literal value ({@link ConstantStep}) or an object reshape ({@link ObjPathStep}).
 * Steps only carry data; the blueprint runtime executes them.
 */
public sealed interface Step permits HttpStep, ConstantStep, ObjPathStep {

    /**
     * Smallest equivalent form of this step. Only {@link HttpStep} has anything to drop.
     */
    Step compress();
}
