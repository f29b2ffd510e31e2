package com.pgm.xdsl.api;

import com.pgm.xdsl.model.GraphModel;

/**
 * Turns a parsed {@link GraphModel} into source text for some target.
 *
 * <p>
 * Implementations must be pure: the same model always yields byte-identical
 * text, and the model is never modified.
 */
@FunctionalInterface
public interface CodeGenerator {
    String generate(GraphModel model);
}
