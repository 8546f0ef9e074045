package io.github.eutro.wasmslice.core.slice;

import io.github.eutro.wasmslice.core.cfg.Label;
import io.github.eutro.wasmslice.core.usedef.Use;

import java.util.Set;

/**
 * Tells which branch instructions decide whether a use happens.
 */
@FunctionalInterface
public interface ControlDependenceOracle {
    /**
     * Get the branches a use is control dependent on.
     *
     * @param use The use, at an instruction or a merge block.
     * @return The labels of the branch instructions.
     */
    Set<Label> branchesFor(Use use);
}
