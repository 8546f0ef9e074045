package io.github.eutro.wasmslice.core.ext;

import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.ops.Op;
import io.github.eutro.wasmslice.core.ops.OpKey;

/**
 * A collection of {@link Ext}s describing the IR itself, rather than the result of an analysis.
 *
 * @see AnalysisExts
 */
public class CommonExts {
    /**
     * Attached to a {@link Cfg}. Has metadata about which analyses are valid for the graph.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to an {@link Op} or {@link OpKey}.
     * Whether the operation may only appear as the instruction of a control block.
     */
    public static final Ext<Boolean> IS_CONTROL = Ext.create(Boolean.class, "IS_CONTROL");
    /**
     * Attached to an {@link Op} or {@link OpKey}.
     * Whether the operation selects one of several outgoing edges, based on a popped operand.
     */
    public static final Ext<Boolean> IS_BRANCH = Ext.create(Boolean.class, "IS_BRANCH");
}
