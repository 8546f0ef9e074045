/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.wasmslice.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Cfg cfg = ...;
 * AnnotateStates.INSTANCE.run(cfg);
 *
 * Insn insn = cfg.instruction(Label.of(2));
 * State before = insn.getExtOrThrow(AnalysisExts.STATE_BEFORE);
 * State after = insn.getExtOrThrow(AnalysisExts.STATE_AFTER);
 * }</pre>
 * <p>
 * Analyses attach their results to the control-flow graph, its blocks and its
 * instructions, instead of passing ad-hoc {@link java.util.Map}s around.
 * Which results are currently valid for a graph is tracked by its
 * {@link io.github.eutro.wasmslice.core.ext.MetadataState}.
 * <p>
 * Specialised implementations of {@link io.github.eutro.wasmslice.core.ext.ExtContainer}
 * may implement fast-paths for certain {@link io.github.eutro.wasmslice.core.ext.Ext}s
 * by storing them directly in fields of the class.
 */
package io.github.eutro.wasmslice.core.ext;
