package io.github.eutro.wasmslice.core.passes.meta;

import io.github.eutro.wasmslice.core.analysis.AnalysisResult;
import io.github.eutro.wasmslice.core.analysis.IntraAnalysis;
import io.github.eutro.wasmslice.core.cfg.BasicBlock;
import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.Insn;
import io.github.eutro.wasmslice.core.ext.AnalysisExts;
import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.passes.InPlaceIRPass;
import io.github.eutro.wasmslice.core.state.InferenceConfig;
import io.github.eutro.wasmslice.core.state.StateInference;
import io.github.eutro.wasmslice.core.state.State;

/**
 * Runs {@link StateInference} to a fixpoint, and attaches {@link AnalysisExts#STATE_BEFORE} and
 * {@link AnalysisExts#STATE_AFTER} to every instruction and block, and {@link AnalysisExts#OUT_STATE}
 * to every block.
 */
public class AnnotateStates implements InPlaceIRPass<Cfg> {
    /**
     * An instance of this pass using {@link InferenceConfig#DEFAULT}.
     */
    public static final AnnotateStates INSTANCE = new AnnotateStates(InferenceConfig.DEFAULT);

    private final InferenceConfig config;

    public AnnotateStates(InferenceConfig config) {
        this.config = config;
    }

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        AnalysisResult<State> result = new IntraAnalysis<>(new StateInference(config)).analyze(cfg);
        for (BasicBlock block : cfg.blocks()) {
            block.attachExt(AnalysisExts.STATE_BEFORE, result.blockBefore(block.index));
            block.attachExt(AnalysisExts.STATE_AFTER, result.blockAfter(block.index));
            block.attachExt(AnalysisExts.OUT_STATE, result.blockOut(block.index));
            for (Insn insn : block.getInsns()) {
                insn.attachExt(AnalysisExts.STATE_BEFORE, result.before(insn.label));
                insn.attachExt(AnalysisExts.STATE_AFTER, result.after(insn.label));
            }
        }
        ms.statesChanged();
        ms.validate(MetadataState.STATES);
    }
}
