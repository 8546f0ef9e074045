package io.github.eutro.wasmslice.core.analysis;

import io.github.eutro.wasmslice.core.cfg.Label;

import java.util.Collections;
import java.util.Map;

/**
 * The annotations computed by {@link IntraAnalysis}: states before and after every
 * instruction and every block, and the states leaving each block.
 *
 * @param <S> The type of states.
 */
public final class AnalysisResult<S> {
    private final Map<Label, S> insnBefore;
    private final Map<Label, S> insnAfter;
    private final Map<Integer, S> blockBefore;
    private final Map<Integer, S> blockAfter;
    private final Map<Integer, TransferResult<S>> blockOut;
    private final int visits;

    AnalysisResult(Map<Label, S> insnBefore,
                   Map<Label, S> insnAfter,
                   Map<Integer, S> blockBefore,
                   Map<Integer, S> blockAfter,
                   Map<Integer, TransferResult<S>> blockOut,
                   int visits) {
        this.insnBefore = Collections.unmodifiableMap(insnBefore);
        this.insnAfter = Collections.unmodifiableMap(insnAfter);
        this.blockBefore = Collections.unmodifiableMap(blockBefore);
        this.blockAfter = Collections.unmodifiableMap(blockAfter);
        this.blockOut = Collections.unmodifiableMap(blockOut);
        this.visits = visits;
    }

    public S before(Label label) {
        return get(insnBefore, label);
    }

    public S after(Label label) {
        return get(insnAfter, label);
    }

    public S blockBefore(int block) {
        return get(blockBefore, block);
    }

    public S blockAfter(int block) {
        return get(blockAfter, block);
    }

    public TransferResult<S> blockOut(int block) {
        return get(blockOut, block);
    }

    /**
     * Get how many block visits the driver needed to reach the fixpoint.
     *
     * @return The number of visits.
     */
    public int visits() {
        return visits;
    }

    private static <K, V> V get(Map<K, V> map, K key) {
        V v = map.get(key);
        if (v == null) throw new IllegalArgumentException("no annotation for " + key);
        return v;
    }
}
