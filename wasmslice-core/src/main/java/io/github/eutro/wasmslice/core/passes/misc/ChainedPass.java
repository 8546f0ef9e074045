package io.github.eutro.wasmslice.core.passes.misc;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.wasmslice.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pipeline of passes, each given the result of the one before.
 * <p>
 * Chaining a chained pass splices its passes in, so a pipeline built with repeated
 * {@link IRPass#then(IRPass)} calls is a flat list.
 *
 * @param <A> The input type.
 * @param <C> The output type.
 */
public class ChainedPass<A, C> implements IRPass<A, C> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final List<IRPass<Object, Object>> passes;
    private final boolean isInPlace;

    /**
     * Chain two passes.
     *
     * @param first The pass to run first.
     * @param next  The pass to run on its result.
     * @param <B>   The intermediate type.
     */
    public <B> ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        List<IRPass<Object, Object>> passes = new ArrayList<>();
        addFlattened(passes, first);
        addFlattened(passes, next);
        this.passes = Collections.unmodifiableList(passes);
        this.isInPlace = first.isInPlace() && next.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private static void addFlattened(List<IRPass<Object, Object>> passes, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?>) pass).passes);
        } else {
            passes.add((IRPass<Object, Object>) pass);
        }
    }

    /**
     * Get the passes of this pipeline, in order.
     *
     * @return The passes.
     */
    public List<IRPass<Object, Object>> getPasses() {
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            logger.atFinest().log("running pass %d of %d: %s", i + 1, passes.size(), pass);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " (" + pass + ") in chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}
