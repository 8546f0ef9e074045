package io.github.eutro.wasmslice.core.cfg;

import io.github.eutro.wasmslice.core.ops.Op;

import java.util.*;

/**
 * Builds a {@link Cfg} block by block.
 * <p>
 * Blocks get consecutive indices from 0, instructions get consecutive {@link Label.Section#FUNCTION function}
 * labels from 0 (or from wherever {@link #nextLabel(int)} moved the counter).
 * The entry defaults to the first block, the exit to the last one.
 *
 * <pre>{@code
 * CfgBuilder cb = new CfgBuilder("f", FuncType.of(ValType.I32));
 * int b0 = cb.data(WasmOps.MEMORY_SIZE.create(), WasmOps.MEMORY_SIZE.create(), WasmOps.binary("i32.add"));
 * int b1 = cb.merge();
 * cb.edge(b0, b1);
 * Cfg cfg = cb.build();
 * }</pre>
 */
public class CfgBuilder {
    private final String name;
    private final FuncType type;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final EdgeMap edges = new EdgeMap();
    private final EdgeMap backEdges = new EdgeMap();
    private final Set<Integer> loopHeads = new TreeSet<>();
    private int nextLabel = 0;
    private Integer entry;
    private Integer exit;

    public CfgBuilder(String name, FuncType type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Set the id of the label the next instruction gets.
     *
     * @param id The label id.
     * @return This builder.
     */
    public CfgBuilder nextLabel(int id) {
        nextLabel = id;
        return this;
    }

    private Insn insn(Op op) {
        return op.insn(Label.of(nextLabel++));
    }

    /**
     * Add a data block.
     *
     * @param ops The operations of the instructions, in order.
     * @return The index of the block.
     */
    public int data(Op... ops) {
        List<Insn> insns = new ArrayList<>(ops.length);
        for (Op op : ops) {
            insns.add(insn(op));
        }
        return add(BasicBlock.data(blocks.size(), insns));
    }

    public int control(Op op) {
        return add(BasicBlock.control(blocks.size(), insn(op)));
    }

    public int merge() {
        return add(BasicBlock.merge(blocks.size()));
    }

    private int add(BasicBlock block) {
        blocks.add(block);
        return block.index;
    }

    /**
     * Add an unconditional edge.
     *
     * @param src The source block.
     * @param dst The target block.
     * @return This builder.
     */
    public CfgBuilder edge(int src, int dst) {
        return edge(src, dst, null);
    }

    /**
     * Add an edge taken when the branch of {@code src} has the given outcome.
     *
     * @param src       The source block.
     * @param dst       The target block.
     * @param condition The branch outcome, or null if unconditional.
     * @return This builder.
     */
    public CfgBuilder edge(int src, int dst, Boolean condition) {
        edges.add(src, new Edge(dst, condition));
        backEdges.add(dst, new Edge(src, condition));
        return this;
    }

    public CfgBuilder entry(int index) {
        entry = index;
        return this;
    }

    public CfgBuilder exit(int index) {
        exit = index;
        return this;
    }

    public CfgBuilder loopHead(int index) {
        loopHeads.add(index);
        return this;
    }

    public Cfg build() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("no blocks in " + name);
        }
        return new Cfg(name,
                type,
                blocks,
                edges,
                backEdges,
                entry == null ? 0 : entry,
                exit == null ? blocks.size() - 1 : exit,
                loopHeads);
    }
}
