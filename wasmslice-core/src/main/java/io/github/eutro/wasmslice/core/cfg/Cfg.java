package io.github.eutro.wasmslice.core.cfg;

import io.github.eutro.wasmslice.core.ext.CommonExts;
import io.github.eutro.wasmslice.core.ext.ExtHolder;
import io.github.eutro.wasmslice.core.ext.MetadataState;
import io.github.eutro.wasmslice.core.ops.WasmOps;

import java.util.*;

/**
 * The control-flow graph of a single function.
 * <p>
 * Blocks are keyed by index. Edges are kept twice: {@link #edges} maps a block to its
 * successors, {@link #backEdges} maps a block to its predecessors, each edge carrying the branch
 * outcome it is taken on. The graph structure is fixed once constructed; analyses attach
 * their results as exts, and slicing produces a new graph.
 */
public final class Cfg extends ExtHolder {
    /**
     * The name of the function, for debugging.
     */
    public final String name;
    /**
     * The signature of the function.
     */
    public final FuncType type;
    /**
     * The index of the entry block.
     */
    public final int entry;
    /**
     * The index of the exit block.
     */
    public final int exit;

    private final SortedMap<Integer, BasicBlock> blocks;
    private final EdgeMap edges;
    private final EdgeMap backEdges;
    private final Set<Integer> loopHeads;
    private final Map<Label, BasicBlock> labelIndex = new HashMap<>();

    public Cfg(String name,
               FuncType type,
               Collection<BasicBlock> blocks,
               EdgeMap edges,
               EdgeMap backEdges,
               int entry,
               int exit,
               Set<Integer> loopHeads) {
        this.name = name;
        this.type = type;
        SortedMap<Integer, BasicBlock> blockMap = new TreeMap<>();
        for (BasicBlock block : blocks) {
            if (blockMap.put(block.index, block) != null) {
                throw new IllegalArgumentException(String.format("duplicate block index %d in %s", block.index, name));
            }
            if (block.isMerge()) {
                labelIndex.put(block.mergeLabel(), block);
            }
            for (Insn insn : block.getInsns()) {
                if (labelIndex.put(insn.label, block) != null) {
                    throw new IllegalArgumentException(String.format("duplicate label %s in %s", insn.label, name));
                }
            }
        }
        this.blocks = Collections.unmodifiableSortedMap(blockMap);
        this.edges = edges.copy();
        this.backEdges = backEdges.copy();
        this.entry = entry;
        this.exit = exit;
        this.loopHeads = Collections.unmodifiableSet(new TreeSet<>(loopHeads));
        block(entry);
        block(exit);
        checkEdges(this.edges);
        checkEdges(this.backEdges);
        for (int idx : this.loopHeads) block(idx);
        attachExt(CommonExts.METADATA_STATE, new MetadataState());
    }

    private void checkEdges(EdgeMap edgeMap) {
        for (int src : edgeMap.sources()) {
            block(src);
            for (Edge edge : edgeMap.from(src)) {
                block(edge.target);
            }
        }
    }

    /**
     * Get the block with the given index.
     *
     * @param index The index.
     * @return The block.
     * @throws IllegalArgumentException If there is no such block.
     */
    public BasicBlock block(int index) {
        BasicBlock block = blocks.get(index);
        if (block == null) {
            throw new IllegalArgumentException(String.format("no block %d in %s", index, name));
        }
        return block;
    }

    /**
     * Get all the blocks of this graph, ordered by index.
     *
     * @return An unmodifiable view of the blocks.
     */
    public Collection<BasicBlock> blocks() {
        return blocks.values();
    }

    /**
     * Get the forward edges of this graph. Must not be modified.
     *
     * @return The edge map.
     */
    public EdgeMap edges() {
        return edges;
    }

    /**
     * Get the back edges of this graph, mapping each block to its predecessors. Must not be modified.
     *
     * @return The edge map.
     */
    public EdgeMap backEdges() {
        return backEdges;
    }

    public Set<Integer> loopHeads() {
        return loopHeads;
    }

    /**
     * Get the instruction with the given label.
     *
     * @param label The label.
     * @return The instruction.
     * @throws IllegalArgumentException If no instruction has that label.
     */
    public Insn instruction(Label label) {
        BasicBlock block = blockOf(label);
        for (Insn insn : block.getInsns()) {
            if (insn.label.equals(label)) return insn;
        }
        throw new IllegalArgumentException(String.format("label %s of %s is not an instruction", label, name));
    }

    /**
     * Get the block containing the instruction with the given label,
     * or the merge block with the given merge label.
     *
     * @param label The label.
     * @return The block.
     * @throws IllegalArgumentException If no instruction or merge block has that label.
     */
    public BasicBlock blockOf(Label label) {
        BasicBlock block = labelIndex.get(label);
        if (block == null) {
            throw new IllegalArgumentException(String.format("no label %s in %s", label, name));
        }
        return block;
    }

    /**
     * Get whether the label names an instruction or merge block of this graph.
     *
     * @param label The label.
     * @return Whether the label is known.
     */
    public boolean hasLabel(Label label) {
        return labelIndex.containsKey(label);
    }

    /**
     * Get every instruction of this graph, in block order.
     *
     * @return The instructions.
     */
    public List<Insn> allInstructions() {
        List<Insn> insns = new ArrayList<>();
        for (BasicBlock block : blocks.values()) {
            insns.addAll(block.getInsns());
        }
        return insns;
    }

    public List<BasicBlock> allMergeBlocks() {
        List<BasicBlock> merges = new ArrayList<>();
        for (BasicBlock block : blocks.values()) {
            if (block.isMerge()) merges.add(block);
        }
        return merges;
    }

    /**
     * Get the successors of a block, in edge order. A successor appears once per edge.
     *
     * @param index The block index.
     * @return The successor indices.
     */
    public List<Integer> successors(int index) {
        return targets(edges.from(index));
    }

    /**
     * Get the predecessors of a block, in edge order. A predecessor appears once per edge.
     *
     * @param index The block index.
     * @return The predecessor indices.
     */
    public List<Integer> predecessors(int index) {
        return targets(backEdges.from(index));
    }

    private static List<Integer> targets(List<Edge> es) {
        List<Integer> targets = new ArrayList<>(es.size());
        for (Edge e : es) {
            targets.add(e.target);
        }
        return targets;
    }

    /**
     * Get the indices of the functions this function calls directly.
     *
     * @return The callees.
     */
    public Set<Integer> callees() {
        Set<Integer> callees = new TreeSet<>();
        for (Insn insn : allInstructions()) {
            WasmOps.CallType callType = WasmOps.CALL.argNullable(insn.op);
            if (callType != null) callees.add(callType.index);
        }
        return callees;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("cfg ").append(name).append(" : ").append(type)
                .append(" entry=").append(entry)
                .append(" exit=").append(exit);
        for (BasicBlock block : blocks.values()) {
            sb.append('\n').append(block).append("\n -> ").append(edges.from(block.index));
        }
        return sb.toString();
    }
}
