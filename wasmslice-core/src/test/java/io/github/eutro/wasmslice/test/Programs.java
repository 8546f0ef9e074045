package io.github.eutro.wasmslice.test;

import io.github.eutro.wasmslice.core.cfg.Cfg;
import io.github.eutro.wasmslice.core.cfg.CfgBuilder;
import io.github.eutro.wasmslice.core.cfg.FuncType;
import io.github.eutro.wasmslice.core.cfg.ValType;
import io.github.eutro.wasmslice.core.ops.Op;
import io.github.eutro.wasmslice.core.ops.WasmOps;

import java.util.List;

public class Programs {
    static Op memSize() {
        return WasmOps.MEMORY_SIZE.create();
    }

    static Op add() {
        return WasmOps.binary("i32.add");
    }

    static Op drop() {
        return WasmOps.DROP.create();
    }

    /**
     * {@code 0: i32.const 1; 1: i32.const 2; 2: i32.add}
     */
    public static Cfg constAdd() {
        CfgBuilder cb = new CfgBuilder("constAdd", FuncType.of(ValType.I32));
        int b0 = cb.data(WasmOps.i32Const(1), WasmOps.i32Const(2), add());
        int b1 = cb.merge();
        cb.edge(b0, b1);
        return cb.build();
    }

    /**
     * Two independent additions of {@code memory.size}s, the first one dropped.
     */
    public static Cfg twoAdds() {
        CfgBuilder cb = new CfgBuilder("twoAdds", FuncType.of(ValType.I32));
        int b0 = cb.data(memSize(), memSize(), add(), drop(), memSize(), memSize(), add());
        int b1 = cb.merge();
        cb.edge(b0, b1);
        return cb.build();
    }

    /**
     * A {@code br_if} skipping a block, labels starting from 1.
     */
    public static Cfg brIf() {
        CfgBuilder cb = new CfgBuilder("brIf", FuncType.of());
        cb.nextLabel(1);
        int b0 = cb.data(memSize());
        int b1 = cb.control(WasmOps.BR_IF.create(0));
        int b2 = cb.data(memSize(), drop());
        int b3 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b3, true)
                .edge(b1, b2, false)
                .edge(b2, b3);
        return cb.build();
    }

    /**
     * An {@code if} choosing between two values, which are added to another value afterwards.
     */
    public static Cfg ifElse() {
        CfgBuilder cb = new CfgBuilder("ifElse", FuncType.of(ValType.I32));
        int b0 = cb.data(memSize());
        int b1 = cb.control(WasmOps.IF.create());
        int b2 = cb.data(memSize());
        int b3 = cb.data(memSize());
        int b4 = cb.merge();
        cb.nextLabel(5);
        int b5 = cb.data(memSize(), memSize(), add(), drop(), memSize(), add());
        int b6 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2, true)
                .edge(b1, b3, false)
                .edge(b2, b4)
                .edge(b3, b4)
                .edge(b4, b5)
                .edge(b5, b6);
        return cb.build();
    }

    /**
     * A loop incrementing a local until a {@code br_if} falls through, then returning the local.
     * <pre>
     * 0: i32.const 0; 1: local.set 0
     * loop:
     *   2: local.get 0; 3: i32.const 1; 4: i32.add; 5: local.tee 0
     *   6: br_if loop
     * 7: local.get 0
     * </pre>
     */
    public static Cfg counter() {
        CfgBuilder cb = new CfgBuilder("counter",
                new FuncType(List.of(), List.of(ValType.I32), List.of(), List.of(ValType.I32)));
        int b0 = cb.data(WasmOps.i32Const(0), WasmOps.LOCAL_SET.create(0));
        int b1 = cb.merge();
        int b2 = cb.data(WasmOps.LOCAL_GET.create(0), WasmOps.i32Const(1), add(), WasmOps.LOCAL_TEE.create(0));
        int b3 = cb.control(WasmOps.BR_IF.create(0));
        int b4 = cb.data(WasmOps.LOCAL_GET.create(0));
        int b5 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2)
                .edge(b2, b3)
                .edge(b3, b1, true)
                .edge(b3, b4, false)
                .edge(b4, b5)
                .loopHead(b1);
        return cb.build();
    }

    /**
     * A function whose body is a loop, so the entry block is the loop header.
     * <pre>
     * loop: 0: memory.size; 1: local.set 0; 2: local.get 0; 3: br_if 0
     * 4: local.get 0
     * </pre>
     */
    public static Cfg entryLoop() {
        CfgBuilder cb = new CfgBuilder("entryLoop",
                new FuncType(List.of(), List.of(ValType.I32), List.of(), List.of(ValType.I32)));
        int b0 = cb.merge();
        int b1 = cb.data(memSize(), WasmOps.LOCAL_SET.create(0), WasmOps.LOCAL_GET.create(0));
        int b2 = cb.control(WasmOps.BR_IF.create(0));
        int b3 = cb.data(WasmOps.LOCAL_GET.create(0));
        int b4 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2)
                .edge(b2, b0, true)
                .edge(b2, b3, false)
                .edge(b3, b4)
                .loopHead(b0);
        return cb.build();
    }

    /**
     * A loop header whose only back edge comes from code after a {@code br} out of the loop.
     * <pre>
     * 0: memory.size
     * loop: 1: br 1
     *   2: nop (never reached, branches back)
     * </pre>
     */
    public static Cfg deadBackEdge() {
        CfgBuilder cb = new CfgBuilder("deadBackEdge", FuncType.of(ValType.I32));
        int b0 = cb.data(memSize());
        int b1 = cb.merge();
        int b2 = cb.control(WasmOps.BR.create(1));
        int b3 = cb.data(WasmOps.NOP.create());
        int b4 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2)
                .edge(b2, b4)
                .edge(b3, b1)
                .loopHead(b1);
        return cb.build();
    }

    /**
     * A store to a constant address, then an unrelated value kept on the stack.
     * <pre>
     * 0: i32.const 100; 1: memory.size; 2: i32.store offset=4
     * 3: memory.size
     * </pre>
     */
    public static Cfg store() {
        CfgBuilder cb = new CfgBuilder("store", FuncType.of(ValType.I32));
        int b0 = cb.data(WasmOps.i32Const(100), memSize(), WasmOps.store(ValType.I32, 4), memSize());
        int b1 = cb.merge();
        cb.edge(b0, b1);
        return cb.build();
    }

    /**
     * A chain of three data blocks, the middle one having no net effect on the stack.
     */
    public static Cfg chain() {
        CfgBuilder cb = new CfgBuilder("chain", FuncType.of(ValType.I32));
        int b0 = cb.data(memSize());
        int b1 = cb.data(memSize(), drop());
        int b2 = cb.data(memSize());
        int b3 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2)
                .edge(b2, b3);
        return cb.build();
    }

    /**
     * A {@code call_indirect} through a table index, with one argument and one result.
     * <pre>
     * 0: global.get 0; 1: i32.const 0
     * 2: call_indirect (i32) -> i32
     * </pre>
     */
    public static Cfg callIndirect() {
        CfgBuilder cb = new CfgBuilder("callIndirect",
                new FuncType(List.of(), List.of(), List.of(ValType.I32), List.of(ValType.I32)));
        int b0 = cb.data(WasmOps.GLOBAL_GET.create(0), WasmOps.i32Const(0));
        int b1 = cb.control(WasmOps.callIndirect(0, 1, 1));
        int b2 = cb.merge();
        cb.edge(b0, b1)
                .edge(b1, b2);
        return cb.build();
    }
}
