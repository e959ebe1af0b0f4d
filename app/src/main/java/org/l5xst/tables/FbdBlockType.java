package org.l5xst.tables;

import java.util.*;

import org.l5xst.ir.IR;

/**
 * Function block diagram block types and how each one lowers.
 */
public enum FbdBlockType {
    ADD(Kind.EXPRESSION, IR.Op.ADD, "REAL", pins("REAL", "SourceA", "SourceB"), pins("REAL", "Dest")),
    SUB(Kind.EXPRESSION, IR.Op.SUB, "REAL", pins("REAL", "SourceA", "SourceB"), pins("REAL", "Dest")),
    MUL(Kind.EXPRESSION, IR.Op.MUL, "REAL", pins("REAL", "SourceA", "SourceB"), pins("REAL", "Dest")),
    DIV(Kind.EXPRESSION, IR.Op.DIV, "REAL", pins("REAL", "SourceA", "SourceB"), pins("REAL", "Dest")),
    MOD(Kind.EXPRESSION, IR.Op.MOD, "REAL", pins("REAL", "SourceA", "SourceB"), pins("REAL", "Dest")),
    BAND(Kind.EXPRESSION, IR.Op.AND, "BOOL", pins("BOOL", "In1", "In2"), pins("BOOL", "Out")),
    BOR(Kind.EXPRESSION, IR.Op.OR, "BOOL", pins("BOOL", "In1", "In2"), pins("BOOL", "Out")),
    BXOR(Kind.EXPRESSION, IR.Op.XOR, "BOOL", pins("BOOL", "In1", "In2"), pins("BOOL", "Out")),
    BNOT(Kind.EXPRESSION, IR.Op.NOT, "BOOL", pins("BOOL", "In"), pins("BOOL", "Out")),
    EQU(Kind.EXPRESSION, IR.Op.EQ, "BOOL", pins("REAL", "SourceA", "SourceB"), pins("BOOL", "Out")),
    NEQ(Kind.EXPRESSION, IR.Op.NE, "BOOL", pins("REAL", "SourceA", "SourceB"), pins("BOOL", "Out")),
    GRT(Kind.EXPRESSION, IR.Op.GT, "BOOL", pins("REAL", "SourceA", "SourceB"), pins("BOOL", "Out")),
    GEQ(Kind.EXPRESSION, IR.Op.GE, "BOOL", pins("REAL", "SourceA", "SourceB"), pins("BOOL", "Out")),
    LES(Kind.EXPRESSION, IR.Op.LT, "BOOL", pins("REAL", "SourceA", "SourceB"), pins("BOOL", "Out")),
    LEQ(Kind.EXPRESSION, IR.Op.LE, "BOOL", pins("REAL", "SourceA", "SourceB"), pins("BOOL", "Out")),
    SEL(Kind.SELECT, null, "REAL",
        List.of(pin("SelectorIn", "G", "BOOL"), pin("In1", "IN0", "REAL"), pin("In2", "IN1", "REAL")),
        pins("REAL", "Out")),
    TONR(Kind.FUNCTION_BLOCK, "TON", true,
        List.of(pin("TimerEnable", "IN", "BOOL"), pin("PRE", "PT", "TIME")),
        List.of(pin("DN", "Q", "BOOL"), pin("ACC", "ET", "TIME"))),
    TOFR(Kind.FUNCTION_BLOCK, "TOF", true,
        List.of(pin("TimerEnable", "IN", "BOOL"), pin("PRE", "PT", "TIME")),
        List.of(pin("DN", "Q", "BOOL"), pin("ACC", "ET", "TIME"))),
    CTUD(Kind.FUNCTION_BLOCK, "CTUD", true,
        List.of(pin("CUEnable", "CU", "BOOL"), pin("CDEnable", "CD", "BOOL"),
            pin("Reset", "R", "BOOL"), pin("PRE", "PV", "INT")),
        List.of(pin("DN", "QU", "BOOL"), pin("ACC", "CV", "INT"))),
    SCL(Kind.TEMPLATE, "SCL", false,
        pins("REAL", "In", "InRawMax", "InRawMin", "InEUMax", "InEUMin"),
        pins("REAL", "Out")),
    ALM(Kind.TEMPLATE, "ALM", true,
        pins("REAL", "In", "HHLimit", "HLimit", "LLimit", "LLLimit", "Deadband"),
        pins("BOOL", "HHAlarm", "HAlarm", "LAlarm", "LLAlarm")),
    SETD(Kind.TEMPLATE, "SETD", true,
        pins("BOOL", "Set", "Reset"),
        pins("BOOL", "Out", "OutNot")),
    OSRI(Kind.TEMPLATE, "OSRI", true,
        pins("BOOL", "InputBit"),
        pins("BOOL", "OutputBit"));

    public enum Kind {
        /** Operator over the inputs, result kept in a synthesized variable. */
        EXPRESSION,
        SELECT,
        /** Standard ST function block called on the block's operand. */
        FUNCTION_BLOCK,
        /** Auxiliary template called on the block's operand. */
        TEMPLATE
    }

    /**
     * A block pin: {@code name} as it appears in the sheet, {@code target} as it is called in ST.
     */
    public record Pin(String name, String target, String type) {
        public String fallback() {
            return TypeTable.defaultValue(type);
        }
    }

    private final Kind kind;
    private final IR.Op op;
    private final String target;
    private final String resultType;
    private final boolean stateful;
    private final List<Pin> inputs;
    private final List<Pin> outputs;

    FbdBlockType(Kind kind, IR.Op op, String resultType, List<Pin> inputs, List<Pin> outputs) {
        this.kind = kind;
        this.op = op;
        this.target = null;
        this.resultType = resultType;
        this.stateful = false;
        this.inputs = inputs;
        this.outputs = outputs;
    }

    FbdBlockType(Kind kind, String target, boolean stateful, List<Pin> inputs, List<Pin> outputs) {
        this.kind = kind;
        this.op = null;
        this.target = target;
        this.resultType = null;
        this.stateful = stateful;
        this.inputs = inputs;
        this.outputs = outputs;
    }

    public Kind kind() {
        return kind;
    }

    public IR.Op op() {
        return op;
    }

    /** ST function block type or template function name. */
    public String target() {
        return target;
    }

    public String resultType() {
        return resultType;
    }

    /** Holds state between scans, so it may close a feedback loop. */
    public boolean stateful() {
        return stateful;
    }

    public List<Pin> inputs() {
        return inputs;
    }

    public List<Pin> outputs() {
        return outputs;
    }

    public Optional<AuxTemplate> template() {
        return kind == Kind.TEMPLATE ? AuxTemplate.forFunction(target) : Optional.empty();
    }

    public Optional<Pin> input(String name) {
        return inputs.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<Pin> output(String name) {
        return outputs.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
    }

    public static Optional<FbdBlockType> lookup(String type) {
        for (var t : values()) {
            if (t.name().equalsIgnoreCase(type)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    private static List<Pin> pins(String type, String... names) {
        var list = new ArrayList<Pin>();
        for (var name : names) {
            list.add(new Pin(name, name, type));
        }
        return List.copyOf(list);
    }

    private static Pin pin(String name, String target, String type) {
        return new Pin(name, target, type);
    }
}
