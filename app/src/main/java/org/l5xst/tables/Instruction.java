package org.l5xst.tables;

import java.util.*;

import org.l5xst.ir.IR;

/**
 * Ladder instruction mnemonics the translator knows how to lower.
 */
public enum Instruction {
    XIC(Kind.CONTACT, 1),
    XIO(Kind.CONTACT, 1),
    AFI(Kind.CONTACT, 0),
    EQU(Kind.COMPARE, 2, IR.Op.EQ),
    NEQ(Kind.COMPARE, 2, IR.Op.NE),
    GRT(Kind.COMPARE, 2, IR.Op.GT),
    GEQ(Kind.COMPARE, 2, IR.Op.GE),
    LES(Kind.COMPARE, 2, IR.Op.LT),
    LEQ(Kind.COMPARE, 2, IR.Op.LE),
    LIM(Kind.COMPARE, 3),
    CMP(Kind.COMPARE, 1),
    ONS(Kind.EDGE, 1),
    OSR(Kind.EDGE, 2),
    OSF(Kind.EDGE, 2),
    RTRIG(Kind.EDGE, 1),
    FTRIG(Kind.EDGE, 1),
    OTE(Kind.COIL, 1),
    OTL(Kind.COIL, 1),
    OTU(Kind.COIL, 1),
    TON(Kind.TIMER, 3),
    TOF(Kind.TIMER, 3),
    RTO(Kind.TIMER, 3),
    TONR(Kind.TIMER, 2),
    CTU(Kind.COUNTER, 3),
    CTD(Kind.COUNTER, 3),
    CTUD(Kind.COUNTER, 4),
    RES(Kind.RESET, 1),
    MOV(Kind.MOVE, 2),
    COP(Kind.MOVE, 3),
    CLR(Kind.MOVE, 1),
    ADD(Kind.MATH, 3, IR.Op.ADD),
    SUB(Kind.MATH, 3, IR.Op.SUB),
    MUL(Kind.MATH, 3, IR.Op.MUL),
    DIV(Kind.MATH, 3, IR.Op.DIV),
    MOD(Kind.MATH, 3, IR.Op.MOD),
    SQR(Kind.MATH, 2),
    ABS(Kind.MATH, 2),
    NEG(Kind.MATH, 2),
    CPT(Kind.MATH, 2),
    BTD(Kind.CONVERT, 2, "BCD_TO_INT"),
    DTB(Kind.CONVERT, 2, "INT_TO_BCD"),
    FRD(Kind.CONVERT, 2, "REAL_TO_INT"),
    TOD(Kind.CONVERT, 2, "INT_TO_REAL"),
    MSG(Kind.MESSAGE, 1),
    JSR(Kind.SYSTEM, 1),
    GSV(Kind.SYSTEM, 4),
    SSV(Kind.SYSTEM, 4),
    NOP(Kind.SYSTEM, 0);

    public enum Kind {
        /** Tests a bit; continues the rung condition. */
        CONTACT,
        /** Compares values; continues the rung condition. */
        COMPARE,
        EDGE,
        COIL,
        TIMER,
        COUNTER,
        RESET,
        MOVE,
        MATH,
        /** {@code dest := <function>(source)}. */
        CONVERT,
        MESSAGE,
        SYSTEM
    }

    private final Kind kind;
    private final int operands;
    private final IR.Op op;
    private final String function;

    Instruction(Kind kind, int operands) {
        this(kind, operands, null, null);
    }

    Instruction(Kind kind, int operands, IR.Op op) {
        this(kind, operands, op, null);
    }

    Instruction(Kind kind, int operands, String function) {
        this(kind, operands, null, function);
    }

    Instruction(Kind kind, int operands, IR.Op op, String function) {
        this.kind = kind;
        this.operands = operands;
        this.op = op;
        this.function = function;
    }

    public Kind kind() {
        return kind;
    }

    /** Minimum number of operands in rung text. */
    public int operands() {
        return operands;
    }

    /** Operator for comparisons and two-operand math, empty otherwise. */
    public Optional<IR.Op> op() {
        return Optional.ofNullable(op);
    }

    /** Edge instructions that sit in the condition path and pass a pulse on instead of writing a bit. */
    public boolean inlineEdge() {
        return this == ONS || this == RTRIG || this == FTRIG;
    }

    /** Conversion function of a {@code CONVERT} instruction, empty otherwise. */
    public Optional<String> function() {
        return Optional.ofNullable(function);
    }

    public static Optional<Instruction> lookup(String mnemonic) {
        for (var ins : values()) {
            if (ins.name().equalsIgnoreCase(mnemonic)) {
                return Optional.of(ins);
            }
        }
        return Optional.empty();
    }
}
