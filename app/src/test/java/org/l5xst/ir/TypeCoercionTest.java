package org.l5xst.ir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import org.l5xst.ErrorKind;

class TypeCoercionTest {
    private static IR.Program program(List<IR.Stmt> body) {
        return new IR.Program("prog0",
            List.of(IR.Var.of("Speed", "REAL"), IR.Var.of("Count", "DINT"), IR.Var.of("Tank", "Tank_t"),
                IR.Var.of("Flag", "BOOL")),
            List.of(new IR.Struct("Tank_t", List.of(new IR.Member("Level", "LREAL", List.of())))),
            List.of(),
            List.of(new IR.Routine("MainRoutine", IR.ROUTINE_KIND.LADDER, body)));
    }

    @Test
    void integerLiteralGainsFraction() {
        var result = new TypeCoercion().apply(program(List.of(
            new IR.Assign(IR.Ref.to("Speed"), IR.Literal.integer(5))
        )));
        assertEquals(List.of(new IR.Assign(IR.Ref.to("Speed"), new IR.Literal(IR.LIT.REAL, "5.0"))),
            result.program().statements());
        assertEquals(1, result.diagnostics().size());
        assertEquals(ErrorKind.TYPE_MISMATCH, result.diagnostics().get(0).kind());
    }

    @Test
    void integerTagIsConverted() {
        var result = new TypeCoercion().apply(program(List.of(
            new IR.Assign(IR.Ref.parse("Tank.Level"), IR.Ref.to("Count"))
        )));
        var assign = (IR.Assign) result.program().statements().get(0);
        assertEquals(new IR.Call("DINT_TO_LREAL", List.of(IR.Ref.to("Count"))), assign.value());
    }

    @Test
    void nestedAssignmentsAreVisited() {
        var result = new TypeCoercion().apply(program(List.of(
            IR.If.when(IR.Ref.to("Flag"), new IR.Assign(IR.Ref.to("Speed"), IR.Ref.to("Count")))
        )));
        var branch = (IR.If) result.program().statements().get(0);
        assertEquals(new IR.Assign(IR.Ref.to("Speed"), new IR.Call("DINT_TO_REAL", List.of(IR.Ref.to("Count")))),
            branch.then().get(0));
    }

    @Test
    void otherAssignmentsAreUntouched() {
        var body = List.<IR.Stmt>of(
            new IR.Assign(IR.Ref.to("Count"), IR.Literal.integer(5)),
            new IR.Assign(IR.Ref.to("Speed"), new IR.Literal(IR.LIT.REAL, "2.5")),
            new IR.Assign(IR.Ref.to("Undeclared"), IR.Literal.integer(1))
        );
        var result = new TypeCoercion().apply(program(body));
        assertEquals(body, result.program().statements());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void functionParamsAreConsidered() {
        var fn = new IR.Function("Scaler",
            List.of(new IR.Param("Raw", "INT", IR.PARAM_DIR.INPUT), new IR.Param("Out", "REAL", IR.PARAM_DIR.OUTPUT)),
            List.of(new IR.Assign(IR.Ref.to("Out"), IR.Ref.to("Raw"))));
        var input = new IR.Program("prog0", List.of(), List.of(), List.of(fn), List.of());
        var result = new TypeCoercion().apply(input);
        assertEquals(new IR.Assign(IR.Ref.to("Out"), new IR.Call("INT_TO_REAL", List.of(IR.Ref.to("Raw")))),
            result.program().functions().get(0).body().get(0));
    }

    private static IR.Expr coerced(IR.Expr value) {
        var result = new TypeCoercion().apply(program(List.of(new IR.Assign(IR.Ref.to("Speed"), value))));
        assertEquals(1, result.diagnostics().size());
        assertEquals(ErrorKind.TYPE_MISMATCH, result.diagnostics().get(0).kind());
        return ((IR.Assign) result.program().statements().get(0)).value();
    }

    private static IR.Expr countToReal() {
        return new IR.Call("DINT_TO_REAL", List.of(IR.Ref.to("Count")));
    }

    @Test
    void arithmeticOperandsAreConverted() {
        assertEquals(new IR.Binary(IR.Op.ADD, countToReal(), new IR.Literal(IR.LIT.REAL, "1.0")),
            coerced(new IR.Binary(IR.Op.ADD, IR.Ref.to("Count"), IR.Literal.integer(1))));

        var nested = new IR.Binary(IR.Op.SUB,
            new IR.Binary(IR.Op.MUL, IR.Ref.to("Count"), IR.Literal.integer(2)),
            new IR.Unary(IR.Op.NEG, IR.Ref.to("Speed")));
        assertEquals(new IR.Binary(IR.Op.SUB,
                new IR.Binary(IR.Op.MUL, countToReal(), new IR.Literal(IR.LIT.REAL, "2.0")),
                new IR.Unary(IR.Op.NEG, IR.Ref.to("Speed"))),
            coerced(nested));
    }

    @Test
    void integerRemainderIsConvertedWhole() {
        var remainder = new IR.Binary(IR.Op.MOD, IR.Ref.to("Count"), IR.Literal.integer(4));
        assertEquals(new IR.Call("DINT_TO_REAL", List.of(remainder)), coerced(remainder));
    }

    @Test
    void realBuiltinArgumentsAreConverted() {
        assertEquals(new IR.Call("SQRT", List.of(countToReal())),
            coerced(new IR.Call("SQRT", List.of(IR.Ref.to("Count")))));
    }

    @Test
    void realExpressionsAndConversionsAreLeftAlone() {
        var body = List.<IR.Stmt>of(
            new IR.Assign(IR.Ref.to("Speed"), new IR.Binary(IR.Op.ADD, IR.Ref.to("Speed"), new IR.Literal(IR.LIT.REAL, "0.5"))),
            new IR.Assign(IR.Ref.to("Speed"), countToReal()),
            new IR.Assign(IR.Ref.to("Count"), new IR.Binary(IR.Op.ADD, IR.Ref.to("Count"), IR.Literal.integer(1)))
        );
        var result = new TypeCoercion().apply(program(body));
        assertEquals(body, result.program().statements());
        assertTrue(result.diagnostics().isEmpty());
    }
}
