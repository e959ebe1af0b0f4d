package org.l5xst.st;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import org.l5xst.ConversionConfig;
import org.l5xst.Diagnostic;
import org.l5xst.ErrorKind;
import org.l5xst.ir.IR;

class StEmitterTest {
    private static final ConversionConfig config = ConversionConfig.defaults();

    private static final IR.Ref A = IR.Ref.to("A");
    private static final IR.Ref B = IR.Ref.to("B");
    private static final IR.Ref C = IR.Ref.to("C");

    private static IR.Program program(List<IR.Stmt> body) {
        var valve = new IR.Function("Valve", List.of(
            new IR.Param("Open", "BOOL", IR.PARAM_DIR.INPUT),
            new IR.Param("Opened", "BOOL", IR.PARAM_DIR.OUTPUT),
            new IR.Param("Delay", "TON", IR.PARAM_DIR.LOCAL)
        ), List.of(
            new IR.FbCall("Delay", "TON", List.of(new IR.Arg("IN", IR.Ref.to("Open")), new IR.Arg("PT", new IR.Literal(IR.LIT.TIME, "T#2s")))),
            new IR.Assign(IR.Ref.to("Opened"), IR.Ref.parse("Delay.Q"))
        ));
        var pump = new IR.Struct("Pump", List.of(
            new IR.Member("Speed", "REAL", List.of()),
            new IR.Member("History", "DINT", List.of(4))
        ));
        var vars = List.of(
            IR.Var.of("A", "BOOL"), IR.Var.of("B", "BOOL"), IR.Var.of("C", "BOOL"), IR.Var.of("Y", "BOOL"),
            IR.Var.of("Count", "DINT"), IR.Var.of("V1", "Valve"), IR.Var.of("P1", "Pump"),
            IR.Var.of("T1", "TON"), IR.Var.of("Latch", "DOMINANT_SET"),
            new IR.Var("Table", "REAL", List.of(8), IR.SCOPE.CONTROLLER, IR.TAG_KIND.BASE,
                Optional.empty(), Optional.empty(), Optional.empty())
        );
        return new IR.Program("prog0", vars, List.of(pump), List.of(valve),
            List.of(new IR.Routine("PlantA/MainRoutine", IR.ROUTINE_KIND.LADDER, body)));
    }

    private static List<IR.Stmt> roundTrip(IR.Program program) {
        var text = StPrinter.print(new StEmitter(config).fromIR(program, List.of()));
        var back = new StToIr().toIR(new StParser().parse(text, "round-trip"), "round-trip");
        return back.routines().get(0).body();
    }

    @Test
    void statementsSurviveTheTextForm() {
        var body = List.<IR.Stmt>of(
            new IR.Assign(IR.Ref.to("Y"), IR.or(IR.and(A, B), IR.not(C))),
            new IR.Assign(IR.Ref.to("Count"), new IR.Binary(IR.Op.MUL,
                new IR.Binary(IR.Op.ADD, IR.Ref.to("Count"), IR.Literal.integer(1)), IR.Literal.integer(-2))),
            new IR.Assign(IR.Ref.to("Count"), new IR.Unary(IR.Op.NEG, IR.Literal.integer(-3))),
            new IR.If(A, List.of(new IR.Assign(IR.Ref.to("Y"), IR.Literal.TRUE)), List.of(
                new IR.If(B, List.of(new IR.Assign(IR.Ref.to("Y"), IR.Literal.FALSE)),
                    List.of(new IR.Assign(IR.Ref.parse("P1.Speed"), new IR.Literal(IR.LIT.REAL, "0.5")))))),
            new IR.FbCall("T1", "TON", List.of(new IR.Arg("IN", A), new IR.Arg("PT", new IR.Literal(IR.LIT.TIME, "T#1500ms")))),
            new IR.FbCall("V1", "Valve", List.of(new IR.Arg("Open", B))),
            new IR.Assign(IR.Ref.to("Latch"), new IR.Call("SETD", List.of(IR.Ref.to("Latch")))),
            new IR.Assign(IR.Ref.parse("Table[Count]"), new IR.Call("DINT_TO_REAL", List.of(IR.Ref.to("Count")))),
            new IR.Disabled("PID(Loop,1,2);", "unsupported instruction PID"),
            new IR.ForLoop(IR.Ref.to("Count"), IR.Literal.integer(0), IR.Literal.integer(7), Optional.empty(),
                List.of(new IR.Assign(IR.Ref.parse("Table[Count]"), new IR.Literal(IR.LIT.REAL, "0.0")))),
            new IR.WhileLoop(new IR.Binary(IR.Op.LT, IR.Ref.to("Count"), IR.Literal.integer(3)),
                List.of(new IR.Assign(IR.Ref.to("Count"), new IR.Binary(IR.Op.ADD, IR.Ref.to("Count"), IR.Literal.integer(1)))))
        );
        assertEquals(body, roundTrip(program(body)));
    }

    @Test
    void declarationsSurviveTheTextForm() {
        var program = program(List.of());
        var text = StPrinter.print(new StEmitter(config).fromIR(program, List.of()));
        var back = new StToIr().toIR(new StParser().parse(text, "decls"), "decls");

        assertEquals(program.types(), back.types());
        assertEquals(program.vars().stream().map(IR.Var::name).toList(), back.vars().stream().map(IR.Var::name).toList());
        assertEquals(List.of(8), back.lookupVar("Table").orElseThrow().dims());
        assertEquals(program.functions(), back.functions());
    }

    @Test
    void sectionsAppearInOrder() {
        var diagnostics = List.of(Diagnostic.of(ErrorKind.UNSUPPORTED_INSTRUCTION, "PlantA/MainRoutine/rung 3", "unsupported instruction PID"));
        var text = StPrinter.print(new StEmitter(config).fromIR(program(List.of()), diagnostics));

        int comment = text.indexOf("(* Conversion diagnostics:");
        int templateType = text.indexOf("DOMINANT_SET :");
        int userType = text.indexOf("Pump :");
        int templateFunction = text.indexOf("FUNCTION SETD");
        int block = text.indexOf("FUNCTION_BLOCK Valve");
        int program = text.indexOf("PROGRAM prog0");
        int configuration = text.indexOf("CONFIGURATION Config0");
        assertEquals(0, comment);
        assertTrue(comment < templateType);
        assertTrue(templateType < userType);
        assertTrue(userType < templateFunction);
        assertTrue(templateFunction < block);
        assertTrue(block < program);
        assertTrue(program < configuration);
        assertTrue(text.contains("E101"));
        assertTrue(text.contains("TASK Task1(INTERVAL := T#1s, PRIORITY := 0);"));
        assertTrue(text.contains("PROGRAM Inst0 WITH Task1 : prog0;"));
        assertTrue(text.contains("(* Routine: PlantA/MainRoutine *)"));
    }

    @Test
    void unusedTemplatesAreLeftOut() {
        var bare = new IR.Program("prog0", List.of(IR.Var.of("A", "BOOL")), List.of(), List.of(), List.of());
        var text = StPrinter.print(new StEmitter(config).fromIR(bare, List.of()));
        assertFalse(text.contains("FUNCTION "));
        assertFalse(text.contains("Conversion diagnostics"));
    }

    @Test
    void nestedOperatorsAreParenthesised() {
        var expr = StEmitter.expr(IR.or(IR.and(A, B), IR.not(C)));
        assertEquals("(A AND B) OR (NOT C)", StPrinter.expr(expr));
        assertEquals("-(-3)", StPrinter.expr(StEmitter.expr(new IR.Unary(IR.Op.NEG, IR.Literal.integer(-3)))));
    }
}
