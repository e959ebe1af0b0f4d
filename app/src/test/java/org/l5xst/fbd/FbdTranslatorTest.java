package org.l5xst.fbd;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.Test;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.StructuralCycleException;
import org.l5xst.ir.IR;
import org.l5xst.ir.IrEval;
import org.l5xst.ir.TagScope;
import org.l5xst.model.Controller;

class FbdTranslatorTest {
    private static final TagScope scope = new TagScope(List.of(
        IR.Var.of("A", "BOOL"), IR.Var.of("B", "BOOL"), IR.Var.of("Y", "BOOL"), IR.Var.of("T1", "TON")
    ), List.of());

    private static final FbdTranslator translator = new FbdTranslator(scope);

    private static Controller.InputRef in(String id, String operand) {
        return new Controller.InputRef(id, operand);
    }

    private static Controller.OutputRef out(String id, String operand) {
        return new Controller.OutputRef(id, operand);
    }

    private static Controller.Block block(String id, String type, String operand) {
        return new Controller.Block(id, type, operand, false, Map.of());
    }

    private static Controller.Wire wire(String from, String to, String toParam) {
        return new Controller.Wire(from, Optional.empty(), to, Optional.ofNullable(toParam));
    }

    private static Controller.Wire wire(String from, String fromParam, String to, String toParam) {
        return new Controller.Wire(from, Optional.of(fromParam), to, Optional.ofNullable(toParam));
    }

    private static Controller.Sheet sheet(List<Controller.SheetElement> elements, List<Controller.Wire> wires) {
        return new Controller.Sheet(1, elements, wires);
    }

    /** Index of the first statement assigning {@code path}. */
    private static int writeOf(List<IR.Stmt> stmts, String path) {
        for (int i = 0; i < stmts.size(); i++) {
            if (stmts.get(i) instanceof IR.Assign a && a.target().path().equalsIgnoreCase(path)) {
                return i;
            }
        }
        return -1;
    }

    @Test
    void producersRunBeforeConsumersRegardlessOfDeclarationOrder() {
        var fragment = translator.translate("Flow", sheet(
            List.of(out("1", "Y"), block("2", "BAND", "And1"), in("3", "A"), in("4", "B")),
            List.of(wire("3", "2", "In1"), wire("4", "2", "In2"), wire("2", "1", null))
        ));

        int computed = writeOf(fragment.stmts(), "And1_Out");
        int written = writeOf(fragment.stmts(), "Y");
        assertTrue(computed >= 0 && computed < written);
        assertEquals(List.of(IR.Var.of("And1_Out", "BOOL")), fragment.synthesized());

        var eval = new IrEval().set("A", true).set("B", true);
        eval.run(fragment.stmts());
        assertTrue(eval.bool("Y"));
        eval.set("B", false);
        eval.run(fragment.stmts());
        assertFalse(eval.bool("Y"));
    }

    @Test
    void chainOfOperatorsIsOrdered() {
        var fragment = translator.translate("Flow", sheet(
            List.of(out("9", "Y"), block("5", "BNOT", "Inv"), block("6", "BOR", "Or1"), in("1", "A"), in("2", "B")),
            List.of(wire("6", "5", "In"), wire("1", "6", "In1"), wire("2", "6", "In2"), wire("5", "9", null))
        ));
        var stmts = fragment.stmts();
        assertTrue(writeOf(stmts, "Or1_Out") < writeOf(stmts, "Inv_Out"));
        assertTrue(writeOf(stmts, "Inv_Out") < writeOf(stmts, "Y"));

        var eval = new IrEval().set("A", false).set("B", false);
        eval.run(stmts);
        assertTrue(eval.bool("Y"));
    }

    @Test
    void statefulBlockOpensFeedbackLoop() {
        var fragment = translator.translate("Flow", sheet(
            List.of(in("a", "A"), block("s", "SETD", "Latch1"), block("n", "BNOT", "Inv"), out("y", "Y")),
            List.of(
                wire("a", "s", "Set"),
                wire("n", "s", "Reset"),
                wire("s", "Out", "n", "In"),
                wire("s", "Out", "y", null))
        ));
        var stmts = fragment.stmts();
        assertTrue(fragment.diagnostics().isEmpty());

        // the inverter reads the latch state of the previous scan
        assertEquals(new IR.Assign(IR.Ref.to("Inv_Out"), new IR.Unary(IR.Op.NOT, IR.Ref.parse("Latch1.Out"))),
            stmts.get(0));
        int call = -1;
        for (int i = 0; i < stmts.size(); i++) {
            if (stmts.get(i) instanceof IR.Assign a && a.value() instanceof IR.Call c && c.function().equals("SETD")) {
                call = i;
            }
        }
        assertTrue(call > 0);
        assertEquals(new IR.Assign(IR.Ref.to("Y"), IR.Ref.parse("Latch1.Out")), stmts.get(stmts.size() - 1));
        assertTrue(fragment.synthesized().contains(IR.Var.of("Latch1", "DOMINANT_SET")));
    }

    @Test
    void combinationalLoopNamesEveryMember() {
        var loop = sheet(
            List.of(in("a", "A"), block("b1", "BAND", "And1"), block("b2", "BAND", "And2"), out("y", "Y")),
            List.of(
                wire("a", "b1", "In1"),
                wire("b2", "b1", "In2"),
                wire("b1", "b2", "In1"),
                wire("a", "b2", "In2"),
                wire("b2", "y", null))
        );
        var e = assertThrows(StructuralCycleException.class, () -> translator.translate("Flow", loop));
        assertEquals(ErrorKind.STRUCTURAL_CYCLE, e.kind());
        assertEquals(List.of("b1 (And1)", "b2 (And2)"), e.members());

        var fragment = translator.translate("Flow", List.of(loop));
        assertEquals(1, fragment.stmts().size());
        assertInstanceOf(IR.Disabled.class, fragment.stmts().get(0));
        assertEquals(ErrorKind.STRUCTURAL_CYCLE, fragment.diagnostics().get(0).kind());
    }

    @Test
    void selfLoopOnOperatorIsACycle() {
        var loop = sheet(
            List.of(block("b", "BOR", "Or1"), in("a", "A")),
            List.of(wire("a", "b", "In1"), wire("b", "b", "In2"))
        );
        var e = assertThrows(StructuralCycleException.class, () -> translator.translate("Flow", loop));
        assertEquals(List.of("b (Or1)"), e.members());
    }

    @Test
    void twoWiresIntoOnePinAreRejected() {
        var bad = sheet(
            List.of(in("a", "A"), in("b", "B"), out("y", "Y")),
            List.of(wire("a", "y", null), wire("b", "y", null))
        );
        var e = assertThrows(ConversionException.class, () -> translator.translate("Flow", bad));
        assertEquals(ErrorKind.MALFORMED_SOURCE_TREE, e.kind());
    }

    @Test
    void wireToUnknownElementIsRejected() {
        var bad = sheet(List.of(in("a", "A")), List.of(wire("a", "zz", null)));
        var e = assertThrows(ConversionException.class, () -> translator.translate("Flow", bad));
        assertEquals(ErrorKind.MALFORMED_SOURCE_TREE, e.kind());
    }

    @Test
    void timerBlockBecomesStandardCall() {
        var timer = new Controller.Block("t", "TONR", "T1", false, Map.of("PRE", "500"));
        var fragment = translator.translate("Flow", sheet(
            List.of(in("a", "A"), timer, out("y", "Y")),
            List.of(wire("a", "t", "TimerEnable"), wire("t", "DN", "y", null))
        ));
        assertEquals(new IR.FbCall("T1", "TON", List.of(
            new IR.Arg("IN", IR.Ref.to("A")),
            new IR.Arg("PT", new IR.Literal(IR.LIT.TIME, "T#500ms"))
        )), fragment.stmts().get(0));
        assertEquals(new IR.Assign(IR.Ref.to("Y"), IR.Ref.parse("T1.Q")), fragment.stmts().get(1));
        assertTrue(fragment.synthesized().isEmpty());
    }

    @Test
    void unknownBlockIsDisabledAndReported() {
        var fragment = translator.translate("Flow", sheet(
            List.of(in("a", "A"), block("p", "PIDE", "Loop1")),
            List.of(wire("a", "p", "PV"))
        ));
        assertInstanceOf(IR.Disabled.class, fragment.stmts().get(0));
        assertEquals(ErrorKind.UNSUPPORTED_INSTRUCTION, fragment.diagnostics().get(0).kind());
    }
}
