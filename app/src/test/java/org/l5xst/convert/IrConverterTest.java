package org.l5xst.convert;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.Test;

import org.l5xst.ir.IR;
import org.l5xst.l5x.RungTextParser;
import org.l5xst.model.Controller;

class IrConverterTest {
    private static Controller.Tag tag(String name, String type, IR.SCOPE scope) {
        return Controller.Tag.base(name, type, scope);
    }

    private static Controller.Tag alias(String name, String target) {
        return new Controller.Tag(name, "", List.of(), IR.SCOPE.CONTROLLER, IR.TAG_KIND.ALIAS,
            Optional.empty(), Optional.of(target), Optional.empty());
    }

    private static Controller.LadderRoutine ladder(String name, String... rungs) {
        var list = new ArrayList<Controller.Rung>();
        for (int i = 0; i < rungs.length; i++) {
            list.add(new Controller.Rung(i, rungs[i], Optional.empty(), RungTextParser.parse(rungs[i], name)));
        }
        return new Controller.LadderRoutine(name, list);
    }

    private static IR.Var var(IR.Program program, String name) {
        return program.lookupVar(name).orElseThrow(() -> new AssertionError("no var " + name));
    }

    @Test
    void shadowingProgramTagsArePrefixed() {
        var controller = new Controller("PlantA",
            List.of(tag("Level", "REAL", IR.SCOPE.CONTROLLER), tag("Start", "BOOL", IR.SCOPE.CONTROLLER)),
            List.of(), List.of(),
            List.of(new Controller.Program("MainProgram", Optional.of("MainRoutine"),
                List.of(tag("Level", "DINT", IR.SCOPE.PROGRAM)),
                List.of(ladder("MainRoutine", "XIC(Start)MOV(5,Level);")))));

        var program = new IrConverter().toIR(controller).program();
        assertEquals("REAL", var(program, "Level").type());
        assertEquals("DINT", var(program, "MainProgram_Level").type());

        var rung = (IR.If) program.statements().get(0);
        assertEquals(new IR.Assign(IR.Ref.to("MainProgram_Level"), IR.Literal.integer(5)), rung.then().get(0));
    }

    @Test
    void mainRoutineComesFirstAndLabelsCarryProgramWhenSeveral() {
        var controller = new Controller("PlantA",
            List.of(tag("A", "BOOL", IR.SCOPE.CONTROLLER), tag("Y", "BOOL", IR.SCOPE.CONTROLLER)),
            List.of(), List.of(),
            List.of(
                new Controller.Program("Fill", Optional.of("Main"),
                    List.of(),
                    List.of(ladder("Helper", "XIC(A)OTE(Y);"), ladder("Main", "XIO(A)OTE(Y);"))),
                new Controller.Program("Drain", Optional.empty(), List.of(),
                    List.of(new Controller.TextRoutine("Logic", "Y := A;")))
            ));

        var program = new IrConverter().toIR(controller).program();
        assertEquals(List.of("Fill/Main", "Fill/Helper", "Drain/Logic"),
            program.routines().stream().map(IR.Routine::name).toList());
        assertEquals(IR.ROUTINE_KIND.TEXT, program.routines().get(2).kind());
        assertEquals(List.of(new IR.Assign(IR.Ref.to("Y"), IR.Ref.to("A"))), program.routines().get(2).body());
    }

    @Test
    void aliasesTakeTheirTargetType() {
        var controller = new Controller("PlantA",
            List.of(
                tag("Status", "DINT", IR.SCOPE.CONTROLLER),
                tag("Tank", "Tank_t", IR.SCOPE.CONTROLLER),
                alias("Running", "Status.3"),
                alias("Fill", "Tank.Level"),
                alias("Lost", "Nowhere")
            ),
            List.of(new Controller.DataType("Tank_t", List.of(new Controller.Member("Level", "REAL", List.of())))),
            List.of(), List.of());

        var program = new IrConverter().toIR(controller).program();
        assertEquals("BOOL", var(program, "Running").type());
        assertEquals("REAL", var(program, "Fill").type());
        assertEquals("BOOL", var(program, "Lost").type());
    }

    @Test
    void timerDrivenAsOffDelayIsRetyped() {
        var controller = new Controller("PlantA",
            List.of(tag("A", "BOOL", IR.SCOPE.CONTROLLER), tag("T1", "TIMER", IR.SCOPE.CONTROLLER)),
            List.of(), List.of(),
            List.of(new Controller.Program("MainProgram", Optional.of("MainRoutine"), List.of(),
                List.of(ladder("MainRoutine", "XIC(A)TOF(T1,500,0);")))));

        var program = new IrConverter().toIR(controller).program();
        assertEquals("TOF", var(program, "T1").type());
        var call = (IR.FbCall) program.statements().get(0);
        assertEquals("TOF", call.fbType());
    }

    @Test
    void retentiveTimerIsRetypedAndItsResetClears() {
        var controller = new Controller("PlantA",
            List.of(tag("A", "BOOL", IR.SCOPE.CONTROLLER), tag("B", "BOOL", IR.SCOPE.CONTROLLER),
                tag("T1", "TIMER", IR.SCOPE.CONTROLLER)),
            List.of(), List.of(),
            List.of(new Controller.Program("MainProgram", Optional.of("MainRoutine"), List.of(),
                List.of(ladder("MainRoutine", "XIC(A)RTO(T1,500,0);", "XIC(B)RES(T1);")))));

        var program = new IrConverter().toIR(controller).program();
        assertEquals("TONR", var(program, "T1").type());
        var reset = (IR.If) program.statements().get(1);
        assertEquals(new IR.FbCall("T1", "TONR", List.of(new IR.Arg("RESET", IR.Literal.TRUE))), reset.then().get(0));
    }

    @Test
    void addOnBodySeesItsParameters() {
        var valve = new Controller.AddOn("Valve",
            List.of(new Controller.AddOnParam("Cmd", "BOOL", Controller.USAGE.INPUT),
                new Controller.AddOnParam("Open", "BOOL", Controller.USAGE.OUTPUT)),
            List.of(tag("Seen", "BOOL", IR.SCOPE.PROGRAM)),
            List.of(ladder("Logic", "XIC(Cmd)OTE(Open);")));
        var controller = new Controller("PlantA", List.of(), List.of(), List.of(valve), List.of());

        var result = new IrConverter().toIR(controller);
        var function = result.program().functions().get(0);
        assertEquals(List.of(
            new IR.Param("Cmd", "BOOL", IR.PARAM_DIR.INPUT),
            new IR.Param("Open", "BOOL", IR.PARAM_DIR.OUTPUT),
            new IR.Param("Seen", "BOOL", IR.PARAM_DIR.LOCAL)
        ), function.params());
        assertEquals(1, function.body().size());
        assertTrue(result.diagnostics().isEmpty());
    }

    /** Assignment targets of every routine, nested statements included. */
    private static List<String> targets(IR.Program program) {
        var out = new ArrayList<String>();
        for (var stmt : program.statements()) {
            collectTargets(stmt, out);
        }
        return out;
    }

    private static void collectTargets(IR.Stmt stmt, List<String> out) {
        if (stmt instanceof IR.Assign a) {
            out.add(a.target().path());
        } else if (stmt instanceof IR.If i) {
            i.then().forEach(s -> collectTargets(s, out));
            i.otherwise().forEach(s -> collectTargets(s, out));
        }
    }

    @Test
    void oneShotsOfRoutinesWithClashingLabelsKeepSeparateState() {
        var controller = new Controller("PlantA",
            List.of(tag("X", "BOOL", IR.SCOPE.CONTROLLER), tag("Z", "BOOL", IR.SCOPE.CONTROLLER),
                tag("S1", "BOOL", IR.SCOPE.CONTROLLER), tag("S2", "BOOL", IR.SCOPE.CONTROLLER),
                tag("Y1", "BOOL", IR.SCOPE.CONTROLLER), tag("Y2", "BOOL", IR.SCOPE.CONTROLLER)),
            List.of(), List.of(),
            List.of(
                new Controller.Program("A", Optional.empty(), List.of(),
                    List.of(ladder("B_C", "XIC(X)ONS(S1)OTE(Y1);"))),
                new Controller.Program("A_B", Optional.empty(), List.of(),
                    List.of(ladder("C", "XIC(Z)ONS(S2)OTE(Y2);")))
            ));

        var program = new IrConverter().toIR(controller).program();
        var shadows = new LinkedHashSet<String>();
        for (var target : targets(program)) {
            if (!target.startsWith("Y")) {
                shadows.add(target);
            }
        }
        assertEquals(4, shadows.size(), "shadow tags " + shadows);
        for (var name : shadows) {
            assertTrue(program.lookupVar(name).isPresent(), "undeclared " + name);
        }

        var names = program.vars().stream().map(v -> v.name().toLowerCase(Locale.ROOT)).toList();
        assertEquals(names.size(), new HashSet<>(names).size(), "duplicate declarations " + names);
    }

    @Test
    void unnamedBlocksOfRoutinesWithClashingLabelsGetDistinctInstances() {
        var sheet = new Controller.Sheet(1,
            List.of(new Controller.InputRef("1", "X"), new Controller.InputRef("2", "Z"),
                new Controller.Block("3", "BAND", "", false, Map.of()), new Controller.OutputRef("4", "Y1")),
            List.of(new Controller.Wire("1", Optional.empty(), "3", Optional.of("In1")),
                new Controller.Wire("2", Optional.empty(), "3", Optional.of("In2")),
                new Controller.Wire("3", Optional.empty(), "4", Optional.empty())));
        var controller = new Controller("PlantA",
            List.of(tag("X", "BOOL", IR.SCOPE.CONTROLLER), tag("Z", "BOOL", IR.SCOPE.CONTROLLER),
                tag("Y1", "BOOL", IR.SCOPE.CONTROLLER)),
            List.of(), List.of(),
            List.of(
                new Controller.Program("A", Optional.empty(), List.of(),
                    List.of(new Controller.FbdRoutine("B_C", List.of(sheet)))),
                new Controller.Program("A_B", Optional.empty(), List.of(),
                    List.of(new Controller.FbdRoutine("C", List.of(sheet))))
            ));

        var program = new IrConverter().toIR(controller).program();
        assertEquals("A_B_C_S1_B3_Out", ((IR.Assign) program.routines().get(0).body().get(0)).target().path());
        assertEquals("A_B_C_S1_B3_Out_", ((IR.Assign) program.routines().get(1).body().get(0)).target().path());
        assertEquals(new IR.Assign(IR.Ref.to("Y1"), IR.Ref.to("A_B_C_S1_B3_Out_")),
            program.routines().get(1).body().get(1));
        assertTrue(program.lookupVar("A_B_C_S1_B3_Out_").isPresent());
    }
}
