package org.l5xst.ladder;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.ConversionException;
import org.l5xst.Diagnostic;
import org.l5xst.ErrorKind;
import org.l5xst.ir.IR;
import org.l5xst.ir.TagScope;
import org.l5xst.model.Controller;
import org.l5xst.model.Controller.Term;
import org.l5xst.st.StParser;
import org.l5xst.st.StToIr;
import org.l5xst.tables.Instruction;

/**
 * Lowers ladder rungs into IR statements.
 *
 * <p>The network is read left to right. Conditions narrow the power flow (series is AND,
 * parallel branches are OR), output instructions consume the power flow reaching them and
 * pass it on unchanged. A rung containing an instruction that cannot be lowered is kept whole
 * as a disabled statement.
 */
public class LadderTranslator {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("ladder");

    private final TagScope scope;
    private final StParser stParser = new StParser();
    private final StToIr stToIr = new StToIr();

    public LadderTranslator(TagScope scope) {
        this.scope = scope;
    }

    /** All rungs of a routine, in order. */
    public IR.Fragment translate(String routine, List<Controller.Rung> rungs) {
        var stmts = new ArrayList<IR.Stmt>();
        var synthesized = new ArrayList<IR.Var>();
        var diagnostics = new ArrayList<Diagnostic>();
        for (var rung : rungs) {
            var fragment = translate(routine, rung);
            stmts.addAll(fragment.stmts());
            synthesized.addAll(fragment.synthesized());
            diagnostics.addAll(fragment.diagnostics());
        }
        return new IR.Fragment(stmts, synthesized, diagnostics);
    }

    public IR.Fragment translate(String routine, Controller.Rung rung) {
        var location = routine + "/rung " + rung.number();
        var state = new RungState(routine, rung.number(), location);
        try {
            walk(rung.network(), IR.Literal.TRUE, state);
        } catch (ConversionException e) {
            if (!e.kind().recoverable()) {
                throw e;
            }
            log.warn("{}: {}, rung kept as disabled text", location, e.reason());
            return new IR.Fragment(
                List.of(new IR.Disabled(rung.text(), e.reason())),
                List.of(),
                List.of(e.toDiagnostic())
            );
        }
        log.debug("{}: {} statements", location, state.stmts.size());
        return new IR.Fragment(state.stmts, state.synthesized, state.diagnostics);
    }

    /*
     * Per-rung accumulator
     */
    private static final class RungState {
        final String routine;
        final int rung;
        final String location;
        final List<IR.Stmt> stmts = new ArrayList<>();
        final List<IR.Var> synthesized = new ArrayList<>();
        final List<Diagnostic> diagnostics = new ArrayList<>();

        RungState(String routine, int rung, String location) {
            this.routine = routine;
            this.rung = rung;
            this.location = location;
        }
    }

    // ==========================================================
    // Network walk
    // ==========================================================

    /**
     * Walks a series and returns the condition it adds to {@code outer}.
     * Outputs inside it see {@code outer AND <condition so far>}.
     */
    private IR.Expr walk(Controller.Series series, IR.Expr outer, RungState state) {
        IR.Expr local = IR.Literal.TRUE;
        for (var node : series.nodes()) {
            if (node instanceof Term term) {
                local = term(term, outer, local, state);
            } else if (node instanceof Controller.Parallel parallel) {
                var inner = IR.and(outer, local);
                IR.Expr any = null;
                for (var branch : parallel.branches()) {
                    var branchCond = walk(branch, inner, state);
                    any = any == null ? branchCond : anyOf(any, branchCond);
                }
                if (any != null) {
                    local = IR.and(local, any);
                }
            } else if (node instanceof Controller.Series nested) {
                local = IR.and(local, walk(nested, IR.and(outer, local), state));
            }
        }
        return local;
    }

    private static IR.Expr anyOf(IR.Expr a, IR.Expr b) {
        if (a.equals(IR.Literal.TRUE) || b.equals(IR.Literal.TRUE)) {
            return IR.Literal.TRUE;
        }
        return IR.or(a, b);
    }

    private IR.Expr term(Term term, IR.Expr outer, IR.Expr local, RungState state) {
        var ins = Instruction.lookup(term.mnemonic());
        if (ins.isEmpty()) {
            var addOn = scope.addOn(term.mnemonic());
            if (addOn.isPresent()) {
                addOnCall(term, addOn.get(), IR.and(outer, local), state);
                return local;
            }
            throw unsupported(term, state, "unsupported instruction " + term.mnemonic());
        }
        var instruction = ins.get();
        if (term.operands().size() < instruction.operands()) {
            throw unsupported(term, state, term.mnemonic() + " expects " + instruction.operands()
                + " operands, found " + term.operands().size());
        }
        var power = IR.and(outer, local);
        switch (instruction.kind()) {
            case CONTACT:
            case COMPARE:
                return IR.and(local, condition(instruction, term, state));
            case EDGE:
                if (instruction == Instruction.FTRIG) {
                    return fallingShot(term, power, state);
                }
                if (instruction.inlineEdge()) {
                    return IR.and(local, oneShot(term, power, state));
                }
                edgeOutput(instruction, term, power, state);
                return local;
            default:
                output(instruction, term, power, state);
                return local;
        }
    }

    // ==========================================================
    // Conditions
    // ==========================================================

    private IR.Expr condition(Instruction ins, Term term, RungState state) {
        var ops = term.operands();
        switch (ins) {
            case XIC:
                return ref(ops.get(0));
            case XIO:
                return IR.not(ref(ops.get(0)));
            case AFI:
                return IR.Literal.FALSE;
            case LIM: {
                var low = value(ops.get(0));
                var test = value(ops.get(1));
                var high = value(ops.get(2));
                return new IR.Binary(IR.Op.AND,
                    new IR.Binary(IR.Op.LE, low, test),
                    new IR.Binary(IR.Op.LE, test, high));
            }
            case CMP:
                return expression(ops.get(0), term, state);
            default:
                var op = ins.op().orElseThrow();
                return new IR.Binary(op, value(ops.get(0)), value(ops.get(1)));
        }
    }

    /** In-line one-shot: a pulse variable that is true for the first scan the power flow is. */
    private IR.Expr oneShot(Term term, IR.Expr power, RungState state) {
        var shadow = synthesize(term, "prev", state);
        var pulse = synthesize(term, "os", state);
        state.stmts.add(new IR.Assign(pulse, IR.and(power, IR.not(shadow))));
        state.stmts.add(new IR.Assign(shadow, power));
        return pulse;
    }

    /**
     * In-line falling trigger: passes power for the one scan after the power reaching it drops,
     * so the pulse replaces the condition built so far.
     */
    private IR.Expr fallingShot(Term term, IR.Expr power, RungState state) {
        var shadow = synthesize(term, "prev", state);
        var pulse = synthesize(term, "os", state);
        state.stmts.add(new IR.Assign(pulse, IR.and(IR.not(power), shadow)));
        state.stmts.add(new IR.Assign(shadow, power));
        return pulse;
    }

    private void edgeOutput(Instruction ins, Term term, IR.Expr power, RungState state) {
        var shadow = synthesize(term, "prev", state);
        var out = ref(term.operands().get(1));
        IR.Expr pulse = ins == Instruction.OSR
            ? IR.and(power, IR.not(shadow))
            : IR.and(IR.not(power), shadow);
        state.stmts.add(new IR.Assign(out, pulse));
        state.stmts.add(new IR.Assign(shadow, power));
    }

    // ==========================================================
    // Outputs
    // ==========================================================

    private void output(Instruction ins, Term term, IR.Expr power, RungState state) {
        var ops = term.operands();
        switch (ins.kind()) {
            case COIL -> coil(ins, ref(ops.get(0)), power, state);
            case TIMER -> {
                var type = ins == Instruction.RTO ? Instruction.TONR.name() : ins.name();
                state.stmts.add(new IR.FbCall(ops.get(0), type, timerArgs(power, ops.get(1))));
            }
            case COUNTER -> {
                var args = new ArrayList<IR.Arg>();
                if (ins == Instruction.CTUD) {
                    // CTUD(counter, preset, up, down): both count inputs are gated by the rung.
                    args.add(new IR.Arg("CU", IR.and(power, value(ops.get(2)))));
                    args.add(new IR.Arg("CD", IR.and(power, value(ops.get(3)))));
                } else {
                    args.add(new IR.Arg(ins == Instruction.CTU ? "CU" : "CD", power));
                }
                preset(ops.get(1)).ifPresent(pv -> args.add(new IR.Arg("PV", pv)));
                state.stmts.add(new IR.FbCall(ops.get(0), ins.name(), args));
            }
            case RESET -> guarded(power, reset(ops.get(0), term, state), state);
            case MOVE -> {
                var dest = ins == Instruction.CLR ? ops.get(0) : ops.get(1);
                var value = ins == Instruction.CLR ? IR.Literal.ZERO : value(ops.get(0));
                guarded(power, new IR.Assign(ref(dest), value), state);
            }
            case MATH -> guarded(power, math(ins, term, state), state);
            case CONVERT -> {
                if (ops.size() != ins.operands()) {
                    throw unsupported(term, state, term.mnemonic() + " with " + ops.size() + " operands");
                }
                var converted = new IR.Call(ins.function().orElseThrow(), List.of(value(ops.get(0))));
                guarded(power, new IR.Assign(ref(ops.get(1)), converted), state);
            }
            case MESSAGE -> {
                var msg = ref(ops.get(0));
                guarded(power, new IR.Assign(msg, new IR.Call("MSG", List.of(msg))), state);
            }
            case SYSTEM -> system(ins, term, state);
            default -> throw unsupported(term, state, "unsupported instruction " + term.mnemonic());
        }
    }

    /** Latch only ever writes TRUE, unlatch only ever writes FALSE. */
    private void coil(Instruction ins, IR.Ref target, IR.Expr power, RungState state) {
        switch (ins) {
            case OTE -> state.stmts.add(new IR.Assign(target, power));
            case OTL -> guarded(power, new IR.Assign(target, IR.Literal.TRUE), state);
            case OTU -> guarded(power, new IR.Assign(target, IR.Literal.FALSE), state);
            default -> throw new IllegalStateException("not a coil: " + ins);
        }
    }

    private List<IR.Arg> timerArgs(IR.Expr power, String preset) {
        var args = new ArrayList<IR.Arg>();
        args.add(new IR.Arg("IN", power));
        preset(preset).ifPresent(pv -> {
            if (pv instanceof IR.Literal lit && lit.kind() == IR.LIT.INT) {
                args.add(new IR.Arg("PT", IR.Literal.millis(lit.text())));
            } else {
                args.add(new IR.Arg("PT", new IR.Call("DINT_TO_TIME", List.of(pv))));
            }
        });
        return args;
    }

    /** {@code ?} leaves the preset to the tag's own value. */
    private Optional<IR.Expr> preset(String operand) {
        if (operand.strip().equals("?")) {
            return Optional.empty();
        }
        return Optional.of(value(operand));
    }

    private IR.Stmt reset(String operand, Term term, RungState state) {
        var type = scope.typeOf(operand).orElseThrow(() -> new ConversionException(
            ErrorKind.UNDECLARED_REFERENCE, state.location,
            "RES on undeclared tag " + operand,
            "declare the timer or counter the rung resets"
        ));
        switch (type.toUpperCase(Locale.ROOT)) {
            case "TON", "TOF":
                return new IR.FbCall(operand, type, List.of(new IR.Arg("IN", IR.Literal.FALSE)));
            case "TONR":
                return new IR.FbCall(operand, type, List.of(new IR.Arg("RESET", IR.Literal.TRUE)));
            case "CTU", "CTUD":
                return new IR.FbCall(operand, type, List.of(new IR.Arg("R", IR.Literal.TRUE)));
            case "CTD":
                return new IR.FbCall(operand, type, List.of(new IR.Arg("LD", IR.Literal.TRUE)));
            default:
                throw unsupported(term, state, "RES on " + type + " tag " + operand);
        }
    }

    private IR.Stmt math(Instruction ins, Term term, RungState state) {
        var ops = term.operands();
        switch (ins) {
            case SQR:
                return new IR.Assign(ref(ops.get(1)), new IR.Call("SQRT", List.of(value(ops.get(0)))));
            case ABS:
                return new IR.Assign(ref(ops.get(1)), new IR.Call("ABS", List.of(value(ops.get(0)))));
            case NEG:
                return new IR.Assign(ref(ops.get(1)), IR.negate(value(ops.get(0))));
            case CPT:
                return new IR.Assign(ref(ops.get(0)), expression(ops.get(1), term, state));
            default:
                var op = ins.op().orElseThrow();
                return new IR.Assign(ref(ops.get(2)), new IR.Binary(op, value(ops.get(0)), value(ops.get(1))));
        }
    }

    private void system(Instruction ins, Term term, RungState state) {
        if (ins == Instruction.NOP) {
            return;
        }
        var reason = ins == Instruction.JSR
            ? "subroutine call, routines are flattened"
            : "system object access " + ins.name();
        state.stmts.add(new IR.Disabled(text(term), reason));
        state.diagnostics.add(Diagnostic.of(ErrorKind.UNSUPPORTED_INSTRUCTION, state.location, reason));
    }

    /**
     * Add-on instruction call: operands are the instance followed by the visible parameters
     * in declaration order. Outputs are copied out after the call.
     */
    private void addOnCall(Term term, IR.Function addOn, IR.Expr power, RungState state) {
        var visible = addOn.params().stream().filter(p -> p.dir() != IR.PARAM_DIR.LOCAL).toList();
        var ops = term.operands();
        if (ops.size() != visible.size() + 1) {
            throw unsupported(term, state, addOn.name() + " expects " + (visible.size() + 1)
                + " operands, found " + ops.size());
        }
        var instance = ops.get(0);
        var args = new ArrayList<IR.Arg>();
        var copies = new ArrayList<IR.Stmt>();
        for (int i = 0; i < visible.size(); i++) {
            var param = visible.get(i);
            var operand = ops.get(i + 1);
            if (param.dir() == IR.PARAM_DIR.OUTPUT) {
                copies.add(new IR.Assign(ref(operand), IR.Ref.to(instance).member(param.name())));
            } else {
                args.add(new IR.Arg(param.name(), value(operand)));
            }
        }
        var body = new ArrayList<IR.Stmt>();
        body.add(new IR.FbCall(instance, addOn.name(), args));
        body.addAll(copies);
        if (power.equals(IR.Literal.TRUE)) {
            state.stmts.addAll(body);
        } else {
            state.stmts.add(new IR.If(power, body, List.of()));
        }
    }

    // ==========================================================
    // Helpers
    // ==========================================================

    private static void guarded(IR.Expr power, IR.Stmt stmt, RungState state) {
        state.stmts.add(power.equals(IR.Literal.TRUE) ? stmt : IR.If.when(power, stmt));
    }

    /** Free-form compute/compare expression, read with the ST expression grammar. */
    private IR.Expr expression(String text, Term term, RungState state) {
        try {
            return stToIr.lowerExpr(stParser.parseExpression(text, state.location), state.location);
        } catch (ConversionException e) {
            throw unsupported(term, state, "unreadable expression '" + text + "'");
        }
    }

    /**
     * Shadow and pulse tags: {@code <routine>_R<rung>_I<position>_<role>}, with {@code _} appended
     * until the name is free.
     */
    private IR.Ref synthesize(Term term, String role, RungState state) {
        var name = sanitize(state.routine) + "_R" + state.rung + "_I" + term.position() + "_" + role;
        while (scope.isDeclared(name)) {
            name = name + "_";
        }
        state.synthesized.add(IR.Var.of(name, "BOOL"));
        return IR.Ref.to(name);
    }

    private static String sanitize(String name) {
        var cleaned = name.replaceAll("[^A-Za-z0-9_]", "_");
        return Character.isDigit(cleaned.charAt(0)) ? "_" + cleaned : cleaned;
    }

    private static IR.Ref ref(String operand) {
        return IR.Ref.parse(operand);
    }

    /** Operand that may be a literal or a tag. */
    private static IR.Expr value(String operand) {
        return IR.Literal.tryParse(operand).<IR.Expr>map(l -> l).orElseGet(() -> IR.Ref.parse(operand));
    }

    private static String text(Term term) {
        return term.mnemonic() + "(" + String.join(",", term.operands()) + ")";
    }

    private static ConversionException unsupported(Term term, RungState state, String err) {
        return new ConversionException(
            ErrorKind.UNSUPPORTED_INSTRUCTION, state.location + " " + text(term), err,
            "the rung is kept as a disabled statement; rewrite it with supported instructions"
        );
    }
}
