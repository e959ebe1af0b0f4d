package org.l5xst.fbd;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.Diagnostic;
import org.l5xst.ErrorKind;
import org.l5xst.StructuralCycleException;
import org.l5xst.ir.IR;
import org.l5xst.ir.TagScope;
import org.l5xst.model.Controller;
import org.l5xst.tables.FbdBlockType;

/**
 * Lowers function block diagram sheets into IR statements in dataflow order.
 *
 * <p>Operator blocks write into synthesized variables, timers and counters become standard
 * function-block calls, template blocks load their instance and call the template function.
 */
public class FbdTranslator {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("fbd");

    private final TagScope scope;

    public FbdTranslator(TagScope scope) {
        this.scope = scope;
    }

    /**
     * All sheets of a routine. A sheet with a combinational loop is replaced by a disabled
     * statement and reported; the other sheets are still translated.
     */
    public IR.Fragment translate(String routine, List<Controller.Sheet> sheets) {
        var stmts = new ArrayList<IR.Stmt>();
        var synthesized = new ArrayList<IR.Var>();
        var diagnostics = new ArrayList<Diagnostic>();
        for (var sheet : sheets) {
            try {
                var fragment = translate(routine, sheet);
                stmts.addAll(fragment.stmts());
                synthesized.addAll(fragment.synthesized());
                diagnostics.addAll(fragment.diagnostics());
            } catch (StructuralCycleException e) {
                log.warn("{}: {}, sheet skipped", e.location(), e.reason());
                stmts.add(new IR.Disabled("sheet " + sheet.number(), e.reason()));
                diagnostics.add(e.toDiagnostic());
            }
        }
        return new IR.Fragment(stmts, synthesized, diagnostics);
    }

    /**
     * @throws StructuralCycleException if the sheet has a loop without a stateful block
     */
    public IR.Fragment translate(String routine, Controller.Sheet sheet) {
        var location = routine + "/sheet " + sheet.number();
        var graph = SheetGraph.build(sheet, location);
        var order = graph.schedule();
        var state = new SheetState(routine, sheet.number(), location, graph);
        for (int index : order) {
            emit(graph.node(index), state);
        }
        log.debug("{}: {} nodes scheduled into {} statements", location, order.size(), state.stmts.size());
        return new IR.Fragment(state.stmts, new ArrayList<>(state.synthesized.values()), state.diagnostics);
    }

    /*
     * Per-sheet accumulator
     */
    private static final class SheetState {
        final String routine;
        final int sheet;
        final String location;
        final SheetGraph graph;
        final List<IR.Stmt> stmts = new ArrayList<>();
        final Map<String, IR.Var> synthesized = new LinkedHashMap<>();
        final List<Diagnostic> diagnostics = new ArrayList<>();

        SheetState(String routine, int sheet, String location, SheetGraph graph) {
            this.routine = routine;
            this.sheet = sheet;
            this.location = location;
            this.graph = graph;
        }
    }

    // ==========================================================
    // Emission
    // ==========================================================

    private void emit(SheetGraph.Node node, SheetState state) {
        var element = node.element();
        if (element instanceof Controller.InputRef) {
            return;
        }
        if (element instanceof Controller.OutputRef out) {
            var source = node.inputs().get(SheetGraph.OUTPUT_REF_PIN);
            if (source == null) {
                log.warn("{}: output reference {} ({}) has no input, skipped", state.location, out.id(), out.operand());
                return;
            }
            state.stmts.add(new IR.Assign(IR.Ref.parse(out.operand()), read(source, state)));
            return;
        }
        var block = (Controller.Block) element;
        if (block.addOn()) {
            addOn(node, block, state);
            return;
        }
        if (node.type().isEmpty()) {
            var reason = "unsupported block type " + block.type();
            log.warn("{}: {}", state.location, reason);
            state.stmts.add(new IR.Disabled(block.type() + " " + block.operand(), reason));
            state.diagnostics.add(Diagnostic.of(ErrorKind.UNSUPPORTED_INSTRUCTION, state.location + " " + block.id(), reason));
            return;
        }
        var type = node.type().get();
        switch (type.kind()) {
            case EXPRESSION -> expression(node, block, type, state);
            case SELECT -> select(node, block, type, state);
            case FUNCTION_BLOCK -> functionBlock(node, block, type, state);
            case TEMPLATE -> template(node, block, type, state);
        }
    }

    private void expression(SheetGraph.Node node, Controller.Block block, FbdBlockType type, SheetState state) {
        var in = type.inputs();
        IR.Expr value = type.op().unary()
            ? new IR.Unary(type.op(), input(node, in.get(0), state))
            : new IR.Binary(type.op(), input(node, in.get(0), state), input(node, in.get(1), state));
        state.stmts.add(new IR.Assign(result(block, type, state), value));
    }

    private void select(SheetGraph.Node node, Controller.Block block, FbdBlockType type, SheetState state) {
        var args = type.inputs().stream().map(pin -> input(node, pin, state)).toList();
        state.stmts.add(new IR.Assign(result(block, type, state), new IR.Call("SEL", args)));
    }

    /** Unwired inputs are left out of the call, so the instance keeps its own value. */
    private void functionBlock(SheetGraph.Node node, Controller.Block block, FbdBlockType type, SheetState state) {
        var instance = instance(block, type.target(), state);
        var args = new ArrayList<IR.Arg>();
        for (var pin : type.inputs()) {
            wired(node, pin.name()).ifPresent(source -> {
                var value = read(source, state);
                if (pin.type().equals("TIME")) {
                    value = toTime(value);
                }
                args.add(new IR.Arg(pin.target(), value));
            });
        }
        state.stmts.add(new IR.FbCall(instance, type.target(), args));
    }

    private void template(SheetGraph.Node node, Controller.Block block, FbdBlockType type, SheetState state) {
        var template = type.template().orElseThrow();
        var instance = instance(block, template.structType(), state);
        var self = IR.Ref.to(instance);
        for (var pin : type.inputs()) {
            wired(node, pin.name()).ifPresent(source ->
                state.stmts.add(new IR.Assign(self.member(pin.name()), read(source, state))));
        }
        state.stmts.add(new IR.Assign(self, new IR.Call(template.functionName(), List.of(self))));
    }

    private void addOn(SheetGraph.Node node, Controller.Block block, SheetState state) {
        var instance = instance(block, block.type(), state);
        var args = new ArrayList<IR.Arg>();
        node.inputs().forEach((pin, source) -> args.add(new IR.Arg(pin, read(source, state))));
        state.stmts.add(new IR.FbCall(instance, block.type(), args));
    }

    // ==========================================================
    // Values
    // ==========================================================

    private static Optional<PinSource> wired(SheetGraph.Node node, String pin) {
        for (var entry : node.inputs().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(pin)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /** Value of an operator input: its source, or the pin's default when nothing feeds it. */
    private IR.Expr input(SheetGraph.Node node, FbdBlockType.Pin pin, SheetState state) {
        return wired(node, pin.name())
            .map(source -> read(source, state))
            .orElseGet(() -> IR.Literal.tryParse(pin.fallback()).orElseThrow());
    }

    private IR.Expr read(PinSource source, SheetState state) {
        if (source instanceof PinSource.Literal lit) {
            return IR.Literal.tryParse(lit.value()).orElseThrow();
        } else if (source instanceof PinSource.Tag tag) {
            return IR.Ref.parse(tag.operand());
        }
        var wire = (PinSource.Wire) source;
        return output(state.graph.node(wire.producer()), wire.pin(), state);
    }

    /** The value a consumer reads from output {@code pin} of {@code producer}. */
    private IR.Expr output(SheetGraph.Node producer, String pin, SheetState state) {
        var block = (Controller.Block) producer.element();
        if (producer.type().isEmpty()) {
            return IR.Ref.to(instanceName(block, state)).member(pin);
        }
        var type = producer.type().get();
        return switch (type.kind()) {
            case EXPRESSION, SELECT -> IR.Ref.to(resultName(block, type, state));
            case FUNCTION_BLOCK -> {
                var out = type.output(pin);
                var ref = IR.Ref.to(instanceName(block, state)).member(out.map(FbdBlockType.Pin::target).orElse(pin));
                yield out.isPresent() && out.get().type().equals("TIME")
                    ? new IR.Call("TIME_TO_DINT", List.of(ref))
                    : ref;
            }
            case TEMPLATE -> IR.Ref.to(instanceName(block, state)).member(pin);
        };
    }

    private static IR.Expr toTime(IR.Expr value) {
        if (value instanceof IR.Literal lit && lit.kind() == IR.LIT.INT) {
            return IR.Literal.millis(lit.text());
        }
        if (value instanceof IR.Literal lit && lit.kind() == IR.LIT.TIME) {
            return lit;
        }
        return new IR.Call("DINT_TO_TIME", List.of(value));
    }

    // ==========================================================
    // Names
    // ==========================================================

    private IR.Ref result(Controller.Block block, FbdBlockType type, SheetState state) {
        var name = resultName(block, type, state);
        if (!scope.isDeclared(name)) {
            state.synthesized.putIfAbsent(name, IR.Var.of(name, type.resultType()));
        }
        return IR.Ref.to(name);
    }

    /** {@code <operand>_<pin>}: the variable holding an operator block's result. */
    private static String resultName(Controller.Block block, FbdBlockType type, SheetState state) {
        return instanceName(block, state) + "_" + type.outputs().get(0).name();
    }

    /** Declares the block's instance when the project does not. */
    private String instance(Controller.Block block, String type, SheetState state) {
        var name = instanceName(block, state);
        if (!scope.isDeclared(name)) {
            state.synthesized.putIfAbsent(name, IR.Var.of(name, type));
        }
        return name;
    }

    private static String instanceName(Controller.Block block, SheetState state) {
        if (!block.operand().isEmpty()) {
            return block.operand();
        }
        var routine = state.routine.replaceAll("[^A-Za-z0-9_]", "_");
        return routine + "_S" + state.sheet + "_B" + block.id().replaceAll("[^A-Za-z0-9_]", "_");
    }
}
