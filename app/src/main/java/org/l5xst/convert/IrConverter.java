package org.l5xst.convert;

import java.util.*;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.Diagnostic;
import org.l5xst.fbd.FbdTranslator;
import org.l5xst.ir.IR;
import org.l5xst.ir.IrRewriter;
import org.l5xst.ir.TagScope;
import org.l5xst.ladder.LadderTranslator;
import org.l5xst.model.Controller;
import org.l5xst.st.StParser;
import org.l5xst.st.StToIr;
import org.l5xst.tables.TypeTable;

/**
 * Builds the IR program of one controller: declarations through the type table, every routine
 * through the translator for its language.
 *
 * <p>Holds no state between calls, so controllers may be converted concurrently.
 */
public class IrConverter {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("pipeline");

    public record Result(IR.Program program, List<Diagnostic> diagnostics) {
        public Result {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    private final StParser stParser = new StParser();
    private final StToIr stToIr = new StToIr();

    public Result toIR(Controller controller) {
        var diagnostics = new ArrayList<Diagnostic>();

        var types = controller.types().stream()
            .map(t -> new IR.Struct(t.name(), t.members().stream()
                .map(m -> new IR.Member(m.name(), TypeTable.toSt(m.dataType()), m.dims()))
                .toList()))
            .toList();

        var headers = controller.addOns().stream().map(IrConverter::header).toList();
        var functions = new ArrayList<IR.Function>();
        for (int i = 0; i < headers.size(); i++) {
            functions.add(addOnBody(controller.name(), controller.addOns().get(i), headers.get(i), headers, diagnostics));
        }

        var controllerVars = new ArrayList<IR.Var>();
        for (var tag : controller.tags()) {
            controllerVars.add(var(tag, tag.name()));
        }

        // Program tags that shadow another tag get the program name in front.
        var claimed = new HashSet<String>();
        controllerVars.forEach(v -> claimed.add(key(v.name())));
        var counts = new HashMap<String, Integer>();
        for (var program : controller.programs()) {
            for (var tag : program.tags()) {
                counts.merge(key(tag.name()), 1, Integer::sum);
            }
        }

        // Every program's final tag names are claimed before any routine synthesizes a name.
        var vars = new ArrayList<>(controllerVars);
        var programRenames = new ArrayList<Map<String, String>>();
        var programVisible = new ArrayList<List<IR.Var>>();
        for (var program : controller.programs()) {
            var renames = new HashMap<String, String>();
            var programVars = new ArrayList<IR.Var>();
            for (var tag : program.tags()) {
                var name = tag.name();
                if (claimed.contains(key(name)) || counts.getOrDefault(key(name), 0) > 1) {
                    name = sanitize(program.name()) + "_" + tag.name();
                    renames.put(key(tag.name()), name);
                    claimed.add(key(tag.name()));
                    log.debug("{}/{}: program tag {} renamed to {}", controller.name(), program.name(), tag.name(), name);
                }
                programVars.add(var(tag, tag.name()));
                vars.add(var(tag, name));
                claimed.add(key(name));
            }
            var visible = new ArrayList<IR.Var>(programVars);
            for (var v : controllerVars) {
                if (!renames.containsKey(key(v.name()))) {
                    visible.add(v);
                }
            }
            programRenames.add(renames);
            programVisible.add(visible);
        }

        var routines = new ArrayList<IR.Routine>();
        boolean qualify = controller.programs().size() > 1;
        for (int p = 0; p < controller.programs().size(); p++) {
            var program = controller.programs().get(p);
            var renames = programRenames.get(p);
            var visible = programVisible.get(p);
            var scope = new TagScope(visible, headers);
            for (var routine : ordered(program)) {
                var label = qualify ? program.name() + "/" + routine.name() : routine.name();
                var fragment = claimSynthesized(
                    translate(controller.name() + "/" + label, label, routine, visible, scope, headers), claimed);
                List<IR.Stmt> body = fragment.stmts();
                if (!renames.isEmpty()) {
                    body = IrRewriter.renameAll(body,
                        r -> new IR.Ref(renames.getOrDefault(key(r.root()), r.root()), r.suffix()),
                        t -> t);
                }
                routines.add(new IR.Routine(label, kind(routine), body));
                vars.addAll(fragment.synthesized());
                diagnostics.addAll(fragment.diagnostics());
            }
        }

        var resolved = resolveAliases(vars, types);
        var program = new IR.Program(controller.name(), resolved, types, functions, routines);
        program = retypeInstances(dropUnusedBlockStorage(program));
        log.info("controller {}: {} tags, {} routines, {} diagnostics",
            controller.name(), program.vars().size(), program.routines().size(), diagnostics.size());
        return new Result(program, diagnostics);
    }

    // ==========================================================
    // Declarations
    // ==========================================================

    private static IR.Var var(Controller.Tag tag, String name) {
        return new IR.Var(name, TypeTable.toSt(tag.dataType()), tag.dims(), tag.scope(), tag.kind(),
            tag.value(), tag.aliasFor(), tag.message());
    }

    private static IR.Function header(Controller.AddOn addOn) {
        var params = new ArrayList<IR.Param>();
        for (var p : addOn.params()) {
            var dir = switch (p.usage()) {
                case INPUT -> IR.PARAM_DIR.INPUT;
                case OUTPUT -> IR.PARAM_DIR.OUTPUT;
                case IN_OUT -> IR.PARAM_DIR.IN_OUT;
            };
            params.add(new IR.Param(p.name(), TypeTable.toSt(p.dataType()), dir));
        }
        for (var local : addOn.localTags()) {
            params.add(new IR.Param(local.name(), TypeTable.toSt(local.dataType()), IR.PARAM_DIR.LOCAL));
        }
        return new IR.Function(addOn.name(), params, List.of());
    }

    /** Add-on logic sees only its own parameters and local tags. */
    private IR.Function addOnBody(
        String controller, Controller.AddOn addOn, IR.Function header,
        List<IR.Function> headers, List<Diagnostic> diagnostics
    ) {
        var locals = header.params().stream().map(p -> IR.Var.of(p.name(), p.type())).toList();
        var scope = new TagScope(locals, headers);
        var body = new ArrayList<IR.Stmt>();
        var params = new ArrayList<>(header.params());
        var claimed = new HashSet<String>();
        params.forEach(p -> claimed.add(key(p.name())));
        for (var routine : addOn.routines()) {
            var label = addOn.name() + "/" + routine.name();
            var fragment = claimSynthesized(
                translate(controller + "/" + label, label, routine, locals, scope, headers), claimed);
            body.addAll(fragment.stmts());
            for (var v : fragment.synthesized()) {
                params.add(new IR.Param(v.name(), v.type(), IR.PARAM_DIR.LOCAL));
            }
            diagnostics.addAll(fragment.diagnostics());
        }
        return new IR.Function(addOn.name(), params, body);
    }

    // ==========================================================
    // Routines
    // ==========================================================

    /** Main routine first, the others in document order; subroutine calls are flattened this way. */
    private static List<Controller.Routine> ordered(Controller.Program program) {
        var main = program.mainRoutine();
        var first = new ArrayList<Controller.Routine>();
        var rest = new ArrayList<Controller.Routine>();
        for (var routine : program.routines()) {
            if (main.isPresent() && routine.name().equalsIgnoreCase(main.get())) {
                first.add(routine);
            } else {
                rest.add(routine);
            }
        }
        first.addAll(rest);
        return first;
    }

    private IR.Fragment translate(
        String origin, String label, Controller.Routine routine,
        List<IR.Var> visible, TagScope scope, List<IR.Function> headers
    ) {
        if (routine instanceof Controller.LadderRoutine ladder) {
            return new LadderTranslator(scope).translate(label, ladder.rungs());
        } else if (routine instanceof Controller.FbdRoutine fbd) {
            return new FbdTranslator(scope).translate(label, fbd.sheets());
        }
        var text = (Controller.TextRoutine) routine;
        var types = new HashMap<String, String>();
        visible.forEach(v -> types.putIfAbsent(key(v.name()), v.type()));
        var stmts = stToIr.lowerStatements(stParser.parseStatements(text.text(), origin), types, origin);
        return new IR.Fragment(stmts, List.of(), List.of());
    }

    /**
     * Claims the names a routine synthesized. A name already claimed by a declared tag or by an
     * earlier routine gets {@code _} appended until it is free, and the routine body follows the
     * rename. Repeats of one name inside the routine stay one variable.
     */
    private static IR.Fragment claimSynthesized(IR.Fragment fragment, Set<String> claimed) {
        var renames = new HashMap<String, String>();
        var vars = new ArrayList<IR.Var>();
        for (var v : fragment.synthesized()) {
            if (renames.containsKey(key(v.name()))) {
                continue;
            }
            var name = v.name();
            while (claimed.contains(key(name))) {
                name = name + "_";
            }
            claimed.add(key(name));
            renames.put(key(v.name()), name);
            vars.add(v.withName(name));
            if (!name.equals(v.name())) {
                log.debug("synthesized tag {} renamed to {}", v.name(), name);
            }
        }
        var stmts = fragment.stmts();
        if (renames.entrySet().stream().anyMatch(e -> !e.getKey().equals(key(e.getValue())))) {
            stmts = IrRewriter.renameAll(stmts,
                r -> new IR.Ref(renames.getOrDefault(key(r.root()), r.root()), r.suffix()),
                t -> t);
        }
        return new IR.Fragment(stmts, vars, fragment.diagnostics());
    }

    private static IR.ROUTINE_KIND kind(Controller.Routine routine) {
        if (routine instanceof Controller.LadderRoutine) return IR.ROUTINE_KIND.LADDER;
        if (routine instanceof Controller.FbdRoutine) return IR.ROUTINE_KIND.FBD;
        return IR.ROUTINE_KIND.TEXT;
    }

    // ==========================================================
    // Fix-ups
    // ==========================================================

    /** Alias tags take the type of their target; targets that cannot be resolved are bits. */
    private static List<IR.Var> resolveAliases(List<IR.Var> vars, List<IR.Struct> types) {
        var byName = new HashMap<String, IR.Var>();
        vars.forEach(v -> byName.putIfAbsent(key(v.name()), v));
        var out = new ArrayList<IR.Var>();
        for (var v : vars) {
            if (v.kind() != IR.TAG_KIND.ALIAS || !v.type().isEmpty()) {
                out.add(v);
                continue;
            }
            var target = IR.Ref.parse(v.aliasFor().orElse(""));
            var type = Optional.ofNullable(byName.get(key(target.root()))).map(IR.Var::type);
            if (type.isPresent() && !target.suffix().isEmpty()) {
                type = memberType(type.get(), target.suffix(), types);
            }
            out.add(v.withType(type.orElse("BOOL")));
        }
        return out;
    }

    private static Optional<String> memberType(String type, String suffix, List<IR.Struct> types) {
        var current = type;
        for (var part : suffix.replaceAll("\\[[^\\]]*\\]", "").split("\\.")) {
            if (part.isEmpty()) continue;
            if (part.chars().allMatch(Character::isDigit)) {
                return Optional.of("BOOL");
            }
            String next = null;
            for (var t : types) {
                if (t.name().equalsIgnoreCase(current)) {
                    for (var m : t.members()) {
                        if (m.name().equalsIgnoreCase(part)) next = m.type();
                    }
                }
            }
            if (next == null) return Optional.empty();
            current = next;
        }
        return Optional.of(current);
    }

    private static IR.Program dropUnusedBlockStorage(IR.Program program) {
        var used = new HashSet<String>();
        program.statements().forEach(s -> IrRewriter.forEachRef(s, r -> used.add(key(r.root()))));
        var kept = new ArrayList<IR.Var>();
        for (var v : program.vars()) {
            if (TypeTable.isBlockStorage(v.type()) && !used.contains(key(v.name()))) {
                log.debug("{}: block tag {} of type {} dropped", program.name(), v.name(), v.type());
                continue;
            }
            kept.add(v);
        }
        return new IR.Program(program.name(), kept, program.types(), program.functions(), program.routines());
    }

    /**
     * Timer and counter tags are typed after the instruction that drives them ({@code TOF},
     * {@code CTD}), and every call on them follows.
     */
    private static IR.Program retypeInstances(IR.Program program) {
        var declared = new HashMap<String, String>();
        program.vars().forEach(v -> declared.put(key(v.name()), v.type()));
        var driven = new HashMap<String, String>();
        for (var stmt : program.statements()) {
            visitCalls(stmt, call -> {
                var type = declared.get(key(call.instance()));
                if (type != null && TypeTable.isGenericFunctionBlock(type)
                    && TypeTable.isGenericFunctionBlock(call.fbType())
                    && !type.equalsIgnoreCase(call.fbType())) {
                    driven.putIfAbsent(key(call.instance()), call.fbType());
                }
            });
        }
        if (driven.isEmpty()) {
            return program;
        }
        var vars = program.vars().stream()
            .map(v -> driven.containsKey(key(v.name())) ? v.withType(driven.get(key(v.name()))) : v)
            .toList();
        var routines = program.routines().stream()
            .map(r -> new IR.Routine(r.name(), r.kind(), IrRewriter.rewrite(r.body(), stmt -> {
                if (stmt instanceof IR.FbCall call && driven.containsKey(key(call.instance()))) {
                    var type = driven.get(key(call.instance()));
                    return new IR.FbCall(call.instance(), type, resetArgs(type, call.args()));
                }
                return stmt;
            })))
            .toList();
        return new IR.Program(program.name(), vars, program.types(), program.functions(), routines);
    }

    /**
     * Reset calls follow the block: {@code LD} for down counters, {@code RESET} for retentive
     * timers, which an idle {@code IN} does not clear.
     */
    private static List<IR.Arg> resetArgs(String type, List<IR.Arg> args) {
        if (type.equalsIgnoreCase("TONR")
            && args.equals(List.of(new IR.Arg("IN", IR.Literal.FALSE)))) {
            return List.of(new IR.Arg("RESET", IR.Literal.TRUE));
        }
        if (!type.equalsIgnoreCase("CTD")) {
            return args;
        }
        return args.stream()
            .map(a -> a.name().equalsIgnoreCase("R") ? new IR.Arg("LD", a.value()) : a)
            .toList();
    }

    private static void visitCalls(IR.Stmt stmt, Consumer<IR.FbCall> visitor) {
        if (stmt instanceof IR.FbCall call) {
            visitor.accept(call);
        }
        IrRewriter.children(stmt).forEach(child -> visitCalls(child, visitor));
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
