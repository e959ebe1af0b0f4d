package org.l5xst.consolidate;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.ConversionConfig;
import org.l5xst.Diagnostic;
import org.l5xst.ErrorKind;
import org.l5xst.consolidate.RenameTable.KIND;
import org.l5xst.ir.IR;
import org.l5xst.ir.IrRewriter;
import org.l5xst.st.StEmitter;
import org.l5xst.st.StPrinter;
import org.l5xst.tables.AuxTemplate;
import org.l5xst.tables.ReservedWords;

/**
 * Merges the IR programs of several controllers into one program with a single namespace.
 *
 * <p>Names are claimed unit by unit (types, then function blocks, then tags), so the same
 * inputs always produce the same table. Messages between mapped controllers become direct
 * assignments; statements touching I/O modules are disabled.
 */
public class Consolidator {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("consolidate");

    private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public record Result(IR.Program program, RenameTable renames, List<Diagnostic> diagnostics) {
        public Result {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    private final ConversionConfig config;
    private final ReservedWords reserved;

    public Consolidator(ConversionConfig config) {
        this.config = config;
        this.reserved = new ReservedWords(config.reservedWords());
    }

    public Result consolidate(List<IR.Program> units) {
        var table = buildTable(units);
        var diagnostics = new ArrayList<Diagnostic>();

        var vars = new ArrayList<IR.Var>();
        var types = new LinkedHashMap<String, IR.Struct>();
        var functions = new LinkedHashMap<String, IR.Function>();
        var routines = new ArrayList<IR.Routine>();

        for (int i = 0; i < units.size(); i++) {
            int unit = i + 1;
            var program = units.get(i);
            var renamer = new UnitRenamer(unit, program, table, diagnostics);

            for (var type : program.types()) {
                var name = table.lookup(unit, KIND.TYPE, type.name()).orElseThrow();
                types.putIfAbsent(name.toLowerCase(Locale.ROOT), new IR.Struct(name, type.members().stream()
                    .map(m -> new IR.Member(memberName(m.name()), renamer.type(m.type()), m.dims()))
                    .toList()));
            }
            for (var function : program.functions()) {
                var name = table.lookup(unit, KIND.FUNCTION, function.name()).orElseThrow();
                functions.putIfAbsent(name.toLowerCase(Locale.ROOT), renamer.function(name, function));
            }
            var seen = new HashSet<String>();
            for (var v : program.vars()) {
                if (!seen.add(v.name().toLowerCase(Locale.ROOT))) {
                    log.warn("{}: duplicate declaration of {} dropped", program.name(), v.name());
                    continue;
                }
                var name = table.lookup(unit, KIND.VAR, v.name()).orElseThrow();
                vars.add(v.withName(name).withType(renamer.type(v.type())));
            }
            for (var routine : program.routines()) {
                var body = IrRewriter.rewrite(routine.body(), stmt -> renamer.statement(stmt, units));
                routines.add(new IR.Routine(program.name() + "/" + routine.name(), routine.kind(), body));
            }
        }

        log.info("consolidated {} units into {} with {} tags, {} types, {} function blocks",
            units.size(), config.programName(), vars.size(), types.size(), functions.size());
        var merged = new IR.Program(config.programName(), vars,
            new ArrayList<>(types.values()), new ArrayList<>(functions.values()), routines);
        return new Result(merged, table, diagnostics);
    }

    // ==========================================================
    // Rename table
    // ==========================================================

    /** Single-threaded: every unit's declarations are claimed before any statement is rewritten. */
    RenameTable buildTable(List<IR.Program> units) {
        var builder = new RenameTable.Builder(reserved, config.maxRenameAttempts());
        AuxTemplate.declaredNames().forEach(builder::reserve);
        builder.reserve(config.programName());
        builder.reserve(config.configurationName());
        builder.reserve(config.resourceName());
        builder.reserve(config.taskName());
        builder.reserve(config.programInstance());

        var typeOwners = new HashMap<String, IR.Struct>();
        var typeNames = new HashMap<String, String>();
        var functionOwners = new HashMap<String, IR.Function>();
        var functionNames = new HashMap<String, String>();

        for (int i = 0; i < units.size(); i++) {
            int unit = i + 1;
            var program = units.get(i);
            for (var type : program.types()) {
                var key = type.name().toLowerCase(Locale.ROOT);
                if (type.equals(typeOwners.get(key))) {
                    builder.share(unit, KIND.TYPE, type.name(), typeNames.get(key));
                    continue;
                }
                var name = builder.claim(unit, KIND.TYPE, type.name());
                typeOwners.putIfAbsent(key, type);
                typeNames.putIfAbsent(key, name);
            }
            for (var function : program.functions()) {
                var key = function.name().toLowerCase(Locale.ROOT);
                if (function.equals(functionOwners.get(key))) {
                    builder.share(unit, KIND.FUNCTION, function.name(), functionNames.get(key));
                    continue;
                }
                var name = builder.claim(unit, KIND.FUNCTION, function.name());
                functionOwners.putIfAbsent(key, function);
                functionNames.putIfAbsent(key, name);
            }
            for (var v : program.vars()) {
                builder.claim(unit, KIND.VAR, v.name());
            }
        }

        // Undeclared references come last, so they never take over another unit's tag.
        for (int i = 0; i < units.size(); i++) {
            int unit = i + 1;
            var program = units.get(i);
            for (var stmt : program.statements()) {
                IrRewriter.forEachRef(stmt, ref -> {
                    claimUndeclared(builder, unit, program, ref.root());
                    suffix(ref.suffix(), n -> n, n -> {
                        claimUndeclared(builder, unit, program, n);
                        return n;
                    });
                });
            }
        }
        return builder.build();
    }

    private void claimUndeclared(RenameTable.Builder builder, int unit, IR.Program program, String name) {
        if (!isModule(name) && program.lookupVar(name).isEmpty()) {
            builder.claim(unit, KIND.VAR, name);
        }
    }

    private boolean isModule(String root) {
        if (root.contains(":")) {
            return true;
        }
        for (var prefix : config.moduleChannels()) {
            if (root.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return true;
            }
        }
        return false;
    }

    private String memberName(String name) {
        return reserved.isReserved(name) ? reserved.rename(name) : name;
    }

    // ==========================================================
    // Per-unit rewriting
    // ==========================================================

    private final class UnitRenamer {
        final int unit;
        final IR.Program program;
        final RenameTable table;
        final List<Diagnostic> diagnostics;
        final Set<String> reported = new HashSet<>();

        UnitRenamer(int unit, IR.Program program, RenameTable table, List<Diagnostic> diagnostics) {
            this.unit = unit;
            this.program = program;
            this.table = table;
            this.diagnostics = diagnostics;
        }

        String type(String type) {
            return table.lookup(unit, KIND.TYPE, type)
                .or(() -> table.lookup(unit, KIND.FUNCTION, type))
                .orElse(type);
        }

        /** Whether {@code type} names one of the merged user function blocks, before or after renaming. */
        boolean isRenamedFunction(String type) {
            return table.lookup(unit, KIND.FUNCTION, type).isPresent()
                || table.entries().entrySet().stream().anyMatch(e ->
                    e.getKey().unit() == unit && e.getKey().kind() == KIND.FUNCTION && e.getValue().equalsIgnoreCase(type));
        }

        /** Function block bodies only see their own parameters, which only lose reserved words. */
        IR.Function function(String name, IR.Function function) {
            UnaryOperator<String> local = n -> memberName(n);
            UnaryOperator<IR.Ref> refs = r -> new IR.Ref(memberName(r.root()), suffix(r.suffix(), local, local));
            var params = function.params().stream()
                .map(p -> new IR.Param(memberName(p.name()), type(p.type()), p.dir()))
                .toList();
            var body = IrRewriter.rewrite(IrRewriter.renameAll(function.body(), refs, this::type), this::renameArgs);
            return new IR.Function(name, params, body);
        }

        /** Parameter names of user function blocks lose reserved words like the parameters did. */
        private IR.Stmt renameArgs(IR.Stmt stmt) {
            if (stmt instanceof IR.FbCall call && isRenamedFunction(call.fbType())) {
                return new IR.FbCall(call.instance(), call.fbType(), call.args().stream()
                    .map(a -> new IR.Arg(a.name().isEmpty() ? "" : memberName(a.name()), a.value()))
                    .toList());
            }
            return stmt;
        }

        /** Rewrites one statement whose nested bodies are already rewritten. */
        IR.Stmt statement(IR.Stmt stmt, List<IR.Program> units) {
            var module = moduleReference(stmt);
            if (module.isPresent()) {
                var text = StPrinter.printStatements(StEmitter.statements(List.of(stmt)), 0).strip();
                log.debug("{}: statement on I/O module {} disabled", program.name(), module.get());
                return new IR.Disabled(text, "I/O module reference " + module.get());
            }
            var message = messageTransfer(stmt, units);
            if (message.isPresent()) {
                return message.get();
            }
            return renameArgs(shallow(stmt));
        }

        private Optional<String> moduleReference(IR.Stmt stmt) {
            var found = new ArrayList<String>();
            IrRewriter.forEachOwnRef(stmt, ref -> {
                if (isModule(ref.root())) found.add(ref.root());
            });
            return found.stream().findFirst();
        }

        /** {@code m := MSG(m)} on a mapped channel becomes the transfer it performs. */
        private Optional<IR.Stmt> messageTransfer(IR.Stmt stmt, List<IR.Program> units) {
            if (!(stmt instanceof IR.Assign a)
                || !(a.value() instanceof IR.Call call)
                || !call.function().equalsIgnoreCase(AuxTemplate.MSG.functionName())) {
                return Optional.empty();
            }
            var params = program.lookupVar(a.target().root()).flatMap(IR.Var::message);
            if (params.isEmpty()) {
                return Optional.empty();
            }
            var msg = params.get();
            var target = config.controllerForChannel(msg.channel());
            if (target.isEmpty() || target.get() < 1 || target.get() > units.size()) {
                log.debug("{}: message {} on unmapped channel {} kept", program.name(), a.target().root(), msg.channel());
                return Optional.empty();
            }
            int remoteUnit = target.get();
            var remote = IR.Ref.parse(msg.remoteElement());
            var remoteName = units.get(remoteUnit - 1).lookupVar(remote.root())
                .flatMap(v -> table.lookup(remoteUnit, KIND.VAR, v.name()));
            if (remoteName.isEmpty()) {
                report(ErrorKind.UNDECLARED_REFERENCE, remote.root(),
                    "message " + a.target().root() + " targets " + remote.root()
                        + ", which controller " + remoteUnit + " does not declare");
                return Optional.empty();
            }
            var remoteRef = new IR.Ref(remoteName.get(), suffix(remote.suffix(), n -> memberName(n), n -> tag(remoteUnit, n)));
            var localRef = ref(IR.Ref.parse(msg.localElement()));
            log.debug("{}: message {} rewritten to a direct {}", program.name(), a.target().root(),
                msg.write() ? "write" : "read");
            return Optional.of(msg.write()
                ? new IR.Assign(remoteRef, localRef)
                : new IR.Assign(localRef, remoteRef));
        }

        private IR.Stmt shallow(IR.Stmt stmt) {
            if (stmt instanceof IR.If i) {
                return new IR.If(IrRewriter.rename(i.cond(), this::ref), i.then(), i.otherwise());
            } else if (stmt instanceof IR.ForLoop f) {
                return new IR.ForLoop(ref(f.counter()),
                    IrRewriter.rename(f.from(), this::ref),
                    IrRewriter.rename(f.to(), this::ref),
                    f.step().map(e -> IrRewriter.rename(e, this::ref)),
                    f.body());
            } else if (stmt instanceof IR.WhileLoop w) {
                return new IR.WhileLoop(IrRewriter.rename(w.cond(), this::ref), w.body());
            }
            return IrRewriter.rename(stmt, this::ref, this::type);
        }

        IR.Ref ref(IR.Ref ref) {
            return new IR.Ref(tag(unit, ref.root()), suffix(ref.suffix(), n -> memberName(n), n -> tag(unit, n)));
        }

        private String tag(int owner, String name) {
            if (owner == unit && program.lookupVar(name).isEmpty()) {
                report(ErrorKind.UNDECLARED_REFERENCE, name, "reference to undeclared tag " + name);
            }
            return table.lookup(owner, KIND.VAR, name).orElseGet(() -> reserved.rename(name));
        }

        private void report(ErrorKind kind, String name, String message) {
            if (reported.add(name.toLowerCase(Locale.ROOT))) {
                log.warn("{}: {}", program.name(), message);
                diagnostics.add(Diagnostic.of(kind, program.name(), message));
            }
        }
    }

    /**
     * Renames inside a reference suffix: members lose reserved words, identifiers used as
     * array indexes go through {@code tags}.
     */
    static String suffix(String suffix, UnaryOperator<String> members, UnaryOperator<String> tags) {
        var out = new StringBuilder();
        var matcher = IDENT.matcher(suffix);
        int depth = 0;
        int last = 0;
        while (matcher.find()) {
            for (int i = last; i < matcher.start(); i++) {
                char c = suffix.charAt(i);
                if (c == '[') depth++;
                if (c == ']') depth--;
            }
            out.append(suffix, last, matcher.start());
            var word = matcher.group();
            boolean member = matcher.start() > 0 && suffix.charAt(matcher.start() - 1) == '.';
            boolean digitBefore = matcher.start() > 0 && Character.isDigit(suffix.charAt(matcher.start() - 1));
            if (digitBefore) {
                out.append(word);
            } else if (member) {
                out.append(members.apply(word));
            } else if (depth > 0) {
                out.append(tags.apply(word));
            } else {
                out.append(word);
            }
            last = matcher.end();
        }
        out.append(suffix.substring(last));
        return out.toString();
    }
}
