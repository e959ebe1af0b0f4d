package org.l5xst.ir;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.Diagnostic;
import org.l5xst.ErrorKind;
import org.l5xst.tables.TypeTable;

/**
 * Makes integer-to-real assignments explicit, which the source format allows implicitly.
 * Integer literals gain a fractional part, integer tags are wrapped in a conversion call.
 */
public class TypeCoercion {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("consolidate");

    public record Result(IR.Program program, List<Diagnostic> diagnostics) {
        public Result {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    public Result apply(IR.Program program) {
        var diagnostics = new ArrayList<Diagnostic>();
        var structs = new HashMap<String, IR.Struct>();
        program.types().forEach(t -> structs.put(key(t.name()), t));

        var globals = new HashMap<String, String>();
        program.vars().forEach(v -> globals.put(key(v.name()), v.type()));
        var routines = program.routines().stream()
            .map(r -> new IR.Routine(r.name(), r.kind(), coerce(r.body(), globals, structs, r.name(), diagnostics)))
            .toList();

        var functions = new ArrayList<IR.Function>();
        for (var f : program.functions()) {
            var locals = new HashMap<String, String>();
            f.params().forEach(p -> locals.put(key(p.name()), p.type()));
            functions.add(new IR.Function(f.name(), f.params(), coerce(f.body(), locals, structs, f.name(), diagnostics)));
        }
        return new Result(
            new IR.Program(program.name(), program.vars(), program.types(), functions, routines),
            diagnostics
        );
    }

    private List<IR.Stmt> coerce(
        List<IR.Stmt> body, Map<String, String> vars, Map<String, IR.Struct> structs,
        String location, List<Diagnostic> diagnostics
    ) {
        return IrRewriter.rewrite(body, stmt -> {
            if (!(stmt instanceof IR.Assign a)) {
                return stmt;
            }
            var target = typeOf(a.target(), vars, structs);
            if (target.isEmpty() || !TypeTable.isReal(target.get())) {
                return stmt;
            }
            var converted = toReal(a.value(), target.get(), vars, structs);
            if (converted.isEmpty()) {
                return stmt;
            }
            var message = "integer value assigned to " + target.get() + " " + a.target().path() + ", converted";
            log.warn("{}: {}", location, message);
            diagnostics.add(Diagnostic.of(ErrorKind.TYPE_MISMATCH, location, message));
            return new IR.Assign(a.target(), converted.get());
        });
    }

    /** Real-valued builtins whose arguments are converted along with the result. */
    private static final Set<String> REAL_FUNCTIONS = Set.of(
        "ABS", "SQRT", "LN", "LOG", "EXP", "SIN", "COS", "TAN", "ASIN", "ACOS", "ATAN", "MIN", "MAX", "LIMIT"
    );

    private static final Set<IR.Op> ARITHMETIC = EnumSet.of(
        IR.Op.NEG, IR.Op.POW, IR.Op.MUL, IR.Op.DIV, IR.Op.ADD, IR.Op.SUB
    );

    /**
     * Converts the integer parts of a value assigned to a real. Arithmetic converts its
     * operands, {@code MOD} is integer-only and converts its result.
     */
    private Optional<IR.Expr> toReal(IR.Expr value, String realType, Map<String, String> vars, Map<String, IR.Struct> structs) {
        if (value instanceof IR.Literal lit && lit.kind() == IR.LIT.INT && lit.text().matches("-?\\d+")) {
            return Optional.of(new IR.Literal(IR.LIT.REAL, lit.text() + ".0"));
        }
        if (value instanceof IR.Ref ref) {
            var source = typeOf(ref, vars, structs);
            if (source.isPresent() && TypeTable.isInteger(source.get())) {
                return Optional.of(convert(ref, source.get(), realType));
            }
        }
        if (value instanceof IR.Unary u && ARITHMETIC.contains(u.op())) {
            return toReal(u.operand(), realType, vars, structs).map(operand -> new IR.Unary(u.op(), operand));
        }
        if (value instanceof IR.Binary b && ARITHMETIC.contains(b.op())) {
            var left = toReal(b.left(), realType, vars, structs);
            var right = toReal(b.right(), realType, vars, structs);
            if (left.isEmpty() && right.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new IR.Binary(b.op(), left.orElse(b.left()), right.orElse(b.right())));
        }
        if (value instanceof IR.Binary b && b.op() == IR.Op.MOD) {
            return integerType(b, vars, structs).map(type -> convert(b, type, realType));
        }
        if (value instanceof IR.Call call && REAL_FUNCTIONS.contains(call.function().toUpperCase(Locale.ROOT))) {
            var args = new ArrayList<IR.Expr>();
            boolean changed = false;
            for (var arg : call.args()) {
                var converted = toReal(arg, realType, vars, structs);
                changed |= converted.isPresent();
                args.add(converted.orElse(arg));
            }
            return changed ? Optional.of(new IR.Call(call.function(), args)) : Optional.empty();
        }
        return Optional.empty();
    }

    /** Integer type of an expression built only from integer literals and tags. */
    private Optional<String> integerType(IR.Expr value, Map<String, String> vars, Map<String, IR.Struct> structs) {
        if (value instanceof IR.Literal lit) {
            return lit.kind() == IR.LIT.INT ? Optional.of("DINT") : Optional.empty();
        }
        if (value instanceof IR.Ref ref) {
            return typeOf(ref, vars, structs).filter(TypeTable::isInteger);
        }
        if (value instanceof IR.Unary u && u.op() == IR.Op.NEG) {
            return integerType(u.operand(), vars, structs);
        }
        if (value instanceof IR.Binary b && (ARITHMETIC.contains(b.op()) || b.op() == IR.Op.MOD)) {
            var left = integerType(b.left(), vars, structs);
            var right = integerType(b.right(), vars, structs);
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            return b.left() instanceof IR.Literal ? right : left;
        }
        return Optional.empty();
    }

    private static IR.Expr convert(IR.Expr value, String from, String realType) {
        var function = from.toUpperCase(Locale.ROOT) + "_TO_" + realType.toUpperCase(Locale.ROOT);
        return new IR.Call(function, List.of(value));
    }

    /** Declared type of a tag path, following struct members; array indexes are skipped. */
    static Optional<String> typeOf(IR.Ref ref, Map<String, String> vars, Map<String, IR.Struct> structs) {
        var type = vars.get(key(ref.root()));
        var suffix = ref.suffix().replaceAll("\\[[^\\]]*\\]", "");
        if (type == null) {
            return Optional.empty();
        }
        if (suffix.isEmpty()) {
            return Optional.of(type);
        }
        for (var member : suffix.substring(1).split("\\.")) {
            var struct = structs.get(key(type));
            if (struct == null || member.isEmpty()) {
                return Optional.empty();
            }
            type = null;
            for (var m : struct.members()) {
                if (m.name().equalsIgnoreCase(member)) {
                    type = m.type();
                }
            }
            if (type == null) {
                return Optional.empty();
            }
        }
        return Optional.of(type);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
