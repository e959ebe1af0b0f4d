package org.l5xst.ir;

import java.util.*;
import java.util.regex.Pattern;

import org.l5xst.Diagnostic;

/**
 * Syntax-neutral program model shared by both translation directions.
 *
 * <p>Ladder and FBD translators lower into {@link Stmt}; the ST and L5X emitters read
 * only from it. Equality is structural, which is what the fidelity scorer compares.
 */
public final class IR {
    private IR() {}

    public enum SCOPE { CONTROLLER, PROGRAM }

    public enum TAG_KIND { BASE, ALIAS, PRODUCED, CONSUMED }

    public enum ROUTINE_KIND { LADDER, FBD, TEXT }

    public enum PARAM_DIR { INPUT, OUTPUT, IN_OUT, LOCAL }

    // ==========================================================
    // Declarations
    // ==========================================================

    public record Program(
        String name,
        List<Var> vars,
        List<Struct> types,
        List<Function> functions,
        List<Routine> routines
    ) {
        public Program {
            vars = List.copyOf(vars);
            types = List.copyOf(types);
            functions = List.copyOf(functions);
            routines = List.copyOf(routines);
        }

        /** All routine bodies in execution order. */
        public List<Stmt> statements() {
            var all = new ArrayList<Stmt>();
            for (var routine : routines) {
                all.addAll(routine.body());
            }
            return all;
        }

        public Optional<Var> lookupVar(String name) {
            for (var v : vars) {
                if (v.name().equalsIgnoreCase(name)) {
                    return Optional.of(v);
                }
            }
            return Optional.empty();
        }
    }

    /** A tag declaration. */
    public record Var(
        String name,
        String type,
        List<Integer> dims,
        SCOPE scope,
        TAG_KIND kind,
        Optional<String> initialValue,
        Optional<String> aliasFor,
        Optional<Message> message
    ) {
        public Var {
            dims = List.copyOf(dims);
        }

        public static Var of(String name, String type) {
            return new Var(name, type, List.of(), SCOPE.PROGRAM, TAG_KIND.BASE,
                Optional.empty(), Optional.empty(), Optional.empty());
        }

        public Var withName(String newName) {
            return new Var(newName, type, dims, scope, kind, initialValue, aliasFor, message);
        }

        public Var withType(String newType) {
            return new Var(name, newType, dims, scope, kind, initialValue, aliasFor, message);
        }
    }

    /**
     * Parameters of a message instruction tag.
     * {@code channel} is the first segment of the connection path.
     */
    public record Message(String channel, String localElement, String remoteElement, boolean write) {}

    public record Member(String name, String type, List<Integer> dims) {
        public Member {
            dims = List.copyOf(dims);
        }
    }

    public record Struct(String name, List<Member> members) {
        public Struct {
            members = List.copyOf(members);
        }
    }

    public record Param(String name, String type, PARAM_DIR dir) {}

    /** User-defined function block (an add-on instruction in the source format). */
    public record Function(String name, List<Param> params, List<Stmt> body) {
        public Function {
            params = List.copyOf(params);
            body = List.copyOf(body);
        }
    }

    public record Routine(String name, ROUTINE_KIND kind, List<Stmt> body) {
        public Routine {
            body = List.copyOf(body);
        }
    }

    /** Translator output for one rung or sheet. */
    public record Fragment(List<Stmt> stmts, List<Var> synthesized, List<Diagnostic> diagnostics) {
        public Fragment {
            stmts = List.copyOf(stmts);
            synthesized = List.copyOf(synthesized);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    // ==========================================================
    // Statements
    // ==========================================================

    public sealed interface Stmt permits Assign, If, FbCall, Invoke, ForLoop, WhileLoop, Disabled {}

    public record Assign(Ref target, Expr value) implements Stmt {}

    public record If(Expr cond, List<Stmt> then, List<Stmt> otherwise) implements Stmt {
        public If {
            then = List.copyOf(then);
            otherwise = List.copyOf(otherwise);
        }

        public static If when(Expr cond, Stmt... then) {
            return new If(cond, List.of(then), List.of());
        }
    }

    /** Call of a function-block instance with named arguments. */
    public record FbCall(String instance, String fbType, List<Arg> args) implements Stmt {
        public FbCall {
            args = List.copyOf(args);
        }
    }

    /** Call of a function for its side effect, positional arguments. */
    public record Invoke(String function, List<Expr> args) implements Stmt {
        public Invoke {
            args = List.copyOf(args);
        }
    }

    public record ForLoop(Ref counter, Expr from, Expr to, Optional<Expr> step, List<Stmt> body) implements Stmt {
        public ForLoop {
            body = List.copyOf(body);
        }
    }

    public record WhileLoop(Expr cond, List<Stmt> body) implements Stmt {
        public WhileLoop {
            body = List.copyOf(body);
        }
    }

    /**
     * A statement kept as text only: unsupported instructions, module references, skipped sheets.
     */
    public record Disabled(String text, String reason) implements Stmt {
        public Disabled {
            text = text.replace("*)", "* )").replace("\r", " ").replace("\n", " ").strip();
            reason = reason.replace("*)", "* )").replace("|", "/").replace("\r", " ").replace("\n", " ").strip();
        }
    }

    public record Arg(String name, Expr value) {}

    // ==========================================================
    // Expressions
    // ==========================================================

    public sealed interface Expr permits Ref, Literal, Unary, Binary, Call {}

    /**
     * Reference to a tag. {@code root} is the declared name, {@code suffix} the member,
     * index or bit path after it ({@code ".DN"}, {@code "[3].Level"}, {@code ".5"}).
     */
    public record Ref(String root, String suffix) implements Expr {
        public static Ref to(String name) {
            return new Ref(name, "");
        }

        public static Ref parse(String path) {
            var text = path.strip();
            int cut = text.length();
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '.' || c == '[') {
                    cut = i;
                    break;
                }
            }
            return new Ref(text.substring(0, cut), text.substring(cut));
        }

        public Ref member(String name) {
            return new Ref(root, suffix + "." + name);
        }

        public String path() {
            return root + suffix;
        }
    }

    public enum LIT { BOOL, INT, REAL, TIME, STRING }

    public record Literal(LIT kind, String text) implements Expr {
        public static final Literal TRUE = new Literal(LIT.BOOL, "TRUE");
        public static final Literal FALSE = new Literal(LIT.BOOL, "FALSE");
        public static final Literal ZERO = new Literal(LIT.INT, "0");

        private static final Pattern INT = Pattern.compile("-?(\\d[\\d_]*|16#[0-9A-Fa-f_]+|8#[0-7_]+|2#[01_]+)");
        private static final Pattern REAL = Pattern.compile("-?\\d+\\.\\d+([eE][+-]?\\d+)?");
        private static final Pattern TIME = Pattern.compile("(?i)(T|TIME)#-?[0-9a-z_.]+");
        private static final Pattern STRING = Pattern.compile("'([^'$]|\\$.)*'");

        public static Optional<Literal> tryParse(String raw) {
            var text = raw.strip();
            if (text.equalsIgnoreCase("TRUE")) return Optional.of(TRUE);
            if (text.equalsIgnoreCase("FALSE")) return Optional.of(FALSE);
            if (INT.matcher(text).matches()) return Optional.of(new Literal(LIT.INT, text));
            if (REAL.matcher(text).matches()) return Optional.of(new Literal(LIT.REAL, text));
            if (TIME.matcher(text).matches()) return Optional.of(new Literal(LIT.TIME, text));
            if (STRING.matcher(text).matches()) return Optional.of(new Literal(LIT.STRING, text));
            return Optional.empty();
        }

        public static Literal integer(long value) {
            return new Literal(LIT.INT, Long.toString(value));
        }

        public static Literal millis(String value) {
            return new Literal(LIT.TIME, "T#" + value + "ms");
        }
    }

    public record Unary(Op op, Expr operand) implements Expr {}

    public record Binary(Op op, Expr left, Expr right) implements Expr {}

    /** Function call used as a value. */
    public record Call(String function, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }
    }

    public enum Op {
        NOT("NOT"), NEG("-"),
        POW("**"), MUL("*"), DIV("/"), MOD("MOD"), ADD("+"), SUB("-"),
        LT("<"), GT(">"), LE("<="), GE(">="), EQ("="), NE("<>"),
        AND("AND"), XOR("XOR"), OR("OR");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean unary() {
            return this == NOT || this == NEG;
        }

        public static Op binary(String symbol) {
            if (symbol.equals("&")) return AND;
            for (var op : values()) {
                if (!op.unary() && op.symbol.equalsIgnoreCase(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("not a binary operator: " + symbol);
        }

        public static Op prefix(String symbol) {
            if (symbol.equals("-")) return NEG;
            if (symbol.equalsIgnoreCase("NOT")) return NOT;
            throw new IllegalArgumentException("not a prefix operator: " + symbol);
        }
    }

    // ==========================================================
    // Builders
    // ==========================================================

    public static Expr and(Expr a, Expr b) {
        if (a.equals(Literal.TRUE)) return b;
        if (b.equals(Literal.TRUE)) return a;
        return new Binary(Op.AND, a, b);
    }

    public static Expr or(Expr a, Expr b) {
        if (a.equals(b)) return a;
        return new Binary(Op.OR, a, b);
    }

    public static Expr not(Expr e) {
        return new Unary(Op.NOT, e);
    }

    /** Numeric literals fold the sign in, so {@code -5} is one literal however it was written. */
    public static Expr negate(Expr e) {
        if (e instanceof Literal lit && (lit.kind() == LIT.INT || lit.kind() == LIT.REAL)) {
            var text = lit.text().startsWith("-") ? lit.text().substring(1) : "-" + lit.text();
            return new Literal(lit.kind(), text);
        }
        return new Unary(Op.NEG, e);
    }
}
