package org.l5xst.st;

import java.util.*;
import java.util.stream.Collectors;

import org.l5xst.st.StAst.*;

/**
 * Renders {@link StAst} as Structured Text source.
 * Nested operator expressions are always parenthesised, so reading the text back yields the same tree.
 */
public class StPrinter {
    private final StringBuilder sb = new StringBuilder();

    public static String print(StAst ast) {
        var printer = new StPrinter();
        var first = true;
        for (var pou : ast.pous()) {
            if (!first) {
                printer.sb.append("\n");
            }
            printer.printPou(pou);
            first = false;
        }
        return printer.sb.toString();
    }

    /** Statements at the given indentation, one per line. */
    public static String printStatements(List<Stmt> stmts, int level) {
        var printer = new StPrinter();
        printer.printBody(stmts, level);
        return printer.sb.toString();
    }

    private void printPou(Pou pou) {
        if (pou instanceof TypeDecl t) {
            sb.append("TYPE\n");
            sb.append(indent(1)).append(t.name()).append(" :\n");
            sb.append(indent(1)).append("STRUCT\n");
            t.members().forEach(m -> printVarDecl(m, 2));
            sb.append(indent(1)).append("END_STRUCT;\n");
            sb.append("END_TYPE\n");
        } else if (pou instanceof FunctionDecl f) {
            if (f.isBlock()) {
                sb.append("FUNCTION_BLOCK ").append(f.name()).append("\n");
            } else {
                sb.append("FUNCTION ").append(f.name()).append(" : ").append(f.returnType().get()).append("\n");
            }
            printSections(f.sections());
            printBody(f.body(), 1);
            sb.append(f.isBlock() ? "END_FUNCTION_BLOCK\n" : "END_FUNCTION\n");
        } else if (pou instanceof ProgramDecl p) {
            sb.append("PROGRAM ").append(p.name()).append("\n");
            printSections(p.sections());
            printBody(p.body(), 1);
            sb.append("END_PROGRAM\n");
        } else if (pou instanceof ConfigurationDecl c) {
            sb.append("CONFIGURATION ").append(c.name()).append("\n");
            sb.append(indent(1)).append("RESOURCE ").append(c.resource()).append(" ON ").append(c.target()).append("\n");
            sb.append(indent(2)).append("TASK ").append(c.task())
                .append("(INTERVAL := ").append(c.interval())
                .append(", PRIORITY := ").append(c.priority()).append(");\n");
            sb.append(indent(2)).append("PROGRAM ").append(c.instance())
                .append(" WITH ").append(c.task()).append(" : ").append(c.program()).append(";\n");
            sb.append(indent(1)).append("END_RESOURCE\n");
            sb.append("END_CONFIGURATION\n");
        } else if (pou instanceof Verbatim v) {
            sb.append(v.text().strip()).append("\n");
        }
    }

    private void printSections(List<VarSection> sections) {
        for (var section : sections) {
            sb.append(indent(1)).append(section.kind()).append("\n");
            section.decls().forEach(d -> printVarDecl(d, 2));
            sb.append(indent(1)).append("END_VAR\n");
        }
    }

    private void printVarDecl(VarDecl decl, int level) {
        sb.append(indent(level)).append(decl.name()).append(" : ");
        if (!decl.dims().isEmpty()) {
            var ranges = decl.dims().stream().map(n -> "0.." + (n - 1)).collect(Collectors.joining(", "));
            sb.append("ARRAY [").append(ranges).append("] OF ");
        }
        sb.append(decl.type());
        decl.init().ifPresent(v -> sb.append(" := ").append(v));
        sb.append(";\n");
    }

    // --- Statements ---

    private void printBody(List<Stmt> stmts, int level) {
        stmts.forEach(s -> printStmt(s, level));
    }

    private void printStmt(Stmt stmt, int level) {
        if (stmt instanceof Assign a) {
            sb.append(indent(level)).append(a.target().text()).append(" := ").append(expr(a.value())).append(";\n");
        } else if (stmt instanceof IfChain chain) {
            for (int i = 0; i < chain.branches().size(); i++) {
                var branch = chain.branches().get(i);
                sb.append(indent(level)).append(i == 0 ? "IF " : "ELSIF ")
                    .append(expr(branch.cond())).append(" THEN\n");
                printBody(branch.body(), level + 1);
            }
            if (!chain.otherwise().isEmpty()) {
                sb.append(indent(level)).append("ELSE\n");
                printBody(chain.otherwise(), level + 1);
            }
            sb.append(indent(level)).append("END_IF;\n");
        } else if (stmt instanceof Case c) {
            sb.append(indent(level)).append("CASE ").append(expr(c.selector())).append(" OF\n");
            for (var arm : c.arms()) {
                var labels = arm.labels().stream()
                    .map(l -> l.from() + l.to().map(to -> ".." + to).orElse(""))
                    .collect(Collectors.joining(", "));
                sb.append(indent(level + 1)).append(labels).append(":\n");
                printBody(arm.body(), level + 2);
            }
            if (!c.otherwise().isEmpty()) {
                sb.append(indent(level)).append("ELSE\n");
                printBody(c.otherwise(), level + 1);
            }
            sb.append(indent(level)).append("END_CASE;\n");
        } else if (stmt instanceof For f) {
            sb.append(indent(level)).append("FOR ").append(f.counter())
                .append(" := ").append(expr(f.from()))
                .append(" TO ").append(expr(f.to()));
            f.by().ifPresent(by -> sb.append(" BY ").append(expr(by)));
            sb.append(" DO\n");
            printBody(f.body(), level + 1);
            sb.append(indent(level)).append("END_FOR;\n");
        } else if (stmt instanceof While w) {
            sb.append(indent(level)).append("WHILE ").append(expr(w.cond())).append(" DO\n");
            printBody(w.body(), level + 1);
            sb.append(indent(level)).append("END_WHILE;\n");
        } else if (stmt instanceof CallStmt call) {
            sb.append(indent(level)).append(call.name()).append("(").append(args(call.args())).append(");\n");
        } else if (stmt instanceof Pragma p) {
            sb.append(indent(level)).append("(*#DISABLED ").append(p.reason());
            if (!p.text().isEmpty()) {
                sb.append(" | ").append(p.text());
            }
            sb.append(" *)\n");
        } else if (stmt instanceof Comment c) {
            sb.append(indent(level)).append("(* ").append(c.text()).append(" *)\n");
        }
    }

    // --- Expressions ---

    public static String expr(Expr expr) {
        if (expr instanceof Name n) {
            return n.text();
        } else if (expr instanceof Lit lit) {
            return lit.text();
        } else if (expr instanceof UnaryOp u) {
            var separator = u.op().equals("-") ? "" : " ";
            return u.op() + separator + operand(u.operand(), true);
        } else if (expr instanceof BinaryOp b) {
            return operand(b.left(), false) + " " + b.op() + " " + operand(b.right(), false);
        } else if (expr instanceof FnCall call) {
            return call.name() + "(" + args(call.args()) + ")";
        }
        throw new IllegalStateException("unknown expression " + expr);
    }

    private static String operand(Expr e, boolean underUnary) {
        if (e instanceof BinaryOp || e instanceof UnaryOp) {
            return "(" + expr(e) + ")";
        }
        if (underUnary && e instanceof Lit lit && lit.text().startsWith("-")) {
            return "(" + lit.text() + ")";
        }
        return expr(e);
    }

    private static String args(List<CallArg> args) {
        return args.stream()
            .map(a -> a.name().map(n -> n + " := ").orElse("") + expr(a.value()))
            .collect(Collectors.joining(", "));
    }

    private static String indent(int level) {
        return "    ".repeat(level);
    }
}
