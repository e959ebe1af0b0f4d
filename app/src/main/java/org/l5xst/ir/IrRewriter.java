package org.l5xst.ir;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Structural traversals over IR statements.
 */
public final class IrRewriter {
    private IrRewriter() {}

    /**
     * Rewrites tag references and function-block type names throughout {@code stmt}.
     * Function-block instances are tag references too and go through {@code refs}.
     */
    public static IR.Stmt rename(IR.Stmt stmt, UnaryOperator<IR.Ref> refs, UnaryOperator<String> types) {
        if (stmt instanceof IR.Assign a) {
            return new IR.Assign(refs.apply(a.target()), rename(a.value(), refs));
        } else if (stmt instanceof IR.If i) {
            return new IR.If(
                rename(i.cond(), refs),
                renameAll(i.then(), refs, types),
                renameAll(i.otherwise(), refs, types)
            );
        } else if (stmt instanceof IR.FbCall c) {
            var args = c.args().stream()
                .map(arg -> new IR.Arg(arg.name(), rename(arg.value(), refs)))
                .toList();
            return new IR.FbCall(refs.apply(IR.Ref.to(c.instance())).root(), types.apply(c.fbType()), args);
        } else if (stmt instanceof IR.Invoke inv) {
            return new IR.Invoke(inv.function(), inv.args().stream().map(e -> rename(e, refs)).toList());
        } else if (stmt instanceof IR.ForLoop f) {
            return new IR.ForLoop(
                refs.apply(f.counter()),
                rename(f.from(), refs),
                rename(f.to(), refs),
                f.step().map(e -> rename(e, refs)),
                renameAll(f.body(), refs, types)
            );
        } else if (stmt instanceof IR.WhileLoop w) {
            return new IR.WhileLoop(rename(w.cond(), refs), renameAll(w.body(), refs, types));
        }
        return stmt;
    }

    public static List<IR.Stmt> renameAll(List<IR.Stmt> stmts, UnaryOperator<IR.Ref> refs, UnaryOperator<String> types) {
        return stmts.stream().map(s -> rename(s, refs, types)).toList();
    }

    public static IR.Expr rename(IR.Expr expr, UnaryOperator<IR.Ref> refs) {
        if (expr instanceof IR.Ref r) {
            return refs.apply(r);
        } else if (expr instanceof IR.Unary u) {
            return new IR.Unary(u.op(), rename(u.operand(), refs));
        } else if (expr instanceof IR.Binary b) {
            return new IR.Binary(b.op(), rename(b.left(), refs), rename(b.right(), refs));
        } else if (expr instanceof IR.Call c) {
            return new IR.Call(c.function(), c.args().stream().map(e -> rename(e, refs)).toList());
        }
        return expr;
    }

    /**
     * Applies {@code f} bottom-up: nested bodies are rewritten before their parent is handed to {@code f}.
     */
    public static List<IR.Stmt> rewrite(List<IR.Stmt> stmts, UnaryOperator<IR.Stmt> f) {
        var out = new ArrayList<IR.Stmt>(stmts.size());
        for (var stmt : stmts) {
            IR.Stmt inner = stmt;
            if (stmt instanceof IR.If i) {
                inner = new IR.If(i.cond(), rewrite(i.then(), f), rewrite(i.otherwise(), f));
            } else if (stmt instanceof IR.ForLoop l) {
                inner = new IR.ForLoop(l.counter(), l.from(), l.to(), l.step(), rewrite(l.body(), f));
            } else if (stmt instanceof IR.WhileLoop w) {
                inner = new IR.WhileLoop(w.cond(), rewrite(w.body(), f));
            }
            out.add(f.apply(inner));
        }
        return out;
    }

    /** Visits every tag reference of {@code stmt}, nested bodies excluded. */
    public static void forEachOwnRef(IR.Stmt stmt, Consumer<IR.Ref> visitor) {
        if (stmt instanceof IR.Assign a) {
            visitor.accept(a.target());
            forEachRef(a.value(), visitor);
        } else if (stmt instanceof IR.If i) {
            forEachRef(i.cond(), visitor);
        } else if (stmt instanceof IR.FbCall c) {
            visitor.accept(IR.Ref.to(c.instance()));
            c.args().forEach(arg -> forEachRef(arg.value(), visitor));
        } else if (stmt instanceof IR.Invoke inv) {
            inv.args().forEach(e -> forEachRef(e, visitor));
        } else if (stmt instanceof IR.ForLoop f) {
            visitor.accept(f.counter());
            forEachRef(f.from(), visitor);
            forEachRef(f.to(), visitor);
            f.step().ifPresent(e -> forEachRef(e, visitor));
        } else if (stmt instanceof IR.WhileLoop w) {
            forEachRef(w.cond(), visitor);
        }
    }

    public static void forEachRef(IR.Stmt stmt, Consumer<IR.Ref> visitor) {
        forEachOwnRef(stmt, visitor);
        children(stmt).forEach(child -> forEachRef(child, visitor));
    }

    public static void forEachRef(IR.Expr expr, Consumer<IR.Ref> visitor) {
        if (expr instanceof IR.Ref r) {
            visitor.accept(r);
        } else if (expr instanceof IR.Unary u) {
            forEachRef(u.operand(), visitor);
        } else if (expr instanceof IR.Binary b) {
            forEachRef(b.left(), visitor);
            forEachRef(b.right(), visitor);
        } else if (expr instanceof IR.Call c) {
            c.args().forEach(e -> forEachRef(e, visitor));
        }
    }

    /** Names of every function called as a value or invoked as a statement. */
    public static void forEachFunction(IR.Stmt stmt, Consumer<String> visitor) {
        if (stmt instanceof IR.Invoke inv) {
            visitor.accept(inv.function());
        }
        Consumer<IR.Expr> exprs = e -> forEachFunction(e, visitor);
        if (stmt instanceof IR.Assign a) {
            exprs.accept(a.value());
        } else if (stmt instanceof IR.If i) {
            exprs.accept(i.cond());
        } else if (stmt instanceof IR.FbCall c) {
            c.args().forEach(arg -> exprs.accept(arg.value()));
        } else if (stmt instanceof IR.Invoke inv) {
            inv.args().forEach(exprs);
        } else if (stmt instanceof IR.ForLoop f) {
            exprs.accept(f.from());
            exprs.accept(f.to());
            f.step().ifPresent(exprs);
        } else if (stmt instanceof IR.WhileLoop w) {
            exprs.accept(w.cond());
        }
        children(stmt).forEach(child -> forEachFunction(child, visitor));
    }

    private static void forEachFunction(IR.Expr expr, Consumer<String> visitor) {
        if (expr instanceof IR.Call c) {
            visitor.accept(c.function());
            c.args().forEach(e -> forEachFunction(e, visitor));
        } else if (expr instanceof IR.Unary u) {
            forEachFunction(u.operand(), visitor);
        } else if (expr instanceof IR.Binary b) {
            forEachFunction(b.left(), visitor);
            forEachFunction(b.right(), visitor);
        }
    }

    public static List<IR.Stmt> children(IR.Stmt stmt) {
        if (stmt instanceof IR.If i) {
            var all = new ArrayList<IR.Stmt>(i.then());
            all.addAll(i.otherwise());
            return all;
        } else if (stmt instanceof IR.ForLoop f) {
            return f.body();
        } else if (stmt instanceof IR.WhileLoop w) {
            return w.body();
        }
        return List.of();
    }
}
