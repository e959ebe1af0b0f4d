package org.l5xst.ir;

import java.util.*;

/**
 * Executes boolean and integer IR over a tag map, one scan per call. Function-block calls are
 * recorded, not run.
 */
public final class IrEval {
    private final Map<String, Object> tags = new HashMap<>();
    public final List<IR.FbCall> calls = new ArrayList<>();

    public IrEval set(String path, Object value) {
        tags.put(key(path), value);
        return this;
    }

    public Object get(String path) {
        return tags.get(key(path));
    }

    public boolean bool(String path) {
        return (Boolean) tags.getOrDefault(key(path), false);
    }

    public void run(List<IR.Stmt> stmts) {
        for (var stmt : stmts) {
            exec(stmt);
        }
    }

    private void exec(IR.Stmt stmt) {
        if (stmt instanceof IR.Assign a) {
            tags.put(key(a.target().path()), eval(a.value()));
        } else if (stmt instanceof IR.If i) {
            run((Boolean) eval(i.cond()) ? i.then() : i.otherwise());
        } else if (stmt instanceof IR.FbCall call) {
            calls.add(call);
        } else {
            throw new IllegalArgumentException("cannot run " + stmt);
        }
    }

    public Object eval(IR.Expr expr) {
        if (expr instanceof IR.Literal lit) {
            return switch (lit.kind()) {
                case BOOL -> lit.text().equalsIgnoreCase("TRUE");
                case INT -> Long.parseLong(lit.text());
                default -> throw new IllegalArgumentException("literal " + lit);
            };
        }
        if (expr instanceof IR.Ref ref) {
            var value = tags.get(key(ref.path()));
            return value == null ? Boolean.FALSE : value;
        }
        if (expr instanceof IR.Unary u) {
            var v = eval(u.operand());
            return u.op() == IR.Op.NOT ? !(Boolean) v : -(Long) v;
        }
        var b = (IR.Binary) expr;
        var l = eval(b.left());
        var r = eval(b.right());
        return switch (b.op()) {
            case AND -> (Boolean) l && (Boolean) r;
            case OR -> (Boolean) l || (Boolean) r;
            case XOR -> (Boolean) l ^ (Boolean) r;
            case EQ -> l.equals(r);
            case NE -> !l.equals(r);
            case LT -> (Long) l < (Long) r;
            case LE -> (Long) l <= (Long) r;
            case GT -> (Long) l > (Long) r;
            case GE -> (Long) l >= (Long) r;
            case ADD -> (Long) l + (Long) r;
            case SUB -> (Long) l - (Long) r;
            case MUL -> (Long) l * (Long) r;
            case DIV -> (Long) l / (Long) r;
            case MOD -> (Long) l % (Long) r;
            default -> throw new IllegalArgumentException("operator " + b.op());
        };
    }

    private static String key(String path) {
        return path.toLowerCase(Locale.ROOT);
    }
}
