package org.l5xst.st;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.ir.IR;
import org.l5xst.tables.AuxTemplate;

/**
 * Lowers a Structured Text syntax tree into the IR.
 *
 * <p>{@code ELSIF} chains become nested conditionals, {@code CASE} becomes a chain of
 * equality tests, calls on declared function-block instances become {@link IR.FbCall}.
 * Template assets are recognised by name and left out.
 */
public class StToIr {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("st-parser");

    public static final String ROUTINE_NAME = "MainRoutine";

    public IR.Program toIR(StAst ast, String origin) {
        var types = new ArrayList<IR.Struct>();
        var functions = new ArrayList<IR.Function>();
        var vars = new ArrayList<IR.Var>();
        var routines = new ArrayList<IR.Routine>();
        String programName = null;

        for (var pou : ast.pous()) {
            if (pou instanceof StAst.TypeDecl t) {
                if (AuxTemplate.forStruct(t.name()).isPresent()) continue;
                types.add(new IR.Struct(t.name(), t.members().stream()
                    .map(m -> new IR.Member(m.name(), m.type(), m.dims()))
                    .toList()));
            } else if (pou instanceof StAst.FunctionDecl f) {
                if (AuxTemplate.forFunction(f.name()).isPresent()) continue;
                functions.add(lowerFunction(f, origin));
            } else if (pou instanceof StAst.ProgramDecl p) {
                var declared = new ArrayList<IR.Var>();
                for (var section : p.sections()) {
                    for (var decl : section.decls()) {
                        declared.add(new IR.Var(decl.name(), decl.type(), decl.dims(),
                            IR.SCOPE.CONTROLLER, IR.TAG_KIND.BASE, decl.init(), Optional.empty(), Optional.empty()));
                    }
                }
                vars.addAll(declared);
                var scope = typesOf(vars);
                var routineName = programName == null ? ROUTINE_NAME : p.name();
                routines.add(new IR.Routine(routineName, IR.ROUTINE_KIND.TEXT,
                    lowerStatements(p.body(), scope, origin + "/" + p.name())));
                if (programName == null) {
                    programName = p.name();
                }
            } else if (pou instanceof StAst.ConfigurationDecl c) {
                log.debug("{}: configuration {} binds {} to task {}", origin, c.name(), c.program(), c.task());
            }
        }
        if (programName == null) {
            throw new ConversionException(
                ErrorKind.MALFORMED_ST_SYNTAX, origin,
                "no PROGRAM declaration",
                "the merged logic must live in one PROGRAM ... END_PROGRAM block"
            );
        }
        return new IR.Program(programName, vars, types, functions, routines);
    }

    private IR.Function lowerFunction(StAst.FunctionDecl f, String origin) {
        if (!f.isBlock()) {
            log.warn("{}: FUNCTION {} is kept as a function block, its return type {} is dropped",
                origin, f.name(), f.returnType().orElse(""));
        }
        var params = new ArrayList<IR.Param>();
        var scope = new HashMap<String, String>();
        for (var section : f.sections()) {
            var dir = switch (section.kind()) {
                case VAR_INPUT -> IR.PARAM_DIR.INPUT;
                case VAR_OUTPUT -> IR.PARAM_DIR.OUTPUT;
                case VAR_IN_OUT -> IR.PARAM_DIR.IN_OUT;
                default -> IR.PARAM_DIR.LOCAL;
            };
            for (var decl : section.decls()) {
                params.add(new IR.Param(decl.name(), decl.type(), dir));
                scope.put(decl.name().toLowerCase(Locale.ROOT), decl.type());
            }
        }
        return new IR.Function(f.name(), params, lowerStatements(f.body(), scope, origin + "/" + f.name()));
    }

    private static Map<String, String> typesOf(List<IR.Var> vars) {
        var scope = new HashMap<String, String>();
        for (var v : vars) {
            scope.put(v.name().toLowerCase(Locale.ROOT), v.type());
        }
        return scope;
    }

    // ==========================================================
    // Statements
    // ==========================================================

    /**
     * @param scope declared variable types keyed by lower-case name, used to tell
     *              function-block calls from function invocations
     */
    public List<IR.Stmt> lowerStatements(List<StAst.Stmt> stmts, Map<String, String> scope, String origin) {
        var out = new ArrayList<IR.Stmt>();
        for (var stmt : stmts) {
            lower(stmt, scope, origin).ifPresent(out::add);
        }
        return out;
    }

    private Optional<IR.Stmt> lower(StAst.Stmt stmt, Map<String, String> scope, String origin) {
        if (stmt instanceof StAst.Assign a) {
            return Optional.of(new IR.Assign(
                new IR.Ref(a.target().root(), a.target().suffix()),
                lowerExpr(a.value(), origin)
            ));
        } else if (stmt instanceof StAst.IfChain chain) {
            return Optional.of(lowerChain(chain.branches(), 0, chain.otherwise(), scope, origin));
        } else if (stmt instanceof StAst.Case c) {
            return Optional.of(lowerCase(c, 0, scope, origin));
        } else if (stmt instanceof StAst.For f) {
            return Optional.of(new IR.ForLoop(
                IR.Ref.to(f.counter()),
                lowerExpr(f.from(), origin),
                lowerExpr(f.to(), origin),
                f.by().map(e -> lowerExpr(e, origin)),
                lowerStatements(f.body(), scope, origin)
            ));
        } else if (stmt instanceof StAst.While w) {
            return Optional.of(new IR.WhileLoop(lowerExpr(w.cond(), origin), lowerStatements(w.body(), scope, origin)));
        } else if (stmt instanceof StAst.CallStmt call) {
            return Optional.of(lowerCall(call, scope, origin));
        } else if (stmt instanceof StAst.Pragma p) {
            return Optional.of(new IR.Disabled(p.text(), p.reason()));
        }
        return Optional.empty();
    }

    private IR.Stmt lowerChain(
        List<StAst.Branch> branches, int index, List<StAst.Stmt> otherwise,
        Map<String, String> scope, String origin
    ) {
        var branch = branches.get(index);
        List<IR.Stmt> rest = index + 1 < branches.size()
            ? List.of(lowerChain(branches, index + 1, otherwise, scope, origin))
            : lowerStatements(otherwise, scope, origin);
        return new IR.If(lowerExpr(branch.cond(), origin), lowerStatements(branch.body(), scope, origin), rest);
    }

    private IR.Stmt lowerCase(StAst.Case c, int index, Map<String, String> scope, String origin) {
        var selector = lowerExpr(c.selector(), origin);
        var arm = c.arms().get(index);
        IR.Expr cond = null;
        for (var label : arm.labels()) {
            var test = labelTest(selector, label);
            cond = cond == null ? test : new IR.Binary(IR.Op.OR, cond, test);
        }
        List<IR.Stmt> rest = index + 1 < c.arms().size()
            ? List.of(lowerCase(c, index + 1, scope, origin))
            : lowerStatements(c.otherwise(), scope, origin);
        return new IR.If(cond, lowerStatements(arm.body(), scope, origin), rest);
    }

    private IR.Expr labelTest(IR.Expr selector, StAst.CaseLabel label) {
        var from = labelValue(label.from());
        if (label.to().isEmpty()) {
            return new IR.Binary(IR.Op.EQ, selector, from);
        }
        var to = labelValue(label.to().get());
        return new IR.Binary(IR.Op.AND,
            new IR.Binary(IR.Op.GE, selector, from),
            new IR.Binary(IR.Op.LE, selector, to));
    }

    private IR.Expr labelValue(String text) {
        return IR.Literal.tryParse(text).<IR.Expr>map(l -> l).orElseGet(() -> IR.Ref.to(text));
    }

    private IR.Stmt lowerCall(StAst.CallStmt call, Map<String, String> scope, String origin) {
        var instanceType = scope.get(call.name().toLowerCase(Locale.ROOT));
        if (instanceType != null) {
            var args = call.args().stream()
                .map(arg -> new IR.Arg(arg.name().orElse(""), lowerExpr(arg.value(), origin)))
                .toList();
            return new IR.FbCall(call.name(), instanceType, args);
        }
        return new IR.Invoke(call.name(), call.args().stream().map(arg -> lowerExpr(arg.value(), origin)).toList());
    }

    // ==========================================================
    // Expressions
    // ==========================================================

    public IR.Expr lowerExpr(StAst.Expr expr, String origin) {
        if (expr instanceof StAst.Name n) {
            return new IR.Ref(n.root(), n.suffix());
        } else if (expr instanceof StAst.Lit lit) {
            return IR.Literal.tryParse(lit.text()).orElseThrow(() -> new ConversionException(
                ErrorKind.MALFORMED_ST_SYNTAX, origin,
                "unrecognised literal " + lit.text(),
                "use decimal, based (16#..), real, T#.. or quoted string literals"
            ));
        } else if (expr instanceof StAst.UnaryOp u) {
            return new IR.Unary(IR.Op.prefix(u.op()), lowerExpr(u.operand(), origin));
        } else if (expr instanceof StAst.BinaryOp b) {
            return new IR.Binary(IR.Op.binary(b.op()), lowerExpr(b.left(), origin), lowerExpr(b.right(), origin));
        } else if (expr instanceof StAst.FnCall call) {
            return new IR.Call(call.name(), call.args().stream().map(arg -> lowerExpr(arg.value(), origin)).toList());
        }
        throw new IllegalStateException("unknown expression " + expr);
    }
}
