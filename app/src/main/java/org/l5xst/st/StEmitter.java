package org.l5xst.st;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.ConversionConfig;
import org.l5xst.Diagnostic;
import org.l5xst.ir.IR;
import org.l5xst.ir.IrRewriter;
import org.l5xst.tables.AuxTemplate;

/**
 * Builds the Structured Text syntax tree for a merged IR program.
 *
 * <p>Layout: diagnostics comment, template struct types, user types, template functions,
 * user function blocks, the program, then one configuration binding it to a task.
 */
public class StEmitter {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("st-emitter");

    private final ConversionConfig config;

    public StEmitter(ConversionConfig config) {
        this.config = config;
    }

    public StAst fromIR(IR.Program program, List<Diagnostic> diagnostics) {
        var pous = new ArrayList<StAst.Pou>();
        if (!diagnostics.isEmpty()) {
            pous.add(new StAst.Verbatim("diagnostics", diagnosticsBlock(diagnostics)));
        }

        var templates = usedTemplates(program);
        for (var template : templates) {
            pous.add(new StAst.Verbatim(template.structType(), template.structText()));
        }
        for (var type : program.types()) {
            pous.add(new StAst.TypeDecl(type.name(), type.members().stream()
                .map(m -> new StAst.VarDecl(m.name(), m.type(), m.dims(), Optional.empty()))
                .toList()));
        }
        for (var template : templates) {
            pous.add(new StAst.Verbatim(template.functionName(), template.functionText()));
        }
        for (var function : program.functions()) {
            pous.add(functionBlock(function));
        }

        var decls = program.vars().stream()
            .map(v -> new StAst.VarDecl(v.name(), v.type(), v.dims(), v.initialValue()))
            .toList();
        var body = new ArrayList<StAst.Stmt>();
        for (var routine : program.routines()) {
            body.add(new StAst.Comment("Routine: " + routine.name()));
            body.addAll(statements(routine.body()));
        }
        var sections = decls.isEmpty()
            ? List.<StAst.VarSection>of()
            : List.of(new StAst.VarSection(StAst.SECTION.VAR, decls));
        pous.add(new StAst.ProgramDecl(program.name(), sections, body));

        pous.add(new StAst.ConfigurationDecl(
            config.configurationName(),
            config.resourceName(),
            config.resourceTarget(),
            config.taskName(),
            config.taskInterval(),
            config.taskPriority(),
            config.programInstance(),
            program.name()
        ));
        log.debug("emitted {} templates, {} types, {} function blocks, {} variables",
            templates.size(), program.types().size(), program.functions().size(), decls.size());
        return new StAst(pous);
    }

    /** Templates called anywhere in the program, or whose struct type some variable has. */
    static List<AuxTemplate> usedTemplates(IR.Program program) {
        var used = EnumSet.noneOf(AuxTemplate.class);
        var stmts = new ArrayList<>(program.statements());
        program.functions().forEach(f -> stmts.addAll(f.body()));
        for (var stmt : stmts) {
            IrRewriter.forEachFunction(stmt, name -> AuxTemplate.forFunction(name).ifPresent(used::add));
        }
        for (var v : program.vars()) {
            AuxTemplate.forStruct(v.type()).ifPresent(used::add);
        }
        for (var f : program.functions()) {
            f.params().forEach(p -> AuxTemplate.forStruct(p.type()).ifPresent(used::add));
        }
        return List.copyOf(used);
    }

    private static String diagnosticsBlock(List<Diagnostic> diagnostics) {
        var sb = new StringBuilder("(* Conversion diagnostics:\n");
        for (var d : diagnostics) {
            sb.append("   ").append(d.summary().replace("*)", "* )").replace("(*", "( *")).append("\n");
        }
        return sb.append("*)").toString();
    }

    private StAst.FunctionDecl functionBlock(IR.Function function) {
        var sections = new ArrayList<StAst.VarSection>();
        for (var dir : IR.PARAM_DIR.values()) {
            var decls = function.params().stream()
                .filter(p -> p.dir() == dir)
                .map(p -> new StAst.VarDecl(p.name(), p.type(), List.of(), Optional.empty()))
                .toList();
            if (decls.isEmpty()) continue;
            var kind = switch (dir) {
                case INPUT -> StAst.SECTION.VAR_INPUT;
                case OUTPUT -> StAst.SECTION.VAR_OUTPUT;
                case IN_OUT -> StAst.SECTION.VAR_IN_OUT;
                case LOCAL -> StAst.SECTION.VAR;
            };
            sections.add(new StAst.VarSection(kind, decls));
        }
        return new StAst.FunctionDecl(function.name(), Optional.empty(), sections, statements(function.body()));
    }

    // ==========================================================
    // Statements
    // ==========================================================

    public static List<StAst.Stmt> statements(List<IR.Stmt> stmts) {
        return stmts.stream().map(StEmitter::statement).toList();
    }

    private static StAst.Stmt statement(IR.Stmt stmt) {
        if (stmt instanceof IR.Assign a) {
            return new StAst.Assign(name(a.target()), expr(a.value()));
        } else if (stmt instanceof IR.If i) {
            var branches = new ArrayList<StAst.Branch>();
            IR.If current = i;
            List<IR.Stmt> otherwise;
            while (true) {
                branches.add(new StAst.Branch(expr(current.cond()), statements(current.then())));
                otherwise = current.otherwise();
                if (otherwise.size() == 1 && otherwise.get(0) instanceof IR.If nested) {
                    current = nested;
                } else {
                    break;
                }
            }
            return new StAst.IfChain(branches, statements(otherwise));
        } else if (stmt instanceof IR.FbCall c) {
            var args = c.args().stream()
                .map(arg -> new StAst.CallArg(
                    arg.name().isEmpty() ? Optional.empty() : Optional.of(arg.name()),
                    expr(arg.value())))
                .toList();
            return new StAst.CallStmt(c.instance(), args);
        } else if (stmt instanceof IR.Invoke inv) {
            return new StAst.CallStmt(inv.function(), positional(inv.args()));
        } else if (stmt instanceof IR.ForLoop f) {
            return new StAst.For(f.counter().path(), expr(f.from()), expr(f.to()),
                f.step().map(StEmitter::expr), statements(f.body()));
        } else if (stmt instanceof IR.WhileLoop w) {
            return new StAst.While(expr(w.cond()), statements(w.body()));
        } else if (stmt instanceof IR.Disabled d) {
            return new StAst.Pragma(d.reason(), d.text());
        }
        throw new IllegalStateException("unknown statement " + stmt);
    }

    // ==========================================================
    // Expressions
    // ==========================================================

    public static StAst.Expr expr(IR.Expr expr) {
        if (expr instanceof IR.Ref r) {
            return name(r);
        } else if (expr instanceof IR.Literal lit) {
            return new StAst.Lit(lit.text());
        } else if (expr instanceof IR.Unary u) {
            return new StAst.UnaryOp(u.op().symbol(), expr(u.operand()));
        } else if (expr instanceof IR.Binary b) {
            return new StAst.BinaryOp(b.op().symbol(), expr(b.left()), expr(b.right()));
        } else if (expr instanceof IR.Call c) {
            return new StAst.FnCall(c.function(), positional(c.args()));
        }
        throw new IllegalStateException("unknown expression " + expr);
    }

    private static StAst.Name name(IR.Ref ref) {
        return new StAst.Name(ref.root(), ref.suffix());
    }

    private static List<StAst.CallArg> positional(List<IR.Expr> args) {
        return args.stream().map(e -> new StAst.CallArg(Optional.empty(), expr(e))).toList();
    }
}
