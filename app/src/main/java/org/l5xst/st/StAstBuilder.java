package org.l5xst.st;

import static org.l5xst.st.StructuredTextParser.*;

import java.util.*;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import org.l5xst.st.StAst.*;

/**
 * Converts the ANTLR parse tree into {@link StAst}.
 */
public class StAstBuilder extends StructuredTextBaseVisitor<Object> {

    @Override
    public Object visitCompilationUnit(CompilationUnitContext ctx) {
        var pous = new ArrayList<Pou>();
        for (var pou : ctx.pou()) {
            var visited = visit(pou);
            if (visited instanceof List<?> many) {
                for (var item : many) {
                    pous.add((Pou) item);
                }
            } else {
                pous.add((Pou) visited);
            }
        }
        return new StAst(pous);
    }

    @Override
    public Object visitStatementsOnly(StatementsOnlyContext ctx) {
        return visit(ctx.statementList());
    }

    @Override
    public Object visitExpressionOnly(ExpressionOnlyContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Object visitPou(PouContext ctx) {
        return visit(ctx.getChild(0));
    }

    // --- Declarations ---

    /** One TYPE block may hold several structs, so this returns a list. */
    @Override
    public Object visitTypeDecl(TypeDeclContext ctx) {
        var decls = new ArrayList<TypeDecl>();
        for (var struct : ctx.structDecl()) {
            var members = new ArrayList<VarDecl>();
            for (var decl : struct.varDecl()) {
                members.addAll(varDecls(decl));
            }
            decls.add(new TypeDecl(struct.IDENT().getText(), members));
        }
        return decls;
    }

    @Override
    public Object visitFunctionDecl(FunctionDeclContext ctx) {
        return new FunctionDecl(
            ctx.IDENT().getText(),
            Optional.of(typeName(ctx.typeRef())),
            sections(ctx.varSection()),
            statements(ctx.statementList())
        );
    }

    @Override
    public Object visitFunctionBlockDecl(FunctionBlockDeclContext ctx) {
        return new FunctionDecl(
            ctx.IDENT().getText(),
            Optional.empty(),
            sections(ctx.varSection()),
            statements(ctx.statementList())
        );
    }

    @Override
    public Object visitProgramDecl(ProgramDeclContext ctx) {
        return new ProgramDecl(ctx.IDENT().getText(), sections(ctx.varSection()), statements(ctx.statementList()));
    }

    @Override
    public Object visitConfigurationDecl(ConfigurationDeclContext ctx) {
        String resource = "";
        String target = "";
        String task = "";
        String interval = "";
        int priority = 0;
        String instance = "";
        String program = "";
        if (!ctx.resourceDecl().isEmpty()) {
            var res = ctx.resourceDecl(0);
            resource = res.IDENT(0).getText();
            target = res.IDENT(1).getText();
            if (!res.taskDecl().isEmpty()) {
                var taskDecl = res.taskDecl(0);
                task = taskDecl.IDENT().getText();
                for (var param : taskDecl.taskParam()) {
                    var value = param.expression().getText();
                    switch (param.IDENT().getText().toUpperCase(Locale.ROOT)) {
                        case "INTERVAL" -> interval = value;
                        case "PRIORITY" -> priority = Integer.parseInt(value);
                        default -> { }
                    }
                }
            }
            if (!res.programBinding().isEmpty()) {
                var binding = res.programBinding(0);
                instance = binding.IDENT(0).getText();
                program = binding.IDENT(2).getText();
            }
        }
        return new ConfigurationDecl(ctx.IDENT().getText(), resource, target, task, interval, priority, instance, program);
    }

    private List<VarSection> sections(List<VarSectionContext> contexts) {
        var sections = new ArrayList<VarSection>();
        for (var section : contexts) {
            var decls = new ArrayList<VarDecl>();
            for (var decl : section.varDecl()) {
                decls.addAll(varDecls(decl));
            }
            var kind = SECTION.valueOf(section.varKeyword().getText().toUpperCase(Locale.ROOT));
            sections.add(new VarSection(kind, decls));
        }
        return sections;
    }

    private List<VarDecl> varDecls(VarDeclContext ctx) {
        var type = typeName(ctx.typeRef());
        var dims = dims(ctx.typeRef());
        var init = Optional.ofNullable(ctx.expression()).map(ParserRuleContext::getText);
        var decls = new ArrayList<VarDecl>();
        for (TerminalNode name : ctx.IDENT()) {
            decls.add(new VarDecl(name.getText(), type, dims, init));
        }
        return decls;
    }

    private static String typeName(TypeRefContext ctx) {
        if (ctx instanceof ArrayTypeContext array) {
            return array.IDENT().getText();
        }
        return ((NamedTypeContext) ctx).IDENT().getText();
    }

    private static List<Integer> dims(TypeRefContext ctx) {
        if (!(ctx instanceof ArrayTypeContext array)) {
            return List.of();
        }
        var dims = new ArrayList<Integer>();
        for (var range : array.subrange()) {
            int lo = Integer.parseInt(range.signedInt(0).getText());
            int hi = Integer.parseInt(range.signedInt(1).getText());
            dims.add(hi - lo + 1);
        }
        return dims;
    }

    // --- Statements ---

    @Override
    public Object visitStatementList(StatementListContext ctx) {
        return statements(ctx);
    }

    private List<Stmt> statements(StatementListContext ctx) {
        var stmts = new ArrayList<Stmt>();
        if (ctx == null) {
            return stmts;
        }
        for (var stmt : ctx.statement()) {
            var visited = visit(stmt);
            if (visited != null) {
                stmts.add((Stmt) visited);
            }
        }
        return stmts;
    }

    @Override
    public Object visitAssignStmt(AssignStmtContext ctx) {
        var assignment = ctx.assignment();
        return new Assign(name(assignment.variable()), expr(assignment.expression()));
    }

    @Override
    public Object visitCallStmt(CallStmtContext ctx) {
        var call = ctx.callStatement();
        return new CallStmt(call.IDENT().getText(), args(call.callArg()));
    }

    @Override
    public Object visitIfStmt(IfStmtContext ctx) {
        var ifCtx = ctx.ifStatement();
        var conditions = ifCtx.expression();
        var bodies = ifCtx.statementList();
        var branches = new ArrayList<Branch>();
        for (int i = 0; i < conditions.size(); i++) {
            branches.add(new Branch(expr(conditions.get(i)), statements(bodies.get(i))));
        }
        List<Stmt> otherwise = ifCtx.ELSE() != null
            ? statements(bodies.get(conditions.size()))
            : List.of();
        return new IfChain(branches, otherwise);
    }

    @Override
    public Object visitCaseStmt(CaseStmtContext ctx) {
        var caseCtx = ctx.caseStatement();
        var arms = new ArrayList<CaseArm>();
        for (var element : caseCtx.caseElement()) {
            var labels = new ArrayList<CaseLabel>();
            for (var label : element.caseLabel()) {
                if (label.IDENT() != null) {
                    labels.add(new CaseLabel(label.IDENT().getText(), Optional.empty()));
                } else {
                    var ints = label.signedInt();
                    labels.add(new CaseLabel(
                        ints.get(0).getText(),
                        ints.size() > 1 ? Optional.of(ints.get(1).getText()) : Optional.empty()
                    ));
                }
            }
            arms.add(new CaseArm(labels, statements(element.statementList())));
        }
        return new Case(expr(caseCtx.expression()), arms, statements(caseCtx.statementList()));
    }

    @Override
    public Object visitForStmt(ForStmtContext ctx) {
        var forCtx = ctx.forStatement();
        var bounds = forCtx.expression();
        return new For(
            forCtx.IDENT().getText(),
            expr(bounds.get(0)),
            expr(bounds.get(1)),
            bounds.size() > 2 ? Optional.of(expr(bounds.get(2))) : Optional.empty(),
            statements(forCtx.statementList())
        );
    }

    @Override
    public Object visitWhileStmt(WhileStmtContext ctx) {
        var whileCtx = ctx.whileStatement();
        return new While(expr(whileCtx.expression()), statements(whileCtx.statementList()));
    }

    @Override
    public Object visitDisabledStmt(DisabledStmtContext ctx) {
        var raw = ctx.DISABLED().getText();
        var inner = raw.substring("(*#DISABLED".length(), raw.length() - "*)".length()).strip();
        int bar = inner.indexOf(" | ");
        if (bar < 0) {
            return new Pragma(inner, "");
        }
        return new Pragma(inner.substring(0, bar).strip(), inner.substring(bar + 3).strip());
    }

    @Override
    public Object visitEmptyStmt(EmptyStmtContext ctx) {
        return null;
    }

    private List<CallArg> args(List<CallArgContext> contexts) {
        var args = new ArrayList<CallArg>();
        for (var arg : contexts) {
            if (arg instanceof NamedArgContext named) {
                args.add(new CallArg(Optional.of(named.IDENT().getText()), expr(named.expression())));
            } else {
                args.add(new CallArg(Optional.empty(), expr(((PositionalArgContext) arg).expression())));
            }
        }
        return args;
    }

    // --- Expressions ---

    private Expr expr(ExpressionContext ctx) {
        return (Expr) visit(ctx);
    }

    private Name name(VariableContext ctx) {
        var suffix = new StringBuilder();
        for (var selector : ctx.selector()) {
            suffix.append(selector.getText());
        }
        return new Name(ctx.IDENT().getText(), suffix.toString());
    }

    @Override
    public Object visitParenExpr(ParenExprContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Object visitCallExpr(CallExprContext ctx) {
        return new FnCall(ctx.IDENT().getText(), args(ctx.callArg()));
    }

    @Override
    public Object visitVarExpr(VarExprContext ctx) {
        return name(ctx.variable());
    }

    @Override
    public Object visitLiteralExpr(LiteralExprContext ctx) {
        return new Lit(ctx.literal().getText());
    }

    @Override
    public Object visitUnaryExpr(UnaryExprContext ctx) {
        var operand = expr(ctx.expression());
        var op = ctx.op.getText().toUpperCase(Locale.ROOT);
        if (op.equals("-") && operand instanceof Lit lit && !lit.text().startsWith("-")
                && !lit.text().isEmpty() && Character.isDigit(lit.text().charAt(0))) {
            return new Lit("-" + lit.text());
        }
        return new UnaryOp(op, operand);
    }

    @Override
    public Object visitPowExpr(PowExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitMulExpr(MulExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitAddExpr(AddExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitRelExpr(RelExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitEqExpr(EqExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitAndExpr(AndExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitXorExpr(XorExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Object visitOrExpr(OrExprContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    private BinaryOp binary(String op, ExpressionContext left, ExpressionContext right) {
        return new BinaryOp(op.toUpperCase(Locale.ROOT), expr(left), expr(right));
    }
}
