package org.l5xst.st;

import java.util.*;

/**
 * Syntax tree of an IEC 61131-3 Structured Text compilation unit.
 *
 * <p>Unlike the IR it keeps surface forms: {@code ELSIF} chains, {@code CASE}, var sections,
 * comments and verbatim text blocks.
 */
public record StAst(List<StAst.Pou> pous) {
    public StAst {
        pous = List.copyOf(pous);
    }

    // ==========================================================
    // Program organisation units
    // ==========================================================

    public sealed interface Pou permits TypeDecl, FunctionDecl, ProgramDecl, ConfigurationDecl, Verbatim {}

    public record TypeDecl(String name, List<VarDecl> members) implements Pou {
        public TypeDecl {
            members = List.copyOf(members);
        }
    }

    /** {@code FUNCTION} when {@code returnType} is present, {@code FUNCTION_BLOCK} otherwise. */
    public record FunctionDecl(String name, Optional<String> returnType, List<VarSection> sections, List<Stmt> body)
        implements Pou {
        public FunctionDecl {
            sections = List.copyOf(sections);
            body = List.copyOf(body);
        }

        public boolean isBlock() {
            return returnType.isEmpty();
        }
    }

    public record ProgramDecl(String name, List<VarSection> sections, List<Stmt> body) implements Pou {
        public ProgramDecl {
            sections = List.copyOf(sections);
            body = List.copyOf(body);
        }
    }

    public record ConfigurationDecl(
        String name,
        String resource,
        String target,
        String task,
        String interval,
        int priority,
        String instance,
        String program
    ) implements Pou {}

    /** Text printed as is: template assets and comment blocks. */
    public record Verbatim(String name, String text) implements Pou {}

    public enum SECTION { VAR, VAR_INPUT, VAR_OUTPUT, VAR_IN_OUT, VAR_GLOBAL, VAR_EXTERNAL, VAR_TEMP }

    public record VarSection(SECTION kind, List<VarDecl> decls) {
        public VarSection {
            decls = List.copyOf(decls);
        }
    }

    /** {@code dims} are array sizes; arrays are zero-based. */
    public record VarDecl(String name, String type, List<Integer> dims, Optional<String> init) {
        public VarDecl {
            dims = List.copyOf(dims);
        }
    }

    // ==========================================================
    // Statements
    // ==========================================================

    public sealed interface Stmt permits Assign, IfChain, Case, For, While, CallStmt, Pragma, Comment {}

    public record Assign(Name target, Expr value) implements Stmt {}

    public record Branch(Expr cond, List<Stmt> body) {
        public Branch {
            body = List.copyOf(body);
        }
    }

    /** {@code IF} with its {@code ELSIF} branches in order. */
    public record IfChain(List<Branch> branches, List<Stmt> otherwise) implements Stmt {
        public IfChain {
            branches = List.copyOf(branches);
            otherwise = List.copyOf(otherwise);
        }
    }

    public record CaseLabel(String from, Optional<String> to) {}

    public record CaseArm(List<CaseLabel> labels, List<Stmt> body) {
        public CaseArm {
            labels = List.copyOf(labels);
            body = List.copyOf(body);
        }
    }

    public record Case(Expr selector, List<CaseArm> arms, List<Stmt> otherwise) implements Stmt {
        public Case {
            arms = List.copyOf(arms);
            otherwise = List.copyOf(otherwise);
        }
    }

    public record For(String counter, Expr from, Expr to, Optional<Expr> by, List<Stmt> body) implements Stmt {
        public For {
            body = List.copyOf(body);
        }
    }

    public record While(Expr cond, List<Stmt> body) implements Stmt {
        public While {
            body = List.copyOf(body);
        }
    }

    public record CallStmt(String name, List<CallArg> args) implements Stmt {
        public CallStmt {
            args = List.copyOf(args);
        }
    }

    /** {@code (*#DISABLED reason | text *)}: a statement kept as text. */
    public record Pragma(String reason, String text) implements Stmt {}

    public record Comment(String text) implements Stmt {}

    public record CallArg(Optional<String> name, Expr value) {}

    // ==========================================================
    // Expressions
    // ==========================================================

    public sealed interface Expr permits Name, Lit, UnaryOp, BinaryOp, FnCall {}

    public record Name(String root, String suffix) implements Expr {
        public String text() {
            return root + suffix;
        }
    }

    public record Lit(String text) implements Expr {}

    public record UnaryOp(String op, Expr operand) implements Expr {}

    public record BinaryOp(String op, Expr left, Expr right) implements Expr {}

    public record FnCall(String name, List<CallArg> args) implements Expr {
        public FnCall {
            args = List.copyOf(args);
        }
    }
}
