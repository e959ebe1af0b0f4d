package org.l5xst.st;

import java.util.*;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;

/**
 * Entry points into the generated Structured Text parser. Any syntax error is fatal.
 */
public class StParser {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("st-parser");

    private final StAstBuilder builder = new StAstBuilder();

    public StAst parse(String text, String origin) {
        var parser = parser(text, origin);
        var ast = (StAst) builder.visit(parser.compilationUnit());
        log.debug("{}: parsed {} program organisation unit(s)", origin, ast.pous().size());
        return ast;
    }

    /** A bare statement list, as stored in an ST routine. */
    @SuppressWarnings("unchecked")
    public List<StAst.Stmt> parseStatements(String text, String origin) {
        var parser = parser(text, origin);
        return (List<StAst.Stmt>) builder.visit(parser.statementsOnly());
    }

    /** A single expression, as written in compute instructions. */
    public StAst.Expr parseExpression(String text, String origin) {
        var parser = parser(text, origin);
        return (StAst.Expr) builder.visit(parser.expressionOnly());
    }

    private static StructuredTextParser parser(String text, String origin) {
        var listener = new FailingListener(origin);
        var lexer = new StructuredTextLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        var parser = new StructuredTextParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        return parser;
    }

    private static final class FailingListener extends BaseErrorListener {
        private final String origin;

        FailingListener(String origin) {
            this.origin = origin;
        }

        @Override
        public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e
        ) {
            throw new ConversionException(
                ErrorKind.MALFORMED_ST_SYNTAX,
                origin + " " + line + ":" + (charPositionInLine + 1),
                msg,
                "check the statement against IEC 61131-3 Structured Text"
            );
        }
    }
}
