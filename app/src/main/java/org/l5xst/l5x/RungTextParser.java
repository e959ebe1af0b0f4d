package org.l5xst.l5x;

import java.util.*;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.model.Controller;

/**
 * Parses neutral rung text such as {@code XIC(A)[XIC(B),XIO(C)]OTE(Y);} into a series-parallel tree.
 */
public class RungTextParser {
    /*
     * Parser state
     */
    private final String text;
    private final String location;
    private int pos = 0;
    private int instructions = 0;

    public RungTextParser(String text, String location) {
        this.text = text;
        this.location = location;
    }

    public static Controller.Series parse(String text, String location) {
        return new RungTextParser(text, location).parse();
    }

    public Controller.Series parse() {
        var network = parseSeries(false);
        skipSpaces();
        if (pos < text.length() && text.charAt(pos) == ';') {
            pos++;
        }
        skipSpaces();
        if (pos < text.length()) {
            throw fail("unexpected '" + text.charAt(pos) + "'", "a rung ends after its last instruction and ';'");
        }
        return network;
    }

    private Controller.Series parseSeries(boolean inBranch) {
        var nodes = new ArrayList<Controller.RungNode>();
        while (true) {
            skipSpaces();
            if (pos >= text.length()) {
                if (inBranch) {
                    throw fail("branch is not closed", "every '[' needs a matching ']'");
                }
                break;
            }
            char c = text.charAt(pos);
            if (c == ';' || (inBranch && (c == ',' || c == ']'))) {
                break;
            }
            if (c == '[') {
                nodes.add(parseParallel());
            } else if (Character.isLetter(c) || c == '_') {
                nodes.add(parseTerm());
            } else {
                throw fail("unexpected '" + c + "'", "expected an instruction or a branch");
            }
        }
        return new Controller.Series(nodes);
    }

    private Controller.Parallel parseParallel() {
        pos++; // '['
        var branches = new ArrayList<Controller.Series>();
        branches.add(parseSeries(true));
        while (text.charAt(pos) == ',') {
            pos++;
            branches.add(parseSeries(true));
        }
        if (pos >= text.length() || text.charAt(pos) != ']') {
            throw fail("branch is not closed", "every '[' needs a matching ']'");
        }
        pos++;
        return new Controller.Parallel(branches);
    }

    private Controller.Term parseTerm() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        var mnemonic = text.substring(start, pos);
        skipSpaces();
        var operands = new ArrayList<String>();
        if (pos < text.length() && text.charAt(pos) == '(') {
            pos++;
            operands.addAll(parseOperands(mnemonic));
        }
        return new Controller.Term(mnemonic, operands, instructions++);
    }

    private List<String> parseOperands(String mnemonic) {
        var operands = new ArrayList<String>();
        var current = new StringBuilder();
        int depth = 0;
        while (true) {
            if (pos >= text.length()) {
                throw fail("operands of " + mnemonic + " are not closed", "add the missing ')'");
            }
            char c = text.charAt(pos++);
            if (depth == 0 && c == ')') {
                break;
            }
            if (depth == 0 && c == ',') {
                operands.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            if (c == '(' || c == '[') depth++;
            if (c == ')' || c == ']') depth--;
            current.append(c);
        }
        var last = current.toString().strip();
        if (!last.isEmpty() || !operands.isEmpty()) {
            operands.add(last);
        }
        return operands;
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    RuntimeException fail(String err, String hint) {
        return new ConversionException(
            ErrorKind.MALFORMED_SOURCE_TREE,
            location + " col " + (pos + 1),
            err + " in rung text \"" + text.strip() + "\"",
            hint
        );
    }
}
