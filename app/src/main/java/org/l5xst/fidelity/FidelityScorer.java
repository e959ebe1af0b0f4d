package org.l5xst.fidelity;

import java.util.*;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.l5xst.ir.IR;
import org.l5xst.st.StEmitter;
import org.l5xst.st.StPrinter;

/**
 * Structural diff of two IR programs.
 *
 * <p>Declarations are matched by name regardless of order and agree when their types agree.
 * Statements are aligned in order on a longest common subsequence; unaligned statements facing
 * each other count as mismatched, the rest as missing or extra.
 */
public class FidelityScorer {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("fidelity");

    /**
     * @param expected the reference program
     * @param actual   the program rebuilt from the translated text
     */
    public FidelityReport compare(IR.Program expected, IR.Program actual) {
        var tally = new Tally();
        compareDeclarations(declarations(expected), declarations(actual), tally);
        compareStatements(statements(expected), statements(actual), tally);
        var report = new FidelityReport(tally.matched, tally.mismatched, tally.missing, tally.extra, tally.details);
        log.info("{} vs {}: {}", expected.name(), actual.name(), report.summary());
        return report;
    }

    private static final class Tally {
        int matched;
        int mismatched;
        int missing;
        int extra;
        final List<String> details = new ArrayList<>();
    }

    // ==========================================================
    // Declarations
    // ==========================================================

    /** Declaration signatures by {@code kind name}, lower-cased. */
    private static Map<String, String> declarations(IR.Program program) {
        var decls = new LinkedHashMap<String, String>();
        for (var v : program.vars()) {
            decls.put("var " + key(v.name()), typeText(v.type(), v.dims()));
        }
        for (var t : program.types()) {
            decls.put("type " + key(t.name()), t.members().stream()
                .map(m -> m.name() + ":" + typeText(m.type(), m.dims()))
                .collect(Collectors.joining(",")));
        }
        for (var f : program.functions()) {
            decls.put("function " + key(f.name()), f.params().stream()
                .map(p -> p.dir() + " " + p.name() + ":" + p.type())
                .collect(Collectors.joining(",")));
        }
        return decls;
    }

    private static void compareDeclarations(Map<String, String> expected, Map<String, String> actual, Tally tally) {
        for (var entry : expected.entrySet()) {
            var other = actual.get(entry.getKey());
            if (other == null) {
                tally.missing++;
                tally.details.add("missing " + entry.getKey());
            } else if (other.equalsIgnoreCase(entry.getValue())) {
                tally.matched++;
            } else {
                tally.mismatched++;
                tally.details.add("mismatched " + entry.getKey() + ": " + entry.getValue() + " vs " + other);
            }
        }
        for (var key : actual.keySet()) {
            if (!expected.containsKey(key)) {
                tally.extra++;
                tally.details.add("extra " + key);
            }
        }
    }

    private static String typeText(String type, List<Integer> dims) {
        return dims.isEmpty() ? type : type + dims;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    // ==========================================================
    // Statements
    // ==========================================================

    /** Top-level routine statements in order, then each function block body. */
    private static List<IR.Stmt> statements(IR.Program program) {
        var all = new ArrayList<>(program.statements());
        program.functions().forEach(f -> all.addAll(f.body()));
        return all;
    }

    /**
     * Common leading and trailing statements match outright; the rest is aligned in linear
     * space, since whole merged programs are compared.
     */
    private static void compareStatements(List<IR.Stmt> expected, List<IR.Stmt> actual, Tally tally) {
        int n = expected.size();
        int m = actual.size();
        int head = 0;
        while (head < n && head < m && expected.get(head).equals(actual.get(head))) {
            head++;
        }
        int tail = 0;
        while (tail < n - head && tail < m - head
            && expected.get(n - 1 - tail).equals(actual.get(m - 1 - tail))) {
            tail++;
        }
        tally.matched += head;

        var pairs = new ArrayList<int[]>();
        align(expected, head, n - tail, actual, head, m - tail, pairs);
        var gapExpected = new ArrayList<IR.Stmt>();
        var gapActual = new ArrayList<IR.Stmt>();
        int i = head;
        int j = head;
        for (var pair : pairs) {
            gapExpected.addAll(expected.subList(i, pair[0]));
            gapActual.addAll(actual.subList(j, pair[1]));
            closeGap(gapExpected, gapActual, tally);
            tally.matched++;
            i = pair[0] + 1;
            j = pair[1] + 1;
        }
        gapExpected.addAll(expected.subList(i, n - tail));
        gapActual.addAll(actual.subList(j, m - tail));
        closeGap(gapExpected, gapActual, tally);
        tally.matched += tail;
    }

    /** Index pairs of a longest common subsequence of {@code a[aLo, aHi)} and {@code b[bLo, bHi)}, in order. */
    private static void align(List<IR.Stmt> a, int aLo, int aHi, List<IR.Stmt> b, int bLo, int bHi, List<int[]> pairs) {
        if (aLo >= aHi || bLo >= bHi) {
            return;
        }
        if (aHi - aLo == 1) {
            for (int j = bLo; j < bHi; j++) {
                if (a.get(aLo).equals(b.get(j))) {
                    pairs.add(new int[] {aLo, j});
                    return;
                }
            }
            return;
        }
        int mid = (aLo + aHi) / 2;
        var forward = forwardRow(a, aLo, mid, b, bLo, bHi);
        var backward = backwardRow(a, mid, aHi, b, bLo, bHi);
        int split = 0;
        int best = -1;
        for (int k = 0; k <= bHi - bLo; k++) {
            if (forward[k] + backward[k] > best) {
                best = forward[k] + backward[k];
                split = k;
            }
        }
        align(a, aLo, mid, b, bLo, bLo + split, pairs);
        align(a, mid, aHi, b, bLo + split, bHi, pairs);
    }

    /** {@code row[k]}: LCS length of {@code a[aLo, aHi)} and {@code b[bLo, bLo + k)}. */
    private static int[] forwardRow(List<IR.Stmt> a, int aLo, int aHi, List<IR.Stmt> b, int bLo, int bHi) {
        int m = bHi - bLo;
        var prev = new int[m + 1];
        var cur = new int[m + 1];
        for (int i = aLo; i < aHi; i++) {
            cur[0] = 0;
            for (int k = 1; k <= m; k++) {
                cur[k] = a.get(i).equals(b.get(bLo + k - 1)) ? prev[k - 1] + 1 : Math.max(prev[k], cur[k - 1]);
            }
            var swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    /** {@code row[k]}: LCS length of {@code a[aLo, aHi)} and {@code b[bLo + k, bHi)}. */
    private static int[] backwardRow(List<IR.Stmt> a, int aLo, int aHi, List<IR.Stmt> b, int bLo, int bHi) {
        int m = bHi - bLo;
        var prev = new int[m + 1];
        var cur = new int[m + 1];
        for (int i = aHi - 1; i >= aLo; i--) {
            cur[m] = 0;
            for (int k = m - 1; k >= 0; k--) {
                cur[k] = a.get(i).equals(b.get(bLo + k)) ? prev[k + 1] + 1 : Math.max(prev[k], cur[k + 1]);
            }
            var swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    private static void closeGap(List<IR.Stmt> expected, List<IR.Stmt> actual, Tally tally) {
        int paired = Math.min(expected.size(), actual.size());
        for (int k = 0; k < paired; k++) {
            tally.mismatched++;
            tally.details.add("mismatched statement: " + text(expected.get(k)) + " vs " + text(actual.get(k)));
        }
        for (int k = paired; k < expected.size(); k++) {
            tally.missing++;
            tally.details.add("missing statement: " + text(expected.get(k)));
        }
        for (int k = paired; k < actual.size(); k++) {
            tally.extra++;
            tally.details.add("extra statement: " + text(actual.get(k)));
        }
        expected.clear();
        actual.clear();
    }

    private static String text(IR.Stmt stmt) {
        var printed = StPrinter.printStatements(StEmitter.statements(List.of(stmt)), 0).strip();
        int newline = printed.indexOf('\n');
        return newline < 0 ? printed : printed.substring(0, newline) + " ...";
    }
}
