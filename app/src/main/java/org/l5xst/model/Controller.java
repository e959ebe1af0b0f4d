package org.l5xst.model;

import java.util.*;

import org.l5xst.ir.IR;
import org.l5xst.tables.Instruction;

/**
 * One controller of a vendor project, as read from its element tree.
 * This is the Program Unit before translation.
 */
public record Controller(
    String name,
    List<Tag> tags,
    List<DataType> types,
    List<AddOn> addOns,
    List<Program> programs
) {
    public Controller {
        tags = List.copyOf(tags);
        types = List.copyOf(types);
        addOns = List.copyOf(addOns);
        programs = List.copyOf(programs);
    }

    public record Tag(
        String name,
        String dataType,
        List<Integer> dims,
        IR.SCOPE scope,
        IR.TAG_KIND kind,
        Optional<String> value,
        Optional<String> aliasFor,
        Optional<IR.Message> message
    ) {
        public Tag {
            dims = List.copyOf(dims);
        }

        public static Tag base(String name, String dataType, IR.SCOPE scope) {
            return new Tag(name, dataType, List.of(), scope, IR.TAG_KIND.BASE,
                Optional.empty(), Optional.empty(), Optional.empty());
        }
    }

    public record Member(String name, String dataType, List<Integer> dims) {
        public Member {
            dims = List.copyOf(dims);
        }
    }

    /** User-defined structure. */
    public record DataType(String name, List<Member> members) {
        public DataType {
            members = List.copyOf(members);
        }
    }

    public enum USAGE { INPUT, OUTPUT, IN_OUT }

    public record AddOnParam(String name, String dataType, USAGE usage) {}

    /** Add-On Instruction definition: a user function block. */
    public record AddOn(String name, List<AddOnParam> params, List<Tag> localTags, List<Routine> routines) {
        public AddOn {
            params = List.copyOf(params);
            localTags = List.copyOf(localTags);
            routines = List.copyOf(routines);
        }
    }

    public record Program(String name, Optional<String> mainRoutine, List<Tag> tags, List<Routine> routines) {
        public Program {
            tags = List.copyOf(tags);
            routines = List.copyOf(routines);
        }
    }

    // ==========================================================
    // Routines
    // ==========================================================

    public sealed interface Routine permits LadderRoutine, FbdRoutine, TextRoutine {
        String name();
    }

    public record LadderRoutine(String name, List<Rung> rungs) implements Routine {
        public LadderRoutine {
            rungs = List.copyOf(rungs);
        }
    }

    public record FbdRoutine(String name, List<Sheet> sheets) implements Routine {
        public FbdRoutine {
            sheets = List.copyOf(sheets);
        }
    }

    public record TextRoutine(String name, String text) implements Routine {}

    // ==========================================================
    // Ladder
    // ==========================================================

    /**
     * One rung: the series-parallel network in left-to-right order. Output instructions
     * are leaves of the network like any other instruction.
     */
    public record Rung(int number, String text, Optional<String> comment, Series network) {
        /** The output actions of the rung, in scan order. */
        public List<Term> outputs() {
            var found = new ArrayList<Term>();
            collectOutputs(network, found);
            return found;
        }

        private static void collectOutputs(RungNode node, List<Term> found) {
            if (node instanceof Term t) {
                if (t.isOutput()) {
                    found.add(t);
                }
            } else if (node instanceof Series s) {
                s.nodes().forEach(n -> collectOutputs(n, found));
            } else if (node instanceof Parallel p) {
                p.branches().forEach(n -> collectOutputs(n, found));
            }
        }
    }

    public sealed interface RungNode permits Term, Series, Parallel {}

    /** One instruction; {@code position} counts instructions from the left of the rung. */
    public record Term(String mnemonic, List<String> operands, int position) implements RungNode {
        public Term {
            operands = List.copyOf(operands);
        }

        /** Anything that is not a contact, comparison or in-line one-shot. Unknown mnemonics count as outputs. */
        public boolean isOutput() {
            return Instruction.lookup(mnemonic)
                .map(ins -> switch (ins.kind()) {
                    case CONTACT, COMPARE -> false;
                    case EDGE -> !ins.inlineEdge();
                    default -> true;
                })
                .orElse(true);
        }
    }

    public record Series(List<RungNode> nodes) implements RungNode {
        public Series {
            nodes = List.copyOf(nodes);
        }
    }

    public record Parallel(List<Series> branches) implements RungNode {
        public Parallel {
            branches = List.copyOf(branches);
        }
    }

    // ==========================================================
    // Function block diagrams
    // ==========================================================

    public record Sheet(int number, List<SheetElement> elements, List<Wire> wires) {
        public Sheet {
            elements = List.copyOf(elements);
            wires = List.copyOf(wires);
        }
    }

    public sealed interface SheetElement permits InputRef, OutputRef, Block {
        String id();
    }

    /** Reads a tag (or a literal) into the sheet. */
    public record InputRef(String id, String operand) implements SheetElement {}

    /** Writes its single input into a tag. */
    public record OutputRef(String id, String operand) implements SheetElement {}

    /**
     * A block, function or add-on instruction. {@code arguments} holds pin values written
     * on the block itself, by pin name.
     */
    public record Block(String id, String type, String operand, boolean addOn, Map<String, String> arguments)
        implements SheetElement {
        public Block {
            arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }
    }

    public record Wire(String fromId, Optional<String> fromParam, String toId, Optional<String> toParam) {}
}
