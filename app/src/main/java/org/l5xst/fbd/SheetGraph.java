package org.l5xst.fbd;

import java.util.*;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.StructuralCycleException;
import org.l5xst.ir.IR;
import org.l5xst.model.Controller;
import org.l5xst.tables.FbdBlockType;

/**
 * A sheet as an arena of nodes in declaration order, with wires as index edges.
 *
 * <p>Every input pin has at most one source. Edges out of a stateful node may be broken
 * while scheduling; the consumer then reads the value the node kept from the previous scan.
 */
public final class SheetGraph {
    public static final String OUTPUT_REF_PIN = "In";

    /**
     * One sheet element. {@code inputs} maps pin names (as written in the sheet) to their sources.
     */
    public record Node(int index, Controller.SheetElement element, Optional<FbdBlockType> type,
                       boolean stateful, Map<String, PinSource> inputs) {
        public String id() {
            return element.id();
        }

        /** {@code id (operand)}, as used in error messages. */
        public String label() {
            if (element instanceof Controller.Block b) {
                return b.id() + " (" + (b.operand().isEmpty() ? b.type() : b.operand()) + ")";
            } else if (element instanceof Controller.InputRef r) {
                return r.id() + " (" + r.operand() + ")";
            } else if (element instanceof Controller.OutputRef r) {
                return r.id() + " (" + r.operand() + ")";
            }
            return element.id();
        }
    }

    private final List<Node> nodes;
    private final List<Set<Integer>> successors;
    private final String location;

    private SheetGraph(List<Node> nodes, List<Set<Integer>> successors, String location) {
        this.nodes = nodes;
        this.successors = successors;
        this.location = location;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    // ==========================================================
    // Construction
    // ==========================================================

    public static SheetGraph build(Controller.Sheet sheet, String location) {
        var index = new HashMap<String, Integer>();
        var elements = sheet.elements();
        for (int i = 0; i < elements.size(); i++) {
            if (index.putIfAbsent(elements.get(i).id(), i) != null) {
                throw malformed(location, "duplicate element id " + elements.get(i).id(),
                    "element ids must be unique within a sheet");
            }
        }

        var inputs = new ArrayList<Map<String, PinSource>>();
        var successors = new ArrayList<Set<Integer>>();
        for (var element : elements) {
            var pins = new LinkedHashMap<String, PinSource>();
            if (element instanceof Controller.Block b) {
                b.arguments().forEach((pin, arg) -> pins.put(pin, operandSource(arg)));
            }
            inputs.add(pins);
            successors.add(new LinkedHashSet<>());
        }

        for (var wire : sheet.wires()) {
            var from = index.get(wire.fromId());
            var to = index.get(wire.toId());
            if (from == null || to == null) {
                throw malformed(location,
                    "wire " + wire.fromId() + " -> " + wire.toId() + " names an unknown element",
                    "every wire must connect two elements of the same sheet");
            }
            var producer = elements.get(from);
            var consumer = elements.get(to);
            if (producer instanceof Controller.OutputRef) {
                throw malformed(location, "wire leaves output reference " + producer.id(),
                    "output references only receive values");
            }
            if (consumer instanceof Controller.InputRef) {
                throw malformed(location, "wire enters input reference " + consumer.id(),
                    "input references only provide values");
            }

            var pin = inputPin(consumer, wire, location);
            PinSource source;
            if (producer instanceof Controller.InputRef ref) {
                source = operandSource(ref.operand());
            } else {
                source = new PinSource.Wire(from, outputPin((Controller.Block) producer, wire, location));
                successors.get(from).add(to);
            }
            var pins = inputs.get(to);
            for (var existing : pins.keySet()) {
                if (existing.equalsIgnoreCase(pin)) {
                    throw malformed(location, "pin " + consumer.id() + "." + pin + " has more than one source",
                        "an input pin takes exactly one wire");
                }
            }
            pins.put(pin, source);
        }

        var nodes = new ArrayList<Node>();
        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            Optional<FbdBlockType> type = Optional.empty();
            boolean stateful = false;
            if (element instanceof Controller.Block b) {
                type = b.addOn() ? Optional.empty() : FbdBlockType.lookup(b.type());
                stateful = b.addOn() || type.map(FbdBlockType::stateful).orElse(false);
            }
            nodes.add(new Node(i, element, type, stateful, Collections.unmodifiableMap(inputs.get(i))));
        }
        return new SheetGraph(List.copyOf(nodes), successors, location);
    }

    private static PinSource operandSource(String operand) {
        return IR.Literal.tryParse(operand)
            .<PinSource>map(l -> new PinSource.Literal(l.text()))
            .orElseGet(() -> new PinSource.Tag(operand));
    }

    private static String inputPin(Controller.SheetElement consumer, Controller.Wire wire, String location) {
        if (consumer instanceof Controller.OutputRef) {
            return OUTPUT_REF_PIN;
        }
        var block = (Controller.Block) consumer;
        var pin = wire.toParam().orElseThrow(() -> malformed(location,
            "wire into block " + block.id() + " names no input pin",
            "wires into blocks carry a ToParam attribute"));
        if (!block.addOn()) {
            var type = FbdBlockType.lookup(block.type());
            if (type.isPresent() && type.get().input(pin).isEmpty()) {
                throw malformed(location, block.type() + " block " + block.id() + " has no input pin " + pin,
                    "check the pin names of the block type");
            }
        }
        return pin;
    }

    private static String outputPin(Controller.Block block, Controller.Wire wire, String location) {
        if (wire.fromParam().isPresent()) {
            return wire.fromParam().get();
        }
        var type = block.addOn() ? Optional.<FbdBlockType>empty() : FbdBlockType.lookup(block.type());
        return type.map(t -> t.outputs().get(0).name()).orElseThrow(() -> malformed(location,
            "wire out of block " + block.id() + " names no output pin",
            "wires out of multi-output blocks carry a FromParam attribute"));
    }

    private static ConversionException malformed(String location, String err, String hint) {
        return new ConversionException(ErrorKind.MALFORMED_SOURCE_TREE, location, err, hint);
    }

    // ==========================================================
    // Scheduling
    // ==========================================================

    /**
     * Execution order: producers before consumers, ties by declaration order. A feedback loop is
     * opened at its lowest-index stateful node.
     *
     * @throws StructuralCycleException if a loop contains no stateful node
     */
    public List<Integer> schedule() {
        int n = nodes.size();
        var broken = new HashSet<Long>();
        var indegree = new int[n];
        for (int from = 0; from < n; from++) {
            for (int to : successors.get(from)) {
                indegree[to]++;
            }
        }
        var scheduled = new boolean[n];
        var ready = new PriorityQueue<Integer>();
        for (int i = 0; i < n; i++) {
            if (indegree[i] == 0) ready.add(i);
        }
        var order = new ArrayList<Integer>(n);
        while (order.size() < n) {
            if (ready.isEmpty()) {
                var components = cyclicComponents(scheduled, broken);
                if (components.isEmpty()) {
                    throw new IllegalStateException(location + ": no schedulable node and no cycle");
                }
                for (var scc : components) {
                    var breaker = scc.stream().filter(i -> nodes.get(i).stateful()).findFirst();
                    if (breaker.isEmpty()) {
                        throw new StructuralCycleException(location,
                            scc.stream().map(i -> nodes.get(i).label()).toList());
                    }
                    int from = breaker.get();
                    for (int to : successors.get(from)) {
                        if (scc.contains(to) && broken.add(edge(from, to)) && --indegree[to] == 0) {
                            ready.add(to);
                        }
                    }
                }
                continue;
            }
            int next = ready.poll();
            scheduled[next] = true;
            order.add(next);
            for (int to : successors.get(next)) {
                if (!broken.contains(edge(next, to)) && --indegree[to] == 0) {
                    ready.add(to);
                }
            }
        }
        return order;
    }

    private static long edge(int from, int to) {
        return ((long) from << 32) | to;
    }

    /** Strongly connected components among unscheduled nodes that contain a cycle, members sorted. */
    private List<SortedSet<Integer>> cyclicComponents(boolean[] scheduled, Set<Long> broken) {
        var tarjan = new Tarjan(scheduled, broken);
        for (int i = 0; i < nodes.size(); i++) {
            if (!scheduled[i] && tarjan.index[i] < 0) {
                tarjan.visit(i);
            }
        }
        var cyclic = new ArrayList<SortedSet<Integer>>();
        for (var scc : tarjan.components) {
            int only = scc.first();
            if (scc.size() > 1 || (successors.get(only).contains(only) && !broken.contains(edge(only, only)))) {
                cyclic.add(scc);
            }
        }
        cyclic.sort(Comparator.comparing(SortedSet::first));
        return cyclic;
    }

    private final class Tarjan {
        final boolean[] scheduled;
        final Set<Long> broken;
        final int[] index;
        final int[] low;
        final boolean[] onStack;
        final Deque<Integer> stack = new ArrayDeque<>();
        final List<SortedSet<Integer>> components = new ArrayList<>();
        int counter = 0;

        Tarjan(boolean[] scheduled, Set<Long> broken) {
            this.scheduled = scheduled;
            this.broken = broken;
            this.index = new int[nodes.size()];
            this.low = new int[nodes.size()];
            this.onStack = new boolean[nodes.size()];
            Arrays.fill(index, -1);
        }

        void visit(int v) {
            index[v] = low[v] = counter++;
            stack.push(v);
            onStack[v] = true;
            for (int w : successors.get(v)) {
                if (scheduled[w] || broken.contains(edge(v, w))) continue;
                if (index[w] < 0) {
                    visit(w);
                    low[v] = Math.min(low[v], low[w]);
                } else if (onStack[w]) {
                    low[v] = Math.min(low[v], index[w]);
                }
            }
            if (low[v] == index[v]) {
                var scc = new TreeSet<Integer>();
                int w;
                do {
                    w = stack.pop();
                    onStack[w] = false;
                    scc.add(w);
                } while (w != v);
                components.add(scc);
            }
        }
    }
}
