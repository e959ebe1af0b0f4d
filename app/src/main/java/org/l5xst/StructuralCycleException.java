package org.l5xst;

import java.util.List;

/**
 * A dataflow sheet whose feedback loop is not broken by any stateful block.
 */
public class StructuralCycleException extends ConversionException {
    private final List<String> members;

    public StructuralCycleException(String location, List<String> members) {
        super(
            ErrorKind.STRUCTURAL_CYCLE,
            location,
            "combinational cycle through " + String.join(", ", members),
            "insert a stateful block (timer, latch, one-shot) into the loop or remove one of its wires"
        );
        this.members = List.copyOf(members);
    }

    public List<String> members() {
        return members;
    }
}
