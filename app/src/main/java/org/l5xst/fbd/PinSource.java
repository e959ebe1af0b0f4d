package org.l5xst.fbd;

/**
 * Where a block input takes its value from. An input with no entry keeps the value
 * stored in the block's own instance.
 */
public sealed interface PinSource permits PinSource.Wire, PinSource.Literal, PinSource.Tag {
    /** Output pin {@code pin} of the node at index {@code producer}. */
    record Wire(int producer, String pin) implements PinSource {}

    record Literal(String value) implements PinSource {}

    /** A tag read through an input reference. */
    record Tag(String operand) implements PinSource {}
}
