package org.l5xst.tables;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

class TablesTest {
    @Test
    void vendorTypesMapBothWays() {
        assertEquals("TON", TypeTable.toSt("TIMER"));
        assertEquals("CTU", TypeTable.toSt("counter"));
        assertEquals("BOOL", TypeTable.toSt("BIT"));
        assertEquals("Tank_t", TypeTable.toSt("Tank_t"));
        assertEquals("TIMER", TypeTable.toSource("TOF"));
        assertEquals("COUNTER", TypeTable.toSource("CTD"));
        assertEquals("REAL", TypeTable.toSource("REAL"));
    }

    @Test
    void typeClasses() {
        assertTrue(TypeTable.isInteger("dint"));
        assertFalse(TypeTable.isInteger("REAL"));
        assertTrue(TypeTable.isReal("LREAL"));
        assertTrue(TypeTable.isBlockStorage("FBD_BOOLEAN_AND"));
        assertFalse(TypeTable.isBlockStorage("FBD_ONESHOT"), "template struct, not storage");
        assertTrue(TypeTable.isGenericFunctionBlock("tof"));
        assertEquals("0.0", TypeTable.defaultValue("REAL"));
        assertEquals("FALSE", TypeTable.defaultValue("BOOL"));
    }

    @Test
    void reservedWordsPreferConfiguredNames() {
        var words = new ReservedWords(Map.of("type", "TYPE1", "Alarm", "alert"));
        assertEquals("TYPE1", words.rename("type"));
        assertEquals("alert", words.rename("ALARM"));
        assertEquals("Sqrt1", words.rename("Sqrt"));
        assertEquals("SETD1", words.rename("SETD"));
        assertEquals("Motor", words.rename("Motor"));
        assertTrue(words.isReserved("end_if"));
    }

    @Test
    void instructionsAndBlocksAreLookedUpIgnoringCase() {
        assertEquals(Instruction.Kind.TIMER, Instruction.lookup("ton").orElseThrow().kind());
        assertTrue(Instruction.lookup("PIDE").isEmpty());

        var timer = FbdBlockType.lookup("TONR").orElseThrow();
        assertEquals("TON", timer.target());
        assertTrue(timer.stateful());
        assertEquals("PT", timer.input("PRE").orElseThrow().target());
        assertEquals(AuxTemplate.SETD, FbdBlockType.SETD.template().orElseThrow());
        assertEquals(AuxTemplate.MSG, AuxTemplate.forStruct("message").orElseThrow());
    }
}
