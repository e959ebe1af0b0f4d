package org.l5xst;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import org.l5xst.ir.IR;

class JsonSupportTest {
    @Test
    void optionalsAreWrittenAsValueOrNull() {
        var v = new IR.Var("Count", "DINT", List.of(), IR.SCOPE.PROGRAM, IR.TAG_KIND.BASE,
            Optional.of("5"), Optional.empty(), Optional.empty());
        var json = JsonParser.parseString(JsonSupport.gson().toJson(v)).getAsJsonObject();
        assertEquals("5", json.get("initialValue").getAsString());
        assertTrue(json.get("aliasFor").isJsonNull());
    }

    @Test
    void statementsAreWrittenWithTheirFields() {
        var program = new IR.Program("prog0", List.of(), List.of(), List.of(), List.of(
            new IR.Routine("MainRoutine", IR.ROUTINE_KIND.TEXT,
                List.of(new IR.Assign(IR.Ref.to("Y"), IR.Literal.TRUE)))));
        var json = JsonParser.parseString(JsonSupport.gson().toJson(program)).getAsJsonObject();
        var assign = json.getAsJsonArray("routines").get(0).getAsJsonObject()
            .getAsJsonArray("body").get(0).getAsJsonObject();
        assertEquals("Y", assign.getAsJsonObject("target").get("root").getAsString());
        assertEquals("TRUE", assign.getAsJsonObject("value").get("text").getAsString());
    }
}
