package org.l5xst.l5x;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.ir.IR;
import org.l5xst.model.Controller;

class L5xLoaderTest {
    private final L5xLoader loader = new L5xLoader();

    private static Controller plantA() throws IOException, URISyntaxException {
        var file = Path.of(L5xLoaderTest.class.getResource("/plant/PlantA.L5X").toURI());
        return new L5xLoader().load(L5xDocuments.read(file));
    }

    private static String controller(String body) {
        return """
            <?xml version="1.0" encoding="UTF-8"?>
            <RSLogix5000Content SchemaRevision="1.0">
            <Controller Name="Unit">
            %s
            </Controller>
            </RSLogix5000Content>
            """.formatted(body);
    }

    @Test
    void declarationsAreRead() throws Exception {
        var plant = plantA();
        assertEquals("PlantA", plant.name());

        var start = plant.tags().get(0);
        assertEquals("Start", start.name());
        assertEquals(Optional.of("FALSE"), start.value());
        assertEquals(IR.SCOPE.CONTROLLER, start.scope());

        var report = plant.tags().stream().filter(t -> t.name().equals("Report")).findFirst().orElseThrow();
        assertEquals(Optional.of(new IR.Message("RIO2", "Level", "Inbox", true)), report.message());

        var valve = plant.addOns().get(0);
        assertEquals(List.of("Cmd", "Open"), valve.params().stream().map(Controller.AddOnParam::name).toList());
        assertEquals(Controller.USAGE.OUTPUT, valve.params().get(1).usage());
    }

    @Test
    void routinesOfEveryLanguageAreRead() throws Exception {
        var program = plantA().programs().get(0);
        assertEquals(Optional.of("MainRoutine"), program.mainRoutine());
        assertEquals(IR.SCOPE.PROGRAM, program.tags().get(0).scope());

        var text = (Controller.TextRoutine) program.routines().get(0);
        assertEquals("Count := Count + 1;\nIF Count > 100 THEN\n    Count := 0;\nEND_IF;", text.text());

        var ladder = (Controller.LadderRoutine) program.routines().get(1);
        assertEquals(4, ladder.rungs().size());
        assertEquals(Optional.of("Start delay"), ladder.rungs().get(0).comment());

        var flow = (Controller.FbdRoutine) program.routines().get(2);
        var sheet = flow.sheets().get(0);
        assertEquals(4, sheet.elements().size(), "text box is not an element");
        assertEquals(3, sheet.wires().size());
        assertEquals(new Controller.Block("2", "BAND", "BAND_01", false, Map.of()), sheet.elements().get(2));
    }

    @Test
    void aliasTypeIsLeftForResolution() {
        var doc = L5xDocuments.parse(controller("""
            <Tags>
            <Tag Name="Running" TagType="Alias" AliasFor="Status.3"/>
            <Tag Name="Speeds" TagType="Base" DataType="REAL" Dimensions="4"/>
            </Tags>
            """));
        var tags = loader.load(doc).tags();
        assertEquals(IR.TAG_KIND.ALIAS, tags.get(0).kind());
        assertEquals("", tags.get(0).dataType());
        assertEquals(Optional.of("Status.3"), tags.get(0).aliasFor());
        assertEquals(List.of(4), tags.get(1).dims());
    }

    @Test
    void sequentialFunctionChartsAreSkipped() {
        var doc = L5xDocuments.parse(controller("""
            <Programs><Program Name="P"><Routines>
            <Routine Name="Steps" Type="SFC"/>
            <Routine Name="Main" Type="ST"><STContent><Line Number="0"><![CDATA[X := 1;]]></Line></STContent></Routine>
            </Routines></Program></Programs>
            """));
        var routines = loader.load(doc).programs().get(0).routines();
        assertEquals(1, routines.size());
        assertEquals("Main", routines.get(0).name());
    }

    @Test
    void malformedTreesAreRejected() {
        var unknownType = L5xDocuments.parse(controller("""
            <Programs><Program Name="P"><Routines><Routine Name="R" Type="IL"/></Routines></Program></Programs>
            """));
        var e = assertThrows(ConversionException.class, () -> loader.load(unknownType));
        assertEquals(ErrorKind.MALFORMED_SOURCE_TREE, e.kind());

        var noType = L5xDocuments.parse(controller("<Tags><Tag Name=\"X\"/></Tags>"));
        assertThrows(ConversionException.class, () -> loader.load(noType));

        var wrongRoot = L5xDocuments.parse("<Project/>");
        assertThrows(ConversionException.class, () -> loader.load(wrongRoot));

        var e2 = assertThrows(ConversionException.class, () -> L5xDocuments.parse("<RSLogix5000Content>"));
        assertEquals(ErrorKind.MALFORMED_SOURCE_TREE, e2.kind());
    }
}
