package org.l5xst.convert;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.l5xst.ConversionConfig;
import org.l5xst.ConversionException;
import org.l5xst.ErrorKind;
import org.l5xst.l5x.L5xDocuments;
import org.l5xst.l5x.L5xLoader;
import org.l5xst.model.Controller;

class PipelineTest {
    private static Path plant;

    private final Pipeline pipeline = new Pipeline(ConversionConfig.defaults());

    @TempDir
    Path tmp;

    @BeforeAll
    static void locateFixtures() throws URISyntaxException {
        plant = Path.of(PipelineTest.class.getResource("/plant").toURI());
    }

    @Test
    void directoryInputsAreSortedByName() throws IOException {
        var inputs = Pipeline.inputs(plant);
        assertEquals(2, inputs.size());
        assertEquals("PlantA.L5X", inputs.get(0).getFileName().toString());
        assertEquals("PlantB.L5X", inputs.get(1).getFileName().toString());
    }

    @Test
    void directoryWithoutSourcesIsRejected() {
        var e = assertThrows(ConversionException.class, () -> Pipeline.inputs(tmp));
        assertEquals(ErrorKind.MALFORMED_SOURCE_TREE, e.kind());
    }

    @Test
    void twoControllersBecomeOneValidatedProgram() throws IOException {
        var result = pipeline.toSt(plant, true);
        var text = result.text();

        assertTrue(text.contains("FUNCTION_BLOCK Valve"), text);
        assertTrue(text.contains("PROGRAM prog0"), text);
        assertTrue(text.contains("(* Routine: PlantA/MainRoutine *)"), text);
        assertTrue(text.contains("T1(IN := Start, PT := T#1500ms);"), text);
        assertTrue(text.contains("Inbox := Level;"), "message write became a direct assignment\n" + text);
        assertTrue(text.contains("Level_2 := DINT_TO_REAL(Inbox);"), text);
        assertTrue(text.contains("Start_2"), text);

        assertTrue(result.ir().lookupVar("BAND_01_Out").isPresent());
        assertTrue(result.ir().lookupVar("BAND_01").isEmpty(), "unused block tag dropped");
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.kind() == ErrorKind.TYPE_MISMATCH));

        var fidelity = result.fidelity().orElseThrow();
        assertTrue(pipeline.accepted(result), fidelity.summary() + "\n" + fidelity.details());
    }

    @Test
    void sequentialAndParallelRunsAgree() throws IOException {
        var parallel = pipeline.toSt(plant, false);
        var sequential = new Pipeline(ConversionConfig.defaults().withParallel(false)).toSt(plant, false);
        assertEquals(sequential.text(), parallel.text());
        assertTrue(parallel.fidelity().isEmpty());
    }

    @Test
    void singleControllerKeepsItsNames() throws IOException {
        var result = pipeline.toSt(plant.resolve("PlantB.L5X"), false);
        assertTrue(result.text().contains("Level := DINT_TO_REAL(Inbox);"), result.text());
    }

    @Test
    void structuredTextRoundTripsThroughL5x() throws IOException {
        var st = pipeline.toSt(plant, false).text();
        var result = pipeline.toL5x(st, "plant.st", true);

        var controller = new L5xLoader().load(L5xDocuments.parse(result.text()));
        assertEquals("prog0", controller.name());
        assertEquals("Valve", controller.addOns().get(0).name());
        assertEquals(1, controller.programs().size());
        assertTrue(controller.programs().get(0).routines().stream()
            .allMatch(r -> r instanceof Controller.TextRoutine));

        var fidelity = result.fidelity().orElseThrow();
        assertTrue(pipeline.accepted(result), fidelity.summary() + "\n" + fidelity.details());
    }

    @Test
    void writeCreatesMissingDirectories() throws IOException {
        var result = pipeline.toSt(plant.resolve("PlantB.L5X"), false);
        var output = tmp.resolve("out/nested/plant.st");
        Pipeline.write(result, output);
        assertEquals(result.text(), Files.readString(output));
    }
}
