package org.l5xst;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AppTest {
    private static Path plant;

    @TempDir
    Path tmp;

    @BeforeAll
    static void locateFixtures() throws Exception {
        plant = Path.of(AppTest.class.getResource("/plant").toURI());
    }

    @Test
    void optionsAreParsed() throws Exception {
        var options = App.parse(new String[] {"to-st", "in.L5X", "out.st", "--validate", "--config", "c.json", "--dump-ir"});
        assertEquals("to-st", options.command());
        assertEquals(Path.of("in.L5X"), options.input());
        assertEquals(Path.of("out.st"), options.output());
        assertTrue(options.validate());
        assertTrue(options.dumpIr());
        assertFalse(options.verbose());
        assertEquals(Optional.of(Path.of("c.json")), options.config());
    }

    @Test
    void badArgumentsAreUsageErrors() {
        assertThrows(App.UsageException.class, () -> App.parse(new String[] {"to-st", "in.L5X"}));
        assertThrows(App.UsageException.class, () -> App.parse(new String[] {"compile", "a", "b"}));
        assertThrows(App.UsageException.class, () -> App.parse(new String[] {"to-st", "a", "b", "--fast"}));
        assertThrows(App.UsageException.class, () -> App.parse(new String[] {"to-l5x", "a", "b", "--dump-ir"}));
        assertThrows(App.UsageException.class, () -> App.parse(new String[] {"to-st", "a", "b", "--config"}));

        assertEquals(App.EXIT_USAGE, App.run(new String[] {}));
        assertEquals(App.EXIT_USAGE, App.run(new String[] {"to-st", tmp.resolve("missing.L5X").toString(), "out.st"}));
    }

    @Test
    void bothDirectionsFromTheCommandLine() throws Exception {
        var st = tmp.resolve("plant.st");
        assertEquals(App.EXIT_OK, App.run(new String[] {"to-st", plant.toString(), st.toString(), "--validate"}));
        assertTrue(Files.readString(st).contains("PROGRAM prog0"));

        var l5x = tmp.resolve("back/plant.L5X");
        assertEquals(App.EXIT_OK, App.run(new String[] {"to-l5x", st.toString(), l5x.toString(), "--validate"}));
        assertTrue(Files.readString(l5x).contains("<RSLogix5000Content"));
    }

    @Test
    void failuresHaveTheirOwnExitCodes() throws Exception {
        var broken = tmp.resolve("broken.st");
        Files.writeString(broken, "PROGRAM p\n  X := ;\nEND_PROGRAM\n");
        assertEquals(App.EXIT_FAILED, App.run(new String[] {"to-l5x", broken.toString(), tmp.resolve("o.L5X").toString()}));

        var strict = tmp.resolve("strict.json");
        Files.writeString(strict, "{\"fidelityThreshold\": 1.01}");
        assertEquals(App.EXIT_LOW_FIDELITY, App.run(new String[] {
            "to-st", plant.resolve("PlantB.L5X").toString(), tmp.resolve("b.st").toString(),
            "--validate", "--config", strict.toString()
        }));
        assertTrue(Files.exists(tmp.resolve("b.st")), "output is written even when fidelity is low");
    }
}
