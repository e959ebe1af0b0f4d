package org.l5xst.convert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;

import org.l5xst.ConversionConfig;
import org.l5xst.ConversionException;
import org.l5xst.Diagnostic;
import org.l5xst.ErrorKind;
import org.l5xst.consolidate.Consolidator;
import org.l5xst.fidelity.FidelityReport;
import org.l5xst.fidelity.FidelityScorer;
import org.l5xst.ir.IR;
import org.l5xst.ir.TypeCoercion;
import org.l5xst.l5x.L5xDocuments;
import org.l5xst.l5x.L5xEmitter;
import org.l5xst.l5x.L5xLoader;
import org.l5xst.model.Controller;
import org.l5xst.st.StEmitter;
import org.l5xst.st.StParser;
import org.l5xst.st.StPrinter;
import org.l5xst.st.StToIr;

/**
 * Both conversion directions, from files or from in-memory documents.
 *
 * <pre>
 *   L5X files -> Controller -> IR (per controller) -> consolidated IR -> ST text
 *   ST text   -> IR -> L5X document
 * </pre>
 *
 * Validation converts the output back into IR and scores it against the IR the output was
 * written from.
 */
public class Pipeline {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("pipeline");

    static final String SOURCE_EXTENSION = ".l5x";

    private final ConversionConfig config;
    private final StParser stParser = new StParser();
    private final StToIr stToIr = new StToIr();
    private final FidelityScorer scorer = new FidelityScorer();

    public Pipeline(ConversionConfig config) {
        this.config = config;
    }

    // ==========================================================
    // Source format to Structured Text
    // ==========================================================

    /** Input files of a run: the file itself, or every L5X file of a directory sorted by name. */
    public static List<Path> inputs(Path input) throws IOException {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> files = Files.list(input)) {
            var found = files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SOURCE_EXTENSION))
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString().toLowerCase(Locale.ROOT)))
                .toList();
            if (found.isEmpty()) {
                throw new ConversionException(ErrorKind.MALFORMED_SOURCE_TREE, input.toString(),
                    "directory holds no L5X files", "pass an .L5X file or a directory of them");
            }
            return found;
        }
    }

    public ConversionResult toSt(Path input, boolean validate) throws IOException {
        var documents = new ArrayList<Document>();
        for (var file : inputs(input)) {
            log.info("reading {}", file);
            documents.add(L5xDocuments.read(file));
        }
        return toSt(documents, validate);
    }

    public ConversionResult toSt(List<Document> documents, boolean validate) {
        var loader = new L5xLoader();
        var controllers = documents.stream().map(loader::load).toList();
        return convertControllers(controllers, validate);
    }

    public ConversionResult convertControllers(List<Controller> controllers, boolean validate) {
        var results = translateAll(controllers);
        var diagnostics = new ArrayList<Diagnostic>();
        var units = new ArrayList<IR.Program>();
        for (var result : results) {
            units.add(result.program());
            diagnostics.addAll(result.diagnostics());
        }

        var consolidated = new Consolidator(config).consolidate(units);
        diagnostics.addAll(consolidated.diagnostics());
        var coerced = new TypeCoercion().apply(consolidated.program());
        diagnostics.addAll(coerced.diagnostics());

        var program = coerced.program();
        var text = StPrinter.print(new StEmitter(config).fromIR(program, diagnostics));
        log.info("{} controller(s) converted to program {} with {} diagnostic(s)",
            controllers.size(), program.name(), diagnostics.size());

        var result = new ConversionResult(text, program, diagnostics, Optional.empty());
        if (validate) {
            var reparsed = stToIr.toIR(stParser.parse(text, "output"), "output");
            result = result.withFidelity(score(program, reparsed));
        }
        return result;
    }

    /** Controllers are independent, so they are translated concurrently when enabled. */
    private List<IrConverter.Result> translateAll(List<Controller> controllers) {
        var converter = new IrConverter();
        if (!config.parallel() || controllers.size() < 2) {
            return controllers.stream().map(converter::toIR).toList();
        }
        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(controllers.size(), Runtime.getRuntime().availableProcessors()));
        try {
            var tasks = new ArrayList<Callable<IrConverter.Result>>();
            for (var controller : controllers) {
                tasks.add(() -> converter.toIR(controller));
            }
            var results = new ArrayList<IrConverter.Result>();
            for (Future<IrConverter.Result> future : pool.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while translating controllers", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("controller translation failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    // ==========================================================
    // Structured Text to source format
    // ==========================================================

    public ConversionResult toL5x(Path input, boolean validate) throws IOException {
        log.info("reading {}", input);
        var text = Files.readString(input, StandardCharsets.UTF_8);
        return toL5x(text, input.getFileName().toString(), validate);
    }

    public ConversionResult toL5x(String stText, String origin, boolean validate) {
        var program = stToIr.toIR(stParser.parse(stText, origin), origin);
        var document = new L5xEmitter(config).emit(program);
        var xml = L5xDocuments.write(document);
        log.info("program {} written as controller with {} routine(s)", program.name(), program.routines().size());

        var result = new ConversionResult(xml, program, List.of(), Optional.empty());
        if (validate) {
            var reloaded = new IrConverter().toIR(new L5xLoader().load(L5xDocuments.parse(xml)));
            result = new ConversionResult(xml, program, reloaded.diagnostics(), Optional.empty())
                .withFidelity(score(program, reloaded.program()));
        }
        return result;
    }

    // ==========================================================
    // Validation
    // ==========================================================

    private FidelityReport score(IR.Program expected, IR.Program actual) {
        var report = scorer.compare(expected, actual);
        if (report.meets(config.fidelityThreshold())) {
            log.info("fidelity {}", report.summary());
        } else {
            log.warn("fidelity {} below threshold {}", report.summary(), config.fidelityThreshold());
        }
        return report;
    }

    public boolean accepted(ConversionResult result) {
        return result.fidelity().map(r -> r.meets(config.fidelityThreshold())).orElse(true);
    }

    public static void write(ConversionResult result, Path output) throws IOException {
        var parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, result.text(), StandardCharsets.UTF_8);
    }
}
