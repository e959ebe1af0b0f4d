package org.l5xst;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import org.l5xst.convert.ConversionResult;
import org.l5xst.convert.Pipeline;

public class App {
    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("pipeline");

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_LOW_FIDELITY = 3;

    static final String USAGE = """
        usage:
          l5xst to-st  <input.L5X|dir> <output.st>  [--validate] [--verbose] [--dump-ir] [--config file]
          l5xst to-l5x <input.st>      <output.L5X> [--validate] [--verbose] [--config file]""";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    // ==========================================================
    // COMMAND LINE
    // ==========================================================

    record Options(
        String command,
        Path input,
        Path output,
        boolean validate,
        boolean verbose,
        boolean dumpIr,
        Optional<Path> config
    ) {}

    /** Thrown for arguments that do not form a command; reported with the usage text. */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static Options parse(String[] args) throws UsageException {
        var positional = new ArrayList<String>();
        boolean validate = false;
        boolean verbose = false;
        boolean dumpIr = false;
        Optional<Path> config = Optional.empty();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--validate" -> validate = true;
                case "--verbose" -> verbose = true;
                case "--dump-ir" -> dumpIr = true;
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new UsageException("--config needs a file");
                    }
                    config = Optional.of(Path.of(args[++i]));
                }
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("unknown option " + args[i]);
                    }
                    positional.add(args[i]);
                }
            }
        }
        if (positional.size() != 3) {
            throw new UsageException("expected a command, an input and an output");
        }
        var command = positional.get(0);
        if (!command.equals("to-st") && !command.equals("to-l5x")) {
            throw new UsageException("unknown command " + command);
        }
        if (dumpIr && command.equals("to-l5x")) {
            throw new UsageException("--dump-ir applies to to-st only");
        }
        return new Options(command, Path.of(positional.get(1)), Path.of(positional.get(2)),
            validate, verbose, dumpIr, config);
    }

    // ==========================================================
    // MAIN PIPELINE
    // ==========================================================

    static int run(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.verbose()) {
            Configurator.setAllLevels(LogManager.ROOT_LOGGER_NAME, Level.DEBUG);
        }
        if (!Files.exists(options.input())) {
            System.err.println("Cannot find input: " + options.input());
            return EXIT_USAGE;
        }

        try {
            var config = options.config().isPresent()
                ? ConversionConfig.load(options.config().get())
                : ConversionConfig.defaults();
            var pipeline = new Pipeline(config);

            ConversionResult result = options.command().equals("to-st")
                ? pipeline.toSt(options.input(), options.validate())
                : pipeline.toL5x(options.input(), options.validate());
            Pipeline.write(result, options.output());
            log.info("wrote {}", options.output());

            result.diagnostics().forEach(d -> System.err.println(d.summary()));
            if (options.dumpIr()) {
                System.out.println(JsonSupport.gson().toJson(result.ir()));
            }
            if (result.fidelity().isPresent()) {
                System.out.println(result.fidelity().get().toJson());
            }
            return pipeline.accepted(result) ? EXIT_OK : EXIT_LOW_FIDELITY;
        } catch (ConversionException e) {
            System.err.println(e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            System.err.println("Critical I/O Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }
}
