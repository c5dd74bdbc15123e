package com.budgetam.tools;

import com.budgetam.loader.BudgetLoader;
import com.budgetam.loader.LoaderException;
import com.budgetam.loader.LoaderResult;
import com.budgetam.schema.SourceKind;
import com.budgetam.validation.ValidationRegistry;
import com.budgetam.validation.ValidationReport;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses and validates a batch of workbooks, one worker task per {@code year:KIND:path} input. A
 * failing input is reported on its own line and never stops the others.
 */
public final class BudgetBatchCli {
    private static final Logger LOGGER = Logger.getLogger(BudgetBatchCli.class.getName());
    private static final String USAGE =
            "Usage: BudgetBatchCli [--strict] [--verbose] [--report-dir DIR] [--threads N] <year>:<KIND>:<path>...";

    record Input(int year, SourceKind kind, Path path) {
        static Input parse(String text) {
            String[] parts = text.split(":", 3);
            if (parts.length != 3 || parts[2].isEmpty()) {
                throw new IllegalArgumentException("Expected <year>:<KIND>:<path> but got " + text);
            }
            int year;
            try {
                year = Integer.parseInt(parts[0].trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid year in " + text, ex);
            }
            return new Input(year, SourceKind.parse(parts[1]), Path.of(parts[2]));
        }
    }

    record Options(boolean strict, boolean verbose, Path reportDir, int threads, List<Input> inputs) {
        static Options parse(String[] args) {
            boolean strict = false;
            boolean verbose = false;
            Path reportDir = null;
            int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
            List<Input> inputs = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--strict" -> strict = true;
                    case "--verbose" -> verbose = true;
                    case "--report-dir" -> reportDir = Path.of(requireValue(args, ++i, arg));
                    case "--threads" -> {
                        String value = requireValue(args, ++i, arg);
                        try {
                            threads = Integer.parseInt(value);
                        } catch (NumberFormatException ex) {
                            throw new IllegalArgumentException("Invalid thread count: " + value, ex);
                        }
                        if (threads < 1) {
                            throw new IllegalArgumentException("Thread count must be positive: " + value);
                        }
                    }
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        inputs.add(Input.parse(arg));
                    }
                }
            }
            if (inputs.isEmpty()) {
                throw new IllegalArgumentException("No inputs given");
            }
            return new Options(strict, verbose, reportDir, threads, List.copyOf(inputs));
        }

        private static String requireValue(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            return args[index];
        }
    }

    /** One output line per input. */
    record Outcome(Input input, boolean ok, String reason) {
        String line() {
            return input.year() + " " + input.kind().name() + " " + (ok ? "OK" : "FAIL") + " " + reason;
        }
    }

    private BudgetBatchCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return process exit code: 0 when every input parsed and validated, 1 when any failed, 2 on
     *     usage errors
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return 2;
        }
        if (options.verbose()) {
            enableVerboseLogging();
        }
        if (options.reportDir() != null) {
            try {
                Files.createDirectories(options.reportDir());
            } catch (IOException ex) {
                err.println("Cannot create report directory " + options.reportDir() + ": " + ex.getMessage());
                return 2;
            }
        }

        List<Outcome> outcomes = process(options);
        boolean failed = false;
        for (Outcome outcome : outcomes) {
            out.println(outcome.line());
            failed |= !outcome.ok();
        }
        return failed ? 1 : 0;
    }

    static List<Outcome> process(Options options) {
        int threads = Math.min(options.threads(), options.inputs().size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Input input : options.inputs()) {
                futures.add(executor.submit(() -> processOne(input, options)));
            }
            List<Outcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                Input input = options.inputs().get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    LOGGER.log(Level.SEVERE, "Unexpected failure for " + input.path(), cause);
                    String reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    outcomes.add(new Outcome(input, false, reason));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    outcomes.add(new Outcome(input, false, "interrupted"));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Outcome processOne(Input input, Options options) throws IOException {
        LoaderResult result;
        try {
            result = new BudgetLoader().load(input.path(), input.kind(), input.year());
        } catch (LoaderException ex) {
            LOGGER.log(Level.WARNING, "Failed to parse {0}: {1}", new Object[] {input.path(), ex.getMessage()});
            return new Outcome(input, false, ex.getMessage());
        }
        ValidationReport report = ValidationRegistry.defaultChecks().validate(result.getDataset());
        if (options.reportDir() != null) {
            String prefix = input.year() + "_" + input.kind().name() + "_report";
            report.writeMarkdown(options.reportDir().resolve(prefix + ".md"));
            report.writeJson(options.reportDir().resolve(prefix + ".json"));
        }
        if (options.verbose()) {
            LOGGER.info(report.toConsoleSummary());
        }
        int records = result.getDataset().getRecords().size();
        if (report.hasErrors(options.strict())) {
            return new Outcome(input, false, "validation failed: " + report.getErrorCount() + " errors, "
                    + report.getWarningCount() + " warnings");
        }
        return new Outcome(input, true, records + " records, " + report.getWarningCount() + " warnings");
    }

    /** Idempotent: repeated runs in one JVM reuse the console handler installed by the first. */
    private static synchronized void enableVerboseLogging() {
        Logger root = Logger.getLogger("com.budgetam");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
                return;
            }
        }
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }
}
