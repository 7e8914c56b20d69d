package org.patterncompare.ui.console;

import org.patterncompare.app.api.ComparisonConfig;
import org.patterncompare.app.api.ComparisonUseCases;
import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.app.service.ComparisonApplicationService;
import org.patterncompare.exceptions.ComparisonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Headless entry point: compares two files and prints the statistics report.
 *
 * Exit codes: 0 success, 1 bad arguments, 2 comparison failure.
 */
public final class ConsoleApp {

    private static final Logger log = LoggerFactory.getLogger(ConsoleApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private final ComparisonUseCases useCases;
    private final PrintStream out;

    ConsoleApp(ComparisonUseCases useCases, PrintStream out) {
        this.useCases = useCases;
        this.out = out;
    }

    int run(String... args) {
        ComparisonConfig config;
        try {
            config = ComparisonConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return EXIT_USAGE;
        }

        try {
            ComparisonReport report = useCases.compare(config);
            out.print(new ConsoleReport().format(report));
            out.flush();
            return EXIT_OK;
        } catch (ComparisonException e) {
            log.error("Comparison failed: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    public static void main(String[] args) {
        int code = new ConsoleApp(new ComparisonApplicationService(), System.out).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }
}
