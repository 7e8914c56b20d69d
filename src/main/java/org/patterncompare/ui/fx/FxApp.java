package org.patterncompare.ui.fx;

import javafx.application.Application;
import javafx.concurrent.Task;
import javafx.scene.Scene;
import javafx.stage.Stage;
import org.patterncompare.app.api.ComparisonConfig;
import org.patterncompare.app.api.ComparisonUseCases;
import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.app.service.ComparisonApplicationService;
import org.patterncompare.ui.console.ConsoleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * JavaFX entry point.
 * Runs the comparison off the FX thread, prints the text report, then shows the heatmaps.
 */
public final class FxApp extends Application {

    private static final Logger log = LoggerFactory.getLogger(FxApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;

    @Override
    public void start(Stage stage) {
        // Arguments were checked in main before the toolkit started
        ComparisonConfig config = ComparisonConfig.fromArgs(getParameters().getRaw().toArray(new String[0]));

        ComparisonUseCases useCases = new ComparisonApplicationService();
        ComparisonView root = new ComparisonView();

        stage.setTitle("Antenna Pattern Comparison");
        stage.setScene(new Scene(root, 1400, 600));
        stage.show();

        Task<ComparisonReport> task = new Task<>() {
            @Override
            protected ComparisonReport call() {
                return useCases.compare(config);
            }
        };

        task.setOnSucceeded(e -> {
            ComparisonReport report = task.getValue();
            System.out.print(new ConsoleReport().format(report));
            stage.setTitle(String.format(Locale.ROOT, "Antenna Pattern Comparison (MSE: %.4f)", report.summary().mse()));
            root.show(report);
        });

        task.setOnFailed(e -> {
            Throwable err = task.getException();
            log.error("Comparison failed", err);
            root.setStatus("Comparison failed: " + (err == null ? "unknown error" : err.getMessage()));
        });

        Thread worker = new Thread(task, "pattern-comparison");
        worker.setDaemon(true);
        worker.start();
    }

    /**
     * Validates the command line without starting JavaFX.
     *
     * @return {@link #EXIT_OK}, or {@link #EXIT_USAGE} after logging the problem
     */
    static int checkArgs(String... args) {
        try {
            ComparisonConfig.fromArgs(args);
            return EXIT_OK;
        } catch (IllegalArgumentException ex) {
            log.error("{}", ex.getMessage());
            return EXIT_USAGE;
        }
    }

    public static void main(String[] args) {
        int code = checkArgs(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
        launch(args);
    }
}
