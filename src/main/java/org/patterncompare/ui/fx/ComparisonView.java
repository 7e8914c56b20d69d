package org.patterncompare.ui.fx;

import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.Label;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.ColumnConstraints;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.RowConstraints;
import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.app.api.dto.HeatmapView;
import org.patterncompare.ui.console.ConsoleReport;

/**
 * Main window content:
 * - Center: reconstruction, reference and absolute-error heatmaps side by side
 * - Bottom: statistics bar (or the loading/failure message)
 *
 * Stateless apart from the widgets: a new report means a new view.
 */
public final class ComparisonView extends BorderPane {

    private final Label statusBar = new Label("Loading...");

    public ComparisonView() {
        setPadding(new Insets(14));
        HBox bottom = new HBox(statusBar);
        bottom.setAlignment(Pos.CENTER);
        bottom.setPadding(new Insets(10));
        statusBar.setStyle("-fx-font-size: 13px; -fx-font-weight: 700;");
        setBottom(bottom);
    }

    public void show(ComparisonReport report) {
        GridPane panels = new GridPane();
        panels.setHgap(10);
        RowConstraints row = new RowConstraints();
        row.setVgrow(Priority.ALWAYS);
        panels.getRowConstraints().add(row);

        int col = 0;
        for (HeatmapView heatmap : report.heatmaps()) {
            ColumnConstraints cc = new ColumnConstraints();
            cc.setPercentWidth(100.0 / report.heatmaps().size());
            cc.setHgrow(Priority.ALWAYS);
            panels.getColumnConstraints().add(cc);

            // Columns are the second coordinate (X), rows the first (Y)
            HeatmapPanel panel = new HeatmapPanel(heatmap, report.coordBField(), report.coordAField());
            GridPane.setVgrow(panel, Priority.ALWAYS);
            panels.add(panel, col++, 0);
        }

        setCenter(panels);
        statusBar.setText(ConsoleReport.statisticsLine(report.summary()));
    }

    public void setStatus(String msg) {
        statusBar.setText(msg);
    }
}
