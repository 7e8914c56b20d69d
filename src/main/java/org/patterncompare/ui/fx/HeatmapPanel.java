package org.patterncompare.ui.fx;

import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.geometry.VPos;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Label;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import javafx.scene.layout.Pane;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;
import javafx.scene.text.TextAlignment;
import org.patterncompare.app.api.dto.HeatmapKind;
import org.patterncompare.app.api.dto.HeatmapView;

import java.util.Locale;
import java.util.Objects;

/**
 * One heatmap with its colour bar:
 * - columns along X, rows along Y with the first row at the bottom
 * - bilinear smoothing when the grid is scaled to the panel
 * - colour bounds from the NaN-ignoring min/max of the grid
 */
public final class HeatmapPanel extends VBox {

    private static final double MARGIN_LEFT = 56;
    private static final double MARGIN_BOTTOM = 40;
    private static final double MARGIN_TOP = 8;
    private static final double BAR_WIDTH = 16;
    private static final double BAR_GAP = 14;
    private static final double BAR_LABEL_WIDTH = 70;
    private static final Font AXIS_FONT = Font.font("System", 11);

    private final HeatmapView heatmap;
    private final String xLabel;
    private final String yLabel;
    private final ColorRamp ramp;
    private final WritableImage image;
    private final Canvas canvas = new Canvas(420, 480);

    /**
     * @param heatmap grid to draw
     * @param xLabel  column coordinate name (e.g. Theta[deg])
     * @param yLabel  row coordinate name (e.g. Phi[deg])
     */
    public HeatmapPanel(HeatmapView heatmap, String xLabel, String yLabel) {
        this.heatmap = Objects.requireNonNull(heatmap, "heatmap must not be null");
        this.xLabel = Objects.requireNonNull(xLabel, "xLabel must not be null");
        this.yLabel = Objects.requireNonNull(yLabel, "yLabel must not be null");
        this.ramp = new ColorRamp(heatmap.kind() == HeatmapKind.ERROR ? ColorRamp.Palette.JET : ColorRamp.Palette.SPECTRAL);
        this.image = rasterize();

        Label title = new Label(heatmap.title());
        title.setStyle("-fx-font-size: 13px; -fx-font-weight: 700;");

        Pane holder = new Pane(canvas);
        holder.setMinSize(200, 200);
        VBox.setVgrow(holder, Priority.ALWAYS);
        canvas.widthProperty().bind(holder.widthProperty());
        canvas.heightProperty().bind(holder.heightProperty());
        canvas.widthProperty().addListener((o, a, b) -> redraw());
        canvas.heightProperty().addListener((o, a, b) -> redraw());

        setSpacing(6);
        setAlignment(Pos.TOP_CENTER);
        setPadding(new Insets(10));
        setStyle("""
                -fx-background-color: white;
                -fx-border-color: #e8e8e8;
                -fx-border-radius: 14;
                -fx-background-radius: 14;
                """);
        getChildren().addAll(title, holder);
        redraw();
    }

    /** One pixel per cell; row 0 lands on the bottom image line. */
    private WritableImage rasterize() {
        int rows = heatmap.rows();
        int cols = heatmap.columns();
        WritableImage img = new WritableImage(Math.max(cols, 1), Math.max(rows, 1));
        PixelWriter pw = img.getPixelWriter();
        double[][] values = heatmap.values();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                pw.setArgb(c, rows - 1 - r, ramp.argb(values[r][c], heatmap.min(), heatmap.max()));
            }
        }
        return img;
    }

    private void redraw() {
        double w = canvas.getWidth();
        double h = canvas.getHeight();
        GraphicsContext g = canvas.getGraphicsContext2D();
        g.clearRect(0, 0, w, h);

        double plotW = w - MARGIN_LEFT - BAR_GAP - BAR_WIDTH - BAR_LABEL_WIDTH;
        double plotH = h - MARGIN_TOP - MARGIN_BOTTOM;
        if (plotW <= 10 || plotH <= 10) return;

        g.setImageSmoothing(true);
        g.drawImage(image, MARGIN_LEFT, MARGIN_TOP, plotW, plotH);
        g.setStroke(Color.web("#9a9a9a"));
        g.strokeRect(MARGIN_LEFT, MARGIN_TOP, plotW, plotH);

        g.setFill(Color.web("#333333"));
        g.setFont(AXIS_FONT);

        // X axis: column coordinate range
        g.setTextBaseline(VPos.TOP);
        g.setTextAlign(TextAlignment.LEFT);
        g.fillText(fmt(heatmap.columnMin()), MARGIN_LEFT, MARGIN_TOP + plotH + 4);
        g.setTextAlign(TextAlignment.RIGHT);
        g.fillText(fmt(heatmap.columnMax()), MARGIN_LEFT + plotW, MARGIN_TOP + plotH + 4);
        g.setTextAlign(TextAlignment.CENTER);
        g.fillText(xLabel, MARGIN_LEFT + plotW / 2, MARGIN_TOP + plotH + 20);

        // Y axis: row coordinate range, smallest at the bottom
        g.setTextAlign(TextAlignment.RIGHT);
        g.setTextBaseline(VPos.BOTTOM);
        g.fillText(fmt(heatmap.rowMin()), MARGIN_LEFT - 4, MARGIN_TOP + plotH);
        g.setTextBaseline(VPos.TOP);
        g.fillText(fmt(heatmap.rowMax()), MARGIN_LEFT - 4, MARGIN_TOP);
        g.save();
        g.translate(14, MARGIN_TOP + plotH / 2);
        g.rotate(-90);
        g.setTextAlign(TextAlignment.CENTER);
        g.setTextBaseline(VPos.CENTER);
        g.fillText(yLabel, 0, 0);
        g.restore();

        drawColorBar(g, MARGIN_LEFT + plotW + BAR_GAP, MARGIN_TOP, plotH);
    }

    private void drawColorBar(GraphicsContext g, double x, double y, double height) {
        int steps = (int) Math.max(1, Math.round(height));
        for (int i = 0; i < steps; i++) {
            double t = 1.0 - (double) i / Math.max(1, steps - 1);
            g.setFill(toColor(ramp.argbAt(t)));
            g.fillRect(x, y + i, BAR_WIDTH, 1.5);
        }
        g.setStroke(Color.web("#9a9a9a"));
        g.strokeRect(x, y, BAR_WIDTH, height);

        g.setFill(Color.web("#333333"));
        g.setTextAlign(TextAlignment.LEFT);
        g.setTextBaseline(VPos.TOP);
        g.fillText(fmt(heatmap.max()), x + BAR_WIDTH + 4, y);
        g.setTextBaseline(VPos.BOTTOM);
        g.fillText(fmt(heatmap.min()), x + BAR_WIDTH + 4, y + height);
        g.setTextBaseline(VPos.CENTER);
        g.fillText(heatmap.unitLabel(), x + BAR_WIDTH + 4, y + height / 2);
    }

    private static Color toColor(int argb) {
        return Color.rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, ((argb >>> 24) & 0xFF) / 255.0);
    }

    private static String fmt(double v) {
        return Double.isNaN(v) ? "n/a" : String.format(Locale.ROOT, "%.2f", v);
    }
}
