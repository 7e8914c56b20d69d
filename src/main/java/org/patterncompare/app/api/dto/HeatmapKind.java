package org.patterncompare.app.api.dto;

/** Whether a heatmap shows pattern values or error magnitudes; drives the colour palette. */
public enum HeatmapKind {
    VALUE,
    ERROR
}
