package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kurobe.exception.ConfigurationException;

import java.util.Locale;

/**
 * Chart kinds a panel can be rendered as.
 */
public enum ChartType {
    LINE,
    BAR,
    PIE,
    SCATTER,
    AREA,
    TABLE,
    METRIC,
    HEATMAP,
    GAUGE,
    FUNNEL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChartType fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Chart type is required");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported chart type: " + id);
        }
    }
}
