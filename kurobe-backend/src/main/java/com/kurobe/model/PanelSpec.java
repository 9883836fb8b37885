package com.kurobe.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Declarative chart specification produced by a visualization engine.
 *
 * <p>Either {@code data} or {@code queryResult} carries the values to render.
 * {@code width} is a 1-12 grid span.
 */
@Value
@Builder(toBuilder = true)
public class PanelSpec {
    public static final int MIN_WIDTH = 1;
    public static final int MAX_WIDTH = 12;

    String id;
    ChartType type;
    String title;
    String description;
    List<DataPoint> data;
    QueryResult queryResult;
    @Builder.Default
    Map<String, Object> config = Map.of();
    @Builder.Default
    int width = 6;
    @Builder.Default
    int height = 4;
    @Builder.Default
    OffsetDateTime createdAt = OffsetDateTime.now();
    @Builder.Default
    OffsetDateTime updatedAt = OffsetDateTime.now();
}
