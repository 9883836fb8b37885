package com.kurobe.engine.visualization;

import com.kurobe.engine.AbstractEngine;
import com.kurobe.engine.VisualizationEngine;
import com.kurobe.exception.ConfigurationException;
import com.kurobe.model.ChartType;
import com.kurobe.model.DataPoint;
import com.kurobe.model.EngineConfig;
import com.kurobe.model.PanelSpec;
import com.kurobe.model.QueryResult;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Rule-based panel recommendations from the shape of a query result.
 *
 * <ul>
 *   <li>one row, one column: METRIC</li>
 *   <li>temporal column plus numeric columns: LINE</li>
 *   <li>category column plus numeric column: BAR, and PIE for few non-negative categories</li>
 *   <li>two numeric columns: SCATTER</li>
 * </ul>
 * A TABLE panel over the raw result is always appended last.
 *
 * <p>Settings: {@code pie_max_categories} (6).
 */
public class HeuristicVisualizationEngine extends AbstractEngine implements VisualizationEngine {

    public static final String PROVIDER = "heuristic";
    static final int DEFAULT_PIE_MAX_CATEGORIES = 6;

    private enum Kind {
        NUMERIC,
        TEMPORAL,
        CATEGORY
    }

    private int pieMaxCategories = DEFAULT_PIE_MAX_CATEGORIES;

    public HeuristicVisualizationEngine(EngineConfig config) {
        super(config);
    }

    @Override
    protected void doInitialize() {
        String raw = config.getString("pie_max_categories", null);
        if (raw != null) {
            try {
                pieMaxCategories = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("pie_max_categories must be an integer: " + raw);
            }
        }
    }

    @Override
    public List<PanelSpec> recommendVisualization(QueryResult result, String question, Map<String, Object> context) {
        requireReady();
        List<PanelSpec> panels = new ArrayList<>();
        List<String> columns = result.getColumns();

        if (!result.isEmpty() && !columns.isEmpty()) {
            List<Kind> kinds = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                kinds.add(classify(result, i));
            }

            if (result.getRowCount() == 1 && columns.size() == 1) {
                panels.add(metric(result, question));
            } else {
                int temporal = kinds.indexOf(Kind.TEMPORAL);
                int category = kinds.indexOf(Kind.CATEGORY);
                List<Integer> numeric = new ArrayList<>();
                for (int i = 0; i < kinds.size(); i++) {
                    if (kinds.get(i) == Kind.NUMERIC) {
                        numeric.add(i);
                    }
                }

                if (temporal >= 0 && !numeric.isEmpty()) {
                    panels.add(line(result, temporal, numeric, question));
                } else if (category >= 0 && !numeric.isEmpty()) {
                    int value = numeric.get(0);
                    panels.add(bar(result, category, value, question));
                    if (pieFits(result, category, value)) {
                        panels.add(pie(result, category, value, question));
                    }
                } else if (numeric.size() >= 2) {
                    panels.add(scatter(result, numeric.get(0), numeric.get(1), question));
                }
            }
        }

        panels.add(table(result, question));
        log.debug("Recommended panels: engine={}, columns={}, rows={}, panels={}",
                config.getName(), columns.size(), result.getRowCount(), panels.size());
        return panels;
    }

    @Override
    public PanelSpec optimizeVisualization(PanelSpec panel, Map<String, Object> feedback) {
        requireReady();
        if (feedback == null || feedback.isEmpty()) {
            return panel;
        }
        PanelSpec.PanelSpecBuilder builder = panel.toBuilder();
        Object type = feedback.get("type");
        if (type != null) {
            builder.type(type instanceof ChartType chartType ? chartType : ChartType.fromId(String.valueOf(type)));
        }
        Object title = feedback.get("title");
        if (title != null) {
            builder.title(String.valueOf(title));
        }
        Object width = feedback.get("width");
        if (width != null) {
            builder.width(Math.max(PanelSpec.MIN_WIDTH, Math.min(PanelSpec.MAX_WIDTH, toInt("width", width))));
        }
        Object height = feedback.get("height");
        if (height != null) {
            builder.height(Math.max(1, toInt("height", height)));
        }
        Object extra = feedback.get("config");
        if (extra instanceof Map<?, ?> map) {
            Map<String, Object> merged = new LinkedHashMap<>(panel.getConfig());
            map.forEach((k, v) -> merged.put(String.valueOf(k), v));
            builder.config(merged);
        } else if (extra != null) {
            throw new ConfigurationException("Panel feedback 'config' must be an object");
        }
        return builder.updatedAt(OffsetDateTime.now()).build();
    }

    private PanelSpec metric(QueryResult result, String question) {
        String column = result.getColumns().get(0);
        Object value = result.getRows().get(0).get(0);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("value", value);
        DataPoint point = DataPoint.builder()
                .x(column)
                .y(value instanceof Number n ? n : null)
                .series(column)
                .metadata(metadata)
                .build();
        return panel(ChartType.METRIC, column, question)
                .data(List.of(point))
                .config(Map.of("value_column", column))
                .width(3)
                .height(2)
                .build();
    }

    private PanelSpec line(QueryResult result, int x, List<Integer> ys, String question) {
        List<DataPoint> points = new ArrayList<>();
        List<String> yNames = new ArrayList<>();
        for (int y : ys) {
            String series = result.getColumns().get(y);
            yNames.add(series);
            points.addAll(points(result, x, y, series));
        }
        String xName = result.getColumns().get(x);
        return panel(ChartType.LINE, String.join(", ", yNames) + " over " + xName, question)
                .data(points)
                .config(Map.of("x_axis", xName, "y_axis", yNames))
                .width(PanelSpec.MAX_WIDTH)
                .build();
    }

    private PanelSpec bar(QueryResult result, int category, int value, String question) {
        String xName = result.getColumns().get(category);
        String yName = result.getColumns().get(value);
        return panel(ChartType.BAR, yName + " by " + xName, question)
                .data(points(result, category, value, yName))
                .config(Map.of("x_axis", xName, "y_axis", yName))
                .build();
    }

    private PanelSpec pie(QueryResult result, int category, int value, String question) {
        String label = result.getColumns().get(category);
        String yName = result.getColumns().get(value);
        return panel(ChartType.PIE, yName + " share by " + label, question)
                .data(points(result, category, value, yName))
                .config(Map.of("label", label, "value", yName))
                .build();
    }

    private PanelSpec scatter(QueryResult result, int x, int y, String question) {
        String xName = result.getColumns().get(x);
        String yName = result.getColumns().get(y);
        return panel(ChartType.SCATTER, yName + " vs " + xName, question)
                .data(points(result, x, y, yName))
                .config(Map.of("x_axis", xName, "y_axis", yName))
                .build();
    }

    private PanelSpec table(QueryResult result, String question) {
        return panel(ChartType.TABLE, "Results", question)
                .queryResult(result)
                .config(Map.of("columns", result.getColumns()))
                .width(PanelSpec.MAX_WIDTH)
                .build();
    }

    private static PanelSpec.PanelSpecBuilder panel(ChartType type, String title, String question) {
        return PanelSpec.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .title(title)
                .description(question);
    }

    private static List<DataPoint> points(QueryResult result, int x, int y, String series) {
        List<DataPoint> points = new ArrayList<>(result.getRowCount());
        for (List<Object> row : result.getRows()) {
            if (row.get(y) instanceof Number n) {
                points.add(DataPoint.builder().x(row.get(x)).y(n).series(series).build());
            }
        }
        return points;
    }

    private boolean pieFits(QueryResult result, int category, int value) {
        Set<Object> labels = new LinkedHashSet<>();
        for (List<Object> row : result.getRows()) {
            labels.add(row.get(category));
            if (row.get(value) instanceof Number n && n.doubleValue() < 0) {
                return false;
            }
        }
        return labels.size() <= pieMaxCategories;
    }

    private static Kind classify(QueryResult result, int column) {
        boolean seen = false;
        boolean numeric = true;
        boolean temporal = true;
        for (List<Object> row : result.getRows()) {
            Object v = row.get(column);
            if (v == null) {
                continue;
            }
            seen = true;
            numeric &= v instanceof Number;
            temporal &= isTemporal(v);
            if (!numeric && !temporal) {
                return Kind.CATEGORY;
            }
        }
        if (!seen) {
            return Kind.CATEGORY;
        }
        return numeric ? Kind.NUMERIC : temporal ? Kind.TEMPORAL : Kind.CATEGORY;
    }

    static boolean isTemporal(Object v) {
        if (v instanceof TemporalAccessor || v instanceof Date) {
            return true;
        }
        if (!(v instanceof String s) || s.length() < 10 || !Character.isDigit(s.charAt(0))) {
            return false;
        }
        // JDBC values arrive as ISO text or java.sql.Timestamp#toString
        String iso = s.length() > 10 && s.charAt(10) == ' ' ? s.substring(0, 10) + 'T' + s.substring(11) : s;
        try {
            LocalDate.parse(iso);
            return true;
        } catch (DateTimeParseException ignored) {
            // try the next form
        }
        try {
            LocalDateTime.parse(iso);
            return true;
        } catch (DateTimeParseException ignored) {
            // try the next form
        }
        try {
            OffsetDateTime.parse(iso);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Panel feedback '" + key + "' must be an integer: " + value);
        }
    }
}
