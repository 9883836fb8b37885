package com.kurobe.util;

import com.kurobe.exception.QueryExecutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * SQL text with {@code :name} placeholders rewritten to JDBC-style {@code ?} markers.
 *
 * <p>Placeholders inside quoted literals, quoted identifiers, dollar-quoted bodies and comments are
 * left alone, as are PostgreSQL {@code ::type} casts. Statements that already use {@code ?} markers
 * bind the parameter map positionally, in its iteration order. A statement bound without any values
 * runs as written, so operators spelled with {@code ?} (the jsonb {@code ?}, {@code ?|} and
 * {@code ?&}) need no escaping as long as the statement has no named placeholders.
 */
public final class NamedParameterSql {
    private final String originalSql;
    private final String sql;
    private final List<String> parameterNames;
    private final int positionalCount;

    private NamedParameterSql(String originalSql, String sql, List<String> parameterNames, int positionalCount) {
        this.originalSql = originalSql;
        this.sql = sql;
        this.parameterNames = Collections.unmodifiableList(parameterNames);
        this.positionalCount = positionalCount;
    }

    /**
     * Parse SQL text.
     *
     * @param sql SQL with optional {@code :name} placeholders
     * @return parsed statement
     */
    public static NamedParameterSql parse(String sql) {
        if (sql == null) {
            throw new QueryExecutionException("SQL is required");
        }
        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        int positional = 0;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '$') {
                int end = skipDollarQuoted(sql, i);
                if (end > i) {
                    out.append(sql, i, end);
                    i = end;
                    continue;
                }
            }
            if (c == ':' && i + 1 < n && sql.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
                continue;
            }
            if (c == ':' && i + 1 < n && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
                int j = i + 1;
                while (j < n && Character.isJavaIdentifierPart(sql.charAt(j))) {
                    j++;
                }
                names.add(sql.substring(i + 1, j));
                out.append('?');
                i = j;
                continue;
            }
            if (c == '?') {
                positional++;
            }
            out.append(c);
            i++;
        }
        return new NamedParameterSql(sql, out.toString(), names, positional);
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    /**
     * Returns the end of a {@code $tag$ ... $tag$} body starting at {@code start}, or {@code start}
     * itself when the dollar sign does not open one ({@code $1} markers, {@code $} inside identifiers).
     */
    private static int skipDollarQuoted(String sql, int start) {
        if (start > 0 && Character.isJavaIdentifierPart(sql.charAt(start - 1))) {
            return start;
        }
        int j = start + 1;
        while (j < sql.length() && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) {
            j++;
        }
        if (j >= sql.length() || sql.charAt(j) != '$') {
            return start;
        }
        if (j > start + 1 && Character.isDigit(sql.charAt(start + 1))) {
            return start;
        }
        String delimiter = sql.substring(start, j + 1);
        int close = sql.indexOf(delimiter, j + 1);
        return close < 0 ? sql.length() : close + delimiter.length();
    }

    /**
     * Resolve the ordered values for the {@code ?} markers of {@link #getSql()}.
     *
     * @param parameters name to value map, may be null
     * @return ordered values; empty when the statement should run as written
     * @throws QueryExecutionException if a placeholder has no value or the counts disagree
     */
    public List<Object> bind(Map<String, ?> parameters) {
        Map<String, ?> params = parameters != null ? parameters : Map.of();
        if (!parameterNames.isEmpty()) {
            List<Object> values = new ArrayList<>(parameterNames.size());
            for (String name : parameterNames) {
                if (!params.containsKey(name)) {
                    throw new QueryExecutionException("Missing value for query parameter :" + name);
                }
                values.add(params.get(name));
            }
            return values;
        }
        if (positionalCount == 0 || params.isEmpty()) {
            return List.of();
        }
        if (positionalCount != params.size()) {
            throw new QueryExecutionException(
                    "Query has " + positionalCount + " positional parameters but " + params.size() + " values were supplied");
        }
        return new ArrayList<>(params.values());
    }

    public boolean hasParameters() {
        return !parameterNames.isEmpty() || positionalCount > 0;
    }

    public String getOriginalSql() {
        return originalSql;
    }

    public String getSql() {
        return sql;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }
}
