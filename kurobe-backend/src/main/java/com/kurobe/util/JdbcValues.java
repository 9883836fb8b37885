package com.kurobe.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC driver values into plain, JSON-friendly Java values for {@code QueryResult} rows.
 *
 * <p>Shared by the relational and embedded connectors so driver-specific objects never leak
 * out of the connector layer.
 */
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    /**
     * Column labels of a result set, in order.
     *
     * @param metaData result set metadata
     * @return column labels
     * @throws SQLException on JDBC errors
     */
    public static List<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
        int count = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            String label = metaData.getColumnLabel(i);
            columns.add(label != null && !label.isEmpty() ? label : metaData.getColumnName(i));
        }
        return columns;
    }

    /**
     * Read the current row of a result set as a list exactly {@code columnCount} wide.
     *
     * @param rs result set positioned on a row
     * @param columnCount number of columns
     * @return converted row values
     * @throws SQLException on JDBC errors
     */
    public static List<Object> readRow(ResultSet rs, int columnCount) throws SQLException {
        List<Object> row = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            row.add(readValue(rs, i));
        }
        return row;
    }

    /**
     * Reads a JDBC column value and returns a plain equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return converted value
     */
    public static Object readValue(ResultSet rs, int columnIndex) {
        try {
            return toPlain(rs.getObject(columnIndex), 0);
        } catch (Exception ignored) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    static Object toPlain(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }

        Object pgValue = tryReadPgObject(v);
        if (pgValue != null) {
            return truncateString(String.valueOf(pgValue));
        }

        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncateString(s);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return truncateString(xml.getString());
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp) {
            return v.toString();
        }
        if (v instanceof TemporalAccessor) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.util.UUID) {
            return v.toString();
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            Object[] safe = attrs != null ? attrs : new Object[0];
            List<Object> out = new ArrayList<>(safe.length);
            for (Object attr : safe) {
                out.add(toPlain(attr, depth + 1));
            }
            return out;
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toPlain(elem, depth + 1));
                }
                return out;
            }
            return truncateString(String.valueOf(arrayValue));
        }

        return truncateString(String.valueOf(v));
    }

    private static String truncateString(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static Object tryReadPgObject(Object v) {
        // json/jsonb/enum columns come back as org.postgresql.util.PGobject
        if (!"org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            return null;
        }
        try {
            var m = v.getClass().getMethod("getValue");
            Object value = m.invoke(v);
            return value != null ? value : "";
        } catch (Exception ignored) {
            return null;
        }
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException ignored) {
            try (Reader reader = clob.getCharacterStream()) {
                if (reader == null) {
                    return "";
                }
                char[] buf = new char[Math.min(MAX_LOB_CHARS, 8192)];
                StringBuilder sb = new StringBuilder();
                int n;
                while (sb.length() < MAX_LOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                    sb.append(buf, 0, n);
                }
                return sb.toString();
            } catch (Exception e) {
                return "";
            }
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
