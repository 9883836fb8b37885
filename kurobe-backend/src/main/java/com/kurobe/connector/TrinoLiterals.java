package com.kurobe.connector;

import com.kurobe.exception.QueryExecutionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Renders bound values as Trino SQL literals for {@code EXECUTE ... USING}.
 */
final class TrinoLiterals {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    private static final DateTimeFormatter TIMESTAMP_TZ = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS xxx");

    private TrinoLiterals() {
    }

    static String executeStatement(String statementName, List<Object> values) {
        if (values.isEmpty()) {
            return "EXECUTE " + statementName;
        }
        StringBuilder sb = new StringBuilder("EXECUTE ").append(statementName).append(" USING ");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(literal(values.get(i)));
        }
        return sb.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long
                || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Float || value instanceof Double) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new QueryExecutionException("Cannot bind non-finite number: " + value);
            }
            return "DOUBLE '" + value + "'";
        }
        if (value instanceof BigDecimal decimal) {
            return "DECIMAL '" + decimal.toPlainString() + "'";
        }
        if (value instanceof LocalDate date) {
            return "DATE '" + date + "'";
        }
        if (value instanceof LocalDateTime dateTime) {
            return "TIMESTAMP '" + TIMESTAMP.format(dateTime) + "'";
        }
        if (value instanceof OffsetDateTime dateTime) {
            return "TIMESTAMP '" + TIMESTAMP_TZ.format(dateTime) + "'";
        }
        if (value instanceof ZonedDateTime dateTime) {
            return "TIMESTAMP '" + TIMESTAMP_TZ.format(dateTime.toOffsetDateTime()) + "'";
        }
        if (value instanceof Instant instant) {
            return "TIMESTAMP '" + TIMESTAMP_TZ.format(instant.atOffset(ZoneOffset.UTC)) + "'";
        }
        if (value instanceof LocalTime time) {
            return "TIME '" + time + "'";
        }
        if (value instanceof UUID uuid) {
            return "UUID '" + uuid + "'";
        }
        if (value instanceof Number) {
            return "DECIMAL '" + new BigDecimal(value.toString()).toPlainString() + "'";
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) {
            return quote(value.toString());
        }
        throw new QueryExecutionException("Unsupported parameter type for Trino: " + value.getClass().getName());
    }

    static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
