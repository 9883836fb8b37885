package com.kurobe.connector;

import com.kurobe.exception.QueryExecutionException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrinoLiteralsTest {

    @Test
    void quotesStringsAndEscapesSingleQuotes() {
        assertThat(TrinoLiterals.literal("O'Brien")).isEqualTo("'O''Brien'");
        assertThat(TrinoLiterals.literal("'; DROP TABLE t; --")).isEqualTo("'''; DROP TABLE t; --'");
    }

    @Test
    void typedLiterals() {
        assertThat(TrinoLiterals.literal(null)).isEqualTo("NULL");
        assertThat(TrinoLiterals.literal(true)).isEqualTo("TRUE");
        assertThat(TrinoLiterals.literal(42L)).isEqualTo("42");
        assertThat(TrinoLiterals.literal(1.5d)).isEqualTo("DOUBLE '1.5'");
        assertThat(TrinoLiterals.literal(new BigDecimal("12.50"))).isEqualTo("DECIMAL '12.50'");
        assertThat(TrinoLiterals.literal(LocalDate.of(2024, 3, 1))).isEqualTo("DATE '2024-03-01'");
        assertThat(TrinoLiterals.literal(LocalDateTime.of(2024, 3, 1, 8, 30)))
                .isEqualTo("TIMESTAMP '2024-03-01 08:30:00.000000'");
        assertThat(TrinoLiterals.literal(OffsetDateTime.of(2024, 3, 1, 8, 30, 0, 0, ZoneOffset.ofHours(2))))
                .isEqualTo("TIMESTAMP '2024-03-01 08:30:00.000000 +02:00'");
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertThat(TrinoLiterals.literal(id)).isEqualTo("UUID '123e4567-e89b-12d3-a456-426614174000'");
    }

    @Test
    void rejectsValuesWithoutLiteralForm() {
        assertThatThrownBy(() -> TrinoLiterals.literal(Double.NaN)).isInstanceOf(QueryExecutionException.class);
        assertThatThrownBy(() -> TrinoLiterals.literal(new Object()))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessageContaining("Unsupported parameter type");
    }

    @Test
    void executeStatementListsLiteralsInOrder() {
        assertThat(TrinoLiterals.executeStatement("s", List.of())).isEqualTo("EXECUTE s");
        assertThat(TrinoLiterals.executeStatement("s", Arrays.asList("EU", null, 3)))
                .isEqualTo("EXECUTE s USING 'EU', NULL, 3");
    }
}
