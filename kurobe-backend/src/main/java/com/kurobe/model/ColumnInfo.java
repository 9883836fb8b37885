package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One column entry of a schema introspection result.
 */
@Value
@Builder
public class ColumnInfo {
    @JsonProperty("column_name")
    String columnName;
    @JsonProperty("data_type")
    String dataType;
    @JsonProperty("is_nullable")
    boolean nullable;
    @JsonProperty("default")
    String defaultValue;
}
