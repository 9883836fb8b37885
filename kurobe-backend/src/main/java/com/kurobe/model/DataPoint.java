package com.kurobe.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A single point of a chart series.
 */
@Value
@Builder
public class DataPoint {
    Object x;
    Number y;
    String series;
    Map<String, Object> metadata;
}
