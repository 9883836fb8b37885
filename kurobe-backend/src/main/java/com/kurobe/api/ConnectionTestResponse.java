package com.kurobe.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ConnectionTestResponse {
    private String name;
    private boolean healthy;
    private String traceId;
}
