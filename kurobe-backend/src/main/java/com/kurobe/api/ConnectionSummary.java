package com.kurobe.api;

import com.kurobe.connector.DataConnector;
import com.kurobe.model.ConnectionType;
import lombok.Builder;
import lombok.Data;

/**
 * Credential-free listing entry for a live connection.
 */
@Data
@Builder
public class ConnectionSummary {
    private String name;
    private ConnectionType type;
    private String target;
    private boolean connected;

    public static ConnectionSummary of(DataConnector connector) {
        return ConnectionSummary.builder()
                .name(connector.getConfig().getName())
                .type(connector.getConfig().getType())
                .target(connector.describeTarget())
                .connected(connector.isConnected())
                .build();
    }
}
