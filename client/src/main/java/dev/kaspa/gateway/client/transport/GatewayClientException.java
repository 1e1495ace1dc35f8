package dev.kaspa.gateway.client.transport;

import java.io.IOException;

/**
 * Non-success reply from the gateway.
 */
public class GatewayClientException extends IOException {

    private final int status;
    private final String kind;

    public GatewayClientException(int status, String kind, String message) {
        super("HTTP " + status + (kind == null ? "" : " " + kind) + ": " + message);
        this.status = status;
        this.kind = kind;
    }

    public int status() {
        return status;
    }

    public String kind() {
        return kind;
    }
}
