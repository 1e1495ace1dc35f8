package dev.kaspa.gateway.rpc;

import java.util.Objects;

/**
 * Typed failure of a gateway operation. Delivered as the error signal of the returned
 * {@code Mono}/{@code Flux}, or thrown from operations that fail before any I/O is started.
 */
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;

    public GatewayException(GatewayErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GatewayException(GatewayErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GatewayErrorKind kind() {
        return kind;
    }

    public static GatewayException connection(String message, Throwable cause) {
        return new GatewayException(GatewayErrorKind.CONNECTION, message, cause);
    }

    public static GatewayException invalidArgument(String message) {
        return new GatewayException(GatewayErrorKind.INVALID_ARGUMENT, message);
    }

    @Override
    public String toString() {
        return "GatewayException[" + kind + "]: " + getMessage();
    }
}
