package dev.kaspa.gateway.rpc.grpc;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Network location of the node's gRPC endpoint, parsed from {@code http://host:port},
 * {@code https://host:port} or a bare {@code host:port}.
 */
public record NodeTarget(String host, int port, boolean tls) {

    public static final int DEFAULT_PORT = 16110;

    public NodeTarget {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Node host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Node port out of range: " + port);
        }
    }

    public static NodeTarget parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Node URL must not be blank");
        }
        String candidate = url.contains("://") ? url.trim() : "http://" + url.trim();
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed node URL: " + url, e);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        boolean tls = switch (scheme) {
            case "http", "grpc" -> false;
            case "https", "grpcs" -> true;
            default -> throw new IllegalArgumentException("Unsupported node URL scheme: " + scheme);
        };
        int port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();
        return new NodeTarget(uri.getHost(), port, tls);
    }

    @Override
    public String toString() {
        return (tls ? "https://" : "http://") + host + ":" + port;
    }
}
