package dev.kaspa.gateway.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin client for the gateway's HTTP endpoints and UTXO subscription WebSocket.
 */
public class GatewayClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final URI baseUri;
    private final String authorization;
    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param baseUri gateway root, e.g. {@code http://localhost:8080}
     * @param credentials {@code user:password} for HTTP Basic, or {@code null}
     */
    public GatewayClient(URI baseUri, String credentials) {
        this.baseUri = baseUri;
        this.authorization = credentials == null ? null
            : "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        this.http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }

    public boolean health() throws IOException, InterruptedException {
        HttpResponse<String> response = http.send(request("/health").GET().build(), HttpResponse.BodyHandlers.ofString());
        return response.statusCode() == 200;
    }

    public JsonNode dagTips() throws IOException, InterruptedException {
        return post("/rpc/getDAGTips", mapper.createObjectNode());
    }

    public JsonNode block(String hash, boolean includeTransactions) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("hash", hash);
        body.put("includeTransactions", includeTransactions);
        return post("/rpc/getBlock", body);
    }

    public JsonNode utxos(List<String> addresses) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode list = body.putArray("addresses");
        for (String address : addresses) {
            list.add(address);
        }
        return post("/rpc/getUtxosByAddresses", body);
    }

    public JsonNode submit(JsonNode transaction, boolean allowOrphan) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.set("transaction", transaction);
        body.put("allowOrphan", allowOrphan);
        return post("/rpc/submitTransaction", body);
    }

    /**
     * Open the UTXO subscription socket. Every text frame is parsed and handed to {@code onFrame};
     * the returned future completes once the socket is open.
     */
    public CompletableFuture<WebSocket> subscribe(List<String> addresses, Consumer<JsonNode> onFrame,
                                                  Runnable onClose) {
        WebSocket.Builder builder = http.newWebSocketBuilder();
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder.buildAsync(subscriptionUri(baseUri, addresses), new FrameListener(onFrame, onClose));
    }

    /**
     * WebSocket URI for a subscription: same host and path prefix as {@code base},
     * {@code ws}/{@code wss} scheme, addresses comma separated and URL encoded.
     */
    public static URI subscriptionUri(URI base, List<String> addresses) {
        String scheme = "https".equalsIgnoreCase(base.getScheme()) ? "wss" : "ws";
        StringBuilder query = new StringBuilder();
        for (String address : addresses) {
            if (query.length() > 0) {
                query.append(',');
            }
            query.append(URLEncoder.encode(address, StandardCharsets.UTF_8));
        }
        return endpoint(base, scheme, "/ws/subscribeUTXO?addresses=" + query);
    }

    /**
     * Append {@code path} to the path of {@code base}, so a gateway mounted under a prefix is
     * reached under that prefix.
     */
    static URI endpoint(URI base, String scheme, String path) {
        String prefix = base.getRawPath() == null ? "" : base.getRawPath();
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return URI.create(scheme + "://" + base.getRawAuthority() + prefix + path);
    }

    private JsonNode post(String path, JsonNode body) throws IOException, InterruptedException {
        String json = mapper.writeValueAsString(body);
        LOGGER.debug("POST {} {}", path, json);
        HttpRequest request = request(path)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        LOGGER.debug("HTTP {} {}", response.statusCode(), response.body());
        JsonNode payload = response.body() == null || response.body().isBlank()
            ? mapper.createObjectNode()
            : mapper.readTree(response.body());
        if (response.statusCode() / 100 != 2) {
            throw new GatewayClientException(response.statusCode(),
                payload.hasNonNull("kind") ? payload.get("kind").asText() : null,
                payload.path("error").asText(response.body()));
        }
        return payload;
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint(baseUri, baseUri.getScheme(), path)).timeout(REQUEST_TIMEOUT);
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    private final class FrameListener implements WebSocket.Listener {

        private final Consumer<JsonNode> onFrame;
        private final Runnable onClose;
        private final StringBuilder partial = new StringBuilder();

        private FrameListener(Consumer<JsonNode> onFrame, Runnable onClose) {
            this.onFrame = onFrame;
            this.onClose = onClose;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String frame = partial.toString();
                partial.setLength(0);
                try {
                    onFrame.accept(mapper.readTree(frame));
                } catch (IOException e) {
                    LOGGER.warn("Ignoring unparseable frame: {}", frame, e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            LOGGER.info("Subscription closed with status {} {}", statusCode, reason);
            onClose.run();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            LOGGER.error("Subscription socket failed", error);
            onClose.run();
        }
    }
}
