package dev.kaspa.gateway.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.kaspa.gateway.client.transport.GatewayClient;
import dev.kaspa.gateway.client.transport.GatewayClientException;
import java.net.URI;
import java.net.http.WebSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class Main {

    private static final String DEFAULT_URL = "http://localhost:8080";

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        String url = option(arguments, "--url", System.getenv().getOrDefault("GATEWAY_URL", DEFAULT_URL));
        String credentials = option(arguments, "--user", null);
        boolean headerOnly = arguments.remove("--header-only");
        boolean allowOrphan = arguments.remove("--allow-orphan");
        if (arguments.isEmpty()) {
            printUsage();
            return;
        }
        String command = arguments.remove(0);
        GatewayClient client = new GatewayClient(URI.create(url), credentials);

        try {
            switch (command) {
                case "health" -> System.out.println(client.health() ? "UP" : "DOWN");
                case "dag-tips" -> print(client.dagTips());
                case "block" -> handleBlock(client, arguments, !headerOnly);
                case "utxos" -> handleUtxos(client, arguments);
                case "submit" -> handleSubmit(client, arguments, allowOrphan);
                case "subscribe" -> handleSubscribe(client, arguments);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        } catch (GatewayClientException e) {
            System.err.println("FAILED " + e.getMessage());
            System.exit(1);
        }
    }

    private static void handleBlock(GatewayClient client, List<String> arguments, boolean includeTransactions)
        throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("block requires a hash argument");
        }
        JsonNode response = client.block(arguments.get(0), includeTransactions);
        JsonNode data = response.path("data");
        System.out.println("BLOCK " + data.path("hash").asText()
            + " daaScore=" + data.path("header").path("daaScore").asText()
            + " txs=" + data.path("transactions").size()
            + " latency=" + response.path("latency_ms").asDouble() + "ms");
    }

    private static void handleUtxos(GatewayClient client, List<String> arguments) throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("utxos requires at least one address");
        }
        print(client.utxos(arguments));
    }

    private static void handleSubmit(GatewayClient client, List<String> arguments, boolean allowOrphan)
        throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("submit requires a transaction JSON file");
        }
        JsonNode transaction = new ObjectMapper().readTree(Files.readString(Path.of(arguments.get(0))));
        JsonNode response = client.submit(transaction, allowOrphan);
        System.out.println("SUBMITTED " + response.path("data").path("transactionId").asText());
    }

    private static void handleSubscribe(GatewayClient client, List<String> arguments) throws Exception {
        List<String> addresses = new ArrayList<>(arguments);
        long seconds = 0;
        if (!addresses.isEmpty() && addresses.get(addresses.size() - 1).matches("\\d+")) {
            seconds = Long.parseLong(addresses.remove(addresses.size() - 1));
        }
        if (addresses.isEmpty()) {
            throw new IllegalArgumentException("subscribe requires at least one address");
        }
        CountDownLatch closed = new CountDownLatch(1);
        WebSocket socket = client.subscribe(addresses, frame -> System.out.println("FRAME " + frame), closed::countDown)
            .get(10, TimeUnit.SECONDS);
        if (seconds > 0) {
            if (!closed.await(seconds, TimeUnit.SECONDS)) {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
            }
        } else {
            closed.await();
        }
    }

    private static String option(List<String> arguments, String name, String fallback) {
        int index = arguments.indexOf(name);
        if (index < 0 || index + 1 >= arguments.size()) {
            return fallback;
        }
        String value = arguments.get(index + 1);
        arguments.remove(index + 1);
        arguments.remove(index);
        return value;
    }

    private static void print(JsonNode response) {
        System.out.println(response.toPrettyString());
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar kaspa-gateway-client.jar [--url <gateway>] [--user <user:password>] <command> [args]\n" +
            "Commands:\n" +
            "  health\n" +
            "  dag-tips\n" +
            "  block <hash> [--header-only]\n" +
            "  utxos <address...>\n" +
            "  submit <transaction.json> [--allow-orphan]\n" +
            "  subscribe <address...> [seconds]");
    }
}
