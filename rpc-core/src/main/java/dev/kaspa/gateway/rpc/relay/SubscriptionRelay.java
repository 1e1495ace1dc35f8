package dev.kaspa.gateway.rpc.relay;

import dev.kaspa.gateway.rpc.CorrelationIdGenerator;
import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.rpc.RpcChannel;
import dev.kaspa.gateway.rpc.RpcStream;
import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.NotifyUtxosChangedRequestMessage;
import dev.kaspa.gateway.rpc.protowire.RpcNotifyCommand;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns one long-lived node push stream into a {@link NotificationSource}. Each subscription owns
 * its own stream; nothing is resubscribed when that stream ends or fails.
 */
public final class SubscriptionRelay {

    private final RpcChannel channel;
    private final CorrelationIdGenerator correlationIds;

    public SubscriptionRelay(RpcChannel channel, CorrelationIdGenerator correlationIds) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.correlationIds = Objects.requireNonNull(correlationIds, "correlationIds");
    }

    /**
     * Open a stream and send the subscribe command for the given addresses.
     * @param addresses non-empty list of distinct, non-blank addresses
     * @return an active source; the caller owns it and must close it
     * @throws GatewayException {@code INVALID_ARGUMENT} before any stream is opened when the
     * address list is unusable, {@code CONNECTION} when the stream cannot be opened or written
     */
    public NotificationSource subscribe(List<String> addresses) {
        List<String> watched = validate(addresses);
        RpcStream stream = channel.openStream();
        StreamNotificationSource source = new StreamNotificationSource(stream, watched);
        source.open(KaspadRequest.newBuilder()
            .setId(correlationIds.next())
            .setNotifyUtxosChangedRequest(NotifyUtxosChangedRequestMessage.newBuilder()
                .addAllAddresses(watched)
                .setCommand(RpcNotifyCommand.NOTIFY_START))
            .build());
        return source;
    }

    private static List<String> validate(List<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw GatewayException.invalidArgument("At least one address is required");
        }
        Set<String> seen = new HashSet<>();
        for (String address : addresses) {
            if (address == null || address.isBlank()) {
                throw GatewayException.invalidArgument("Addresses must not be blank");
            }
            if (!seen.add(address)) {
                throw GatewayException.invalidArgument("Duplicate address " + address);
            }
        }
        return List.copyOf(addresses);
    }
}
