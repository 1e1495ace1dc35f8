package dev.kaspa.gateway.rpc.model;

import dev.kaspa.gateway.rpc.protowire.UtxosChangedNotificationMessage;
import java.util.List;

/**
 * UTXOs added and removed for the watched addresses by one node push message, in node order.
 */
public record UtxoChangeNotification(List<UtxoChange> added, List<UtxoChange> removed) {

    public UtxoChangeNotification {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public static UtxoChangeNotification fromProto(UtxosChangedNotificationMessage notification) {
        return new UtxoChangeNotification(
            notification.getAddedList().stream().map(UtxoChange::fromProto).toList(),
            notification.getRemovedList().stream().map(UtxoChange::fromProto).toList());
    }
}
