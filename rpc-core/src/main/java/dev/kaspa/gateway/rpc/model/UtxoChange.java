package dev.kaspa.gateway.rpc.model;

import dev.kaspa.gateway.rpc.protowire.RpcUtxosByAddressesEntry;

/**
 * One UTXO associated with a watched address. Nested values the node left out stay {@code null}
 * so consumers can tell "not supplied" from "zero".
 */
public record UtxoChange(String address, Outpoint outpoint, UtxoEntry utxoEntry) {

    public static UtxoChange fromProto(RpcUtxosByAddressesEntry entry) {
        return new UtxoChange(
            entry.getAddress(),
            entry.hasOutpoint() ? Outpoint.fromProto(entry.getOutpoint()) : null,
            entry.hasUtxoEntry() ? UtxoEntry.fromProto(entry.getUtxoEntry()) : null);
    }
}
