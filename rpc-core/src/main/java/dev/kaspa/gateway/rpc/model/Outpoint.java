package dev.kaspa.gateway.rpc.model;

import dev.kaspa.gateway.rpc.protowire.RpcOutpoint;

/**
 * Reference to one output of a transaction.
 * @param transactionId hex transaction id
 * @param index output index (unsigned 32-bit on the wire)
 */
public record Outpoint(String transactionId, long index) {

    public static Outpoint fromProto(RpcOutpoint outpoint) {
        return new Outpoint(outpoint.getTransactionId(), Integer.toUnsignedLong(outpoint.getIndex()));
    }
}
