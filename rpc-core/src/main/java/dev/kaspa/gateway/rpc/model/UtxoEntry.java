package dev.kaspa.gateway.rpc.model;

import dev.kaspa.gateway.rpc.protowire.RpcUtxoEntry;

/**
 * Unspent output as reported by the node.
 * @param amount value in sompi
 * @param scriptPublicKey locking script, {@code null} when the node did not send one
 * @param blockDaaScore DAA score of the accepting block
 * @param coinbase whether the output comes from a coinbase transaction
 */
public record UtxoEntry(long amount, ScriptPublicKey scriptPublicKey, long blockDaaScore, boolean coinbase) {

    public static UtxoEntry fromProto(RpcUtxoEntry entry) {
        return new UtxoEntry(
            entry.getAmount(),
            entry.hasScriptPublicKey() ? ScriptPublicKey.fromProto(entry.getScriptPublicKey()) : null,
            entry.getBlockDaaScore(),
            entry.getIsCoinbase());
    }
}
