package dev.kaspa.gateway.rpc.model;

import dev.kaspa.gateway.rpc.protowire.RpcScriptPublicKey;

public record ScriptPublicKey(int version, String script) {

    public static ScriptPublicKey fromProto(RpcScriptPublicKey scriptPublicKey) {
        return new ScriptPublicKey(scriptPublicKey.getVersion(), scriptPublicKey.getScriptPublicKey());
    }
}
