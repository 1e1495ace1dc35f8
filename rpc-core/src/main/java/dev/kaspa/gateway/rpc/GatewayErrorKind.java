package dev.kaspa.gateway.rpc;

/**
 * Classification of every failure the gateway can surface. Handlers map each kind to a distinct
 * externally visible status so callers can tell upstream trouble from their own mistakes.
 */
public enum GatewayErrorKind {

    /** Transport failure opening or using a stream to the node. */
    CONNECTION,

    /** The stream ended before the node sent any reply. */
    EMPTY_RESPONSE,

    /** The node replied with a payload variant other than the one the request implies. */
    PROTOCOL_MISMATCH,

    /** The node reported a domain error (invalid hash, rejected transaction, ...). */
    REMOTE,

    /** Caller-supplied input failed a local precondition before any network call was made. */
    INVALID_ARGUMENT
}
