package dev.kaspa.gateway.server.model;

import java.util.List;
import java.util.Map;

/**
 * Result of {@code POST /rpc/getUtxosByAddresses}.
 * @param entries unspent outputs of the requested addresses, rendered like {@code utxo_changed} entries
 */
public record UtxosByAddressesResponse(List<Map<String, Object>> entries) {
}
