package dev.kaspa.gateway.server.model;

import java.util.List;

/**
 * Body of {@code POST /rpc/getUtxosByAddresses}.
 * @param addresses addresses whose unspent outputs are requested
 */
public record GetUtxosByAddressesRequest(List<String> addresses) {
}
