package dev.kaspa.gateway.server.model;

import java.util.List;

/**
 * Result of {@code POST /rpc/getDAGTips}: the node's current view of the block DAG.
 * @param networkName network the node runs on
 * @param tipHashes hashes of the current DAG tips
 * @param blockCount number of blocks known to the node
 * @param headerCount number of headers known to the node
 * @param difficulty current difficulty
 * @param pastMedianTime past median time in milliseconds
 * @param virtualParentHashes parents of the virtual block
 * @param pruningPointHash current pruning point
 * @param virtualDaaScore DAA score of the virtual block
 */
public record DagTipsResponse(String networkName, List<String> tipHashes, long blockCount, long headerCount,
		double difficulty, long pastMedianTime, List<String> virtualParentHashes, String pruningPointHash,
		long virtualDaaScore) {
}
