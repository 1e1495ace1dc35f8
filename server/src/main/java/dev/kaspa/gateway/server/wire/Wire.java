package dev.kaspa.gateway.server.wire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.kaspa.gateway.rpc.protowire.KaspadRequest;
import dev.kaspa.gateway.rpc.protowire.KaspadResponse;

/**
 * Logs node envelopes in one consistent format on the {@code WIRE} logger.
 */
public final class Wire {

	private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

	static final int MAX_PAYLOAD_CHARS = 200;

	private Wire() {
	}

	public static void tx(String streamId, KaspadRequest request) {
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("TX stream={} id={} payload={} body={}", streamId, Long.toUnsignedString(request.getId()),
					request.getPayloadCase(), truncate(request.toString(), MAX_PAYLOAD_CHARS));
		}
	}

	public static void rx(String streamId, KaspadResponse response) {
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("RX stream={} id={} payload={} body={}", streamId, Long.toUnsignedString(response.getId()),
					response.getPayloadCase(), truncate(response.toString(), MAX_PAYLOAD_CHARS));
		}
	}

	public static void closed(String streamId, String status) {
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("END stream={} status={}", streamId, status);
		}
	}

	/**
	 * Collapse a protobuf text rendering onto one line and cut it at {@code max} characters.
	 */
	public static String truncate(String value, int max) {
		if (value == null) {
			return null;
		}
		String flat = value.replace('\n', ' ').trim();
		if (flat.length() <= max) {
			return flat;
		}
		return flat.substring(0, max) + "...";
	}

}
