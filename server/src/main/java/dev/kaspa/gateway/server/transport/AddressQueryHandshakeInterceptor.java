package dev.kaspa.gateway.server.transport;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Reads the {@code addresses} query parameter of the subscription handshake. The upgrade is
 * refused with {@code 400} when no usable address remains, so no node stream is ever opened for
 * such a request.
 */
public class AddressQueryHandshakeInterceptor implements HandshakeInterceptor {

	private static final Logger logger = LoggerFactory.getLogger(AddressQueryHandshakeInterceptor.class);

	/**
	 * Session attribute holding the parsed {@code List<String>} of addresses.
	 */
	public static final String ADDRESSES_ATTRIBUTE = "kaspa.addresses";

	static final String QUERY_PARAMETER = "addresses";

	@Override
	public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
			Map<String, Object> attributes) throws Exception {
		String raw = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst(QUERY_PARAMETER);
		List<String> addresses = parseAddresses(raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8));
		if (addresses.isEmpty()) {
			logger.warn("Refusing subscription handshake from {} without addresses", request.getRemoteAddress());
			response.setStatusCode(HttpStatus.BAD_REQUEST);
			response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
			response.getBody().write("No addresses provided".getBytes(StandardCharsets.UTF_8));
			return false;
		}
		attributes.put(ADDRESSES_ATTRIBUTE, addresses);
		return true;
	}

	@Override
	public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
			Exception exception) {
	}

	/**
	 * Split a comma separated address list. Entries are trimmed, blanks dropped and duplicates
	 * removed keeping the first occurrence.
	 * @param raw decoded query value, may be {@code null}
	 * @return addresses in request order
	 */
	public static List<String> parseAddresses(String raw) {
		if (raw == null) {
			return List.of();
		}
		Set<String> addresses = new LinkedHashSet<>();
		for (String part : raw.split(",")) {
			String address = part.trim();
			if (!address.isEmpty()) {
				addresses.add(address);
			}
		}
		return List.copyOf(addresses);
	}

}
