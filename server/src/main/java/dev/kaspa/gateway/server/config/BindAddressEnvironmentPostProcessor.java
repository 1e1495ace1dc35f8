package dev.kaspa.gateway.server.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Accepts a combined {@code BIND_ADDRESS=host:port} and exposes it as {@code BIND_HOST} and
 * {@code BIND_PORT}. The split values sit at the lowest precedence, so explicitly set
 * {@code BIND_HOST}/{@code BIND_PORT} still win.
 */
public class BindAddressEnvironmentPostProcessor implements EnvironmentPostProcessor {

	static final String BIND_ADDRESS = "BIND_ADDRESS";

	static final String PROPERTY_SOURCE_NAME = "bindAddress";

	@Override
	public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
		String bindAddress = environment.getProperty(BIND_ADDRESS);
		if (bindAddress == null || bindAddress.isBlank()) {
			return;
		}
		environment.getPropertySources().addLast(new MapPropertySource(PROPERTY_SOURCE_NAME, split(bindAddress.trim())));
	}

	/**
	 * Split {@code host:port}; IPv6 hosts are written in brackets, e.g. {@code [::1]:8080}.
	 * @param bindAddress value of {@code BIND_ADDRESS}
	 * @return {@code BIND_HOST} and {@code BIND_PORT}
	 * @throws IllegalArgumentException when the value is not {@code host:port}
	 */
	static Map<String, Object> split(String bindAddress) {
		int colon = bindAddress.lastIndexOf(':');
		if (colon <= 0 || colon == bindAddress.length() - 1) {
			throw new IllegalArgumentException(BIND_ADDRESS + " must be host:port, got '" + bindAddress + "'");
		}
		String host = bindAddress.substring(0, colon);
		if (host.startsWith("[") && host.endsWith("]")) {
			host = host.substring(1, host.length() - 1);
		}
		int port;
		try {
			port = Integer.parseInt(bindAddress.substring(colon + 1));
		}
		catch (NumberFormatException ex) {
			throw new IllegalArgumentException(BIND_ADDRESS + " has an invalid port: '" + bindAddress + "'", ex);
		}
		if (port < 0 || port > 65535) {
			throw new IllegalArgumentException(BIND_ADDRESS + " port out of range: '" + bindAddress + "'");
		}
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("BIND_HOST", host);
		properties.put("BIND_PORT", String.valueOf(port));
		return properties;
	}

}
