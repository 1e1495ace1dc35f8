package dev.kaspa.gateway.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Security properties. When {@code enabled} is {@code false} the gateway is open; otherwise the
 * credentials below are required through HTTP Basic.
 */
@ConfigurationProperties("kaspa.gateway.security")
public record GatewaySecurityProperties(boolean enabled, String username, String password) {

	public GatewaySecurityProperties {
		username = username == null || username.isBlank() ? "gateway" : username;
		password = password == null || password.isBlank() ? "change-me" : password;
	}

}
