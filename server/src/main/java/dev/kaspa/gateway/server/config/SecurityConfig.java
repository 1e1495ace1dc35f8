package dev.kaspa.gateway.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Optional HTTP Basic authentication in front of the RPC and WebSocket endpoints. The health probe
 * always stays open.
 */
@Configuration
public class SecurityConfig {

	@Bean
	public UserDetailsService userDetailsService(GatewaySecurityProperties securityProperties) {
		UserDetails user = User.withUsername(securityProperties.username())
			.password("{noop}" + securityProperties.password())
			.roles("GATEWAY_CLIENT")
			.build();
		return new InMemoryUserDetailsManager(user);
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http, GatewaySecurityProperties securityProperties)
			throws Exception {
		http.csrf(AbstractHttpConfigurer::disable);
		if (!securityProperties.enabled()) {
			http.authorizeHttpRequests(registry -> registry.anyRequest().permitAll());
			return http.build();
		}
		http.authorizeHttpRequests(registry -> registry.requestMatchers("/health")
			.permitAll()
			.anyRequest()
			.authenticated());
		http.httpBasic(Customizer.withDefaults());
		return http.build();
	}

}
