package dev.kaspa.gateway.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Kaspa RPC gateway Spring Boot application.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GatewayServerApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(GatewayServerApplication.class, args);
	}

}
