package dev.kaspa.gateway.server.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import dev.kaspa.gateway.rpc.GatewayErrorKind;
import dev.kaspa.gateway.rpc.GatewayException;
import dev.kaspa.gateway.server.model.ErrorResponse;

/**
 * Renders gateway failures as {@link ErrorResponse} bodies. Each failure kind maps to its own
 * status so clients can tell node outages from bad input.
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

	private static final Logger logger = LoggerFactory.getLogger(GatewayExceptionHandler.class);

	@ExceptionHandler(GatewayException.class)
	public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException ex) {
		HttpStatus status = statusFor(ex.kind());
		if (status.is5xxServerError()) {
			logger.error("Node call failed with {}: {}", ex.kind(), ex.getMessage(), ex.getCause());
		}
		else {
			logger.warn("Rejected request ({}): {}", ex.kind(), ex.getMessage());
		}
		return ResponseEntity.status(status).body(new ErrorResponse(ex.getMessage(), status.value(), ex.kind().name()));
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
		logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
		return ResponseEntity.badRequest()
			.body(new ErrorResponse("Malformed request body", HttpStatus.BAD_REQUEST.value(),
					GatewayErrorKind.INVALID_ARGUMENT.name()));
	}

	/**
	 * HTTP status reported for a failure kind.
	 * @param kind failure category
	 * @return status code, distinct for every kind
	 */
	public static HttpStatus statusFor(GatewayErrorKind kind) {
		return switch (kind) {
			case CONNECTION -> HttpStatus.BAD_GATEWAY;
			case EMPTY_RESPONSE -> HttpStatus.SERVICE_UNAVAILABLE;
			case PROTOCOL_MISMATCH -> HttpStatus.INTERNAL_SERVER_ERROR;
			case REMOTE -> HttpStatus.UNPROCESSABLE_ENTITY;
			case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
		};
	}

}
