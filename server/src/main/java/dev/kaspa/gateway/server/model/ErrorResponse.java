package dev.kaspa.gateway.server.model;

/**
 * Body returned for every failed request.
 * @param error human readable message
 * @param code HTTP status code
 * @param kind failure category
 */
public record ErrorResponse(String error, int code, String kind) {
}
