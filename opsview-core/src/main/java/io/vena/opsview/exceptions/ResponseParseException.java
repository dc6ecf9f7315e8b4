package io.vena.opsview.exceptions;

/**
 * The response body could not be parsed, or could not be bound to the expected type.
 */
public class ResponseParseException extends OpsviewClientException {
	public ResponseParseException(String message) { super(message); }
	public ResponseParseException(String message, Throwable cause) { super(message, cause); }
}
