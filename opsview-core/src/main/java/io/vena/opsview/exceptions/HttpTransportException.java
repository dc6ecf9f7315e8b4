package io.vena.opsview.exceptions;

/**
 * The request never produced a response: connection failure, timeout, or interruption.
 */
public class HttpTransportException extends OpsviewClientException {
	public HttpTransportException(String message, Throwable cause) { super(message, cause); }
}
