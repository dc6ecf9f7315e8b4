package io.vena.opsview.exceptions;

/**
 * A response field that should hold a list held something else.
 */
public class NotAnArrayException extends OpsviewClientException {
	public NotAnArrayException(String message) { super(message); }
}
