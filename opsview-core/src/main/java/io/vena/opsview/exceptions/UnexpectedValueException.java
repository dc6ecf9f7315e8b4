package io.vena.opsview.exceptions;

/**
 * A response field held a value outside the set the operation understands.
 */
public class UnexpectedValueException extends OpsviewClientException {
	public UnexpectedValueException(String message) { super(message); }
}
