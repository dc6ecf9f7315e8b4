package io.vena.opsview.exceptions;

/**
 * A response lacked a field that the operation needs.
 */
public class FieldNotFoundException extends OpsviewClientException {
	public FieldNotFoundException(String message) { super(message); }
}
