package io.vena.opsview.exceptions;

/**
 * Thrown before any request is made when an object has none of the identifiers an operation can use.
 */
public class MissingIdentifiersException extends OpsviewClientException {
	public MissingIdentifiersException(String message) { super(message); }
}
