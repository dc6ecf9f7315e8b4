package io.vena.opsview.exceptions;

/**
 * The object type exists only embedded in other objects, so it has no resource path of its own.
 */
public class NoConfigPathException extends OpsviewClientException {
	public NoConfigPathException(String message) { super(message); }
}
