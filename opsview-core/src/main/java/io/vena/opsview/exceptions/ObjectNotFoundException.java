package io.vena.opsview.exceptions;

/**
 * The server responded, but the requested object was not in the response.
 */
public class ObjectNotFoundException extends OpsviewClientException {
	public ObjectNotFoundException(String message) { super(message); }
}
