package io.vena.opsview.exceptions;

/**
 * An id lookup by name found no matching object, or the match carried no id.
 */
public class IdNotFoundException extends OpsviewClientException {
	public IdNotFoundException(String message) { super(message); }
}
