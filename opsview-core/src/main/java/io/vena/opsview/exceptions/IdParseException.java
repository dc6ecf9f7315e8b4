package io.vena.opsview.exceptions;

public class IdParseException extends OpsviewClientException {
	public IdParseException(String message, Throwable cause) { super(message, cause); }
}
