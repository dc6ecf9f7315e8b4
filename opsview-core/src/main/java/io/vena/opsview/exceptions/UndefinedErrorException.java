package io.vena.opsview.exceptions;

/**
 * Catch-all for statuses without a dedicated exception.
 */
public class UndefinedErrorException extends HttpStatusException {
	public UndefinedErrorException(int status, String message) { super(status, message); }
}
