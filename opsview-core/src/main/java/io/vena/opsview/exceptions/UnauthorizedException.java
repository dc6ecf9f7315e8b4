package io.vena.opsview.exceptions;

public class UnauthorizedException extends HttpStatusException {
	public UnauthorizedException(String message) { super(401, message); }
}
