package io.vena.opsview.exceptions;

public class BadRequestException extends HttpStatusException {
	public BadRequestException(String message) { super(400, message); }
}
