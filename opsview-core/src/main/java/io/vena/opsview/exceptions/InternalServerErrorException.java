package io.vena.opsview.exceptions;

public class InternalServerErrorException extends HttpStatusException {
	public InternalServerErrorException(String message) { super(500, message); }
}
