package io.vena.opsview.exceptions;

public class ResourceNotFoundException extends HttpStatusException {
	public ResourceNotFoundException(String message) { super(404, message); }
}
