package io.vena.opsview.exceptions;

public class ConflictingOptionsException extends InvalidConfigException {
	public ConflictingOptionsException(String message) { super(message); }
}
