package io.vena.opsview.exceptions;

public class ForbiddenCharacterException extends InvalidConfigException {
	public ForbiddenCharacterException(char character) {
		super("Forbidden character '" + character + "'");
	}
}
