package io.vena.opsview.exceptions;

public class StringTooLongException extends InvalidConfigException {
	public StringTooLongException(int maxLength, int actualLength) {
		super("String too long: maximum " + maxLength + " characters, got " + actualLength);
	}
}
