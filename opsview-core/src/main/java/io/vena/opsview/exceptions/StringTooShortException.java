package io.vena.opsview.exceptions;

public class StringTooShortException extends InvalidConfigException {
	public StringTooShortException(int minLength, int actualLength) {
		super("String too short: minimum " + minLength + " characters, got " + actualLength);
	}
}
