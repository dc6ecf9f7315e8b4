package io.vena.opsview.exceptions;

/**
 * The value fits the length limit as typed, but not once it is percent-encoded into a URL.
 */
public class StringTooLongWhenPercentEncodedException extends InvalidConfigException {
	public StringTooLongWhenPercentEncodedException(int maxLength, int encodedLength) {
		super("String too long when percent-encoded: maximum " + maxLength + " characters, got " + encodedLength);
	}
}
