package io.vena.opsview.exceptions;

public class DoesNotMatchRegexException extends InvalidConfigException {
	public DoesNotMatchRegexException(String value, String regex) {
		super("'" + value + "' does not match regex " + regex);
	}
}
