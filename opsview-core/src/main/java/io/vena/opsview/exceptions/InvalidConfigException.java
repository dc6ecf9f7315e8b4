package io.vena.opsview.exceptions;

/**
 * A builder or setter refused a value.
 *
 * <p>
 * Checked, and deliberately not an {@link java.io.IOException}: nothing went wrong
 * with the service, so retrying will not help.
 */
public class InvalidConfigException extends Exception {
	public InvalidConfigException(String message) { super(message); }
}
