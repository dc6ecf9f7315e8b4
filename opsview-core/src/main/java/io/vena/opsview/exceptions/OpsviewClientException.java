package io.vena.opsview.exceptions;

import java.io.IOException;

/**
 * Base class for every failure that occurs while talking to the configuration service,
 * or while interpreting what it sent back.
 *
 * <p>
 * Extends {@link IOException} because callers that already handle network trouble
 * (eg. by aborting or retrying) will generally want to treat these the same way.
 * Subclasses identify the precise cause so callers can branch on it.
 */
public class OpsviewClientException extends IOException {
	public OpsviewClientException(String message) { super(message); }
	public OpsviewClientException(String message, Throwable cause) { super(message, cause); }
}
