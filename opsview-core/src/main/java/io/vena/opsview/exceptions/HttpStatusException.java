package io.vena.opsview.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The server answered with a status other than 200.
 * Each subclass corresponds to one status the service is known to use.
 */
@Getter
@Accessors(fluent = true)
public abstract class HttpStatusException extends OpsviewClientException {
	private final int status;

	protected HttpStatusException(int status, String message) {
		super(message);
		this.status = status;
	}
}
