package io.vena.opsview.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public class InvalidRefException extends OpsviewClientException {
	private final String ref;

	public InvalidRefException(String ref, String reason) {
		super("Invalid ref '" + ref + "': " + reason);
		this.ref = ref;
	}
}
