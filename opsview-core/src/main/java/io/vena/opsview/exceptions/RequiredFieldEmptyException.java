package io.vena.opsview.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public class RequiredFieldEmptyException extends InvalidConfigException {
	private final String field;

	public RequiredFieldEmptyException(String field) {
		super("Mandatory field '" + field + "' cannot be empty");
		this.field = field;
	}
}
