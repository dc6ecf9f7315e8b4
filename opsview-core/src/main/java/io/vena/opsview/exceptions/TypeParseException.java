package io.vena.opsview.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
public class TypeParseException extends OpsviewClientException {
	private final String value;
	private final String targetType;

	public TypeParseException(String value, String targetType) {
		super("Failed to parse '" + value + "' as " + targetType);
		this.value = value;
		this.targetType = targetType;
	}
}
