package io.vena.opsview.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Two elements of a serialized {@link io.vena.opsview.KeyedMap} computed the same unique name.
 *
 * <p>
 * Unlike {@link io.vena.opsview.KeyedMap#add}, which quietly replaces, deserialization
 * treats this as an error: the server should never send such data.
 * Extends {@link JsonMappingException} so that Jackson passes it through intact when it occurs in a nested field.
 */
@Getter
@Accessors(fluent = true)
public class DuplicateKeyException extends JsonMappingException {
	private final String key;

	public DuplicateKeyException(JsonParser p, String key) {
		super(p, "Duplicate name detected: " + key);
		this.key = key;
	}
}
