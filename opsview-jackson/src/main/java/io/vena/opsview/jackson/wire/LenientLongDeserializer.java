package io.vena.opsview.jackson.wire;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * Reads a non-negative integer sent either as a JSON number or as a string holding one.
 */
public class LenientLongDeserializer extends StdDeserializer<Long> {
	public LenientLongDeserializer() {
		super(Long.class);
	}

	@Override
	public Long deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
		switch (p.currentToken()) {
			case VALUE_NUMBER_INT:
				return checked(p.getLongValue(), ctxt);
			case VALUE_STRING:
				String text = p.getText().trim();
				try {
					return checked(Long.parseLong(text), ctxt);
				} catch (NumberFormatException e) {
					return (Long) ctxt.handleWeirdStringValue(Long.class, text, "not an integer");
				}
			default:
				return (Long) ctxt.handleUnexpectedToken(Long.class, p);
		}
	}

	private static Long checked(long value, DeserializationContext ctxt) throws IOException {
		if (value < 0) {
			return (Long) ctxt.handleWeirdNumberValue(Long.class, value, "must not be negative");
		}
		return value;
	}
}
