package io.vena.opsview.jackson.wire;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.Locale;

/**
 * Reads the many ways the configuration service spells a boolean:
 * <code>"0"</code>, <code>"1"</code>, <code>"yes"</code>, <code>"no"</code>,
 * <code>"true"</code>, <code>"false"</code>, the numbers 0 and 1, or a real JSON boolean.
 * Null stays null.
 */
public class LenientBooleanDeserializer extends StdDeserializer<Boolean> {
	public LenientBooleanDeserializer() {
		super(Boolean.class);
	}

	@Override
	public Boolean deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
		switch (p.currentToken()) {
			case VALUE_TRUE:
				return true;
			case VALUE_FALSE:
				return false;
			case VALUE_NUMBER_INT:
				long number = p.getLongValue();
				if (number == 0) {
					return false;
				} else if (number == 1) {
					return true;
				}
				return (Boolean) ctxt.handleWeirdNumberValue(Boolean.class, number, "expected 0 or 1");
			case VALUE_STRING:
				String text = p.getText().trim();
				switch (text.toLowerCase(Locale.ROOT)) {
					case "1": case "yes": case "true":
						return true;
					case "0": case "no": case "false":
						return false;
					default:
						return (Boolean) ctxt.handleWeirdStringValue(Boolean.class, text, "not a recognized boolean");
				}
			default:
				return (Boolean) ctxt.handleUnexpectedToken(Boolean.class, p);
		}
	}
}
