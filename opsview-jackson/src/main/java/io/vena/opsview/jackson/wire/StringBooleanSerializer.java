package io.vena.opsview.jackson.wire;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/**
 * Writes booleans the way the configuration service stores them: <code>"1"</code> or <code>"0"</code>.
 */
public class StringBooleanSerializer extends StdSerializer<Boolean> {
	public StringBooleanSerializer() {
		super(Boolean.class);
	}

	@Override
	public void serialize(Boolean value, JsonGenerator gen, SerializerProvider provider) throws IOException {
		gen.writeString(value ? "1" : "0");
	}
}
