package io.vena.opsview.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.opsview.exceptions.FieldNotFoundException;
import io.vena.opsview.exceptions.OpsviewClientException;
import io.vena.opsview.exceptions.TypeParseException;

/**
 * The totals the server declares alongside each page of a collection.
 * The numbers arrive as strings.
 */
record PageSummary(long totalRows, long totalPages) {

	static PageSummary parse(JsonNode response) throws OpsviewClientException {
		JsonNode summary = response.get("summary");
		if (summary == null || !summary.isObject()) {
			throw new FieldNotFoundException("Response does not contain 'summary' field");
		}
		return new PageSummary(
			unsignedField(summary, "totalrows"),
			unsignedField(summary, "totalpages"));
	}

	private static long unsignedField(JsonNode summary, String fieldName) throws OpsviewClientException {
		JsonNode field = summary.get(fieldName);
		if (field == null) {
			throw new FieldNotFoundException("Summary does not contain '" + fieldName + "' field");
		}
		if (!field.isTextual()) {
			throw new TypeParseException(field.toString(), "string");
		}
		String text = field.textValue();
		try {
			long result = Long.parseLong(text);
			if (text.startsWith("-")) {
				throw new TypeParseException(text, "unsigned integer");
			}
			return result;
		} catch (NumberFormatException e) {
			throw new TypeParseException(text, "unsigned integer");
		}
	}
}
