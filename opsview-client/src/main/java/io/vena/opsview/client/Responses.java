package io.vena.opsview.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.opsview.exceptions.BadRequestException;
import io.vena.opsview.exceptions.HttpStatusException;
import io.vena.opsview.exceptions.InternalServerErrorException;
import io.vena.opsview.exceptions.OpsviewClientException;
import io.vena.opsview.exceptions.ResourceNotFoundException;
import io.vena.opsview.exceptions.ResponseParseException;
import io.vena.opsview.exceptions.UnauthorizedException;
import io.vena.opsview.exceptions.UndefinedErrorException;

/**
 * Turns a {@link TransportResponse} into a parsed body or the exception for its status.
 */
final class Responses {
	private Responses() {}

	static JsonNode parse(TransportResponse response, ObjectMapper mapper) throws OpsviewClientException {
		return parseJson(text(response, mapper), mapper);
	}

	/**
	 * @return the body, if the status is 200
	 */
	static String text(TransportResponse response, ObjectMapper mapper) throws HttpStatusException {
		switch (response.status()) {
			case 200:
				return response.body();
			case 400:
				throw new BadRequestException(messageOr(response, mapper, "Bad request"));
			case 401:
				throw new UnauthorizedException(messageOr(response, mapper, "Unauthorized access"));
			case 404:
				throw new ResourceNotFoundException("Resource not found");
			case 500:
				throw new InternalServerErrorException(messageOr(response, mapper, "Internal server error"));
			default:
				throw new UndefinedErrorException(response.status(), messageOr(response, mapper, "Unknown error"));
		}
	}

	static JsonNode parseJson(String body, ObjectMapper mapper) throws ResponseParseException {
		try {
			return mapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw new ResponseParseException("Response is not valid JSON", e);
		}
	}

	/**
	 * Error responses usually carry a <code>message</code> field, but not always, and not always as JSON.
	 */
	private static String messageOr(TransportResponse response, ObjectMapper mapper, String defaultMessage) {
		JsonNode body;
		try {
			body = mapper.readTree(response.body());
		} catch (JsonProcessingException e) {
			return defaultMessage;
		}
		JsonNode message = body.get("message");
		if (message != null && message.isTextual()) {
			return message.textValue();
		}
		return defaultMessage;
	}
}
