package io.vena.opsview.client;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vena.opsview.ConfigClient;
import io.vena.opsview.ConfigObject;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.ConfigType;
import io.vena.opsview.Lookup;
import io.vena.opsview.Lookup.ById;
import io.vena.opsview.Lookup.ByName;
import io.vena.opsview.Lookup.ByRef;
import io.vena.opsview.Persistent;
import io.vena.opsview.QueryParams;
import io.vena.opsview.exceptions.FieldNotFoundException;
import io.vena.opsview.exceptions.IdNotFoundException;
import io.vena.opsview.exceptions.IdParseException;
import io.vena.opsview.exceptions.ObjectNotFoundException;
import io.vena.opsview.exceptions.OpsviewClientException;
import io.vena.opsview.exceptions.ResponseParseException;
import io.vena.opsview.exceptions.TypeParseException;
import io.vena.opsview.exceptions.UnexpectedValueException;
import io.vena.opsview.jackson.DuplicateKeyException;
import io.vena.opsview.jackson.OpsviewJacksonModule;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A logged-in session with one configuration server.
 *
 * <p>
 * Every request goes to <code>{url}/rest{path}</code> and carries the session token.
 * Responses with any status but 200 become the matching {@link io.vena.opsview.exceptions.HttpStatusException}.
 *
 * <p>
 * Immutable once logged in, so one instance may be shared across threads.
 */
public final class OpsviewClient implements ConfigClient {
	private final String baseUrl;
	private final Map<String, String> headers;
	private final Duration timeout;
	private final OpsviewTransport transport;
	private final ObjectMapper mapper;

	private OpsviewClient(String baseUrl, Map<String, String> headers, Duration timeout, OpsviewTransport transport, ObjectMapper mapper) {
		this.baseUrl = baseUrl;
		this.headers = headers;
		this.timeout = timeout;
		this.transport = transport;
		this.mapper = mapper;
	}

	public static OpsviewClient login(OpsviewClientSettings settings) throws IOException {
		Duration timeout = Duration.ofMillis(settings.requestTimeoutMS());
		return login(settings, JdkHttpTransport.create(settings.ignoreCert(), timeout));
	}

	public static OpsviewClient login(OpsviewClientSettings settings, OpsviewTransport transport) throws IOException {
		settings.validate();
		ObjectMapper mapper = OpsviewJacksonModule.newObjectMapper();
		String baseUrl = settings.baseUrl();
		Duration timeout = Duration.ofMillis(settings.requestTimeoutMS());

		ObjectNode credentials = mapper.createObjectNode()
			.put("username", settings.username())
			.put("password", settings.password());
		LOGGER.info("Logging in to {} as {}", baseUrl, settings.username());
		TransportResponse response = transport.send(new TransportRequest(
			"POST",
			URI.create(baseUrl + "/rest/login"),
			Map.of("Content-Type", "application/json"),
			mapper.writeValueAsBytes(credentials),
			timeout));
		JsonNode token = Responses.parse(response, mapper).get("token");
		if (token == null || !token.isTextual()) {
			throw new FieldNotFoundException("Login response does not contain 'token' field");
		}

		Map<String, String> headers = Map.of(
			"X-Opsview-Username", settings.username(),
			"X-Opsview-Token", token.textValue(),
			"Content-Type", "application/json");
		return new OpsviewClient(baseUrl, headers, timeout, transport, mapper);
	}

	public void logout() throws IOException {
		post("/logout", null);
		LOGGER.info("Logged out of {}", baseUrl);
	}

	// Persistent operations

	@Override
	public boolean objectExists(Persistent<?> object) throws IOException {
		Lookup lookup = object.identifiers().forExists();
		String path = object.configType().requireConfigPath() + "/exists";
		JsonNode response;
		if (lookup instanceof ById byId) {
			response = get(path, QueryParams.of("id", Long.toString(byId.id())));
		} else {
			response = get(path, QueryParams.of("name", ((ByName) lookup).name()));
		}
		return interpretExists(response);
	}

	@Override
	public <T extends Persistent<T>> T fetchObject(T object) throws IOException {
		Lookup lookup = object.identifiers().forFetch();
		ConfigType<T> type = object.configType();
		if (lookup instanceof ByRef byRef) {
			return fetchByRef(type, byRef.ref());
		} else if (lookup instanceof ById byId) {
			return fetchById(type, byId.id());
		} else {
			return fetchByName(type, ((ByName) lookup).name());
		}
	}

	@Override
	public <T extends ConfigObject<T>> ConfigObjectMap<T> fetchAll(ConfigType<T> type, QueryParams params) throws IOException {
		String path = type.requireConfigPath();
		JavaType mapType = mapper.getTypeFactory().constructParametricType(ConfigObjectMap.class, type.objectClass());
		LOGGER.debug("Fetching all {} from {}", type, path);
		return PagedFetch.fetchAll(path, params, this::get, list -> decode(list, mapType));
	}

	@Override
	public JsonNode createObject(Persistent<?> object) throws IOException {
		String path = object.configType().requireConfigPath();
		return post(path, envelope("object", object));
	}

	@Override
	public <T extends Persistent<T>> JsonNode createAll(ConfigType<T> type, ConfigObjectMap<T> objects) throws IOException {
		String path = type.requireConfigPath();
		return post(path, envelope("list", objects));
	}

	@Override
	public JsonNode updateObject(Persistent<?> object) throws IOException {
		String path = object.configType().requireConfigPath();
		return put(path, envelope("object", object));
	}

	@Override
	public JsonNode deleteObject(Persistent<?> object) throws IOException {
		Lookup lookup = object.identifiers().forDelete();
		if (lookup instanceof ByRef byRef) {
			return delete(Refs.pathFromRef(byRef.ref()));
		}
		String path = object.configType().requireConfigPath();
		if (lookup instanceof ById byId) {
			return delete(path + "/" + byId.id());
		} else {
			long id = fetchIdByName(path, ((ByName) lookup).name());
			return delete(path + "/" + id);
		}
	}

	// Lookups

	public <T extends ConfigObject<T>> T fetchById(ConfigType<T> type, long id) throws IOException {
		String path = type.requireConfigPath() + "/" + id;
		JsonNode object = get(path, QueryParams.empty()).get("object");
		if (object == null) {
			throw new ObjectNotFoundException(type + " with id " + id + " not found");
		}
		return decode(object, mapper.constructType(type.objectClass()));
	}

	public <T extends ConfigObject<T>> T fetchByName(ConfigType<T> type, String name) throws IOException {
		return fetchByField(type, "name", name);
	}

	/**
	 * @return the first object whose <code>field</code> equals <code>value</code>
	 */
	public <T extends ConfigObject<T>> T fetchByField(ConfigType<T> type, String field, String value) throws IOException {
		String path = type.requireConfigPath();
		JsonNode list = get(path, QueryParams.of("s." + field, value)).get("list");
		if (list == null || !list.isArray() || list.isEmpty()) {
			throw new ObjectNotFoundException(type + " with " + field + " '" + value + "' not found");
		}
		return decode(list.get(0), mapper.constructType(type.objectClass()));
	}

	public <T extends ConfigObject<T>> T fetchByRef(ConfigType<T> type, String ref) throws IOException {
		JsonNode object = get(Refs.pathFromRef(ref), QueryParams.empty()).get("object");
		if (object == null) {
			throw new ObjectNotFoundException(type + " with ref '" + ref + "' not found");
		}
		return decode(object, mapper.constructType(type.objectClass()));
	}

	private long fetchIdByName(String path, String name) throws IOException {
		JsonNode list = get(path, QueryParams.of("s.name", name)).get("list");
		JsonNode id = (list == null || !list.isArray() || list.isEmpty()) ? null : list.get(0).get("id");
		if (id == null || id.isNull()) {
			throw new IdNotFoundException("No id found for '" + name + "' in " + path);
		}
		try {
			return Long.parseLong(id.asText());
		} catch (NumberFormatException e) {
			throw new IdParseException("Unable to parse id '" + id.asText() + "' for '" + name + "'", e);
		}
	}

	// Reloads

	/**
	 * Makes the server start using all committed configuration changes.
	 */
	public JsonNode applyChanges() throws IOException {
		LOGGER.info("Applying pending changes on {}", baseUrl);
		return post("/reload", null);
	}

	public boolean changesToApply() throws IOException {
		String status = textField(get("/reload", QueryParams.empty()), "configuration_status");
		switch (status) {
			case "uptodate":
				return false;
			case "pending":
				return true;
			default:
				throw new UnexpectedValueException("Unexpected value for 'configuration_status' field: '" + status + "'");
		}
	}

	/**
	 * @return when the configuration was last changed, in seconds since the epoch
	 */
	public long lastUpdated() throws IOException {
		String value = textField(get("/reload", QueryParams.empty()), "lastupdated");
		try {
			return Long.parseUnsignedLong(value);
		} catch (NumberFormatException e) {
			throw new TypeParseException(value, "unsigned integer");
		}
	}

	// Raw requests

	/**
	 * The unparsed body of a GET, for endpoints this client has no model for.
	 */
	public String getRaw(String path, QueryParams params) throws IOException {
		return Responses.text(send("GET", path, params, null), mapper);
	}

	public JsonNode get(String path, QueryParams params) throws IOException {
		return Responses.parse(send("GET", path, params, null), mapper);
	}

	public JsonNode post(String path, JsonNode body) throws IOException {
		return Responses.parse(send("POST", path, QueryParams.empty(), body), mapper);
	}

	public JsonNode put(String path, JsonNode body) throws IOException {
		return Responses.parse(send("PUT", path, QueryParams.empty(), body), mapper);
	}

	public JsonNode delete(String path) throws IOException {
		return Responses.parse(send("DELETE", path, QueryParams.empty(), null), mapper);
	}

	private TransportResponse send(String method, String path, QueryParams params, JsonNode body) throws IOException {
		String url = baseUrl + "/rest" + path + (params.isEmpty() ? "" : "?" + params.toQueryString());
		LOGGER.debug("{} {}", method, url);
		byte[] bytes = (body == null) ? null : mapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
		return transport.send(new TransportRequest(method, URI.create(url), headers, bytes, timeout));
	}

	private ObjectNode envelope(String fieldName, Object contents) {
		ObjectNode result = mapper.createObjectNode();
		result.set(fieldName, mapper.valueToTree(contents));
		return result;
	}

	/**
	 * @throws DuplicateKeyException if the server sent two objects with the same unique name
	 */
	private <V> V decode(JsonNode node, JavaType type) throws IOException {
		try {
			return mapper.readerFor(type).readValue(node);
		} catch (DuplicateKeyException e) {
			throw e;
		} catch (IOException e) {
			throw new ResponseParseException("Unable to read " + type.getRawClass().getSimpleName() + " from response", e);
		}
	}

	private static boolean interpretExists(JsonNode response) throws OpsviewClientException {
		String value = textField(response, "exists");
		switch (value) {
			case "1":
				return true;
			case "0":
				return false;
			default:
				throw new UnexpectedValueException("Unexpected value for 'exists' field: '" + value + "'");
		}
	}

	private static String textField(JsonNode response, String fieldName) throws FieldNotFoundException {
		JsonNode field = response.get(fieldName);
		if (field == null || field.isNull()) {
			throw new FieldNotFoundException("Response does not contain '" + fieldName + "' field");
		}
		return field.asText();
	}

	@Override
	public String toString() {
		return "OpsviewClient(" + baseUrl + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OpsviewClient.class);
}
