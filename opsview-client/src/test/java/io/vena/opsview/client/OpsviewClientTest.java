package io.vena.opsview.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.QueryParams;
import io.vena.opsview.config.Hashtag;
import io.vena.opsview.exceptions.BadRequestException;
import io.vena.opsview.exceptions.FieldNotFoundException;
import io.vena.opsview.exceptions.HttpStatusException;
import io.vena.opsview.exceptions.IdNotFoundException;
import io.vena.opsview.exceptions.InternalServerErrorException;
import io.vena.opsview.exceptions.InvalidRefException;
import io.vena.opsview.exceptions.MissingIdentifiersException;
import io.vena.opsview.exceptions.NotAnArrayException;
import io.vena.opsview.exceptions.ObjectNotFoundException;
import io.vena.opsview.exceptions.ResourceNotFoundException;
import io.vena.opsview.exceptions.ResponseParseException;
import io.vena.opsview.exceptions.RowCountMismatchException;
import io.vena.opsview.exceptions.UnauthorizedException;
import io.vena.opsview.exceptions.UndefinedErrorException;
import io.vena.opsview.exceptions.UnexpectedValueException;
import io.vena.opsview.jackson.DuplicateKeyException;
import io.vena.opsview.jackson.OpsviewJacksonModule;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static java.util.stream.Collectors.joining;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpsviewClientTest {
	final ObjectMapper mapper = OpsviewJacksonModule.newObjectMapper();
	MockWebServer server;
	OpsviewClient client;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockWebServer();
		server.start();
		server.enqueue(ok("{\"token\":\"t0k3n\"}"));
		client = OpsviewClient.login(settings(), transport());
		takeRequest(); // login
	}

	@AfterEach
	void tearDown() throws Exception {
		server.shutdown();
	}

	@Test
	void login_sendsCredentialsThenToken() throws Exception {
		server.enqueue(ok("{\"exists\":\"1\"}"));
		client.objectExists(Hashtag.TYPE.minimal("web"));

		RecordedRequest request = takeRequest();
		assertEquals("admin", request.getHeader("X-Opsview-Username"));
		assertEquals("t0k3n", request.getHeader("X-Opsview-Token"));
		assertEquals("application/json", request.getHeader("Content-Type"));
	}

	@Test
	void login_badCredentials() {
		server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"Invalid username or password\"}"));
		UnauthorizedException e = assertThrows(UnauthorizedException.class, () -> OpsviewClient.login(settings(), transport()));
		assertEquals("Invalid username or password", e.getMessage());
	}

	@Test
	void login_postsUsernameAndPassword() throws Exception {
		server.enqueue(ok("{\"token\":\"second\"}"));
		OpsviewClient.login(settings(), transport());

		RecordedRequest request = takeRequest();
		assertEquals("POST", request.getMethod());
		assertEquals("/rest/login", request.getPath());
		JsonNode body = mapper.readTree(request.getBody().readUtf8());
		assertEquals("admin", body.get("username").textValue());
		assertEquals("secret", body.get("password").textValue());
	}

	@Test
	void fetchAll_walksEveryPage() throws Exception {
		server.enqueue(ok(page(25, 3, names(1, 10))));
		server.enqueue(ok(page(25, 3, names(11, 20))));
		server.enqueue(ok(page(25, 3, names(21, 25))));

		ConfigObjectMap<Hashtag> hashtags = client.fetchAll(Hashtag.TYPE);

		assertEquals(25, hashtags.size());
		assertTrue(hashtags.contains("tag17"));
		assertEquals("/rest/config/keyword", takeRequest().getPath());
		assertEquals("/rest/config/keyword?page=2", takeRequest().getPath());
		assertEquals("/rest/config/keyword?page=3", takeRequest().getPath());
	}

	@Test
	void fetchAll_keepsCallerParams() throws Exception {
		server.enqueue(ok(page(3, 2, names(1, 2))));
		server.enqueue(ok(page(3, 2, names(3, 3))));

		client.fetchAll(Hashtag.TYPE, QueryParams.of("rows", "2").with("page", "1"));

		assertEquals("/rest/config/keyword?rows=2&page=1", takeRequest().getPath());
		assertEquals("/rest/config/keyword?rows=2&page=2", takeRequest().getPath());
	}

	@Test
	void fetchAll_emptyCollection() throws Exception {
		server.enqueue(ok(page(0, 0)));
		assertTrue(client.fetchAll(Hashtag.TYPE).isEmpty());
		assertEquals(2, server.getRequestCount());
	}

	@Test
	void fetchAll_totalChangesMidway() {
		server.enqueue(ok(page(25, 3, names(1, 10))));
		server.enqueue(ok(page(20, 2, names(11, 20))));

		RowCountMismatchException e = assertThrows(RowCountMismatchException.class, () -> client.fetchAll(Hashtag.TYPE));
		assertEquals(25, e.expectedRows());
		assertEquals(20, e.actualRows());
		assertEquals(3, server.getRequestCount());
	}

	@Test
	void fetchAll_objectShiftedBetweenPages() {
		// tag2 shows up twice because something before it was deleted
		server.enqueue(ok(page(3, 2, "tag1", "tag2")));
		server.enqueue(ok(page(3, 2, "tag2")));

		RowCountMismatchException e = assertThrows(RowCountMismatchException.class, () -> client.fetchAll(Hashtag.TYPE));
		assertEquals(3, e.expectedRows());
		assertEquals(2, e.actualRows());
	}

	@Test
	void fetchAll_duplicateWithinPage() {
		server.enqueue(ok(page(2, 1, "tag1", "tag1")));
		DuplicateKeyException e = assertThrows(DuplicateKeyException.class, () -> client.fetchAll(Hashtag.TYPE));
		assertEquals("tag1", e.key());
	}

	@Test
	void fetchAll_namelessObject() {
		server.enqueue(ok("{\"summary\":{\"totalrows\":\"1\",\"totalpages\":\"1\"},"
			+ "\"list\":[{\"id\":\"5\",\"ref\":\"/rest/config/keyword/5\"}]}"));
		assertThrows(ResponseParseException.class, () -> client.fetchAll(Hashtag.TYPE));
	}

	@Test
	void fetchAll_malformedPages() {
		server.enqueue(ok("{\"summary\":{\"totalrows\":\"1\",\"totalpages\":\"1\"},\"list\":{}}"));
		assertThrows(NotAnArrayException.class, () -> client.fetchAll(Hashtag.TYPE));

		server.enqueue(ok("{\"summary\":{\"totalrows\":\"1\",\"totalpages\":\"1\"}}"));
		assertThrows(ObjectNotFoundException.class, () -> client.fetchAll(Hashtag.TYPE));

		server.enqueue(ok("{\"list\":[]}"));
		assertThrows(FieldNotFoundException.class, () -> client.fetchAll(Hashtag.TYPE));
	}

	@Test
	void exists_prefersId() throws Exception {
		Hashtag persisted = mapper.readValue("{\"name\":\"web\",\"id\":\"7\",\"ref\":\"/rest/config/keyword/7\"}", Hashtag.class);
		server.enqueue(ok("{\"exists\":\"1\"}"));
		server.enqueue(ok("{\"exists\":\"0\"}"));

		assertTrue(persisted.exists(client));
		assertFalse(Hashtag.TYPE.minimal("newone").exists(client));

		assertEquals("/rest/config/keyword/exists?id=7", takeRequest().getPath());
		assertEquals("/rest/config/keyword/exists?name=newone", takeRequest().getPath());
	}

	@Test
	void exists_unexpectedAnswer() {
		server.enqueue(ok("{\"exists\":\"maybe\"}"));
		assertThrows(UnexpectedValueException.class, () -> Hashtag.TYPE.minimal("web").exists(client));
	}

	@Test
	void noIdentifiers_noRequest() throws Exception {
		Hashtag anonymous = mapper.readValue("{\"description\":\"nameless\"}", Hashtag.class);

		assertThrows(MissingIdentifiersException.class, () -> anonymous.exists(client));
		assertThrows(MissingIdentifiersException.class, () -> anonymous.fetch(client));
		assertThrows(MissingIdentifiersException.class, () -> anonymous.remove(client));
		assertEquals(1, server.getRequestCount());
	}

	@Test
	void fetch_prefersRef() throws Exception {
		Hashtag stale = mapper.readValue("{\"name\":\"web\",\"id\":\"12\",\"ref\":\"/rest/config/keyword/99\"}", Hashtag.class);
		server.enqueue(ok("{\"object\":{\"name\":\"web\",\"id\":\"99\",\"ref\":\"/rest/config/keyword/99\",\"enabled\":\"0\"}}"));

		Hashtag fresh = stale.fetch(client);

		assertEquals(99L, fresh.id());
		assertFalse(fresh.enabled());
		assertEquals("/rest/config/keyword/99", takeRequest().getPath());
	}

	@Test
	void fetch_byName() throws Exception {
		server.enqueue(ok("{\"list\":[{\"name\":\"web\",\"id\":\"3\"}]}"));
		Hashtag fetched = Hashtag.TYPE.minimal("web").fetch(client);
		assertEquals(3L, fetched.id());
		assertEquals("/rest/config/keyword?s.name=web", takeRequest().getPath());
	}

	@Test
	void fetch_badRef() throws Exception {
		Hashtag weird = mapper.readValue("{\"name\":\"web\",\"ref\":\"/api/keyword/1\"}", Hashtag.class);
		assertThrows(InvalidRefException.class, () -> weird.fetch(client));
		assertEquals(1, server.getRequestCount());
	}

	@Test
	void create_wrapsInObject() throws Exception {
		server.enqueue(ok("{\"object\":{\"id\":\"4\"}}"));
		Hashtag.builder().name("web").isPublic(true).build().create(client);

		RecordedRequest request = takeRequest();
		assertEquals("POST", request.getMethod());
		assertEquals("/rest/config/keyword", request.getPath());
		JsonNode body = mapper.readTree(request.getBody().readUtf8());
		assertEquals("web", body.get("object").get("name").textValue());
		assertEquals("1", body.get("object").get("public").textValue());
	}

	@Test
	void createAll_wrapsInList() throws Exception {
		server.enqueue(ok("{\"total\":\"2\"}"));
		client.createAll(Hashtag.TYPE, ConfigObjectMap.of(Hashtag.TYPE.minimal("a"), Hashtag.TYPE.minimal("b")));

		JsonNode body = mapper.readTree(takeRequest().getBody().readUtf8());
		assertEquals(2, body.get("list").size());
	}

	@Test
	void update_puts() throws Exception {
		server.enqueue(ok("{\"object\":{}}"));
		Hashtag.TYPE.minimal("web").update(client);
		RecordedRequest request = takeRequest();
		assertEquals("PUT", request.getMethod());
		assertEquals("/rest/config/keyword", request.getPath());
	}

	@Test
	void remove_byNameLooksUpId() throws Exception {
		server.enqueue(ok("{\"list\":[{\"name\":\"web\",\"id\":\"12\"}]}"));
		server.enqueue(ok("{\"success\":1}"));

		Hashtag.TYPE.minimal("web").remove(client);

		RecordedRequest lookup = takeRequest();
		assertEquals("GET", lookup.getMethod());
		assertEquals("/rest/config/keyword?s.name=web", lookup.getPath());
		RecordedRequest delete = takeRequest();
		assertEquals("DELETE", delete.getMethod());
		assertEquals("/rest/config/keyword/12", delete.getPath());
	}

	@Test
	void remove_unknownName() {
		server.enqueue(ok("{\"list\":[]}"));
		assertThrows(IdNotFoundException.class, () -> Hashtag.TYPE.minimal("web").remove(client));
		assertEquals(2, server.getRequestCount());
	}

	@Test
	void remove_byId() throws Exception {
		Hashtag persisted = mapper.readValue("{\"name\":\"web\",\"id\":\"7\"}", Hashtag.class);
		server.enqueue(ok("{\"success\":1}"));
		persisted.remove(client);
		assertEquals("/rest/config/keyword/7", takeRequest().getPath());
	}

	static Stream<Arguments> errorStatuses() {
		return Stream.of(
			Arguments.of(400, "{\"message\":\"Missing field\"}", BadRequestException.class, "Missing field"),
			Arguments.of(400, "", BadRequestException.class, "Bad request"),
			Arguments.of(401, "{}", UnauthorizedException.class, "Unauthorized access"),
			Arguments.of(404, "{\"message\":\"ignored\"}", ResourceNotFoundException.class, "Resource not found"),
			Arguments.of(500, "{\"message\":\"Database locked\"}", InternalServerErrorException.class, "Database locked"),
			Arguments.of(418, "not json", UndefinedErrorException.class, "Unknown error"));
	}

	@ParameterizedTest
	@MethodSource("errorStatuses")
	void statusMapping(int status, String body, Class<? extends HttpStatusException> expectedType, String expectedMessage) {
		server.enqueue(new MockResponse().setResponseCode(status).setBody(body));
		HttpStatusException e = assertThrows(expectedType, () -> client.get("/config/keyword", QueryParams.empty()));
		assertEquals(status, e.status());
		assertEquals(expectedMessage, e.getMessage());
	}

	@Test
	void reloadStatus() throws Exception {
		server.enqueue(ok("{\"configuration_status\":\"pending\",\"lastupdated\":\"1700000000\"}"));
		server.enqueue(ok("{\"configuration_status\":\"uptodate\",\"lastupdated\":\"1700000000\"}"));
		server.enqueue(ok("{\"configuration_status\":\"uptodate\",\"lastupdated\":\"1700000000\"}"));
		server.enqueue(ok("{\"configuration_status\":\"broken\"}"));

		assertTrue(client.changesToApply());
		assertFalse(client.changesToApply());
		assertEquals(1_700_000_000L, client.lastUpdated());
		assertThrows(UnexpectedValueException.class, client::changesToApply);
		assertEquals("/rest/reload", takeRequest().getPath());
	}

	@Test
	void applyChanges_posts() throws Exception {
		server.enqueue(ok("{\"configuration_status\":\"uptodate\"}"));
		client.applyChanges();
		RecordedRequest request = takeRequest();
		assertEquals("POST", request.getMethod());
		assertEquals("/rest/reload", request.getPath());
	}

	@Test
	void getRaw_returnsBodyUnparsed() throws Exception {
		server.enqueue(ok("plain text, not json"));
		assertEquals("plain text, not json", client.getRaw("/info", QueryParams.of("verbose", "1")));
		assertEquals("/rest/info?verbose=1", takeRequest().getPath());
	}

	private OpsviewClientSettings settings() {
		return OpsviewClientSettings.builder()
			.url(server.url("/").toString())
			.username("admin")
			.password("secret")
			.build();
	}

	private static OpsviewTransport transport() {
		return new JdkHttpTransport(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build());
	}

	private RecordedRequest takeRequest() throws InterruptedException {
		RecordedRequest result = server.takeRequest(5, TimeUnit.SECONDS);
		if (result == null) {
			throw new AssertionError("Expected another request");
		}
		return result;
	}

	private static MockResponse ok(String body) {
		return new MockResponse().setResponseCode(200).setBody(body);
	}

	private static String[] names(int first, int last) {
		return IntStream.rangeClosed(first, last).mapToObj(i -> "tag" + i).toArray(String[]::new);
	}

	private static String page(int totalRows, int totalPages, String... names) {
		List<String> objects = new ArrayList<>();
		for (String name : names) {
			objects.add("{\"name\":\"" + name + "\",\"ref\":\"/rest/config/keyword/" + name.hashCode() + "\"}");
		}
		return "{\"summary\":{\"totalrows\":\"" + totalRows + "\",\"totalpages\":\"" + totalPages + "\"},"
			+ "\"list\":[" + objects.stream().collect(joining(",")) + "]}";
	}
}
