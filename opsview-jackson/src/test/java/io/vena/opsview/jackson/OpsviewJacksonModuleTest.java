package io.vena.opsview.jackson;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.ConfigRefMap;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpsviewJacksonModuleTest {
	final ObjectMapper mapper = OpsviewJacksonModule.newObjectMapper();
	final JavaType widgetMapType = mapper.getTypeFactory().constructParametricType(ConfigObjectMap.class, Widget.class);

	@Test
	void map_serializesAsArrayOfValues() {
		ConfigObjectMap<Widget> map = ConfigObjectMap.of(Widget.named("a"), Widget.named("b"));
		JsonNode json = mapper.valueToTree(map);
		assertTrue(json.isArray());
		assertEquals(2, json.size());
		json.forEach(element -> assertTrue(element.has("name")));
	}

	@Test
	void roundTrip_preservesKeys() throws Exception {
		ConfigObjectMap<Widget> map = ConfigObjectMap.of(
			new Widget("a", 1L, true, ConfigRefMap.of(new WidgetRef("bolt", "/rest/config/widget/9"))),
			Widget.named("b"));

		ConfigObjectMap<Widget> actual = mapper.readValue(mapper.writeValueAsString(map), widgetMapType);

		assertEquals(map.keys(), actual.keys());
		assertEquals(map, actual);
	}

	@Test
	void duplicateNames_rejected() {
		String json = "[{\"name\":\"a\"},{\"name\":\"b\"},{\"name\":\"a\",\"id\":\"3\"}]";
		DuplicateKeyException e = assertThrows(DuplicateKeyException.class, () -> mapper.readValue(json, widgetMapType));
		assertEquals("a", e.key());
		assertThat(e.getMessage(), containsString("Duplicate name detected: a"));
	}

	@Test
	void duplicateNames_inNestedField_rejected() {
		String json = "{\"name\":\"a\",\"spare_parts\":[{\"name\":\"bolt\"},{\"name\":\"bolt\"}]}";
		DuplicateKeyException e = assertThrows(DuplicateKeyException.class, () -> mapper.readValue(json, Widget.class));
		assertEquals("bolt", e.key());
	}

	@Test
	void namelessEntry_rejected() {
		String json = "[{\"name\":\"a\"},{\"id\":\"5\"}]";
		JsonMappingException e = assertThrows(JsonMappingException.class, () -> mapper.readValue(json, widgetMapType));
		assertThat(e.getMessage(), containsString("no unique name"));
	}

	@Test
	void wireFields_useServerSpelling() throws Exception {
		Widget widget = new Widget("a", 12L, false, null);
		JsonNode json = mapper.valueToTree(widget);
		assertEquals("12", json.get("id").textValue());
		assertEquals("0", json.get("enabled").textValue());
		assertTrue(!json.has("spare_parts"), "Unset fields are omitted");

		Widget parsed = mapper.readValue("{\"name\":\"a\",\"id\":12,\"enabled\":\"no\",\"extra\":true}", Widget.class);
		assertEquals(widget, parsed);
	}

	@Test
	void emptyArray_givesEmptyMap() throws Exception {
		ConfigObjectMap<Widget> actual = mapper.readValue("[]", widgetMapType);
		assertTrue(actual.isEmpty());
	}
}
