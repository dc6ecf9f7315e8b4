package io.vena.opsview.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.opsview.ConfigClient;
import io.vena.opsview.ConfigObject;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.ConfigType;
import io.vena.opsview.Persistent;
import io.vena.opsview.QueryParams;
import io.vena.opsview.exceptions.InvalidConfigException;
import io.vena.opsview.exceptions.RowCountMismatchException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpsviewInstanceTest {
	ExecutorService executor;
	FakeClient client;

	@BeforeEach
	void setup() throws InvalidConfigException {
		executor = Executors.newFixedThreadPool(4);
		client = new FakeClient();
		client.collections.put(Hashtag.TYPE, ConfigObjectMap.of(Hashtag.TYPE.minimal("web"), Hashtag.TYPE.minimal("db")));
		client.collections.put(HostGroup.TYPE, ConfigObjectMap.of(HostGroup.TYPE.minimal("Opsview")));
		client.collections.put(Host.TYPE, new ConfigObjectMap<Host>());
		client.collections.put(BSMComponent.TYPE, ConfigObjectMap.of(BSMComponent.minimal("Web")));
	}

	@AfterEach
	void teardown() {
		executor.shutdownNow();
	}

	@Test
	void refresh_replacesEveryCollection() throws IOException {
		OpsviewInstance instance = new OpsviewInstance();
		instance.refresh(client, executor);

		assertEquals(2, instance.hashtags().size());
		assertTrue(instance.hashtags().contains("db"));
		assertEquals(1, instance.hostGroups().size());
		assertTrue(instance.hosts().isEmpty());
		assertTrue(instance.bsmComponents().contains("Web"));
	}

	@Test
	void refresh_failureKeepsOldSnapshot() throws IOException {
		OpsviewInstance instance = new OpsviewInstance();
		instance.refresh(client, executor);
		ConfigObjectMap<Hashtag> before = instance.hashtags();

		client.failure = new RowCountMismatchException(10, 9);
		RowCountMismatchException e = assertThrows(RowCountMismatchException.class, () -> instance.refresh(client, executor));
		assertEquals(10, e.expectedRows());
		assertSame(before, instance.hashtags());
	}

	@Test
	void refresh_runtimeFailurePassesThrough() {
		client.collections.remove(Host.TYPE);
		assertThrows(IllegalStateException.class, () -> new OpsviewInstance().refresh(client, executor));
	}

	static final class FakeClient implements ConfigClient {
		final Map<ConfigType<?>, ConfigObjectMap<?>> collections = new HashMap<>();
		volatile IOException failure;

		@Override
		@SuppressWarnings("unchecked")
		public <T extends ConfigObject<T>> ConfigObjectMap<T> fetchAll(ConfigType<T> type, QueryParams params) throws IOException {
			if (failure != null && type.equals(Host.TYPE)) {
				throw failure;
			}
			ConfigObjectMap<?> result = collections.get(type);
			if (result == null) {
				throw new IllegalStateException("No collection for " + type);
			}
			return (ConfigObjectMap<T>) result;
		}

		@Override
		public boolean objectExists(Persistent<?> object) {
			throw new UnsupportedOperationException();
		}

		@Override
		public <T extends Persistent<T>> T fetchObject(T object) {
			throw new UnsupportedOperationException();
		}

		@Override
		public JsonNode createObject(Persistent<?> object) {
			throw new UnsupportedOperationException();
		}

		@Override
		public <T extends Persistent<T>> JsonNode createAll(ConfigType<T> type, ConfigObjectMap<T> objects) {
			throw new UnsupportedOperationException();
		}

		@Override
		public JsonNode updateObject(Persistent<?> object) {
			throw new UnsupportedOperationException();
		}

		@Override
		public JsonNode deleteObject(Persistent<?> object) {
			throw new UnsupportedOperationException();
		}
	}
}
