package io.vena.opsview;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.opsview.exceptions.MissingIdentifiersException;
import io.vena.opsview.exceptions.NoConfigPathException;
import io.vena.opsview.exceptions.RowCountMismatchException;
import java.io.IOException;

/**
 * The remote side of every {@link Persistent} operation.
 *
 * <p>
 * Each method either returns a complete result or throws;
 * there are no partial results.
 */
public interface ConfigClient {
	/**
	 * @throws MissingIdentifiersException if <code>object</code> has neither an id nor a name
	 */
	boolean objectExists(Persistent<?> object) throws IOException;

	/**
	 * @return a fresh copy of <code>object</code> as the server currently has it
	 */
	<T extends Persistent<T>> T fetchObject(T object) throws IOException;

	/**
	 * Retrieves an entire collection, walking every page.
	 *
	 * @throws NoConfigPathException if <code>type</code> has no collection of its own
	 * @throws RowCountMismatchException if the collection changed while it was being read
	 */
	<T extends ConfigObject<T>> ConfigObjectMap<T> fetchAll(ConfigType<T> type, QueryParams params) throws IOException;

	default <T extends ConfigObject<T>> ConfigObjectMap<T> fetchAll(ConfigType<T> type) throws IOException {
		return fetchAll(type, QueryParams.empty());
	}

	JsonNode createObject(Persistent<?> object) throws IOException;

	<T extends Persistent<T>> JsonNode createAll(ConfigType<T> type, ConfigObjectMap<T> objects) throws IOException;

	JsonNode updateObject(Persistent<?> object) throws IOException;

	JsonNode deleteObject(Persistent<?> object) throws IOException;
}
