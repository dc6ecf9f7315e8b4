package io.vena.opsview;

import com.fasterxml.jackson.databind.JsonNode;
import io.vena.opsview.exceptions.InvalidConfigException;
import java.io.IOException;

/**
 * A {@link ConfigObject} that lives in its own collection on the server and can be
 * created, fetched, updated and removed there.
 *
 * <p>
 * The operations themselves are carried out by a {@link ConfigClient};
 * the entity only contributes its {@link #identifiers() identifiers}.
 */
public interface Persistent<T extends Persistent<T>> extends ConfigObject<T> {
	Identifiers identifiers();

	/**
	 * Unsets every field assigned by the server (id, ref, computed flags)
	 * so the next create treats this as a new object.
	 */
	void clearReadonly();

	/**
	 * @return <code>name</code>, normalized, if it is acceptable for this type
	 */
	String validatedName(String name) throws InvalidConfigException;

	void setName(String name) throws InvalidConfigException;

	/**
	 * @return an independent copy; later changes to either object don't affect the other
	 */
	T copy();

	default boolean exists(ConfigClient client) throws IOException {
		return client.objectExists(self());
	}

	default T fetch(ConfigClient client) throws IOException {
		return client.fetchObject(self());
	}

	default JsonNode create(ConfigClient client) throws IOException {
		return client.createObject(self());
	}

	default JsonNode update(ConfigClient client) throws IOException {
		return client.updateObject(self());
	}

	default JsonNode remove(ConfigClient client) throws IOException {
		return client.deleteObject(self());
	}

	/**
	 * A copy of <code>original</code> that the server will see as a brand-new object called <code>newName</code>.
	 */
	static <T extends Persistent<T>> T cloneWithNewName(T original, String newName) throws InvalidConfigException {
		T result = original.copy();
		result.clearReadonly();
		result.setName(newName);
		return result;
	}

	@SuppressWarnings("unchecked")
	private T self() {
		return (T) this;
	}
}
