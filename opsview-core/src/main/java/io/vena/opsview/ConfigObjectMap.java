package io.vena.opsview;

import lombok.EqualsAndHashCode;

/**
 * A {@link KeyedMap} of full configuration objects.
 * This is the client-side accumulator for collections fetched from the server;
 * it is never the system of record.
 */
@EqualsAndHashCode(callSuper = true)
public final class ConfigObjectMap<T extends ConfigObject<T>> extends KeyedMap<T> {

	/**
	 * @throws IllegalArgumentException if two of <code>objects</code> have the same unique name
	 */
	@SafeVarargs
	public static <T extends ConfigObject<T>> ConfigObjectMap<T> of(T... objects) {
		ConfigObjectMap<T> result = new ConfigObjectMap<>();
		for (T object : objects) {
			T old = result.add(object);
			if (old != null) {
				throw new IllegalArgumentException("Multiple objects with unique name \"" + object.uniqueName() + "\"");
			}
		}
		return result;
	}

	public static <T extends ConfigObject<T>> ConfigObjectMap<T> copyOf(KeyedMap<? extends T> other) {
		ConfigObjectMap<T> result = new ConfigObjectMap<>();
		result.addAll(other);
		return result;
	}
}
