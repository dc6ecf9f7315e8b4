package io.vena.opsview;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import lombok.EqualsAndHashCode;

import static java.util.Collections.unmodifiableCollection;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * A set of {@link UniquelyNamed} objects, addressable by their unique names.
 *
 * <p>
 * Behaves like a {@link HashMap}, except we automatically know the key for each
 * entry: its {@link UniquelyNamed#uniqueName() uniqueName}, computed at the moment
 * it is added. Adding an object whose key is already present replaces the old one.
 * Iteration order is unspecified.
 *
 * <p>
 * Entries are held by reference, so one object may sit in several maps at once.
 * Not thread-safe.
 */
@EqualsAndHashCode
public abstract class KeyedMap<V extends UniquelyNamed> implements Iterable<V> {
	private final Map<String, V> contents = new HashMap<>();

	/**
	 * @return the entry this one replaced, or null
	 * @throws IllegalArgumentException if <code>value</code> has no unique name
	 */
	public V add(V value) {
		String key = requireNonNull(value).uniqueName();
		if (key == null) {
			throw new IllegalArgumentException("Cannot add " + value.getClass().getSimpleName() + " with no unique name");
		}
		return contents.put(key, value);
	}

	public void addAll(Iterable<? extends V> values) {
		values.forEach(this::add);
	}

	public V get(String key) {
		return contents.get(requireNonNull(key));
	}

	public boolean contains(String key) {
		return contents.containsKey(requireNonNull(key));
	}

	/**
	 * @return the removed entry, or null if there was none
	 */
	public V remove(String key) {
		return contents.remove(requireNonNull(key));
	}

	public int size() { return contents.size(); }

	public boolean isEmpty() { return contents.isEmpty(); }

	public Set<String> keys() {
		return unmodifiableSet(contents.keySet());
	}

	public Collection<V> values() {
		return unmodifiableCollection(contents.values());
	}

	public List<V> asList() {
		return new ArrayList<>(contents.values());
	}

	public Map<String, V> asMap() {
		return unmodifiableMap(contents);
	}

	public Stream<V> stream() {
		return contents.values().stream();
	}

	@Override
	public Iterator<V> iterator() {
		return values().iterator();
	}

	/**
	 * Empties this map.
	 *
	 * @return everything this map held
	 */
	public List<V> drain() {
		List<V> result = new ArrayList<>(contents.values());
		contents.clear();
		return result;
	}

	/**
	 * Moves every entry of <code>source</code> into this map, leaving <code>source</code> empty.
	 * On key collisions, the entry from <code>source</code> wins.
	 */
	public void extend(KeyedMap<? extends V> source) {
		if (source == this) {
			return;
		}
		source.drain().forEach(this::add);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + contents.keySet();
	}
}
