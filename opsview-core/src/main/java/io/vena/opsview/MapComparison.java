package io.vena.opsview;

import java.util.Set;
import java.util.TreeSet;
import lombok.Value;
import lombok.experimental.Accessors;

import static java.util.Collections.unmodifiableSet;

/**
 * How the key sets of two {@link KeyedMap}s overlap.
 * Useful for working out what to create and what to delete when synchronizing.
 */
@Value
@Accessors(fluent = true)
public class MapComparison {
	Set<String> onlyInFirst;
	Set<String> onlyInSecond;
	Set<String> inBoth;

	public static MapComparison of(KeyedMap<?> first, KeyedMap<?> second) {
		Set<String> onlyInFirst = new TreeSet<>(first.keys());
		onlyInFirst.removeAll(second.keys());
		Set<String> onlyInSecond = new TreeSet<>(second.keys());
		onlyInSecond.removeAll(first.keys());
		Set<String> inBoth = new TreeSet<>(first.keys());
		inBoth.retainAll(second.keys());
		return new MapComparison(unmodifiableSet(onlyInFirst), unmodifiableSet(onlyInSecond), unmodifiableSet(inBoth));
	}

	public boolean sameKeys() {
		return onlyInFirst.isEmpty() && onlyInSecond.isEmpty();
	}
}
