package io.vena.opsview;

import java.net.URLEncoder;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.joining;

/**
 * An immutable, ordered list of query parameters. Keys may repeat.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class QueryParams implements Iterable<Entry<String, String>> {
	private final List<Entry<String, String>> entries;

	private static final QueryParams EMPTY = new QueryParams(List.of());

	public static QueryParams empty() {
		return EMPTY;
	}

	public static QueryParams of(String key, String value) {
		return EMPTY.with(key, value);
	}

	public QueryParams with(String key, String value) {
		List<Entry<String, String>> newEntries = new ArrayList<>(entries);
		newEntries.add(new SimpleImmutableEntry<>(key, value));
		return new QueryParams(unmodifiableList(newEntries));
	}

	/**
	 * Like {@link #with} except any existing entries for <code>key</code> are dropped first.
	 */
	public QueryParams replacing(String key, String value) {
		List<Entry<String, String>> newEntries = new ArrayList<>(entries);
		newEntries.removeIf(e -> e.getKey().equals(key));
		newEntries.add(new SimpleImmutableEntry<>(key, value));
		return new QueryParams(unmodifiableList(newEntries));
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public List<Entry<String, String>> entries() {
		return entries;
	}

	@Override
	public Iterator<Entry<String, String>> iterator() {
		return entries.iterator();
	}

	/**
	 * @return the percent-encoded form, without the leading <code>?</code>
	 */
	public String toQueryString() {
		return entries.stream()
			.map(e -> URLEncoder.encode(e.getKey(), UTF_8) + "=" + URLEncoder.encode(e.getValue(), UTF_8))
			.collect(joining("&"));
	}

	@Override
	public String toString() {
		return toQueryString();
	}
}
