package io.vena.opsview;

import io.vena.opsview.Lookup.ById;
import io.vena.opsview.Lookup.ByName;
import io.vena.opsview.Lookup.ByRef;
import io.vena.opsview.exceptions.MissingIdentifiersException;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * The up to three values that can identify a persisted object: the server-assigned
 * ref and id, and the caller-assigned name.
 *
 * <p>
 * Empty strings count as absent.
 *
 * <p>
 * Which identifier wins depends on the operation:
 * <ul>
 *     <li>
 *         Existence checks use the id, then the name. They never use the ref,
 *         since they are mostly asked about objects that haven't been created yet.
 *     </li>
 *     <li>
 *         Fetch and delete use the ref, then the id, then the name.
 *     </li>
 * </ul>
 * With no usable identifier, the operation fails with {@link MissingIdentifiersException}
 * before any request is made.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Identifiers {
	private final String ref;
	private final Long id;
	private final String name;

	private static final Identifiers NONE = new Identifiers(null, null, null);

	public static Identifiers of(String ref, Long id, String name) {
		return new Identifiers(emptyToNull(ref), id, emptyToNull(name));
	}

	public static Identifiers none() {
		return NONE;
	}

	public Optional<String> ref() {
		return Optional.ofNullable(ref);
	}

	public Optional<Long> id() {
		return Optional.ofNullable(id);
	}

	public Optional<String> name() {
		return Optional.ofNullable(name);
	}

	public boolean isEmpty() {
		return ref == null && id == null && name == null;
	}

	public Lookup forExists() throws MissingIdentifiersException {
		if (id != null) {
			return new ById(id);
		} else if (name != null) {
			return new ByName(name);
		} else {
			throw new MissingIdentifiersException("Cannot check if object exists: neither id, nor name are set.");
		}
	}

	public Lookup forFetch() throws MissingIdentifiersException {
		return byPriority("fetch");
	}

	public Lookup forDelete() throws MissingIdentifiersException {
		return byPriority("delete");
	}

	private Lookup byPriority(String operation) throws MissingIdentifiersException {
		if (ref != null) {
			return new ByRef(ref);
		} else if (id != null) {
			return new ById(id);
		} else if (name != null) {
			return new ByName(name);
		} else {
			throw new MissingIdentifiersException("Cannot " + operation + " object: neither ref, id, nor name are set.");
		}
	}

	private static String emptyToNull(String value) {
		return (value == null || value.isEmpty()) ? null : value;
	}

	@Override
	public String toString() {
		return "Identifiers(ref=" + ref + ", id=" + id + ", name=" + name + ")";
	}
}
