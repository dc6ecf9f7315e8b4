package io.vena.opsview;

import java.util.Optional;

/**
 * The reduced form of a {@link Persistent} object used when it is embedded in another object's fields.
 * Carries the name and ref, plus whatever extra fields the embedding object needs.
 */
public interface ConfigRef extends UniquelyNamed {
	String name();

	Optional<String> ref();
}
