package io.vena.opsview;

/**
 * Anything that can be held in a {@link KeyedMap}.
 */
public interface UniquelyNamed {
	/**
	 * The key under which this object is stored in a {@link KeyedMap}.
	 *
	 * <p>
	 * Usually just the name. Types whose names the server does not keep unique
	 * must qualify it (eg. with the id or ref) so that distinct remote objects
	 * never collide. Computed from the current field values every time it is called.
	 */
	String uniqueName();
}
