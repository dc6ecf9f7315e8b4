package io.vena.opsview;

/**
 * The single identifier chosen to address a remote object for one operation.
 *
 * @see Identifiers
 */
public sealed interface Lookup {
	record ByRef(String ref) implements Lookup {}
	record ById(long id) implements Lookup {}
	record ByName(String name) implements Lookup {}
}
