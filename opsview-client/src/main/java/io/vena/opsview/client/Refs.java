package io.vena.opsview.client;

import io.vena.opsview.exceptions.InvalidRefException;

final class Refs {
	private static final String REF_PREFIX = "/rest/config/";

	private Refs() {}

	/**
	 * Refs look like <code>/rest/config/hostgroup/7</code>; since every request path
	 * is already under <code>/rest</code>, that prefix is dropped.
	 */
	static String pathFromRef(String ref) throws InvalidRefException {
		if (!ref.startsWith(REF_PREFIX)) {
			throw new InvalidRefException(ref, "expected it to start with " + REF_PREFIX);
		}
		return ref.substring("/rest".length());
	}
}
