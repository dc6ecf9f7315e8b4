package io.vena.opsview.config;

import java.util.regex.Pattern;

/**
 * Naming rules the configuration service enforces, per object type.
 */
final class NameRules {
	static final Pattern HASHTAG_NAME = Pattern.compile("^[\\p{L}\\p{N}][\\p{L}\\p{N}_-]*$");
	static final Pattern HOSTGROUP_NAME = Pattern.compile("^[\\p{L}\\p{N}][\\p{L}\\p{N} ./+\\-_]*$");
	static final Pattern HOST_NAME = Pattern.compile("^[\\p{L}\\p{N}.\\-_]+$");
	static final Pattern BSM_COMPONENT_NAME = Pattern.compile("^[\\p{L}\\p{N}][\\p{L}\\p{N}\\p{S}\\p{P} ]*$");
	static final Pattern CONTACTLINK_NAME = Pattern.compile("^[\\p{L}\\p{N}][\\p{L}\\p{N} ._-]*$");
	static final Pattern CONTACTLINK_URL = Pattern.compile("^(https?:/)?/[\\p{L}\\p{N}\\p{S}\\p{P} ]*$");

	// Anything but separators, though a plain space is fine
	static final Pattern INLINE_FREE_TEXT = Pattern.compile("^[\\P{Z}\\p{N}\\p{S}\\p{P} ]*$");

	private NameRules() {}
}
