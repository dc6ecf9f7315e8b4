package io.vena.opsview.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the dashboard lays out objects carrying a {@link Hashtag}.
 */
public enum HashtagStyle {
	GROUP_BY_HOST("group_by_host"),
	GROUP_BY_SERVICE("group_by_service"),
	HOST_SUMMARY("host_summary"),
	ERRORS_AND_HOST_CELLS("errors_and_host_cells"),
	PERFORMANCE("performance"),
	;

	private final String wireName;

	HashtagStyle(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}

	/**
	 * @return null for the server's <code>"null"</code>, meaning no style
	 */
	@JsonCreator
	public static HashtagStyle fromWireName(String wireName) {
		if (wireName == null || "null".equals(wireName)) {
			return null;
		}
		for (HashtagStyle style : values()) {
			if (style.wireName.equals(wireName)) {
				return style;
			}
		}
		throw new IllegalArgumentException("Unknown hashtag style \"" + wireName + "\"");
	}
}
