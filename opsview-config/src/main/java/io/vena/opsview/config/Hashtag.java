package io.vena.opsview.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.vena.opsview.ConfigBuilder;
import io.vena.opsview.ConfigType;
import io.vena.opsview.Identifiers;
import io.vena.opsview.Persistent;
import io.vena.opsview.exceptions.InvalidConfigException;
import io.vena.opsview.jackson.wire.WireBoolean;
import io.vena.opsview.jackson.wire.WireLong;
import io.vena.opsview.jackson.wire.WireObject;
import io.vena.opsview.validation.Validation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

import static io.vena.opsview.config.NameRules.HASHTAG_NAME;
import static io.vena.opsview.config.NameRules.INLINE_FREE_TEXT;
import static io.vena.opsview.validation.Validation.requireField;

/**
 * A label that groups hosts and service checks for dashboards and notifications.
 * Stored by the server as a "keyword".
 */
@WireObject
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Hashtag implements Persistent<Hashtag> {
	public static final ConfigType<Hashtag> TYPE = ConfigType.of(Hashtag.class, "/config/keyword", Builder::new);

	private String name;
	@WireBoolean private Boolean allHosts;
	@WireBoolean private Boolean allServicechecks;
	@WireBoolean private Boolean calculateHardStates;
	private String description;
	@WireBoolean private Boolean enabled;
	@WireBoolean private Boolean excludeHandled;
	@JsonProperty("public")
	@WireBoolean private Boolean isPublic;
	@WireBoolean private Boolean showContextualMenus;
	private HashtagStyle style;

	// Read-only
	@WireLong private Long id;
	private String ref;
	@WireBoolean private Boolean uncommitted;

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ConfigType<Hashtag> configType() {
		return TYPE;
	}

	@Override
	public String uniqueName() {
		return name;
	}

	@Override
	public Identifiers identifiers() {
		return Identifiers.of(ref, id, name);
	}

	@Override
	public void clearReadonly() {
		id = null;
		ref = null;
		uncommitted = null;
	}

	@Override
	public String validatedName(String name) throws InvalidConfigException {
		return Validation.validateTrimmedString(name, 1, 128, HASHTAG_NAME);
	}

	@Override
	public void setName(String name) throws InvalidConfigException {
		this.name = validatedName(name);
	}

	@Override
	public Hashtag copy() {
		return new Hashtag(name, allHosts, allServicechecks, calculateHardStates, description, enabled,
			excludeHandled, isPublic, showContextualMenus, style, id, ref, uncommitted);
	}

	public static final class Builder implements ConfigBuilder<Hashtag> {
		private String name;
		private Boolean allHosts;
		private Boolean allServicechecks;
		private Boolean calculateHardStates;
		private String description;
		private Boolean enabled = true;
		private Boolean excludeHandled;
		private Boolean isPublic;
		private Boolean showContextualMenus = true;
		private HashtagStyle style;

		private Builder() {}

		@Override
		public Builder name(String name) { this.name = name; return this; }

		public Builder allHosts(boolean allHosts) { this.allHosts = allHosts; return this; }

		public Builder allServicechecks(boolean allServicechecks) { this.allServicechecks = allServicechecks; return this; }

		public Builder calculateHardStates(boolean calculateHardStates) { this.calculateHardStates = calculateHardStates; return this; }

		public Builder description(String description) { this.description = description; return this; }

		public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }

		public Builder excludeHandled(boolean excludeHandled) { this.excludeHandled = excludeHandled; return this; }

		public Builder isPublic(boolean isPublic) { this.isPublic = isPublic; return this; }

		public Builder showContextualMenus(boolean showContextualMenus) { this.showContextualMenus = showContextualMenus; return this; }

		public Builder style(HashtagStyle style) { this.style = style; return this; }

		@Override
		public Hashtag build() throws InvalidConfigException {
			String validName = Validation.validateTrimmedString(requireField(name, "name"), 1, 128, HASHTAG_NAME);
			String validDescription = description == null ? null
				: Validation.validateTrimmedString(description, 0, 255, INLINE_FREE_TEXT);
			return new Hashtag(validName, allHosts, allServicechecks, calculateHardStates, validDescription, enabled,
				excludeHandled, isPublic, showContextualMenus, style, null, null, null);
		}
	}
}
