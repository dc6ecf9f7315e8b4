package io.vena.opsview.config;

import io.vena.opsview.ConfigBuilder;
import io.vena.opsview.ConfigObject;
import io.vena.opsview.ConfigType;
import io.vena.opsview.exceptions.InvalidConfigException;
import io.vena.opsview.jackson.wire.WireLong;
import io.vena.opsview.jackson.wire.WireObject;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

import static io.vena.opsview.config.NameRules.CONTACTLINK_NAME;
import static io.vena.opsview.config.NameRules.CONTACTLINK_URL;
import static io.vena.opsview.validation.Validation.requireField;
import static io.vena.opsview.validation.Validation.validateTrimmedString;

/**
 * A link shown in a host's or service's contextual menu.
 * Only ever appears inside other objects; it has no collection of its own.
 */
@WireObject
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ContactLink implements ConfigObject<ContactLink> {
	public static final ConfigType<ContactLink> TYPE = ConfigType
		.embedded(ContactLink.class, Builder::new)
		.withMinimalFactory(ContactLink::minimal);

	private String name;
	private String url;
	private String fontawesomeIcon;

	// Read-only
	@WireLong private Long id;

	public static Builder builder() {
		return new Builder();
	}

	public static ContactLink minimal(String name) throws InvalidConfigException {
		return new ContactLink(validateTrimmedString(name, 3, 128, CONTACTLINK_NAME), null, null, null);
	}

	@Override
	public ConfigType<ContactLink> configType() {
		return TYPE;
	}

	/**
	 * The same name may point at different places, so the tail of the url disambiguates.
	 */
	@Override
	public String uniqueName() {
		if (url == null) {
			return name;
		} else if (url.length() < 5) {
			return name + "_" + url;
		} else {
			return name + "_" + url.substring(url.length() - 5);
		}
	}

	public static final class Builder implements ConfigBuilder<ContactLink> {
		private String name;
		private String url;
		private String fontawesomeIcon;

		private Builder() {}

		@Override
		public Builder name(String name) { this.name = name; return this; }

		public Builder url(String url) { this.url = url; return this; }

		public Builder fontawesomeIcon(String fontawesomeIcon) { this.fontawesomeIcon = fontawesomeIcon; return this; }

		@Override
		public ContactLink build() throws InvalidConfigException {
			String requiredName = requireField(name, "name");
			String requiredUrl = requireField(url, "url");
			return new ContactLink(
				validateTrimmedString(requiredName, 3, 128, CONTACTLINK_NAME),
				validateTrimmedString(requiredUrl, 1, 255, CONTACTLINK_URL),
				fontawesomeIcon,
				null);
		}
	}
}
