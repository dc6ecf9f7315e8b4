package io.vena.opsview.config;

import io.vena.opsview.ConfigBuilder;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.ConfigRefMap;
import io.vena.opsview.ConfigType;
import io.vena.opsview.Identifiers;
import io.vena.opsview.Persistent;
import io.vena.opsview.exceptions.InvalidConfigException;
import io.vena.opsview.jackson.wire.WireBoolean;
import io.vena.opsview.jackson.wire.WireLong;
import io.vena.opsview.jackson.wire.WireObject;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

import static io.vena.opsview.config.NameRules.HOST_NAME;
import static io.vena.opsview.config.NameRules.INLINE_FREE_TEXT;
import static io.vena.opsview.validation.Validation.requireField;
import static io.vena.opsview.validation.Validation.validatePercentEncodedLength;
import static io.vena.opsview.validation.Validation.validateTrimmedString;

/**
 * A monitored host. Belongs to exactly one {@link HostGroup} and carries any number of {@link Hashtag}s.
 */
@WireObject
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Host implements Persistent<Host> {
	public static final ConfigType<Host> TYPE = ConfigType.of(Host.class, "/config/host", Builder::new);

	private String name;
	private String ip;
	private String alias;
	private HostGroupRef hostgroup;
	private ConfigRefMap<HashtagRef> hashtags;
	@WireBoolean private Boolean enableRancid;

	// Read-only
	@WireLong private Long id;
	@WireLong private Long lastUpdated;
	private String ref;
	@WireBoolean private Boolean uncommitted;

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ConfigType<Host> configType() {
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
		lastUpdated = null;
		ref = null;
		uncommitted = null;
	}

	@Override
	public String validatedName(String name) throws InvalidConfigException {
		// The name ends up in URLs, where the limit applies to the encoded form
		validatePercentEncodedLength(name, 255);
		return validateTrimmedString(name, 1, 64, HOST_NAME);
	}

	@Override
	public void setName(String name) throws InvalidConfigException {
		this.name = validatedName(name);
	}

	@Override
	public Host copy() {
		return new Host(name, ip, alias, hostgroup, hashtags == null ? null : ConfigRefMap.copyOf(hashtags), enableRancid,
			id, lastUpdated, ref, uncommitted);
	}

	public static final class Builder implements ConfigBuilder<Host> {
		private String name;
		private String ip;
		private String alias;
		private HostGroupRef hostgroup;
		private ConfigRefMap<HashtagRef> hashtags;
		private Boolean enableRancid;

		private Builder() {}

		@Override
		public Builder name(String name) { this.name = name; return this; }

		public Builder ip(String ip) { this.ip = ip; return this; }

		public Builder alias(String alias) { this.alias = alias; return this; }

		public Builder hostgroup(HostGroup hostgroup) { this.hostgroup = HostGroupRef.from(hostgroup); return this; }

		public Builder hostgroup(HostGroupRef hostgroup) { this.hostgroup = hostgroup; return this; }

		public Builder hashtags(ConfigObjectMap<Hashtag> hashtags) {
			this.hashtags = ConfigRefMap.from(hashtags, HashtagRef::from);
			return this;
		}

		public Builder enableRancid(boolean enableRancid) { this.enableRancid = enableRancid; return this; }

		@Override
		public Host build() throws InvalidConfigException {
			String requiredIp = requireField(ip, "ip");
			String requiredName = requireField(name, "name");
			HostGroupRef requiredHostgroup = requireField(hostgroup, "hostgroup");

			validatePercentEncodedLength(requiredName, 255);
			String validName = validateTrimmedString(requiredName, 1, 64, HOST_NAME);
			String validAlias = alias == null ? null : validateTrimmedString(alias, 0, 255, INLINE_FREE_TEXT);
			return new Host(validName, requiredIp.trim(), validAlias, requiredHostgroup, hashtags, enableRancid,
				null, null, null, null);
		}
	}
}
