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
import io.vena.opsview.validation.Validation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

import static io.vena.opsview.config.NameRules.HOSTGROUP_NAME;
import static io.vena.opsview.validation.Validation.requireField;

/**
 * A node in the tree of host groups.
 *
 * <p>
 * Names need only be unique among siblings, so the unique name is the server's
 * materialized path (like <code>Opsview,UK,London,</code>) once it is known.
 */
@WireObject
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HostGroup implements Persistent<HostGroup> {
	public static final ConfigType<HostGroup> TYPE = ConfigType.of(HostGroup.class, "/config/hostgroup", Builder::new);

	private String name;
	private ConfigRefMap<HostGroupRef> children;
	private HostGroupRef parent;

	// Read-only
	@WireLong private Long id;
	@WireBoolean private Boolean isLeaf;
	private String matpath;
	private String ref;
	@WireBoolean private Boolean uncommitted;

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ConfigType<HostGroup> configType() {
		return TYPE;
	}

	@Override
	public String uniqueName() {
		return matpath == null ? name : matpath;
	}

	@Override
	public Identifiers identifiers() {
		return Identifiers.of(ref, id, name);
	}

	@Override
	public void clearReadonly() {
		id = null;
		isLeaf = null;
		matpath = null;
		ref = null;
		uncommitted = null;
	}

	@Override
	public String validatedName(String name) throws InvalidConfigException {
		return Validation.validateTrimmedString(name, 1, 128, HOSTGROUP_NAME);
	}

	@Override
	public void setName(String name) throws InvalidConfigException {
		this.name = validatedName(name);
	}

	@Override
	public HostGroup copy() {
		return new HostGroup(name, children == null ? null : ConfigRefMap.copyOf(children), parent,
			id, isLeaf, matpath, ref, uncommitted);
	}

	public static final class Builder implements ConfigBuilder<HostGroup> {
		private String name;
		private ConfigRefMap<HostGroupRef> children;
		private HostGroupRef parent;

		private Builder() {}

		@Override
		public Builder name(String name) { this.name = name; return this; }

		public Builder parent(HostGroup parent) { this.parent = HostGroupRef.from(parent); return this; }

		public Builder parent(HostGroupRef parent) { this.parent = parent; return this; }

		public Builder children(ConfigObjectMap<HostGroup> children) {
			this.children = ConfigRefMap.from(children, HostGroupRef::from);
			return this;
		}

		public Builder childRefs(ConfigRefMap<HostGroupRef> children) {
			this.children = ConfigRefMap.copyOf(children);
			return this;
		}

		@Override
		public HostGroup build() throws InvalidConfigException {
			String validName = Validation.validateTrimmedString(requireField(name, "name"), 1, 128, HOSTGROUP_NAME);
			return new HostGroup(validName, children, parent, null, null, null, null, null);
		}
	}
}
