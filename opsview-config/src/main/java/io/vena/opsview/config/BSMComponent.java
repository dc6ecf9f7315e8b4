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

import static io.vena.opsview.config.NameRules.BSM_COMPONENT_NAME;
import static io.vena.opsview.validation.Validation.requireField;
import static io.vena.opsview.validation.Validation.validateRatioPercentage;
import static io.vena.opsview.validation.Validation.validateTrimmedString;

/**
 * A business service component: a set of hosts, of which a quorum must be up
 * for the component to count as available.
 *
 * <p>
 * The server does not keep component names unique, so the unique name is
 * qualified with the id, or replaced by the ref, whichever is known.
 */
@WireObject
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BSMComponent implements Persistent<BSMComponent> {
	public static final ConfigType<BSMComponent> TYPE = ConfigType
		.of(BSMComponent.class, "/config/bsmcomponent", Builder::new)
		.withMinimalFactory(BSMComponent::minimal);

	private String name;
	private ConfigRefMap<HostRef> hosts;
	private String quorumPct;

	// Read-only
	@WireLong private Long hasIcon;
	@WireLong private Long id;
	private String ref;
	@WireBoolean private Boolean uncommitted;

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Just a name. Not valid for creation on its own, but enough to look one up.
	 */
	public static BSMComponent minimal(String name) throws InvalidConfigException {
		BSMComponent result = new BSMComponent();
		result.setName(name);
		return result;
	}

	@Override
	public ConfigType<BSMComponent> configType() {
		return TYPE;
	}

	@Override
	public String uniqueName() {
		if (id != null) {
			return name + "-" + id;
		} else if (ref != null) {
			return ref;
		} else {
			return name;
		}
	}

	@Override
	public Identifiers identifiers() {
		return Identifiers.of(ref, id, name);
	}

	@Override
	public void clearReadonly() {
		hasIcon = null;
		id = null;
		ref = null;
		uncommitted = null;
	}

	@Override
	public String validatedName(String name) throws InvalidConfigException {
		return validateTrimmedString(name, 1, 255, BSM_COMPONENT_NAME);
	}

	@Override
	public void setName(String name) throws InvalidConfigException {
		this.name = validatedName(name);
	}

	@Override
	public BSMComponent copy() {
		return new BSMComponent(name, hosts == null ? null : ConfigRefMap.copyOf(hosts), quorumPct,
			hasIcon, id, ref, uncommitted);
	}

	public static final class Builder implements ConfigBuilder<BSMComponent> {
		private String name;
		private ConfigRefMap<HostRef> hosts;
		private String quorumPct;

		private Builder() {}

		@Override
		public Builder name(String name) { this.name = name; return this; }

		public Builder hosts(ConfigObjectMap<Host> hosts) {
			this.hosts = ConfigRefMap.from(hosts, HostRef::from);
			return this;
		}

		public Builder hostRefs(ConfigRefMap<HostRef> hosts) {
			this.hosts = ConfigRefMap.copyOf(hosts);
			return this;
		}

		/**
		 * @param quorumPct like <code>"66.67"</code>: the share of hosts that must be up, to two decimals
		 */
		public Builder quorumPct(String quorumPct) { this.quorumPct = quorumPct; return this; }

		@Override
		public BSMComponent build() throws InvalidConfigException {
			String requiredName = requireField(name, "name");
			ConfigRefMap<HostRef> requiredHosts = requireField(hosts, "hosts");
			String requiredQuorum = requireField(quorumPct, "quorum_pct");

			return new BSMComponent(
				validateTrimmedString(requiredName, 1, 255, BSM_COMPONENT_NAME),
				requiredHosts,
				validateRatioPercentage(requiredQuorum, requiredHosts.size()),
				null, null, null, null);
		}
	}
}
