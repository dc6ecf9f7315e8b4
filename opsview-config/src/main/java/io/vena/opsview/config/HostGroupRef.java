package io.vena.opsview.config;

import io.vena.opsview.ConfigRef;
import io.vena.opsview.jackson.wire.WireObject;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Points at a {@link HostGroup} from a host or from another group.
 * Carries the materialized path because names are only unique among siblings.
 */
@WireObject
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HostGroupRef implements ConfigRef {
	private String name;
	private String matpath;
	private String ref;

	public static HostGroupRef from(HostGroup hostGroup) {
		return new HostGroupRef(hostGroup.name(), hostGroup.matpath(), hostGroup.ref());
	}

	@Override
	public String name() {
		return name;
	}

	public Optional<String> matpath() {
		return Optional.ofNullable(matpath);
	}

	@Override
	public Optional<String> ref() {
		return Optional.ofNullable(ref);
	}

	@Override
	public String uniqueName() {
		return matpath == null ? name : matpath;
	}
}
