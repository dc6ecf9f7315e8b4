package io.vena.opsview.config;

import io.vena.opsview.ConfigRef;
import io.vena.opsview.jackson.wire.WireObject;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@WireObject
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HostRef implements ConfigRef {
	private String name;
	private String ref;

	public static HostRef from(Host host) {
		return new HostRef(host.name(), host.ref());
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public Optional<String> ref() {
		return Optional.ofNullable(ref);
	}

	@Override
	public String uniqueName() {
		return name;
	}
}
