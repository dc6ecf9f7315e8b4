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
 * Component names aren't unique, so a reference is keyed by its ref when it has one.
 */
@WireObject
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BSMComponentRef implements ConfigRef {
	private String name;
	private String ref;

	public static BSMComponentRef from(BSMComponent component) {
		return new BSMComponentRef(component.name(), component.ref());
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
		return (ref == null || ref.isEmpty()) ? name : ref;
	}
}
