package io.vena.opsview;

import java.util.function.Function;
import lombok.EqualsAndHashCode;

/**
 * A {@link KeyedMap} of references, used for fields in which one object names a set of others.
 */
@EqualsAndHashCode(callSuper = true)
public final class ConfigRefMap<R extends ConfigRef> extends KeyedMap<R> {

	@SafeVarargs
	public static <R extends ConfigRef> ConfigRefMap<R> of(R... refs) {
		ConfigRefMap<R> result = new ConfigRefMap<>();
		for (R ref : refs) {
			R old = result.add(ref);
			if (old != null) {
				throw new IllegalArgumentException("Multiple references with unique name \"" + ref.uniqueName() + "\"");
			}
		}
		return result;
	}

	/**
	 * Derives a reference from each object in <code>objects</code>.
	 * The references are keyed by their own unique names, and <code>objects</code> is left untouched.
	 *
	 * @param derivation usually the reference type's <code>from</code> method
	 */
	public static <T extends ConfigObject<T>, R extends ConfigRef> ConfigRefMap<R> from(KeyedMap<? extends T> objects, Function<? super T, ? extends R> derivation) {
		ConfigRefMap<R> result = new ConfigRefMap<>();
		for (T object : objects) {
			result.add(derivation.apply(object));
		}
		return result;
	}

	public static <R extends ConfigRef> ConfigRefMap<R> copyOf(KeyedMap<? extends R> other) {
		ConfigRefMap<R> result = new ConfigRefMap<>();
		result.addAll(other);
		return result;
	}
}
