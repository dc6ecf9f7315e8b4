package io.vena.opsview;

import io.vena.opsview.exceptions.InvalidConfigException;
import io.vena.opsview.exceptions.RequiredFieldEmptyException;

/**
 * Accumulates field values for a {@link ConfigObject}. Nothing is checked until {@link #build()}.
 *
 * <p>
 * Concrete builders narrow the return type of each setter to themselves.
 */
public interface ConfigBuilder<T extends ConfigObject<T>> {
	ConfigBuilder<T> name(String name);

	/**
	 * Checks every required field, then every field validator, in field order,
	 * and reports the first violation.
	 * The resulting object has all server-assigned fields unset.
	 *
	 * @throws RequiredFieldEmptyException if a mandatory field was never set
	 * @throws InvalidConfigException if any field fails validation
	 */
	T build() throws InvalidConfigException;
}
