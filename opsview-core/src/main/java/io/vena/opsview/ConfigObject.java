package io.vena.opsview;

/**
 * A configuration entity: either one with its own collection on the server,
 * or one that only ever appears embedded inside another entity.
 *
 * @param <T> the implementing type itself
 */
public interface ConfigObject<T extends ConfigObject<T>> extends UniquelyNamed {
	ConfigType<T> configType();
}
