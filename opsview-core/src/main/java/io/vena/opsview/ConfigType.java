package io.vena.opsview;

import io.vena.opsview.exceptions.InvalidConfigException;
import io.vena.opsview.exceptions.NoConfigPathException;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Everything about a {@link ConfigObject} type that doesn't depend on an instance:
 * its class, its resource path, and how to build one.
 *
 * <p>
 * Each entity class exposes one of these as a constant.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class ConfigType<T extends ConfigObject<T>> {
	private final @NonNull Class<T> objectClass;
	private final String configPath;
	@EqualsAndHashCode.Exclude
	private final @NonNull Supplier<? extends ConfigBuilder<T>> builderFactory;
	@EqualsAndHashCode.Exclude
	private final MinimalFactory<T> minimalFactory;

	@FunctionalInterface
	public interface MinimalFactory<T> {
		T minimal(String name) throws InvalidConfigException;
	}

	/**
	 * @param configPath the REST sub-path of this type's collection, like <code>/config/hostgroup</code>
	 */
	public static <T extends ConfigObject<T>> ConfigType<T> of(Class<T> objectClass, String configPath, Supplier<? extends ConfigBuilder<T>> builderFactory) {
		if (!configPath.startsWith("/")) {
			throw new IllegalArgumentException("Config path must start with a slash: \"" + configPath + "\"");
		}
		return new ConfigType<>(objectClass, configPath, builderFactory, null);
	}

	/**
	 * For types that only exist inside other objects.
	 */
	public static <T extends ConfigObject<T>> ConfigType<T> embedded(Class<T> objectClass, Supplier<? extends ConfigBuilder<T>> builderFactory) {
		return new ConfigType<>(objectClass, null, builderFactory, null);
	}

	/**
	 * For types whose builder demands more than a name, so that {@link #minimal} can't go through it.
	 */
	public ConfigType<T> withMinimalFactory(MinimalFactory<T> minimalFactory) {
		return new ConfigType<>(objectClass, configPath, builderFactory, minimalFactory);
	}

	public Class<T> objectClass() {
		return objectClass;
	}

	public Optional<String> configPath() {
		return Optional.ofNullable(configPath);
	}

	public String requireConfigPath() throws NoConfigPathException {
		if (configPath == null) {
			throw new NoConfigPathException(objectClass.getSimpleName() + " has no config path; it exists only embedded in other objects");
		}
		return configPath;
	}

	public ConfigBuilder<T> builder() {
		return builderFactory.get();
	}

	/**
	 * The smallest valid object with the given name; everything else takes its default.
	 */
	public T minimal(String name) throws InvalidConfigException {
		if (minimalFactory != null) {
			return minimalFactory.minimal(name);
		}
		return builder().name(name).build();
	}

	@Override
	public String toString() {
		return objectClass.getSimpleName();
	}
}
