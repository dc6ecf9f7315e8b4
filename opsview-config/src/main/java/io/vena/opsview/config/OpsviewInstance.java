package io.vena.opsview.config;

import io.vena.opsview.ConfigClient;
import io.vena.opsview.ConfigObject;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.ConfigType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A local snapshot of every supported collection on one server.
 *
 * <p>
 * {@link #refresh} fetches all collections at once, each on its own task.
 * The fetches share nothing but the client, so they need no coordination.
 * The snapshot is replaced only if every fetch succeeds.
 */
@Getter
@Accessors(fluent = true)
public class OpsviewInstance {
	private volatile ConfigObjectMap<Hashtag> hashtags = new ConfigObjectMap<>();
	private volatile ConfigObjectMap<HostGroup> hostGroups = new ConfigObjectMap<>();
	private volatile ConfigObjectMap<Host> hosts = new ConfigObjectMap<>();
	private volatile ConfigObjectMap<BSMComponent> bsmComponents = new ConfigObjectMap<>();

	public void refresh(ConfigClient client, Executor executor) throws IOException {
		LOGGER.info("Refreshing all collections");
		CompletableFuture<ConfigObjectMap<Hashtag>> hashtagsFuture = fetchAsync(client, Hashtag.TYPE, executor);
		CompletableFuture<ConfigObjectMap<HostGroup>> hostGroupsFuture = fetchAsync(client, HostGroup.TYPE, executor);
		CompletableFuture<ConfigObjectMap<Host>> hostsFuture = fetchAsync(client, Host.TYPE, executor);
		CompletableFuture<ConfigObjectMap<BSMComponent>> bsmComponentsFuture = fetchAsync(client, BSMComponent.TYPE, executor);

		ConfigObjectMap<Hashtag> newHashtags = await(hashtagsFuture);
		ConfigObjectMap<HostGroup> newHostGroups = await(hostGroupsFuture);
		ConfigObjectMap<Host> newHosts = await(hostsFuture);
		ConfigObjectMap<BSMComponent> newBsmComponents = await(bsmComponentsFuture);

		hashtags = newHashtags;
		hostGroups = newHostGroups;
		hosts = newHosts;
		bsmComponents = newBsmComponents;
		LOGGER.info("Refreshed {} hashtags, {} host groups, {} hosts, {} BSM components",
			newHashtags.size(), newHostGroups.size(), newHosts.size(), newBsmComponents.size());
	}

	private static <T extends ConfigObject<T>> CompletableFuture<ConfigObjectMap<T>> fetchAsync(ConfigClient client, ConfigType<T> type, Executor executor) {
		return CompletableFuture.supplyAsync(() -> {
			try {
				return client.fetchAll(type);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}, executor);
	}

	private static <V> V await(CompletableFuture<V> future) throws IOException {
		try {
			return future.join();
		} catch (CompletionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof UncheckedIOException u) {
				throw u.getCause();
			} else if (cause instanceof RuntimeException r) {
				throw r;
			} else {
				throw e;
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OpsviewInstance.class);
}
