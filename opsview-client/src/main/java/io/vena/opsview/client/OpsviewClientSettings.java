package io.vena.opsview.client;

import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Builder
@Accessors(fluent = true)
public class OpsviewClientSettings {
	/**
	 * The server's address. If there's no scheme, <code>https://</code> is assumed.
	 */
	@NonNull String url;
	@NonNull String username;
	@ToString.Exclude
	@NonNull String password;

	/**
	 * Accept any server certificate.
	 */
	@Default boolean ignoreCert = false;
	@Default long requestTimeoutMS = 30_000;

	public static final String URL_VARIABLE = "OV_URL";
	public static final String USERNAME_VARIABLE = "OV_USERNAME";
	public static final String PASSWORD_VARIABLE = "OV_PASSWORD";
	public static final String IGNORE_CERT_VARIABLE = "OV_IGNORE_CERT";

	public static OpsviewClientSettings fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	static OpsviewClientSettings fromEnvironment(Map<String, String> env) {
		OpsviewClientSettings result = OpsviewClientSettings.builder()
			.url(requiredVariable(env, URL_VARIABLE))
			.username(requiredVariable(env, USERNAME_VARIABLE))
			.password(requiredVariable(env, PASSWORD_VARIABLE))
			.ignoreCert(Boolean.parseBoolean(env.getOrDefault(IGNORE_CERT_VARIABLE, "false").toLowerCase(Locale.ROOT)))
			.build();
		result.validate();
		return result;
	}

	/**
	 * @return the url with a scheme and without a trailing slash
	 */
	public String baseUrl() {
		String result = url.contains("://") ? url : "https://" + url;
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	public void validate() {
		if (url.isBlank()) {
			throw new IllegalArgumentException("url must not be blank");
		}
		if (username.isBlank()) {
			throw new IllegalArgumentException("username must not be blank");
		}
		if (requestTimeoutMS <= 0) {
			throw new IllegalArgumentException("requestTimeoutMS must be positive: " + requestTimeoutMS);
		}
	}

	private static String requiredVariable(Map<String, String> env, String name) {
		String value = env.get(name);
		if (value == null) {
			throw new IllegalArgumentException("Environment variable " + name + " is not set");
		}
		return value;
	}
}
