package io.vena.opsview.client;

import io.vena.opsview.exceptions.HttpTransportException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 */
public final class JdkHttpTransport implements OpsviewTransport {
	private final HttpClient http;

	public JdkHttpTransport(HttpClient http) {
		this.http = Objects.requireNonNull(http, "http");
	}

	/**
	 * @param ignoreCert accept any server certificate. Only for test servers with self-signed certificates.
	 */
	public static JdkHttpTransport create(boolean ignoreCert, Duration connectTimeout) {
		HttpClient.Builder builder = HttpClient.newBuilder().connectTimeout(connectTimeout);
		if (ignoreCert) {
			LOGGER.warn("Server certificates will not be verified");
			builder.sslContext(trustAllContext());
		}
		return new JdkHttpTransport(builder.build());
	}

	@Override
	public TransportResponse send(TransportRequest request) throws HttpTransportException {
		try {
			HttpResponse<String> resp = http.send(buildRequest(request), HttpResponse.BodyHandlers.ofString());
			return new TransportResponse(resp.statusCode(), resp.body());
		} catch (IOException e) {
			throw new HttpTransportException(request.method() + " " + request.url() + " failed", e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new HttpTransportException(request.method() + " " + request.url() + " interrupted", e);
		}
	}

	private static HttpRequest buildRequest(TransportRequest request) {
		HttpRequest.BodyPublisher body = request.body() == null
			? HttpRequest.BodyPublishers.noBody()
			: HttpRequest.BodyPublishers.ofByteArray(request.body());

		HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
			.method(request.method(), body);

		if (request.timeout() != null) {
			builder.timeout(request.timeout());
		}

		for (Map.Entry<String, String> entry : request.headers().entrySet()) {
			builder.header(entry.getKey(), entry.getValue());
		}

		return builder.build();
	}

	private static SSLContext trustAllContext() {
		TrustManager trustAll = new X509TrustManager() {
			@Override
			public void checkClientTrusted(X509Certificate[] chain, String authType) { }

			@Override
			public void checkServerTrusted(X509Certificate[] chain, String authType) { }

			@Override
			public X509Certificate[] getAcceptedIssuers() {
				return new X509Certificate[0];
			}
		};
		try {
			SSLContext context = SSLContext.getInstance("TLS");
			context.init(null, new TrustManager[] { trustAll }, new SecureRandom());
			return context;
		} catch (GeneralSecurityException e) {
			throw new IllegalStateException("Unable to set up permissive TLS", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpTransport.class);
}
