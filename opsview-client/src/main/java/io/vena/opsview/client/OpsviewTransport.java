package io.vena.opsview.client;

import io.vena.opsview.exceptions.HttpTransportException;

/**
 * Sends one HTTP request and returns whatever came back, whatever the status.
 * Status interpretation is left to {@link OpsviewClient}.
 */
public interface OpsviewTransport {
	/**
	 * @throws HttpTransportException if no response was received, including on timeout or interruption
	 */
	TransportResponse send(TransportRequest request) throws HttpTransportException;
}
