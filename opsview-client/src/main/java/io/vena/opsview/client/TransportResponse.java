package io.vena.opsview.client;

public record TransportResponse(int status, String body) {
	public TransportResponse {
		if (body == null) {
			body = "";
		}
	}
}
