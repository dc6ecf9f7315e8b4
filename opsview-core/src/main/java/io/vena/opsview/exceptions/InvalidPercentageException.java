package io.vena.opsview.exceptions;

/**
 * A quorum percentage that is malformed or matches no whole fraction of the members.
 */
public class InvalidPercentageException extends InvalidQuorumException {
	public InvalidPercentageException(String value, String reason) {
		super("Invalid percentage '" + value + "': " + reason);
	}
}
