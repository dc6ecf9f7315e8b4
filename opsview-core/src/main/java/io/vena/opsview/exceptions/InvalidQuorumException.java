package io.vena.opsview.exceptions;

public class InvalidQuorumException extends InvalidConfigException {
	public InvalidQuorumException(String message) { super(message); }
}
