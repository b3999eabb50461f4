package cl.camodev.rrbot.ex;

import java.time.Duration;
import java.util.List;

public class BridgeTimeoutException extends BridgeException {

	private static final long serialVersionUID = 1L;

	private final transient List<String> command;
	private final Duration timeout;

	public BridgeTimeoutException(List<String> command, Duration timeout) {
		super("Bridge command " + command + " exceeded " + timeout.toMillis() + " ms");
		this.command = List.copyOf(command);
		this.timeout = timeout;
	}

	public List<String> getCommand() {
		return command;
	}

	public Duration getTimeout() {
		return timeout;
	}
}
