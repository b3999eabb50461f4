package cl.camodev.rrbot.ex;

/**
 * Base type for failures of the device bridge itself, as opposed to a device side command failing.
 */
public class BridgeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public BridgeException(String message) {
		super(message);
	}

	public BridgeException(String message, Throwable cause) {
		super(message, cause);
	}
}
