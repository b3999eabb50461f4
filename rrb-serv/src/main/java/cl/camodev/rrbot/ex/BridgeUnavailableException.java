package cl.camodev.rrbot.ex;

/**
 * The adb executable could not be located or started.
 */
public class BridgeUnavailableException extends BridgeException {

	private static final long serialVersionUID = 1L;

	public BridgeUnavailableException(String message) {
		super(message);
	}

	public BridgeUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
