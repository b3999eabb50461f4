package cl.camodev.rrbot.ex;

/**
 * Raised while loading a rank model that is missing or unreadable.
 */
public class ClassifierUnavailableException extends Exception {

	private static final long serialVersionUID = 1L;

	public ClassifierUnavailableException(String message) {
		super(message);
	}

	public ClassifierUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
