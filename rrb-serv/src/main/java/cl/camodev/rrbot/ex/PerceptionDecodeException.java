package cl.camodev.rrbot.ex;

public class PerceptionDecodeException extends Exception {

	private static final long serialVersionUID = 1L;

	public PerceptionDecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
