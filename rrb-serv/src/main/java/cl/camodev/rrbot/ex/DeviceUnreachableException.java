package cl.camodev.rrbot.ex;

public class DeviceUnreachableException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public DeviceUnreachableException(String message) {
		super(message);
	}
}
