package cl.camodev.rrbot.console.enumerable;

import java.util.regex.Pattern;

public enum EnumConnectionKind {
	USB, NETWORK, EMULATOR;

	private static final Pattern IPV4_ADDRESS = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}:\\d+$");

	/**
	 * Infers how a device is attached from the shape of its serial.
	 * {@code 192.168.0.5:5555} is a network device, {@code emulator-5554} an emulator, anything else USB.
	 */
	public static EnumConnectionKind fromDeviceId(String deviceId) {
		if (deviceId == null) {
			return USB;
		}
		if (deviceId.contains(":") && IPV4_ADDRESS.matcher(deviceId).matches()) {
			return NETWORK;
		}
		if (deviceId.contains("emulator")) {
			return EMULATOR;
		}
		return USB;
	}
}
