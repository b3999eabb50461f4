package cl.camodev.rrbot.console.enumerable;

public enum EnumDeviceStatus {
	DISCONNECTED, CONNECTING, CONNECTED, UNAUTHORIZED, ERROR;

	/**
	 * Maps the status token printed by {@code adb devices} to a device status.
	 */
	public static EnumDeviceStatus fromBridgeToken(String token) {
		if (token == null) {
			return ERROR;
		}
		switch (token.trim().toLowerCase()) {
			case "device":
				return CONNECTED;
			case "offline":
				return DISCONNECTED;
			case "unauthorized":
				return UNAUTHORIZED;
			default:
				return ERROR;
		}
	}
}
