package cl.camodev.rrbot.console.enumerable;

public enum EnumResultCode {
	OK,
	STATE_TRANSITION_REJECTED,
	DEVICE_UNREACHABLE,
	BRIDGE_UNAVAILABLE,
	BRIDGE_TIMEOUT,
	INVALID_CONFIG,
	INVALID_COMMAND,
	ACTION_FAILED
}
