package cl.camodev.rrbot.device;

import java.time.Duration;
import java.util.List;

import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ot.DTOBridgeResult;

/**
 * Runner installed when no adb executable was found. Every call fails with {@link BridgeUnavailableException},
 * which leaves the rest of the process usable.
 */
public class UnavailableBridgeRunner implements BridgeCommandRunner {

	private final String reason;

	public UnavailableBridgeRunner(String reason) {
		this.reason = reason;
	}

	@Override
	public DTOBridgeResult run(List<String> args, String deviceId, Duration timeout) {
		throw new BridgeUnavailableException(reason);
	}

	@Override
	public boolean isAvailable() {
		return false;
	}
}
