package cl.camodev.rrbot.device;

import java.time.Duration;
import java.util.List;

import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ot.DTOBridgeResult;

/**
 * Executes one adb invocation. Implementations must never block longer than the given timeout.
 */
public interface BridgeCommandRunner {

	/**
	 * @param args     adb arguments, without the executable and without {@code -s}
	 * @param deviceId target serial, or null for host level commands
	 * @param timeout  hard deadline for the whole invocation
	 * @throws BridgeUnavailableException if adb cannot be started
	 * @throws BridgeTimeoutException     if the deadline expires; the process is killed
	 */
	DTOBridgeResult run(List<String> args, String deviceId, Duration timeout);

	boolean isAvailable();

	/**
	 * Releases worker threads. Further calls to {@link #run} are not allowed.
	 */
	default void shutdown() {
	}
}
