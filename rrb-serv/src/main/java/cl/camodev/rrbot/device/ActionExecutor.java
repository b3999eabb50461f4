package cl.camodev.rrbot.device;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.ex.BridgeException;
import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ot.DTOBridgeResult;

/**
 * Performs input and capture actions on one device through {@link DeviceBridge}.
 * <p>
 * A failed command (non-zero exit, timeout) is logged and reported as {@code false} or an empty
 * capture so that a single bad tap never ends the control loop. Only a missing adb executable
 * propagates, as {@link BridgeUnavailableException}.
 */
public class ActionExecutor {
	private static final Logger logger = LoggerFactory.getLogger(ActionExecutor.class);

	public static final long SCREENSHOT_CACHE_TTL_MS = 1000;
	public static final int KEYCODE_BACK = 4;

	private final DeviceBridge deviceBridge;
	private final long screenshotTtlMs;

	private final ConcurrentHashMap<String, CachedFrame> screenshotCache = new ConcurrentHashMap<>();

	public ActionExecutor(DeviceBridge deviceBridge) {
		this(deviceBridge, SCREENSHOT_CACHE_TTL_MS);
	}

	public ActionExecutor(DeviceBridge deviceBridge, long screenshotTtlMs) {
		this.deviceBridge = deviceBridge;
		this.screenshotTtlMs = screenshotTtlMs;
	}

	/**
	 * Captures the screen as PNG bytes. A frame younger than the cache TTL is reused.
	 *
	 * @return the encoded frame, or empty if the capture failed
	 */
	public Optional<byte[]> screenshot(String deviceId) {
		long now = System.currentTimeMillis();
		CachedFrame cached = screenshotCache.get(deviceId);
		if (cached != null && now - cached.capturedAt < screenshotTtlMs) {
			logger.trace("Reusing cached frame for {}", deviceId);
			return Optional.of(cached.data);
		}

		long start = System.currentTimeMillis();
		Optional<DTOBridgeResult> result = execute(deviceId, List.of("exec-out", "screencap", "-p"), "screenshot");
		if (result.isEmpty()) {
			return Optional.empty();
		}
		byte[] data = result.get().getStdout();
		if (data.length == 0) {
			logger.warn("Empty screen capture from {}", deviceId);
			return Optional.empty();
		}
		screenshotCache.put(deviceId, new CachedFrame(data, System.currentTimeMillis()));
		logger.debug("Screenshot from {} captured in {} ms, {} bytes", deviceId, System.currentTimeMillis() - start,
				data.length);
		return Optional.of(data);
	}

	public void invalidateScreenshot(String deviceId) {
		screenshotCache.remove(deviceId);
	}

	public boolean tap(String deviceId, int x, int y) {
		logger.debug("Tapping at ({},{}) on device {}", x, y, deviceId);
		boolean done = shell(deviceId, "tap", "input", "tap", String.valueOf(x), String.valueOf(y));
		if (done) {
			invalidateScreenshot(deviceId);
		}
		return done;
	}

	public boolean swipe(String deviceId, int x1, int y1, int x2, int y2, int durationMs) {
		logger.debug("Swipe from ({},{}) to ({},{}) in {} ms on device {}", x1, y1, x2, y2, durationMs, deviceId);
		boolean done = shell(deviceId, "swipe", "input", "swipe", String.valueOf(x1), String.valueOf(y1),
				String.valueOf(x2), String.valueOf(y2), String.valueOf(Math.max(0, durationMs)));
		if (done) {
			invalidateScreenshot(deviceId);
		}
		return done;
	}

	public boolean sendText(String deviceId, String text) {
		String escaped = escapeTextForShell(text);
		if (escaped.isEmpty()) {
			logger.debug("Nothing to type on device {}", deviceId);
			return true;
		}
		return shell(deviceId, "sendText", "input", "text", escaped);
	}

	public boolean sendKeyEvent(String deviceId, int keyCode) {
		return shell(deviceId, "sendKeyEvent", "input", "keyevent", String.valueOf(keyCode));
	}

	public boolean pressBack(String deviceId) {
		return sendKeyEvent(deviceId, KEYCODE_BACK);
	}

	/**
	 * Brings the game to the foreground through the launcher intent.
	 */
	public boolean launchApp(String deviceId, String packageName) {
		logger.info("Launching {} on device {}", packageName, deviceId);
		return shell(deviceId, "launchApp", "monkey", "-p", packageName, "-c", "android.intent.category.LAUNCHER",
				"1");
	}

	private boolean shell(String deviceId, String actionName, String... command) {
		List<String> args = new ArrayList<>(command.length + 1);
		args.add("shell");
		args.addAll(List.of(command));
		return execute(deviceId, args, actionName).isPresent();
	}

	private Optional<DTOBridgeResult> execute(String deviceId, List<String> args, String actionName) {
		try {
			DTOBridgeResult result = deviceBridge.runCommand(args, deviceId);
			if (!result.isSuccess()) {
				logger.warn("{} failed on device {} (exit {}): {}", actionName, deviceId, result.getExitCode(),
						result.errorText());
				return Optional.empty();
			}
			return Optional.of(result);
		} catch (BridgeUnavailableException e) {
			throw e;
		} catch (BridgeTimeoutException e) {
			logger.warn("{} timed out on device {}", actionName, deviceId);
			return Optional.empty();
		} catch (BridgeException e) {
			logger.warn("{} failed on device {}: {}", actionName, deviceId, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Escapes text for {@code input text}. Whitespace becomes {@code %s}, shell metacharacters are
	 * backslash escaped and other control characters are dropped.
	 */
	static String escapeTextForShell(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		StringBuilder escaped = new StringBuilder(text.length() * 2);
		for (char c : text.toCharArray()) {
			if (c == ' ' || c == '\t') {
				escaped.append("%s");
			} else if (Character.isISOControl(c)) {
				continue;
			} else if ("\\\"'$`&|;<>()%*?~#!{}[]".indexOf(c) >= 0) {
				escaped.append('\\').append(c);
			} else {
				escaped.append(c);
			}
		}
		return escaped.toString();
	}

	private static final class CachedFrame {
		private final byte[] data;
		private final long capturedAt;

		private CachedFrame(byte[] data, long capturedAt) {
			this.data = data;
			this.capturedAt = capturedAt;
		}
	}
}
