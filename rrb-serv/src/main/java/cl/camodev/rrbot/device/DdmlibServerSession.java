package cl.camodev.rrbot.device;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.android.ddmlib.AndroidDebugBridge;

/**
 * Keeps the adb server running through ddmlib's {@link AndroidDebugBridge}.
 */
public class DdmlibServerSession implements ServerSession {
	private static final Logger logger = LoggerFactory.getLogger(DdmlibServerSession.class);
	private static final int INIT_LOOPS = 10;
	private static final int INIT_DELAY_MS = 500;

	private static volatile boolean ddmlibInitialized = false;

	private final Path adbPath;
	private AndroidDebugBridge bridge;

	public DdmlibServerSession(Path adbPath) {
		this.adbPath = adbPath;
	}

	private static synchronized void initDdmlib() {
		if (!ddmlibInitialized) {
			AndroidDebugBridge.init(false);
			ddmlibInitialized = true;
		}
	}

	@Override
	public synchronized void start() {
		if (bridge != null && bridge.isConnected()) {
			return;
		}
		initDdmlib();
		logger.info("Initializing ADB bridge with path: {}", adbPath);
		bridge = AndroidDebugBridge.createBridge(adbPath.toString(), false);
		waitForBridge();
	}

	@Override
	public synchronized void restart() {
		initDdmlib();
		logger.info("Restarting ADB bridge with path: {}", adbPath);
		AndroidDebugBridge.disconnectBridge();
		bridge = AndroidDebugBridge.createBridge(adbPath.toString(), true);
		waitForBridge();
		logger.info("ADB restarted, connected: {}", isConnected());
	}

	private void waitForBridge() {
		int loops = 0;
		while ((bridge == null || !bridge.hasInitialDeviceList()) && loops < INIT_LOOPS) {
			try {
				Thread.sleep(INIT_DELAY_MS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while waiting for the ADB bridge");
				return;
			}
			loops++;
		}
		if (bridge == null || !bridge.hasInitialDeviceList()) {
			logger.warn("ADB bridge did not report its device list after {} ms", INIT_LOOPS * INIT_DELAY_MS);
		}
	}

	@Override
	public synchronized void shutdown() {
		if (!ddmlibInitialized) {
			return;
		}
		AndroidDebugBridge.disconnectBridge();
		AndroidDebugBridge.terminate();
		bridge = null;
		synchronized (DdmlibServerSession.class) {
			ddmlibInitialized = false;
		}
		logger.info("ADB bridge terminated");
	}

	@Override
	public synchronized boolean isConnected() {
		return bridge != null && bridge.isConnected();
	}
}
