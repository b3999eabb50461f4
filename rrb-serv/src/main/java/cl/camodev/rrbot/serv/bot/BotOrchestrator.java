package cl.camodev.rrbot.serv.bot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.console.enumerable.EnumBotEvent;
import cl.camodev.rrbot.console.enumerable.EnumBotState;
import cl.camodev.rrbot.console.enumerable.EnumResultCode;
import cl.camodev.rrbot.console.enumerable.EnumTpMessageSeverity;
import cl.camodev.rrbot.device.ActionExecutor;
import cl.camodev.rrbot.device.DeviceBridge;
import cl.camodev.rrbot.ex.BridgeException;
import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ex.DeviceUnreachableException;
import cl.camodev.rrbot.ex.InvalidConfigException;
import cl.camodev.rrbot.ot.DTOBotStats;
import cl.camodev.rrbot.ot.DTOBotStatus;
import cl.camodev.rrbot.ot.DTOCommandResult;
import cl.camodev.rrbot.ot.DTODeviceRecord;
import cl.camodev.rrbot.ot.DTOGameState;
import cl.camodev.rrbot.serv.config.BotConfig;
import cl.camodev.rrbot.serv.impl.ServConfig;
import cl.camodev.rrbot.serv.impl.ServEvents;
import cl.camodev.rrbot.serv.impl.ServLogs;
import cl.camodev.rrbot.vision.PerceptionPipeline;

/**
 * Lifecycle and main loop of the bot.
 * <p>
 * Lifecycle commands run one at a time on a dedicated control thread. The capture, perceive,
 * decide, act cycle runs on its own loop thread and observes pause and stop only between cycles
 * and between actions. Commands issued from an incompatible state return a
 * {@link EnumResultCode#STATE_TRANSITION_REJECTED} failure.
 */
public class BotOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(BotOrchestrator.class);
	private static final String SOURCE = "BotOrchestrator";

	private final DeviceBridge deviceBridge;
	private final ActionExecutor actionExecutor;
	private final PerceptionPipeline perception;
	private final ServConfig servConfig;
	private final ServEvents events;
	private final ServLogs logs;
	private final DecisionEngine decisionEngine;

	private final BotRuntimeState runtime = new BotRuntimeState();
	private final RunGate runGate = new RunGate();
	private final AtomicBoolean restartPending = new AtomicBoolean();
	private final ExecutorService controlExecutor;
	private final ExecutorService loopExecutor;

	private volatile CountDownLatch stopSignal = new CountDownLatch(0);
	private volatile Future<?> loopFuture;

	public BotOrchestrator(DeviceBridge deviceBridge, ActionExecutor actionExecutor, PerceptionPipeline perception,
			ServConfig servConfig, ServEvents events, ServLogs logs) {
		this(deviceBridge, actionExecutor, perception, servConfig, events, logs, new DecisionEngine());
	}

	public BotOrchestrator(DeviceBridge deviceBridge, ActionExecutor actionExecutor, PerceptionPipeline perception,
			ServConfig servConfig, ServEvents events, ServLogs logs, DecisionEngine decisionEngine) {
		this.deviceBridge = deviceBridge;
		this.actionExecutor = actionExecutor;
		this.perception = perception;
		this.servConfig = servConfig;
		this.events = events;
		this.logs = logs;
		this.decisionEngine = decisionEngine;
		this.controlExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "bot-control"));
		this.loopExecutor = Executors.newSingleThreadExecutor(r -> daemon(r, "bot-loop"));
	}

	private static Thread daemon(Runnable runnable, String name) {
		Thread thread = new Thread(runnable, name);
		thread.setDaemon(true);
		return thread;
	}

	// ========================================================================
	// LIFECYCLE COMMANDS
	// ========================================================================

	/**
	 * Starts the bot on the given device, the configured preferred device, or the first connected one.
	 */
	public DTOCommandResult start(String deviceId) {
		return onControlThread(() -> doStart(deviceId));
	}

	public DTOCommandResult stop() {
		return onControlThread(this::doStop);
	}

	public DTOCommandResult pause() {
		return onControlThread(this::doPause);
	}

	public DTOCommandResult resume() {
		return onControlThread(this::doResume);
	}

	public DTOCommandResult togglePause() {
		return onControlThread(() -> runtime.getState() == EnumBotState.PAUSED ? doResume() : doPause());
	}

	/**
	 * Remembers the device as preferred, enables auto start and starts the bot.
	 */
	public DTOCommandResult quickStart(String deviceId) {
		Map<String, Object> delta = new LinkedHashMap<>();
		delta.put("autoStart", Boolean.TRUE);
		if (deviceId != null && !deviceId.isBlank()) {
			delta.put("preferredDevice", deviceId);
		}
		DTOCommandResult updated = updateConfig(delta);
		if (!updated.isSuccess()) {
			return updated;
		}
		return start(deviceId);
	}

	private DTOCommandResult onControlThread(Callable<DTOCommandResult> command) {
		try {
			return controlExecutor.submit(command).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, "Interrupted while waiting for the bot");
		} catch (ExecutionException e) {
			logger.error("Bot command failed", e.getCause());
			return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, String.valueOf(e.getCause().getMessage()));
		} catch (RejectedExecutionException e) {
			return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, "Bot is shut down");
		}
	}

	private DTOCommandResult doStart(String requestedDevice) {
		EnumBotState current = runtime.getState();
		if (current != EnumBotState.STOPPED && current != EnumBotState.ERROR) {
			return rejected("start", current);
		}
		if (current == EnumBotState.ERROR) {
			// below the error limit the previous loop is still cycling
			haltLoop();
		}
		changeState(EnumBotState.STARTING);
		BotConfig config = servConfig.getConfig();

		String deviceId;
		try {
			deviceId = resolveDevice(requestedDevice, config);
		} catch (DeviceUnreachableException e) {
			return failStart(EnumResultCode.DEVICE_UNREACHABLE, e.getMessage());
		} catch (BridgeTimeoutException e) {
			return failStart(EnumResultCode.BRIDGE_TIMEOUT, e.getMessage());
		} catch (BridgeUnavailableException e) {
			return failStart(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		}

		runtime.resetSession(deviceId);
		restartPending.set(false);
		events.publish(EnumBotEvent.DEVICE_CONNECTED, data("device_id", deviceId));

		if (config.isLaunchGameOnStart() && !actionExecutor.launchApp(deviceId, config.getGamePackage())) {
			logWarning(deviceId, "Could not launch " + config.getGamePackage() + ", continuing with current screen");
		}

		CountDownLatch signal = new CountDownLatch(1);
		stopSignal = signal;
		runGate.open();
		changeState(EnumBotState.RUNNING);
		loopFuture = loopExecutor.submit(() -> runLoop(signal));

		logInfo(deviceId, "Bot started");
		events.publish(EnumBotEvent.BOT_STARTED, data("device_id", deviceId));
		return DTOCommandResult.ok("Bot started on " + deviceId, deviceId);
	}

	private DTOCommandResult failStart(EnumResultCode code, String message) {
		runtime.setErrorMessage(message);
		changeState(EnumBotState.ERROR);
		logError(null, "Start failed: " + message);
		events.publish(EnumBotEvent.ERROR_OCCURRED, data("message", message, "error_count", runtime.getErrorCount()));
		return DTOCommandResult.failure(code, message);
	}

	private String resolveDevice(String requestedDevice, BotConfig config) {
		String candidate = requestedDevice;
		if (candidate == null || candidate.isBlank()) {
			candidate = config.getPreferredDevice().orElse(null);
		}
		if (candidate != null) {
			DTOCommandResult connected = deviceBridge.connect(candidate);
			if (!connected.isSuccess()) {
				throw new DeviceUnreachableException(connected.getMessage());
			}
			return candidate;
		}
		return deviceBridge.listDevices().stream()
				.filter(DTODeviceRecord::isConnected)
				.map(DTODeviceRecord::getId)
				.findFirst()
				.orElseThrow(() -> new DeviceUnreachableException("No connected device found"));
	}

	private DTOCommandResult doStop() {
		EnumBotState current = runtime.getState();
		if (current != EnumBotState.RUNNING && current != EnumBotState.PAUSED && current != EnumBotState.ERROR) {
			return rejected("stop", current);
		}
		changeState(EnumBotState.STOPPING);
		haltLoop();
		changeState(EnumBotState.STOPPED);
		logInfo(runtime.getConnectedDeviceId(), "Bot stopped");
		events.publish(EnumBotEvent.BOT_STOPPED, data("device_id", runtime.getConnectedDeviceId()));
		return DTOCommandResult.ok("Bot stopped");
	}

	private DTOCommandResult doPause() {
		if (!runtime.compareAndSetState(EnumBotState.RUNNING, EnumBotState.PAUSED)) {
			return rejected("pause", runtime.getState());
		}
		runGate.close();
		publishStatus();
		logInfo(runtime.getConnectedDeviceId(), "Bot paused");
		events.publish(EnumBotEvent.BOT_PAUSED, data("device_id", runtime.getConnectedDeviceId()));
		return DTOCommandResult.ok("Bot paused");
	}

	private DTOCommandResult doResume() {
		if (!runtime.compareAndSetState(EnumBotState.PAUSED, EnumBotState.RUNNING)) {
			return rejected("resume", runtime.getState());
		}
		runGate.open();
		publishStatus();
		logInfo(runtime.getConnectedDeviceId(), "Bot resumed");
		events.publish(EnumBotEvent.BOT_RESUMED, data("device_id", runtime.getConnectedDeviceId()));
		return DTOCommandResult.ok("Bot resumed");
	}

	private DTOCommandResult rejected(String command, EnumBotState current) {
		String message = "Cannot " + command + " while " + current.wireName();
		logger.info(message);
		return DTOCommandResult.failure(EnumResultCode.STATE_TRANSITION_REJECTED, message);
	}

	/**
	 * Signals the loop to stop and waits for it up to the grace period, then cancels it.
	 */
	private void haltLoop() {
		stopSignal.countDown();
		runGate.open();
		Future<?> future = loopFuture;
		loopFuture = null;
		if (future == null) {
			return;
		}
		int grace = servConfig.getConfig().getStopGraceSeconds();
		try {
			future.get(grace, TimeUnit.SECONDS);
		} catch (TimeoutException e) {
			logger.warn("Main loop did not finish within {} s, cancelling", grace);
			future.cancel(true);
		} catch (CancellationException e) {
			logger.debug("Main loop was already cancelled");
		} catch (ExecutionException e) {
			logger.error("Main loop ended with an error", e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
		}
	}

	// ========================================================================
	// MAIN LOOP
	// ========================================================================

	private void runLoop(CountDownLatch signal) {
		logger.debug("Main loop started");
		while (signal.getCount() > 0) {
			try {
				runGate.awaitOpen();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
			if (signal.getCount() == 0) {
				break;
			}

			BotConfig config = servConfig.getConfig();
			try {
				runCycle(config, signal);
				recoverIfNeeded();
			} catch (RuntimeException e) {
				if (handleLoopFailure(e, config)) {
					return;
				}
			}

			try {
				if (signal.await(config.getCycleInterval().toMillis(), TimeUnit.MILLISECONDS)) {
					break;
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
		}
		logger.debug("Main loop finished");
	}

	private void runCycle(BotConfig config, CountDownLatch signal) {
		String deviceId = runtime.getConnectedDeviceId();
		byte[] frame = actionExecutor.screenshot(deviceId)
				.orElseThrow(() -> new BridgeException("Screenshot capture failed on " + deviceId));

		DTOGameState state = perception.analyze(frame, config.getGridConfig(), config.getManaConfig());
		runtime.recordCycle();
		runtime.setLastMana(state.getMana());
		if (runtime.updateInGame(state.isInGame())) {
			logInfo(deviceId, "Game detected");
		}

		List<BotAction> actions = decisionEngine.decide(state, config);
		for (BotAction action : actions) {
			if (signal.getCount() == 0 || !runGate.isOpen()) {
				return;
			}
			execute(deviceId, action);
			try {
				if (signal.await(config.getActionDelay().toMillis(), TimeUnit.MILLISECONDS)) {
					return;
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
		}
	}

	private void execute(String deviceId, BotAction action) {
		boolean done;
		if (action.getKind() == BotAction.Kind.PLACE_UNIT) {
			done = actionExecutor.tap(deviceId, action.getFrom().getX(), action.getFrom().getY());
		} else {
			done = actionExecutor.swipe(deviceId, action.getFrom().getX(), action.getFrom().getY(),
					action.getTo().getX(), action.getTo().getY(), BotAction.MERGE_SWIPE_MS);
		}
		if (!done) {
			logWarning(deviceId, "Action failed: " + action);
			return;
		}
		runtime.recordAction(action.getDescription());
		if (action.getKind() == BotAction.Kind.PLACE_UNIT) {
			runtime.recordPlacement();
		} else {
			runtime.recordMerge();
		}
		logger.debug("Executed {}", action);
	}

	private void recoverIfNeeded() {
		if (runtime.getErrorCount() == 0) {
			return;
		}
		runtime.clearConsecutiveErrors();
		if (runtime.compareAndSetState(EnumBotState.ERROR, EnumBotState.RUNNING)) {
			runtime.setErrorMessage(null);
			publishStatus();
			logInfo(runtime.getConnectedDeviceId(), "Recovered after errors");
		}
	}

	/**
	 * @return true if the loop must exit
	 */
	private boolean handleLoopFailure(RuntimeException e, BotConfig config) {
		String deviceId = runtime.getConnectedDeviceId();
		String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
		int consecutive = runtime.recordFailure(message);
		logger.error("Cycle failed ({} consecutive)", consecutive, e);
		logs.appendLog(EnumTpMessageSeverity.ERROR, SOURCE, deviceOrDash(deviceId), "Cycle failed: " + message);

		if (runtime.compareAndSetState(EnumBotState.RUNNING, EnumBotState.ERROR)
				|| runtime.compareAndSetState(EnumBotState.PAUSED, EnumBotState.ERROR)) {
			publishStatus();
		}
		events.publish(EnumBotEvent.ERROR_OCCURRED, data("message", message, "error_count", consecutive));

		if (consecutive < config.getMaxErrors()) {
			return false;
		}
		if (config.isRestartOnError()) {
			if (restartPending.compareAndSet(false, true)) {
				logWarning(deviceId, consecutive + " consecutive errors, restarting");
				controlExecutor.execute(this::restartAfterFailures);
			}
		} else {
			logError(deviceId, consecutive + " consecutive errors, stopping");
			controlExecutor.execute(this::stopAfterFailures);
		}
		return true;
	}

	private void restartAfterFailures() {
		if (runtime.getState() != EnumBotState.ERROR) {
			logger.info("Restart skipped, bot is {}", runtime.getState().wireName());
			return;
		}
		String deviceId = runtime.getConnectedDeviceId();
		doStop();
		DTOCommandResult restarted = doStart(deviceId);
		if (!restarted.isSuccess()) {
			logError(deviceId, "Restart failed: " + restarted.getMessage());
		}
	}

	private void stopAfterFailures() {
		if (runtime.getState() != EnumBotState.ERROR) {
			return;
		}
		haltLoop();
		events.publish(EnumBotEvent.BOT_STOPPED,
				data("device_id", runtime.getConnectedDeviceId(), "reason", "max_errors"));
	}

	// ========================================================================
	// GAME AND MANUAL ACTIONS
	// ========================================================================

	public DTOCommandResult quitGame() {
		Optional<String> device = targetDevice();
		if (device.isEmpty()) {
			return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE, "No device connected");
		}
		if (!runtime.isInGame()) {
			return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, "Not in a game");
		}
		return manualAction(device.get(), "quit game", () -> actionExecutor.pressBack(device.get()), () -> {
			runtime.updateInGame(false);
			return DTOCommandResult.ok("Left the game");
		});
	}

	public DTOCommandResult tap(int x, int y) {
		Optional<String> device = targetDevice();
		if (device.isEmpty()) {
			return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE, "No device connected");
		}
		String description = "tap " + x + "," + y;
		return manualAction(device.get(), description, () -> actionExecutor.tap(device.get(), x, y),
				() -> DTOCommandResult.ok("Tapped " + x + "," + y));
	}

	public DTOCommandResult swipe(int x1, int y1, int x2, int y2, int durationMs) {
		Optional<String> device = targetDevice();
		if (device.isEmpty()) {
			return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE, "No device connected");
		}
		String description = "swipe " + x1 + "," + y1 + " -> " + x2 + "," + y2;
		return manualAction(device.get(), description,
				() -> actionExecutor.swipe(device.get(), x1, y1, x2, y2, durationMs),
				() -> DTOCommandResult.ok("Swiped " + x1 + "," + y1 + " -> " + x2 + "," + y2));
	}

	/**
	 * Captures the current screen. On success the result data is the image bytes.
	 */
	public DTOCommandResult screenshot() {
		Optional<String> device = targetDevice();
		if (device.isEmpty()) {
			return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE, "No device connected");
		}
		try {
			return actionExecutor.screenshot(device.get())
					.map(bytes -> DTOCommandResult.ok("Screenshot captured", bytes))
					.orElseGet(() -> DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, "Screenshot failed"));
		} catch (BridgeUnavailableException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		}
	}

	private DTOCommandResult manualAction(String deviceId, String description, Callable<Boolean> action,
			Callable<DTOCommandResult> onSuccess) {
		try {
			if (!action.call()) {
				return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, "Failed to " + description);
			}
			runtime.recordAction(description);
			return onSuccess.call();
		} catch (BridgeUnavailableException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		} catch (Exception e) {
			logger.error("Manual action {} failed on {}", description, deviceId, e);
			return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, String.valueOf(e.getMessage()));
		}
	}

	private Optional<String> targetDevice() {
		String connected = runtime.getConnectedDeviceId();
		if (connected != null) {
			return Optional.of(connected);
		}
		Optional<String> preferred = servConfig.getConfig().getPreferredDevice();
		if (preferred.isPresent()) {
			return preferred;
		}
		return deviceBridge.getDevices().stream()
				.filter(DTODeviceRecord::isConnected)
				.map(DTODeviceRecord::getId)
				.findFirst();
	}

	// ========================================================================
	// STATUS AND CONFIGURATION
	// ========================================================================

	public DTOBotStatus getStatus() {
		return runtime.snapshot();
	}

	public DTOBotStats getStats() {
		return runtime.stats();
	}

	public DTOCommandResult updateConfig(Map<String, ?> delta) {
		try {
			BotConfig updated = servConfig.update(delta);
			return DTOCommandResult.ok("Configuration updated", updated.toMap());
		} catch (InvalidConfigException e) {
			logWarning(runtime.getConnectedDeviceId(), "Configuration rejected: " + e.getMessage());
			return DTOCommandResult.failure(EnumResultCode.INVALID_CONFIG, e.getMessage());
		}
	}

	/**
	 * Stops the bot if needed and releases both worker threads.
	 */
	public void shutdown() {
		EnumBotState state = runtime.getState();
		if (state.isActive() || state == EnumBotState.ERROR) {
			stop();
		}
		controlExecutor.shutdown();
		loopExecutor.shutdownNow();
		try {
			if (!controlExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				controlExecutor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			controlExecutor.shutdownNow();
		}
	}

	// ========================================================================
	// EVENTS AND LOGGING
	// ========================================================================

	private void changeState(EnumBotState next) {
		runtime.setState(next);
		publishStatus();
	}

	private void publishStatus() {
		EnumBotState state = runtime.getState();
		logger.debug("Bot state is now {}", state);
		events.publish(EnumBotEvent.STATUS_CHANGED,
				data("state", state.wireName(), "error_count", runtime.getErrorCount()));
	}

	private static @NotNull Map<String, Object> data(Object... keyValues) {
		Map<String, Object> data = new LinkedHashMap<>();
		for (int i = 0; i + 1 < keyValues.length; i += 2) {
			data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
		}
		return data;
	}

	private static String deviceOrDash(String deviceId) {
		return deviceId == null ? "-" : deviceId;
	}

	private void logInfo(String deviceId, String message) {
		logger.info("[{}] {}", deviceOrDash(deviceId), message);
		logs.appendLog(EnumTpMessageSeverity.INFO, SOURCE, deviceOrDash(deviceId), message);
	}

	private void logWarning(String deviceId, String message) {
		logger.warn("[{}] {}", deviceOrDash(deviceId), message);
		logs.appendLog(EnumTpMessageSeverity.WARNING, SOURCE, deviceOrDash(deviceId), message);
	}

	private void logError(String deviceId, String message) {
		logger.error("[{}] {}", deviceOrDash(deviceId), message);
		logs.appendLog(EnumTpMessageSeverity.ERROR, SOURCE, deviceOrDash(deviceId), message);
	}
}
