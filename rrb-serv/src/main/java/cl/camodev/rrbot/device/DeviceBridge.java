package cl.camodev.rrbot.device;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.console.enumerable.EnumConnectionKind;
import cl.camodev.rrbot.console.enumerable.EnumDeviceStatus;
import cl.camodev.rrbot.console.enumerable.EnumResultCode;
import cl.camodev.rrbot.ex.BridgeException;
import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ot.DTOBridgeResult;
import cl.camodev.rrbot.ot.DTOCommandResult;
import cl.camodev.rrbot.ot.DTODeviceRecord;
import cl.camodev.rrbot.serv.config.BotConfig;
import cl.camodev.rrbot.serv.impl.ServConfig;
import cl.camodev.utiles.number.NumberConverters;

/**
 * Entry point for everything that talks to adb.
 * <p>
 * Owns the device registry: one {@link DTODeviceRecord} per serial, replaced on every enumeration and
 * pruned when a serial disappears. Other components only ever receive snapshots. Every command goes
 * through {@link #runCommand}, which enforces the per-command deadline.
 */
public class DeviceBridge {
	private static final Logger logger = LoggerFactory.getLogger(DeviceBridge.class);

	private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);
	private static final Duration PROPERTY_TIMEOUT = Duration.ofSeconds(5);

	private static final Pattern BRACKET_PROPERTY = Pattern.compile("^\\[(.+?)\\]:\\s*\\[(.*)\\]$");
	private static final Pattern PLAIN_PROPERTY = Pattern.compile("^([^:\\[\\]]+):\\s*(.*)$");
	private static final Pattern BATTERY_LEVEL = Pattern.compile("level:\\s*(\\d+)");
	private static final Pattern MEM_TOTAL = Pattern.compile("MemTotal:\\s*(\\d+)\\s*kB");
	private static final Pattern MEM_AVAILABLE = Pattern.compile("MemAvailable:\\s*(\\d+)\\s*kB");
	private static final Pattern WM_SIZE = Pattern.compile("(?:Override|Physical) size:\\s*(\\d+x\\d+)");
	private static final Pattern WM_DENSITY = Pattern.compile("(?:Override|Physical) density:\\s*(\\d+)");

	private final BridgeCommandRunner runner;
	private final ServerSession session;
	private final ServConfig servConfig;

	private final Map<String, DTODeviceRecord> registry = new ConcurrentHashMap<>();
	private final ReentrantLock scanLock = new ReentrantLock();

	public DeviceBridge(BridgeCommandRunner runner, ServerSession session, ServConfig servConfig) {
		this.runner = runner;
		this.session = session;
		this.servConfig = servConfig;
	}

	public boolean isAvailable() {
		return runner.isAvailable();
	}

	/**
	 * Starts the host side server session. Failures are logged; device features stay unavailable.
	 */
	public void initialize() {
		if (!runner.isAvailable()) {
			logger.warn("ADB is not available, device features are disabled");
			return;
		}
		try {
			session.start();
		} catch (RuntimeException e) {
			logger.error("Could not start the ADB server session", e);
		}
	}

	public void shutdown() {
		try {
			session.shutdown();
		} finally {
			runner.shutdown();
		}
	}

	/**
	 * Single choke point for adb invocations.
	 *
	 * @throws BridgeUnavailableException if adb cannot be located or started
	 * @throws BridgeTimeoutException     if the command outlives {@code timeout}
	 */
	public DTOBridgeResult runCommand(List<String> args, String deviceId, Duration timeout) {
		logger.trace("adb {}{}", deviceId == null ? "" : "-s " + deviceId + " ", args);
		return runner.run(args, deviceId, timeout);
	}

	public DTOBridgeResult runCommand(List<String> args, String deviceId) {
		return runCommand(args, deviceId, servConfig.getConfig().getBridgeTimeout());
	}

	// ========================================================================
	// ENUMERATION
	// ========================================================================

	/**
	 * Enumerates devices, enriches connected ones with device properties and prunes serials that are gone.
	 *
	 * @return snapshot of the registry after the scan, sorted by serial
	 * @throws BridgeUnavailableException if adb is missing
	 */
	public synchronized List<DTODeviceRecord> listDevices() {
		DTOBridgeResult result;
		try {
			result = runCommand(List.of("devices"), null);
		} catch (BridgeTimeoutException e) {
			logger.warn("Device enumeration timed out, keeping previous registry");
			return getDevices();
		}
		if (!result.isSuccess()) {
			logger.warn("Device enumeration failed: {}", result.errorText());
			return getDevices();
		}

		LocalDateTime now = LocalDateTime.now();
		Set<String> seen = new HashSet<>();
		for (String[] entry : parseDeviceList(result.getStdoutText())) {
			String id = entry[0];
			EnumDeviceStatus status = EnumDeviceStatus.fromBridgeToken(entry[1]);
			DTODeviceRecord.Builder builder = DTODeviceRecord.builder(id)
					.status(status)
					.connectionKind(EnumConnectionKind.fromDeviceId(id))
					.lastSeen(now);
			if (status == EnumDeviceStatus.CONNECTED) {
				enrich(id, builder);
			}
			registry.put(id, builder.build());
			seen.add(id);
		}

		registry.keySet().removeIf(id -> {
			if (!seen.contains(id)) {
				logger.info("Device {} is no longer listed, removing it", id);
				return true;
			}
			return false;
		});
		return getDevices();
	}

	/**
	 * Parses {@code adb devices} output.
	 *
	 * @return {serial, statusToken} for every device line
	 */
	static List<String[]> parseDeviceList(String output) {
		List<String[]> devices = new ArrayList<>();
		for (String line : output.split("\\R")) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("List of devices") || trimmed.startsWith("*")) {
				continue;
			}
			String[] tokens = trimmed.split("\\s+");
			if (tokens.length >= 2) {
				devices.add(new String[] { tokens[0], tokens[1] });
			}
		}
		return devices;
	}

	private void enrich(String id, DTODeviceRecord.Builder builder) {
		Map<String, String> props = queryProperties(id);
		String model = props.getOrDefault("ro.product.model", DTODeviceRecord.UNKNOWN);
		String manufacturer = props.get("ro.product.manufacturer");
		builder.model(model)
				.osVersion(props.getOrDefault("ro.build.version.release", DTODeviceRecord.UNKNOWN))
				.architecture(props.getOrDefault("ro.product.cpu.abi", DTODeviceRecord.UNKNOWN));
		if (!DTODeviceRecord.UNKNOWN.equals(model)) {
			builder.displayName(manufacturer != null ? manufacturer + " " + model : model);
		}

		String battery = queryText(id, List.of("shell", "dumpsys", "battery"));
		builder.batteryLevel(NumberConverters.findInt(battery, BATTERY_LEVEL));

		String meminfo = queryText(id, List.of("shell", "cat", "/proc/meminfo"));
		Long total = NumberConverters.findLong(meminfo, MEM_TOTAL);
		Long available = NumberConverters.findLong(meminfo, MEM_AVAILABLE);
		if (total != null) {
			builder.totalMemory(NumberConverters.formatKilobytes(total));
		}
		if (available != null) {
			builder.availableMemory(NumberConverters.formatKilobytes(available));
		}

		Matcher size = WM_SIZE.matcher(nullToEmpty(queryText(id, List.of("shell", "wm", "size"))));
		if (size.find()) {
			builder.screenResolution(size.group(1));
		}
		Matcher density = WM_DENSITY.matcher(nullToEmpty(queryText(id, List.of("shell", "wm", "density"))));
		if (density.find()) {
			builder.screenDensity(density.group(1));
		}
	}

	private Map<String, String> queryProperties(String id) {
		String output = queryText(id, List.of("shell", "getprop"));
		return output == null ? Map.of() : parseProperties(output);
	}

	/**
	 * Runs a property style query.
	 *
	 * @return stdout, or null if the query failed or timed out
	 */
	private String queryText(String id, List<String> args) {
		try {
			DTOBridgeResult result = runCommand(args, id, PROPERTY_TIMEOUT);
			if (result.isSuccess()) {
				return result.getStdoutText();
			}
			logger.debug("Query {} on {} failed: {}", args, id, result.errorText());
		} catch (BridgeTimeoutException e) {
			logger.debug("Query {} on {} timed out", args, id);
		}
		return null;
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}

	/**
	 * Parses property output in either {@code [key]: [value]} or {@code key: value} form.
	 */
	public static Map<String, String> parseProperties(String output) {
		Map<String, String> properties = new LinkedHashMap<>();
		for (String line : output.split("\\R")) {
			String trimmed = line.trim();
			Matcher bracket = BRACKET_PROPERTY.matcher(trimmed);
			if (bracket.matches()) {
				properties.put(bracket.group(1).trim(), bracket.group(2).trim());
				continue;
			}
			Matcher plain = PLAIN_PROPERTY.matcher(trimmed);
			if (plain.matches()) {
				properties.put(plain.group(1).trim(), plain.group(2).trim());
			}
		}
		return properties;
	}

	public List<DTODeviceRecord> getDevices() {
		return registry.values().stream()
				.sorted(Comparator.comparing(DTODeviceRecord::getId))
				.collect(Collectors.toList());
	}

	public Optional<DTODeviceRecord> getDevice(String deviceId) {
		return Optional.ofNullable(registry.get(deviceId));
	}

	// ========================================================================
	// DISCOVERY
	// ========================================================================

	/**
	 * Tries {@code adb connect host:port} for every port in the range with a fixed pool of workers.
	 * Concurrent calls are serialized.
	 *
	 * @return sorted ports that accepted the connection, without duplicates
	 * @throws IllegalArgumentException   for an empty or invalid range or a non-positive concurrency
	 * @throws BridgeUnavailableException if adb is missing
	 */
	public List<Integer> scanPortRange(int start, int end, int concurrency) {
		return scanPortRange(servConfig.getConfig().getScanHost(), start, end, concurrency);
	}

	public List<Integer> scanPortRange(String host, int start, int end, int concurrency) {
		if (start < 1 || end > 65535 || start > end) {
			throw new IllegalArgumentException("Invalid port range " + start + "-" + end);
		}
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be positive");
		}

		scanLock.lock();
		ExecutorService pool = Executors.newFixedThreadPool(concurrency);
		try {
			logger.info("Scanning {} ports {}-{} with {} workers", host, start, end, concurrency);
			Map<Integer, Future<Boolean>> probes = new LinkedHashMap<>();
			for (int port = start; port <= end; port++) {
				final int target = port;
				probes.put(port, pool.submit(() -> probe(host, target)));
			}

			TreeSet<Integer> accepted = new TreeSet<>();
			for (Map.Entry<Integer, Future<Boolean>> probe : probes.entrySet()) {
				if (waitForProbe(probe.getValue())) {
					accepted.add(probe.getKey());
				}
			}
			logger.info("Port scan finished, {} port(s) accepted: {}", accepted.size(), accepted);
			return new ArrayList<>(accepted);
		} finally {
			pool.shutdownNow();
			scanLock.unlock();
		}
	}

	private boolean waitForProbe(Future<Boolean> probe) {
		try {
			return probe.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BridgeException("Interrupted during port scan", e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof BridgeUnavailableException) {
				throw (BridgeUnavailableException) e.getCause();
			}
			logger.debug("Probe failed: {}", e.getCause().getMessage());
			return false;
		}
	}

	private boolean probe(String host, int port) {
		try {
			DTOBridgeResult result = runCommand(List.of("connect", host + ":" + port), null, PROBE_TIMEOUT);
			return result.isSuccess() && isConnectAccepted(result.getStdoutText());
		} catch (BridgeTimeoutException e) {
			return false;
		}
	}

	static boolean isConnectAccepted(String output) {
		String text = output == null ? "" : output.toLowerCase();
		return text.contains("connected") && !text.contains("cannot") && !text.contains("failed")
				&& !text.contains("unable");
	}

	/**
	 * Scans the configured port range, then re-enumerates so discovered devices enter the registry.
	 */
	public List<DTODeviceRecord> autoDiscover() {
		BotConfig config = servConfig.getConfig();
		List<Integer> ports = scanPortRange(config.getScanHost(), config.getScanPortStart(), config.getScanPortEnd(),
				config.getScanConcurrency());
		logger.info("Auto discovery found ports {}", ports);
		return listDevices();
	}

	// ========================================================================
	// CONNECTION
	// ========================================================================

	/**
	 * Connects a network device with {@code adb connect}; USB and emulator devices only need to be listed.
	 */
	public DTOCommandResult connect(String idOrAddress) {
		if (idOrAddress == null || idOrAddress.isBlank()) {
			return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "Device id is required");
		}
		try {
			if (idOrAddress.contains(":")) {
				DTOBridgeResult result = runCommand(List.of("connect", idOrAddress), null);
				String output = result.getStdoutText().trim();
				if (!result.isSuccess() || !isConnectAccepted(output)) {
					String error = output.isEmpty() ? result.errorText() : output;
					logger.warn("Could not connect to: {} - Response: {}", idOrAddress, error);
					return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE, error);
				}
				logger.info("Successful connection to: {}", idOrAddress);
			}

			listDevices();
			Optional<DTODeviceRecord> device = getDevice(idOrAddress);
			if (device.isEmpty()) {
				return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE, "Device " + idOrAddress + " not found");
			}
			if (!device.get().isConnected()) {
				return DTOCommandResult.failure(EnumResultCode.DEVICE_UNREACHABLE,
						"Device " + idOrAddress + " is " + device.get().getStatus().name().toLowerCase());
			}
			return DTOCommandResult.ok("Connected to " + idOrAddress, idOrAddress);
		} catch (BridgeTimeoutException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_TIMEOUT, e.getMessage());
		} catch (BridgeUnavailableException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		}
	}

	public DTOCommandResult disconnect(String deviceId) {
		if (deviceId == null || deviceId.isBlank()) {
			return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "Device id is required");
		}
		try {
			if (deviceId.contains(":")) {
				DTOBridgeResult result = runCommand(List.of("disconnect", deviceId), null);
				if (!result.isSuccess()) {
					return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, result.errorText());
				}
			}
			registry.remove(deviceId);
			logger.info("Disconnected from {}", deviceId);
			return DTOCommandResult.ok("Disconnected from " + deviceId);
		} catch (BridgeTimeoutException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_TIMEOUT, e.getMessage());
		} catch (BridgeUnavailableException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		}
	}

	/**
	 * Kills and restarts the adb server, then re-establishes the session.
	 */
	public DTOCommandResult restartServer() {
		try {
			runCommand(List.of("kill-server"), null);
			DTOBridgeResult start = runCommand(List.of("start-server"), null);
			if (!start.isSuccess()) {
				return DTOCommandResult.failure(EnumResultCode.ACTION_FAILED, start.errorText());
			}
			session.restart();
			registry.clear();
			return DTOCommandResult.ok("ADB server restarted");
		} catch (BridgeTimeoutException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_TIMEOUT, e.getMessage());
		} catch (BridgeUnavailableException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		}
	}
}
