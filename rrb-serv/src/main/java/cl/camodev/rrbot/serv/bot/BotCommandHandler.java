package cl.camodev.rrbot.serv.bot;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;

import cl.camodev.rrbot.console.enumerable.EnumBotEvent;
import cl.camodev.rrbot.console.enumerable.EnumResultCode;
import cl.camodev.rrbot.device.DeviceBridge;
import cl.camodev.rrbot.ex.BridgeTimeoutException;
import cl.camodev.rrbot.ex.BridgeUnavailableException;
import cl.camodev.rrbot.ot.DTOBotStats;
import cl.camodev.rrbot.ot.DTOBotStatus;
import cl.camodev.rrbot.ot.DTOCommandResult;
import cl.camodev.rrbot.ot.DTODeviceRecord;
import cl.camodev.rrbot.ot.DTOLogEntry;
import cl.camodev.rrbot.ot.DTOManaReading;
import cl.camodev.rrbot.ot.DTOVisionStats;
import cl.camodev.rrbot.serv.impl.ServEvents;
import cl.camodev.rrbot.serv.impl.ServLogs;
import cl.camodev.rrbot.vision.PerceptionPipeline;

/**
 * Entry point for commands arriving from the transport layer, either as JSON
 * {@code {"command": "...", "params": {...}}} or as a name plus parameter map.
 * Every command answers with a {@link DTOCommandResult} whose data holds only maps, lists and
 * primitives so it can be serialized as is.
 */
public class BotCommandHandler {
	private static final Logger logger = LoggerFactory.getLogger(BotCommandHandler.class);
	private static final Gson GSON = new Gson();

	public static final int DEFAULT_LOG_LIMIT = 100;
	public static final int DEFAULT_SWIPE_MS = 300;

	private final BotOrchestrator orchestrator;
	private final DeviceBridge deviceBridge;
	private final PerceptionPipeline perception;
	private final ServLogs logs;
	private final ServEvents events;

	public BotCommandHandler(BotOrchestrator orchestrator, DeviceBridge deviceBridge, PerceptionPipeline perception,
			ServLogs logs, ServEvents events) {
		this.orchestrator = orchestrator;
		this.deviceBridge = deviceBridge;
		this.perception = perception;
		this.logs = logs;
		this.events = events;
	}

	public DTOCommandResult handle(String json) {
		JsonObject request;
		try {
			JsonElement element = JsonParser.parseString(json);
			if (!element.isJsonObject()) {
				return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "Command must be a JSON object");
			}
			request = element.getAsJsonObject();
		} catch (JsonParseException | IllegalStateException e) {
			return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "Malformed command: " + e.getMessage());
		}
		if (!request.has("command") || !request.get("command").isJsonPrimitive()) {
			return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "Missing command name");
		}
		Map<String, Object> params = new LinkedHashMap<>();
		if (request.has("params") && request.get("params").isJsonObject()) {
			params = GSON.fromJson(request.get("params"), new TypeToken<LinkedHashMap<String, Object>>() {
			}.getType());
		}
		return handle(request.get("command").getAsString(), params);
	}

	public DTOCommandResult handle(String command, Map<String, Object> params) {
		Map<String, Object> args = params == null ? Map.of() : params;
		logger.debug("Command {} {}", command, args);
		try {
			switch (command) {
			case "start":
				return orchestrator.start(optionalString(args, "device_id"));
			case "stop":
				return orchestrator.stop();
			case "pause":
				return orchestrator.togglePause();
			case "resume":
				return orchestrator.resume();
			case "quick_start":
				return orchestrator.quickStart(optionalString(args, "device_id"));
			case "quit_game":
				return orchestrator.quitGame();
			case "update_config":
				return orchestrator.updateConfig(configDelta(args));
			case "tap":
				return orchestrator.tap(requiredInt(args, "x"), requiredInt(args, "y"));
			case "swipe":
				return orchestrator.swipe(requiredInt(args, "x1"), requiredInt(args, "y1"), requiredInt(args, "x2"),
						requiredInt(args, "y2"), optionalInt(args, "duration", DEFAULT_SWIPE_MS));
			case "get_screenshot":
				return screenshot();
			case "get_status":
				return DTOCommandResult.ok("Status", statusMap(orchestrator.getStatus()));
			case "get_stats":
				return DTOCommandResult.ok("Statistics", statsMap(orchestrator.getStats(), perception.getStats()));
			case "get_logs":
				return DTOCommandResult.ok("Logs", logsList(optionalInt(args, "limit", DEFAULT_LOG_LIMIT)));
			case "clear_logs":
				logs.clear();
				return DTOCommandResult.ok("Logs cleared");
			case "list_devices":
				return bridgeCall(() -> DTOCommandResult.ok("Devices", devicesList(deviceBridge.listDevices())));
			case "scan_devices":
				return bridgeCall(() -> DTOCommandResult.ok("Devices", devicesList(deviceBridge.autoDiscover())));
			case "connect_device":
				return connectDevice(requiredString(args, "device_id"));
			case "disconnect_device":
				return disconnectDevice(optionalString(args, "device_id"));
			default:
				return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "Unknown command: " + command);
			}
		} catch (IllegalArgumentException e) {
			return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, e.getMessage());
		}
	}

	/**
	 * Serializes a result as {@code {"success", "code", "message", "data"}}.
	 */
	public static String toJson(DTOCommandResult result) {
		JsonObject json = new JsonObject();
		json.addProperty("success", result.isSuccess());
		json.addProperty("code", result.getCode().name());
		json.addProperty("message", result.getMessage());
		if (result.getData() != null) {
			json.add("data", GSON.toJsonTree(result.getData()));
		}
		return GSON.toJson(json);
	}

	// ===================== Commands =====================

	private DTOCommandResult screenshot() {
		DTOCommandResult result = orchestrator.screenshot();
		if (!result.isSuccess() || !(result.getData() instanceof byte[])) {
			return result;
		}
		byte[] image = (byte[]) result.getData();
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("image", Base64.getEncoder().encodeToString(image));
		data.put("size", image.length);
		return DTOCommandResult.ok(result.getMessage(), data);
	}

	private DTOCommandResult connectDevice(String deviceId) {
		DTOCommandResult result = bridgeCall(() -> deviceBridge.connect(deviceId));
		if (result.isSuccess()) {
			events.publish(EnumBotEvent.DEVICE_CONNECTED, Map.of("device_id", deviceId));
		}
		return result;
	}

	private DTOCommandResult disconnectDevice(String requested) {
		String deviceId = requested != null ? requested : orchestrator.getStatus().getConnectedDeviceId();
		if (deviceId == null) {
			return DTOCommandResult.failure(EnumResultCode.INVALID_COMMAND, "No device to disconnect");
		}
		DTOCommandResult result = bridgeCall(() -> deviceBridge.disconnect(deviceId));
		if (result.isSuccess()) {
			events.publish(EnumBotEvent.DEVICE_DISCONNECTED, Map.of("device_id", deviceId));
		}
		return result;
	}

	private DTOCommandResult bridgeCall(Supplier<DTOCommandResult> call) {
		try {
			return call.get();
		} catch (BridgeTimeoutException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_TIMEOUT, e.getMessage());
		} catch (BridgeUnavailableException e) {
			return DTOCommandResult.failure(EnumResultCode.BRIDGE_UNAVAILABLE, e.getMessage());
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> configDelta(Map<String, Object> args) {
		Object nested = args.get("config");
		if (nested instanceof Map) {
			return (Map<String, Object>) nested;
		}
		return args;
	}

	// ===================== Views =====================

	static Map<String, Object> statusMap(DTOBotStatus status) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("state", status.getState().wireName());
		map.put("started_at", timestamp(status.getStartedAt()));
		map.put("error_count", status.getErrorCount());
		map.put("last_action", status.getLastAction());
		map.put("device_id", status.getConnectedDeviceId());
		map.put("error_message", status.getErrorMessage());
		map.put("stats", statsMap(status.getStats(), null));
		DTOManaReading mana = status.getLastMana();
		if (mana != null) {
			Map<String, Object> manaMap = new LinkedHashMap<>();
			manaMap.put("current", mana.getCurrent());
			manaMap.put("max", mana.getMax());
			manaMap.put("percentage", mana.getPercentage());
			manaMap.put("confidence", mana.getConfidence());
			map.put("mana", manaMap);
		}
		return map;
	}

	static Map<String, Object> statsMap(DTOBotStats stats, DTOVisionStats vision) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("games_played", stats.getGamesPlayed());
		map.put("actions_performed", stats.getActionsPerformed());
		map.put("errors", stats.getErrors());
		map.put("units_placed", stats.getUnitsPlaced());
		map.put("units_merged", stats.getUnitsMerged());
		map.put("cycles", stats.getCycles());
		if (vision != null) {
			Map<String, Object> visionMap = new LinkedHashMap<>();
			visionMap.put("total_analyses", vision.getTotalAnalyses());
			visionMap.put("grid_analyses", vision.getGridAnalyses());
			visionMap.put("mana_analyses", vision.getManaAnalyses());
			visionMap.put("rank_predictions", vision.getRankPredictions());
			visionMap.put("template_matches", vision.getTemplateMatches());
			visionMap.put("decode_failures", vision.getDecodeFailures());
			visionMap.put("average_processing_time_ms", vision.getAverageProcessingTimeMs());
			visionMap.put("reference_colors", vision.getReferenceColors());
			visionMap.put("templates", vision.getTemplates());
			visionMap.put("rank_model_loaded", vision.isRankModelLoaded());
			map.put("vision", visionMap);
		}
		return map;
	}

	private List<Map<String, Object>> logsList(int limit) {
		List<Map<String, Object>> list = new ArrayList<>();
		for (DTOLogEntry entry : logs.getLogs(limit)) {
			Map<String, Object> map = new LinkedHashMap<>();
			map.put("timestamp", timestamp(entry.getTimestamp()));
			map.put("level", entry.getSeverity().name());
			map.put("source", entry.getSource());
			map.put("device", entry.getDevice());
			map.put("message", entry.getMessage());
			list.add(map);
		}
		return list;
	}

	static List<Map<String, Object>> devicesList(List<DTODeviceRecord> devices) {
		List<Map<String, Object>> list = new ArrayList<>();
		for (DTODeviceRecord device : devices) {
			Map<String, Object> map = new LinkedHashMap<>();
			map.put("id", device.getId());
			map.put("name", device.getDisplayName());
			map.put("model", device.getModel());
			map.put("android_version", device.getOsVersion());
			map.put("architecture", device.getArchitecture());
			map.put("status", device.getStatus().name().toLowerCase());
			map.put("connection_type", device.getConnectionKind().name().toLowerCase());
			map.put("last_seen", timestamp(device.getLastSeen()));
			map.put("battery_level", device.getBatteryLevel());
			map.put("total_memory", device.getTotalMemory());
			map.put("available_memory", device.getAvailableMemory());
			map.put("screen_resolution", device.getScreenResolution());
			map.put("screen_density", device.getScreenDensity());
			list.add(map);
		}
		return list;
	}

	private static String timestamp(LocalDateTime time) {
		return time == null ? null : time.toString();
	}

	// ===================== Parameters =====================

	private static String optionalString(Map<String, Object> args, String name) {
		Object value = args.get(name);
		if (value == null) {
			return null;
		}
		String text = String.valueOf(value).trim();
		return text.isEmpty() ? null : text;
	}

	private static String requiredString(Map<String, Object> args, String name) {
		String value = optionalString(args, name);
		if (value == null) {
			throw new IllegalArgumentException("Missing parameter: " + name);
		}
		return value;
	}

	private static int requiredInt(Map<String, Object> args, String name) {
		Object value = args.get(name);
		if (value == null) {
			throw new IllegalArgumentException("Missing parameter: " + name);
		}
		return toInt(name, value);
	}

	private static int optionalInt(Map<String, Object> args, String name, int defaultValue) {
		Object value = args.get(name);
		return value == null ? defaultValue : toInt(name, value);
	}

	private static int toInt(String name, Object value) {
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		try {
			return (int) Double.parseDouble(String.valueOf(value));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Parameter " + name + " must be a number: " + value);
		}
	}
}
