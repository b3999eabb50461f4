package cl.camodev.rrbot.serv.impl;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cl.camodev.rrbot.console.enumerable.EnumConfigurationKey;
import cl.camodev.rrbot.ex.InvalidConfigException;
import cl.camodev.rrbot.serv.config.BotConfig;

/**
 * Owner of the single live {@link BotConfig}.
 * <p>
 * Readers always see a complete configuration. Updates are applied to a copy, validated, and only then
 * swapped in, so a rejected update leaves the previous configuration in place.
 */
public class ServConfig {

	private static final Logger logger = LoggerFactory.getLogger(ServConfig.class);

	/**
	 * Options read once when the services are wired. Changing them needs a restart of the application.
	 */
	private static final Set<EnumConfigurationKey> STARTUP_ONLY = EnumSet.of(
			EnumConfigurationKey.ADB_PATH_STRING,
			EnumConfigurationKey.SCAN_CONCURRENCY_INT,
			EnumConfigurationKey.REFERENCE_DIRECTORY_STRING,
			EnumConfigurationKey.TEMPLATE_DIRECTORY_STRING,
			EnumConfigurationKey.RANK_MODEL_PATH_STRING);

	private final AtomicReference<BotConfig> current;

	public ServConfig(BotConfig initial) {
		this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
	}

	public BotConfig getConfig() {
		return current.get();
	}

	/**
	 * Applies a partial update. Keys are option names ({@code autoMerge}, {@code gridConfig.rows}) or enum
	 * names; nested maps such as {@code {"gridConfig": {"rows": 5}}} are flattened with a dot.
	 *
	 * @param delta changed options only; null or empty leaves the configuration untouched
	 * @return the configuration in force after the call
	 * @throws InvalidConfigException if a key is unknown, a startup-only option would change, or the resulting
	 *                                configuration is invalid
	 */
	public synchronized BotConfig update(Map<String, ?> delta) {
		BotConfig before = current.get();
		if (delta == null || delta.isEmpty()) {
			return before;
		}

		Map<String, Object> flat = new LinkedHashMap<>();
		flatten("", delta, flat);

		BotConfig.Builder builder = before.toBuilder();
		Set<EnumConfigurationKey> touched = EnumSet.noneOf(EnumConfigurationKey.class);
		for (Map.Entry<String, Object> entry : flat.entrySet()) {
			EnumConfigurationKey key = EnumConfigurationKey.fromName(entry.getKey());
			if (key == null) {
				throw new InvalidConfigException("Unknown configuration option: " + entry.getKey());
			}
			builder.set(key, toRawValue(key, entry.getValue()));
			touched.add(key);
		}

		BotConfig after = builder.build();
		for (EnumConfigurationKey key : touched) {
			if (STARTUP_ONLY.contains(key) && !Objects.equals(startupValue(before, key), startupValue(after, key))) {
				throw new InvalidConfigException("Option " + key.getOptionName() + " requires a restart to change");
			}
		}
		current.set(after);
		logger.info("Configuration updated: {}", flat.keySet());
		return after;
	}

	private static Object startupValue(BotConfig config, EnumConfigurationKey key) {
		switch (key) {
			case ADB_PATH_STRING:
				return config.getAdbPath();
			case SCAN_CONCURRENCY_INT:
				return config.getScanConcurrency();
			case REFERENCE_DIRECTORY_STRING:
				return config.getReferenceDirectory();
			case TEMPLATE_DIRECTORY_STRING:
				return config.getTemplateDirectory();
			case RANK_MODEL_PATH_STRING:
				return config.getRankModelPath();
			default:
				throw new IllegalArgumentException("Not a startup option: " + key);
		}
	}

	private static void flatten(String prefix, Map<String, ?> source, Map<String, Object> target) {
		for (Map.Entry<String, ?> entry : source.entrySet()) {
			String name = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
			Object value = entry.getValue();
			if (value instanceof Map) {
				@SuppressWarnings("unchecked")
				Map<String, ?> nested = (Map<String, ?>) value;
				flatten(name, nested, target);
			} else {
				target.put(name, value);
			}
		}
	}

	private static String toRawValue(EnumConfigurationKey key, Object value) {
		if (value == null) {
			if (key.getType().equals(String.class)) {
				return "";
			}
			throw new InvalidConfigException("Option " + key.getOptionName() + " cannot be null");
		}
		if (value instanceof Collection) {
			return ((Collection<?>) value).stream()
					.map(v -> v instanceof Number ? String.valueOf(((Number) v).intValue()) : String.valueOf(v))
					.collect(Collectors.joining(","));
		}
		if (value instanceof Number && key.getType().equals(Integer.class)) {
			double number = ((Number) value).doubleValue();
			if (number != Math.rint(number)) {
				throw new InvalidConfigException("Option " + key.getOptionName() + " must be an integer: " + value);
			}
			return String.valueOf((long) number);
		}
		return String.valueOf(value);
	}
}
