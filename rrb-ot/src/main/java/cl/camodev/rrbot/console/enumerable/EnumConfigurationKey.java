package cl.camodev.rrbot.console.enumerable;

/**
 * Configuration keys for the bot.
 * Keys are organized by functional categories; each one carries its default value and value type.
 */
public enum EnumConfigurationKey {

	// @formatter:off
    // ========================================================================
    // BOT BEHAVIOUR
    // ========================================================================
	AUTO_START_BOOL("autoStart", "false", Boolean.class),
	AUTO_MERGE_BOOL("autoMerge", "true", Boolean.class),
	AUTO_UPGRADE_BOOL("autoUpgrade", "true", Boolean.class),
	CYCLE_INTERVAL_DOUBLE("cycleInterval", "2.0", Double.class),
	ACTION_DELAY_DOUBLE("actionDelay", "0.5", Double.class),
	MAX_ERRORS_INT("maxErrors", "3", Integer.class),
	RESTART_ON_ERROR_BOOL("restartOnError", "true", Boolean.class),
	STOP_GRACE_SECONDS_INT("stopGraceSeconds", "10", Integer.class),
	MIN_UNIT_COST_INT("minUnitCost", "3", Integer.class),
	GAME_PACKAGE_STRING("gamePackage", "com.my.defense", String.class),
	LAUNCH_GAME_ON_START_BOOL("launchGameOnStart", "true", Boolean.class),

    // ========================================================================
    // DEVICE BRIDGE
    // ========================================================================
	PREFERRED_DEVICE_STRING("preferredDevice", "", String.class),
	ADB_PATH_STRING("adbPath", "", String.class),
	BRIDGE_TIMEOUT_INT("bridgeTimeout", "10", Integer.class),
	SCAN_HOST_STRING("scanHost", "127.0.0.1", String.class),
	SCAN_PORT_START_INT("scanPortStart", "5555", Integer.class),
	SCAN_PORT_END_INT("scanPortEnd", "5585", Integer.class),
	SCAN_CONCURRENCY_INT("scanConcurrency", "10", Integer.class),

    // ========================================================================
    // VISION
    // ========================================================================
	VISION_CONFIDENCE_THRESHOLD_DOUBLE("visionConfidenceThreshold", "0.8", Double.class),
	GRID_ROWS_INT("gridConfig.rows", "4", Integer.class),
	GRID_COLS_INT("gridConfig.cols", "4", Integer.class),
	GRID_CELL_WIDTH_INT("gridConfig.cellWidth", "80", Integer.class),
	GRID_CELL_HEIGHT_INT("gridConfig.cellHeight", "80", Integer.class),
	GRID_ORIGIN_X_INT("gridConfig.originX", "100", Integer.class),
	GRID_ORIGIN_Y_INT("gridConfig.originY", "200", Integer.class),
	GRID_SPACING_INT("gridConfig.spacing", "10", Integer.class),
	MANA_REGION_X_INT("manaConfig.regionX", "50", Integer.class),
	MANA_REGION_Y_INT("manaConfig.regionY", "50", Integer.class),
	MANA_REGION_WIDTH_INT("manaConfig.regionWidth", "200", Integer.class),
	MANA_REGION_HEIGHT_INT("manaConfig.regionHeight", "30", Integer.class),
	MANA_LOWER_HSV_STRING("manaConfig.lowerHsv", "100,150,200", String.class),
	MANA_UPPER_HSV_STRING("manaConfig.upperHsv", "120,255,255", String.class),
	MANA_MAX_INT("manaConfig.maxMana", "10", Integer.class),
	REFERENCE_DIRECTORY_STRING("referenceDirectory", "", String.class),
	TEMPLATE_DIRECTORY_STRING("templateDirectory", "", String.class),
	RANK_MODEL_PATH_STRING("rankModelPath", "", String.class);
	// @formatter:on

	private final String optionName;
	private final String defaultValue;
	private final Class<?> type;

	EnumConfigurationKey(String optionName, String defaultValue, Class<?> type) {
		this.optionName = optionName;
		this.defaultValue = defaultValue;
		this.type = type;
	}

	/**
	 * Name used by command payloads, e.g. {@code cycleInterval} or {@code gridConfig.rows}.
	 */
	public String getOptionName() {
		return optionName;
	}

	public String getDefaultValue() {
		return defaultValue;
	}

	public Class<?> getType() {
		return type;
	}

	/**
	 * Resolves a key either by its enum name or by its option name, ignoring case.
	 *
	 * @return the key, or null if nothing matches
	 */
	public static EnumConfigurationKey fromName(String name) {
		if (name == null) {
			return null;
		}
		for (EnumConfigurationKey key : values()) {
			if (key.name().equalsIgnoreCase(name) || key.optionName.equalsIgnoreCase(name)) {
				return key;
			}
		}
		return null;
	}

	/**
	 * Converts a String to the type defined in 'type'.
	 *
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	@SuppressWarnings("unchecked")
	public <T> T castValue(String value) {
		if (type.equals(String.class)) {
			return (T) (value == null ? "" : value.trim());
		}
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Empty value for " + optionName);
		}
		String trimmed = value.trim();
		if (type.equals(Boolean.class)) {
			if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
				throw new IllegalArgumentException("Not a boolean for " + optionName + ": " + value);
			}
			return (T) Boolean.valueOf(trimmed);
		} else if (type.equals(Integer.class)) {
			return (T) Integer.valueOf(trimmed);
		} else if (type.equals(Double.class)) {
			return (T) Double.valueOf(trimmed);
		}

		throw new UnsupportedOperationException("Type " + type.getSimpleName() + " not supported for casting.");
	}
}
