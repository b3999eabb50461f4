package cl.camodev.rrbot.serv.config;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import cl.camodev.rrbot.console.enumerable.EnumConfigurationKey;
import cl.camodev.rrbot.ex.InvalidConfigException;
import cl.camodev.rrbot.ot.DTOArea;
import cl.camodev.rrbot.ot.DTOGridConfig;
import cl.camodev.rrbot.ot.DTOManaConfig;
import cl.camodev.utiles.number.NumberConverters;

/**
 * Immutable, validated bot configuration.
 * <p>
 * Values are stored as the raw strings keyed by {@link EnumConfigurationKey} and parsed once at
 * construction, so an instance that exists is always fully valid. New instances are produced with
 * {@link #builder()} or {@link #toBuilder()}.
 */
public final class BotConfig {

	private final Map<EnumConfigurationKey, String> values;

	private final boolean autoStart;
	private final boolean autoMerge;
	private final boolean autoUpgrade;
	private final double cycleIntervalSeconds;
	private final double actionDelaySeconds;
	private final int maxErrors;
	private final boolean restartOnError;
	private final String preferredDevice;
	private final double visionConfidenceThreshold;
	private final int minUnitCost;
	private final String gamePackage;
	private final boolean launchGameOnStart;
	private final int stopGraceSeconds;
	private final String adbPath;
	private final int bridgeTimeoutSeconds;
	private final String scanHost;
	private final int scanPortStart;
	private final int scanPortEnd;
	private final int scanConcurrency;
	private final String referenceDirectory;
	private final String templateDirectory;
	private final String rankModelPath;
	private final DTOGridConfig gridConfig;
	private final DTOManaConfig manaConfig;

	private BotConfig(Map<EnumConfigurationKey, String> source) {
		this.values = new EnumMap<>(EnumConfigurationKey.class);
		for (EnumConfigurationKey key : EnumConfigurationKey.values()) {
			String value = source.get(key);
			values.put(key, value == null ? key.getDefaultValue() : value);
		}

		this.autoStart = get(EnumConfigurationKey.AUTO_START_BOOL);
		this.autoMerge = get(EnumConfigurationKey.AUTO_MERGE_BOOL);
		this.autoUpgrade = get(EnumConfigurationKey.AUTO_UPGRADE_BOOL);
		this.cycleIntervalSeconds = get(EnumConfigurationKey.CYCLE_INTERVAL_DOUBLE);
		this.actionDelaySeconds = get(EnumConfigurationKey.ACTION_DELAY_DOUBLE);
		this.maxErrors = get(EnumConfigurationKey.MAX_ERRORS_INT);
		this.restartOnError = get(EnumConfigurationKey.RESTART_ON_ERROR_BOOL);
		String device = get(EnumConfigurationKey.PREFERRED_DEVICE_STRING);
		this.preferredDevice = device.isEmpty() ? null : device;
		this.visionConfidenceThreshold = get(EnumConfigurationKey.VISION_CONFIDENCE_THRESHOLD_DOUBLE);
		this.minUnitCost = get(EnumConfigurationKey.MIN_UNIT_COST_INT);
		this.gamePackage = get(EnumConfigurationKey.GAME_PACKAGE_STRING);
		this.launchGameOnStart = get(EnumConfigurationKey.LAUNCH_GAME_ON_START_BOOL);
		this.stopGraceSeconds = get(EnumConfigurationKey.STOP_GRACE_SECONDS_INT);
		this.adbPath = get(EnumConfigurationKey.ADB_PATH_STRING);
		this.bridgeTimeoutSeconds = get(EnumConfigurationKey.BRIDGE_TIMEOUT_INT);
		this.scanHost = get(EnumConfigurationKey.SCAN_HOST_STRING);
		this.scanPortStart = get(EnumConfigurationKey.SCAN_PORT_START_INT);
		this.scanPortEnd = get(EnumConfigurationKey.SCAN_PORT_END_INT);
		this.scanConcurrency = get(EnumConfigurationKey.SCAN_CONCURRENCY_INT);
		this.referenceDirectory = get(EnumConfigurationKey.REFERENCE_DIRECTORY_STRING);
		this.templateDirectory = get(EnumConfigurationKey.TEMPLATE_DIRECTORY_STRING);
		this.rankModelPath = get(EnumConfigurationKey.RANK_MODEL_PATH_STRING);

		this.gridConfig = new DTOGridConfig(
				this.<Integer>get(EnumConfigurationKey.GRID_ROWS_INT),
				this.<Integer>get(EnumConfigurationKey.GRID_COLS_INT),
				this.<Integer>get(EnumConfigurationKey.GRID_CELL_WIDTH_INT),
				this.<Integer>get(EnumConfigurationKey.GRID_CELL_HEIGHT_INT),
				this.<Integer>get(EnumConfigurationKey.GRID_ORIGIN_X_INT),
				this.<Integer>get(EnumConfigurationKey.GRID_ORIGIN_Y_INT),
				this.<Integer>get(EnumConfigurationKey.GRID_SPACING_INT));
		this.manaConfig = new DTOManaConfig(
				DTOArea.of(this.<Integer>get(EnumConfigurationKey.MANA_REGION_X_INT),
						this.<Integer>get(EnumConfigurationKey.MANA_REGION_Y_INT),
						this.<Integer>get(EnumConfigurationKey.MANA_REGION_WIDTH_INT),
						this.<Integer>get(EnumConfigurationKey.MANA_REGION_HEIGHT_INT)),
				triple(EnumConfigurationKey.MANA_LOWER_HSV_STRING),
				triple(EnumConfigurationKey.MANA_UPPER_HSV_STRING),
				this.<Integer>get(EnumConfigurationKey.MANA_MAX_INT));

		validate();
	}

	public static BotConfig defaults() {
		return new BotConfig(Collections.emptyMap());
	}

	public static Builder builder() {
		return new Builder(Collections.emptyMap());
	}

	public Builder toBuilder() {
		return new Builder(values);
	}

	private <T> T get(EnumConfigurationKey key) {
		try {
			return key.castValue(values.get(key));
		} catch (IllegalArgumentException e) {
			throw new InvalidConfigException("Invalid value for " + key.getOptionName() + ": " + values.get(key), e);
		}
	}

	private int[] triple(EnumConfigurationKey key) {
		try {
			return NumberConverters.parseTriple(values.get(key));
		} catch (IllegalArgumentException e) {
			throw new InvalidConfigException("Invalid value for " + key.getOptionName() + ": " + values.get(key), e);
		}
	}

	private void validate() {
		require(cycleIntervalSeconds > 0 && cycleIntervalSeconds <= 3600, "cycleInterval must be in (0, 3600] seconds");
		require(actionDelaySeconds >= 0 && actionDelaySeconds <= 60, "actionDelay must be in [0, 60] seconds");
		require(maxErrors >= 1, "maxErrors must be at least 1");
		require(visionConfidenceThreshold >= 0.0 && visionConfidenceThreshold <= 1.0,
				"visionConfidenceThreshold must be in [0, 1]");
		require(minUnitCost >= 0, "minUnitCost must not be negative");
		require(stopGraceSeconds >= 1, "stopGraceSeconds must be at least 1");
		require(bridgeTimeoutSeconds >= 1, "bridgeTimeout must be at least 1 second");
		require(scanPortStart >= 1 && scanPortEnd <= 65535 && scanPortStart <= scanPortEnd,
				"scan port range must satisfy 1 <= start <= end <= 65535");
		require(scanConcurrency >= 1 && scanConcurrency <= 64, "scanConcurrency must be in [1, 64]");

		require(gridConfig.getRows() >= 1 && gridConfig.getCols() >= 1, "grid must have at least one row and column");
		require(gridConfig.getRows() <= 20 && gridConfig.getCols() <= 20, "grid is limited to 20x20");
		require(gridConfig.getCellWidth() >= 1 && gridConfig.getCellHeight() >= 1, "grid cells must be at least 1px");
		require(gridConfig.getOriginX() >= 0 && gridConfig.getOriginY() >= 0, "grid origin must not be negative");
		require(gridConfig.getSpacing() >= 0, "grid spacing must not be negative");

		DTOArea region = manaConfig.getRegion();
		require(region.getX() >= 0 && region.getY() >= 0, "mana region origin must not be negative");
		require(region.getWidth() >= 1 && region.getHeight() >= 1, "mana region must be at least 1px");
		require(manaConfig.getMaxMana() >= 1, "maxMana must be at least 1");
		int[] lower = manaConfig.getLowerHsv();
		int[] upper = manaConfig.getUpperHsv();
		int[] limits = { 180, 255, 255 };
		for (int i = 0; i < 3; i++) {
			require(lower[i] >= 0 && upper[i] <= limits[i] && lower[i] <= upper[i],
					"mana colour range must satisfy 0 <= lower <= upper <= (180,255,255)");
		}
	}

	private static void require(boolean condition, String message) {
		if (!condition) {
			throw new InvalidConfigException(message);
		}
	}

	public boolean isAutoStart() { return autoStart; }
	public boolean isAutoMerge() { return autoMerge; }
	public boolean isAutoUpgrade() { return autoUpgrade; }
	public double getCycleIntervalSeconds() { return cycleIntervalSeconds; }
	public double getActionDelaySeconds() { return actionDelaySeconds; }
	public int getMaxErrors() { return maxErrors; }
	public boolean isRestartOnError() { return restartOnError; }
	public Optional<String> getPreferredDevice() { return Optional.ofNullable(preferredDevice); }
	public double getVisionConfidenceThreshold() { return visionConfidenceThreshold; }
	public int getMinUnitCost() { return minUnitCost; }
	public String getGamePackage() { return gamePackage; }
	public boolean isLaunchGameOnStart() { return launchGameOnStart; }
	public int getStopGraceSeconds() { return stopGraceSeconds; }
	public String getAdbPath() { return adbPath; }
	public int getBridgeTimeoutSeconds() { return bridgeTimeoutSeconds; }
	public String getScanHost() { return scanHost; }
	public int getScanPortStart() { return scanPortStart; }
	public int getScanPortEnd() { return scanPortEnd; }
	public int getScanConcurrency() { return scanConcurrency; }
	public String getReferenceDirectory() { return referenceDirectory; }
	public String getTemplateDirectory() { return templateDirectory; }
	public String getRankModelPath() { return rankModelPath; }
	public DTOGridConfig getGridConfig() { return gridConfig; }
	public DTOManaConfig getManaConfig() { return manaConfig; }

	public Duration getCycleInterval() {
		return Duration.ofMillis(Math.round(cycleIntervalSeconds * 1000));
	}

	public Duration getActionDelay() {
		return Duration.ofMillis(Math.round(actionDelaySeconds * 1000));
	}

	public Duration getBridgeTimeout() {
		return Duration.ofSeconds(bridgeTimeoutSeconds);
	}

	public String getRawValue(EnumConfigurationKey key) {
		return values.get(key);
	}

	/**
	 * @return option name to typed value, in declaration order
	 */
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		for (EnumConfigurationKey key : EnumConfigurationKey.values()) {
			map.put(key.getOptionName(), get(key));
		}
		return map;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof BotConfig)) return false;
		return toMap().equals(((BotConfig) o).toMap());
	}

	@Override
	public int hashCode() {
		return toMap().hashCode();
	}

	@Override
	public String toString() {
		return "BotConfig" + toMap();
	}

	public static final class Builder {
		private final Map<EnumConfigurationKey, String> values = new EnumMap<>(EnumConfigurationKey.class);

		private Builder(Map<EnumConfigurationKey, String> initial) {
			values.putAll(initial);
		}

		public Builder set(EnumConfigurationKey key, String value) {
			values.put(key, value);
			return this;
		}

		public Builder autoStart(boolean value) { return set(EnumConfigurationKey.AUTO_START_BOOL, String.valueOf(value)); }
		public Builder autoMerge(boolean value) { return set(EnumConfigurationKey.AUTO_MERGE_BOOL, String.valueOf(value)); }
		public Builder autoUpgrade(boolean value) { return set(EnumConfigurationKey.AUTO_UPGRADE_BOOL, String.valueOf(value)); }
		public Builder cycleInterval(double seconds) { return set(EnumConfigurationKey.CYCLE_INTERVAL_DOUBLE, String.valueOf(seconds)); }
		public Builder actionDelay(double seconds) { return set(EnumConfigurationKey.ACTION_DELAY_DOUBLE, String.valueOf(seconds)); }
		public Builder maxErrors(int value) { return set(EnumConfigurationKey.MAX_ERRORS_INT, String.valueOf(value)); }
		public Builder restartOnError(boolean value) { return set(EnumConfigurationKey.RESTART_ON_ERROR_BOOL, String.valueOf(value)); }
		public Builder preferredDevice(String deviceId) { return set(EnumConfigurationKey.PREFERRED_DEVICE_STRING, deviceId == null ? "" : deviceId); }
		public Builder visionConfidenceThreshold(double value) { return set(EnumConfigurationKey.VISION_CONFIDENCE_THRESHOLD_DOUBLE, String.valueOf(value)); }
		public Builder minUnitCost(int value) { return set(EnumConfigurationKey.MIN_UNIT_COST_INT, String.valueOf(value)); }
		public Builder launchGameOnStart(boolean value) { return set(EnumConfigurationKey.LAUNCH_GAME_ON_START_BOOL, String.valueOf(value)); }
		public Builder stopGraceSeconds(int value) { return set(EnumConfigurationKey.STOP_GRACE_SECONDS_INT, String.valueOf(value)); }

		public Builder gridConfig(DTOGridConfig grid) {
			set(EnumConfigurationKey.GRID_ROWS_INT, String.valueOf(grid.getRows()));
			set(EnumConfigurationKey.GRID_COLS_INT, String.valueOf(grid.getCols()));
			set(EnumConfigurationKey.GRID_CELL_WIDTH_INT, String.valueOf(grid.getCellWidth()));
			set(EnumConfigurationKey.GRID_CELL_HEIGHT_INT, String.valueOf(grid.getCellHeight()));
			set(EnumConfigurationKey.GRID_ORIGIN_X_INT, String.valueOf(grid.getOriginX()));
			set(EnumConfigurationKey.GRID_ORIGIN_Y_INT, String.valueOf(grid.getOriginY()));
			return set(EnumConfigurationKey.GRID_SPACING_INT, String.valueOf(grid.getSpacing()));
		}

		public Builder manaConfig(DTOManaConfig mana) {
			DTOArea region = mana.getRegion();
			set(EnumConfigurationKey.MANA_REGION_X_INT, String.valueOf(region.getX()));
			set(EnumConfigurationKey.MANA_REGION_Y_INT, String.valueOf(region.getY()));
			set(EnumConfigurationKey.MANA_REGION_WIDTH_INT, String.valueOf(region.getWidth()));
			set(EnumConfigurationKey.MANA_REGION_HEIGHT_INT, String.valueOf(region.getHeight()));
			set(EnumConfigurationKey.MANA_LOWER_HSV_STRING, joinTriple(mana.getLowerHsv()));
			set(EnumConfigurationKey.MANA_UPPER_HSV_STRING, joinTriple(mana.getUpperHsv()));
			return set(EnumConfigurationKey.MANA_MAX_INT, String.valueOf(mana.getMaxMana()));
		}

		private static String joinTriple(int[] values) {
			return values[0] + "," + values[1] + "," + values[2];
		}

		/**
		 * @throws InvalidConfigException if any value is malformed or out of range
		 */
		public BotConfig build() {
			return new BotConfig(values);
		}
	}
}
