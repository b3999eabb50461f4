package cl.camodev.rrbot.serv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.console.enumerable.EnumConfigurationKey;
import cl.camodev.rrbot.ex.InvalidConfigException;
import cl.camodev.rrbot.ot.DTOGridConfig;

class BotConfigTest {

	@Test
	@DisplayName("Defaults match the documented option values")
	void defaults() {
		BotConfig config = BotConfig.defaults();

		assertFalse(config.isAutoStart());
		assertTrue(config.isAutoMerge());
		assertTrue(config.isAutoUpgrade());
		assertEquals(Duration.ofSeconds(2), config.getCycleInterval());
		assertEquals(Duration.ofMillis(500), config.getActionDelay());
		assertEquals(3, config.getMaxErrors());
		assertTrue(config.isRestartOnError());
		assertTrue(config.getPreferredDevice().isEmpty());
		assertEquals(0.8, config.getVisionConfidenceThreshold(), 1e-9);
		assertEquals(4, config.getGridConfig().getRows());
		assertEquals(80, config.getGridConfig().getCellWidth());
		assertEquals(10, config.getManaConfig().getMaxMana());
		assertEquals(120, config.getManaConfig().getUpperHsv()[0]);
	}

	@Test
	@DisplayName("Out of range values are rejected")
	void rejectsOutOfRange() {
		assertThrows(InvalidConfigException.class, () -> BotConfig.builder().maxErrors(0).build());
		assertThrows(InvalidConfigException.class, () -> BotConfig.builder().visionConfidenceThreshold(1.5).build());
		assertThrows(InvalidConfigException.class, () -> BotConfig.builder().cycleInterval(0).build());
		assertThrows(InvalidConfigException.class,
				() -> BotConfig.builder().set(EnumConfigurationKey.MANA_LOWER_HSV_STRING, "130,0,0").build());
	}

	@Test
	@DisplayName("Malformed values are rejected")
	void rejectsMalformed() {
		assertThrows(InvalidConfigException.class,
				() -> BotConfig.builder().set(EnumConfigurationKey.AUTO_MERGE_BOOL, "yes").build());
		assertThrows(InvalidConfigException.class,
				() -> BotConfig.builder().set(EnumConfigurationKey.MAX_ERRORS_INT, "three").build());
		assertThrows(InvalidConfigException.class,
				() -> BotConfig.builder().set(EnumConfigurationKey.MANA_UPPER_HSV_STRING, "1,2").build());
	}

	@Test
	@DisplayName("toBuilder keeps untouched options")
	void toBuilderKeepsValues() {
		BotConfig original = BotConfig.builder().maxErrors(7).preferredDevice("emulator-5554").build();
		BotConfig changed = original.toBuilder().autoMerge(false).build();

		assertEquals(7, changed.getMaxErrors());
		assertEquals("emulator-5554", changed.getPreferredDevice().orElse(null));
		assertFalse(changed.isAutoMerge());
		assertTrue(original.isAutoMerge());
	}

	@Test
	@DisplayName("Grid geometry can be replaced in one call")
	void gridConfig() {
		BotConfig config = BotConfig.builder().gridConfig(new DTOGridConfig(5, 3, 60, 70, 10, 20, 4)).build();

		assertEquals(5, config.getGridConfig().getRows());
		assertEquals(3, config.getGridConfig().getCols());
		assertEquals(70, config.getGridConfig().getCellHeight());
		assertEquals(4, config.getGridConfig().getSpacing());
	}

	@Test
	@DisplayName("toMap exposes typed values by option name")
	void toMap() {
		Map<String, Object> map = BotConfig.builder().maxErrors(5).build().toMap();

		assertEquals(Integer.valueOf(5), map.get("maxErrors"));
		assertEquals(Boolean.TRUE, map.get("autoMerge"));
		assertEquals(Double.valueOf(2.0), map.get("cycleInterval"));
		assertEquals("com.my.defense", map.get("gamePackage"));
		assertEquals(EnumConfigurationKey.values().length, map.size());
	}

	@Test
	@DisplayName("Configurations with the same values are equal")
	void equality() {
		assertEquals(BotConfig.defaults(), BotConfig.builder().build());
		assertEquals(BotConfig.defaults().hashCode(), BotConfig.builder().build().hashCode());
	}
}
