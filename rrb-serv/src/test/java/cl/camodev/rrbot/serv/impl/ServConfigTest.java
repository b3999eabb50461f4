package cl.camodev.rrbot.serv.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.ex.InvalidConfigException;
import cl.camodev.rrbot.serv.config.BotConfig;

class ServConfigTest {

	@Test
	@DisplayName("An empty update leaves the configuration untouched")
	void emptyUpdate() {
		ServConfig servConfig = new ServConfig(BotConfig.defaults());
		BotConfig before = servConfig.getConfig();

		assertSame(before, servConfig.update(Collections.emptyMap()));
		assertSame(before, servConfig.update(null));
	}

	@Test
	@DisplayName("Only the named options change")
	void partialUpdate() {
		ServConfig servConfig = new ServConfig(BotConfig.defaults());
		Map<String, Object> delta = new HashMap<>();
		delta.put("autoMerge", false);
		delta.put("cycleInterval", 1.0);

		BotConfig after = servConfig.update(delta);

		assertFalse(after.isAutoMerge());
		assertEquals(1.0, after.getCycleIntervalSeconds(), 1e-9);
		assertTrue(after.isAutoUpgrade());
		assertEquals(3, after.getMaxErrors());
		assertSame(after, servConfig.getConfig());
	}

	@Test
	@DisplayName("Nested grid settings are merged into the current grid")
	void nestedGrid() {
		ServConfig servConfig = new ServConfig(BotConfig.defaults());
		Map<String, Object> grid = new HashMap<>();
		grid.put("rows", 5.0);
		Map<String, Object> delta = new HashMap<>();
		delta.put("gridConfig", grid);
		delta.put("manaConfig", Collections.singletonMap("lowerHsv", Arrays.asList(90.0, 100.0, 150.0)));

		BotConfig after = servConfig.update(delta);

		assertEquals(5, after.getGridConfig().getRows());
		assertEquals(4, after.getGridConfig().getCols());
		assertEquals(90, after.getManaConfig().getLowerHsv()[0]);
	}

	@Test
	@DisplayName("An invalid update is rejected and the previous configuration kept")
	void invalidUpdate() {
		ServConfig servConfig = new ServConfig(BotConfig.defaults());
		BotConfig before = servConfig.getConfig();

		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("maxErrors", 0)));
		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("maxErrors", 2.5)));
		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("noSuchOption", true)));

		assertSame(before, servConfig.getConfig());
	}

	@Test
	@DisplayName("A null preferred device clears it")
	void clearPreferredDevice() {
		ServConfig servConfig = new ServConfig(BotConfig.builder().preferredDevice("emulator-5554").build());

		BotConfig after = servConfig.update(Collections.singletonMap("preferredDevice", null));

		assertTrue(after.getPreferredDevice().isEmpty());
	}

	@Test
	@DisplayName("Options read at startup cannot change at runtime")
	void startupOptionsRejected() {
		ServConfig servConfig = new ServConfig(BotConfig.defaults());
		BotConfig before = servConfig.getConfig();

		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("adbPath", "/opt/adb")));
		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("scanConcurrency", 4)));
		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("templateDirectory", "templates")));
		assertThrows(InvalidConfigException.class,
				() -> servConfig.update(Collections.singletonMap("RANK_MODEL_PATH_STRING", "rank.json")));

		assertSame(before, servConfig.getConfig());
	}

	@Test
	@DisplayName("Resending the current startup options is accepted")
	void startupOptionsUnchanged() {
		ServConfig servConfig = new ServConfig(BotConfig.defaults());
		Map<String, Object> delta = new HashMap<>();
		delta.put("scanConcurrency", 10);
		delta.put("referenceDirectory", "");
		delta.put("autoMerge", false);

		BotConfig after = servConfig.update(delta);

		assertFalse(after.isAutoMerge());
		assertEquals(10, after.getScanConcurrency());
	}
}
