package cl.camodev.rrbot.serv.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import cl.camodev.rrbot.console.enumerable.EnumTpMessageSeverity;
import cl.camodev.rrbot.ot.DTOLogEntry;

class ServLogsTest {

	@Test
	@DisplayName("Oldest entries are discarded past the capacity")
	void boundedCapacity() {
		ServLogs logs = new ServLogs(3);
		for (int i = 0; i < 5; i++) {
			logs.appendLog(EnumTpMessageSeverity.INFO, "test", null, "message " + i);
		}

		List<DTOLogEntry> entries = logs.getLogs(10);
		assertEquals(3, entries.size());
		assertEquals("message 2", entries.get(0).getMessage());
		assertEquals("message 4", entries.get(2).getMessage());
		assertEquals("-", entries.get(0).getDevice());
	}

	@Test
	@DisplayName("A limit returns the newest entries")
	void limit() {
		ServLogs logs = new ServLogs();
		for (int i = 0; i < 10; i++) {
			logs.appendLog(EnumTpMessageSeverity.WARNING, "test", "emulator-5554", "message " + i);
		}

		List<DTOLogEntry> entries = logs.getLogs(2);
		assertEquals(2, entries.size());
		assertEquals("message 8", entries.get(0).getMessage());
		assertEquals("message 9", entries.get(1).getMessage());
		assertTrue(logs.getLogs(0).isEmpty());
		assertTrue(logs.getLogs(-4).isEmpty());
	}

	@Test
	@DisplayName("Clearing empties the buffer")
	void clear() {
		ServLogs logs = new ServLogs();
		logs.appendLog(EnumTpMessageSeverity.ERROR, "test", "d", "boom");

		logs.clear();

		assertEquals(0, logs.size());
	}

	@Test
	@DisplayName("Capacity must be positive")
	void invalidCapacity() {
		assertThrows(IllegalArgumentException.class, () -> new ServLogs(0));
	}
}
