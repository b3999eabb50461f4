package cl.camodev.rrbot.serv.impl;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import cl.camodev.rrbot.console.enumerable.EnumTpMessageSeverity;
import cl.camodev.rrbot.ot.DTOLogEntry;

/**
 * Bounded in-memory log shown to the operator. Oldest entries are discarded once the capacity is reached.
 */
public class ServLogs {
	public static final int DEFAULT_CAPACITY = 1000;

	private final int capacity;
	private final Deque<DTOLogEntry> entries = new ArrayDeque<>();

	public ServLogs() {
		this(DEFAULT_CAPACITY);
	}

	public ServLogs(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be positive");
		}
		this.capacity = capacity;
	}

	public synchronized void appendLog(EnumTpMessageSeverity severity, String source, String device, String message) {
		entries.addLast(new DTOLogEntry(LocalDateTime.now(), severity, source, device == null ? "-" : device, message));
		while (entries.size() > capacity) {
			entries.removeFirst();
		}
	}

	/**
	 * @param limit maximum number of entries to return
	 * @return the newest {@code limit} entries, oldest first
	 */
	public synchronized List<DTOLogEntry> getLogs(int limit) {
		int count = Math.max(0, Math.min(limit, entries.size()));
		List<DTOLogEntry> all = new ArrayList<>(entries);
		return new ArrayList<>(all.subList(all.size() - count, all.size()));
	}

	public synchronized int size() {
		return entries.size();
	}

	public synchronized void clear() {
		entries.clear();
	}
}
