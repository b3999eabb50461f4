package cl.camodev.rrbot.ot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import cl.camodev.rrbot.console.enumerable.EnumBotEvent;

/**
 * Timestamped tagged payload pushed to event subscribers.
 */
public class DTOBotEvent {
    private final EnumBotEvent type;
    private final Instant timestamp;
    private final Map<String, Object> data;

    public DTOBotEvent(EnumBotEvent type, Map<String, Object> data) {
        this(type, Instant.now(), data);
    }

    public DTOBotEvent(EnumBotEvent type, Instant timestamp, Map<String, Object> data) {
        this.type = type;
        this.timestamp = timestamp;
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public EnumBotEvent getType() { return type; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, Object> getData() { return data; }

    @Override
    public String toString() {
        return type.getWireName() + "@" + timestamp + " " + data;
    }
}
