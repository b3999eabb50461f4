package cl.camodev.rrbot.ot;

import java.time.LocalDateTime;

import cl.camodev.rrbot.console.enumerable.EnumTpMessageSeverity;

public class DTOLogEntry {
    private final LocalDateTime timestamp;
    private final EnumTpMessageSeverity severity;
    private final String source;
    private final String device;
    private final String message;

    public DTOLogEntry(LocalDateTime timestamp, EnumTpMessageSeverity severity, String source, String device,
            String message) {
        this.timestamp = timestamp;
        this.severity = severity;
        this.source = source;
        this.device = device;
        this.message = message;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public EnumTpMessageSeverity getSeverity() { return severity; }
    public String getSource() { return source; }
    public String getDevice() { return device; }
    public String getMessage() { return message; }
}
