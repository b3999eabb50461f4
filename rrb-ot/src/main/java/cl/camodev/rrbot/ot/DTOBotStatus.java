package cl.camodev.rrbot.ot;

import java.time.LocalDateTime;

import cl.camodev.rrbot.console.enumerable.EnumBotState;

public class DTOBotStatus {
    private final EnumBotState state;
    private final LocalDateTime startedAt;
    private final int errorCount;
    private final String lastAction;
    private final String connectedDeviceId;
    private final String errorMessage;
    private final DTOBotStats stats;
    private final DTOManaReading lastMana;

    public DTOBotStatus(EnumBotState state, LocalDateTime startedAt, int errorCount, String lastAction,
            String connectedDeviceId, String errorMessage, DTOBotStats stats, DTOManaReading lastMana) {
        this.state = state;
        this.startedAt = startedAt;
        this.errorCount = errorCount;
        this.lastAction = lastAction;
        this.connectedDeviceId = connectedDeviceId;
        this.errorMessage = errorMessage;
        this.stats = stats;
        this.lastMana = lastMana;
    }

    public EnumBotState getState() { return state; }
    public LocalDateTime getStartedAt() { return startedAt; }
    public int getErrorCount() { return errorCount; }
    public String getLastAction() { return lastAction; }
    public String getConnectedDeviceId() { return connectedDeviceId; }
    public String getErrorMessage() { return errorMessage; }
    public DTOBotStats getStats() { return stats; }
    public DTOManaReading getLastMana() { return lastMana; }
}
