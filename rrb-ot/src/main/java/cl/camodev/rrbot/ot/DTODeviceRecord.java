package cl.camodev.rrbot.ot;

import java.time.LocalDateTime;

import cl.camodev.rrbot.console.enumerable.EnumConnectionKind;
import cl.camodev.rrbot.console.enumerable.EnumDeviceStatus;

/**
 * Snapshot of one enumerated device. Instances are immutable; the bridge replaces them on every scan.
 */
public class DTODeviceRecord {
    public static final String UNKNOWN = "unknown";

    private final String id;
    private final String displayName;
    private final String model;
    private final String osVersion;
    private final String architecture;
    private final EnumDeviceStatus status;
    private final EnumConnectionKind connectionKind;
    private final LocalDateTime lastSeen;
    private final Integer batteryLevel;
    private final String totalMemory;
    private final String availableMemory;
    private final String screenResolution;
    private final String screenDensity;

    private DTODeviceRecord(Builder builder) {
        this.id = builder.id;
        this.displayName = builder.displayName;
        this.model = builder.model;
        this.osVersion = builder.osVersion;
        this.architecture = builder.architecture;
        this.status = builder.status;
        this.connectionKind = builder.connectionKind;
        this.lastSeen = builder.lastSeen;
        this.batteryLevel = builder.batteryLevel;
        this.totalMemory = builder.totalMemory;
        this.availableMemory = builder.availableMemory;
        this.screenResolution = builder.screenResolution;
        this.screenDensity = builder.screenDensity;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public String getModel() { return model; }
    public String getOsVersion() { return osVersion; }
    public String getArchitecture() { return architecture; }
    public EnumDeviceStatus getStatus() { return status; }
    public EnumConnectionKind getConnectionKind() { return connectionKind; }
    public LocalDateTime getLastSeen() { return lastSeen; }
    public Integer getBatteryLevel() { return batteryLevel; }
    public String getTotalMemory() { return totalMemory; }
    public String getAvailableMemory() { return availableMemory; }
    public String getScreenResolution() { return screenResolution; }
    public String getScreenDensity() { return screenDensity; }

    public boolean isConnected() {
        return status == EnumDeviceStatus.CONNECTED;
    }

    @Override
    public String toString() {
        return id + " [" + status + ", " + connectionKind + ", " + model + "]";
    }

    public static class Builder {
        private final String id;
        private String displayName;
        private String model = UNKNOWN;
        private String osVersion = UNKNOWN;
        private String architecture = UNKNOWN;
        private EnumDeviceStatus status = EnumDeviceStatus.DISCONNECTED;
        private EnumConnectionKind connectionKind;
        private LocalDateTime lastSeen = LocalDateTime.now();
        private Integer batteryLevel;
        private String totalMemory = UNKNOWN;
        private String availableMemory = UNKNOWN;
        private String screenResolution = UNKNOWN;
        private String screenDensity = UNKNOWN;

        private Builder(String id) {
            this.id = id;
            this.displayName = id;
            this.connectionKind = EnumConnectionKind.fromDeviceId(id);
        }

        public Builder displayName(String displayName) { this.displayName = displayName; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder osVersion(String osVersion) { this.osVersion = osVersion; return this; }
        public Builder architecture(String architecture) { this.architecture = architecture; return this; }
        public Builder status(EnumDeviceStatus status) { this.status = status; return this; }
        public Builder connectionKind(EnumConnectionKind connectionKind) { this.connectionKind = connectionKind; return this; }
        public Builder lastSeen(LocalDateTime lastSeen) { this.lastSeen = lastSeen; return this; }
        public Builder batteryLevel(Integer batteryLevel) { this.batteryLevel = batteryLevel; return this; }
        public Builder totalMemory(String totalMemory) { this.totalMemory = totalMemory; return this; }
        public Builder availableMemory(String availableMemory) { this.availableMemory = availableMemory; return this; }
        public Builder screenResolution(String screenResolution) { this.screenResolution = screenResolution; return this; }
        public Builder screenDensity(String screenDensity) { this.screenDensity = screenDensity; return this; }

        public DTODeviceRecord build() {
            return new DTODeviceRecord(this);
        }
    }
}
