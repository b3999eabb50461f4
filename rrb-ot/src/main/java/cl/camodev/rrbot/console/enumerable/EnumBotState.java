package cl.camodev.rrbot.console.enumerable;

public enum EnumBotState {
	STOPPED, STARTING, RUNNING, PAUSED, STOPPING, ERROR;

	public boolean isActive() {
		return this == RUNNING || this == PAUSED;
	}

	public String wireName() {
		return name().toLowerCase();
	}
}
