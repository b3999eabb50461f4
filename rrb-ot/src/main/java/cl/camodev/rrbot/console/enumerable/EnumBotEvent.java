package cl.camodev.rrbot.console.enumerable;

public enum EnumBotEvent {
	STATUS_CHANGED("status_changed"),
	BOT_STARTED("bot_started"),
	BOT_STOPPED("bot_stopped"),
	BOT_PAUSED("bot_paused"),
	BOT_RESUMED("bot_resumed"),
	ERROR_OCCURRED("error_occurred"),
	DEVICE_CONNECTED("device_connected"),
	DEVICE_DISCONNECTED("device_disconnected");

	private final String wireName;

	EnumBotEvent(String wireName) {
		this.wireName = wireName;
	}

	public String getWireName() {
		return wireName;
	}
}
