package cl.camodev.rrbot.console.enumerable;

public enum EnumTpMessageSeverity {
	DEBUG, INFO, WARNING, ERROR
}
