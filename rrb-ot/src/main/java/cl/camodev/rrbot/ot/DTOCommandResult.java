package cl.camodev.rrbot.ot;

import cl.camodev.rrbot.console.enumerable.EnumResultCode;

/**
 * Structured answer returned to every caller of a bot operation. Failures never carry a stack trace.
 */
public class DTOCommandResult {
    private final boolean success;
    private final EnumResultCode code;
    private final String message;
    private final Object data;

    private DTOCommandResult(boolean success, EnumResultCode code, String message, Object data) {
        this.success = success;
        this.code = code;
        this.message = message;
        this.data = data;
    }

    public static DTOCommandResult ok(String message) {
        return new DTOCommandResult(true, EnumResultCode.OK, message, null);
    }

    public static DTOCommandResult ok(String message, Object data) {
        return new DTOCommandResult(true, EnumResultCode.OK, message, data);
    }

    public static DTOCommandResult failure(EnumResultCode code, String message) {
        return new DTOCommandResult(false, code, message, null);
    }

    public boolean isSuccess() { return success; }
    public EnumResultCode getCode() { return code; }
    public String getMessage() { return message; }
    public Object getData() { return data; }

    @Override
    public String toString() {
        return (success ? "OK" : code.name()) + ": " + message;
    }
}
