package cl.camodev.rrbot.ot;

import java.nio.charset.StandardCharsets;

/**
 * Outcome of one bridge command. Stdout is kept as bytes because screen captures travel through it.
 */
public class DTOBridgeResult {
    private final int exitCode;
    private final byte[] stdout;
    private final String stderr;

    public DTOBridgeResult(int exitCode, byte[] stdout, String stderr) {
        this.exitCode = exitCode;
        this.stdout = stdout == null ? new byte[0] : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public static DTOBridgeResult ofText(int exitCode, String stdout, String stderr) {
        return new DTOBridgeResult(exitCode, stdout == null ? null : stdout.getBytes(StandardCharsets.UTF_8), stderr);
    }

    public int getExitCode() {
        return exitCode;
    }

    public byte[] getStdout() {
        return stdout;
    }

    public String getStdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String getStderr() {
        return stderr;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Error text to show to the operator, preferring stderr and falling back to stdout.
     */
    public String errorText() {
        if (!stderr.isBlank()) {
            return stderr.trim();
        }
        return getStdoutText().trim();
    }
}
