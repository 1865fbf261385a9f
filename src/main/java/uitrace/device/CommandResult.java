package uitrace.device;

import java.nio.charset.StandardCharsets;

/** Exit code and captured output of one external command. */
public record CommandResult(int exitCode, byte[] stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String stdoutText() {
        return stdout == null ? "" : new String(stdout, StandardCharsets.UTF_8);
    }

    /** Best available error text: stderr, else stdout, else {@code fallback}. */
    public String errorText(String fallback) {
        if (stderr != null && !stderr.isBlank()) return stderr.trim();
        String out = stdoutText();
        if (!out.isBlank()) return out.trim();
        return fallback;
    }
}
