package uitrace.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.model.ActionOutcome;

import java.io.IOException;

/**
 * {@link DeviceBridge} that drives the device through the {@code adb} command
 * line: {@code uiautomator dump}, {@code screencap}, {@code dumpsys activity}
 * and {@code input}.
 */
public class ShellBackend implements DeviceBridge {

    private static final Logger log = LoggerFactory.getLogger(ShellBackend.class);

    static final String REMOTE_DUMP = "/sdcard/window_dump.xml";
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};

    private final AdbInvoker adb;

    public ShellBackend(AdbInvoker adb) {
        this.adb = adb;
    }

    // ── Connection ────────────────────────────────────────────────────────

    @Override
    public void ensureConnected() {
        CommandResult res;
        try {
            res = adb.runGlobal("devices");
        } catch (IOException e) {
            throw new DeviceConnectionException("adb check error: " + e.getMessage(), e);
        }
        if (!res.isSuccess()) {
            throw new DeviceConnectionException(res.errorText("adb devices failed"));
        }
        String ready = null;
        for (String raw : res.stdoutText().split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.toLowerCase().startsWith("list of devices")) continue;
            if (!line.endsWith("\tdevice")) continue;
            String serial = line.substring(0, line.indexOf('\t'));
            if (adb.getSerial().isEmpty() || adb.getSerial().equals(serial)) {
                ready = serial;
                break;
            }
        }
        if (ready == null) {
            throw new DeviceConnectionException(
                    "no device ready (check USB, authorization, or 'adb connect')");
        }
        log.debug("adb device ready: {}", ready);
    }

    // ── Capture ───────────────────────────────────────────────────────────

    @Override
    public String dumpHierarchy() throws IOException {
        CommandResult dump = adb.run("shell", "uiautomator", "dump", REMOTE_DUMP);
        if (!dump.isSuccess()) {
            throw new IOException("uiautomator dump failed: " + dump.errorText("exit " + dump.exitCode()));
        }
        CommandResult cat = adb.run("exec-out", "cat", REMOTE_DUMP);
        if (!cat.isSuccess()) {
            throw new IOException("reading " + REMOTE_DUMP + " failed: " + cat.errorText("exit " + cat.exitCode()));
        }
        String xml = cat.stdoutText();
        if (!xml.contains("<hierarchy")) {
            throw new IOException("uiautomator dump returned no hierarchy");
        }
        return xml;
    }

    @Override
    public byte[] screenshot() throws IOException {
        CommandResult res = adb.run("exec-out", "screencap", "-p");
        if (!res.isSuccess()) {
            throw new IOException("screencap failed: " + res.errorText("exit " + res.exitCode()));
        }
        byte[] png = res.stdout();
        if (!isPng(png)) {
            throw new IOException("screencap returned no PNG data");
        }
        return png;
    }

    @Override
    public String foregroundActivity() throws IOException {
        CommandResult res = adb.run("shell", "dumpsys", "activity");
        if (!res.isSuccess()) {
            throw new IOException("dumpsys activity failed: " + res.errorText("exit " + res.exitCode()));
        }
        return ActivityParser.parse(res.stdoutText());
    }

    // ── Actions ───────────────────────────────────────────────────────────

    @Override
    public ActionOutcome tap(int x, int y) {
        return input("adb input tap failed", "tap", str(x), str(y));
    }

    /** A swipe that starts and ends on the same point. */
    @Override
    public ActionOutcome longPress(int x, int y, int durationMs) {
        return input("adb long press failed", "swipe", str(x), str(y), str(x), str(y), str(durationMs));
    }

    @Override
    public ActionOutcome swipe(int x1, int y1, int x2, int y2, int durationMs) {
        return input("adb swipe failed", "swipe", str(x1), str(y1), str(x2), str(y2), str(durationMs));
    }

    @Override
    public ActionOutcome inputText(String text) {
        return input("adb input text failed", "text", escapeInputText(text));
    }

    @Override
    public ActionOutcome back() {
        return input("adb back failed", "keyevent", "4");
    }

    @Override
    public String name() { return "adb"; }

    /** {@code input text} treats {@code %s} as a space. */
    static String escapeInputText(String text) {
        return text == null ? "" : text.replace(" ", "%s");
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private ActionOutcome input(String fallbackError, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "shell";
        full[1] = "input";
        System.arraycopy(args, 0, full, 2, args.length);
        try {
            CommandResult res = adb.run(full);
            if (!res.isSuccess()) {
                String err = res.stderr() == null || res.stderr().isBlank() ? fallbackError : res.stderr().trim();
                log.warn("input {} failed: {}", args[0], err);
                return ActionOutcome.failure(err);
            }
            return ActionOutcome.success();
        } catch (IOException e) {
            log.warn("input {} failed: {}", args[0], e.getMessage());
            return ActionOutcome.failure(e.getMessage());
        }
    }

    private static boolean isPng(byte[] data) {
        if (data == null || data.length < PNG_MAGIC.length) return false;
        for (int i = 0; i < PNG_MAGIC.length; i++) {
            if (data[i] != PNG_MAGIC[i]) return false;
        }
        return true;
    }

    private static String str(int v) {
        return String.valueOf(v);
    }

    @Override
    public String toString() {
        return "ShellBackend{serial='" + adb.getSerial() + "'}";
    }
}
