package uitrace.device;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds and runs {@code adb [-s serial] ...} command lines for one device.
 */
public class AdbInvoker {

    private final String executable;
    private final String serial;
    private final Duration timeout;
    private final CommandRunner runner;

    public AdbInvoker(String executable, String serial, Duration timeout, CommandRunner runner) {
        this.executable = executable;
        this.serial     = serial == null ? "" : serial.trim();
        this.timeout    = timeout;
        this.runner     = runner;
    }

    /** Full command line for the given adb arguments. */
    public List<String> command(String... args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        if (!serial.isEmpty()) {
            cmd.add("-s");
            cmd.add(serial);
        }
        cmd.addAll(Arrays.asList(args));
        return cmd;
    }

    public CommandResult run(String... args) throws IOException {
        return runner.run(command(args), timeout);
    }

    /** Runs without a device selector (for {@code adb devices}). */
    public CommandResult runGlobal(String... args) throws IOException {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.addAll(Arrays.asList(args));
        return runner.run(cmd, timeout);
    }

    public String getSerial() { return serial; }
}
