package uitrace.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.device.AdbInvoker;
import uitrace.device.CommandResult;

import java.io.IOException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the touchscreen input device from {@code getevent -pl} output.
 *
 * <p>Each {@code add device N: /dev/input/eventX} block is scored: +2 for
 * {@code BTN_TOUCH}, +2 when both an X and a Y axis are listed, +1 when the
 * device name looks like a touch panel. The best positive score wins; ties go
 * to the first block.
 */
public final class TouchDeviceProbe {

    private static final Logger log = LoggerFactory.getLogger(TouchDeviceProbe.class);

    private static final Pattern BLOCK_SPLIT = Pattern.compile("\\n(?=add device \\d+: )");
    private static final Pattern DEVICE      = Pattern.compile("add device \\d+:\\s+(/dev/input/event\\d+)");
    private static final Pattern NAME        = Pattern.compile("name:\\s+\"(.+?)\"");
    private static final Pattern BTN_TOUCH   = Pattern.compile("BTN_TOUCH", Pattern.CASE_INSENSITIVE);
    private static final Pattern AXIS_X      = Pattern.compile("ABS_MT_POSITION_X|ABS_X", Pattern.CASE_INSENSITIVE);
    private static final Pattern AXIS_Y      = Pattern.compile("ABS_MT_POSITION_Y|ABS_Y", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOUCH_NAME  = Pattern.compile("touch|ts|finger", Pattern.CASE_INSENSITIVE);

    private TouchDeviceProbe() {}

    /**
     * Runs {@code getevent -pl} on the device and selects the touchscreen.
     *
     * @return the device path, or empty to listen on all devices
     */
    public static Optional<String> detect(AdbInvoker adb) {
        try {
            CommandResult res = adb.run("shell", "getevent", "-pl");
            if (!res.isSuccess()) {
                log.warn("getevent -pl failed: {}", res.errorText("exit " + res.exitCode()));
                return Optional.empty();
            }
            return select(res.stdoutText());
        } catch (IOException e) {
            log.warn("getevent -pl failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Scores the blocks of a {@code getevent -pl} listing. */
    public static Optional<String> select(String listing) {
        if (listing == null || listing.isBlank()) return Optional.empty();
        String best = null;
        int bestScore = 0;
        for (String block : BLOCK_SPLIT.split(listing.replace("\r\n", "\n"))) {
            Matcher dev = DEVICE.matcher(block);
            if (!dev.find()) continue;
            int score = score(block);
            log.debug("touch probe: {} scored {}", dev.group(1), score);
            if (score > bestScore) {
                bestScore = score;
                best = dev.group(1);
            }
        }
        return Optional.ofNullable(best);
    }

    static int score(String block) {
        Matcher name = NAME.matcher(block);
        String deviceName = name.find() ? name.group(1) : "";
        int score = 0;
        if (BTN_TOUCH.matcher(block).find()) score += 2;
        if (AXIS_X.matcher(block).find() && AXIS_Y.matcher(block).find()) score += 2;
        if (TOUCH_NAME.matcher(deviceName).find()) score += 1;
        return score;
    }
}
